package quest.gekko.dcr.service.core;

/**
 * Neither the date-filtered nor the full order fetch succeeded; the whole run for the date fails.
 */
public class DataSourceUnavailableException extends RuntimeException {
    public DataSourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
