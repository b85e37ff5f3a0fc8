package quest.gekko.dcr.service.core;

/**
 * Optional sink a caller can attach to an aggregation run, e.g. to record progress on a job row.
 * Every method is a no-op by default.
 */
public interface AggregationLogger {
    AggregationLogger NONE = new AggregationLogger() {};

    default void info(String message) {}

    default void warn(String message) {}

    default void error(String message, Throwable cause) {}
}
