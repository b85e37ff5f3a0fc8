package quest.gekko.dcr.service.integration;

/**
 * Rolling volume and rank windows for one entity, as published by the trend collection.
 * Volumes are cumulative over the window; a zero means "no data".
 */
public record TrendSnapshot(String entityName,
                            long days1, long days7, long days14, long days30, long days60, long days90,
                            int days1Rank, int days7Rank, int days14Rank, int days30Rank, int days60Rank, int days90Rank) {

    public static TrendSnapshot empty(String entityName) {
        return new TrendSnapshot(entityName, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
