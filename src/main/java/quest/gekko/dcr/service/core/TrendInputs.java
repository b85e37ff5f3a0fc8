package quest.gekko.dcr.service.core;

import java.util.List;

/**
 * Historical context for scoring one entity on one day. Zero means "unknown" for every numeric field.
 *
 * @param days1              volume over the most recent day
 * @param days7              cumulative volume over the trailing 7 days
 * @param days14             cumulative volume over the trailing 14 days, 0 if not published
 * @param previousRank       rank on the previous day, 0 if unranked
 * @param streakDays         consecutive top-10 days including today
 * @param marketSharePercent share of the category's 7-day volume
 * @param dailyVolumes       estimated per-day volumes for the trailing week
 */
public record TrendInputs(long days1, long days7, long days14,
                          int previousRank, int streakDays, double marketSharePercent,
                          List<Double> dailyVolumes) {

    public static final TrendInputs NONE = new TrendInputs(0, 0, 0, 0, 0, 0d, List.of());

    public TrendInputs {
        dailyVolumes = dailyVolumes == null ? List.of() : List.copyOf(dailyVolumes);
    }
}
