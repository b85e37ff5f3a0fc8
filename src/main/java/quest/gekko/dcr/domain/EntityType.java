package quest.gekko.dcr.domain;

import quest.gekko.dcr.service.core.EntityCounters;

/**
 * Ranked marketplace entity kinds. Every per-type rule (primary ranking metric, point weights,
 * rank bonus tiers) hangs off this enum so callers dispatch with an exhaustive switch.
 */
public enum EntityType {
    MANUFACTURER,
    STRAIN,
    PRODUCT,
    PHARMACY,
    BRAND;

    /** Multiplier applied to {@code floor(volume / 10)}. */
    public int volumeMultiplier() {
        return switch (this) {
            case MANUFACTURER, PHARMACY, BRAND -> 1;
            case STRAIN -> 2;
            case PRODUCT -> 3;
        };
    }

    /** Points per order; always five times the volume multiplier. */
    public int orderWeight() {
        return volumeMultiplier() * 5;
    }

    /** Whether {@code floor(revenueCents / 1000)} counts towards base points. */
    public boolean scoresRevenue() {
        return switch (this) {
            case MANUFACTURER, PHARMACY -> true;
            case STRAIN, PRODUCT, BRAND -> false;
        };
    }

    /** The value entities of this type are ranked by, descending. */
    public long primaryMetric(EntityCounters counters) {
        return switch (this) {
            case MANUFACTURER, STRAIN, PRODUCT -> counters.volume();
            case PHARMACY -> counters.revenueCents();
            case BRAND -> counters.totalRatings();
        };
    }

    public int rankBonus(int rank) {
        if (rank <= 0 || rank > 10) return 0;
        return switch (this) {
            case MANUFACTURER, PRODUCT, BRAND -> tier(rank, 50, 30, 20, 15, 10);
            case STRAIN, PHARMACY -> tier(rank, 40, 25, 15, 10, 5);
        };
    }

    private static int tier(int rank, int first, int second, int third, int fourToFive, int sixToTen) {
        if (rank == 1) return first;
        if (rank == 2) return second;
        if (rank == 3) return third;
        if (rank <= 5) return fourToFive;
        return sixToTen;
    }
}
