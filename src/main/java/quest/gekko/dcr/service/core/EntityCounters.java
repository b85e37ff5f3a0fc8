package quest.gekko.dcr.service.core;

/**
 * Per-entity daily counters. Order-based types fill volume/orders/revenue; brands fill the rating fields.
 */
public record EntityCounters(long volume, int orderCount, long revenueCents, int totalRatings, double bayesianAverage) {

    public static EntityCounters ofOrders(long volume, int orderCount, long revenueCents) {
        return new EntityCounters(volume, orderCount, revenueCents, 0, 0d);
    }

    public static EntityCounters ofRatings(int totalRatings, double bayesianAverage) {
        return new EntityCounters(0, 0, 0, totalRatings, bayesianAverage);
    }
}
