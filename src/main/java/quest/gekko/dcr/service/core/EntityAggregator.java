package quest.gekko.dcr.service.core;

import quest.gekko.dcr.domain.EntityType;
import quest.gekko.dcr.service.integration.BrandRating;
import quest.gekko.dcr.service.integration.TransactionRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups the day's order lines per entity. Result maps keep first-seen order, which the ranker relies on for ties.
 */
public final class EntityAggregator {

    private EntityAggregator() {
    }

    public static Map<String, EntityCounters> aggregate(EntityType type, List<TransactionRecord> records) {
        Map<String, long[]> acc = new LinkedHashMap<>();
        for (TransactionRecord r : records) {
            String name = displayName(type, r);
            if (name == null || name.isBlank()) continue;

            long[] c = acc.computeIfAbsent(name, k -> new long[3]);
            c[0] += r.quantity();
            c[1] += 1;
            c[2] += toCents(r.amount());
        }

        Map<String, EntityCounters> out = new LinkedHashMap<>();
        acc.forEach((name, c) -> out.put(name, EntityCounters.ofOrders(c[0], (int) c[1], c[2])));
        return out;
    }

    public static Map<String, EntityCounters> fromRatings(List<BrandRating> ratings) {
        Map<String, EntityCounters> out = new LinkedHashMap<>();
        for (BrandRating b : ratings) {
            if (b.name() == null || b.name().isBlank() || b.totalRatings() <= 0) continue;
            out.putIfAbsent(b.name(), EntityCounters.ofRatings(b.totalRatings(), b.bayesianAverage()));
        }
        return out;
    }

    /** Round half away from zero. */
    public static long toCents(BigDecimal amount) {
        if (amount == null) return 0L;
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValue();
    }

    static String displayName(EntityType type, TransactionRecord r) {
        return switch (type) {
            case MANUFACTURER -> r.manufacturerName();
            case STRAIN -> r.strainName();
            case PRODUCT -> r.productName();
            case PHARMACY -> r.pharmacyName();
            case BRAND -> throw new IllegalArgumentException("Brands are aggregated from ratings, not orders");
        };
    }
}
