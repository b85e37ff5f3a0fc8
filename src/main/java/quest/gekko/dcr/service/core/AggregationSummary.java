package quest.gekko.dcr.service.core;

import quest.gekko.dcr.domain.EntityType;

import java.time.LocalDate;
import java.util.Map;

public record AggregationSummary(LocalDate statDate, int totalOrders, Map<EntityType, TypeSummary> perEntityType) {

    public record TypeSummary(int processed, int skipped) {
        public static final TypeSummary EMPTY = new TypeSummary(0, 0);
    }

    public TypeSummary of(EntityType type) {
        return perEntityType.getOrDefault(type, TypeSummary.EMPTY);
    }
}
