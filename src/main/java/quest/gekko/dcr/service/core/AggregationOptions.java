package quest.gekko.dcr.service.core;

import quest.gekko.dcr.domain.EntityType;

import java.util.EnumSet;
import java.util.Set;

public record AggregationOptions(AggregationLogger logger, Set<EntityType> entityTypes) {

    public static final AggregationOptions DEFAULT = new AggregationOptions(AggregationLogger.NONE, EnumSet.allOf(EntityType.class));

    public AggregationOptions {
        logger = logger == null ? AggregationLogger.NONE : logger;
        entityTypes = entityTypes == null || entityTypes.isEmpty() ? EnumSet.allOf(EntityType.class) : EnumSet.copyOf(entityTypes);
    }

    public static AggregationOptions withLogger(AggregationLogger logger) {
        return new AggregationOptions(logger, null);
    }
}
