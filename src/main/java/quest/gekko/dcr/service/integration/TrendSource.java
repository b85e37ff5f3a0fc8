package quest.gekko.dcr.service.integration;

import quest.gekko.dcr.domain.EntityType;

import java.time.LocalDate;
import java.util.Map;

public interface TrendSource {

    /** Trend windows for every entity of the type, keyed by display name. */
    Map<String, TrendSnapshot> fetchSnapshots(EntityType type, LocalDate date);
}
