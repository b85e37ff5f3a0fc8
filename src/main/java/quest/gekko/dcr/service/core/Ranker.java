package quest.gekko.dcr.service.core;

import quest.gekko.dcr.domain.EntityType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

public final class Ranker {

    private Ranker() {
    }

    /**
     * Sorts descending by the type's primary metric and numbers the result 1..N. The sort is stable, so equal
     * metrics keep the aggregation order. Ranks are fixed here; later resolution misses never renumber them.
     */
    public static List<RankedEntity> rank(EntityType type, Map<String, EntityCounters> aggregated) {
        record Entry(String name, EntityCounters counters) {}

        List<Entry> sorted = new ArrayList<>();
        aggregated.forEach((name, counters) -> sorted.add(new Entry(name, counters)));
        sorted.sort(Comparator.comparingLong((Entry e) -> type.primaryMetric(e.counters())).reversed());

        List<RankedEntity> ranked = new ArrayList<>(sorted.size());
        int rank = 1;
        for (Entry e : sorted) {
            ranked.add(new RankedEntity(rank++, e.name(), e.counters()));
        }
        return List.copyOf(ranked);
    }
}
