package quest.gekko.dcr.service.core;

public record RankedEntity(int rank, String name, EntityCounters counters) {
}
