package quest.gekko.dcr.service.scheduling;

import quest.gekko.dcr.service.core.AggregationSummary;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Handle for a submitted aggregation run. Immutable; the registry swaps in a new instance on each transition.
 */
public record AggregationJob(String id, LocalDate statDate, Status status, Instant submittedAt, Instant finishedAt,
                             AggregationSummary summary, String error) {

    public enum Status { QUEUED, RUNNING, SUCCEEDED, FAILED }

    static AggregationJob queued(String id, LocalDate date, Instant at) {
        return new AggregationJob(id, date, Status.QUEUED, at, null, null, null);
    }

    AggregationJob running() {
        return new AggregationJob(id, statDate, Status.RUNNING, submittedAt, null, null, null);
    }

    AggregationJob succeeded(AggregationSummary result, Instant at) {
        return new AggregationJob(id, statDate, Status.SUCCEEDED, submittedAt, at, result, null);
    }

    AggregationJob failed(String message, Instant at) {
        return new AggregationJob(id, statDate, Status.FAILED, submittedAt, at, null, message);
    }
}
