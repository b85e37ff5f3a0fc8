package quest.gekko.dcr.service.integration;

import java.time.LocalDate;
import java.util.List;

/** Raw order feed. */
public interface TransactionRecordSource {

    /** Orders placed on {@code date}, filtered at the source. */
    List<TransactionRecord> fetchForDate(LocalDate date);

    /** Every order the source can return; callers filter client-side. */
    List<TransactionRecord> fetchAll();
}
