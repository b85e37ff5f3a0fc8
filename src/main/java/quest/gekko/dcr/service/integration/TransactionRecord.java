package quest.gekko.dcr.service.integration;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One order line from the raw order feed. Any of the names may be blank when the feed lacks them.
 */
public record TransactionRecord(String manufacturerName,
                                String strainName,
                                String productName,
                                String pharmacyName,
                                long quantity,
                                BigDecimal amount,
                                LocalDateTime orderedAt) {
}
