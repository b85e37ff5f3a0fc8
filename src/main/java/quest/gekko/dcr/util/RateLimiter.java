package quest.gekko.dcr.util;

import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import quest.gekko.dcr.config.RankerProperties;

import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;

/**
 * Caps concurrent calls to the upstream analytics API and retries transient failures with a fixed backoff.
 */
@Component
public class RateLimiter {
    private final Semaphore sem;
    private final RetryTemplate retry;

    public RateLimiter(final RankerProperties.Metabase props) {
        this.sem = new Semaphore(Math.max(1, props.maxConcurrentCalls()));
        this.retry = RetryTemplate.builder()
                .maxAttempts(Math.max(1, props.maxAttempts()))
                .fixedBackoff(Math.max(1L, props.backoffMillis()))
                .build();
    }

    public <T> T call(Callable<T> c) {
        try {
            sem.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for upstream permit", e);
        }
        try {
            return retry.execute(ctx -> c.call());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        } finally {
            sem.release();
        }
    }
}
