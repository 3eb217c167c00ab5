package rastr.domain.halftone;

import java.time.Duration;

/**
 * Cooperative cancellation, polled once per screen grid row
 * @since 19/10/2026
 */
@FunctionalInterface
public interface ICancellationHook {

    ICancellationHook NONE = () -> false;

    boolean isCancelled();

    /**
     * Hook that fires once {@code timeout} has elapsed from now
     */
    static ICancellationHook deadline(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be zero or positive");
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        return () -> System.nanoTime() - deadline >= 0;
    }
}
