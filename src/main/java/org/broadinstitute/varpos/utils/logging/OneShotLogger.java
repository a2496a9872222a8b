package org.broadinstitute.varpos.utils.logging;

import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A logger wrapper which only outputs the first warning provided to it, even when shared between threads.
 */
public final class OneShotLogger {
    @VisibleForTesting
    final Logger logger;
    private final AtomicBoolean hasWarned = new AtomicBoolean(false);

    public OneShotLogger(final Class<?> clazz) {
        this(LogManager.getLogger(clazz));
    }

    public OneShotLogger(final Logger logger) {
        this.logger = logger;
    }

    /**
     * Writes {@code message} as a warning if no warning has been written through this instance yet.
     *
     * @return true if this call emitted the warning
     */
    public boolean warn(final String message) {
        if (hasWarned.compareAndSet(false, true)) {
            logger.warn(message);
            return true;
        }
        return false;
    }

    @VisibleForTesting
    boolean hasWarned() {
        return hasWarned.get();
    }
}
