package de.mirkosertic.imagebatch.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Status surface for headless use: every text change is written to the log.
 */
public class LoggingStatusSurface implements StatusSurface {

    private static final Logger logger = LoggerFactory.getLogger(LoggingStatusSurface.class);

    @Override
    public StatusIndicator createIndicator() {
        return new LoggingIndicator();
    }

    private static final class LoggingIndicator implements StatusIndicator {

        private final AtomicBoolean removed = new AtomicBoolean(false);

        @Override
        public void setText(final String text) {
            if (!removed.get()) {
                logger.info("{}", text);
            }
        }

        @Override
        public void remove() {
            if (removed.compareAndSet(false, true)) {
                logger.debug("Status indicator removed");
            }
        }
    }
}
