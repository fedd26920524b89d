package com.tidewaysystems.observability;

import com.tidewaysystems.eventstore.AppendInterceptor;
import com.tidewaysystems.eventstore.ConcurrencyException;
import com.tidewaysystems.eventstore.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Logs every append outcome. Concurrency conflicts are expected under contention
 * and logged at info; other failures at warn.
 */
public class LoggingAppendInterceptor implements AppendInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(LoggingAppendInterceptor.class);

    @Override
    public void afterAppend(String streamId, long expectedVersion, List<StoredEvent> appended, Throwable error) {
        if (error instanceof ConcurrencyException) {
            logger.info("Append to '{}' rejected: {}", streamId, error.getMessage());
        } else if (error != null) {
            logger.warn("Append to '{}' at expected version {} failed", streamId, expectedVersion, error);
        } else if (!appended.isEmpty()) {
            logger.info("Appended {} to '{}' (versions {}-{})",
                appended.stream().map(StoredEvent::typeName).toList(), streamId,
                appended.get(0).version(), appended.get(appended.size() - 1).version());
        }
    }
}
