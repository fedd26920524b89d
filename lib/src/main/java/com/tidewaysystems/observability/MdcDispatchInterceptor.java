package com.tidewaysystems.observability;

import com.tidewaysystems.bus.DispatchInterceptor;
import com.tidewaysystems.message.Message;
import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Puts the message id, correlation id and message type into the SLF4J {@link MDC}
 * for the duration of a dispatch, restoring the previous values afterwards so nested
 * dispatches leave the outer context intact.
 *
 * <p>Only effective for handlers running on the publishing thread. For an asynchronous
 * publish the publishing thread's context is restored in {@link #afterHandoff(Message)},
 * and the later {@code afterDispatch} on a pool thread leaves that thread's MDC alone.
 */
public class MdcDispatchInterceptor implements DispatchInterceptor {

    public static final String MESSAGE_ID = "messageId";
    public static final String CORRELATION_ID = "correlationId";
    public static final String MESSAGE_TYPE = "messageType";

    private final ThreadLocal<Deque<String[]>> saved =
        ThreadLocal.withInitial(ArrayDeque::new);
    // message id -> number of asynchronous dispatches already restored on the publishing thread
    private final Map<UUID, Integer> handedOff = new ConcurrentHashMap<>();

    @Override
    public void beforeDispatch(Message message) {
        saved.get().push(new String[] {MDC.get(MESSAGE_ID), MDC.get(CORRELATION_ID), MDC.get(MESSAGE_TYPE)});
        MDC.put(MESSAGE_ID, message.messageId().toString());
        MDC.put(CORRELATION_ID, message.correlationId());
        MDC.put(MESSAGE_TYPE, message.getClass().getSimpleName());
    }

    @Override
    public void afterHandoff(Message message) {
        handedOff.merge(message.messageId(), 1, Integer::sum);
        restorePrevious();
    }

    @Override
    public void afterDispatch(Message message, Throwable error) {
        if (consumeHandoff(message.messageId())) {
            return;
        }
        restorePrevious();
    }

    private boolean consumeHandoff(UUID messageId) {
        boolean[] found = {false};
        handedOff.computeIfPresent(messageId, (id, count) -> {
            found[0] = true;
            return count == 1 ? null : count - 1;
        });
        return found[0];
    }

    private void restorePrevious() {
        String[] previous = saved.get().poll();
        restore(MESSAGE_ID, previous == null ? null : previous[0]);
        restore(CORRELATION_ID, previous == null ? null : previous[1]);
        restore(MESSAGE_TYPE, previous == null ? null : previous[2]);
        if (saved.get().isEmpty()) {
            saved.remove();
        }
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
