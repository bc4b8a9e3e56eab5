package io.authrelay.model;

import java.util.List;

public record MessageBatch(
        long id,
        List<ProcessorMessage> msgs,
        Subroutine subroutine,
        Priority priority,
        CurrentRetry retry,
        Expiration expiration,
        int nextFunction,
        boolean started
) {
    public MessageBatch {
        msgs = msgs == null ? List.of() : List.copyOf(msgs);
    }

    public static MessageBatch queued(long id, List<ProcessorMessage> msgs, Subroutine subroutine, Priority priority,
                                      Expiration expiration) {
        return new MessageBatch(id, msgs, subroutine, priority, null, expiration, 0, false);
    }

    public boolean atomic() {
        return subroutine instanceof Subroutine.Atomic;
    }

    public MessageBatch withRetry(CurrentRetry next) {
        return new MessageBatch(id, msgs, subroutine, priority, next, expiration, nextFunction, started);
    }

    public MessageBatch advancedTo(int index) {
        return new MessageBatch(id, msgs, subroutine, priority, null, expiration, index, started);
    }

    public MessageBatch markStarted() {
        return new MessageBatch(id, msgs, subroutine, priority, retry, expiration, nextFunction, true);
    }

    public long executedCount() {
        return atomic() ? 0L : nextFunction;
    }
}
