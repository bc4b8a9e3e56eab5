package io.authrelay.model;

public record Authorization(
        String label,
        AuthorizationMode mode,
        Expiration notBefore,
        Expiration expiration,
        long maxConcurrentExecutions,
        Subroutine subroutine,
        Priority priority,
        AuthorizationState state
) {
    public Authorization withState(AuthorizationState next) {
        return new Authorization(label, mode, notBefore, expiration, maxConcurrentExecutions, subroutine, priority, next);
    }

    public Authorization modified(Expiration nextNotBefore, Expiration nextExpiration, Long nextMaxConcurrent, Priority nextPriority) {
        return new Authorization(
                label,
                mode,
                nextNotBefore == null ? notBefore : nextNotBefore,
                nextExpiration == null ? expiration : nextExpiration,
                nextMaxConcurrent == null ? maxConcurrentExecutions : nextMaxConcurrent,
                subroutine,
                nextPriority == null ? priority : nextPriority,
                state
        );
    }

    public boolean permissionless() {
        return mode instanceof AuthorizationMode.Permissionless;
    }
}
