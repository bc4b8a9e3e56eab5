package io.authrelay.model;

import io.authrelay.host.BlockInfo;

public record AuthorizationInfo(
        String label,
        AuthorizationMode mode,
        Expiration notBefore,
        AuthorizationDuration duration,
        Long maxConcurrentExecutions,
        Subroutine subroutine,
        Priority priority
) {
    public static final long DEFAULT_MAX_CONCURRENT_EXECUTIONS = 1L;

    public Authorization toAuthorization(BlockInfo block) {
        AuthorizationDuration effectiveDuration = duration == null ? AuthorizationDuration.FOREVER : duration;
        return new Authorization(
                label,
                mode,
                notBefore == null ? Expiration.NEVER : notBefore,
                effectiveDuration.expirationFrom(block),
                maxConcurrentExecutions == null ? DEFAULT_MAX_CONCURRENT_EXECUTIONS : maxConcurrentExecutions,
                subroutine,
                priority == null ? Priority.MEDIUM : priority,
                AuthorizationState.ENABLED
        );
    }
}
