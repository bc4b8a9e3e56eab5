package io.authrelay.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(Subroutine.Atomic.class),
        @JsonSubTypes.Type(Subroutine.NonAtomic.class)
})
public interface Subroutine {
    List<? extends LibraryFunction> functions();

    // seconds a queued batch may wait before it expires; null for no limit
    Long expirationTime();

    RetryLogic retryLogicFor(int functionIndex);

    default Domain domain() {
        List<? extends LibraryFunction> functions = functions();
        return functions.isEmpty() ? Domain.MAIN : functions.get(0).domain();
    }

    @JsonTypeName("atomic")
    record Atomic(List<AtomicFunction> functions, RetryLogic retryLogic, Long expirationTime) implements Subroutine {
        public Atomic {
            functions = functions == null ? List.of() : List.copyOf(functions);
        }

        @Override
        public RetryLogic retryLogicFor(int functionIndex) {
            return retryLogic;
        }
    }

    @JsonTypeName("non_atomic")
    record NonAtomic(List<NonAtomicFunction> functions, Long expirationTime) implements Subroutine {
        public NonAtomic {
            functions = functions == null ? List.of() : List.copyOf(functions);
        }

        @Override
        public RetryLogic retryLogicFor(int functionIndex) {
            return functionIndex >= 0 && functionIndex < functions.size()
                    ? functions.get(functionIndex).retryLogic()
                    : null;
        }
    }
}
