package io.virtserve.core.engine;

import io.virtserve.core.model.Stub;
import java.util.Objects;

/**
 * A stub paired with its compiled predicate.
 *
 * @param stub     the stub as defined
 * @param compiled its compiled predicate
 */
public record CompiledStub(Stub stub, CompiledPredicate compiled) {

    public CompiledStub {
        Objects.requireNonNull(stub, "stub must not be null");
        Objects.requireNonNull(compiled, "compiled must not be null");
    }

    /** Compiles a stub. */
    static CompiledStub compile(Stub stub, FieldOptimizer optimizer) {
        return new CompiledStub(stub, optimizer.compile(stub.predicates()));
    }
}
