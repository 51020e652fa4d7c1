package io.virtserve.core.engine;

import io.virtserve.core.model.Imposter;
import io.virtserve.core.model.Stub;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An imposter together with the compiled form of each of its stubs. Stub edits produce a new
 * snapshot; only the added or replaced stubs are compiled, the others are shared.
 *
 * <p>
 * Thread-safe: immutable.
 */
public final class ImposterSnapshot {

    private final Imposter imposter;
    private final List<CompiledStub> stubs;

    private ImposterSnapshot(Imposter imposter, List<CompiledStub> stubs) {
        this.imposter = imposter;
        this.stubs = List.copyOf(stubs);
    }

    /**
     * Compiles every stub of an imposter.
     *
     * @param imposter  the imposter
     * @param optimizer compiler for stub predicates
     * @return the snapshot
     */
    public static ImposterSnapshot compile(Imposter imposter, FieldOptimizer optimizer) {
        Objects.requireNonNull(imposter, "imposter must not be null");
        List<CompiledStub> compiled = new ArrayList<>(imposter.stubs().size());
        for (Stub stub : imposter.stubs()) {
            compiled.add(CompiledStub.compile(stub, optimizer));
        }
        return new ImposterSnapshot(imposter, compiled);
    }

    public Imposter imposter() {
        return imposter;
    }

    public int port() {
        return imposter.port();
    }

    /** Compiled stubs in declaration order. */
    public List<CompiledStub> stubs() {
        return stubs;
    }

    /** Total number of field groups across all stubs. */
    public int groupCount() {
        return stubs.stream().mapToInt(stub -> stub.compiled().groups().size()).sum();
    }

    /** Total number of residual predicates across all stubs. */
    public int residualCount() {
        return stubs.stream().mapToInt(stub -> stub.compiled().residual().size()).sum();
    }

    /**
     * Returns a snapshot with a stub inserted.
     *
     * @param index position to insert at, {@code 0..stubs().size()}
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public ImposterSnapshot withStubAdded(int index, Stub stub, FieldOptimizer optimizer) {
        List<CompiledStub> updated = new ArrayList<>(stubs);
        updated.add(index, CompiledStub.compile(stub, optimizer));
        return rebuild(updated);
    }

    /**
     * Returns a snapshot with the stub at {@code index} replaced.
     *
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public ImposterSnapshot withStubReplaced(int index, Stub stub, FieldOptimizer optimizer) {
        List<CompiledStub> updated = new ArrayList<>(stubs);
        updated.set(index, CompiledStub.compile(stub, optimizer));
        return rebuild(updated);
    }

    /**
     * Returns a snapshot without the stub at {@code index}.
     *
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public ImposterSnapshot withStubRemoved(int index) {
        List<CompiledStub> updated = new ArrayList<>(stubs);
        updated.remove(index);
        return rebuild(updated);
    }

    /** Returns a snapshot whose stub list is replaced wholesale. */
    public ImposterSnapshot withStubs(List<Stub> newStubs, FieldOptimizer optimizer) {
        return compile(imposter.withStubs(newStubs), optimizer);
    }

    private ImposterSnapshot rebuild(List<CompiledStub> updated) {
        List<Stub> definitions = new ArrayList<>(updated.size());
        updated.forEach(compiled -> definitions.add(compiled.stub()));
        return new ImposterSnapshot(imposter.withStubs(definitions), updated);
    }
}
