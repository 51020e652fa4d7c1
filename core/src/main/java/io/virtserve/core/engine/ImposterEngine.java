package io.virtserve.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.virtserve.core.error.ImposterLoadException;
import io.virtserve.core.error.ImposterNotFoundException;
import io.virtserve.core.model.Imposter;
import io.virtserve.core.model.Request;
import io.virtserve.core.model.Stub;
import io.virtserve.core.spec.ImposterParser;
import io.virtserve.core.spi.MatchListener;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the matching core: holds the imposters, applies admin mutations and selects the
 * stub for each request.
 *
 * <p>
 * Thread-safe: the imposters live in an immutable {@link ImposterRegistry} held by an
 * {@link AtomicReference}. Mutations compile the affected stubs in the calling thread, build a new
 * registry and swap it in; they are serialized so concurrent edits of the same imposter cannot
 * lose updates. {@link #match} reads one registry reference and never blocks, so an in-flight
 * match never observes a partially-updated stub list.
 */
public final class ImposterEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ImposterEngine.class);

    private final ImposterParser parser;
    private final FieldOptimizer optimizer;
    private final StubMatcher matcher;
    private final MatchListener listener;
    private final AtomicReference<ImposterRegistry> registryRef = new AtomicReference<>(ImposterRegistry.empty());

    /** Creates an engine with optimized matching and the default budget. */
    public ImposterEngine() {
        this(new ImposterParser(), MatchMode.OPTIMIZED, MatchBudget.DEFAULT, null);
    }

    /**
     * Creates an engine with all configuration options.
     *
     * @param parser   parser for inline and file definitions
     * @param mode     matching mode
     * @param budget   regex budget
     * @param listener optional listener for match and load events, may be null
     */
    public ImposterEngine(ImposterParser parser, MatchMode mode, MatchBudget budget, MatchListener listener) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.optimizer = new FieldOptimizer(budget);
        this.matcher = new StubMatcher(mode, budget);
        this.listener = listener; // nullable
    }

    // --- Imposter lifecycle ---

    /**
     * Compiles and registers an imposter, replacing any imposter on the same port.
     *
     * @param imposter the imposter
     * @return the published snapshot
     */
    public synchronized ImposterSnapshot createImposter(Imposter imposter) {
        ImposterSnapshot snapshot = ImposterSnapshot.compile(imposter, optimizer);
        ImposterRegistry previous = registryRef.getAndUpdate(old -> old.toBuilder().put(snapshot).build());
        LOG.info(
                "Imposter {} {}: stubs={}, groups={}, residual={}",
                imposter.port(),
                previous.get(imposter.port()) != null ? "replaced" : "created",
                imposter.stubs().size(),
                snapshot.groupCount(),
                snapshot.residualCount());
        notifyCompiled(snapshot);
        return snapshot;
    }

    /**
     * Parses and registers an imposter definition file (JSON or YAML).
     *
     * @param path definition file
     * @return the published snapshot
     * @throws ImposterLoadException if the definition is rejected
     */
    public ImposterSnapshot loadImposter(Path path) {
        try {
            return createImposter(parser.parse(path));
        } catch (ImposterLoadException e) {
            notifyRejected(path.toString(), e);
            throw e;
        }
    }

    /**
     * Parses and registers an inline imposter definition (JSON or YAML).
     *
     * @param definition the definition text
     * @return the published snapshot
     * @throws ImposterLoadException if the definition is rejected
     */
    public ImposterSnapshot loadImposter(String definition) {
        try {
            return createImposter(parser.parse(definition));
        } catch (ImposterLoadException e) {
            notifyRejected("<inline>", e);
            throw e;
        }
    }

    /**
     * Loads every {@code .json}, {@code .yaml} and {@code .yml} file of a directory, in file-name
     * order. The first rejected file aborts loading; files loaded before it stay registered.
     *
     * @param directory directory of imposter definitions
     * @return number of imposters loaded
     * @throws ImposterLoadException if a definition is rejected
     * @throws IllegalArgumentException if the directory cannot be listed
     */
    public int loadDirectory(Path directory) {
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(ImposterEngine::isDefinitionFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot list imposter directory: " + directory, e);
        }
        for (Path file : files) {
            loadImposter(file);
        }
        LOG.info("Loaded {} imposter definition(s) from {}", files.size(), directory);
        return files.size();
    }

    /**
     * Removes the imposter on a port.
     *
     * @param port the port
     * @return the removed imposter, or empty if none was registered
     */
    public synchronized Optional<Imposter> deleteImposter(int port) {
        ImposterRegistry previous = registryRef.getAndUpdate(old -> old.toBuilder().remove(port).build());
        ImposterSnapshot removed = previous.get(port);
        if (removed != null) {
            LOG.info("Imposter {} deleted", port);
        }
        return Optional.ofNullable(removed).map(ImposterSnapshot::imposter);
    }

    /**
     * Returns the imposter on a port.
     *
     * @param port the port
     * @return the imposter, or empty
     */
    public Optional<Imposter> imposter(int port) {
        return Optional.ofNullable(registryRef.get().get(port)).map(ImposterSnapshot::imposter);
    }

    // --- Stub mutations ---

    /**
     * Appends a stub.
     *
     * @throws ImposterNotFoundException if no imposter is registered on the port
     */
    public ImposterSnapshot addStub(int port, Stub stub) {
        return mutate(port, "stub appended", snapshot ->
                snapshot.withStubAdded(snapshot.stubs().size(), stub, optimizer));
    }

    /**
     * Inserts a stub at a position.
     *
     * @throws ImposterNotFoundException if no imposter is registered on the port
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public ImposterSnapshot addStub(int port, int index, Stub stub) {
        return mutate(port, "stub inserted at " + index, snapshot -> snapshot.withStubAdded(index, stub, optimizer));
    }

    /**
     * Parses and appends an inline stub definition ({@code {"predicates": [...], "responses": [...]}}).
     *
     * @throws ImposterLoadException     if the definition is rejected
     * @throws ImposterNotFoundException if no imposter is registered on the port
     */
    public ImposterSnapshot addStub(int port, String definition) {
        Stub stub;
        try {
            stub = parser.parseStub(definition, String.valueOf(port));
        } catch (ImposterLoadException e) {
            notifyRejected("<inline>", e);
            throw e;
        }
        return addStub(port, stub);
    }

    /**
     * Replaces the stub at a position.
     *
     * @throws ImposterNotFoundException if no imposter is registered on the port
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public ImposterSnapshot replaceStub(int port, int index, Stub stub) {
        return mutate(
                port, "stub " + index + " replaced", snapshot -> snapshot.withStubReplaced(index, stub, optimizer));
    }

    /**
     * Replaces the whole stub list.
     *
     * @throws ImposterNotFoundException if no imposter is registered on the port
     */
    public ImposterSnapshot replaceStubs(int port, List<Stub> stubs) {
        List<Stub> copy = new ArrayList<>(stubs);
        return mutate(port, "stubs replaced", snapshot -> snapshot.withStubs(copy, optimizer));
    }

    /**
     * Deletes the stub at a position.
     *
     * @throws ImposterNotFoundException if no imposter is registered on the port
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public ImposterSnapshot deleteStub(int port, int index) {
        return mutate(port, "stub " + index + " deleted", snapshot -> snapshot.withStubRemoved(index));
    }

    private synchronized ImposterSnapshot mutate(int port, String action, UnaryOperator<ImposterSnapshot> change) {
        ImposterRegistry current = registryRef.get();
        ImposterSnapshot snapshot = current.get(port);
        if (snapshot == null) {
            throw new ImposterNotFoundException(port);
        }
        ImposterSnapshot updated = change.apply(snapshot);
        registryRef.set(current.toBuilder().put(updated).build());
        LOG.info("Imposter {}: {}, stubs={}", port, action, updated.stubs().size());
        notifyCompiled(updated);
        return updated;
    }

    // --- Matching ---

    /**
     * Selects the stub for a request.
     *
     * @param port    the port the request arrived on
     * @param request the request
     * @return the matched stub, the default response, or {@link MatchResult.Outcome#NO_IMPOSTER}
     */
    public MatchResult match(int port, Request request) {
        ImposterSnapshot snapshot = registryRef.get().get(port);
        if (snapshot == null) {
            LOG.debug("No imposter on port {}", port);
            return MatchResult.noImposter(port);
        }
        long start = System.nanoTime();
        Optional<StubMatch> match = matcher.findMatch(snapshot, RequestFields.of(request));
        long durationNanos = System.nanoTime() - start;
        if (match.isPresent()) {
            LOG.debug(
                    "Imposter {}: {} {} matched stub {}",
                    port,
                    request.method(),
                    request.path(),
                    match.get().index());
            notifyMatched(port, match.get(), request, durationNanos);
            return MatchResult.matched(port, match.get());
        }
        Imposter imposter = snapshot.imposter();
        LOG.debug("Imposter {}: {} {} matched no stub", port, request.method(), request.path());
        JsonNode defaultResponse = imposter.defaultResponse();
        notifyNoMatch(port, request, defaultResponse != null, durationNanos);
        return MatchResult.noMatch(port, defaultResponse);
    }

    /**
     * Returns the current registry snapshot. Primarily for testing and introspection.
     *
     * @return the current immutable registry
     */
    public ImposterRegistry registry() {
        return registryRef.get();
    }

    /** The matching mode in use. */
    public MatchMode mode() {
        return matcher.mode();
    }

    private static boolean isDefinitionFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return Files.isRegularFile(path) && (name.endsWith(".json") || name.endsWith(".yaml") || name.endsWith(".yml"));
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they MUST NOT affect matching.

    private void notifyMatched(int port, StubMatch match, Request request, long durationNanos) {
        if (listener == null) return;
        try {
            listener.onStubMatched(new MatchListener.StubMatchedEvent(
                    port, match.index(), request.method(), request.path(), durationNanos));
        } catch (Exception e) {
            LOG.warn("MatchListener.onStubMatched failed", e);
        }
    }

    private void notifyNoMatch(int port, Request request, boolean hasDefault, long durationNanos) {
        if (listener == null) return;
        try {
            listener.onNoMatch(
                    new MatchListener.NoMatchEvent(port, request.method(), request.path(), hasDefault, durationNanos));
        } catch (Exception e) {
            LOG.warn("MatchListener.onNoMatch failed", e);
        }
    }

    private void notifyCompiled(ImposterSnapshot snapshot) {
        if (listener == null) return;
        try {
            listener.onImposterCompiled(new MatchListener.ImposterCompiledEvent(
                    snapshot.port(), snapshot.stubs().size(), snapshot.groupCount(), snapshot.residualCount()));
        } catch (Exception e) {
            LOG.warn("MatchListener.onImposterCompiled failed", e);
        }
    }

    private void notifyRejected(String source, Exception cause) {
        LOG.warn("Imposter definition rejected ({}): {}", source, cause.getMessage());
        if (listener == null) return;
        try {
            listener.onImposterRejected(new MatchListener.ImposterRejectedEvent(source, cause.getMessage()));
        } catch (Exception e) {
            LOG.warn("MatchListener.onImposterRejected failed", e);
        }
    }
}
