package io.virtserve.core.engine;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable snapshot of all imposters, keyed by port.
 *
 * <p>
 * This is the unit of atomic swap in {@link ImposterEngine}. The engine holds an
 * {@code ImposterRegistry} reference via {@link java.util.concurrent.atomic.AtomicReference};
 * every admin mutation builds a new registry and swaps it in. A request that captured the old
 * reference finishes matching against it; later requests see the new one.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class ImposterRegistry {

    private final Map<Integer, ImposterSnapshot> imposters;

    /**
     * Creates a registry. The map is defensively copied.
     *
     * @param imposters port → compiled imposter
     */
    public ImposterRegistry(Map<Integer, ImposterSnapshot> imposters) {
        this.imposters = Collections.unmodifiableMap(new TreeMap<>(imposters));
    }

    /**
     * Creates an empty registry.
     *
     * @return an empty, immutable registry
     */
    public static ImposterRegistry empty() {
        return new ImposterRegistry(Map.of());
    }

    /**
     * Returns a new {@link Builder} seeded with this registry's imposters.
     *
     * @return a builder
     */
    public Builder toBuilder() {
        return new Builder(imposters);
    }

    /**
     * Looks up an imposter by port.
     *
     * @param port the port
     * @return the snapshot, or null if no imposter listens on the port
     */
    public ImposterSnapshot get(int port) {
        return imposters.get(port);
    }

    /** Ports with an imposter, ascending. */
    public Set<Integer> ports() {
        return imposters.keySet();
    }

    /** Number of imposters. */
    public int size() {
        return imposters.size();
    }

    /**
     * Builder for deriving a registry from an existing one.
     */
    public static final class Builder {

        private final Map<Integer, ImposterSnapshot> imposters;

        Builder(Map<Integer, ImposterSnapshot> seed) {
            this.imposters = new TreeMap<>(seed);
        }

        /**
         * Registers (or replaces) the imposter on the snapshot's port.
         *
         * @param snapshot the compiled imposter
         * @return this builder (fluent)
         */
        public Builder put(ImposterSnapshot snapshot) {
            imposters.put(snapshot.port(), snapshot);
            return this;
        }

        /**
         * Removes the imposter on a port, if any.
         *
         * @param port the port
         * @return this builder (fluent)
         */
        public Builder remove(int port) {
            imposters.remove(port);
            return this;
        }

        /**
         * Builds an immutable {@link ImposterRegistry} from the accumulated state.
         *
         * @return the new registry
         */
        public ImposterRegistry build() {
            return new ImposterRegistry(imposters);
        }
    }
}
