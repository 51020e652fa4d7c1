package io.virtserve.core.config;

import io.virtserve.core.engine.ImposterEngine;
import io.virtserve.core.engine.MatchBudget;
import io.virtserve.core.engine.MatchMode;
import io.virtserve.core.spec.ImposterParser;
import io.virtserve.core.spi.MatchListener;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration of the matching engine.
 *
 * <p>
 * All fields have defaults. Use {@link #builder()} to construct instances.
 *
 * @param matchMode     {@code optimized} (default) or {@code reference} matching
 * @param maxRegexSteps character reads allowed per regex run (default 1,000,000)
 * @param impostersDir  directory of imposter definitions loaded at startup, or null
 */
public record EngineConfig(MatchMode matchMode, int maxRegexSteps, String impostersDir) {

    /** Configuration with every default applied. */
    public static final EngineConfig DEFAULT = builder().build();

    public EngineConfig {
        Objects.requireNonNull(matchMode, "matchMode must not be null");
        if (maxRegexSteps <= 0) {
            throw new IllegalArgumentException("maxRegexSteps must be positive, got: " + maxRegexSteps);
        }
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** The regex budget derived from {@link #maxRegexSteps()}. */
    public MatchBudget budget() {
        return new MatchBudget(maxRegexSteps);
    }

    /**
     * Creates an engine from this configuration and, when {@link #impostersDir()} is set, loads
     * its imposter definitions.
     *
     * @param listener optional listener, may be null
     * @return the engine
     */
    public ImposterEngine createEngine(MatchListener listener) {
        ImposterEngine engine = new ImposterEngine(new ImposterParser(), matchMode, budget(), listener);
        if (impostersDir != null) {
            engine.loadDirectory(Path.of(impostersDir));
        }
        return engine;
    }

    /** Builder for {@link EngineConfig}. */
    public static final class Builder {
        private MatchMode matchMode = MatchMode.OPTIMIZED;
        private int maxRegexSteps = MatchBudget.DEFAULT.maxRegexSteps();
        private String impostersDir;

        Builder() {}

        public Builder matchMode(MatchMode matchMode) {
            this.matchMode = matchMode;
            return this;
        }

        /**
         * Sets the match mode by name, case-insensitively.
         *
         * @throws ConfigLoadException if the name is not a mode
         */
        public Builder matchMode(String matchMode) {
            for (MatchMode mode : MatchMode.values()) {
                if (mode.name().equalsIgnoreCase(matchMode.trim())) {
                    this.matchMode = mode;
                    return this;
                }
            }
            throw new ConfigLoadException(
                    "Invalid match mode '" + matchMode + "'; expected 'optimized' or 'reference'");
        }

        public Builder maxRegexSteps(int maxRegexSteps) {
            this.maxRegexSteps = maxRegexSteps;
            return this;
        }

        public Builder impostersDir(String impostersDir) {
            this.impostersDir = impostersDir;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(matchMode, maxRegexSteps, impostersDir);
        }
    }
}
