package io.github.luanext.core;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Options for {@link AnalysisContext#compute(java.util.List, AnalysisOptions)}.
 */
public final class AnalysisOptions {
    /**
     * The environment variable that, if set, names a directory to write a Graphviz dump
     * of every analyzed scope to.
     */
    public static final String DUMP_DIRECTORY_ENV = "LUANEXT_ANALYSIS_DUMP";

    private static final @Nullable String DEFAULT_DUMP_DIRECTORY = System.getenv(DUMP_DIRECTORY_ENV);

    private final Executor executor;
    private final @Nullable Path dumpDirectory;

    private AnalysisOptions(Builder builder) {
        executor = builder.executor;
        dumpDirectory = builder.dumpDirectory;
    }

    /**
     * Get the default options: analyze on the calling thread, dumping only if
     * {@value #DUMP_DIRECTORY_ENV} is set.
     *
     * @return The options.
     */
    public static AnalysisOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the executor that scopes are analyzed on. Scopes are independent,
     * so they may be analyzed in parallel.
     *
     * @return The executor.
     */
    public Executor getExecutor() {
        return executor;
    }

    public @Nullable Path getDumpDirectory() {
        return dumpDirectory;
    }

    public static final class Builder {
        private Executor executor = Runnable::run;
        private @Nullable Path dumpDirectory = DEFAULT_DUMP_DIRECTORY == null ? null : Paths.get(DEFAULT_DUMP_DIRECTORY);

        private Builder() {
        }

        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor);
            return this;
        }

        /**
         * Set the directory to dump analyses to, or null to not dump them.
         *
         * @param dumpDirectory The directory.
         * @return This builder.
         */
        public Builder dumpDirectory(@Nullable Path dumpDirectory) {
            this.dumpDirectory = dumpDirectory;
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }
    }
}
