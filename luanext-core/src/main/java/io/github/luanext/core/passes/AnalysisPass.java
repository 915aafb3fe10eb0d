package io.github.luanext.core.passes;

import com.google.common.flogger.FluentLogger;
import io.github.luanext.core.AnalysisUnit;

import java.util.concurrent.TimeUnit;

/**
 * A pass that computes some analysis of an {@link AnalysisUnit} and attaches it to the unit,
 * returning the same unit.
 */
public abstract class AnalysisPass implements IRPass<AnalysisUnit, AnalysisUnit> {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();

    /**
     * Compute the analysis and attach it to the unit.
     *
     * @param unit The unit.
     */
    protected abstract void runOn(AnalysisUnit unit);

    @Override
    public final AnalysisUnit run(AnalysisUnit unit) {
        long start = System.nanoTime();
        runOn(unit);
        logger.atFine().log("%s on %s took %dus", this, unit,
                TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - start));
        return unit;
    }

    /**
     * {@inheritDoc}
     *
     * @return {@code true}
     */
    @Override
    public final boolean isInPlace() {
        return true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
