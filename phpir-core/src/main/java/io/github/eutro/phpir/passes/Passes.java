package io.github.eutro.phpir.passes;

import io.github.eutro.phpir.passes.misc.ForRoutines;
import io.github.eutro.phpir.passes.opts.MarkUnconditionalDeclarations;
import io.github.eutro.phpir.passes.opts.TransformRoutine;
import io.github.eutro.phpir.symbols.DelayedTransformations;
import io.github.eutro.phpir.symbols.RoutineSymbol;

import java.util.Collection;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * Some pre-composed passes. This should not be considered stable.
 */
public class Passes {
    /**
     * The passes to run on every routine once it has been analysed: the peephole
     * rewriter, then the search for declarations it made unconditional.
     *
     * @param delayedTransformations Where the passes report their findings.
     * @return The routine pass.
     */
    public static IRPass<RoutineSymbol, RoutineSymbol> routineTransformations(DelayedTransformations delayedTransformations) {
        return new TransformRoutine(delayedTransformations)
                .then(new MarkUnconditionalDeclarations(delayedTransformations));
    }

    /**
     * {@link #routineTransformations(DelayedTransformations)} for every routine of a compilation,
     * run concurrently.
     *
     * @param delayedTransformations Where the passes report their findings.
     * @param executor               The executor to run the routines on.
     * @param cancelled              Whether the compilation has been cancelled.
     * @return The pass, which returns the number of routines that changed.
     */
    public static IRPass<Collection<? extends RoutineSymbol>, Integer> transformAll(
            DelayedTransformations delayedTransformations,
            Executor executor,
            BooleanSupplier cancelled
    ) {
        return ForRoutines.parallel(routineTransformations(delayedTransformations), executor, cancelled);
    }
}
