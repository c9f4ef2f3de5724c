package io.github.eutro.phpir.passes.misc;

import com.google.common.base.Preconditions;
import io.github.eutro.phpir.bound.ControlFlowGraph;
import io.github.eutro.phpir.passes.IRPass;
import io.github.eutro.phpir.symbols.RoutineSymbol;
import org.apache.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * A pass which lifts a routine pass to run on every routine of a compilation,
 * either on the calling thread or on an {@link Executor}.
 * <p>
 * The result is the number of routines whose control flow graph was replaced.
 * <p>
 * Cancellation is only checked between routines, a routine that has started is
 * always finished. If the run was cancelled, a {@link CancellationException} is
 * thrown once the routines already started have finished.
 */
public class ForRoutines implements IRPass<Collection<? extends RoutineSymbol>, Integer> {
    private static final Logger LOGGER = Logger.getLogger(ForRoutines.class);

    private final IRPass<RoutineSymbol, RoutineSymbol> pass;
    @Nullable
    private final Executor executor;
    private final BooleanSupplier cancelled;

    private ForRoutines(IRPass<RoutineSymbol, RoutineSymbol> pass, @Nullable Executor executor, BooleanSupplier cancelled) {
        Preconditions.checkArgument(pass.isInPlace(), "routine pass %s must be in-place", pass);
        this.pass = pass;
        this.executor = executor;
        this.cancelled = Preconditions.checkNotNull(cancelled, "cancelled");
    }

    /**
     * Lift a routine pass to run on each routine in turn, on the calling thread.
     *
     * @param pass      The routine pass.
     * @param cancelled Whether the compilation has been cancelled.
     * @return The lifted pass.
     */
    public static ForRoutines sequential(IRPass<RoutineSymbol, RoutineSymbol> pass, BooleanSupplier cancelled) {
        return new ForRoutines(pass, null, cancelled);
    }

    public static ForRoutines sequential(IRPass<RoutineSymbol, RoutineSymbol> pass) {
        return sequential(pass, () -> false);
    }

    /**
     * Lift a routine pass to run on every routine concurrently, as tasks of {@code executor}.
     *
     * @param pass      The routine pass, which must be safe to run on different routines at once.
     * @param executor  The executor.
     * @param cancelled Whether the compilation has been cancelled.
     * @return The lifted pass.
     */
    public static ForRoutines parallel(IRPass<RoutineSymbol, RoutineSymbol> pass, Executor executor, BooleanSupplier cancelled) {
        return new ForRoutines(pass, Preconditions.checkNotNull(executor, "executor"), cancelled);
    }

    @Override
    public Integer run(Collection<? extends RoutineSymbol> routines) {
        return executor == null ? runSequential(routines) : runParallel(routines, executor);
    }

    private boolean runOne(RoutineSymbol routine) {
        ControlFlowGraph before = routine.getControlFlowGraph();
        try {
            pass.run(routine);
        } catch (Throwable t) {
            t.addSuppressed(new RuntimeException("in routine " + routine));
            throw t;
        }
        return routine.getControlFlowGraph() != before;
    }

    private int runSequential(Collection<? extends RoutineSymbol> routines) {
        int changed = 0;
        for (RoutineSymbol routine : routines) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("cancelled before " + routine);
            }
            if (runOne(routine)) changed++;
        }
        LOGGER.debug(String.format("%d of %d routines changed", changed, routines.size()));
        return changed;
    }

    private int runParallel(Collection<? extends RoutineSymbol> routines, Executor executor) {
        AtomicInteger changed = new AtomicInteger();
        AtomicBoolean skipped = new AtomicBoolean();
        List<CompletableFuture<Void>> futures = new ArrayList<>(routines.size());
        for (RoutineSymbol routine : routines) {
            futures.add(CompletableFuture.runAsync(() -> {
                if (cancelled.getAsBoolean()) {
                    skipped.set(true);
                    return;
                }
                if (runOne(routine)) changed.incrementAndGet();
            }, executor));
        }

        RuntimeException failure = null;
        for (CompletableFuture<Void> future : futures) {
            try {
                future.join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (failure == null) {
                    failure = cause instanceof RuntimeException
                            ? (RuntimeException) cause
                            : new RuntimeException(cause);
                } else {
                    failure.addSuppressed(cause);
                }
            }
        }
        if (failure != null) throw failure;
        if (skipped.get()) throw new CancellationException("cancelled with routines remaining");
        LOGGER.debug(String.format("%d of %d routines changed", changed.get(), routines.size()));
        return changed.get();
    }
}
