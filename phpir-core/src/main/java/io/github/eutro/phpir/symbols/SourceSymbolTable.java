package io.github.eutro.phpir.symbols;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A {@link SymbolProvider} over the functions declared in source.
 * Functions may be added while other threads resolve names.
 */
public class SourceSymbolTable implements SymbolProvider {
    private final ConcurrentHashMap<QualifiedName, List<FunctionSymbol>> functions = new ConcurrentHashMap<>();

    /**
     * Add a declared function. The same name may be declared more than once,
     * in which case resolving it is ambiguous.
     *
     * @param function The function.
     */
    public void addFunction(FunctionSymbol function) {
        functions.computeIfAbsent(function.getQualifiedName(), k -> new CopyOnWriteArrayList<>())
                .add(function);
    }

    @Override
    public @Nullable RoutineSymbol resolveFunction(QualifiedName name) {
        List<FunctionSymbol> candidates = functions.get(name);
        if (candidates == null || candidates.isEmpty()) return null;
        if (candidates.size() == 1) return candidates.get(0);
        ImmutableList<FunctionSymbol> snapshot = ImmutableList.copyOf(candidates);
        boolean overloadable = true;
        for (FunctionSymbol candidate : snapshot) {
            // only conditional declarations can coexist at runtime
            if (!candidate.isConditional()) {
                overloadable = false;
                break;
            }
        }
        return new AmbiguousRoutineSymbol(name, snapshot, overloadable);
    }
}
