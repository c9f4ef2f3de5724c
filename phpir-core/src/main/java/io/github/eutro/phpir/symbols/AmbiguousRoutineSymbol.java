package io.github.eutro.phpir.symbols;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The result of resolving a name that matches several routines,
 * e.g. a function declared under different conditions.
 */
public final class AmbiguousRoutineSymbol extends RoutineSymbol {
    private final ImmutableList<RoutineSymbol> ambiguities;
    private final boolean isOverloadable;

    /**
     * @param name           The resolved name.
     * @param ambiguities    The matching routines.
     * @param isOverloadable Whether the right routine can be picked at runtime,
     *                       so that a reference to the name is still meaningful.
     */
    public AmbiguousRoutineSymbol(QualifiedName name, List<? extends RoutineSymbol> ambiguities, boolean isOverloadable) {
        super(name.toString(),
                ambiguities.get(0).getContainingFile(),
                ambiguities.get(0).getDeclaringCompilation(),
                null);
        this.ambiguities = ImmutableList.copyOf(ambiguities);
        this.isOverloadable = isOverloadable;
    }

    public List<RoutineSymbol> getAmbiguities() {
        return ambiguities;
    }

    public boolean isOverloadable() {
        return isOverloadable;
    }

    @Override
    public boolean isGlobalScope() {
        return true;
    }

    @Override
    public boolean isValid() {
        return false;
    }

    @Override
    public String toString() {
        return "ambiguous " + getName() + " " + ambiguities;
    }
}
