package io.github.eutro.phpir.bound;

import io.github.eutro.phpir.symbols.QualifiedName;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The target of a {@link io.github.eutro.phpir.ops.PhpOps#CALL global function call}.
 * <p>
 * A direct call names its function in source. Inside a namespace an unqualified
 * call also has a fallback name, the global function PHP tries when the
 * namespaced one does not exist. An indirect call gets its name from an expression.
 */
public final class FunctionName {
    private static final FunctionName INDIRECT = new FunctionName(null, null);

    @Nullable
    private final QualifiedName nameValue;
    @Nullable
    private final QualifiedName fallbackName;

    private FunctionName(@Nullable QualifiedName nameValue, @Nullable QualifiedName fallbackName) {
        this.nameValue = nameValue;
        this.fallbackName = fallbackName;
    }

    public static FunctionName direct(QualifiedName name) {
        return new FunctionName(Objects.requireNonNull(name), null);
    }

    public static FunctionName direct(QualifiedName name, @Nullable QualifiedName fallbackName) {
        return new FunctionName(Objects.requireNonNull(name), fallbackName);
    }

    public static FunctionName indirect() {
        return INDIRECT;
    }

    public boolean isDirect() {
        return nameValue != null;
    }

    public @Nullable QualifiedName getNameValue() {
        return nameValue;
    }

    public @Nullable QualifiedName getFallbackName() {
        return fallbackName;
    }

    @Override
    public String toString() {
        if (nameValue == null) return "<indirect>";
        return fallbackName == null ? nameValue.toString() : nameValue + "|" + fallbackName;
    }
}
