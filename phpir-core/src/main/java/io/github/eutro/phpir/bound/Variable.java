package io.github.eutro.phpir.bound;

/**
 * A storage location of a routine, referenced by {@link io.github.eutro.phpir.ops.PhpOps#VAR_REF}.
 * <p>
 * Variables are compared by identity: two references denote the same storage
 * exactly when they hold the same {@code Variable}.
 */
public final class Variable {
    /**
     * The name, without the {@code $}.
     */
    public final String name;
    private final boolean isThis;

    private Variable(String name, boolean isThis) {
        this.name = name;
        this.isThis = isThis;
    }

    /**
     * Create a local variable or parameter.
     *
     * @param name The name, without the {@code $}.
     * @return The variable.
     */
    public static Variable local(String name) {
        return new Variable(name, false);
    }

    /**
     * Create the {@code $this} variable of a routine.
     *
     * @return The variable.
     */
    public static Variable thisVariable() {
        return new Variable("this", true);
    }

    /**
     * Whether this is {@code $this}.
     *
     * @return Whether it is.
     */
    public boolean isThis() {
        return isThis;
    }

    @Override
    public String toString() {
        return '$' + name;
    }
}
