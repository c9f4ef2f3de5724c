package io.github.eutro.phpir.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Function;

/**
 * An operation key whose operations carry a single immediate of type {@code T},
 * such as the operator of a binary expression or the value of a literal.
 *
 * @param <T> The type of the immediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;
    private boolean allowNull = false;

    public UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, Objects::toString);
    }

    /**
     * Allow null immediates for this key.
     *
     * @return this
     */
    public UnaryOpKey<T> allowNull() {
        allowNull = true;
        return this;
    }

    /**
     * An operation of this key, with its immediate.
     */
    public class UnaryOp extends Op {
        /**
         * The immediate.
         */
        public final T arg;

        UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    /**
     * Get {@code val} as an operation of this key, or null if it is of a different key.
     *
     * @param val The operation.
     * @return The operation, or null.
     */
    public @Nullable UnaryOp checkNullable(Op val) {
        if (val.key == this) {
            @SuppressWarnings("unchecked")
            UnaryOp ret = (UnaryOp) val;
            return ret;
        } else {
            return null;
        }
    }

    /**
     * Get the immediate of {@code val}, or null if it is of a different key.
     *
     * @param val The operation.
     * @return The immediate, or null.
     */
    @Nullable
    public T argNullable(Op val) {
        UnaryOp op = checkNullable(val);
        if (op == null) return null;
        return op.arg;
    }

    /**
     * Create an operation of this key.
     *
     * @param arg The immediate.
     * @return The operation.
     */
    public UnaryOp create(T arg) {
        if (!allowNull && arg == null) {
            throw new IllegalArgumentException("Argument is null");
        }
        return new UnaryOp(arg);
    }
}
