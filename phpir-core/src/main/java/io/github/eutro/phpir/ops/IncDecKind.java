package io.github.eutro.phpir.ops;

/**
 * The forms of {@link PhpOps#INC_DEC}.
 */
public enum IncDecKind {
    PRE_INCREMENT(true, true),
    PRE_DECREMENT(false, true),
    POST_INCREMENT(true, false),
    POST_DECREMENT(false, false),
    ;

    public final boolean isIncrement;
    public final boolean isPrefix;

    IncDecKind(boolean isIncrement, boolean isPrefix) {
        this.isIncrement = isIncrement;
        this.isPrefix = isPrefix;
    }

    /**
     * Get the prefix form.
     *
     * @param isIncrement Whether it increments.
     * @return The prefix increment or decrement.
     */
    public static IncDecKind prefix(boolean isIncrement) {
        return isIncrement ? PRE_INCREMENT : PRE_DECREMENT;
    }

    @Override
    public String toString() {
        String sym = isIncrement ? "++" : "--";
        return isPrefix ? sym : "post" + sym;
    }
}
