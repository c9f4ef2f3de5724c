package io.github.eutro.phpir.ops;

/**
 * The operators of {@link PhpOps#BINARY binary}, {@link PhpOps#UNARY unary}
 * and {@link PhpOps#COMPOUND_ASSIGN compound assignment} expressions.
 */
public enum Operation {
    AND("&&", true, true),
    OR("||", true, true),
    XOR("xor", true, true),

    BIT_AND("&", false, false),
    BIT_OR("|", false, false),
    BIT_XOR("^", false, false),
    SHIFT_LEFT("<<", false, false),
    SHIFT_RIGHT(">>", false, false),
    ADD("+", false, false),
    SUB("-", false, false),
    MUL("*", false, false),
    DIV("/", false, false),
    MOD("%", false, false),
    POW("**", false, false),
    CONCAT(".", false, false),
    COALESCE("??", false, true),

    EQUAL("==", true, false),
    NOT_EQUAL("!=", true, false),
    IDENTICAL("===", true, true),
    NOT_IDENTICAL("!==", true, true),
    LESS_THAN("<", true, false),
    GREATER_THAN(">", true, false),
    LESS_THAN_OR_EQUAL("<=", true, false),
    GREATER_THAN_OR_EQUAL(">=", true, false),

    LOGIC_NEGATION("!", true, true),
    MINUS("-", false, false),
    PLUS("+", false, false),
    BIT_NEGATION("~", false, false),
    SILENCE("@", false, false),
    ;

    /**
     * The source form of the operator.
     */
    public final String symbol;
    private final boolean producesBool;
    private final boolean pure;

    Operation(String symbol, boolean producesBool, boolean pure) {
        this.symbol = symbol;
        this.producesBool = producesBool;
        this.pure = pure;
    }

    /**
     * Whether the result of this operator is always a PHP boolean.
     *
     * @return Whether it is.
     */
    public boolean producesBool() {
        return producesBool;
    }

    /**
     * Whether applying this operator to side-effect free operands is itself
     * free of side effects. Operators that may convert objects, raise
     * arithmetic errors or emit notices are not.
     *
     * @return Whether it is.
     */
    public boolean isPure() {
        return pure;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
