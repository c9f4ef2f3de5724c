package io.github.eutro.phpir.ops;

import io.github.eutro.phpir.bound.FunctionName;
import io.github.eutro.phpir.bound.TypeRef;
import io.github.eutro.phpir.bound.Variable;
import io.github.eutro.phpir.ext.CommonExts;
import io.github.eutro.phpir.symbols.FunctionSymbol;
import io.github.eutro.phpir.symbols.RoutineSymbol;
import io.github.eutro.phpir.symbols.TypeSymbol;

/**
 * The operations of the bound tree: expressions, statements and block edges.
 * <p>
 * Children of each expression are listed in brackets.
 */
public class PhpOps {
    // expressions

    /**
     * Expression: a literal value. {@code null} is PHP's {@code NULL}.
     */
    public static final UnaryOpKey<Object> LITERAL = new UnaryOpKey<>("const", PhpOps::printLiteral).allowNull();
    /**
     * Expression: a reference to a local variable or {@code $this}.
     */
    public static final UnaryOpKey<Variable> VAR_REF = new UnaryOpKey<>("var");
    /**
     * Expression: [left, right] combined with a binary operator.
     */
    public static final UnaryOpKey<Operation> BINARY = new UnaryOpKey<>("binary");
    /**
     * Expression: [operand] with a unary operator.
     */
    public static final UnaryOpKey<Operation> UNARY = new UnaryOpKey<>("unary");
    /**
     * Expression: [condition, ifTrue, ifFalse], or [condition, ifFalse] for {@code condition ?: ifFalse}.
     */
    public static final Op CONDITIONAL = new SimpleOpKey("cond").create();
    /**
     * Expression: [target, value].
     */
    public static final Op ASSIGN = new SimpleOpKey("assign").create();
    /**
     * Expression: [target, value], {@code target op= value}.
     */
    public static final UnaryOpKey<Operation> COMPOUND_ASSIGN = new UnaryOpKey<>("compound_assign");
    /**
     * Expression: [target].
     */
    public static final UnaryOpKey<IncDecKind> INC_DEC = new UnaryOpKey<>("incdec");
    /**
     * Expression: [part...], the string concatenation of every part.
     */
    public static final Op CONCAT = new SimpleOpKey("concat").create();
    /**
     * Expression: a call to a global function. [argument...] for direct calls,
     * [name, argument...] for calls through a name expression.
     */
    public static final UnaryOpKey<FunctionName> CALL = new UnaryOpKey<>("call");
    /**
     * Expression: a compile-time constant like {@code __FILE__}.
     */
    public static final UnaryOpKey<PseudoConstKind> PSEUDO_CONST = new UnaryOpKey<>("pseudo");
    /**
     * Expression: [operand] converted to a type.
     */
    public static final UnaryOpKey<TypeRef> CONVERT = new UnaryOpKey<>("convert");
    /**
     * Expression: [operand] converted to a callable bound to a known routine.
     */
    public static final UnaryOpKey<RoutineSymbol> CALLABLE_CONVERT = new UnaryOpKey<>("callable");
    /**
     * Expression: [operand], copied with value semantics.
     */
    public static final Op COPY_VALUE = new SimpleOpKey("copy").create();

    // statements

    /**
     * Statement: [expression] evaluated for its effects.
     */
    public static final Op EXPR_STMT = new SimpleOpKey("expr").create();
    /**
     * Statement: [] or [value], returning from the routine.
     */
    public static final Op RETURN = new SimpleOpKey("return").create();
    /**
     * Statement: [value...] written to the output.
     */
    public static final Op ECHO = new SimpleOpKey("echo").create();
    /**
     * Statement: declares a function when executed.
     */
    public static final UnaryOpKey<FunctionSymbol> FUNCTION_DECL = new UnaryOpKey<>("function");
    /**
     * Statement: declares a class, interface or trait when executed.
     */
    public static final UnaryOpKey<TypeSymbol> TYPE_DECL = new UnaryOpKey<>("type");

    // edges

    /**
     * Edge: jumps to its only target.
     */
    public static final Op BR = new SimpleOpKey("br").create();
    /**
     * Edge: jumps to its first target if the condition is truthy, otherwise to its second.
     */
    public static final Op BR_COND = new SimpleOpKey("br_cond").create();
    /**
     * Edge: leaves the routine.
     */
    public static final Op EXIT = new SimpleOpKey("exit").create();

    static {
        for (OpKey key : new OpKey[]{
                LITERAL,
                VAR_REF,
                PSEUDO_CONST,
                CONDITIONAL.key,
                COPY_VALUE.key,
        }) {
            key.attachExt(CommonExts.IS_PURE, true);
        }
        for (OpKey key : new OpKey[]{
                LITERAL,
                PSEUDO_CONST,
                BINARY,
                UNARY,
                CONCAT.key,
                INC_DEC,
                CONVERT,
                CALLABLE_CONVERT,
        }) {
            key.attachExt(CommonExts.IS_DEEPLY_COPIED, false);
        }
    }

    private static String printLiteral(Object value) {
        if (value == null) return "NULL";
        if (value instanceof String) {
            return '"' + ((String) value).replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
        return value.toString();
    }
}
