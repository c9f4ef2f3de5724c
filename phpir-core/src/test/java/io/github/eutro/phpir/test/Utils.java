package io.github.eutro.phpir.test;

import io.github.eutro.phpir.bound.*;
import io.github.eutro.phpir.ops.PhpOps;
import io.github.eutro.phpir.passes.rewrite.TransformationRewriter;
import io.github.eutro.phpir.symbols.*;

import java.util.Arrays;

public class Utils {
    public static final SourceFile FILE = new SourceFile("src/lib/helpers.php");

    public static Compilation compilation(SymbolProvider symbols, String... extensions) {
        return new Compilation(Arrays.asList(extensions), symbols);
    }

    public static Compilation compilation(String... extensions) {
        return compilation(new SourceSymbolTable(), extensions);
    }

    public static FunctionSymbol function(Compilation compilation, String name, ControlFlowGraph cfg) {
        return new FunctionSymbol(QualifiedName.of(name), FILE, compilation, cfg, false);
    }

    public static FunctionSymbol conditionalFunction(Compilation compilation, String name) {
        return new FunctionSymbol(QualifiedName.of(name), FILE, compilation, emptyGraph(), true);
    }

    public static ControlFlowGraph emptyGraph() {
        ControlFlowGraph cfg = new ControlFlowGraph();
        cfg.newBlock();
        return cfg;
    }

    /**
     * A graph of a single block, returning {@code expr}.
     */
    public static ControlFlowGraph returning(BoundExpression expr) {
        ControlFlowGraph cfg = new ControlFlowGraph();
        cfg.newBlock().addStatement(new BoundStatement(PhpOps.RETURN, expr));
        return cfg;
    }

    /**
     * Get the expression returned by the first statement of the start block.
     */
    public static BoundExpression returned(ControlFlowGraph cfg) {
        return cfg.start().getStatements().get(0).args().get(0);
    }

    /**
     * Rewrite {@code expr} as the returned value of {@code routine}.
     */
    public static BoundExpression rewriteIn(RoutineSymbol routine, BoundExpression expr) {
        routine.setControlFlowGraph(returning(expr));
        TransformationRewriter.tryTransform(new DelayedTransformations(), routine);
        return returned(routine.getControlFlowGraph());
    }

    /**
     * Rewrite {@code expr} as the returned value of a global function.
     */
    public static BoundExpression rewrite(BoundExpression expr) {
        return rewriteIn(function(compilation(), "test", emptyGraph()), expr);
    }

    /**
     * A call to a function that is not known to be pure.
     */
    public static BoundExpression call(String name, BoundExpression... args) {
        return Exprs.call(FunctionName.direct(QualifiedName.parse(name, false)), args);
    }

    public static BoundStatement declaration(FunctionSymbol function) {
        return new BoundStatement(PhpOps.FUNCTION_DECL.create(function));
    }

    public static BoundStatement declaration(TypeSymbol type) {
        return new BoundStatement(PhpOps.TYPE_DECL.create(type));
    }

    public static BoundStatement echo(BoundExpression expr) {
        return new BoundStatement(PhpOps.ECHO, expr);
    }

    /**
     * Whether {@code needle} appears anywhere in {@code tree}.
     */
    public static boolean contains(BoundExpression tree, BoundExpression needle) {
        if (tree == needle) return true;
        for (BoundExpression arg : tree.args()) {
            if (contains(arg, needle)) return true;
        }
        return false;
    }
}
