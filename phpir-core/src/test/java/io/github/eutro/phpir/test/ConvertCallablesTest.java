package io.github.eutro.phpir.test;

import io.github.eutro.phpir.bound.BoundAccess;
import io.github.eutro.phpir.bound.BoundExpression;
import io.github.eutro.phpir.bound.ControlFlowGraph;
import io.github.eutro.phpir.bound.Exprs;
import io.github.eutro.phpir.bound.TypeRef;
import io.github.eutro.phpir.ops.PhpOps;
import io.github.eutro.phpir.passes.rewrite.TransformationRewriter;
import io.github.eutro.phpir.symbols.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.github.eutro.phpir.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ConvertCallablesTest {
    private static final BoundAccess AS_CALLABLE = BoundAccess.READ.withRead(TypeRef.CALLABLE);

    private SourceSymbolTable symbols;
    private Compilation compilation;
    private FunctionSymbol routine;

    @BeforeEach
    void setUp() {
        symbols = new SourceSymbolTable();
        compilation = compilation(symbols);
        routine = function(compilation, "test", emptyGraph());
    }

    private FunctionSymbol declare(String name, boolean conditional) {
        FunctionSymbol function = new FunctionSymbol(
                QualifiedName.parse(name, true), FILE, compilation, emptyGraph(), conditional);
        symbols.addFunction(function);
        return function;
    }

    private static BoundExpression callable(String name) {
        return Exprs.str(name).withAccess(AS_CALLABLE);
    }

    @Test
    void testResolved() {
        FunctionSymbol target = declare("App\\handler", false);
        BoundExpression result = rewriteIn(routine, callable("App\\handler"));
        assertSame(target, PhpOps.CALLABLE_CONVERT.argNullable(result.op));
        assertEquals(AS_CALLABLE, result.access());

        BoundExpression literal = result.arg(0);
        assertEquals("App\\handler", literal.constantValue());
        assertSame(TypeRef.STRING, literal.access().getTargetType());
    }

    @Test
    void testResolvedIgnoringCase() {
        FunctionSymbol target = declare("handler", false);
        BoundExpression result = rewriteIn(routine, callable("HANDLER"));
        assertSame(target, PhpOps.CALLABLE_CONVERT.argNullable(result.op));
    }

    @Test
    void testUnknownFunction() {
        BoundExpression expr = callable("missing");
        assertSame(expr, rewriteIn(routine, expr));
    }

    @Test
    void testStaticMethod() {
        declare("handler", false);
        BoundExpression expr = callable("Handlers::handler");
        assertSame(expr, rewriteIn(routine, expr));
    }

    @Test
    void testNotAName() {
        BoundExpression expr = callable("not a name");
        assertSame(expr, rewriteIn(routine, expr));
    }

    @Test
    void testConditionalOverloads() {
        declare("handler", true);
        declare("handler", true);
        BoundExpression result = rewriteIn(routine, callable("handler"));
        RoutineSymbol target = PhpOps.CALLABLE_CONVERT.argNullable(result.op);
        assertTrue(target instanceof AmbiguousRoutineSymbol);
        assertEquals(2, ((AmbiguousRoutineSymbol) target).getAmbiguities().size());
    }

    @Test
    void testAmbiguousDeclarations() {
        declare("handler", false);
        declare("handler", true);
        BoundExpression expr = callable("handler");
        assertSame(expr, rewriteIn(routine, expr));
    }

    @Test
    void testPlainString() {
        declare("handler", false);
        BoundExpression expr = Exprs.str("handler");
        assertSame(expr, rewriteIn(routine, expr));
    }

    @Test
    void testOnlyOnce() {
        declare("handler", false);
        rewriteIn(routine, callable("handler"));
        ControlFlowGraph before = routine.getControlFlowGraph();
        assertFalse(TransformationRewriter.tryTransform(new DelayedTransformations(), routine));
        assertSame(before, routine.getControlFlowGraph());
    }
}
