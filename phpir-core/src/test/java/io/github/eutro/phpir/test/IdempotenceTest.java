package io.github.eutro.phpir.test;

import io.github.eutro.phpir.bound.*;
import io.github.eutro.phpir.ops.IncDecKind;
import io.github.eutro.phpir.ops.Operation;
import io.github.eutro.phpir.ops.PhpOps;
import io.github.eutro.phpir.ops.PseudoConstKind;
import io.github.eutro.phpir.passes.rewrite.TransformationRewriter;
import io.github.eutro.phpir.symbols.*;
import org.junit.jupiter.api.Test;

import static io.github.eutro.phpir.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class IdempotenceTest {
    private static final Variable I = Variable.local("i");
    private static final Variable S = Variable.local("s");

    private static BoundExpression ref(String name) {
        return Exprs.ref(Variable.local(name));
    }

    private static BoundStatement expr(BoundExpression x) {
        return new BoundStatement(PhpOps.EXPR_STMT, x);
    }

    /**
     * Global code using most of the rewrites at once.
     */
    private static ControlFlowGraph sample(Compilation compilation, TypeSymbol deadType, FunctionSymbol deadFunction) {
        ControlFlowGraph cfg = new ControlFlowGraph();
        BoundBlock start = cfg.newBlock();
        BoundBlock body = cfg.newBlock();
        BoundBlock dead = cfg.newBlock();
        BoundBlock loop = cfg.newBlock();
        BoundBlock deadToo = cfg.newBlock();
        BoundBlock end = cfg.newBlock();

        start.addStatement(expr(Exprs.assign(Exprs.ref(I), Exprs.binary(Operation.ADD, Exprs.ref(I), Exprs.integer(1)))))
                .addStatement(expr(Exprs.assign(Exprs.ref(S),
                        Exprs.binary(Operation.CONCAT, Exprs.ref(S), Exprs.concat(Exprs.str("a"), Exprs.str("b"))))))
                .addStatement(echo(Exprs.concat(Exprs.str(""), Exprs.str("x"), Exprs.str("y"), ref("v"), Exprs.str(""))))
                .addStatement(echo(Exprs.conditional(
                        Exprs.not(Exprs.not(ref("c"))), Exprs.bool(false), Exprs.bool(true))))
                .addStatement(echo(call("basename", Exprs.pseudoConst(PseudoConstKind.FILE))))
                .addStatement(expr(Exprs.copyValue(Exprs.integer(3))));
        start.setEdge(Edge.cond(call("extension_loaded", Exprs.str("intl")), dead, body));

        body.addStatement(echo(Exprs.binary(Operation.AND, Exprs.bool(true), ref("flag"))));
        body.setEdge(Edge.cond(Exprs.binary(Operation.AND, call("check"), Exprs.bool(false)), deadToo, loop));

        dead.addStatement(declaration(deadType));
        dead.setEdge(Edge.br(end));

        loop.addStatement(expr(Exprs.incDec(IncDecKind.POST_INCREMENT, Exprs.ref(I))));
        loop.setEdge(Edge.cond(ref("more"), loop, end));

        deadToo.addStatement(declaration(deadFunction));
        deadToo.setEdge(Edge.br(end));
        return cfg;
    }

    @Test
    void testSecondRunChangesNothing() {
        Compilation compilation = compilation("mbstring");
        TypeSymbol deadType = TypeSymbol.ofClass(QualifiedName.of("Profiler"), null);
        FunctionSymbol deadFunction = conditionalFunction(compilation, "trace");
        GlobalCodeSymbol main = new GlobalCodeSymbol(FILE, compilation, sample(compilation, deadType, deadFunction));
        DelayedTransformations delayed = new DelayedTransformations();

        assertTrue(TransformationRewriter.tryTransform(delayed, main));
        ControlFlowGraph once = main.getControlFlowGraph();
        assertEquals(4, once.blocks.size());
        assertTrue(delayed.unreachableTypes.contains(deadType));
        assertTrue(delayed.unreachableRoutines.contains(deadFunction));

        assertFalse(TransformationRewriter.tryTransform(delayed, main));
        assertSame(once, main.getControlFlowGraph());
        assertEquals(1, delayed.unreachableTypes.size());
        assertEquals(1, delayed.unreachableRoutines.size());
    }

    @Test
    void testRewrittenStatements() {
        Compilation compilation = compilation();
        GlobalCodeSymbol main = new GlobalCodeSymbol(FILE, compilation, sample(compilation,
                TypeSymbol.ofClass(QualifiedName.of("Profiler"), null),
                conditionalFunction(compilation, "trace")));
        assertTrue(TransformationRewriter.tryTransform(new DelayedTransformations(), main));

        BoundBlock start = main.getControlFlowGraph().start();
        BoundExpression increment = start.getStatements().get(0).args().get(0);
        assertSame(IncDecKind.PRE_INCREMENT, PhpOps.INC_DEC.argNullable(increment.op));

        BoundExpression append = start.getStatements().get(1).args().get(0);
        assertSame(Operation.CONCAT, PhpOps.COMPOUND_ASSIGN.argNullable(append.op));
        assertEquals("ab", append.arg(1).constantValue());

        BoundExpression echoed = start.getStatements().get(2).args().get(0);
        assertEquals(2, echoed.args().size());
        assertEquals("xy", echoed.arg(0).constantValue());

        BoundExpression negated = start.getStatements().get(3).args().get(0);
        assertSame(Operation.LOGIC_NEGATION, PhpOps.UNARY.argNullable(negated.op));
        assertSame(TypeRef.BOOL, PhpOps.CONVERT.argNullable(negated.arg(0).op));

        assertEquals("helpers.php", start.getStatements().get(4).args().get(0).constantValue());
        assertSame(PhpOps.LITERAL, start.getStatements().get(5).args().get(0).op.key);
    }
}
