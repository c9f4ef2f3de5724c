package io.github.eutro.phpir.passes.rewrite;

import com.google.common.base.Preconditions;
import io.github.eutro.phpir.bound.BoundBlock;
import io.github.eutro.phpir.bound.BoundExpression;
import io.github.eutro.phpir.bound.BoundStatement;
import io.github.eutro.phpir.bound.ControlFlowGraph;
import io.github.eutro.phpir.bound.Edge;
import io.github.eutro.phpir.ops.OpKey;
import io.github.eutro.phpir.ops.PhpOps;
import io.github.eutro.phpir.symbols.FunctionSymbol;
import io.github.eutro.phpir.symbols.TypeSymbol;
import io.github.eutro.phpir.util.GraphWalker;

import java.util.*;

/**
 * Rewrites a {@link ControlFlowGraph} without mutating it.
 * <p>
 * Blocks are visited from the start block, following the edges as they are
 * <i>after</i> rewriting, so blocks that a rewritten edge no longer reaches are
 * dropped. Statements are visited in order, then the edge, and expressions
 * children-first through {@link #accept(BoundExpression)}, which dispatches
 * to the {@code visit} method for the kind of the node.
 * <p>
 * Subclasses must call {@link #noteTransformation()} for every rewrite they make.
 * If none were made, {@link #visitCFG(ControlFlowGraph)} returns its argument.
 * Otherwise it returns a new graph, with new blocks in the order of the old ones.
 */
public abstract class GraphRewriter {
    private int transformationCount = 0;
    private final Set<BoundBlock> queued = new HashSet<>();
    private final Deque<BoundBlock> worklist = new ArrayDeque<>();
    private final Map<BoundBlock, RewrittenBlock> rewritten = new LinkedHashMap<>();
    private final Set<BoundBlock> possiblyUnreachable = new LinkedHashSet<>();

    private static class RewrittenBlock {
        final List<BoundStatement> statements;
        final Edge edge;

        RewrittenBlock(List<BoundStatement> statements, Edge edge) {
            this.statements = statements;
            this.edge = edge;
        }
    }

    /**
     * Get the number of rewrites made so far.
     *
     * @return The count.
     */
    public int getTransformationCount() {
        return transformationCount;
    }

    /**
     * Record that a rewrite was made.
     */
    protected void noteTransformation() {
        transformationCount++;
    }

    /**
     * Record that a rewritten edge no longer jumps to {@code block}. If the block is not
     * reached some other way, its declarations are reported once the graph has been visited.
     *
     * @param block The block of the old graph.
     */
    public void notePossiblyUnreachable(BoundBlock block) {
        possiblyUnreachable.add(block);
    }

    /**
     * Called with a function declared in a block that can no longer be reached.
     *
     * @param routine The function.
     */
    protected abstract void onUnreachableRoutineFound(FunctionSymbol routine);

    /**
     * Called with a type declared in a block that can no longer be reached.
     *
     * @param type The type.
     */
    protected abstract void onUnreachableTypeFound(TypeSymbol type);

    /**
     * Called before the graph is visited.
     *
     * @param cfg The graph.
     */
    protected void onVisitCFG(ControlFlowGraph cfg) {
    }

    /**
     * Rewrite a graph. A rewriter visits a single graph.
     *
     * @param cfg The graph.
     * @return The rewritten graph, {@code cfg} itself if nothing was rewritten.
     */
    public ControlFlowGraph visitCFG(ControlFlowGraph cfg) {
        Preconditions.checkState(rewritten.isEmpty() && queued.isEmpty(), "rewriter already used");
        Preconditions.checkArgument(!cfg.blocks.isEmpty(), "graph has no start block");
        onVisitCFG(cfg);

        accept(cfg.start());
        while (!worklist.isEmpty()) {
            BoundBlock block = worklist.removeFirst();
            RewrittenBlock result = visitBlock(block);
            rewritten.put(block, result);
            for (BoundBlock target : result.edge.targets) {
                accept(target);
            }
        }

        reportUnreachable();

        if (transformationCount == 0) return cfg;
        return rebuild(cfg);
    }

    /**
     * Schedule a block of the old graph to be visited, if it hasn't been already.
     *
     * @param block The block.
     * @return The block.
     */
    public BoundBlock accept(BoundBlock block) {
        if (queued.add(block)) {
            worklist.addLast(block);
        }
        return block;
    }

    private RewrittenBlock visitBlock(BoundBlock block) {
        List<BoundStatement> statements = new ArrayList<>(block.getStatements().size());
        for (BoundStatement statement : block.getStatements()) {
            statements.add(visitStatement(statement));
        }
        return new RewrittenBlock(statements, visitEdge(block.getEdge()));
    }

    /**
     * Rewrite a statement. By default, this rewrites its expressions.
     *
     * @param statement The statement.
     * @return The rewritten statement.
     */
    protected BoundStatement visitStatement(BoundStatement statement) {
        return statement.update(acceptAll(statement.args()));
    }

    /**
     * Rewrite the edge at the end of a block. Targets of the result that are in the
     * old graph are visited afterwards.
     *
     * @param edge The edge.
     * @return The rewritten edge.
     */
    protected Edge visitEdge(Edge edge) {
        if (edge.isConditional()) {
            return visitConditionalEdge(edge);
        }
        return edge;
    }

    protected Edge visitConditionalEdge(Edge edge) {
        return edge.withCondition(accept(Objects.requireNonNull(edge.getCondition())));
    }

    /**
     * Rewrite an expression, dispatching on its kind. Rules may call this
     * to rewrite a node they have built or taken apart.
     *
     * @param x The expression.
     * @return The rewritten expression.
     */
    public BoundExpression accept(BoundExpression x) {
        OpKey key = x.op.key;
        if (key == PhpOps.LITERAL) return visitLiteral(x);
        if (key == PhpOps.BINARY) return visitBinary(x);
        if (key == PhpOps.UNARY) return visitUnary(x);
        if (key == PhpOps.CONDITIONAL.key) return visitConditional(x);
        if (key == PhpOps.ASSIGN.key) return visitAssign(x);
        if (key == PhpOps.CONCAT.key) return visitConcat(x);
        if (key == PhpOps.CALL) return visitCall(x);
        if (key == PhpOps.COPY_VALUE.key) return visitCopyValue(x);
        return visitChildren(x);
    }

    /**
     * Rewrite the children of an expression.
     *
     * @param x The expression.
     * @return The expression with rewritten children, {@code x} if none changed.
     */
    protected BoundExpression visitChildren(BoundExpression x) {
        if (x.args().isEmpty()) return x;
        return x.update(acceptAll(x.args()));
    }

    private List<BoundExpression> acceptAll(List<BoundExpression> args) {
        List<BoundExpression> newArgs = new ArrayList<>(args.size());
        for (BoundExpression arg : args) {
            newArgs.add(accept(arg));
        }
        return newArgs;
    }

    protected BoundExpression visitLiteral(BoundExpression x) {
        return x;
    }

    protected BoundExpression visitBinary(BoundExpression x) {
        return visitChildren(x);
    }

    protected BoundExpression visitUnary(BoundExpression x) {
        return visitChildren(x);
    }

    protected BoundExpression visitConditional(BoundExpression x) {
        return visitChildren(x);
    }

    protected BoundExpression visitAssign(BoundExpression x) {
        return visitChildren(x);
    }

    protected BoundExpression visitConcat(BoundExpression x) {
        return visitChildren(x);
    }

    protected BoundExpression visitCall(BoundExpression x) {
        return visitChildren(x);
    }

    protected BoundExpression visitCopyValue(BoundExpression x) {
        return visitChildren(x);
    }

    private void reportUnreachable() {
        Set<BoundBlock> scanned = new HashSet<>();
        for (BoundBlock noted : possiblyUnreachable) {
            if (rewritten.containsKey(noted)) continue;
            // everything only reachable through the dead block is dead too
            GraphWalker<BoundBlock> walker = new GraphWalker<>(noted, block -> {
                List<BoundBlock> dead = new ArrayList<>();
                for (BoundBlock target : block.getEdge().targets) {
                    if (!rewritten.containsKey(target)) dead.add(target);
                }
                return dead;
            });
            for (BoundBlock block : walker.preOrder()) {
                if (!scanned.add(block)) continue;
                for (BoundStatement statement : block.getStatements()) {
                    FunctionSymbol function = PhpOps.FUNCTION_DECL.argNullable(statement.op);
                    if (function != null) onUnreachableRoutineFound(function);
                    TypeSymbol type = PhpOps.TYPE_DECL.argNullable(statement.op);
                    if (type != null) onUnreachableTypeFound(type);
                }
            }
        }
    }

    private ControlFlowGraph rebuild(ControlFlowGraph cfg) {
        ControlFlowGraph out = new ControlFlowGraph();
        Map<BoundBlock, BoundBlock> newBlocks = new HashMap<>();
        for (BoundBlock block : cfg.blocks) {
            if (rewritten.containsKey(block)) {
                newBlocks.put(block, out.newBlock());
            }
        }
        Preconditions.checkState(newBlocks.size() == rewritten.size(), "edges target blocks outside the graph");
        for (Map.Entry<BoundBlock, BoundBlock> entry : newBlocks.entrySet()) {
            RewrittenBlock result = rewritten.get(entry.getKey());
            BoundBlock newBlock = entry.getValue();
            newBlock.getStatements().addAll(result.statements);
            newBlock.setEdge(result.edge.remapTargets(newBlocks::get));
        }
        return out;
    }
}
