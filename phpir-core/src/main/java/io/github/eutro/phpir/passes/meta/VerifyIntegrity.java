package io.github.eutro.phpir.passes.meta;

import io.github.eutro.phpir.bound.BoundBlock;
import io.github.eutro.phpir.bound.ControlFlowGraph;
import io.github.eutro.phpir.bound.Edge;
import io.github.eutro.phpir.ops.PhpOps;
import io.github.eutro.phpir.passes.InPlaceIRPass;
import io.github.eutro.phpir.util.GraphWalker;

import java.util.HashSet;
import java.util.Set;

/**
 * Checks the structure of a rewritten graph: every block appears once, every
 * edge is well-formed and targets a block of the graph, and every block
 * is reachable from the start.
 */
public class VerifyIntegrity implements InPlaceIRPass<ControlFlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public void runInPlace(ControlFlowGraph cfg) {
        if (cfg.blocks.isEmpty()) {
            throw new IllegalStateException("graph has no start block");
        }
        Set<BoundBlock> blockSet = new HashSet<>(cfg.blocks);
        if (blockSet.size() != cfg.blocks.size()) {
            throw new IllegalStateException("graph contains duplicate blocks");
        }

        for (BoundBlock block : cfg.blocks) {
            Edge edge = block.getEdge();
            int expectedTargets;
            if (edge.op.key == PhpOps.BR.key) {
                expectedTargets = 1;
            } else if (edge.op.key == PhpOps.BR_COND.key) {
                expectedTargets = 2;
            } else {
                expectedTargets = 0;
            }
            if (edge.targets.size() != expectedTargets) {
                throw new IllegalStateException(String.format(
                        "edge has %d targets, expected %d\n  edge: %s\n  in block: %s",
                        edge.targets.size(),
                        expectedTargets,
                        edge,
                        block));
            }
            for (BoundBlock target : edge.targets) {
                if (!blockSet.contains(target)) {
                    throwInvalidReference(block, edge, target);
                }
            }
        }

        Set<BoundBlock> reachable = new HashSet<>(GraphWalker.blockWalker(cfg).preOrder().toList());
        for (BoundBlock block : cfg.blocks) {
            if (!reachable.contains(block)) {
                throw new IllegalStateException(String.format(
                        "block not reachable from the start\n  block: %s",
                        block));
            }
        }
    }

    private void throwInvalidReference(BoundBlock block, Edge edge, BoundBlock referenced) {
        throw new IllegalStateException(String.format(
                "edge references block not in graph;" +
                        "\n  referenced: %s" +
                        "\n  edge: %s" +
                        "\n  in block: %s",
                referenced.toTargetString(),
                edge,
                block
        ));
    }
}
