package io.github.eutro.phpir.bound;

import io.github.eutro.phpir.ext.ExtHolder;

import java.util.ArrayList;
import java.util.List;

/**
 * The control flow graph of a routine. The first block is where execution starts.
 */
public final class ControlFlowGraph extends ExtHolder {
    public final List<BoundBlock> blocks = new ArrayList<>();

    /**
     * Create a new block in this graph. The first block created is the start block.
     *
     * @return The block.
     */
    public BoundBlock newBlock() {
        BoundBlock block = new BoundBlock();
        blocks.add(block);
        return block;
    }

    public BoundBlock start() {
        return blocks.get(0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (BoundBlock block : blocks) {
            sb.append(block).append('\n');
        }
        return sb.toString();
    }
}
