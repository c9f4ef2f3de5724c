package io.github.eutro.phpir.bound;

import io.github.eutro.phpir.ext.ExtHolder;

import java.util.ArrayList;
import java.util.List;

/**
 * A basic block: a list of statements, ending with a single {@link Edge}.
 */
public final class BoundBlock extends ExtHolder {
    private final List<BoundStatement> statements = new ArrayList<>();
    private Edge edge = Edge.exit();

    /**
     * Get the statements of this block. The list may be mutated while the graph is being built.
     *
     * @return The statements.
     */
    public List<BoundStatement> getStatements() {
        return statements;
    }

    public BoundBlock addStatement(BoundStatement statement) {
        statements.add(statement);
        return this;
    }

    public Edge getEdge() {
        return edge;
    }

    public void setEdge(Edge edge) {
        this.edge = edge;
    }

    /**
     * Get the string with which to represent this block as a jump target.
     *
     * @return The string.
     */
    public String toTargetString() {
        return String.format("@%08x", System.identityHashCode(this));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append(":\n");
        for (BoundStatement statement : statements) {
            sb.append("  ").append(statement).append('\n');
        }
        sb.append("  ").append(edge);
        return sb.toString();
    }
}
