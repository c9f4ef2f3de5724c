package io.github.eutro.phpir.passes.rewrite;

/**
 * Thrown when the rewriter produces an inconsistent result, which is a bug in the rewriter.
 */
public class RewriteInvariantException extends RuntimeException {
    public RewriteInvariantException(String message) {
        super(message);
    }
}
