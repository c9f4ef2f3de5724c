package io.github.eutro.phpir.ops;

/**
 * The compile-time "magic" constants, see {@link PhpOps#PSEUDO_CONST}.
 */
public enum PseudoConstKind {
    LINE("__LINE__"),
    FILE("__FILE__"),
    DIR("__DIR__"),
    FUNCTION("__FUNCTION__"),
    CLASS("__CLASS__"),
    TRAIT("__TRAIT__"),
    METHOD("__METHOD__"),
    NAMESPACE("__NAMESPACE__"),
    ;

    public final String sourceName;

    PseudoConstKind(String sourceName) {
        this.sourceName = sourceName;
    }

    @Override
    public String toString() {
        return sourceName;
    }
}
