package io.github.eutro.phpir.ops;

/**
 * An operation key without an immediate; it has exactly one {@link Op}.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String mnemonic) {
        super(mnemonic);
    }

    /**
     * Get the only operation of this key.
     *
     * @return The operation.
     */
    public Op create() {
        return op;
    }
}
