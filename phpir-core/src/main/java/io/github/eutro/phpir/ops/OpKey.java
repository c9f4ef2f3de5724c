package io.github.eutro.phpir.ops;

import io.github.eutro.phpir.ext.ExtHolder;

/**
 * An operation key: the kind of a bound node, without any immediate operand.
 * <p>
 * Keys are compared by identity, e.g. {@code x.op.key == PhpOps.CONCAT}.
 */
public abstract class OpKey extends ExtHolder {
    /**
     * The name of the operation, for debugging.
     */
    public final String mnemonic;

    protected OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
