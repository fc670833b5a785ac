package org.smchecker.dataflow.analysis;

import org.smchecker.dataflow.cfg.block.Block;

/**
 * {@code TransferInput} is used as the input type of the individual transfer functions of a
 * {@link PathTransferFunction}. It holds the store of the path together with where the path is:
 * the block being processed and the witness of the path up to and including that block.
 *
 * @param <S> the store type
 */
public final class TransferInput<S extends PathStore<S>> {

    private final S store;
    private final Block block;
    private final Witness witness;

    public TransferInput(S store, Block block, Witness witness) {
        this.store = store;
        this.block = block;
        this.witness = witness;
    }

    public S getStore() {
        return store;
    }

    public Block getBlock() {
        return block;
    }

    public Witness getWitness() {
        return witness;
    }

    /** @return a transfer input at the same point with another store */
    public TransferInput<S> withStore(S newStore) {
        return new TransferInput<>(newStore, block, witness);
    }

    @Override
    public String toString() {
        return "[" + block + ", path " + witness + ", " + store + "]";
    }
}
