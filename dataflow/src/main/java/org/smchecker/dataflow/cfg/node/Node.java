package org.smchecker.dataflow.cfg.node;

import java.util.Collection;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.javacutil.BugInCF;
import org.smchecker.dataflow.cfg.block.Block;

/**
 * A node in the abstract representation used for the control flow graph. A node is either an
 * effect that a block performs (a call, an assignment, a dereference or a return) or an operand of
 * such an effect (a local variable or a literal).
 *
 * <p>Effects are contained in exactly one {@link Block}, in the order they execute. Operands are
 * not added to blocks themselves; they hang off the effect that uses them.
 */
public abstract class Node {

    /**
     * The basic block this node belongs to, or {@code null} if it is an operand or has not been
     * added to a block yet.
     */
    protected @Nullable Block block;

    /** The position of this node in the contents of {@link #block}, or -1. */
    protected int index = -1;

    /** @return the basic block this node belongs to (or {@code null} if it is an operand) */
    public @Nullable Block getBlock() {
        return block;
    }

    /** @return the position of this node in its block, or -1 if it is an operand */
    public int getIndex() {
        return index;
    }

    /**
     * Set the basic block and the position this node belongs to. Called once, when the node is
     * added to a block.
     *
     * @param b the basic block
     * @param i the position of the node in {@code b}
     * @throws BugInCF if the node already belongs to a block
     */
    public void setBlock(Block b, int i) {
        if (block != null) {
            throw new BugInCF(
                    "Node " + this + " is already at index " + index + " of " + block
                            + ", cannot add it to " + b);
        }
        block = b;
        index = i;
    }

    /**
     * Accept method of the visitor pattern.
     *
     * @param <R> result type of the operation
     * @param <P> parameter type
     * @param visitor the visitor to be applied to this node
     * @param p the parameter for this operation
     * @return the result of the visit
     */
    public abstract <R, P> R accept(NodeVisitor<R, P> visitor, P p);

    /** @return a collection containing all of the operand {@link Node}s of this {@link Node}. */
    public abstract Collection<Node> getOperands();
}
