package org.smchecker.dataflow.cfg.node;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;

/**
 * A node for a read or write through a pointer variable:
 *
 * <pre>
 *   *<em>variable</em>
 * </pre>
 */
public class DereferenceNode extends Node {

    protected final LocalVariableNode operand;

    public DereferenceNode(LocalVariableNode operand) {
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public LocalVariableNode getOperand() {
        return operand;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitDereference(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return Collections.singletonList(operand);
    }

    @Override
    public String toString() {
        return "*" + operand;
    }
}
