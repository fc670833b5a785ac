package org.smchecker.dataflow.cfg.node;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * A node for an assignment to a local variable:
 *
 * <pre>
 *   <em>variable</em> = <em>expression</em>
 * </pre>
 *
 * The expression is a {@link CallNode}, a {@link LocalVariableNode}, a {@link DereferenceNode} or
 * a {@link LiteralNode}.
 */
public class AssignmentNode extends Node {

    protected final LocalVariableNode target;
    protected final Node expression;

    public AssignmentNode(LocalVariableNode target, Node expression) {
        this.target = Objects.requireNonNull(target, "target");
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public LocalVariableNode getTarget() {
        return target;
    }

    public Node getExpression() {
        return expression;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitAssignment(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return Arrays.asList(target, expression);
    }

    @Override
    public String toString() {
        return target + " = " + expression;
    }
}
