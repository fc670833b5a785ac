package org.smchecker.dataflow.cfg.node;

/**
 * A default implementation of the node visitor interface. The class introduces a new method
 * {@link #visitNode} that is called by every visit method unless it is overridden.
 */
public abstract class AbstractNodeVisitor<R, P> implements NodeVisitor<R, P> {

    public abstract R visitNode(Node n, P p);

    @Override
    public R visitLocalVariable(LocalVariableNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitLiteral(LiteralNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitCall(CallNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitAssignment(AssignmentNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitDereference(DereferenceNode n, P p) {
        return visitNode(n, p);
    }

    @Override
    public R visitReturn(ReturnNode n, P p) {
        return visitNode(n, p);
    }
}
