package org.smchecker.dataflow.cfg.node;

/**
 * A visitor for a {@link Node} tree.
 *
 * @param <R> return type of the visitor. Use {@link Void} if the visitor does not have a return
 *     value.
 * @param <P> parameter type of the visitor. Use {@link Void} if the visitor does not have a
 *     parameter.
 */
public interface NodeVisitor<R, P> {

    R visitLocalVariable(LocalVariableNode n, P p);

    R visitLiteral(LiteralNode n, P p);

    R visitCall(CallNode n, P p);

    R visitAssignment(AssignmentNode n, P p);

    R visitDereference(DereferenceNode n, P p);

    R visitReturn(ReturnNode n, P p);
}
