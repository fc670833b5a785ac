package org.smchecker.dataflow.cfg.node;

import java.util.Collection;
import java.util.Collections;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node for a return statement:
 *
 * <pre>
 *   return
 *   return <em>expression</em>
 * </pre>
 */
public class ReturnNode extends Node {

    protected final @Nullable Node result;

    public ReturnNode(@Nullable Node result) {
        this.result = result;
    }

    /** @return the returned expression, or {@code null} for a {@code void} return */
    public @Nullable Node getResult() {
        return result;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitReturn(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        if (result == null) {
            return Collections.emptyList();
        }
        return Collections.singletonList(result);
    }

    @Override
    public String toString() {
        if (result == null) {
            return "return";
        }
        return "return " + result;
    }
}
