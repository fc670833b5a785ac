package org.smchecker.dataflow.cfg.node;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node for a literal, kept as its source text ({@code 1024}, {@code NULL}, {@code 0}). The
 * analysis never evaluates literals; they only document the effect they appear in.
 */
public class LiteralNode extends Node {

    protected final String text;

    public LiteralNode(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitLiteral(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return Collections.emptyList();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof LiteralNode)) {
            return false;
        }
        return text.equals(((LiteralNode) obj).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
