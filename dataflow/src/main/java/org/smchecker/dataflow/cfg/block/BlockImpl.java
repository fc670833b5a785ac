package org.smchecker.dataflow.cfg.block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smchecker.dataflow.cfg.node.Node;

/** Base implementation of a {@link Block}, mutable only while the graph is being built. */
public class BlockImpl implements Block {

    /** The unique ID of this block. */
    protected final int id;

    protected final String label;

    /** The effects of this block. */
    protected final List<Node> contents;

    protected final List<Edge> successors;

    protected final List<Edge> predecessors;

    public BlockImpl(int id, String label) {
        this.id = id;
        this.label = label;
        this.contents = new ArrayList<>();
        this.successors = new ArrayList<>();
        this.predecessors = new ArrayList<>();
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public List<Node> getContents() {
        return Collections.unmodifiableList(contents);
    }

    @Override
    public List<Edge> getSuccessors() {
        return Collections.unmodifiableList(successors);
    }

    @Override
    public List<Edge> getPredecessors() {
        return Collections.unmodifiableList(predecessors);
    }

    @Override
    public boolean isExit() {
        return successors.isEmpty();
    }

    /** Add an effect at the end of this block. */
    public void addNode(Node n) {
        n.setBlock(this, contents.size());
        contents.add(n);
    }

    /**
     * Connect this block to {@code target} with a new edge.
     *
     * @param target the successor block
     * @param guard the condition under which control flows along the edge, or {@code null}
     * @return the new edge
     */
    public Edge addSuccessor(BlockImpl target, @Nullable Guard guard) {
        Edge edge = new Edge(this, target, guard);
        successors.add(edge);
        target.predecessors.add(edge);
        return edge;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof BlockImpl)) {
            return false;
        }
        BlockImpl other = (BlockImpl) obj;
        return id == other.id && label.equals(other.label);
    }

    @Override
    public String toString() {
        return "Block#" + id + " (" + label + ")";
    }
}
