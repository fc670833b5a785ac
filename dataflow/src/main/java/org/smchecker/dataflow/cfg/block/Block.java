package org.smchecker.dataflow.cfg.block;

import java.util.List;
import org.smchecker.dataflow.cfg.node.Node;

/**
 * Represents a basic block in a control flow graph: a straight-line sequence of effects followed
 * by zero, one or two outgoing edges. A block without successors is an exit block.
 */
public interface Block {

    /** @return the unique identifier of this block, dense from 0 in creation order */
    int getId();

    /** @return a human readable label, unique within its graph */
    String getLabel();

    /** @return the effects of this block, in execution order */
    List<Node> getContents();

    /** @return the outgoing edges of this block, in declaration order (then before else) */
    List<Edge> getSuccessors();

    /** @return the incoming edges of this block */
    List<Edge> getPredecessors();

    /** @return true if this block has no outgoing edges */
    boolean isExit();
}
