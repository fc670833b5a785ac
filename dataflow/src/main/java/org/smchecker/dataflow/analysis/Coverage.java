package org.smchecker.dataflow.analysis;

/** Whether an analysis run explored every feasible path. */
public enum Coverage {
    /** Every feasible path was explored to an exit block. */
    COMPLETE,
    /**
     * Some paths were cut off by a budget. An empty diagnostic list does not mean the function is
     * free of defects.
     */
    INCOMPLETE
}
