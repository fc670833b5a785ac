package org.smchecker.dataflow.cfg.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * A node for a call to a named function:
 *
 * <pre>
 *   <em>function</em>(<em>arg1</em>, <em>arg2</em>, ...)
 * </pre>
 *
 * A call either stands alone as an effect of a block, or is the right-hand side of an {@link
 * AssignmentNode}.
 */
public class CallNode extends Node {

    protected final String functionName;
    protected final List<Node> arguments;

    public CallNode(String functionName, List<Node> arguments) {
        this.functionName = Objects.requireNonNull(functionName, "functionName");
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public String getFunctionName() {
        return functionName;
    }

    public List<Node> getArguments() {
        return arguments;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P p) {
        return visitor.visitCall(this, p);
    }

    @Override
    public Collection<Node> getOperands() {
        return arguments;
    }

    @Override
    public String toString() {
        StringJoiner args = new StringJoiner(", ", functionName + "(", ")");
        for (Node arg : arguments) {
            args.add(arg.toString());
        }
        return args.toString();
    }
}
