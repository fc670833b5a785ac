package org.smchecker.framework.diagnostic;

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smchecker.framework.flow.TrackedValue;

/**
 * A defect found on a feasible path: a tracked value entered a bad state of a state machine.
 *
 * <p>The witness path is the list of block ids the path visited, entry first, ending in the block
 * where the defect happened.
 */
public final class Diagnostic implements Comparable<Diagnostic> {

    /** Shorter paths first; paths of equal length by their first differing block id. */
    static final Comparator<ImmutableList<Integer>> WITNESS_ORDER =
            (a, b) -> {
                if (a.size() != b.size()) {
                    return Integer.compare(a.size(), b.size());
                }
                for (int i = 0; i < a.size(); i++) {
                    int c = Integer.compare(a.get(i), b.get(i));
                    if (c != 0) {
                        return c;
                    }
                }
                return 0;
            };

    /** Groups the reports of one defect together, best witness first. */
    static final Comparator<Diagnostic> BY_DEFECT_THEN_WITNESS =
            Comparator.comparing(Diagnostic::getMachine)
                    .thenComparing(Diagnostic::getValue)
                    .thenComparing(Diagnostic::getBadState)
                    .thenComparing(Diagnostic::getLocation)
                    .thenComparing(Diagnostic::getWitness, WITNESS_ORDER)
                    .thenComparing(Diagnostic::getVariable);

    /** The order diagnostics are presented in: by block, then location, then defect. */
    private static final Comparator<Diagnostic> ORDER =
            Comparator.comparingInt(Diagnostic::getBlockId)
                    .thenComparing(Diagnostic::getLocation)
                    .thenComparing(BY_DEFECT_THEN_WITNESS);

    private final String machine;
    private final String variable;
    private final TrackedValue value;
    private final String badState;
    private final String location;
    private final int blockId;
    private final ImmutableList<Integer> witness;

    public Diagnostic(
            String machine,
            String variable,
            TrackedValue value,
            String badState,
            String location,
            int blockId,
            ImmutableList<Integer> witness) {
        this.machine = machine;
        this.variable = variable;
        this.value = value;
        this.badState = badState;
        this.location = location;
        this.blockId = blockId;
        this.witness = witness;
    }

    /** @return the name of the state machine that reported this diagnostic */
    public String getMachine() {
        return machine;
    }

    /** @return the variable through which the defect happened */
    public String getVariable() {
        return variable;
    }

    public TrackedValue getValue() {
        return value;
    }

    /** @return the name of the bad state the value entered */
    public String getBadState() {
        return badState;
    }

    /** @return the effect that caused the defect, or the exit the value leaked at */
    public String getLocation() {
        return location;
    }

    public int getBlockId() {
        return blockId;
    }

    public ImmutableList<Integer> getWitness() {
        return witness;
    }

    /**
     * Whether this diagnostic and {@code other} report the same defect, possibly along different
     * paths.
     */
    public boolean isSameDefect(Diagnostic other) {
        return machine.equals(other.machine)
                && value.equals(other.value)
                && badState.equals(other.badState)
                && location.equals(other.location);
    }

    @Override
    public int compareTo(Diagnostic o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof Diagnostic)) {
            return false;
        }
        Diagnostic other = (Diagnostic) obj;
        return isSameDefect(other)
                && variable.equals(other.variable)
                && blockId == other.blockId
                && witness.equals(other.witness);
    }

    @Override
    public int hashCode() {
        return Objects.hash(machine, value, badState, location);
    }

    @Override
    public String toString() {
        StringBuilder path = new StringBuilder();
        for (Integer id : witness) {
            if (path.length() > 0) {
                path.append(" -> ");
            }
            path.append(id);
        }
        return machine
                + ": "
                + badState
                + " of '"
                + variable
                + "' at "
                + location
                + " [path: "
                + path
                + "]";
    }
}
