package org.smchecker.dataflow.analysis;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smchecker.dataflow.cfg.block.Block;

/**
 * The sequence of blocks a path visited so far. Witnesses are persistent lists sharing their
 * prefix with the path they were forked from, so forking is constant time and there is no
 * back-pointer from blocks to paths.
 */
public final class Witness {

    /** Shorter paths first, paths of equal length by their block ids from the entry on. */
    public static final Comparator<Witness> SHORTEST_FIRST =
            (a, b) -> {
                if (a.length != b.length) {
                    return Integer.compare(a.length, b.length);
                }
                ImmutableList<Integer> left = a.toList();
                ImmutableList<Integer> right = b.toList();
                for (int i = 0; i < left.size(); i++) {
                    int c = Integer.compare(left.get(i), right.get(i));
                    if (c != 0) {
                        return c;
                    }
                }
                return 0;
            };

    private final int blockId;
    private final @Nullable Witness previous;
    private final int length;

    private Witness(int blockId, @Nullable Witness previous) {
        this.blockId = blockId;
        this.previous = previous;
        this.length = previous == null ? 1 : previous.length + 1;
    }

    /** A witness of a path that starts at {@code entry}. */
    public static Witness start(Block entry) {
        return new Witness(entry.getId(), null);
    }

    /** The witness of this path extended by {@code next}. */
    public Witness extend(Block next) {
        return new Witness(next.getId(), this);
    }

    /** @return the id of the last block on this path */
    public int getLastBlockId() {
        return blockId;
    }

    /** @return the number of blocks on this path */
    public int length() {
        return length;
    }

    /** @return the block ids of this path, entry first */
    public ImmutableList<Integer> toList() {
        List<Integer> ids = new ArrayList<>(length);
        for (Witness w = this; w != null; w = w.previous) {
            ids.add(w.blockId);
        }
        Collections.reverse(ids);
        return ImmutableList.copyOf(ids);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Integer id : toList()) {
            if (sb.length() > 0) {
                sb.append(" -> ");
            }
            sb.append(id);
        }
        return sb.toString();
    }
}
