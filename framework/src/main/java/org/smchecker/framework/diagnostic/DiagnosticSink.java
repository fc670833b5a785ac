package org.smchecker.framework.diagnostic;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the diagnostics of one analysis run. Paths explored in parallel report into the same
 * sink, so reporting is thread-safe and append-only.
 *
 * <p>The same defect is usually reachable along several paths. {@link #getDiagnostics()} reports
 * it once, with the shortest witness path.
 */
public class DiagnosticSink {

    private static final Logger logger = LoggerFactory.getLogger(DiagnosticSink.class);

    private final Queue<Diagnostic> reported = new ConcurrentLinkedQueue<>();

    public void report(Diagnostic diagnostic) {
        logger.debug("reported {}", diagnostic);
        reported.add(diagnostic);
    }

    /** @return the number of reports, counting a defect once per path it was found on */
    public int getReportCount() {
        return reported.size();
    }

    public void clear() {
        reported.clear();
    }

    /**
     * @return one diagnostic per defect, with the shortest (then lexicographically smallest)
     *     witness, sorted by location
     */
    public ImmutableList<Diagnostic> getDiagnostics() {
        List<Diagnostic> all = new ArrayList<>(reported);
        // Sorting puts the best witness of every defect first among its reports.
        Collections.sort(all, Diagnostic.BY_DEFECT_THEN_WITNESS);
        List<Diagnostic> unique = new ArrayList<>();
        @Nullable Diagnostic last = null;
        for (Diagnostic d : all) {
            if (last == null || !last.isSameDefect(d)) {
                unique.add(d);
                last = d;
            }
        }
        Collections.sort(unique);
        return ImmutableList.copyOf(unique);
    }
}
