package org.smchecker.framework.diagnostic;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.smchecker.framework.flow.TrackedValue;

public class DiagnosticSinkTest {

    private static final TrackedValue P = new TrackedValue("p", 0, 0, 0);
    private static final TrackedValue Q = new TrackedValue("q", 0, 1, 0);

    private static Diagnostic leak(TrackedValue value, int blockId, Integer... path) {
        return new Diagnostic(
                "malloc",
                value.getVariable(),
                value,
                "leak",
                "exit of block " + blockId,
                blockId,
                ImmutableList.copyOf(path));
    }

    @Test
    public void aDefectIsReportedOnceWithItsShortestPath() {
        DiagnosticSink sink = new DiagnosticSink();
        sink.report(leak(P, 9, 0, 2, 5, 9));
        sink.report(leak(P, 9, 0, 3, 9));
        sink.report(leak(P, 9, 0, 1, 9));

        assertThat(sink.getReportCount(), is(3));
        assertThat(sink.getDiagnostics(), contains(leak(P, 9, 0, 1, 9)));
    }

    @Test
    public void differentDefectsAreKeptAndSorted() {
        DiagnosticSink sink = new DiagnosticSink();
        sink.report(leak(Q, 9, 0, 9));
        sink.report(leak(P, 7, 0, 7));
        sink.report(leak(P, 9, 0, 9));

        assertThat(
                sink.getDiagnostics(),
                contains(leak(P, 7, 0, 7), leak(P, 9, 0, 9), leak(Q, 9, 0, 9)));
    }

    @Test
    public void concurrentReportsAreAllCollected() throws InterruptedException {
        final DiagnosticSink sink = new DiagnosticSink();
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            final int block = t;
            Thread thread =
                    new Thread(
                            () -> {
                                for (int i = 0; i < 250; i++) {
                                    sink.report(leak(P, block, 0, block));
                                }
                            });
            threads.add(thread);
            thread.start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        assertThat(sink.getReportCount(), is(1000));
        assertThat(sink.getDiagnostics().size(), is(4));
    }

    @Test
    public void formatting() {
        assertThat(
                leak(P, 3, 0, 2, 3).toString(),
                is("malloc: leak of 'p' at exit of block 3 [path: 0 -> 2 -> 3]"));
    }
}
