package org.smchecker.framework.checker.malloc;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.is;
import static org.smchecker.dataflow.cfg.CFGBuilder.assign;
import static org.smchecker.dataflow.cfg.CFGBuilder.call;
import static org.smchecker.dataflow.cfg.CFGBuilder.callWith;
import static org.smchecker.dataflow.cfg.CFGBuilder.literal;
import static org.smchecker.dataflow.cfg.CFGBuilder.ret;
import static org.smchecker.framework.matchers.DiagnosticPattern.diagnostic;
import static org.smchecker.framework.matchers.ResultContainsExactly.containsExactly;
import static org.smchecker.framework.matchers.ResultIsClean.isClean;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import org.smchecker.dataflow.analysis.AnalysisOptions;
import org.smchecker.dataflow.cfg.CFGBuilder;
import org.smchecker.dataflow.cfg.ControlFlowGraph;
import org.smchecker.dataflow.cfg.block.Edge;
import org.smchecker.dataflow.cfg.block.Guard;
import org.smchecker.framework.checker.CheckerResult;
import org.smchecker.framework.diagnostic.Diagnostic;
import org.smchecker.framework.flow.ProgramState;
import org.smchecker.framework.flow.TrackedValue;
import org.smchecker.framework.playground.MallocFixtures;
import org.smchecker.framework.statemachine.State;

/** Allocation and release correlated through the same branch condition. */
public class ImpossibleErrorTest {

    @Test
    public void correlatedAllocationAndReleaseAreNotReported() {
        CheckerResult result = new MallocChecker().check(MallocFixtures.impossibleError());

        assertThat(result, isClean());
        // flag is true on one side and false on the other of the second branch.
        assertThat(result.getStatistics().getEdgesPruned(), is(2));
    }

    @Test
    public void everyFeasiblePathEndsInTheExpectedState() {
        CheckerResult result = new MallocChecker().check(MallocFixtures.impossibleError());

        List<String> endStates = new ArrayList<>();
        for (ProgramState s : result.getAnalysisResult().getExitStores()) {
            StringBuilder sb = new StringBuilder();
            for (TrackedValue v : s.getTrackedValues()) {
                State state = s.getState(MallocStateMachine.NAME, v);
                sb.append(v).append('=').append(state);
            }
            endStates.add(sb.toString());
        }
        // Allocation failed; allocated and freed; never allocated.
        assertThat(endStates, containsInAnyOrder("ptr@1.0=null", "ptr@1.0=freed", ""));
    }

    @Test
    public void repeatedRunsGiveIdenticalResults() {
        MallocChecker checker = new MallocChecker();
        CheckerResult first = checker.check(MallocFixtures.impossibleError());
        CheckerResult second = checker.check(MallocFixtures.impossibleError());

        assertThat(second.getDiagnostics(), is(first.getDiagnostics()));
        assertThat(
                second.getStatistics().toString(), is(first.getStatistics().toString()));
    }

    @Test
    public void parallelExplorationIsAlsoClean() {
        CheckerResult result =
                new MallocChecker(AnalysisOptions.builder().parallelism(4).build())
                        .check(MallocFixtures.impossibleError());
        assertThat(result, isClean());
    }

    @Test
    public void explorationWithoutMergingIsAlsoClean() {
        CheckerResult result =
                new MallocChecker(AnalysisOptions.builder().mergeJoinPoints(false).build())
                        .check(MallocFixtures.impossibleError());
        assertThat(result, isClean());
    }

    @Test
    public void uncorrelatedConditionsLeak() {
        // Same shape, but the release depends on another input.
        ControlFlowGraph cfg =
                new CFGBuilder("test", "flag", "other")
                        .block("entry")
                        .block("alloc", assign("ptr", call("malloc", literal("1024"))))
                        .block("alloc_failed", ret())
                        .block("checked", call("marker_A"))
                        .block("join", call("marker_B"))
                        .block("release", call("marker_C"), callWith("free", "ptr"))
                        .block("done", call("marker_D"), ret())
                        .block("exit")
                        .branch("entry", "flag", "alloc", "join")
                        .branch("alloc", "ptr", "checked", "alloc_failed")
                        .jump("alloc_failed", "exit")
                        .jump("checked", "join")
                        .branch("join", "other", "release", "done")
                        .jump("release", "done")
                        .jump("done", "exit")
                        .build();

        CheckerResult result = new MallocChecker().check(cfg);
        assertThat(result, containsExactly(diagnostic("leak", "ptr")));
        assertThat(
                result.getDiagnostics().get(0).getWitness(),
                is(ImmutableList.of(0, 1, 3, 4, 6, 7)));
    }

    /**
     * <pre>
     * if (flag) a(); else b();
     * if (flag) { p = malloc(8); if (!p) return; use(p); }
     * </pre>
     */
    private static ControlFlowGraph retestedCondition() {
        return new CFGBuilder("retested", "flag")
                .block("entry")
                .block("a", call("a"))
                .block("b", call("b"))
                .block("join")
                .block("alloc", assign("p", call("malloc", literal("8"))))
                .block("use", callWith("use", "p"))
                .block("failed", ret())
                .block("exit")
                .branch("entry", "flag", "a", "b")
                .jump("a", "join")
                .jump("b", "join")
                .branch("join", "flag", "alloc", "exit")
                .branch("alloc", "p", "use", "failed")
                .jump("use", "exit")
                .jump("failed", "exit")
                .build();
    }

    /** Whether a witness takes contradicting edges on any parameter of {@code cfg}. */
    private static boolean takesConsistentGuards(ControlFlowGraph cfg, List<Integer> witness) {
        Map<String, Boolean> taken = new HashMap<>();
        for (int i = 0; i + 1 < witness.size(); i++) {
            for (Edge e : cfg.getBlock(witness.get(i)).getSuccessors()) {
                Guard g = e.getGuard();
                if (e.getTarget().getId() != witness.get(i + 1)
                        || g == null
                        || !cfg.getParameters().contains(g.getVariable())) {
                    continue;
                }
                Boolean before = taken.put(g.getVariable(), g.getValue());
                if (before != null && before != g.getValue()) {
                    return false;
                }
            }
        }
        return true;
    }

    @Test
    public void aConditionRetestedAfterAJoinKeepsWitnessesFeasible() {
        ControlFlowGraph cfg = retestedCondition();
        CheckerResult sequential = new MallocChecker().check(cfg);
        CheckerResult parallel =
                new MallocChecker(AnalysisOptions.builder().parallelism(4).build()).check(cfg);

        assertThat(sequential, containsExactly(diagnostic("leak", "p")));
        assertThat(
                sequential.getDiagnostics().get(0).getWitness(),
                is(ImmutableList.of(0, 1, 3, 4, 5, 7)));
        assertThat(parallel.getDiagnostics(), is(sequential.getDiagnostics()));
        for (Diagnostic d : sequential.getDiagnostics()) {
            assertThat(d.toString(), takesConsistentGuards(cfg, d.getWitness()), is(true));
        }
        assertThat(sequential.getStatistics().getEdgesPruned(), is(2));
    }
}
