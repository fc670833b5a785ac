package org.smchecker.dataflow.cfg;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.fail;
import static org.smchecker.dataflow.cfg.CFGBuilder.assign;
import static org.smchecker.dataflow.cfg.CFGBuilder.call;
import static org.smchecker.dataflow.cfg.CFGBuilder.ret;

import org.junit.Test;
import org.smchecker.dataflow.cfg.block.Guard;

public class CFGValidatorTest {

    private static void assertRejected(ControlFlowGraph cfg, String message) {
        try {
            CFGValidator.validate(cfg);
            fail("expected MalformedCFGException for " + cfg);
        } catch (MalformedCFGException e) {
            assertThat(e.getMessage(), containsString(message));
        }
    }

    @Test
    public void acceptsAWellFormedBranch() {
        CFGValidator.validate(
                new CFGBuilder("ok")
                        .block("entry", assign("p", call("malloc")))
                        .block("a")
                        .block("b", ret())
                        .branch("entry", "p", "a", "b")
                        .jump("a", "b")
                        .build());
    }

    @Test
    public void rejectsAnEmptyGraph() {
        assertRejected(new CFGBuilder("empty").build(), "no entry block");
    }

    @Test
    public void rejectsSeveralEntries() {
        assertRejected(
                new CFGBuilder("two").block("a").block("b").alsoEntry("b").build(),
                "2 entry blocks");
    }

    @Test
    public void rejectsUnreachableBlocks() {
        assertRejected(
                new CFGBuilder("dead").block("entry").block("dead").build(), "not reachable");
    }

    @Test
    public void rejectsGraphsWithoutExit() {
        assertRejected(
                new CFGBuilder("spin").block("a").block("b").jump("a", "b").jump("b", "a").build(),
                "no exit block");
    }

    @Test
    public void rejectsEffectsAfterReturn() {
        assertRejected(
                new CFGBuilder("late").block("entry", ret(), call("f")).build(),
                "followed by further effects");
    }

    @Test
    public void rejectsGuardsOnUnknownVariables() {
        assertRejected(
                new CFGBuilder("unknown")
                        .block("entry")
                        .block("a")
                        .block("b")
                        .branch("entry", "ghost", "a", "b")
                        .build(),
                "neither a parameter nor assigned");
    }

    @Test
    public void rejectsAGuardedSingleSuccessor() {
        assertRejected(
                new CFGBuilder("half", "flag")
                        .block("entry")
                        .block("a")
                        .edge("entry", "a", Guard.isTrue("flag"))
                        .build(),
                "must not be guarded");
    }

    @Test
    public void rejectsBranchesWithoutComplementaryGuards() {
        assertRejected(
                new CFGBuilder("same", "flag")
                        .block("entry")
                        .block("a")
                        .block("b")
                        .edge("entry", "a", Guard.isTrue("flag"))
                        .edge("entry", "b", Guard.isTrue("flag"))
                        .build(),
                "complementary guards");
        assertRejected(
                new CFGBuilder("split", "x", "y")
                        .block("entry")
                        .block("a")
                        .block("b")
                        .edge("entry", "a", Guard.isTrue("x"))
                        .edge("entry", "b", Guard.isFalse("y"))
                        .build(),
                "complementary guards");
    }

    @Test
    public void rejectsMoreThanTwoSuccessors() {
        assertRejected(
                new CFGBuilder("fan")
                        .block("entry")
                        .block("a")
                        .block("b")
                        .block("c")
                        .jump("entry", "a")
                        .jump("entry", "b")
                        .jump("entry", "c")
                        .build(),
                "at most two");
    }

    @Test
    public void builderRejectsDuplicateAndUnknownLabels() {
        try {
            new CFGBuilder("dup").block("a").block("a");
            fail("expected MalformedCFGException");
        } catch (MalformedCFGException e) {
            assertThat(e.getMessage(), containsString("duplicate block label 'a'"));
        }
        try {
            new CFGBuilder("missing").block("a").jump("a", "nowhere");
            fail("expected MalformedCFGException");
        } catch (MalformedCFGException e) {
            assertThat(e.getMessage(), containsString("'nowhere'"));
        }
    }
}
