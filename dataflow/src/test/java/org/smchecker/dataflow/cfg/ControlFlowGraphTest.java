package org.smchecker.dataflow.cfg;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;
import static org.smchecker.dataflow.cfg.CFGBuilder.assign;
import static org.smchecker.dataflow.cfg.CFGBuilder.call;
import static org.smchecker.dataflow.cfg.CFGBuilder.literal;

import java.util.Map;
import org.checkerframework.javacutil.BugInCF;
import org.junit.Test;
import org.smchecker.dataflow.cfg.block.Block;
import org.smchecker.dataflow.cfg.node.Node;

public class ControlFlowGraphTest {

    private final ControlFlowGraph loop =
            new CFGBuilder("loop", "i")
                    .block("entry", assign("p", call("malloc", literal("8"))))
                    .block("head")
                    .block("body", assign("i", call("next")))
                    .block("out")
                    .jump("entry", "head")
                    .branch("head", "i", "body", "out")
                    .jump("body", "head")
                    .build();

    @Test
    public void blocksAreNumberedInInsertionOrder() {
        assertThat(loop.getEntryBlock(), is(loop.getBlock(0)));
        assertThat(loop.getBlock("body").getId(), is(2));
        assertThat(loop.getBlock("nothing"), is(nullValue()));
        assertThat(loop.getExitBlocks(), contains(loop.getBlock(3)));
        assertThat(loop.getEdges().size(), is(4));
        assertThat(loop.getBlock("head").getPredecessors().size(), is(2));
    }

    @Test
    public void assignedVariables() {
        assertThat(loop.getAssignedVariables(), contains("p", "i"));
    }

    @Test
    public void depthFirstOrderPutsBlocksBeforeTheirSuccessors() {
        Map<Block, Integer> order = loop.getDepthFirstOrder();
        assertThat(order.size(), is(4));
        assertThat(order.get(loop.getBlock("entry")), is(0));
        assertThat(order.get(loop.getBlock("head")), is(1));
        assertThat(order.get(loop.getBlock("head")), lessThan(order.get(loop.getBlock("body"))));
        assertThat(order.get(loop.getBlock("out")), greaterThan(order.get(loop.getBlock("head"))));
        assertThat(loop.getDepthFirstOrder(), is(order));
    }

    @Test(expected = IllegalStateException.class)
    public void aBuilderBuildsOnlyOnce() {
        CFGBuilder builder = new CFGBuilder("once").block("entry");
        builder.build();
        builder.build();
    }

    @Test
    public void anEffectBelongsToOneBlockOnly() {
        Node shared = call("f");
        CFGBuilder builder = new CFGBuilder("shared").block("first", shared);
        try {
            builder.block("second", shared);
            fail("expected BugInCF");
        } catch (BugInCF e) {
            assertThat(e.getMessage().contains("already at index 0"), is(true));
        }
        assertThat(shared.getIndex(), is(0));
        assertThat(shared.getBlock().getLabel(), is("first"));
    }
}
