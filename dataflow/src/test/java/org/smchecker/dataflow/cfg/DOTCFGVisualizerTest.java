package org.smchecker.dataflow.cfg;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.smchecker.dataflow.cfg.CFGBuilder.callWith;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class DOTCFGVisualizerTest {

    @Rule public TemporaryFolder tmp = new TemporaryFolder();

    private final ControlFlowGraph cfg =
            new CFGBuilder("release", "p")
                    .block("entry")
                    .block("free", callWith("free", "p"))
                    .block("done")
                    .branch("entry", "p", "free", "done")
                    .jump("free", "done")
                    .build();

    @Test
    public void rendersBlocksEffectsAndGuards() {
        String dot = new DOTCFGVisualizer().visualize(cfg);
        assertThat(dot, containsString("digraph \"release\" {"));
        assertThat(dot, containsString("1 [label=\"1: free\\lfree(p)\\l\"]"));
        assertThat(dot, containsString("2 [label=\"2: done\\l\", peripheries=2]"));
        assertThat(dot, containsString("0 -> 1 [label=\"p\"]"));
        assertThat(dot, containsString("0 -> 2 [label=\"!p\"]"));
        assertThat(dot, not(containsString("color=red")));
    }

    @Test
    public void highlightsAPath() {
        String dot = new DOTCFGVisualizer().visualize(cfg, Arrays.asList(0, 1, 2));
        assertThat(dot, containsString("0 -> 1 [label=\"p\", color=red, penwidth=2]"));
        assertThat(dot, containsString("1 -> 2 [label=\"\", color=red, penwidth=2]"));
        assertThat(dot, containsString("0 -> 2 [label=\"!p\"];"));
        assertThat(dot, containsString("fillcolor=lightgoldenrod"));
    }

    @Test
    public void writesOneFilePerFunction() throws IOException {
        File out =
                new DOTCFGVisualizer()
                        .writeDOT(cfg, Arrays.asList(0, 2), tmp.newFolder("dot"), "_leak");
        assertThat(out.getName(), is("release_leak.dot"));
        String text = new String(Files.readAllBytes(out.toPath()), StandardCharsets.UTF_8);
        assertThat(text, containsString("0 -> 2 [label=\"!p\", color=red, penwidth=2]"));
    }
}
