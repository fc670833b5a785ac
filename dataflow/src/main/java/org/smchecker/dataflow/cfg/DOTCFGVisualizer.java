package org.smchecker.dataflow.cfg;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.smchecker.dataflow.cfg.block.Block;
import org.smchecker.dataflow.cfg.block.Edge;
import org.smchecker.dataflow.cfg.block.Guard;
import org.smchecker.dataflow.cfg.node.Node;

/**
 * Generate a graph description in the DOT language of a control flow graph. Each block becomes a
 * box listing its effects; each edge is labeled with its guard. A witness path, given as the block
 * ids it visits, can be highlighted.
 */
public class DOTCFGVisualizer {

    protected static final String LEFT_ALIGNED_LINE = "\\l";

    /** Generate the DOT representation of {@code cfg}. */
    public String visualize(ControlFlowGraph cfg) {
        return visualize(cfg, Collections.<Integer>emptyList());
    }

    /**
     * Generate the DOT representation of {@code cfg}, highlighting a path.
     *
     * @param cfg the graph
     * @param path the ids of the blocks on the path to highlight, entry first
     * @return the DOT text
     */
    public String visualize(ControlFlowGraph cfg, List<Integer> path) {
        Set<Integer> onPath = new HashSet<>(path);
        Set<String> pathEdges = new HashSet<>();
        for (int i = 0; i + 1 < path.size(); i++) {
            pathEdges.add(path.get(i) + "->" + path.get(i + 1));
        }

        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(escapeId(cfg.getFunctionName())).append(" {\n");
        sb.append("    node [shape=box];\n");
        for (Block b : cfg.getAllBlocks()) {
            sb.append("    ").append(b.getId()).append(" [label=\"").append(blockLabel(b));
            sb.append('"');
            if (onPath.contains(b.getId())) {
                sb.append(", style=filled, fillcolor=lightgoldenrod");
            }
            if (b.isExit()) {
                sb.append(", peripheries=2");
            }
            sb.append("];\n");
        }
        for (Edge e : cfg.getEdges()) {
            int src = e.getSource().getId();
            int dst = e.getTarget().getId();
            sb.append("    ").append(src).append(" -> ").append(dst);
            Guard guard = e.getGuard();
            sb.append(" [label=\"").append(guard == null ? "" : escape(guard.toString()));
            sb.append('"');
            if (pathEdges.contains(src + "->" + dst)) {
                sb.append(", color=red, penwidth=2");
            }
            sb.append("];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Write the DOT representation of {@code cfg} to {@code outputDir}.
     *
     * @return the file written, named after the function
     */
    public File writeDOT(ControlFlowGraph cfg, List<Integer> path, File outputDir, String suffix)
            throws IOException {
        if (!outputDir.isDirectory() && !outputDir.mkdirs()) {
            throw new IOException("Cannot create output directory: " + outputDir);
        }
        File out = new File(outputDir, cfg.getFunctionName() + suffix + ".dot");
        try (Writer w = Files.newBufferedWriter(out.toPath(), StandardCharsets.UTF_8)) {
            w.write(visualize(cfg, path));
        }
        return out;
    }

    protected String blockLabel(Block b) {
        StringBuilder sb = new StringBuilder();
        sb.append(b.getId()).append(": ").append(escape(b.getLabel())).append(LEFT_ALIGNED_LINE);
        for (Node n : b.getContents()) {
            sb.append(escape(n.toString())).append(LEFT_ALIGNED_LINE);
        }
        return sb.toString();
    }

    protected static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static String escapeId(String s) {
        return "\"" + escape(s) + "\"";
    }
}
