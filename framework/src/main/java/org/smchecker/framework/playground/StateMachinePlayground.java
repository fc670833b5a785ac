package org.smchecker.framework.playground;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.smchecker.dataflow.analysis.AnalysisOptions;
import org.smchecker.dataflow.cfg.ControlFlowGraph;
import org.smchecker.dataflow.cfg.DOTCFGVisualizer;
import org.smchecker.framework.checker.CheckerResult;
import org.smchecker.framework.checker.malloc.MallocChecker;
import org.smchecker.framework.diagnostic.Diagnostic;

/**
 * Runs the malloc checker on the built-in fixtures, prints what it finds and writes the graphs
 * as DOT files, one per function plus one per diagnostic with the witness path highlighted.
 */
public class StateMachinePlayground {

    /** Main method. */
    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Parse {@code args} and check the selected fixtures.
     *
     * @param args the command line
     * @param out where the results go
     * @return the exit status: 0 on success, 1 on a usage error or a failure to write output
     */
    public static int run(String[] args, PrintStream out) {
        if (args.length < 1) {
            printUsage(out);
            return 1;
        }
        File outputDir = new File(args[0]);
        List<String> fixtures = new ArrayList<>();
        AnalysisOptions.Builder options = AnalysisOptions.builder();
        boolean error = false;

        for (int i = 1; i < args.length; i++) {
            String option = args[i];
            switch (option) {
                case "-fixture":
                    if (i >= args.length - 1) {
                        printError("Did not find <name> after -fixture.");
                        error = true;
                        continue;
                    }
                    i++;
                    if (MallocFixtures.byName(args[i]) == null) {
                        printError("Unknown fixture: " + args[i]);
                        error = true;
                    } else {
                        fixtures.add(args[i]);
                    }
                    break;
                case "-maxPaths":
                case "-maxSteps":
                case "-parallelism":
                    if (i >= args.length - 1) {
                        printError("Did not find <n> after " + option + ".");
                        error = true;
                        continue;
                    }
                    i++;
                    try {
                        setBudget(options, option, Integer.parseInt(args[i]));
                    } catch (IllegalArgumentException e) {
                        printError("Invalid value for " + option + ": " + args[i]);
                        error = true;
                    }
                    break;
                case "-nomerge":
                    options.mergeJoinPoints(false);
                    break;
                default:
                    printError("Unknown command line argument: " + option);
                    error = true;
                    break;
            }
        }

        if (error) {
            printUsage(out);
            return 1;
        }
        if (fixtures.isEmpty()) {
            fixtures.addAll(MallocFixtures.names());
        }

        MallocChecker checker = new MallocChecker(options.build());
        DOTCFGVisualizer viz = new DOTCFGVisualizer();
        for (String name : fixtures) {
            ControlFlowGraph cfg = MallocFixtures.byName(name);
            if (cfg == null) {
                throw new IllegalStateException("Fixture disappeared: " + name);
            }
            CheckerResult result = checker.check(cfg);
            out.println(result);
            try {
                out.println("wrote " + viz.writeDOT(cfg, new ArrayList<Integer>(), outputDir, ""));
                int index = 0;
                for (Diagnostic d : result.getDiagnostics()) {
                    index++;
                    out.println(
                            "wrote " + viz.writeDOT(cfg, d.getWitness(), outputDir, "_" + index));
                }
            } catch (IOException e) {
                printError("Cannot write DOT files to " + outputDir + ": " + e.getMessage());
                return 1;
            }
        }
        return 0;
    }

    private static void setBudget(AnalysisOptions.Builder options, String option, int value) {
        switch (option) {
            case "-maxPaths":
                options.maxPaths(value);
                break;
            case "-maxSteps":
                options.maxStepsPerPath(value);
                break;
            default:
                options.parallelism(value);
                break;
        }
    }

    /**
     * Print error message.
     *
     * @param message error message
     */
    public static void printError(String message) {
        System.err.println("ERROR: " + message);
    }

    /** Print usage information. */
    private static void printUsage(PrintStream out) {
        out.println("Check the malloc fixtures and write their control flow graphs as DOT graphs.");
        out.println(
                "Parameters: <outputdir> [-fixture <name>]... [-maxPaths <n>] [-maxSteps <n>]"
                        + " [-parallelism <n>] [-nomerge]");
        out.println("    -fixture:     One of " + MallocFixtures.names() + " (defaults to all).");
        out.println("    -maxPaths:    The maximum number of paths to explore.");
        out.println("    -maxSteps:    The maximum number of blocks on one path.");
        out.println("    -parallelism: The number of threads exploring paths (defaults to 1).");
        out.println("    -nomerge:     Do not merge equal paths at join blocks.");
    }
}
