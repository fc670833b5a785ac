package org.smchecker.dataflow.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;
import java.util.concurrent.atomic.AtomicLong;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.checkerframework.javacutil.BugInCF;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smchecker.dataflow.cfg.CFGValidator;
import org.smchecker.dataflow.cfg.ControlFlowGraph;
import org.smchecker.dataflow.cfg.block.Block;
import org.smchecker.dataflow.cfg.block.Edge;
import org.smchecker.dataflow.cfg.block.Guard;
import org.smchecker.dataflow.cfg.node.Node;

/**
 * A bounded, path-sensitive forward analysis: symbolic execution of a control flow graph, one
 * store per path.
 *
 * <p>Paths are kept in a worklist of (block, store) items, seeded with the entry block and the
 * transfer function's initial store. Processing an item applies the block's effects in order. At
 * an exit block the path ends and the transfer function's exit hook runs. Otherwise every edge is
 * checked by the {@link FeasibilityChecker}: an edge whose guard contradicts a fact of the path is
 * pruned, and a feasible one gets the guard recorded as a new fact before the successor is
 * queued. A path is never revisited, so its facts only grow.
 *
 * <p>The worklist is ordered by reverse post-order of the blocks, so paths meeting at a join block
 * are usually both pending when the first of them is processed. With {@link
 * AnalysisOptions#isMergeJoinPoints()} such paths are merged when their stores allow it, and a
 * path reaching a block with a store that was already explored there is dropped. Mergeable stores
 * agree on their facts, so the merged path may carry either witness; it keeps the one first in
 * {@link Witness#SHORTEST_FIRST}, which is the one a run without merging would report.
 *
 * <p>Two budgets bound the run: the number of paths started ({@link
 * AnalysisOptions#getMaxPaths()}) and the number of blocks per path ({@link
 * AnalysisOptions#getMaxStepsPerPath()}). Exceeding one cuts off only the offending continuation;
 * the result then reports {@link Coverage#INCOMPLETE}.
 *
 * <p>With a parallelism above 1, continuations are explored as fork/join tasks. Stores are never
 * shared mutably, so the only shared state is the transfer function's output, the truncation list
 * and the counters. Join merging is not done in that mode.
 *
 * @param <S> the store type used in the analysis
 * @param <T> the transfer function type that is used to approximate runtime behavior
 */
public class PathSensitiveAnalysis<S extends PathStore<S>, T extends PathTransferFunction<S>>
        implements Analysis<S, T> {

    private static final Logger logger = LoggerFactory.getLogger(PathSensitiveAnalysis.class);

    /** The transfer function for regular nodes. */
    protected final T transferFunction;

    protected final AnalysisOptions options;

    protected final FeasibilityChecker feasibilityChecker;

    /** Is the analysis currently running? */
    protected volatile boolean isRunning = false;

    /** The result of the last completed run. */
    protected @Nullable AnalysisResult<S> result;

    /** The graph being analyzed. */
    protected @Nullable ControlFlowGraph cfg;

    /** Reverse post-order of the blocks of {@link #cfg}. */
    protected Map<Block, Integer> depthFirstOrder = Collections.emptyMap();

    protected final Queue<S> exitStores = new ConcurrentLinkedQueue<>();

    protected final Queue<Truncation> truncations = new ConcurrentLinkedQueue<>();

    protected ExplorationStatistics.Counters counters = new ExplorationStatistics.Counters();

    private final AtomicLong sequence = new AtomicLong();

    /**
     * Construct an object that can perform a path-sensitive analysis over a control flow graph.
     *
     * @param transfer the transfer function
     * @param options the budgets and switches of the exploration
     */
    public PathSensitiveAnalysis(T transfer, AnalysisOptions options) {
        this(transfer, options, new FeasibilityChecker());
    }

    public PathSensitiveAnalysis(
            T transfer, AnalysisOptions options, FeasibilityChecker feasibilityChecker) {
        this.transferFunction = transfer;
        this.options = options;
        this.feasibilityChecker = feasibilityChecker;
    }

    @Override
    public void performAnalysis(ControlFlowGraph cfg) {
        if (isRunning) {
            throw new BugInCF(
                    "PathSensitiveAnalysis::performAnalysis() shouldn't be called when the analysis"
                            + " is running.");
        }
        CFGValidator.validate(cfg);

        isRunning = true;
        try {
            initFields(cfg);
            Block entry = cfg.getEntryBlock();
            if (entry == null) {
                throw new BugInCF("validated graph " + cfg.getFunctionName() + " has no entry");
            }
            PathItem<S> initial =
                    new PathItem<>(
                            entry,
                            transferFunction.initialStore(cfg),
                            Witness.start(entry),
                            sequence.getAndIncrement());
            counters.pathsStarted.incrementAndGet();

            if (options.getParallelism() > 1) {
                exploreInParallel(initial);
            } else {
                exploreSequentially(initial);
            }

            result =
                    new AnalysisResult<>(
                            new ArrayList<>(exitStores),
                            new ArrayList<>(truncations),
                            counters.snapshot());
            if (result.isComplete()) {
                logger.info("{}: {}", cfg.getFunctionName(), result.getStatistics());
            } else {
                logger.warn(
                        "{}: analysis incomplete, {} continuation(s) truncated ({})",
                        cfg.getFunctionName(),
                        truncations.size(),
                        result.getStatistics());
            }
        } finally {
            isRunning = false;
        }
    }

    /** Reset the per-run state. */
    protected void initFields(ControlFlowGraph cfg) {
        this.cfg = cfg;
        this.depthFirstOrder = cfg.getDepthFirstOrder();
        this.result = null;
        this.exitStores.clear();
        this.truncations.clear();
        this.counters = new ExplorationStatistics.Counters();
        this.sequence.set(0);
    }

    /** Worklist exploration on the calling thread, merging paths at join blocks. */
    protected void exploreSequentially(PathItem<S> initial) {
        PriorityQueue<PathItem<S>> worklist = new PriorityQueue<>(11, itemOrder());
        Map<Block, List<PathItem<S>>> pending = new HashMap<>();
        Map<Block, Set<S>> explored = new HashMap<>();

        addToWorklist(initial, worklist, pending, explored);
        while (!worklist.isEmpty()) {
            PathItem<S> item = worklist.poll();
            List<PathItem<S>> sameBlock = pending.get(item.block);
            if (sameBlock != null) {
                sameBlock.remove(item);
            }
            if (options.isMergeJoinPoints()) {
                explored.computeIfAbsent(item.block, b -> new HashSet<>()).add(item.store);
            }
            for (PathItem<S> next : explore(item)) {
                addToWorklist(next, worklist, pending, explored);
            }
        }
    }

    /**
     * Queue {@code item}, unless it can be merged into a pending path at the same block or its
     * store was already explored there.
     */
    protected void addToWorklist(
            PathItem<S> item,
            PriorityQueue<PathItem<S>> worklist,
            Map<Block, List<PathItem<S>>> pending,
            Map<Block, Set<S>> explored) {
        if (options.isMergeJoinPoints()) {
            Set<S> seen = explored.get(item.block);
            if (seen != null && seen.contains(item.store)) {
                counters.merges.incrementAndGet();
                logger.debug(
                        "{}: dropped path {}, store already explored", item.block, item.witness);
                return;
            }
            List<PathItem<S>> sameBlock = pending.get(item.block);
            if (sameBlock != null) {
                for (PathItem<S> other : sameBlock) {
                    if (other.store.isMergeableWith(item.store)) {
                        other.store = other.store.merge(item.store);
                        counters.merges.incrementAndGet();
                        logger.debug(
                                "{}: merged path {} into {}",
                                item.block,
                                item.witness,
                                other.witness);
                        if (Witness.SHORTEST_FIRST.compare(item.witness, other.witness) < 0) {
                            other.witness = item.witness;
                        }
                        return;
                    }
                }
            }
            pending.computeIfAbsent(item.block, b -> new ArrayList<>()).add(item);
        }
        worklist.add(item);
    }

    /** Fork/join exploration; every fork becomes a separate task. */
    protected void exploreInParallel(PathItem<S> initial) {
        ForkJoinPool pool = new ForkJoinPool(options.getParallelism());
        try {
            pool.invoke(new ExploreTask(initial));
        } finally {
            pool.shutdown();
        }
    }

    /** Explores one path until it ends or forks. */
    private final class ExploreTask extends RecursiveAction {

        private static final long serialVersionUID = 1L;

        private final PathItem<S> item;

        ExploreTask(PathItem<S> item) {
            this.item = item;
        }

        @Override
        protected void compute() {
            PathItem<S> current = item;
            while (current != null) {
                List<PathItem<S>> next = explore(current);
                if (next.size() == 1) {
                    current = next.get(0);
                    continue;
                }
                List<ExploreTask> tasks = new ArrayList<>(next.size());
                for (PathItem<S> n : next) {
                    tasks.add(new ExploreTask(n));
                }
                invokeAll(tasks);
                current = null;
            }
        }
    }

    /**
     * Process one worklist item: run the effects of its block and compute the feasible
     * continuations.
     *
     * @param item the path to advance
     * @return the items for the successors to explore, empty if the path ended here
     */
    protected List<PathItem<S>> explore(PathItem<S> item) {
        Block block = item.block;
        Witness witness = item.witness;
        if (witness.length() > options.getMaxStepsPerPath()) {
            truncate(Truncation.Reason.STEP_BUDGET, block, witness);
            return Collections.emptyList();
        }

        S store = item.store;
        for (Node n : block.getContents()) {
            store = n.accept(transferFunction, new TransferInput<>(store, block, witness));
        }

        if (block.isExit()) {
            transferFunction.visitExit(new TransferInput<>(store, block, witness));
            exitStores.add(store);
            counters.pathsCompleted.incrementAndGet();
            return Collections.emptyList();
        }

        List<PathItem<S>> successors = new ArrayList<>(2);
        for (Edge edge : block.getSuccessors()) {
            Block target = edge.getTarget();
            S next = store;
            Guard guard = edge.getGuard();
            if (guard != null) {
                ConditionKey key = store.conditionKey(guard.getVariable());
                if (!feasibilityChecker.isFeasible(store.getFacts(), key, guard)) {
                    counters.edgesPruned.incrementAndGet();
                    logger.debug(
                            "{}: pruned infeasible edge {} on path {}, {} is {}",
                            cfgName(),
                            edge,
                            witness,
                            key,
                            store.getFacts().get(key));
                    continue;
                }
                next = store.withFacts(store.getFacts().with(key, guard.getValue()));
                next = transferFunction.visitEdge(edge, new TransferInput<>(next, block, witness));
            }
            // The first feasible successor continues this path; any other one starts a new path.
            if (!successors.isEmpty() && !claimPath()) {
                truncate(Truncation.Reason.PATH_BUDGET, target, witness.extend(target));
                continue;
            }
            successors.add(
                    new PathItem<>(
                            target, next, witness.extend(target), sequence.getAndIncrement()));
        }
        return successors;
    }

    /** Take one path from the budget; false if the budget is exhausted. */
    private boolean claimPath() {
        if (counters.pathsStarted.incrementAndGet() <= options.getMaxPaths()) {
            return true;
        }
        counters.pathsStarted.decrementAndGet();
        return false;
    }

    private void truncate(Truncation.Reason reason, Block block, Witness witness) {
        Truncation t = new Truncation(reason, block.getId(), witness.toList());
        truncations.add(t);
        counters.truncations.incrementAndGet();
        logger.warn("{}: exploration truncated, {}", cfgName(), t);
    }

    private String cfgName() {
        return cfg == null ? "<none>" : cfg.getFunctionName();
    }

    private Comparator<PathItem<S>> itemOrder() {
        return Comparator.<PathItem<S>>comparingInt(
                        i -> depthFirstOrder.getOrDefault(i.block, Integer.MAX_VALUE))
                .thenComparingLong(i -> i.sequence);
    }

    @Override
    public boolean isRunning() {
        return isRunning;
    }

    @Override
    public AnalysisResult<S> getResult() {
        if (isRunning || result == null) {
            throw new BugInCF(
                    "PathSensitiveAnalysis::getResult() called before the analysis finished.");
        }
        return result;
    }

    @Override
    public T getTransferFunction() {
        return transferFunction;
    }

    @Override
    public AnalysisOptions getOptions() {
        return options;
    }

    /**
     * A path waiting in the worklist. Only the store and the witness change, when another path
     * merges in.
     */
    protected static final class PathItem<S> {
        final Block block;
        S store;
        Witness witness;
        final long sequence;

        PathItem(Block block, S store, Witness witness, long sequence) {
            this.block = block;
            this.store = store;
            this.witness = witness;
            this.sequence = sequence;
        }

        @Override
        public String toString() {
            return "PathItem(" + block + ", path " + witness + ")";
        }
    }
}
