package org.smchecker.framework.playground;

import static org.smchecker.dataflow.cfg.CFGBuilder.assign;
import static org.smchecker.dataflow.cfg.CFGBuilder.call;
import static org.smchecker.dataflow.cfg.CFGBuilder.callWith;
import static org.smchecker.dataflow.cfg.CFGBuilder.literal;
import static org.smchecker.dataflow.cfg.CFGBuilder.ret;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.smchecker.dataflow.cfg.CFGBuilder;
import org.smchecker.dataflow.cfg.ControlFlowGraph;

/** Small functions exercising the malloc checker, as a front end would hand them over. */
public final class MallocFixtures {

    public static final String IMPOSSIBLE_ERROR = "impossible-error";
    public static final String DOUBLE_FREE = "double-free";
    public static final String LEAK = "leak";
    public static final String REASSIGNMENT_LEAK = "reassignment-leak";

    private MallocFixtures() {
        throw new AssertionError("Class MallocFixtures cannot be instantiated.");
    }

    /** @return the names accepted by {@link #byName(String)} */
    public static ImmutableList<String> names() {
        return ImmutableList.of(IMPOSSIBLE_ERROR, DOUBLE_FREE, LEAK, REASSIGNMENT_LEAK);
    }

    /** @return a fresh graph of the named fixture, or {@code null} for an unknown name */
    public static @Nullable ControlFlowGraph byName(String name) {
        switch (name) {
            case IMPOSSIBLE_ERROR:
                return impossibleError();
            case DOUBLE_FREE:
                return doubleFree();
            case LEAK:
                return leak();
            case REASSIGNMENT_LEAK:
                return reassignmentLeak();
            default:
                return null;
        }
    }

    /**
     * Allocation and release guarded by the same condition. Every path that frees {@code ptr} also
     * allocated and checked it, so there is nothing to report.
     *
     * <pre>
     * void test(int flag) {
     *     void *ptr;
     *     if (flag) {
     *         ptr = malloc(1024);
     *         if (!ptr) {
     *             return;
     *         }
     *         marker_A();
     *     }
     *     marker_B();
     *     if (flag) {
     *         marker_C();
     *         free(ptr);
     *     }
     *     marker_D();
     * }
     * </pre>
     */
    public static ControlFlowGraph impossibleError() {
        return new CFGBuilder("test", "flag")
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
                .branch("join", "flag", "release", "done")
                .jump("release", "done")
                .jump("done", "exit")
                .build();
    }

    /**
     * <pre>
     * void double_free(void) {
     *     void *p = malloc(16);
     *     if (!p) return;
     *     free(p);
     *     free(p);
     * }
     * </pre>
     */
    public static ControlFlowGraph doubleFree() {
        return new CFGBuilder("double_free")
                .block("entry", assign("p", call("malloc", literal("16"))))
                .block("alloc_failed", ret())
                .block("release", callWith("free", "p"), callWith("free", "p"))
                .block("exit")
                .branch("entry", "p", "release", "alloc_failed")
                .jump("alloc_failed", "exit")
                .jump("release", "exit")
                .build();
    }

    /**
     * <pre>
     * void leak(void) {
     *     void *p = malloc(16);
     *     if (!p) return;
     *     use(p);
     * }
     * </pre>
     */
    public static ControlFlowGraph leak() {
        return new CFGBuilder("leak")
                .block("entry", assign("p", call("malloc", literal("16"))))
                .block("alloc_failed", ret())
                .block("use", callWith("use", "p"))
                .block("exit")
                .branch("entry", "p", "use", "alloc_failed")
                .jump("alloc_failed", "exit")
                .jump("use", "exit")
                .build();
    }

    /**
     * The first allocation is lost when {@code p} is reassigned.
     *
     * <pre>
     * void reassignment_leak(void) {
     *     void *p = malloc(16);
     *     if (!p) return;
     *     p = malloc(32);
     *     if (!p) return;
     *     free(p);
     * }
     * </pre>
     */
    public static ControlFlowGraph reassignmentLeak() {
        return new CFGBuilder("reassignment_leak")
                .block("entry", assign("p", call("malloc", literal("16"))))
                .block("first_failed", ret())
                .block("realloc", assign("p", call("malloc", literal("32"))))
                .block("second_failed", ret())
                .block("release", callWith("free", "p"))
                .block("exit")
                .branch("entry", "p", "realloc", "first_failed")
                .jump("first_failed", "exit")
                .branch("realloc", "p", "release", "second_failed")
                .jump("second_failed", "exit")
                .jump("release", "exit")
                .build();
    }
}
