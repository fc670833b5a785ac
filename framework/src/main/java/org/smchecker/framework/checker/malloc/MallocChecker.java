package org.smchecker.framework.checker.malloc;

import org.smchecker.dataflow.analysis.AnalysisOptions;
import org.smchecker.framework.checker.StateMachineChecker;
import org.smchecker.framework.statemachine.StateMachineRegistry;

/** Checks functions for misuse of {@code malloc}ed memory, see {@link MallocStateMachine}. */
public class MallocChecker extends StateMachineChecker {

    public MallocChecker() {
        this(AnalysisOptions.defaults());
    }

    public MallocChecker(AnalysisOptions options) {
        super(StateMachineRegistry.of(MallocStateMachine.create()), options);
    }
}
