package org.smchecker.framework.checker;

import com.google.common.collect.ImmutableList;
import org.smchecker.dataflow.analysis.AnalysisResult;
import org.smchecker.dataflow.analysis.Coverage;
import org.smchecker.dataflow.analysis.ExplorationStatistics;
import org.smchecker.dataflow.analysis.Truncation;
import org.smchecker.framework.diagnostic.Diagnostic;
import org.smchecker.framework.flow.ProgramState;

/**
 * The outcome of checking one function: the defects found on feasible paths, and whether every
 * feasible path was explored. An empty diagnostic list only proves the absence of defects when the
 * coverage is {@link Coverage#COMPLETE}.
 */
public class CheckerResult {

    private final String functionName;
    private final ImmutableList<Diagnostic> diagnostics;
    private final AnalysisResult<ProgramState> analysisResult;

    public CheckerResult(
            String functionName,
            ImmutableList<Diagnostic> diagnostics,
            AnalysisResult<ProgramState> analysisResult) {
        this.functionName = functionName;
        this.diagnostics = diagnostics;
        this.analysisResult = analysisResult;
    }

    public String getFunctionName() {
        return functionName;
    }

    /** @return the defects found, one per defect, sorted by location */
    public ImmutableList<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public Coverage getCoverage() {
        return analysisResult.getCoverage();
    }

    public boolean isComplete() {
        return analysisResult.isComplete();
    }

    public ImmutableList<Truncation> getTruncations() {
        return analysisResult.getTruncations();
    }

    public ExplorationStatistics getStatistics() {
        return analysisResult.getStatistics();
    }

    public AnalysisResult<ProgramState> getAnalysisResult() {
        return analysisResult;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(functionName).append(": ").append(diagnostics.size()).append(" diagnostic(s), ");
        sb.append("coverage ").append(getCoverage()).append(" (").append(getStatistics());
        sb.append(')');
        for (Diagnostic d : diagnostics) {
            sb.append(System.lineSeparator()).append("  ").append(d);
        }
        return sb.toString();
    }
}
