package org.smchecker.framework.matchers;

import org.smchecker.framework.diagnostic.Diagnostic;

/** The bad state and the variable a diagnostic is expected to report. */
public class DiagnosticPattern {

    final String badState;
    final String variable;

    public DiagnosticPattern(String badState, String variable) {
        this.badState = badState;
        this.variable = variable;
    }

    public static DiagnosticPattern diagnostic(String badState, String variable) {
        return new DiagnosticPattern(badState, variable);
    }

    public boolean matches(Diagnostic d) {
        return d.getBadState().equals(badState) && d.getVariable().equals(variable);
    }

    @Override
    public String toString() {
        return badState + " of '" + variable + "'";
    }
}
