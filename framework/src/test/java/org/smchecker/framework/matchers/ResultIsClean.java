package org.smchecker.framework.matchers;

import org.hamcrest.BaseMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.smchecker.dataflow.analysis.Coverage;
import org.smchecker.framework.checker.CheckerResult;

/** Matches a result that proves the absence of defects: no diagnostics and complete coverage. */
public class ResultIsClean extends BaseMatcher<CheckerResult> {

    @Override
    public boolean matches(Object o) {
        if (!(o instanceof CheckerResult)) {
            return false;
        }
        CheckerResult result = (CheckerResult) o;
        return result.getDiagnostics().isEmpty() && result.getCoverage() == Coverage.COMPLETE;
    }

    @Override
    public void describeTo(Description description) {
        description.appendText("no diagnostics with complete coverage");
    }

    @Override
    public void describeMismatch(Object item, Description description) {
        if (item instanceof CheckerResult) {
            CheckerResult result = (CheckerResult) item;
            description
                    .appendText("coverage was ")
                    .appendValue(result.getCoverage())
                    .appendText(" with diagnostics ")
                    .appendValue(result.getDiagnostics());
        } else {
            super.describeMismatch(item, description);
        }
    }

    public static Matcher<CheckerResult> isClean() {
        return new ResultIsClean();
    }
}
