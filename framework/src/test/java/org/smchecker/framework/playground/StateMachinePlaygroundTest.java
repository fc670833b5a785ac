package org.smchecker.framework.playground;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLoggerFactory;

public class StateMachinePlaygroundTest {

    @Rule public TemporaryFolder tmp = new TemporaryFolder();

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

    private int run(String... args) throws UnsupportedEncodingException {
        return StateMachinePlayground.run(args, new PrintStream(bytes, true, "UTF-8"));
    }

    private String output() throws UnsupportedEncodingException {
        return bytes.toString("UTF-8");
    }

    @Test
    public void checksTheImpossibleErrorFixture() throws Exception {
        File dir = tmp.newFolder("out");
        int status = run(dir.getPath(), "-fixture", "impossible-error");

        assertThat(status, is(0));
        assertThat(output(), containsString("test: 0 diagnostic(s), coverage COMPLETE"));
        assertThat(new File(dir, "test.dot").isFile(), is(true));
    }

    @Test
    public void writesAWitnessGraphPerDiagnostic() throws Exception {
        File dir = tmp.newFolder("out");
        int status = run(dir.getPath(), "-fixture", "double-free", "-parallelism", "2");

        assertThat(status, is(0));
        assertThat(output(), containsString("malloc: double-free of 'p'"));
        assertThat(new File(dir, "double_free_1.dot").isFile(), is(true));
    }

    @Test
    public void budgetsArePassedOn() throws Exception {
        int status = run(tmp.newFolder("out").getPath(), "-fixture", "leak", "-maxPaths", "1");

        assertThat(status, is(0));
        assertThat(output(), containsString("coverage INCOMPLETE"));
    }

    @Test
    public void rejectsBadArguments() throws Exception {
        assertThat(run(), is(1));
        assertThat(run("out", "-fixture", "nonexistent"), is(1));
        assertThat(run("out", "-maxPaths", "many"), is(1));
        assertThat(run("out", "-verbose"), is(1));
        assertThat(output(), containsString("Parameters: <outputdir>"));
    }

    @Test
    public void loggingHasABinding() {
        assertThat(LoggerFactory.getILoggerFactory(), is(not(instanceOf(NOPLoggerFactory.class))));
    }
}
