package net.littleredcomputer.prover;

import org.apache.commons.cli.ParseException;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.junit.Assert.assertThat;

public class MainTest {
    private static String run(String... args) throws ParseException, IOException {
        PrintStream saved = System.out;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, "UTF-8"));
        try {
            Main.main(args);
        } finally {
            System.setOut(saved);
        }
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void provesFormula() throws Exception {
        assertThat(run("-formula", "knows(ann, p | ~p)"), startsWith("proved: knows(ann, p | ~p)"));
        assertThat(run("-formula", "p | q", "-initialdepth", "50", "-depthstep", "50"), startsWith("not proved: p | q"));
    }

    @Test
    public void tracingAccepted() throws Exception {
        assertThat(run("-formula", "p => p", "-trace", "expand, literal,world"), containsString("proved"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingGoal() throws Exception {
        run("-initialdepth", "10");
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownTraceCategory() throws Exception {
        Main.prover(Main.parse(new String[]{"-trace", "everything"}));
    }

    @Test(expected = IllegalArgumentException.class)
    public void badDepth() throws Exception {
        Main.prover(Main.parse(new String[]{"-maxdepth", "lots"}));
    }
}
