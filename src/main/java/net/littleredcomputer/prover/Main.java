package net.littleredcomputer.prover;

import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.logic.Formula;
import net.littleredcomputer.prover.logic.FormulaParser;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

public class Main {
    private static Splitter commaSplitter = Splitter.on(',').trimResults().omitEmptyStrings();

    private static Options options() {
        return new Options()
                .addOption("axioms", true, "filename of axioms, one formula per line")
                .addOption("formula", true, "formula to prove")
                .addOption("goals", true, "filename of formulas to prove, one per line")
                .addOption("initialdepth", true, "depth limit of the first attempt")
                .addOption("depthstep", true, "increase in depth limit between attempts")
                .addOption("maxdepth", true, "give up rather than exceed this depth limit")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format")
                .addOption("trace", true, "comma-separated trace categories: expand, literal, universal, world");
    }

    private static Reader reader(String filename) throws FileNotFoundException {
        return new BufferedReader(filename.equals("-") ? new InputStreamReader(System.in) : new FileReader(filename));
    }

    private static List<Formula> axioms(CommandLine cmd) throws IOException {
        if (!cmd.hasOption("axioms")) return ImmutableList.of();
        try (Reader r = reader(cmd.getOptionValue("axioms"))) {
            return FormulaParser.parseAll(r);
        }
    }

    private static List<Formula> goals(CommandLine cmd) throws IOException {
        if (!cmd.hasOption("formula") && !cmd.hasOption("goals")) throw new IllegalArgumentException("Must specify -formula or -goals");
        ImmutableList.Builder<Formula> goals = ImmutableList.builder();
        if (cmd.hasOption("formula")) goals.add(FormulaParser.parse(cmd.getOptionValue("formula")));
        if (cmd.hasOption("goals")) {
            try (Reader r = reader(cmd.getOptionValue("goals"))) {
                goals.addAll(FormulaParser.parseAll(r));
            }
        }
        return goals.build();
    }

    private static int intOption(CommandLine cmd, String name, int defaultValue) {
        if (!cmd.hasOption(name)) return defaultValue;
        try {
            return Integer.parseInt(cmd.getOptionValue(name));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("-" + name + " must be an integer", e);
        }
    }

    private static EnumSet<Expander.Trace> tracing(CommandLine cmd) {
        EnumSet<Expander.Trace> t = EnumSet.noneOf(Expander.Trace.class);
        if (!cmd.hasOption("trace")) return t;
        for (String c : commaSplitter.split(cmd.getOptionValue("trace"))) {
            try {
                t.add(Expander.Trace.valueOf(c.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown trace category: " + c, e);
            }
        }
        return t;
    }

    static Prover prover(CommandLine cmd) {
        return new Prover()
                .setInitialDepthLimit(intOption(cmd, "initialdepth", Prover.DEFAULT_DEPTH_LIMIT))
                .setDepthIncrement(intOption(cmd, "depthstep", Prover.DEFAULT_DEPTH_INCREMENT))
                .setMaxDepthLimit(intOption(cmd, "maxdepth", 0))
                .setLogInterval(Duration.parse(cmd.getOptionValue("loginterval", "PT10S")))
                .setTracing(tracing(cmd));
    }

    static CommandLine parse(String[] args) throws ParseException {
        return new DefaultParser().parse(options(), args);
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = parse(args);
        List<Formula> axioms = axioms(cmd);
        List<Formula> goals = goals(cmd);
        Prover prover = prover(cmd);
        for (Formula g : goals) {
            Stopwatch sw = Stopwatch.createStarted();
            boolean proved = prover.prove(axioms, g);
            System.out.printf("%s: %s (%s)\n", proved ? "proved" : "not proved", g, sw);
        }
    }
}
