package com.github.tarcv.u4jxeger.cli;

import com.github.tarcv.u4jxeger.NegatedClassPolicy;
import com.github.tarcv.u4jxeger.RegexParseException;
import com.github.tarcv.u4jxeger.SeededRandomSource;
import com.github.tarcv.u4jxeger.URegexpFlag;
import com.github.tarcv.u4jxeger.Xeger;
import com.github.tarcv.u4jxeger.XegerOptions;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

@CommandLine.Command(name = "xeger", description = "Print random strings matching a regular expression",
        version = "0.1.0", mixinStandardHelpOptions = true)
public class XegerCli implements Callable<Integer> {
    static final int EXIT_INVALID_PATTERN = 1;

    // Held so the level set by --debug is not lost when the logger is collected.
    static final Logger LIBRARY_LOGGER = Logger.getLogger("com.github.tarcv.u4jxeger");

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "PATTERN", description = "Regular expression to generate strings for")
    private String pattern;

    @CommandLine.Option(names = {"-n", "--count"}, defaultValue = "1", description = "Number of strings to print (default: ${DEFAULT-VALUE})")
    private int count;

    @CommandLine.Option(names = {"-maxlen", "--max-length"}, defaultValue = "64",
            description = "Maximum string length in code points, 0 for unlimited (default: ${DEFAULT-VALUE})")
    private int maxLength;

    @CommandLine.Option(names = "--max-repeat", defaultValue = "0",
            description = "Repeat cap for *, + and {n,}, 0 for " + XegerOptions.DEFAULT_MAX_REPEAT)
    private int maxRepeat;

    @CommandLine.Option(names = "--seed", description = "Seed for reproducible output")
    private Long seed;

    @CommandLine.Option(names = "--uniform", description = "Draw repeat counts uniformly instead of favouring short ones")
    private boolean uniform;

    @CommandLine.Option(names = "--exact-negation", description = "Sample negated classes from their whole complement")
    private boolean exactNegation;

    @CommandLine.Option(names = "-i", description = "Case insensitive")
    private boolean caseInsensitive;

    @CommandLine.Option(names = "-s", description = "'.' also matches newline")
    private boolean dotAll;

    @CommandLine.Option(names = "-m", description = "'^' and '$' match at line boundaries")
    private boolean multiLine;

    @CommandLine.Option(names = "--debug", description = "Log the simplified syntax tree")
    private boolean debug;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new XegerCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (count < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Count must not be negative: " + count);
        }
        if (maxLength < 0 || maxRepeat < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Lengths must not be negative");
        }
        if (debug) {
            enableDebugLogging();
        }

        XegerOptions.Builder options = XegerOptions.builder()
                .maxLength(maxLength)
                .maxRepeat(maxRepeat)
                .shortBias(!uniform)
                .negatedClassPolicy(exactNegation ? NegatedClassPolicy.EXACT_COMPLEMENT : NegatedClassPolicy.APPROXIMATE_SUBSET);
        if (caseInsensitive) {
            options.flag(URegexpFlag.UREGEX_CASE_INSENSITIVE);
        }
        if (dotAll) {
            options.flag(URegexpFlag.UREGEX_DOTALL);
        }
        if (multiLine) {
            options.flag(URegexpFlag.UREGEX_MULTILINE);
        }

        SeededRandomSource random = seed != null ? new SeededRandomSource(seed) : new SeededRandomSource();
        Xeger xeger;
        try {
            xeger = Xeger.compile(pattern, options.build(), random);
        } catch (RegexParseException e) {
            spec.commandLine().getErr().println("Error: invalid pattern: " + e.getMessage());
            return EXIT_INVALID_PATTERN;
        }

        PrintWriter out = spec.commandLine().getOut();
        if (debug) {
            PrintWriter err = spec.commandLine().getErr();
            err.println("seed: " + random.getSeed());
            err.print(xeger.tree().dump());
            err.flush();
        }
        for (int i = 0; i < count; i++) {
            out.println(xeger.next());
        }
        out.flush();
        return 0;
    }

    private static synchronized void enableDebugLogging() {
        LIBRARY_LOGGER.setLevel(Level.FINE);
        for (Handler installed : LIBRARY_LOGGER.getHandlers()) {
            if (installed instanceof ConsoleHandler) {
                return;
            }
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        LIBRARY_LOGGER.addHandler(handler);
    }
}
