package com.di.bigfactorial.cli;

import com.di.bigfactorial.reduce.WindowedReducer;
import lombok.Builder;
import lombok.Value;
import picocli.CommandLine;

/**
 * Parsed command line: {@code <x> [-n|--num-threads N] [-f|--full-output] [-h|--help]}.
 * Option values may follow the option as a separate argument or after {@code =}.
 */
@Value
@Builder
public class FactorialArguments {

    public static final String USAGE =
            "Usage: big-factorial <x> [-n|--num-threads N] [-f|--full-output] [-h|--help]";

    /** Number to calculate the factorial of. */
    long x;

    /** Threads used for the calculation; 1 means one window at a time. */
    @Builder.Default
    int numThreads = 1;

    /** Print every decimal digit instead of mantissa and binary exponent. */
    boolean fullOutput;

    boolean help;

    @CommandLine.Command(name = "big-factorial")
    static final class Options {

        @CommandLine.Parameters(index = "0", arity = "1", paramLabel = "<x>",
                description = "Number to calculate the factorial of")
        String x;

        @CommandLine.Option(names = {"-n", "--num-threads"}, paramLabel = "N",
                description = "Number of threads to use for the calculation (default: 1)")
        String numThreads;

        @CommandLine.Option(names = {"-f", "--full-output"},
                description = "Print every digit of the result")
        boolean fullOutput;

        @CommandLine.Option(names = {"-h", "--help"}, usageHelp = true,
                description = "Print usage and exit")
        boolean help;
    }

    /**
     * @throws InvalidArgumentsException on a missing or malformed value or an unknown option
     */
    public static FactorialArguments parse(String... args) {
        Options options;
        try {
            options = CommandLine.populateCommand(new Options(), args);
        } catch (CommandLine.ParameterException ex) {
            throw new InvalidArgumentsException(ex.getMessage(), ex);
        }

        if (options.help) {
            return FactorialArguments.builder().help(true).build();
        }
        if (options.x == null) {
            throw new InvalidArgumentsException("Missing required parameter: '<x>'");
        }

        return FactorialArguments.builder()
                .x(parseX(options.x))
                .numThreads(parseNumThreads(options.numThreads))
                .fullOutput(options.fullOutput)
                .build();
    }

    private static long parseX(String raw) {
        long x;
        try {
            x = Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidArgumentsException("<x> must be a non-negative integer, got '" + raw + "'", ex);
        }
        if (x < 0) {
            throw new InvalidArgumentsException("<x> must be a non-negative integer, got " + x);
        }
        return x;
    }

    private static int parseNumThreads(String raw) {
        if (raw == null) {
            return 1;
        }
        int n;
        try {
            n = Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidArgumentsException("--num-threads must be an integer, got '" + raw + "'", ex);
        }
        if (n < WindowedReducer.MIN_CONCURRENCY || n > WindowedReducer.MAX_CONCURRENCY) {
            throw new InvalidArgumentsException(String.format("--num-threads must be between %d and %d, got %d",
                    WindowedReducer.MIN_CONCURRENCY, WindowedReducer.MAX_CONCURRENCY, n));
        }
        return n;
    }
}
