package com.di.bigfactorial.cli;

import com.di.bigfactorial.reduce.ReductionOutcome;
import com.di.bigfactorial.service.FactorialService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.math.BigInteger;

/**
 * Command-line front end: parses the arguments, runs the parallel factorial
 * and prints the result. Failures are reported, never thrown, and mapped to a
 * process exit code.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FactorialCommand {

    public static final int EXIT_OK      = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE   = 2;

    private final FactorialService factorialService;

    /**
     * @param out where the result line (or usage text) is printed
     * @return the process exit code
     */
    public int execute(String[] args, PrintStream out) {
        FactorialArguments arguments;
        try {
            arguments = FactorialArguments.parse(args);
        } catch (InvalidArgumentsException ex) {
            log.debug("[CLI] rejected arguments: {}", ex.getMessage());
            System.err.println(ex.getMessage());
            System.err.println(FactorialArguments.USAGE);
            return EXIT_USAGE;
        }

        if (arguments.isHelp()) {
            out.println(FactorialArguments.USAGE);
            return EXIT_OK;
        }

        try {
            ReductionOutcome<BigInteger> outcome = factorialService.parallelFactorialWithOutcome(
                    arguments.getX(), arguments.getNumThreads());
            log.info("[CLI] computed {}! with {} thread(s): {} windows in {}ms (runId={})",
                     arguments.getX(), arguments.getNumThreads(), outcome.getWindowsFolded(),
                     outcome.getElapsedMs(), outcome.getRunId());
            out.println(ResultFormatter.format(arguments.getX(), outcome.getValue(), arguments.isFullOutput()));
            return EXIT_OK;
        } catch (RuntimeException ex) {
            log.error("[CLI] failed to compute {}!: {}", arguments.getX(), ex.getMessage(), ex);
            System.err.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }
}
