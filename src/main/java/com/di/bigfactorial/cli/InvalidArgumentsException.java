package com.di.bigfactorial.cli;

/**
 * Thrown by {@link FactorialArguments#parse(String...)} when the command line
 * cannot be turned into a request. The CLI prints the message with a usage
 * line and exits with {@link FactorialCommand#EXIT_USAGE}.
 */
public class InvalidArgumentsException extends RuntimeException {

    public InvalidArgumentsException(String message) {
        super(message);
    }

    public InvalidArgumentsException(String message, Throwable cause) {
        super(message, cause);
    }
}
