package com.di.bigfactorial.util;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Carries the submitting thread's SLF4J MDC (the reduction's {@code runId})
 * onto pool threads, so window log lines name the reduction that issued them.
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Wraps {@code task} so it runs under the MDC captured now. The pool
     * thread's own context is put back when the task returns.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> submitted = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            replaceContext(submitted);
            try {
                task.run();
            } finally {
                replaceContext(previous);
            }
        };
    }

    private static void replaceContext(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }
}
