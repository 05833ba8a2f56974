package com.di.bigfactorial.service;

import com.di.bigfactorial.config.ReductionProperties;
import com.di.bigfactorial.numeric.BigIntegerCapability;
import com.di.bigfactorial.numeric.NumericCapability;
import com.di.bigfactorial.reduce.Factorials;
import com.di.bigfactorial.reduce.ReductionOutcome;
import com.di.bigfactorial.reduce.WindowedReducer;
import com.di.bigfactorial.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Entry point for factorial computations: a sequential path and a windowed,
 * bounded-concurrency path configured from {@link ReductionProperties}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FactorialService {

    private final ReductionProperties properties;
    private final MetricsCollector    metrics;

    /** {@code n!} on the calling thread. */
    public BigInteger factorial(long n) {
        return factorial(BigIntegerCapability.INSTANCE, n);
    }

    public <T> T factorial(NumericCapability<T> capability, long n) {
        log.debug("[FACTORIAL] sequential n={} type={}", n, capability.name());
        return Factorials.factorial(capability, n);
    }

    /** {@code n!} with at most {@code concurrency} windows in flight. */
    public BigInteger parallelFactorial(long n, int concurrency) {
        return parallelFactorial(BigIntegerCapability.INSTANCE, n, concurrency);
    }

    public <T> T parallelFactorial(NumericCapability<T> capability, long n, int concurrency) {
        return reducer(capability).reduce(n, concurrency);
    }

    /** Parallel path returning the value together with window statistics. */
    public ReductionOutcome<BigInteger> parallelFactorialWithOutcome(long n, int concurrency) {
        return reducer(BigIntegerCapability.INSTANCE).reduceWithOutcome(n, concurrency);
    }

    private <T> WindowedReducer<T> reducer(NumericCapability<T> capability) {
        return new WindowedReducer<>(capability, properties, metrics);
    }
}
