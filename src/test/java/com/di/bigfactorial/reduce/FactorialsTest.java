package com.di.bigfactorial.reduce;

import com.di.bigfactorial.numeric.BigIntegerCapability;
import com.di.bigfactorial.numeric.LongCapability;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Factorials Tests")
class FactorialsTest {

    @Test
    @DisplayName("0! and 1! are both one")
    void testIdentityLaw() {
        assertEquals(BigInteger.ONE, Factorials.factorial(BigIntegerCapability.INSTANCE, 0));
        assertEquals(BigInteger.ONE, Factorials.factorial(BigIntegerCapability.INSTANCE, 1));
    }

    @ParameterizedTest
    @CsvSource({
        "2, 2",
        "3, 6",
        "4, 24",
        "5, 120",
        "10, 3628800",
        "20, 2432902008176640000"
    })
    @DisplayName("Should match known values in 64-bit arithmetic")
    void testFactorial_Long(long n, long expected) {
        assertEquals(expected, Factorials.factorial(LongCapability.INSTANCE, n));
    }

    @Test
    @DisplayName("n! == n * (n-1)! for n in 1..60")
    void testRecurrence() {
        for (long n = 1; n <= 60; n++) {
            BigInteger current = Factorials.factorial(BigIntegerCapability.INSTANCE, n);
            BigInteger previous = Factorials.factorial(BigIntegerCapability.INSTANCE, n - 1);
            assertEquals(BigInteger.valueOf(n).multiply(previous), current, "n=" + n);
        }
    }

    @Test
    @DisplayName("21! overflows a long")
    void testFactorial_LongOverflow() {
        assertThrows(ArithmeticException.class, () -> Factorials.factorial(LongCapability.INSTANCE, 21));
    }

    @Test
    @DisplayName("Should reject negative n")
    void testFactorial_Negative() {
        assertThrows(IllegalArgumentException.class,
            () -> Factorials.factorial(BigIntegerCapability.INSTANCE, -1));
    }
}
