package com.di.bigfactorial.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResultFormatter Tests")
class ResultFormatterTest {

    @Test
    @DisplayName("Full output prints every digit")
    void testFormat_Full() {
        assertEquals("20! = 2432902008176640000",
            ResultFormatter.format(20, new BigInteger("2432902008176640000"), true));
    }

    @Test
    @DisplayName("Short output normalises to mantissa in [1, 2) and binary exponent")
    void testFormat_Scientific() {
        assertEquals("4! = 1.5*2^4", ResultFormatter.format(4, BigInteger.valueOf(24), false));
    }

    @Test
    @DisplayName("A whole mantissa prints without a fraction")
    void testFormat_WholeMantissa() {
        assertEquals("0! = 1*2^0", ResultFormatter.format(0, BigInteger.ONE, false));
        assertEquals("2! = 1*2^1", ResultFormatter.format(2, BigInteger.TWO, false));
        assertEquals("1*2^10", ResultFormatter.scientific(BigInteger.ONE.shiftLeft(10)));
    }

    @Test
    @DisplayName("Mantissa is truncated, not rounded, for values wider than 53 bits")
    void testScientific_Truncates() {
        // 2^60 - 1: all ones, the mantissa keeps the top 53 bits
        BigInteger value = BigInteger.ONE.shiftLeft(60).subtract(BigInteger.ONE);
        String rendered = ResultFormatter.scientific(value);
        assertTrue(rendered.endsWith("*2^59"), rendered);
        double mantissa = Double.parseDouble(rendered.substring(0, rendered.indexOf('*')));
        assertTrue(mantissa < 2.0);
        assertEquals(2.0 - Math.ulp(1.0), mantissa);
    }

    @Test
    @DisplayName("Should reject non-positive values")
    void testScientific_NonPositive() {
        assertThrows(IllegalArgumentException.class, () -> ResultFormatter.scientific(BigInteger.ZERO));
    }
}
