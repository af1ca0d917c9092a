package org.symexpr.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class Smt2FormatTest {

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    @Test
    @DisplayName("整数: 负数写成 (- n)")
    void testNumeral() {
        assertAll("Numerals",
                () -> assertEquals("0", Smt2Format.numeral(BigInteger.ZERO)),
                () -> assertEquals("42", Smt2Format.numeral(big(42))),
                () -> assertEquals("(- 42)", Smt2Format.numeral(big(-42)))
        );
    }

    @Test
    @DisplayName("分数: 四种符号组合下输出的数字字面量都非负")
    void testFraction_AllSignCases() {
        assertAll("Fractions",
                () -> assertEquals("(/ 3 2)", Smt2Format.fraction(big(3), big(2))),
                () -> assertEquals("(- (/ 3 2))", Smt2Format.fraction(big(-3), big(2))),
                () -> assertEquals("(- (/ 3 2))", Smt2Format.fraction(big(3), big(-2))),
                () -> assertEquals("(/ 3 2)", Smt2Format.fraction(big(-3), big(-2)))
        );
    }

    @Test
    @DisplayName("压缩空白")
    void testCleanRepr() {
        assertAll("Whitespace",
                () -> assertEquals("(+ x 1)", Smt2Format.cleanRepr("  (+   x\n\t 1)  ")),
                () -> assertEquals("", Smt2Format.cleanRepr("   ")),
                () -> assertEquals("x", Smt2Format.cleanRepr("x"))
        );
    }
}
