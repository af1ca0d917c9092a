package org.symexpr.utils;

import org.apache.commons.lang3.StringUtils;

import java.math.BigInteger;

/**
 * SMT-LIB2 字面量的文本格式。
 * SMT-LIB2 的数字字面量没有符号，负数必须写成 {@code (- n)} 形式。
 */
public final class Smt2Format {

    private Smt2Format() {
    }

    /**
     * 整数: 非负数直接输出十进制，负数输出 {@code (- |i|)}。
     */
    public static String numeral(BigInteger value) {
        if (value.signum() < 0) {
            return "(- " + value.negate() + ")";
        }
        return value.toString();
    }

    /**
     * 分数 {@code (/ num den)}，保证输出的两个数字字面量都非负。
     * 分子分母都为负时同时取反；只有一个为负时，取其绝对值并在外层包一个 {@code (- ...)}。
     */
    public static String fraction(BigInteger num, BigInteger den) {
        boolean numNeg = num.signum() < 0;
        boolean denNeg = den.signum() < 0;
        if (numNeg && denNeg) {
            return "(/ " + num.negate() + " " + den.negate() + ")";
        }
        if (numNeg) {
            return "(- (/ " + num.negate() + " " + den + "))";
        }
        if (denNeg) {
            return "(- (/ " + num + " " + den.negate() + "))";
        }
        return "(/ " + num + " " + den + ")";
    }

    /**
     * 去掉首尾空白，并把内部连续空白压缩成一个空格。
     */
    public static String cleanRepr(String s) {
        return StringUtils.normalizeSpace(s);
    }
}
