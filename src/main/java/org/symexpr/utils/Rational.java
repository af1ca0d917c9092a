package org.symexpr.utils;

import com.microsoft.z3.Context;
import com.microsoft.z3.RatNum;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 精确有理数：分子分母均为 BigInteger，始终约分且分母为正。
 * 与求解器一致，不存在无穷大或 NaN，分母为零在构造时直接拒绝。
 * 此类是不可变的。
 */
public final class Rational implements Comparable<Rational> {
    private static final Logger logger = LoggerFactory.getLogger(Rational.class);

    /** 小数值缓存的分子分母位长上限 */
    private static final int MAX_CACHED_BIT_LENGTH = 64;
    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(256);

    private static final BigInteger BIG_INT_ONE = BigInteger.ONE;

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    // 常用常量
    public static final Rational ZERO = new Rational(BigInteger.ZERO, BIG_INT_ONE); // 0/1
    public static final Rational ONE = new Rational(BIG_INT_ONE, BIG_INT_ONE);      // 1/1
    public static final Rational HALF = new Rational(BIG_INT_ONE, BigInteger.TWO);  // 1/2

    static {
        CACHE.put(ZERO.getCacheKey(), ZERO);
        CACHE.put(ONE.getCacheKey(), ONE);
        CACHE.put(HALF.getCacheKey(), HALF);
    }

    /**
     * 私有构造函数，调用方保证已经约分且分母为正。
     */
    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(BigInteger numerator) {
        return valueOf(numerator, BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator) {
        if (numerator == 0L) {
            return ZERO;
        }
        if (numerator == 1L) {
            return ONE;
        }
        return valueOf(BigInteger.valueOf(numerator), BIG_INT_ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    /**
     * 规范化创建：约分，并把符号移到分子上。
     * @throws ArithmeticException 如果分母为零
     */
    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "numerator cannot be null");
        Objects.requireNonNull(denominator, "denominator cannot be null");

        // 1. 分母为0
        if (denominator.signum() == 0) {
            logger.error("尝试创建分母为零的Rational: {} / {}", numerator, denominator);
            throw new ArithmeticException("Rational with zero denominator: " + numerator + "/0");
        }

        // 2. 分子为0
        if (numerator.signum() == 0) {
            return ZERO;
        }

        // 3. 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }

        // 4. 约分
        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BIG_INT_ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }

        // 5. 缓存
        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }
        Rational result = new Rational(numerator, denominator);
        if (shouldCache(result)) {
            CACHE.put(key, result);
        }
        logger.debug("创建了一个Rational: {}", result);
        return result;
    }

    // ========== 基础运算 ==========

    public Rational add(Rational other) {
        if (this.isZero()) {
            return other;
        }
        if (other.isZero()) {
            return this;
        }
        BigInteger newNum = numerator.multiply(other.denominator).add(other.numerator.multiply(denominator));
        return valueOf(newNum, denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return this.add(other.negate());
    }

    public Rational multiply(Rational other) {
        if (this.isZero() || other.isZero()) {
            return ZERO;
        }
        return valueOf(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    /**
     * @throws ArithmeticException 如果除数为零
     */
    public Rational divide(Rational other) {
        if (other.isZero()) {
            logger.error("Rational除以零: {} / {}", this, other);
            throw new ArithmeticException("Division by zero: " + this + " / 0");
        }
        if (other.equals(ONE)) {
            return this;
        }
        return valueOf(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    public Rational negate() {
        if (isZero()) {
            return ZERO;
        }
        return valueOf(numerator.negate(), denominator);
    }

    // ========== 工具方法 ==========

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    /**
     *  判断该rational是否是整数
     */
    public boolean isInteger() {
        return denominator.equals(BIG_INT_ONE);
    }

    /**
     * SMT-LIB2 文本，负数用显式的 {@code (- ...)} 表示。
     */
    public String toSmt2() {
        return Smt2Format.fraction(numerator, denominator);
    }

    public RatNum toZ3Real(Context ctx) {
        return ctx.mkReal(this.toString());
    }

    // ========== 对象基础方法 ==========

    @Override
    public int compareTo(Rational other) {
        BigInteger ad = this.numerator.multiply(other.denominator);
        BigInteger cb = other.numerator.multiply(this.denominator);
        return ad.compareTo(cb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rational that)) {
            return false;
        }
        return this.numerator.equals(that.numerator) && this.denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    private List<BigInteger> getCacheKey() {
        return List.of(this.numerator, this.denominator);
    }

    private static boolean shouldCache(Rational r) {
        return r.numerator.abs().bitLength() + r.denominator.bitLength() < MAX_CACHED_BIT_LENGTH;
    }

    @Override
    public String toString() {
        if (isInteger()) {
            return numerator.toString();
        }
        return numerator + "/" + denominator;
    }
}
