package org.symexpr.core;

import lombok.Getter;
import org.symexpr.expressions.ToSmt2;
import org.symexpr.utils.Rational;
import org.symexpr.utils.Smt2Format;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 常量：布尔值、任意精度整数或精确有理数之一。
 * 每个常量恰好有一种类型，由标签决定。
 * 全序先比较标签再比较值，只用于规范化比较与相等判断，不是算术意义上的大小。
 * 此类是不可变的。
 */
public final class Constant implements Comparable<Constant>, ToSmt2 {

    private static final Logger logger = LoggerFactory.getLogger(Constant.class);

    public static final Constant TRUE = new Constant(Type.BOOL, Boolean.TRUE);
    public static final Constant FALSE = new Constant(Type.BOOL, Boolean.FALSE);

    @Getter
    private final Type type;

    /** Boolean、BigInteger 或 Rational，由 type 决定 */
    private final Object value;

    private Constant(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    // --- 工厂方法 ---

    public static Constant bool(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static Constant integer(long i) {
        return new Constant(Type.INT, BigInteger.valueOf(i));
    }

    public static Constant integer(BigInteger i) {
        return new Constant(Type.INT, Objects.requireNonNull(i, "integer value cannot be null"));
    }

    public static Constant rational(Rational r) {
        return new Constant(Type.RAT, Objects.requireNonNull(r, "rational value cannot be null"));
    }

    public static Constant rational(long numerator, long denominator) {
        return rational(Rational.valueOf(numerator, denominator));
    }

    public static Constant rational(BigInteger numerator, BigInteger denominator) {
        return rational(Rational.valueOf(numerator, denominator));
    }

    // --- 投影 ---

    /**
     * @throws ConstantMismatchException 如果不是布尔常量
     */
    public boolean asBool() {
        if (type != Type.BOOL) {
            throw mismatch(Type.BOOL);
        }
        return (Boolean) value;
    }

    /**
     * @throws ConstantMismatchException 如果不是整数常量
     */
    public BigInteger asInt() {
        if (type != Type.INT) {
            throw mismatch(Type.INT);
        }
        return (BigInteger) value;
    }

    /**
     * @throws ConstantMismatchException 如果不是有理数常量
     */
    public Rational asRat() {
        if (type != Type.RAT) {
            throw mismatch(Type.RAT);
        }
        return (Rational) value;
    }

    private ConstantMismatchException mismatch(Type expected) {
        logger.error("常量投影失败: 期望 {}，实际为 {}: {}", expected, this, type);
        return new ConstantMismatchException(this, expected);
    }

    /**
     * 算术取反。
     * @throws ConstantMismatchException 如果是布尔常量
     */
    public Constant negate() {
        return switch (type) {
            case INT -> integer(asInt().negate());
            case RAT -> rational(asRat().negate());
            case BOOL -> {
                logger.error("不能对布尔常量 {} 取算术相反数", this);
                throw ConstantMismatchException.forOperand("-", this, Type.INT);
            }
        };
    }

    // --- SMT-LIB2 编码，与步骤无关 ---

    @Override
    public void toSmt2(StringBuilder out) {
        out.append(this);
    }

    @Override
    public void toSmt2(StringBuilder out, int step) {
        out.append(this);
    }

    // --- Object 方法 ---

    @Override
    public int compareTo(Constant other) {
        int cmp = type.compareTo(other.type);
        if (cmp != 0) {
            return cmp;
        }
        return switch (type) {
            case BOOL -> Boolean.compare(asBool(), other.asBool());
            case INT -> asInt().compareTo(other.asInt());
            case RAT -> asRat().compareTo(other.asRat());
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Constant that = (Constant) o;
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return switch (type) {
            case BOOL -> value.toString();
            case INT -> Smt2Format.numeral((BigInteger) value);
            case RAT -> ((Rational) value).toSmt2();
        };
    }
}
