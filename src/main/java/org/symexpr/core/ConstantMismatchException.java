package org.symexpr.core;

import lombok.Getter;

/**
 * 常量的实际形状与期望不符，例如对整数常量调用 {@code asBool}。
 */
@Getter
public class ConstantMismatchException extends IllegalArgumentException {

    /** 出错常量的显示文本 */
    private final String display;
    private final Type expected;
    private final Type actual;

    public ConstantMismatchException(Constant constant, Type expected) {
        this("expected " + expected + ", found `" + constant + "` of type " + constant.getType(),
                constant.toString(), expected, constant.getType());
    }

    private ConstantMismatchException(String message, String display, Type expected, Type actual) {
        super(message);
        this.display = display;
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * 二元运算的两个操作数形状不兼容。
     * @param symbol 运算符的显示符号。
     */
    public static ConstantMismatchException forOperands(String symbol, Constant lhs, Constant rhs) {
        String message = "cannot apply `" + symbol + "` to `" + lhs + ": " + lhs.getType()
                + "` and `" + rhs + ": " + rhs.getType() + "`";
        return new ConstantMismatchException(message, rhs.toString(), lhs.getType(), rhs.getType());
    }

    /**
     * 一元运算的操作数形状不兼容。
     */
    public static ConstantMismatchException forOperand(String symbol, Constant operand, Type expected) {
        String message = "cannot apply `" + symbol + "` to `" + operand + ": " + operand.getType() + "`";
        return new ConstantMismatchException(message, operand.toString(), expected, operand.getType());
    }
}
