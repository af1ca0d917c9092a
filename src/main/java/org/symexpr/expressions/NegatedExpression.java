package org.symexpr.expressions;

import lombok.Getter;
import org.symexpr.core.Symbol;

/**
 * 对一个已有布尔表达式的逻辑取反视图，只持有引用，不复制表达式。
 * 用于断言公式的否定，编码为 {@code (not <inner>)}。
 */
@Getter
public final class NegatedExpression<V extends Symbol> implements ToSmt2 {

    private final Expression<V> inner;

    NegatedExpression(Expression<V> inner) {
        this.inner = inner;
    }

    @Override
    public void toSmt2(StringBuilder out) {
        out.append("(not ");
        inner.toSmt2(out);
        out.append(')');
    }

    @Override
    public void toSmt2(StringBuilder out, int step) {
        out.append("(not ");
        inner.toSmt2(out, step);
        out.append(')');
    }

    @Override
    public String toString() {
        return "(" + Operator.NOT.getDisplaySymbol() + " " + inner + ")";
    }
}
