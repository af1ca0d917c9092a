package org.symexpr.expressions;

import lombok.Getter;
import org.symexpr.core.Constant;
import org.symexpr.core.Symbol;
import org.symexpr.core.Type;

/**
 * 常量叶子。
 */
@Getter
public final class ConstantExpression<V extends Symbol> extends Expression<V> {

    private final Constant constant;

    ConstantExpression(Constant constant) {
        this.constant = constant;
    }

    @Override
    public Type getType() {
        return constant.getType();
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    boolean sameNode(Expression<?> other) {
        return other instanceof ConstantExpression<?> that && constant.equals(that.constant);
    }

    @Override
    public int hashCode() {
        return constant.hashCode();
    }
}
