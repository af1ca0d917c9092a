package org.symexpr.expressions;

import lombok.Getter;
import org.symexpr.core.Symbol;
import org.symexpr.core.Type;

/**
 * 变量叶子。
 */
@Getter
public final class VariableExpression<V extends Symbol> extends Expression<V> {

    private final V variable;

    VariableExpression(V variable) {
        this.variable = variable;
    }

    @Override
    public Type getType() {
        return variable.getType();
    }

    @Override
    public boolean isVariable() {
        return true;
    }

    @Override
    boolean sameNode(Expression<?> other) {
        return other instanceof VariableExpression<?> that && variable.equals(that.variable);
    }

    @Override
    public int hashCode() {
        return 31 * variable.hashCode() + 7;
    }
}
