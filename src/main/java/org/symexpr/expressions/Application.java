package org.symexpr.expressions;

import lombok.AccessLevel;
import lombok.Getter;
import org.symexpr.core.Symbol;
import org.symexpr.core.Type;

import java.util.List;

/**
 * 运算符应用节点。只能由 {@link Expression#fromApplication(Operator, List)} 创建，
 * 因此每个存在的节点都已经通过了运算符的类型检查。
 * 类型在构造时由类型规则推导一次并记住，{@link #recomputeType()} 可重新推导。
 */
@Getter
public final class Application<V extends Symbol> extends Expression<V> {

    private final Operator operator;
    /** 不可变的有序子节点 */
    private final List<Expression<V>> arguments;
    private final Type type;
    @Getter(AccessLevel.NONE)
    private final int hashCode;

    Application(Operator operator, List<Expression<V>> arguments, Type type) {
        this.operator = operator;
        this.arguments = arguments;
        this.type = type;
        int h = operator.ordinal();
        for (Expression<V> arg : arguments) {
            h = 31 * h + arg.hashCode();
        }
        this.hashCode = h;
    }

    public int arity() {
        return arguments.size();
    }

    @Override
    public boolean isApplication() {
        return true;
    }

    @Override
    boolean sameNode(Expression<?> other) {
        return other instanceof Application<?> that
                && operator == that.operator
                && arguments.size() == that.arguments.size();
    }

    @Override
    public int hashCode() {
        return hashCode;
    }
}
