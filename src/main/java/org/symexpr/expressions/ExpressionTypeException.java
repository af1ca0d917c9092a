package org.symexpr.expressions;

import lombok.Getter;
import org.symexpr.core.Type;

import java.util.List;

/**
 * 运算符应用的类型错误：参数个数越界、类型不一致、非算术或非布尔参数。
 * 在构造 {@link Application} 之前抛出，保证不合法的节点不会被创建。
 */
@Getter
public class ExpressionTypeException extends IllegalArgumentException {

    private final Operator operator;
    /** 出错时各参数的类型，按参数顺序 */
    private final List<Type> argumentTypes;

    public ExpressionTypeException(Operator operator, List<Type> argumentTypes, String message) {
        super(message + " (in `" + operator.getWireSymbol() + "` applied to " + argumentTypes + ")");
        this.operator = operator;
        this.argumentTypes = List.copyOf(argumentTypes);
    }
}
