package org.symexpr.expressions;

import org.symexpr.core.Constant;
import org.symexpr.core.Symbol;
import org.symexpr.core.Type;
import org.symexpr.core.Valuation;
import org.symexpr.utils.Smt2Format;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * 多态表达式树，变量的表示由 {@code V} 决定：
 * {@code Expression<Variable>} 是无状态表达式，{@code Expression<StatefulVariable>} 是跨两个时间步的表达式。
 * <p>
 * 节点有三种：{@link ConstantExpression}、{@link VariableExpression} 和 {@link Application}。
 * 运算符应用只能通过 {@link #fromApplication(Operator, List)} 构造，它先做类型检查再做单层化简，
 * 所以不合法的节点永远不会被创建。表达式是不可变的。
 * <p>
 * 遍历 (fold、编码、相等判断) 都使用显式栈，不依赖 Java 调用栈，深层表达式不会栈溢出。
 * @param <V> 变量的表示
 */
public abstract class Expression<V extends Symbol> implements ToSmt2 {

    private static final Logger logger = LoggerFactory.getLogger(Expression.class);

    Expression() {
    }

    // --- 构造 ---

    public static <V extends Symbol> Expression<V> fromConstant(Constant constant) {
        return new ConstantExpression<>(Objects.requireNonNull(constant, "Expression: constant 不能为 null"));
    }

    public static <V extends Symbol> Expression<V> fromVariable(V variable) {
        return new VariableExpression<>(Objects.requireNonNull(variable, "Expression: variable 不能为 null"));
    }

    /**
     * 构造运算符应用：先做类型检查，再做单层化简。
     * 常量上的一元 {@code -} 折叠为取反后的常量；只有一个参数的 {@code +}、{@code and}、{@code or} 直接返回该参数。
     * @throws ExpressionTypeException 参数个数或类型不合法，此时不会创建任何节点
     */
    public static <V extends Symbol> Expression<V> fromApplication(Operator op, List<Expression<V>> args) {
        Objects.requireNonNull(op, "Expression: operator 不能为 null");
        List<Expression<V>> arguments = List.copyOf(args);
        List<Type> argTypes = new ArrayList<>(arguments.size());
        for (Expression<V> arg : arguments) {
            argTypes.add(arg.getType());
        }
        Type type = op.typeCheck(argTypes);

        if (arguments.size() == 1) {
            Expression<V> single = arguments.get(0);
            if (op == Operator.SUB && single.isConstant()) {
                Constant negated = ((ConstantExpression<V>) single).getConstant().negate();
                logger.debug("化简: 常量 {} 的一元取反折叠为 {}", single, negated);
                return fromConstant(negated);
            }
            if (op == Operator.ADD || op == Operator.AND || op == Operator.OR) {
                logger.debug("化简: 单参数的 {} 折叠为其参数", op.getWireSymbol());
                return single;
            }
        }
        return new Application<>(op, arguments, type);
    }

    @SafeVarargs
    public static <V extends Symbol> Expression<V> fromApplication(Operator op, Expression<V>... args) {
        return fromApplication(op, Arrays.asList(args));
    }

    /**
     * 去掉首尾空白并把内部连续空白压缩成一个空格。
     * 用于保存用户写下的表达式原文作为显示用的键 (例如回显求值请求)，而不受排版影响。
     */
    public static String cleanRepr(String repr) {
        return Smt2Format.cleanRepr(repr);
    }

    // --- 查询 ---

    /**
     * 表达式的类型。运算符应用的类型在构造时由类型规则推导出来。
     */
    public abstract Type getType();

    /**
     * 按类型规则自底向上重新推导类型，结果必须与 {@link #getType()} 一致。
     */
    public Type recomputeType() {
        return this.<Type>fold(Symbol::getType, Constant::getType, Operator::typeCheck);
    }

    public boolean isConstant() {
        return false;
    }

    public boolean isVariable() {
        return false;
    }

    public boolean isApplication() {
        return false;
    }

    /**
     * 自底向上折叠：深度优先、从左到右，先折叠应用节点的所有子节点，再调用 {@code appAction}。
     * @param varAction 变量叶子
     * @param cstAction 常量叶子
     * @param appAction 运算符与其子节点的折叠结果
     */
    public <A> A fold(Function<? super V, ? extends A> varAction,
                      Function<? super Constant, ? extends A> cstAction,
                      BiFunction<? super Operator, ? super List<A>, ? extends A> appAction) {
        return ExpressionFolder.fold(this, varAction, cstAction, appAction);
    }

    /**
     * 用给定赋值替换变量后把表达式折叠为一个常量。
     * @throws IllegalArgumentException 某个变量没有赋值
     * @throws org.symexpr.core.ConstantMismatchException 操作数形状不符
     * @throws ArithmeticException 除数为零
     */
    public Constant evaluate(Valuation<V> valuation) {
        Objects.requireNonNull(valuation, "Expression-evaluate: valuation 不能为 null");
        return evaluate(valuation::getValue);
    }

    public Constant evaluate(Function<? super V, Constant> valuation) {
        return this.<Constant>fold(valuation, constant -> constant, Operator::evaluate);
    }

    /**
     * 逻辑取反的视图，不复制本表达式。用于断言一个公式的否定。
     * @throws ExpressionTypeException 本表达式不是布尔类型
     */
    public NegatedExpression<V> negated() {
        Operator.NOT.typeCheck(List.of(getType()));
        return new NegatedExpression<>(this);
    }

    // --- SMT-LIB2 编码 ---

    @Override
    public void toSmt2(StringBuilder out) {
        ExpressionWriter.write(this, out, true, ExpressionWriter.NO_STEP);
    }

    @Override
    public void toSmt2(StringBuilder out, int step) {
        if (step < 0) {
            logger.error("步骤下标不能为负: {}", step);
            throw new IllegalArgumentException("step index must be non-negative, got " + step);
        }
        ExpressionWriter.write(this, out, true, step);
    }

    // --- Object 方法 ---

    /**
     * 只比较本节点 (种类、运算符、参数个数、叶子的值)，不比较子节点。
     */
    abstract boolean sameNode(Expression<?> other);

    @Override
    public final boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Expression<?> other) || hashCode() != other.hashCode()) {
            return false;
        }
        Deque<Expression<?>> lhs = new ArrayDeque<>();
        Deque<Expression<?>> rhs = new ArrayDeque<>();
        lhs.push(this);
        rhs.push(other);
        while (!lhs.isEmpty()) {
            Expression<?> a = lhs.pop();
            Expression<?> b = rhs.pop();
            if (a == b) {
                continue;
            }
            if (!a.sameNode(b)) {
                return false;
            }
            if (a instanceof Application<?> appA) {
                Application<?> appB = (Application<?>) b;
                for (int i = 0; i < appA.arity(); i++) {
                    lhs.push(appA.getArguments().get(i));
                    rhs.push(appB.getArguments().get(i));
                }
            }
        }
        return true;
    }

    @Override
    public abstract int hashCode();

    /**
     * 前缀形式，使用运算符的显示符号，例如 {@code (≥ x 0)}。
     */
    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        ExpressionWriter.write(this, out, false, ExpressionWriter.NO_STEP);
        return out.toString();
    }
}
