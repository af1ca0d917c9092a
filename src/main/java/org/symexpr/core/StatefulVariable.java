package org.symexpr.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 有状态变量：一个 {@link Variable} 加上 "指向下一状态" 标志。
 * 只出现在跨越两个时间步的表达式中，例如迁移关系 {@code next_cnt = cnt + 1}。
 */
@Getter
public final class StatefulVariable implements Symbol, Comparable<StatefulVariable> {

    private static final Logger logger = LoggerFactory.getLogger(StatefulVariable.class);

    private final Variable variable;
    private final boolean next;

    private StatefulVariable(Variable variable, boolean next) {
        this.variable = Objects.requireNonNull(variable, "StatefulVariable: variable 不能为 null");
        this.next = next;
    }

    public static StatefulVariable of(Variable variable, boolean next) {
        return new StatefulVariable(variable, next);
    }

    /** 指向当前状态的版本 */
    public static StatefulVariable current(Variable variable) {
        return new StatefulVariable(variable, false);
    }

    /** 指向下一状态的版本 */
    public static StatefulVariable next(Variable variable) {
        return new StatefulVariable(variable, true);
    }

    @Override
    public String getId() {
        return variable.getId();
    }

    @Override
    public Type getType() {
        return variable.getType();
    }

    /**
     * 无步骤上下文时按第 0 步处理：{@code id@0} 或 {@code id@1}。
     */
    @Override
    public void toSmt2(StringBuilder out) {
        toSmt2(out, 0);
    }

    /**
     * 当前状态写出 {@code id@step}，下一状态写出 {@code id@(step+1)}。
     */
    @Override
    public void toSmt2(StringBuilder out, int step) {
        int actual = Variable.checkStep(step);
        if (next && actual == Integer.MAX_VALUE) {
            logger.error("下一状态变量 {} 的步骤下标溢出: {} + 1", variable, step);
            throw new IllegalArgumentException("step index " + step + " has no next step for `" + variable.getId() + "`");
        }
        variable.toSmt2(out, next ? actual + 1 : actual);
    }

    @Override
    public int compareTo(StatefulVariable other) {
        int cmp = variable.compareTo(other.variable);
        if (cmp != 0) {
            return cmp;
        }
        return Boolean.compare(next, other.next);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StatefulVariable that = (StatefulVariable) o;
        return next == that.next && variable.equals(that.variable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, next);
    }

    @Override
    public String toString() {
        return toSmt2();
    }
}
