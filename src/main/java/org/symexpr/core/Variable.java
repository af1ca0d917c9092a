package org.symexpr.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 无状态变量：标识符加类型。变量本身不持有值，求值时由外部赋值提供。
 */
@Getter
public final class Variable implements Symbol, Comparable<Variable> {

    private static final Logger logger = LoggerFactory.getLogger(Variable.class);

    /** 带步骤的 SMT-LIB2 符号中标识符与步骤之间的分隔符 */
    public static final char STEP_SEPARATOR = '@';

    private final String id;
    private final Type type;

    private Variable(String id, Type type) {
        this.id = id;
        this.type = type;
        logger.debug("创建了一个Variable: {}: {}", id, type);
    }

    public static Variable of(String id, Type type) {
        Objects.requireNonNull(id, "Variable-工厂方法: id 不能为 null");
        Objects.requireNonNull(type, "Variable-工厂方法: type 不能为 null");
        if (id.isEmpty()) {
            logger.error("Variable-工厂方法: 标识符为空");
            throw new IllegalArgumentException("Variable identifier cannot be empty");
        }
        return new Variable(id, type);
    }

    /**
     * 无步骤上下文时写出裸标识符。
     */
    @Override
    public void toSmt2(StringBuilder out) {
        out.append(id);
    }

    /**
     * 写出 {@code id@step}。
     */
    @Override
    public void toSmt2(StringBuilder out, int step) {
        out.append(id).append(STEP_SEPARATOR).append(checkStep(step));
    }

    static int checkStep(int step) {
        if (step < 0) {
            logger.error("步骤下标不能为负: {}", step);
            throw new IllegalArgumentException("step index must be non-negative, got " + step);
        }
        return step;
    }

    @Override
    public int compareTo(Variable other) {
        int cmp = id.compareTo(other.id);
        if (cmp != 0) {
            return cmp;
        }
        return type.compareTo(other.type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Variable that = (Variable) o;
        return id.equals(that.id) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type);
    }

    @Override
    public String toString() {
        return id;
    }
}
