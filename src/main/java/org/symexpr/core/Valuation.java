package org.symexpr.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 变量到常量的赋值，求值时用于替换表达式的叶子变量。
 * 构造时检查每个值的类型与变量类型一致。
 * 此类是不可变的。
 * @param <V> 变量的表示 (无状态或有状态变量)
 */
@Getter
public final class Valuation<V extends Symbol> {

    private static final Logger logger = LoggerFactory.getLogger(Valuation.class);

    private final Map<V, Constant> values;

    private Valuation(Map<V, Constant> values) {
        for (Map.Entry<V, Constant> entry : values.entrySet()) {
            V var = Objects.requireNonNull(entry.getKey(), "Valuation: 变量不能为 null");
            Constant value = Objects.requireNonNull(entry.getValue(), "Valuation: 值不能为 null");
            if (var.getType() != value.getType()) {
                logger.error("初始化赋值时遇到问题：变量 {}: {} 被赋予了 {}: {}", var, var.getType(), value, value.getType());
                throw new IllegalArgumentException("cannot assign `" + value + ": " + value.getType()
                        + "` to variable `" + var + ": " + var.getType() + "`");
            }
        }
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        logger.debug("创建 Valuation: {}", this);
    }

    public static <V extends Symbol> Valuation<V> of(Map<V, Constant> values) {
        return new Valuation<>(Objects.requireNonNull(values, "Valuation: values 不能为 null"));
    }

    public static <V extends Symbol> Valuation<V> empty() {
        return new Valuation<>(Collections.emptyMap());
    }

    /**
     * 返回增加 (或覆盖) 一个变量赋值后的新 Valuation。
     */
    public Valuation<V> with(V var, Constant value) {
        Map<V, Constant> extended = new HashMap<>(values);
        extended.put(var, value);
        return new Valuation<>(extended);
    }

    public boolean contains(V var) {
        return values.containsKey(var);
    }

    /**
     * @throws IllegalArgumentException 如果变量没有赋值
     */
    public Constant getValue(V var) {
        Constant value = values.get(var);
        if (value == null) {
            logger.error("尝试获取不存在的变量值：变量 '{}' 不存在于当前赋值 {} 中。", var, this);
            throw new IllegalArgumentException("no value for variable `" + var + "`");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return values.equals(((Valuation<?>) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "{" +
                values.entrySet().stream()
                        .map(entry -> entry.getKey() + "=" + entry.getValue())
                        .collect(Collectors.joining(", ")) +
                "}";
    }
}
