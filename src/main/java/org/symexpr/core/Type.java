package org.symexpr.core;

import java.util.Optional;

/**
 * 表达式的类型：布尔、无界整数、精确有理数。
 */
public enum Type {

    BOOL("bool", "Bool"),
    INT("int", "Int"),
    RAT("rat", "Real");

    private final String name;
    private final String sort;

    Type(String name, String sort) {
        this.name = name;
        this.sort = sort;
    }

    /**
     * @return 是否为算术类型 (int 或 rat)。
     */
    public boolean isArith() {
        return this != BOOL;
    }

    /**
     * @return SMT-LIB2 中对应的 sort 名称。
     */
    public String toSmt2() {
        return sort;
    }

    public static Optional<Type> fromName(String name) {
        for (Type type : values()) {
            if (type.name.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return name;
    }
}
