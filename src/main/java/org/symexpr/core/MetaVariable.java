package org.symexpr.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 元变量：没有类型的裸标识符，脚本层用它给表达式模板命名。不参与类型化的表达式树。
 */
@Getter
public final class MetaVariable {

    private final String ident;

    private MetaVariable(String ident) {
        this.ident = Objects.requireNonNull(ident, "MetaVariable: ident 不能为 null");
    }

    public static MetaVariable of(String ident) {
        return new MetaVariable(ident);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return ident.equals(((MetaVariable) o).ident);
    }

    @Override
    public int hashCode() {
        return ident.hashCode();
    }

    @Override
    public String toString() {
        return ident;
    }
}
