package org.symexpr.expressions;

/**
 * 定义将 Java 对象编码为 SMT-LIB2 文本的接口。
 * 步骤 (step) 上下文只影响带时间下标的变量，其他节点原样传递给子节点。
 */
public interface ToSmt2 {

    /**
     * 在没有步骤上下文的情况下写出 SMT-LIB2 文本。
     * @param out 输出缓冲区。
     */
    void toSmt2(StringBuilder out);

    /**
     * 在步骤 {@code step} 的上下文中写出 SMT-LIB2 文本。
     * @param out 输出缓冲区。
     * @param step 当前步骤下标，必须非负。
     */
    void toSmt2(StringBuilder out, int step);

    default String toSmt2() {
        StringBuilder out = new StringBuilder();
        toSmt2(out);
        return out.toString();
    }

    default String toSmt2(int step) {
        StringBuilder out = new StringBuilder();
        toSmt2(out, step);
        return out.toString();
    }
}
