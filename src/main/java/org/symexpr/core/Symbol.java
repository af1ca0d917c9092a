package org.symexpr.core;

import org.symexpr.expressions.ToSmt2;

/**
 * 表达式树叶子变量需要具备的能力：标识符、类型，以及按步骤编码为 SMT-LIB2 符号。
 */
public interface Symbol extends ToSmt2 {

    String getId();

    Type getType();
}
