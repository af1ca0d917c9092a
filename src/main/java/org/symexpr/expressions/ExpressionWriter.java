package org.symexpr.expressions;

import org.symexpr.core.Symbol;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 把表达式写成前缀形式的文本，迭代实现。
 * SMT-LIB2 模式使用运算符的 wire 符号并按步骤编码变量；显示模式使用显示符号，
 * 多关键字的运算符 (ite) 写成 {@code (if c then t else e)}。
 */
final class ExpressionWriter {

    /** 没有步骤上下文 */
    static final int NO_STEP = -1;

    private ExpressionWriter() {
    }

    private static final class Cursor<V extends Symbol> {
        private final Application<V> app;
        private int next;

        private Cursor(Application<V> app) {
            this.app = app;
        }
    }

    static <V extends Symbol> void write(Expression<V> root, StringBuilder out, boolean smt2, int step) {
        Deque<Cursor<V>> stack = new ArrayDeque<>();
        Expression<V> current = root;

        while (current != null) {
            if (current instanceof Application<V> app) {
                Operator op = app.getOperator();
                out.append('(').append(smt2 ? op.getWireSymbol() : op.getDisplaySymbol());
                stack.push(new Cursor<>(app));
            } else if (current instanceof VariableExpression<V> var) {
                writeVariable(var.getVariable(), out, smt2, step);
            } else {
                out.append(((ConstantExpression<V>) current).getConstant());
            }

            current = null;
            while (!stack.isEmpty()) {
                Cursor<V> cursor = stack.peek();
                if (cursor.next < cursor.app.arity()) {
                    int index = cursor.next++;
                    out.append(' ');
                    List<String> keywords = cursor.app.getOperator().getDisplayKeywords();
                    if (!smt2 && index > 0 && index < keywords.size()) {
                        out.append(keywords.get(index)).append(' ');
                    }
                    current = cursor.app.getArguments().get(index);
                    break;
                }
                stack.pop();
                out.append(')');
            }
        }
    }

    private static void writeVariable(Symbol variable, StringBuilder out, boolean smt2, int step) {
        if (!smt2) {
            out.append(variable);
        } else if (step == NO_STEP) {
            variable.toSmt2(out);
        } else {
            variable.toSmt2(out, step);
        }
    }
}
