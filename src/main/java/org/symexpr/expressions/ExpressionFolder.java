package org.symexpr.expressions;

import org.symexpr.core.Constant;
import org.symexpr.core.Symbol;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * 表达式的自底向上折叠，用显式的帧栈代替递归，深度只受堆内存限制。
 */
final class ExpressionFolder {

    private static final int INITIAL_STACK_CAPACITY = 16;

    private ExpressionFolder() {
    }

    /**
     * 栈上的一帧对应一个正在处理的应用节点：前 {@code results.size()} 个子节点已经折叠完，
     * 正在处理下一个，剩下的子节点由 {@code todo} 给出。
     */
    private static final class Frame<V extends Symbol, A> {
        private final Operator op;
        private final List<A> results;
        private final Iterator<Expression<V>> todo;

        private Frame(Operator op, int arity, Iterator<Expression<V>> todo) {
            this.op = op;
            this.results = new ArrayList<>(arity);
            this.todo = todo;
        }
    }

    static <V extends Symbol, A> A fold(Expression<V> root,
                                        Function<? super V, ? extends A> varAction,
                                        Function<? super Constant, ? extends A> cstAction,
                                        BiFunction<? super Operator, ? super List<A>, ? extends A> appAction) {
        Deque<Frame<V, A>> stack = new ArrayDeque<>(INITIAL_STACK_CAPACITY);
        Expression<V> current = root;

        while (true) {
            // 向下：叶子直接得到结果，应用节点压栈后进入第一个子节点
            A acc;
            if (current instanceof Application<V> app) {
                Iterator<Expression<V>> todo = app.getArguments().iterator();
                if (todo.hasNext()) {
                    stack.push(new Frame<>(app.getOperator(), app.arity(), todo));
                    current = todo.next();
                    continue;
                }
                acc = appAction.apply(app.getOperator(), new ArrayList<>());
            } else if (current instanceof VariableExpression<V> var) {
                acc = varAction.apply(var.getVariable());
            } else {
                acc = cstAction.apply(((ConstantExpression<V>) current).getConstant());
            }

            // 向上：把结果交给栈顶帧，还有子节点就继续向下，否则完成该应用节点
            Expression<V> next = null;
            while (!stack.isEmpty()) {
                Frame<V, A> frame = stack.peek();
                frame.results.add(acc);
                if (frame.todo.hasNext()) {
                    next = frame.todo.next();
                    break;
                }
                stack.pop();
                acc = appAction.apply(frame.op, frame.results);
            }
            if (next == null) {
                return acc;
            }
            current = next;
        }
    }
}
