package org.symexpr.expressions;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.symexpr.core.Constant;
import org.symexpr.core.StatefulVariable;
import org.symexpr.core.Type;
import org.symexpr.core.Valuation;
import org.symexpr.core.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionTest {

    private static final int DEPTH = 100_000;

    // --- Test Setup ---
    private static Variable x;
    private static Variable b;
    private static Variable v1;
    private static Variable v2;
    private static Expression<Variable> xExpr;
    private static Expression<Variable> bExpr;
    private static Expression<Variable> zero;
    private static Expression<Variable> one;

    @BeforeAll
    static void setUp() {
        x = Variable.of("x", Type.INT);
        b = Variable.of("b", Type.BOOL);
        v1 = Variable.of("v_1", Type.INT);
        v2 = Variable.of("v_2", Type.BOOL);

        xExpr = Expression.fromVariable(x);
        bExpr = Expression.fromVariable(b);
        zero = Expression.fromConstant(Constant.integer(0));
        one = Expression.fromConstant(Constant.integer(1));
    }

    /** (+ 1 (+ 1 (... (+ 1 x)))) */
    private static Expression<Variable> deepChain(Expression<Variable> leaf) {
        Expression<Variable> expr = leaf;
        for (int i = 0; i < DEPTH; i++) {
            expr = Expression.fromApplication(Operator.ADD, one, expr);
        }
        return expr;
    }

    @Nested
    @DisplayName("构造与化简 (Construction and simplification)")
    class ConstructionTests {

        @Test
        @DisplayName("常量上的一元取反折叠为常量")
        void testUnaryMinusOnConstant_Folds() {
            Expression<Variable> expr = Expression.fromApplication(Operator.SUB,
                    Expression.<Variable>fromConstant(Constant.rational(3, 2)));

            assertAll("Folded",
                    () -> assertTrue(expr.isConstant()),
                    () -> assertEquals(Type.RAT, expr.getType()),
                    () -> assertEquals(Constant.rational(-3, 2), ((ConstantExpression<Variable>) expr).getConstant())
            );
        }

        @Test
        @DisplayName("变量上的一元取反保留为应用节点")
        void testUnaryMinusOnVariable_Kept() {
            Expression<Variable> expr = Expression.fromApplication(Operator.SUB, xExpr);

            assertTrue(expr.isApplication());
            assertEquals(Type.INT, expr.getType());
            assertEquals("(- x)", expr.toSmt2());
        }

        @Test
        @DisplayName("单参数的 +、and、or 返回参数本身")
        void testSingleArgument_Collapses() {
            assertAll("Collapsed",
                    () -> assertSame(xExpr, Expression.fromApplication(Operator.ADD, xExpr)),
                    () -> assertSame(bExpr, Expression.fromApplication(Operator.AND, bExpr)),
                    () -> assertSame(bExpr, Expression.fromApplication(Operator.OR, bExpr)),
                    () -> assertTrue(Expression.fromApplication(Operator.MUL, xExpr).isApplication())
            );
        }

        @Test
        @DisplayName("化简前仍然做类型检查")
        void testTypeErrors_Throw() {
            assertAll("Type errors",
                    () -> assertThrows(ExpressionTypeException.class,
                            () -> Expression.fromApplication(Operator.ADD, xExpr, bExpr)),
                    () -> assertThrows(ExpressionTypeException.class,
                            () -> Expression.fromApplication(Operator.AND, xExpr)),
                    () -> assertThrows(ExpressionTypeException.class,
                            () -> Expression.fromApplication(Operator.SUB,
                                    Expression.<Variable>fromConstant(Constant.TRUE))),
                    () -> assertThrows(ExpressionTypeException.class,
                            () -> Expression.fromApplication(Operator.NOT, List.of()))
            );
        }

        @Test
        @DisplayName("记住的类型与重新推导的类型一致")
        void testRecomputeType() {
            Expression<Variable> cmp = Expression.fromApplication(Operator.GE,
                    Expression.fromApplication(Operator.DIV, xExpr, one),
                    Expression.<Variable>fromConstant(Constant.rational(1, 2)));
            Expression<Variable> ite = Expression.fromApplication(Operator.ITE, cmp, xExpr, zero);

            assertAll("Types",
                    () -> assertEquals(Type.BOOL, cmp.getType()),
                    () -> assertEquals(cmp.getType(), cmp.recomputeType()),
                    () -> assertEquals(Type.INT, ite.getType()),
                    () -> assertEquals(ite.getType(), ite.recomputeType())
            );
        }

        @Test
        @DisplayName("参数列表被复制，外部修改不影响表达式")
        void testArguments_AreCopied() {
            List<Expression<Variable>> args = new ArrayList<>(List.of(xExpr, one));
            Application<Variable> app = (Application<Variable>) Expression.fromApplication(Operator.ADD, args);
            args.add(zero);

            assertEquals(2, app.arity());
            assertThrows(UnsupportedOperationException.class, () -> app.getArguments().add(zero));
        }
    }

    @Nested
    @DisplayName("SMT-LIB2 编码与显示 (Encoding and display)")
    class EncodingTests {

        @Test
        @DisplayName("无状态变量: 有步骤时写出 id@step")
        void testStatelessEncoding() {
            Expression<Variable> expr = Expression.fromApplication(Operator.GE,
                    Expression.fromApplication(Operator.ADD, xExpr, Expression.fromConstant(Constant.integer(-5))),
                    zero);

            assertAll("Encoding",
                    () -> assertEquals("(>= (+ x (- 5)) 0)", expr.toSmt2()),
                    () -> assertEquals("(>= (+ x@3 (- 5)) 0)", expr.toSmt2(3)),
                    () -> assertEquals("(≥ (+ x (- 5)) 0)", expr.toString()),
                    () -> assertThrows(IllegalArgumentException.class, () -> expr.toSmt2(-1))
            );
        }

        @Test
        @DisplayName("有状态变量: 下一状态编码为 id@(step+1)")
        void testStatefulEncoding() {
            Variable cnt = Variable.of("cnt", Type.INT);
            Expression<StatefulVariable> transition = Expression.fromApplication(Operator.EQ,
                    Expression.fromVariable(StatefulVariable.next(cnt)),
                    Expression.fromApplication(Operator.ADD,
                            Expression.fromVariable(StatefulVariable.current(cnt)),
                            Expression.fromConstant(Constant.integer(1))));

            assertAll("Stateful",
                    () -> assertEquals("(= cnt@5 (+ cnt@4 1))", transition.toSmt2(4)),
                    () -> assertEquals("(= cnt@1 (+ cnt@0 1))", transition.toSmt2()),
                    () -> assertEquals("(= cnt@1 (+ cnt@0 1))", transition.toString())
            );
        }

        @Test
        @DisplayName("ite 显示为 (if c then t else e)，SMT-LIB2 中为 ite")
        void testIteDisplay() {
            Expression<Variable> expr = Expression.fromApplication(Operator.ITE, bExpr, xExpr, zero);

            assertEquals("(if b then x else 0)", expr.toString());
            assertEquals("(ite b x 0)", expr.toSmt2());
        }

        @Test
        @DisplayName("运算符的显示符号与 SMT-LIB2 符号不同")
        void testDisplaySymbols() {
            Expression<Variable> expr = Expression.fromApplication(Operator.IMPLIES,
                    Expression.fromApplication(Operator.NOT, bExpr),
                    Expression.fromApplication(Operator.EQ,
                            Expression.fromApplication(Operator.MOD, xExpr, Expression.fromConstant(Constant.integer(2))),
                            zero));

            assertEquals("(=> (not b) (= (mod x 2) 0))", expr.toSmt2());
            assertEquals("(⇒ (¬ b) (= (% x 2) 0))", expr.toString());
        }

        @Test
        @DisplayName("取反视图编码为 (not ...)")
        void testNegated() {
            Expression<Variable> conj = Expression.fromApplication(Operator.AND,
                    Expression.fromApplication(Operator.GE, Expression.fromVariable(v1), zero),
                    Expression.fromVariable(v2));
            NegatedExpression<Variable> negated = conj.negated();

            assertAll("Negated",
                    () -> assertEquals("(not (and (>= v_1@0 0) v_2@0))", negated.toSmt2(0)),
                    () -> assertEquals("(not (and (>= v_1 0) v_2))", negated.toSmt2()),
                    () -> assertSame(conj, negated.getInner()),
                    () -> assertEquals("(¬ (⋀ (≥ v_1 0) v_2))", negated.toString()),
                    () -> assertThrows(ExpressionTypeException.class, () -> xExpr.negated())
            );
        }

        @Test
        @DisplayName("cleanRepr 压缩空白")
        void testCleanRepr() {
            assertEquals("(>= x 0)", Expression.cleanRepr("\n  (>=   x\n   0) "));
        }
    }

    @Nested
    @DisplayName("求值 (Evaluation)")
    class EvaluationTests {

        @Test
        @DisplayName("用赋值替换变量后折叠为常量")
        void testEvaluate_WithValuation() {
            Expression<Variable> expr = Expression.fromApplication(Operator.ITE,
                    bExpr,
                    Expression.fromApplication(Operator.DIV, xExpr, Expression.fromConstant(Constant.integer(4))),
                    Expression.<Variable>fromConstant(Constant.rational(-1, 1)));
            Valuation<Variable> valuation = Valuation.of(Map.of(x, Constant.integer(6), b, Constant.TRUE));

            assertAll("Evaluation",
                    () -> assertEquals(Constant.rational(3, 2), expr.evaluate(valuation)),
                    () -> assertEquals(Constant.rational(-1, 1),
                            expr.evaluate(valuation.with(b, Constant.FALSE)))
            );
        }

        @Test
        @DisplayName("缺少变量赋值时抛出 IllegalArgumentException")
        void testEvaluate_MissingVariable_Throws() {
            Expression<Variable> expr = Expression.fromApplication(Operator.ADD, xExpr, one);

            assertThrows(IllegalArgumentException.class, () -> expr.evaluate(Valuation.empty()));
        }

        @Test
        @DisplayName("除数为零在求值时抛出 ArithmeticException")
        void testEvaluate_DivisionByZero_Throws() {
            Expression<Variable> expr = Expression.fromApplication(Operator.IDIV, one, xExpr);

            assertThrows(ArithmeticException.class,
                    () -> expr.evaluate(Valuation.of(Map.of(x, Constant.integer(0)))));
        }

        @Test
        @DisplayName("fold 自底向上、从左到右访问节点")
        void testFold_Order() {
            Expression<Variable> expr = Expression.fromApplication(Operator.SUB,
                    Expression.fromApplication(Operator.MUL, xExpr, one), zero);

            String visited = expr.<String>fold(
                    var -> var.getId(),
                    Constant::toString,
                    (op, children) -> op.getWireSymbol() + children);

            assertEquals("-[*[x, 1], 0]", visited);
        }
    }

    @Nested
    @DisplayName("结构相等 (Structural equality)")
    class EqualityTests {

        @Test
        @DisplayName("结构相同的表达式相等，参数顺序有意义")
        void testEquality() {
            Expression<Variable> a1 = Expression.fromApplication(Operator.ADD, xExpr, one);
            Expression<Variable> a2 = Expression.fromApplication(Operator.ADD,
                    Expression.fromVariable(Variable.of("x", Type.INT)),
                    Expression.fromConstant(Constant.integer(1)));
            Expression<Variable> swapped = Expression.fromApplication(Operator.ADD, one, xExpr);

            assertAll("Equality",
                    () -> assertEquals(a1, a2),
                    () -> assertEquals(a1.hashCode(), a2.hashCode()),
                    () -> assertNotEquals(a1, swapped),
                    () -> assertNotEquals(a1, Expression.fromApplication(Operator.MUL, xExpr, one)),
                    () -> assertNotEquals(one, Expression.<Variable>fromConstant(Constant.rational(1, 1)))
            );
        }
    }

    @Nested
    @DisplayName("深层表达式 (Deep expressions)")
    class DeepExpressionTests {

        @Test
        @DisplayName("十万层嵌套的 + 链: fold、编码、求值和相等判断都不会栈溢出")
        void testDeepChain() {
            Expression<Variable> chain = deepChain(xExpr);
            Expression<Variable> same = deepChain(Expression.fromVariable(x));
            Expression<Variable> other = deepChain(Expression.fromVariable(Variable.of("y", Type.INT)));

            int nodes = chain.<Integer>fold(var -> 1, cst -> 1,
                    (op, children) -> 1 + children.stream().mapToInt(Integer::intValue).sum());
            String smt2 = chain.toSmt2(2);

            assertAll("Deep chain",
                    () -> assertEquals(2 * DEPTH + 1, nodes),
                    () -> assertEquals(Type.INT, chain.recomputeType()),
                    () -> assertEquals(Constant.integer(DEPTH + 7),
                            chain.evaluate(Valuation.of(Map.of(x, Constant.integer(7))))),
                    () -> assertTrue(smt2.startsWith("(+ 1 (+ 1 ")),
                    () -> assertTrue(smt2.endsWith("x@2" + ")".repeat(DEPTH))),
                    () -> assertEquals(chain, same),
                    () -> assertNotEquals(chain, other),
                    () -> assertTrue(chain.toString().endsWith("(+ 1 x)" + ")".repeat(DEPTH - 1)))
            );
        }
    }
}
