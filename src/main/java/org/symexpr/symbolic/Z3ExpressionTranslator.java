package org.symexpr.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import org.symexpr.core.Constant;
import org.symexpr.core.Symbol;
import org.symexpr.expressions.Expression;
import org.symexpr.expressions.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * 把表达式翻译为 Z3 AST，遍历使用 {@link Expression#fold} 的显式栈。
 * 变量由 {@link Z3VariableManager} 缓存，有步骤时按 {@code id@step} 区分。
 */
public class Z3ExpressionTranslator {

    private static final Logger logger = LoggerFactory.getLogger(Z3ExpressionTranslator.class);

    private final Context ctx;
    private final Z3VariableManager varManager;

    public Z3ExpressionTranslator(Context ctx, Z3VariableManager varManager) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.varManager = Objects.requireNonNull(varManager, "Z3VariableManager cannot be null.");
    }

    public <V extends Symbol> Expr<?> translate(Expression<V> expr) {
        return expr.<Expr<?>>fold(varManager::getZ3Var, this::toZ3Constant, this::apply);
    }

    public <V extends Symbol> Expr<?> translate(Expression<V> expr, int step) {
        return expr.<Expr<?>>fold(var -> varManager.getZ3Var(var, step), this::toZ3Constant, this::apply);
    }

    public Expr<?> toZ3Constant(Constant constant) {
        return switch (constant.getType()) {
            case BOOL -> ctx.mkBool(constant.asBool());
            case INT -> ctx.mkInt(constant.asInt().toString());
            case RAT -> constant.asRat().toZ3Real(ctx);
        };
    }

    private Expr<?> apply(Operator op, List<Expr<?>> args) {
        logger.debug("翻译 {} 的 {} 个参数", op.getWireSymbol(), args.size());
        return switch (op) {
            case ITE -> ctx.mkITE((BoolExpr) args.get(0), (Expr) args.get(1), (Expr) args.get(2));
            case IMPLIES -> {
                // 右结合
                BoolExpr acc = (BoolExpr) args.get(args.size() - 1);
                for (int i = args.size() - 2; i >= 0; i--) {
                    acc = ctx.mkImplies((BoolExpr) args.get(i), acc);
                }
                yield acc;
            }
            case ADD -> ctx.mkAdd(arith(args));
            case SUB -> args.size() == 1 ? ctx.mkUnaryMinus((ArithExpr) args.get(0)) : ctx.mkSub(arith(args));
            case MUL -> ctx.mkMul(arith(args));
            case DIV -> ctx.mkDiv(toReal(args.get(0)), toReal(args.get(1)));
            case IDIV -> ctx.mkDiv((IntExpr) args.get(0), (IntExpr) args.get(1));
            case MOD -> ctx.mkMod((IntExpr) args.get(0), (IntExpr) args.get(1));
            case GE -> chain(args, (l, r) -> ctx.mkGe((ArithExpr) l, (ArithExpr) r));
            case LE -> chain(args, (l, r) -> ctx.mkLe((ArithExpr) l, (ArithExpr) r));
            case GT -> chain(args, (l, r) -> ctx.mkGt((ArithExpr) l, (ArithExpr) r));
            case LT -> chain(args, (l, r) -> ctx.mkLt((ArithExpr) l, (ArithExpr) r));
            case EQ -> chain(args, (l, r) -> ctx.mkEq((Expr) l, (Expr) r));
            case NOT -> ctx.mkNot((BoolExpr) args.get(0));
            case AND -> ctx.mkAnd(bools(args));
            case OR -> ctx.mkOr(bools(args));
        };
    }

    /**
     * 链式关系展开为相邻参数两两比较的合取。
     */
    private BoolExpr chain(List<Expr<?>> args, BiFunction<Expr<?>, Expr<?>, BoolExpr> relation) {
        BoolExpr[] pairs = new BoolExpr[args.size() - 1];
        for (int i = 1; i < args.size(); i++) {
            pairs[i - 1] = relation.apply(args.get(i - 1), args.get(i));
        }
        return pairs.length == 1 ? pairs[0] : ctx.mkAnd(pairs);
    }

    private static ArithExpr[] arith(List<Expr<?>> args) {
        ArithExpr[] result = new ArithExpr[args.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = (ArithExpr) args.get(i);
        }
        return result;
    }

    private static BoolExpr[] bools(List<Expr<?>> args) {
        BoolExpr[] result = new BoolExpr[args.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = (BoolExpr) args.get(i);
        }
        return result;
    }

    /**
     * {@code /} 在 Z3 中对两个整数是整除，先把整数提升为实数。
     */
    private ArithExpr toReal(Expr<?> arg) {
        if (arg.isInt()) {
            return ctx.mkInt2Real((IntExpr) arg);
        }
        return (ArithExpr) arg;
    }
}
