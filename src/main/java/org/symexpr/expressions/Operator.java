package org.symexpr.expressions;

import lombok.AccessLevel;
import lombok.Getter;
import org.symexpr.core.Constant;
import org.symexpr.core.ConstantMismatchException;
import org.symexpr.core.Type;
import org.symexpr.utils.Rational;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.BinaryOperator;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;

/**
 * 运算符枚举。
 * 每个运算符带有参数个数上下界、结合性、给人看的显示符号和发给求解器的 SMT-LIB2 符号，
 * 以及类型检查规则和常量求值规则。
 */
@Getter
public enum Operator {

    ITE(3, 3, false, List.of("if", "then", "else"), "ite", "ite"),
    IMPLIES(2, -1, false, List.of("⇒"), "=>", "=>", "implies", "⇒"),
    ADD(1, -1, true, List.of("+"), "+", "+"),
    SUB(1, -1, true, List.of("-"), "-", "-"),
    MUL(1, -1, true, List.of("*"), "*", "*"),
    DIV(2, 2, false, List.of("/"), "/", "/"),
    /**
     * 整数除法，常量求值时向零截断 ({@code (div -7 2)} 得 -3)。
     * 求解器按 SMT-LIB 的欧几里得除法解释 {@code div}，被除数或除数为负时两者结果不同 (求解器得 -4)。
     */
    IDIV(2, 2, false, List.of("div"), "div", "div"),
    /**
     * 取余，常量求值时结果与被除数同号 ({@code (mod -7 2)} 得 -1)。
     * 求解器按 SMT-LIB 的欧几里得取余解释 {@code mod}，结果总是非负 (求解器得 1)。
     */
    MOD(2, 2, false, List.of("%"), "mod", "mod"),
    GE(2, -1, true, List.of("≥"), ">=", ">=", "≥"),
    LE(2, -1, true, List.of("≤"), "<=", "<=", "≤"),
    GT(2, -1, true, List.of(">"), ">", ">"),
    LT(2, -1, true, List.of("<"), "<", "<"),
    EQ(2, -1, true, List.of("="), "=", "="),
    NOT(1, 1, false, List.of("¬"), "not", "not", "!", "¬"),
    AND(1, -1, true, List.of("⋀"), "and", "and", "&&", "⋀"),
    OR(1, -1, true, List.of("⋁"), "or", "or", "||", "⋁");

    private static final Logger logger = LoggerFactory.getLogger(Operator.class);

    private static final Map<String, Operator> BY_SYMBOL = new HashMap<>();

    static {
        for (Operator op : values()) {
            for (String alias : op.aliases) {
                BY_SYMBOL.put(alias, op);
            }
        }
    }

    private final int minArity;
    /** -1 表示无上限 */
    @Getter(AccessLevel.NONE)
    private final int maxArity;
    private final boolean leftAssociative;
    /** 显示关键字，ite 为 if/then/else，其余运算符只有一个 */
    private final List<String> displayKeywords;
    private final String wireSymbol;
    @Getter(AccessLevel.NONE)
    private final List<String> aliases;

    Operator(int minArity, int maxArity, boolean leftAssociative, List<String> displayKeywords,
             String wireSymbol, String... aliases) {
        this.minArity = minArity;
        this.maxArity = maxArity;
        this.leftAssociative = leftAssociative;
        this.displayKeywords = displayKeywords;
        this.wireSymbol = wireSymbol;
        this.aliases = List.of(aliases);
    }

    /**
     * 解析运算符名称，接受 ASCII 和 unicode 形式 (如 {@code >=} 与 {@code ≥})。
     */
    public static Optional<Operator> fromSymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }

    public OptionalInt getMaxArity() {
        return maxArity < 0 ? OptionalInt.empty() : OptionalInt.of(maxArity);
    }

    public String getDisplaySymbol() {
        return displayKeywords.get(0);
    }

    public boolean isArithRelation() {
        return this == GE || this == LE || this == GT || this == LT;
    }

    // ========== 类型检查 ==========

    /**
     * 检查运算符应用于给定类型的参数是否合法，返回结果类型。
     * @throws ExpressionTypeException 参数个数越界或参数类型不符合规则
     */
    public Type typeCheck(List<Type> argTypes) {
        Objects.requireNonNull(argTypes, "Operator-typeCheck: argTypes 不能为 null");
        checkArity(argTypes);

        switch (this) {
            case ITE -> {
                Type cnd = argTypes.get(0);
                if (cnd != Type.BOOL) {
                    throw typeError(argTypes, "expected first argument of type `bool`, got `" + cnd + "`");
                }
                Type thn = argTypes.get(1);
                Type els = argTypes.get(2);
                if (thn != els) {
                    throw typeError(argTypes, "`" + wireSymbol + "`'s second and third arguments should have the same type, got `"
                            + thn + "` and `" + els + "`");
                }
                return thn;
            }
            case IMPLIES, AND, OR, NOT -> {
                for (Type type : argTypes) {
                    if (type != Type.BOOL) {
                        throw typeError(argTypes, "`" + wireSymbol + "`'s arguments must all be boolean expressions, unexpected type `"
                                + type + "`");
                    }
                }
                return Type.BOOL;
            }
            case DIV -> {
                for (Type type : argTypes) {
                    if (!type.isArith()) {
                        throw typeError(argTypes, "`" + wireSymbol + "`'s arguments must have an arithmetic type, unexpected type `"
                                + type + "`");
                    }
                }
                return Type.RAT;
            }
            case ADD, SUB, MUL, IDIV, MOD, GE, LE, GT, LT -> {
                Type first = argTypes.get(0);
                if (!first.isArith()) {
                    throw typeError(argTypes, "`" + wireSymbol + "`'s arguments must have an arithmetic type, unexpected type `"
                            + first + "`");
                }
                for (Type type : argTypes) {
                    if (type != first) {
                        throw typeError(argTypes, "`" + wireSymbol + "`'s arguments must all have the same type, found `"
                                + first + "` and `" + type + "`");
                    }
                }
                if ((this == IDIV || this == MOD) && first != Type.INT) {
                    throw typeError(argTypes, "`" + wireSymbol + "` can only be applied to integer arguments, found `"
                            + first + "`");
                }
                if (this == IDIV || this == MOD) {
                    return Type.INT;
                }
                return isArithRelation() ? Type.BOOL : first;
            }
            case EQ -> {
                Type first = argTypes.get(0);
                for (Type type : argTypes) {
                    if (type != first) {
                        throw typeError(argTypes, "`" + wireSymbol + "`'s arguments must all have the same type, found `"
                                + first + "` and `" + type + "`");
                    }
                }
                return Type.BOOL;
            }
            default -> throw new IllegalStateException("Unknown operator " + this);
        }
    }

    private void checkArity(List<Type> argTypes) {
        int count = argTypes.size();
        if (count < minArity) {
            throw typeError(argTypes, "`" + wireSymbol + "` expects at least " + minArity + " argument(s), got " + count);
        }
        if (maxArity >= 0 && count > maxArity) {
            throw typeError(argTypes, "`" + wireSymbol + "` expects at most " + maxArity + " argument(s), got " + count);
        }
    }

    private ExpressionTypeException typeError(List<Type> argTypes, String message) {
        logger.error("类型检查失败: {} 应用于 {}: {}", wireSymbol, argTypes, message);
        return new ExpressionTypeException(this, argTypes, message);
    }

    // ========== 常量求值 ==========

    /**
     * 把运算符应用到已经化简为常量的参数上。
     * 这里只重新检查参数个数；类型在构造时已经检查过，操作数形状不符时抛出
     * {@link ConstantMismatchException}。{@link #EQ} 不检查类型，形状不同的常量直接比较为不相等。
     * @throws ExpressionTypeException 参数个数越界
     * @throws ConstantMismatchException 操作数形状不符
     * @throws ArithmeticException 除数为零
     */
    public Constant evaluate(List<Constant> args) {
        Objects.requireNonNull(args, "Operator-evaluate: args 不能为 null");
        checkArity(args.stream().map(Constant::getType).collect(Collectors.toList()));
        logger.debug("求值 {} 应用于 {}", wireSymbol, args);

        return switch (this) {
            case ITE -> args.get(0).asBool() ? args.get(1) : args.get(2);
            case IMPLIES -> evalImplies(args);
            case ADD -> foldArith(args, BigInteger::add, Rational::add);
            case SUB -> args.size() == 1
                    ? args.get(0).negate()
                    : foldArith(args, BigInteger::subtract, Rational::subtract);
            case MUL -> foldArith(args, BigInteger::multiply, Rational::multiply);
            case DIV -> Constant.rational(toRational(args.get(0), args.get(1)).divide(toRational(args.get(1), args.get(0))));
            case IDIV -> Constant.integer(requireInt(args.get(0), args.get(1)).divide(requireNonZero(args.get(0), args.get(1))));
            case MOD -> Constant.integer(requireInt(args.get(0), args.get(1)).remainder(requireNonZero(args.get(0), args.get(1))));
            case GE -> evalChain(args, cmp -> cmp >= 0);
            case LE -> evalChain(args, cmp -> cmp <= 0);
            case GT -> evalChain(args, cmp -> cmp > 0);
            case LT -> evalChain(args, cmp -> cmp < 0);
            case EQ -> evalEq(args);
            case NOT -> Constant.bool(!args.get(0).asBool());
            case AND -> {
                for (Constant arg : args) {
                    if (!arg.asBool()) {
                        yield Constant.FALSE;
                    }
                }
                yield Constant.TRUE;
            }
            case OR -> {
                for (Constant arg : args) {
                    if (arg.asBool()) {
                        yield Constant.TRUE;
                    }
                }
                yield Constant.FALSE;
            }
        };
    }

    /**
     * 右结合：{@code a1 ⇒ (a2 ⇒ (… ⇒ an))}。
     * 只要某个前件为假结果即为真，否则结果为最后一个参数。
     */
    private static Constant evalImplies(List<Constant> args) {
        int last = args.size() - 1;
        for (int i = 0; i < last; i++) {
            if (!args.get(i).asBool()) {
                return Constant.TRUE;
            }
        }
        return Constant.bool(args.get(last).asBool());
    }

    private Constant foldArith(List<Constant> args, BinaryOperator<BigInteger> intOp, BinaryOperator<Rational> ratOp) {
        Constant acc = args.get(0);
        if (!acc.getType().isArith()) {
            logger.error("{} 的参数 {} 不是算术常量", wireSymbol, acc);
            throw ConstantMismatchException.forOperand(wireSymbol, acc, Type.INT);
        }
        for (int i = 1; i < args.size(); i++) {
            Constant rhs = args.get(i);
            if (acc.getType() == Type.INT && rhs.getType() == Type.INT) {
                acc = Constant.integer(intOp.apply(acc.asInt(), rhs.asInt()));
            } else if (acc.getType() == Type.RAT && rhs.getType() == Type.RAT) {
                acc = Constant.rational(ratOp.apply(acc.asRat(), rhs.asRat()));
            } else {
                throw operandError(acc, rhs);
            }
        }
        return acc;
    }

    /**
     * 把整数提升为有理数，{@code other} 只用于错误信息。
     */
    private Rational toRational(Constant cst, Constant other) {
        return switch (cst.getType()) {
            case INT -> Rational.valueOf(cst.asInt());
            case RAT -> cst.asRat();
            case BOOL -> throw operandError(cst, other);
        };
    }

    private BigInteger requireInt(Constant lhs, Constant rhs) {
        if (lhs.getType() != Type.INT || rhs.getType() != Type.INT) {
            throw operandError(lhs, rhs);
        }
        return lhs.asInt();
    }

    private BigInteger requireNonZero(Constant lhs, Constant rhs) {
        BigInteger divisor = rhs.asInt();
        if (divisor.signum() == 0) {
            logger.error("{} 的除数为零: {} {} {}", wireSymbol, lhs, wireSymbol, rhs);
            throw new ArithmeticException("`" + wireSymbol + "` by zero: (" + wireSymbol + " " + lhs + " " + rhs + ")");
        }
        return divisor;
    }

    /**
     * 链式比较：逐对从左到右检查相邻参数，遇到第一对不成立就返回 false。
     */
    private Constant evalChain(List<Constant> args, IntPredicate holds) {
        for (int i = 1; i < args.size(); i++) {
            Constant lhs = args.get(i - 1);
            Constant rhs = args.get(i);
            int cmp;
            if (lhs.getType() == Type.INT && rhs.getType() == Type.INT) {
                cmp = lhs.asInt().compareTo(rhs.asInt());
            } else if (lhs.getType() == Type.RAT && rhs.getType() == Type.RAT) {
                cmp = lhs.asRat().compareTo(rhs.asRat());
            } else {
                throw operandError(lhs, rhs);
            }
            if (!holds.test(cmp)) {
                return Constant.FALSE;
            }
        }
        return Constant.TRUE;
    }

    /**
     * 结构相等，不检查类型：形状不同的常量比较结果为 false。
     */
    private static Constant evalEq(List<Constant> args) {
        Constant first = args.get(0);
        for (int i = 1; i < args.size(); i++) {
            if (!first.equals(args.get(i))) {
                return Constant.FALSE;
            }
        }
        return Constant.TRUE;
    }

    private ConstantMismatchException operandError(Constant lhs, Constant rhs) {
        logger.error("无法对 {}: {} 和 {}: {} 应用 {}", lhs, lhs.getType(), rhs, rhs.getType(), wireSymbol);
        return ConstantMismatchException.forOperands(wireSymbol, lhs, rhs);
    }
}
