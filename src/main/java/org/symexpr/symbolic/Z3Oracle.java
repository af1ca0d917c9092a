package org.symexpr.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.RatNum;
import com.microsoft.z3.Z3Exception;
import lombok.Getter;
import org.symexpr.core.Constant;
import org.symexpr.core.Symbol;
import org.symexpr.core.Type;
import org.symexpr.expressions.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 以进程内的 Z3 作为参考 SMT-LIB2 读取器和求值器。
 * 用于把 SMT-LIB2 文本读回常量，以及用 Z3 的化简结果对照本地求值器。
 * 不做 check-sat，也不管理求解器进程。
 */
@Getter
public class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    /** 解析时用来承接待求值项的常量名 */
    private static final String PROBE = "|probe|";

    private final Context ctx;
    private final Z3VariableManager varManager;
    private final Z3ExpressionTranslator translator;

    public Z3Oracle() {
        this.ctx = new Context();
        this.varManager = new Z3VariableManager(ctx);
        this.translator = new Z3ExpressionTranslator(ctx, varManager);
        logger.debug("Z3Oracle 初始化完成");
    }

    /**
     * 用 Z3 的 SMT-LIB2 解析器读取一个常量项并化简为 {@link Constant}。
     * @param smt2 常量的 SMT-LIB2 文本，例如 {@code (- (/ 3 2))}
     * @param type 期望的类型
     */
    public Constant parseConstant(String smt2, Type type) {
        return evaluateSmt2(smt2, type);
    }

    /**
     * 读取任意闭合 (不含自由变量) 的 SMT-LIB2 项，由 Z3 化简为常量。
     * @throws IllegalStateException Z3 无法解析或无法化简为常量
     */
    public Constant evaluateSmt2(String term, Type type) {
        Objects.requireNonNull(term, "Z3Oracle: term 不能为 null");
        String script = "(declare-fun " + PROBE + " () " + type.toSmt2() + ")\n"
                + "(assert (= " + PROBE + " " + term + "))";
        logger.debug("交给 Z3 解析: {}", script);
        BoolExpr[] assertions;
        try {
            assertions = ctx.parseSMTLIB2String(script, null, null, null, null);
        } catch (Z3Exception e) {
            logger.error("Z3 无法解析 {}: {}", term, e.getMessage());
            throw new IllegalStateException("Z3 failed to parse `" + term + "`", e);
        }
        if (assertions.length != 1) {
            logger.error("Z3 解析 {} 得到 {} 条断言", term, assertions.length);
            throw new IllegalStateException("expected exactly one assertion for `" + term + "`");
        }
        return toConstant(assertions[0].getArgs()[1]);
    }

    /**
     * 把闭合表达式编码为 SMT-LIB2 文本，再交给 Z3 读取并化简。
     */
    public <V extends Symbol> Constant evaluate(Expression<V> ground) {
        return evaluateSmt2(ground.toSmt2(), ground.getType());
    }

    /**
     * 通过 Z3 API 翻译闭合表达式并化简，不经过文本。
     */
    public <V extends Symbol> Constant simplify(Expression<V> ground) {
        return toConstant(translator.translate(ground));
    }

    /**
     * 化简 Z3 项并转换为常量。
     * @throws IllegalStateException 化简结果不是数值或布尔常量
     */
    public Constant toConstant(Expr<?> term) {
        Expr<?> simplified = term.simplify();
        if (simplified.isTrue()) {
            return Constant.TRUE;
        }
        if (simplified.isFalse()) {
            return Constant.FALSE;
        }
        if (simplified.isIntNum()) {
            return Constant.integer(((IntNum) simplified).getBigInteger());
        }
        if (simplified.isRatNum()) {
            RatNum rat = (RatNum) simplified;
            return Constant.rational(rat.getBigIntNumerator(), rat.getBigIntDenominator());
        }
        logger.error("Z3 未能把 {} 化简为常量，得到 {}", term, simplified);
        throw new IllegalStateException("Z3 did not reduce `" + term + "` to a constant: " + simplified);
    }

    @Override
    public void close() {
        ctx.close();
        logger.debug("Z3Oracle 已关闭");
    }
}
