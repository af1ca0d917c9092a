package org.symexpr.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.symexpr.core.Symbol;
import org.symexpr.core.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 负责管理变量到 Z3 常量的映射。
 * Z3 常量以变量的 SMT-LIB2 符号命名 (有步骤时为 {@code id@step})，
 * 同名同类型的变量在同一个 Context 中只对应一个 Z3 常量。
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 这个实例不在线程间共享，HashMap 即可
    private final Map<Pair<String, Type>, Expr<?>> z3Vars;

    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.z3Vars = new HashMap<>();
    }

    /**
     * 类型对应的 Z3 sort：bool → Bool，int → Int，rat → Real。
     */
    public Sort toZ3Sort(Type type) {
        return switch (type) {
            case BOOL -> ctx.mkBoolSort();
            case INT -> ctx.mkIntSort();
            case RAT -> ctx.mkRealSort();
        };
    }

    /**
     * 无步骤上下文时变量对应的 Z3 常量。
     */
    public Expr<?> getZ3Var(Symbol symbol) {
        return getZ3Var(symbol.toSmt2(), symbol.getType());
    }

    /**
     * 第 {@code step} 步时变量对应的 Z3 常量。
     */
    public Expr<?> getZ3Var(Symbol symbol, int step) {
        return getZ3Var(symbol.toSmt2(step), symbol.getType());
    }

    private Expr<?> getZ3Var(String name, Type type) {
        return z3Vars.computeIfAbsent(Pair.of(name, type), key -> {
            logger.info("创建 Z3 变量: {}: {}", name, type.toSmt2());
            return ctx.mkConst(name, toZ3Sort(type));
        });
    }
}
