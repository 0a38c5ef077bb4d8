package org.symtrans.symbolic;

import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.enumerations.Z3_sort_kind;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symtrans.core.Declaration;
import org.symtrans.core.Sort;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 负责 {@link Sort} 与 Z3 Sort 之间的映射，并为声明创建对应的 Z3 常量。
 * 每种类型在一个 Z3 Context 中只创建一次并缓存。
 * 与 Z3 Context 一样，此类不是线程安全的。
 * @author Ayalyt
 */
@Getter
public class Z3SortManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3SortManager.class);

    private final Context ctx;
    private final Map<Sort, com.microsoft.z3.Sort> z3Sorts;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     */
    public Z3SortManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.z3Sorts = new HashMap<>();
        logger.debug("Z3SortManager 初始化完成");
    }

    /**
     * 获取指定类型对应的 Z3 Sort，尚未创建时创建并缓存。
     * @param sort 类型。
     * @return 对应的 Z3 Sort。
     */
    public com.microsoft.z3.Sort getZ3Sort(Sort sort) {
        return z3Sorts.computeIfAbsent(sort, s -> {
            logger.debug("创建 Z3 类型: {}", s);
            return switch (s.getKind()) {
                case STRING -> ctx.mkStringSort();
                case INT -> ctx.mkIntSort();
                case BOOL -> ctx.mkBoolSort();
                case BITVECTOR -> ctx.mkBitVecSort(s.getWidth());
            };
        });
    }

    /**
     * 为声明创建 Z3 常量。同名同类型的常量在 Z3 中是同一个项。
     * @param declaration 符号声明。
     * @return 对应的 Z3 常量。
     */
    public Expr<?> mkConst(Declaration declaration) {
        logger.debug("创建 Z3 常量: {}", declaration);
        return ctx.mkConst(declaration.getName(), getZ3Sort(declaration.getSort()));
    }

    /**
     * 把 Z3 Sort 转换回 {@link Sort}。
     * @throws IllegalArgumentException 如果 Z3 Sort 不在支持的类型之内。
     */
    public Sort fromZ3Sort(com.microsoft.z3.Sort z3Sort) {
        Z3_sort_kind kind = z3Sort.getSortKind();
        if (kind == Z3_sort_kind.Z3_INT_SORT) {
            return Sort.INT;
        }
        if (kind == Z3_sort_kind.Z3_BOOL_SORT) {
            return Sort.BOOL;
        }
        if (kind == Z3_sort_kind.Z3_BV_SORT) {
            return Sort.bitVector(((BitVecSort) z3Sort).getSize());
        }
        if (z3Sort.equals(getZ3Sort(Sort.STRING))) {
            return Sort.STRING;
        }
        logger.error("不支持的 Z3 类型: {}", z3Sort);
        throw new IllegalArgumentException("Unsupported Z3 sort: " + z3Sort);
    }
}
