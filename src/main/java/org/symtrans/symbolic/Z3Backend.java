package org.symtrans.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.CharSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Global;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.SeqSort;
import com.microsoft.z3.enumerations.Z3_decl_kind;
import com.microsoft.z3.enumerations.Z3_sort_kind;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symtrans.backends.Backend;
import org.symtrans.backends.BackendOptions;
import org.symtrans.backends.ExpressionDialect;
import org.symtrans.backends.LeafTranslation;
import org.symtrans.core.BitVecValue;
import org.symtrans.core.Declaration;
import org.symtrans.core.Sort;
import org.symtrans.core.StringValue;
import org.symtrans.expressions.LeafOperation;
import org.symtrans.expressions.RawOperation;
import org.symtrans.expressions.TermInspector;

import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * 把表达式树翻译成内存中的 Z3 表达式对象的后端。
 * <p>
 * 编码与 SMT-LIB 文本后端一致：BVS 声明为整数常量，BVV 为位向量数值，
 * 字符串操作映射到 Z3 的序列理论。
 * 后端持有一个 Z3 Context，与 Context 一样不是线程安全的；用完后应调用 {@link #close()}。
 * @author Ayalyt
 */
public class Z3Backend extends Backend<Expr<?>> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Backend.class);

    public static final String NAME = "z3";

    // 断言必须写在一行内
    static {
        Global.setParameter("pp.single_line", "true");
    }

    @Getter
    private final Z3SortManager sortManager;
    private final Context ctx;

    public Z3Backend() {
        this(BackendOptions.defaults());
    }

    public Z3Backend(BackendOptions options) {
        this(new Z3SortManager(new Context()), options);
    }

    private Z3Backend(Z3SortManager sortManager, BackendOptions options) {
        super(NAME, options, new Inspector(sortManager.getCtx()), new Dialect(sortManager));
        this.sortManager = sortManager;
        this.ctx = sortManager.getCtx();
    }

    public Context getContext() {
        return ctx;
    }

    // ------------------- 叶操作 -------------------

    @Override
    protected LeafTranslation<Expr<?>> translateLeaf(LeafOperation op, List<Object> args) {
        return switch (op) {
            case STRING_V -> {
                String content = stringArgument(op, args, 0);
                if (args.size() > 1) {
                    integerArgument(op, args, 1);
                }
                yield LeafTranslation.constant(mkString(content));
            }
            case STRING_S -> {
                String name = symbolArgument(op, args, 0);
                if (args.size() > 1) {
                    integerArgument(op, args, 1);
                }
                yield symbol(Declaration.of(name, Sort.STRING));
            }
            case BOOL_V -> LeafTranslation.constant(ctx.mkBool(booleanArgument(op, args, 0)));
            case BVV -> {
                BitVecValue value = BitVecValue.valueOf(integerArgument(op, args, 0), widthArgument(op, args, 1));
                yield LeafTranslation.constant(ctx.mkBV(value.getValue().toString(), value.getWidth()));
            }
            case BVS -> {
                String name = symbolArgument(op, args, 0);
                widthArgument(op, args, 1);
                yield symbol(Declaration.of(name, Sort.INT));
            }
        };
    }

    private LeafTranslation<Expr<?>> symbol(Declaration declaration) {
        return LeafTranslation.symbol(sortManager.mkConst(declaration), declaration);
    }

    // ------------------- 组合操作 -------------------

    @Override
    protected Expr<?> translateRaw(RawOperation op, List<Expr<?>> operands) {
        return switch (op) {
            case ADD -> arithmetic(true, operands);
            case SUB -> arithmetic(false, operands);

            case EQ -> ctx.mkEq(any(operands.get(0)), any(operands.get(1)));
            case NE -> ctx.mkDistinct(operands.toArray(new Expr<?>[0]));
            case LT -> bothBitVector(operands)
                    ? ctx.mkBVULT(bv(operands.get(0)), bv(operands.get(1)))
                    : ctx.mkLt(integer(operands.get(0)), integer(operands.get(1)));
            case LE -> bothBitVector(operands)
                    ? ctx.mkBVULE(bv(operands.get(0)), bv(operands.get(1)))
                    : ctx.mkLe(integer(operands.get(0)), integer(operands.get(1)));
            case GT -> bothBitVector(operands)
                    ? ctx.mkBVUGT(bv(operands.get(0)), bv(operands.get(1)))
                    : ctx.mkGt(integer(operands.get(0)), integer(operands.get(1)));
            case GE -> bothBitVector(operands)
                    ? ctx.mkBVUGE(bv(operands.get(0)), bv(operands.get(1)))
                    : ctx.mkGe(integer(operands.get(0)), integer(operands.get(1)));
            case OR -> operands.size() == 1 ? operands.get(0) : ctx.mkOr(bools(operands));
            case AND -> operands.size() == 1 ? operands.get(0) : ctx.mkAnd(bools(operands));
            case NOT -> ctx.mkNot(bool(operands.get(0)));

            case STR_CONCAT -> operands.size() == 1 ? operands.get(0) : ctx.mkConcat(strs(operands));
            // (start, count, s)
            case STR_SUBSTR, STR_EXTRACT ->
                    ctx.mkExtract(str(operands.get(2)), integer(operands.get(0)), integer(operands.get(1)));
            case STR_LEN -> ctx.mkLength(str(operands.get(0)));
            case STR_REPLACE -> ctx.mkReplace(str(operands.get(0)), str(operands.get(1)), str(operands.get(2)));
            case STR_CONTAINS -> ctx.mkContains(str(operands.get(0)), str(operands.get(1)));
            case STR_PREFIX_OF -> ctx.mkPrefixOf(str(operands.get(0)), str(operands.get(1)));
            case STR_SUFFIX_OF -> ctx.mkSuffixOf(str(operands.get(0)), str(operands.get(1)));
            case STR_INDEX_OF -> ctx.mkIndexOf(str(operands.get(0)), str(operands.get(1)), ctx.mkInt(0));
            case STR_TO_INT -> ctx.stringToInt(str(operands.get(0)));
        };
    }

    /**
     * 全部是同宽位向量时使用位向量运算，否则按整数运算。
     */
    private Expr<?> arithmetic(boolean add, List<Expr<?>> operands) {
        com.microsoft.z3.Sort first = operands.get(0).getSort();
        boolean allBitVector = first.getSortKind() == Z3_sort_kind.Z3_BV_SORT
                && operands.stream().allMatch(e -> e.getSort().equals(first));
        if (allBitVector) {
            BitVecExpr result = bv(operands.get(0));
            for (int i = 1; i < operands.size(); i++) {
                result = add ? ctx.mkBVAdd(result, bv(operands.get(i))) : ctx.mkBVSub(result, bv(operands.get(i)));
            }
            return result;
        }
        ArithExpr<IntSort> result = integer(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            result = add ? ctx.mkAdd(result, integer(operands.get(i))) : ctx.mkSub(result, integer(operands.get(i)));
        }
        return result;
    }

    private static boolean bothBitVector(List<Expr<?>> operands) {
        com.microsoft.z3.Sort left = operands.get(0).getSort();
        return left.getSortKind() == Z3_sort_kind.Z3_BV_SORT && left.equals(operands.get(1).getSort());
    }

    @Override
    protected Expr<?> convertLiteral(Object literal) {
        if (literal instanceof String s) {
            return mkString(s);
        }
        if (literal instanceof Boolean b) {
            return ctx.mkBool(b);
        }
        return ctx.mkInt(literal.toString());
    }

    private Expr<SeqSort<CharSort>> mkString(String content) {
        return ctx.mkString(StringValue.escapeCodePoints(content));
    }

    @Override
    public void close() {
        logger.debug("关闭 Z3 Context");
        ctx.close();
    }

    // ------------------- 类型转换 -------------------

    @SuppressWarnings("unchecked")
    private static <S extends com.microsoft.z3.Sort> Expr<S> any(Expr<?> expr) {
        return (Expr<S>) expr;
    }

    @SuppressWarnings("unchecked")
    private static Expr<SeqSort<CharSort>> str(Expr<?> expr) {
        return (Expr<SeqSort<CharSort>>) expr;
    }

    @SuppressWarnings("unchecked")
    private static Expr<SeqSort<CharSort>>[] strs(List<Expr<?>> operands) {
        return operands.stream().map(Z3Backend::str).toArray(Expr[]::new);
    }

    @SuppressWarnings("unchecked")
    private static ArithExpr<IntSort> integer(Expr<?> expr) {
        return (ArithExpr<IntSort>) expr;
    }

    private static BitVecExpr bv(Expr<?> expr) {
        return (BitVecExpr) expr;
    }

    private static BoolExpr bool(Expr<?> expr) {
        return (BoolExpr) expr;
    }

    private static BoolExpr[] bools(List<Expr<?>> operands) {
        return operands.stream().map(Z3Backend::bool).toArray(BoolExpr[]::new);
    }

    // ------------------- 类型规范化与脚本支持 -------------------

    private static final class Inspector implements TermInspector<Expr<?>> {

        private final Context ctx;

        private Inspector(Context ctx) {
            this.ctx = ctx;
        }

        @Override
        public boolean isStringTheoryTerm(Expr<?> expr) {
            Z3_sort_kind kind = expr.getSort().getSortKind();
            return kind == Z3_sort_kind.Z3_SEQ_SORT || kind == Z3_sort_kind.Z3_INT_SORT;
        }

        @Override
        public Optional<BitVecValue> bitVecLiteral(Expr<?> expr) {
            if (expr instanceof BitVecNum num) {
                return Optional.of(BitVecValue.valueOf(num.getBigInteger(), num.getSortSize()));
            }
            return Optional.empty();
        }

        @Override
        public Expr<?> mkIntLiteral(BigInteger value) {
            return ctx.mkInt(value.toString());
        }
    }

    /**
     * 自由变量为表达式中的未解释常量；SMT-LIB 文本使用 Z3 自身的打印结果，写在一行内。
     */
    private static final class Dialect implements ExpressionDialect<Expr<?>> {

        private static final Pattern LINE_BREAK = Pattern.compile("\\s*\\R\\s*");

        private final Z3SortManager sortManager;

        private Dialect(Z3SortManager sortManager) {
            this.sortManager = sortManager;
        }

        @Override
        public Collection<Declaration> freeVariables(Expr<?> expr) {
            SortedMap<String, Declaration> free = new TreeMap<>();
            collect(expr, free);
            return free.values();
        }

        private void collect(Expr<?> expr, SortedMap<String, Declaration> free) {
            if (!expr.isApp()) {
                return;
            }
            if (expr.isConst() && expr.getFuncDecl().getDeclKind() == Z3_decl_kind.Z3_OP_UNINTERPRETED) {
                String name = expr.getFuncDecl().getName().toString();
                free.putIfAbsent(name, Declaration.of(name, sortManager.fromZ3Sort(expr.getSort())));
                return;
            }
            for (Expr<?> arg : expr.getArgs()) {
                collect(arg, free);
            }
        }

        @Override
        public String toSmtLib(Expr<?> expr) {
            // 字符串字面量中的控制字符已转义，折叠空白不会改变语义
            return LINE_BREAK.matcher(expr.toString()).replaceAll(" ");
        }
    }
}
