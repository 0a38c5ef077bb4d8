package org.symtrans.smtlib;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symtrans.backends.Backend;
import org.symtrans.backends.BackendOptions;
import org.symtrans.backends.ExpressionDialect;
import org.symtrans.backends.LeafTranslation;
import org.symtrans.core.BitVecValue;
import org.symtrans.core.Declaration;
import org.symtrans.core.Sort;
import org.symtrans.expressions.LeafOperation;
import org.symtrans.expressions.RawOperation;
import org.symtrans.expressions.TermInspector;

import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 把表达式树翻译成 SMT-LIB 文本项 ({@link Term}) 的后端。
 * <p>
 * 定宽数值符号 (BVS) 以无界整数模拟，声明为 {@code Int}；
 * 定宽常量 (BVV) 保留为位向量字面量，在与字符串理论一侧的项比较或相加减时由类型规范化替换为整数。
 * 此后端不持有可变状态，可以被多个线程共享，只要每个线程使用自己的 {@code TranslationContext}。
 */
public class SmtLibBackend extends Backend<Term> {

    private static final Logger logger = LoggerFactory.getLogger(SmtLibBackend.class);

    public static final String NAME = "smtlib";

    public SmtLibBackend() {
        this(BackendOptions.defaults());
    }

    public SmtLibBackend(BackendOptions options) {
        super(NAME, options, new Inspector(), new Dialect(options.isDaggify()));
    }

    // ------------------- 叶操作 -------------------

    @Override
    protected LeafTranslation<Term> translateLeaf(LeafOperation op, List<Object> args) {
        return switch (op) {
            case STRING_V -> {
                String content = stringArgument(op, args, 0);
                if (args.size() > 1) {
                    integerArgument(op, args, 1);
                }
                yield LeafTranslation.constant(Term.stringLiteral(content));
            }
            case STRING_S -> {
                String name = symbolArgument(op, args, 0);
                if (args.size() > 1) {
                    integerArgument(op, args, 1);
                }
                Declaration declaration = Declaration.of(name, Sort.STRING);
                yield LeafTranslation.symbol(Term.symbol(declaration), declaration);
            }
            case BOOL_V -> LeafTranslation.constant(Term.boolLiteral(booleanArgument(op, args, 0)));
            case BVV -> {
                BigInteger value = integerArgument(op, args, 0);
                int width = widthArgument(op, args, 1);
                yield LeafTranslation.constant(Term.bitVecLiteral(BitVecValue.valueOf(value, width)));
            }
            case BVS -> {
                String name = symbolArgument(op, args, 0);
                widthArgument(op, args, 1);
                Declaration declaration = Declaration.of(name, Sort.INT);
                yield LeafTranslation.symbol(Term.symbol(declaration), declaration);
            }
        };
    }

    // ------------------- 组合操作 -------------------

    @Override
    protected Term translateRaw(RawOperation op, List<Term> operands) {
        return switch (op) {
            case ADD -> arithmetic("+", "bvadd", operands);
            case SUB -> arithmetic("-", "bvsub", operands);

            case EQ -> Term.apply("=", Sort.BOOL, operands);
            case NE -> Term.apply("distinct", Sort.BOOL, operands);
            case LT -> comparison("<", "bvult", operands);
            case LE -> comparison("<=", "bvule", operands);
            case GT -> comparison(">", "bvugt", operands);
            case GE -> comparison(">=", "bvuge", operands);
            case OR -> operands.size() == 1 ? operands.get(0) : Term.apply("or", Sort.BOOL, operands);
            case AND -> operands.size() == 1 ? operands.get(0) : Term.apply("and", Sort.BOOL, operands);
            case NOT -> Term.apply("not", Sort.BOOL, operands);

            case STR_CONCAT -> operands.size() == 1 ? operands.get(0) : Term.apply("str.++", Sort.STRING, operands);
            // (start, count, s) -> (str.substr s start count)
            case STR_SUBSTR, STR_EXTRACT ->
                    Term.apply("str.substr", Sort.STRING, operands.get(2), operands.get(0), operands.get(1));
            case STR_LEN -> Term.apply("str.len", Sort.INT, operands.get(0));
            case STR_REPLACE ->
                    Term.apply("str.replace", Sort.STRING, operands.get(0), operands.get(1), operands.get(2));
            case STR_CONTAINS -> Term.apply("str.contains", Sort.BOOL, operands.get(0), operands.get(1));
            case STR_PREFIX_OF -> Term.apply("str.prefixof", Sort.BOOL, operands.get(0), operands.get(1));
            case STR_SUFFIX_OF -> Term.apply("str.suffixof", Sort.BOOL, operands.get(0), operands.get(1));
            case STR_INDEX_OF -> Term.apply("str.indexof", Sort.INT,
                    operands.get(0), operands.get(1), Term.intLiteral(BigInteger.ZERO));
            case STR_TO_INT -> Term.apply("str.to_int", Sort.INT, operands.get(0));
        };
    }

    /**
     * 规范化之后全部是同宽位向量时使用位向量运算，否则按整数运算。
     */
    private Term arithmetic(String intOperator, String bitVecOperator, List<Term> operands) {
        Sort first = operands.get(0).getSort();
        boolean allBitVector = first.isBitVector()
                && operands.stream().allMatch(t -> t.getSort().equals(first));
        if (allBitVector) {
            return Term.apply(bitVecOperator, first, operands);
        }
        if (operands.stream().anyMatch(t -> t.getSort().isBitVector())) {
            logger.warn("{} 的操作数混合了位向量与整数: {}", intOperator, operands);
        }
        return Term.apply(intOperator, Sort.INT, operands);
    }

    /**
     * 两个操作数都是同宽位向量时按无符号比较。
     */
    private Term comparison(String intOperator, String bitVecOperator, List<Term> operands) {
        Sort left = operands.get(0).getSort();
        if (left.isBitVector() && left.equals(operands.get(1).getSort())) {
            return Term.apply(bitVecOperator, Sort.BOOL, operands);
        }
        return Term.apply(intOperator, Sort.BOOL, operands);
    }

    @Override
    protected Term convertLiteral(Object literal) {
        if (literal instanceof String s) {
            return Term.stringLiteral(s);
        }
        if (literal instanceof Boolean b) {
            return Term.boolLiteral(b);
        }
        if (literal instanceof BigInteger big) {
            return Term.intLiteral(big);
        }
        return Term.intLiteral(BigInteger.valueOf(((Number) literal).longValue()));
    }

    // ------------------- 类型规范化与脚本支持 -------------------

    private static final class Inspector implements TermInspector<Term> {

        @Override
        public boolean isStringTheoryTerm(Term expr) {
            return expr.isStringTheoryTerm();
        }

        @Override
        public Optional<BitVecValue> bitVecLiteral(Term expr) {
            return expr.getBitVecValue();
        }

        @Override
        public Term mkIntLiteral(BigInteger value) {
            return Term.intLiteral(value);
        }
    }

    private static final class Dialect implements ExpressionDialect<Term> {

        private final boolean daggify;

        private Dialect(boolean daggify) {
            this.daggify = daggify;
        }

        @Override
        public Collection<Declaration> freeVariables(Term expr) {
            return expr.getFreeVariables().values();
        }

        @Override
        public String toSmtLib(Term expr) {
            return TermPrinter.print(expr, daggify);
        }
    }
}
