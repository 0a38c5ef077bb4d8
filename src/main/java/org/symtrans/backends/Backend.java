package org.symtrans.backends;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symtrans.core.Declaration;
import org.symtrans.expressions.AssertionSet;
import org.symtrans.expressions.AstNode;
import org.symtrans.expressions.LeafOperation;
import org.symtrans.expressions.Operation;
import org.symtrans.expressions.Operations;
import org.symtrans.expressions.RawOperation;
import org.symtrans.expressions.TermInspector;
import org.symtrans.expressions.TypeNormalizer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.regex.Pattern;

/**
 * 操作分派引擎：把与求解器无关的表达式树翻译成目标求解器的表达式。
 * <p>
 * 两层处理器：
 * <ul>
 *     <li>叶处理器 {@link #translateLeaf}：直接接收字面量参数，构造常量或引入新符号。
 *     引入符号时返回的声明由本类写入 {@link TranslationContext}。</li>
 *     <li>组合处理器 {@link #translateRaw}：接收已按深度优先、从左到右翻译好的子表达式，
 *     没有副作用。比较与算术操作的操作数先经过 {@link TypeNormalizer}。</li>
 * </ul>
 * 操作词汇表是封闭的枚举，各后端用穷尽的 switch 处理每个操作；
 * 未知的操作名抛出 {@link UnsupportedOperationError}，不返回任何部分表达式。
 * <p>
 * 后端本身不持有翻译过程的可变状态，所有副作用都经由调用方传入的上下文。
 * @param <E> 后端的表达式类型。
 * @author Ayalyt
 */
public abstract class Backend<E> {

    private static final Logger logger = LoggerFactory.getLogger(Backend.class);

    // SMT-LIB 简单符号
    private static final Pattern SIMPLE_SYMBOL =
            Pattern.compile("[A-Za-z~!@$%^&*_+=<>.?/-][A-Za-z0-9~!@$%^&*_+=<>.?/-]*");

    private static final Set<String> RESERVED_WORDS = Set.of(
            "BINARY", "DECIMAL", "HEXADECIMAL", "NUMERAL", "STRING", "_", "!", "as", "let", "exists",
            "forall", "match", "par", "assert", "check-sat", "declare-fun", "declare-const", "define-fun",
            "get-model", "set-logic", "set-option", "push", "pop", "exit", "true", "false");

    @Getter
    private final String name;
    @Getter
    private final BackendOptions options;

    private final TypeNormalizer<E> normalizer;
    private final SmtScriptBuilder<E> scriptBuilder;

    protected Backend(String name, BackendOptions options, TermInspector<E> inspector, ExpressionDialect<E> dialect) {
        this.name = Objects.requireNonNull(name, "Backend name cannot be null.");
        this.options = Objects.requireNonNull(options, "BackendOptions cannot be null.");
        this.normalizer = new TypeNormalizer<>(inspector);
        this.scriptBuilder = new SmtScriptBuilder<>(dialect, options);
        logger.info("创建后端 {}, logic={}, daggify={}", name, options.getLogic(), options.isDaggify());
    }

    // ========== 由具体后端实现 ==========

    /**
     * 叶处理器。参数已检查个数，且都不是嵌套节点。
     */
    protected abstract LeafTranslation<E> translateLeaf(LeafOperation op, List<Object> args);

    /**
     * 组合处理器。操作数已翻译，需要规范化的操作已规范化。
     */
    protected abstract E translateRaw(RawOperation op, List<E> operands);

    /**
     * 将组合操作中出现的字面量参数（字符串、整数、布尔）转换为表达式。
     */
    protected abstract E convertLiteral(Object literal);

    /**
     * 此后端是否支持某个操作。默认支持整个词汇表。
     */
    public boolean supports(Operation op) {
        return true;
    }

    // ========== 翻译 ==========

    /**
     * 翻译一个表达式树。
     * @param node 根节点。
     * @param ctx  本次翻译过程的上下文。
     * @return 翻译后的表达式。
     * @throws UnsupportedOperationError 如果树中有无法翻译的操作。
     * @throws MalformedLiteralError     如果叶节点的载荷与其类型不符。
     * @throws DeclarationConflictError  如果同名符号以不同类型引入。
     */
    public final E translate(AstNode node, TranslationContext ctx) {
        Objects.requireNonNull(node, "AstNode cannot be null.");
        Objects.requireNonNull(ctx, "TranslationContext cannot be null.");
        ctx.checkValid();
        try {
            return dispatch(node, ctx);
        } catch (RuntimeException e) {
            ctx.invalidate(e);
            throw e;
        }
    }

    /**
     * 按顺序翻译一组约束根节点。
     */
    public final AssertionSet<E> translateAll(List<AstNode> roots, TranslationContext ctx) {
        List<E> translated = new ArrayList<>(roots.size());
        for (AstNode root : roots) {
            translated.add(translate(root, ctx));
        }
        return AssertionSet.of(translated);
    }

    private E dispatch(AstNode node, TranslationContext ctx) {
        Operation op = resolve(node.getOp());
        logger.debug("[{}] 分派 {}", name, node.getOp());

        if (op instanceof LeafOperation leaf) {
            checkLeafArguments(leaf, node);
            LeafTranslation<E> result = translateLeaf(leaf, node.getArgs());
            result.getDeclaration().ifPresent(ctx::declare);
            return result.getExpression();
        }

        RawOperation raw = (RawOperation) op;
        if (!raw.acceptsArity(node.arity())) {
            logger.error("[{}] {} 的参数个数 {} 不合法", name, raw.getName(), node.arity());
            throw new IllegalArgumentException("Operation " + raw.getName() + " does not accept " + node.arity() + " operands");
        }
        if (raw == RawOperation.STR_EXTRACT) {
            integerArgument(raw, node.getArgs(), 0);
            integerArgument(raw, node.getArgs(), 1);
        }

        List<E> operands = new ArrayList<>(node.arity());
        for (Object arg : node.getArgs()) {
            operands.add(arg instanceof AstNode child ? dispatch(child, ctx) : convertLiteral(arg));
        }
        if (raw.isNormalizing()) {
            operands = normalizer.normalizeAll(operands);
        }
        return translateRaw(raw, operands);
    }

    private Operation resolve(String opName) {
        return Operations.lookup(opName)
                .filter(this::supports)
                .orElseThrow(() -> {
                    logger.error("[{}] 没有操作 {} 的翻译", name, opName);
                    return new UnsupportedOperationError(opName, name);
                });
    }

    private void checkLeafArguments(LeafOperation leaf, AstNode node) {
        if (!leaf.acceptsArity(node.arity())) {
            throw malformed(leaf, "expected " + leaf.getMinArgs() + ".." + leaf.getMaxArgs()
                    + " literal arguments, got " + node.arity());
        }
        for (Object arg : node.getArgs()) {
            if (arg instanceof AstNode) {
                throw malformed(leaf, "arguments must be literals, got nested node " + arg);
            }
        }
    }

    // ========== 查询脚本 ==========

    public final String getSatisfiabilityScript(AssertionSet<E> assertions) {
        return scriptBuilder.satisfiabilityScript(assertions);
    }

    public final String getFullModelScript(AssertionSet<E> assertions) {
        return scriptBuilder.fullModelScript(assertions);
    }

    /**
     * 以求解编排对象的约束为默认输入生成可满足性脚本，额外约束放在前面，仅在本次调用中生效。
     */
    public final String getSatisfiabilityScript(ConstraintProvider<E> solver, List<E> extraConstraints) {
        return scriptBuilder.satisfiabilityScript(merge(solver, extraConstraints));
    }

    public final String getFullModelScript(ConstraintProvider<E> solver, List<E> extraConstraints) {
        return scriptBuilder.fullModelScript(merge(solver, extraConstraints));
    }

    public final SortedSet<Declaration> freeVariables(AssertionSet<E> assertions) {
        return scriptBuilder.freeVariables(assertions);
    }

    private AssertionSet<E> merge(ConstraintProvider<E> solver, List<E> extraConstraints) {
        Objects.requireNonNull(solver, "ConstraintProvider cannot be null.");
        return AssertionSet.of(solver.getConstraints()).prepend(extraConstraints);
    }

    /**
     * 翻译后端不能判定可满足性，只产出表达式和查询文本。
     * @throws BackendUnavailableError 总是抛出。
     */
    public boolean satisfiable(ConstraintProvider<E> solver, List<E> extraConstraints) {
        logger.error("[{}] 不支持直接判定可满足性", name);
        throw new BackendUnavailableError("Backend '" + name
                + "' only produces SMT-LIB constraints; use a specialized backend for solving them");
    }

    // ========== 叶参数辅助方法 ==========

    protected static String stringArgument(Operation op, List<Object> args, int index) {
        Object arg = args.get(index);
        if (!(arg instanceof String s)) {
            throw malformed(op, "argument " + index + " must be a string, got " + describe(arg));
        }
        return s;
    }

    protected static boolean booleanArgument(Operation op, List<Object> args, int index) {
        Object arg = args.get(index);
        if (!(arg instanceof Boolean b)) {
            throw malformed(op, "argument " + index + " must be a boolean, got " + describe(arg));
        }
        return b;
    }

    protected static BigInteger integerArgument(Operation op, List<Object> args, int index) {
        Object arg = args.get(index);
        if (arg instanceof BigInteger big) {
            return big;
        }
        if (arg instanceof Integer || arg instanceof Long) {
            return BigInteger.valueOf(((Number) arg).longValue());
        }
        throw malformed(op, "argument " + index + " must be an integer, got " + describe(arg));
    }

    protected static int widthArgument(Operation op, List<Object> args, int index) {
        BigInteger width = integerArgument(op, args, index);
        if (width.signum() <= 0 || width.bitLength() > 31) {
            throw malformed(op, "bit-vector width must be a positive int, got " + width);
        }
        return width.intValue();
    }

    /**
     * 读取符号名，要求是 SMT-LIB 简单符号且不是保留字。
     */
    protected static String symbolArgument(Operation op, List<Object> args, int index) {
        String symbol = stringArgument(op, args, index);
        if (!SIMPLE_SYMBOL.matcher(symbol).matches() || RESERVED_WORDS.contains(symbol)) {
            throw malformed(op, "'" + symbol + "' is not a valid symbol name");
        }
        return symbol;
    }

    private static MalformedLiteralError malformed(Operation op, String detail) {
        logger.error("{} 的字面量不合法: {}", op.getName(), detail);
        return new MalformedLiteralError(op.getName() + ": " + detail);
    }

    private static String describe(Object arg) {
        return arg.getClass().getSimpleName() + " " + arg;
    }
}
