package org.symtrans.backends;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symtrans.core.Declaration;
import org.symtrans.expressions.AssertionSet;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 由一组已翻译断言组装完整的 SMT-LIB 查询脚本。
 * <p>
 * 可满足性脚本：
 * <pre>
 * (set-logic ALL)
 * (declare-fun x () String)   ; 每个自由变量一行，按名称排序
 * (assert ...)                ; 每条断言一行，保持原顺序
 * (check-sat)
 * </pre>
 * 完整模型脚本在逻辑声明之后加 {@code (set-option :produce-models true)}，
 * 并在 {@code (check-sat)} 之后加 {@code (get-model)}。
 * <p>
 * 对相同的断言集合，输出在多次调用之间、在不同后端实例之间逐字节一致。
 * @param <E> 后端的表达式类型。
 */
public final class SmtScriptBuilder<E> {

    private static final Logger logger = LoggerFactory.getLogger(SmtScriptBuilder.class);

    private final ExpressionDialect<E> dialect;
    private final BackendOptions options;

    public SmtScriptBuilder(ExpressionDialect<E> dialect, BackendOptions options) {
        this.dialect = Objects.requireNonNull(dialect, "ExpressionDialect cannot be null.");
        this.options = Objects.requireNonNull(options, "BackendOptions cannot be null.");
    }

    /**
     * 生成只检查可满足性的脚本。
     */
    public String satisfiabilityScript(AssertionSet<E> assertions) {
        return build(assertions, false);
    }

    /**
     * 生成检查可满足性并请求模型的脚本。
     */
    public String fullModelScript(AssertionSet<E> assertions) {
        return build(assertions, true);
    }

    /**
     * 计算断言集合的自由变量：所有断言传递引用的声明之并，按名称去重并排序。
     * 每次调用都重新计算。
     * @throws DeclarationConflictError 如果同名符号以不同类型出现。
     */
    public SortedSet<Declaration> freeVariables(AssertionSet<E> assertions) {
        SortedMap<String, Declaration> byName = new TreeMap<>();
        for (E assertion : assertions) {
            for (Declaration declaration : dialect.freeVariables(assertion)) {
                Declaration existing = byName.putIfAbsent(declaration.getName(), declaration);
                if (existing != null && existing.conflictsWith(declaration)) {
                    logger.error("自由变量 {} 以不同类型出现: {} 和 {}",
                            declaration.getName(), existing.getSort(), declaration.getSort());
                    throw new DeclarationConflictError(existing, declaration);
                }
            }
        }
        return Collections.unmodifiableSortedSet(new TreeSet<>(byName.values()));
    }

    private String build(AssertionSet<E> assertions, boolean produceModels) {
        Objects.requireNonNull(assertions, "AssertionSet cannot be null.");
        // 先完成所有可能失败的步骤，失败时不产生任何输出
        SortedSet<Declaration> freeVariables = freeVariables(assertions);

        StringBuilder sb = new StringBuilder();
        sb.append("(set-logic ").append(options.getLogic()).append(")\n");
        if (produceModels) {
            sb.append("(set-option :produce-models true)\n");
        }
        for (Declaration declaration : freeVariables) {
            sb.append(declaration.toSmtLib()).append('\n');
        }
        for (E assertion : assertions) {
            sb.append("(assert ").append(dialect.toSmtLib(assertion)).append(")\n");
        }
        sb.append("(check-sat)\n");
        if (produceModels) {
            sb.append("(get-model)\n");
        }
        logger.info("生成{}脚本: {} 个声明, {} 条断言",
                produceModels ? "完整模型" : "可满足性", freeVariables.size(), assertions.size());
        return sb.toString();
    }
}
