package org.symtrans.backends;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symtrans.core.Declaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 一次翻译过程的上下文，记录待发出的符号声明。
 * <p>
 * 每次翻译都必须新建一个上下文，并在所有递归翻译调用间显式传递。
 * 此类不是线程安全的：并发翻译应各自使用独立的上下文，或由调用方加锁串行访问。
 * <p>
 * 翻译过程中一旦抛出异常，已记录的声明不会回滚，
 * 上下文被标记为失效，之后的任何使用都会抛出 {@link IllegalStateException}。
 * @author Ayalyt
 */
public final class TranslationContext {

    private static final Logger logger = LoggerFactory.getLogger(TranslationContext.class);

    // 保持插入顺序，即符号首次出现的顺序
    private final Map<String, Declaration> declarations = new LinkedHashMap<>();

    private RuntimeException failure;

    private TranslationContext() {
    }

    public static TranslationContext create() {
        return new TranslationContext();
    }

    /**
     * 记录一个声明。同名同类型的声明只记录一次。
     * @param declaration 要记录的声明。
     * @return 如果是新声明则返回 true。
     * @throws DeclarationConflictError 如果同名符号已以另一类型声明。
     */
    public boolean declare(Declaration declaration) {
        checkValid();
        Declaration existing = declarations.get(declaration.getName());
        if (existing == null) {
            declarations.put(declaration.getName(), declaration);
            logger.debug("记录声明: {}", declaration);
            return true;
        }
        if (existing.conflictsWith(declaration)) {
            logger.error("符号 {} 已声明为 {}，不能再声明为 {}",
                    declaration.getName(), existing.getSort(), declaration.getSort());
            DeclarationConflictError error = new DeclarationConflictError(existing, declaration);
            invalidate(error);
            throw error;
        }
        logger.debug("声明 {} 已存在，跳过", declaration);
        return false;
    }

    /**
     * 按名称查找已记录的声明。
     */
    public Optional<Declaration> lookup(String name) {
        checkValid();
        return Optional.ofNullable(declarations.get(name));
    }

    /**
     * 返回待发出的声明，按符号首次出现的顺序。
     */
    public List<Declaration> getPendingDeclarations() {
        checkValid();
        return Collections.unmodifiableList(new ArrayList<>(declarations.values()));
    }

    public boolean isValid() {
        return failure == null;
    }

    /**
     * 将上下文标记为失效。只保留第一次失败的原因。
     */
    void invalidate(RuntimeException cause) {
        if (failure == null) {
            failure = cause;
            logger.warn("翻译上下文因错误失效: {}", cause.getMessage());
        }
    }

    void checkValid() {
        if (failure != null) {
            throw new IllegalStateException("TranslationContext was invalidated by an earlier failure and must be discarded", failure);
        }
    }
}
