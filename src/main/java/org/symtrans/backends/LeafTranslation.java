package org.symtrans.backends;

import lombok.Getter;
import org.symtrans.core.Declaration;

import java.util.Objects;
import java.util.Optional;

/**
 * 叶操作的翻译结果：表达式，以及（引入符号时的）声明。
 * 声明这一副作用由分派引擎写入上下文，而不是由叶处理器直接修改状态。
 * @param <E> 后端的表达式类型。
 */
@Getter
public final class LeafTranslation<E> {

    private final E expression;
    private final Optional<Declaration> declaration;

    private LeafTranslation(E expression, Declaration declaration) {
        this.expression = Objects.requireNonNull(expression, "Leaf expression cannot be null.");
        this.declaration = Optional.ofNullable(declaration);
    }

    /**
     * 常量：没有声明。
     */
    public static <E> LeafTranslation<E> constant(E expression) {
        return new LeafTranslation<>(expression, null);
    }

    /**
     * 新符号：带声明。
     */
    public static <E> LeafTranslation<E> symbol(E expression, Declaration declaration) {
        return new LeafTranslation<>(expression, Objects.requireNonNull(declaration, "Symbol declaration cannot be null."));
    }
}
