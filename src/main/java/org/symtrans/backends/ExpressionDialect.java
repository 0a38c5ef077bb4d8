package org.symtrans.backends;

import org.symtrans.core.Declaration;

import java.util.Collection;

/**
 * 把后端表达式写成 SMT-LIB 文本、并提取其自由变量的能力，供 {@link SmtScriptBuilder} 使用。
 * @param <E> 后端的表达式类型。
 */
public interface ExpressionDialect<E> {

    /**
     * 表达式传递引用的全部符号声明。
     */
    Collection<Declaration> freeVariables(E expr);

    /**
     * 表达式的 SMT-LIB 文本（不含外层 assert）。
     */
    String toSmtLib(E expr);
}
