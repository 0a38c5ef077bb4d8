package org.symtrans.expressions;

import org.symtrans.core.BitVecValue;

import java.math.BigInteger;
import java.util.Optional;

/**
 * 类型规范化所需的、针对具体后端表达式类型的查询与构造能力。
 * @param <E> 后端的表达式类型。
 */
public interface TermInspector<E> {

    /**
     * 表达式是否属于字符串理论一侧：String 类型，或无界整数类型
     * （在此编码中整数只来自字符串长度/下标以及被模拟的数值符号）。
     */
    boolean isStringTheoryTerm(E expr);

    /**
     * 如果表达式是具体的定宽二进制字面量，返回其值。
     */
    Optional<BitVecValue> bitVecLiteral(E expr);

    /**
     * 构造一个无界整数字面量。
     */
    E mkIntLiteral(BigInteger value);
}
