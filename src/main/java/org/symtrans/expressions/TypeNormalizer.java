package org.symtrans.expressions;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symtrans.core.BitVecValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 在组合二元操作之前调和操作数的类型。
 * <p>
 * 规则：若恰有一个操作数属于字符串理论一侧，而另一个是具体的定宽二进制字面量，
 * 则将该字面量按补码解释为有符号值，替换为同位置的无界整数字面量。
 * 其余情况原样返回，不定义其他任何强制转换。
 * <p>
 * 规则是对称的：{@code normalize(b, a)} 等于 {@code normalize(a, b)} 交换后的结果。
 * 输入不会被修改。
 * @param <E> 后端的表达式类型。
 */
public final class TypeNormalizer<E> {

    private static final Logger logger = LoggerFactory.getLogger(TypeNormalizer.class);

    private final TermInspector<E> inspector;

    public TypeNormalizer(TermInspector<E> inspector) {
        this.inspector = Objects.requireNonNull(inspector, "TermInspector cannot be null.");
    }

    /**
     * 规范化一对操作数。
     * @param left  左操作数。
     * @param right 右操作数。
     * @return 规范化后的 (left', right')，位置保持不变。
     */
    public Pair<E, E> normalize(E left, E right) {
        Objects.requireNonNull(left, "normalize: left 不能为 null");
        Objects.requireNonNull(right, "normalize: right 不能为 null");

        boolean leftString = inspector.isStringTheoryTerm(left);
        boolean rightString = inspector.isStringTheoryTerm(right);

        if (leftString && !rightString) {
            Optional<BitVecValue> literal = inspector.bitVecLiteral(right);
            if (literal.isPresent()) {
                return Pair.of(left, toInteger(literal.get()));
            }
        } else if (rightString && !leftString) {
            Optional<BitVecValue> literal = inspector.bitVecLiteral(left);
            if (literal.isPresent()) {
                return Pair.of(toInteger(literal.get()), right);
            }
        }
        return Pair.of(left, right);
    }

    /**
     * n 元推广：只要有一个操作数属于字符串理论一侧，所有定宽字面量都被替换为整数字面量。
     * 两个操作数时与 {@link #normalize(Object, Object)} 一致。
     * @param operands 操作数列表。
     * @return 新的操作数列表。
     */
    public List<E> normalizeAll(List<E> operands) {
        if (operands.size() == 2) {
            Pair<E, E> pair = normalize(operands.get(0), operands.get(1));
            return List.of(pair.getLeft(), pair.getRight());
        }
        boolean anyString = operands.stream().anyMatch(inspector::isStringTheoryTerm);
        if (!anyString) {
            return operands;
        }
        List<E> result = new ArrayList<>(operands.size());
        for (E operand : operands) {
            Optional<BitVecValue> literal = inspector.isStringTheoryTerm(operand)
                    ? Optional.empty()
                    : inspector.bitVecLiteral(operand);
            result.add(literal.isPresent() ? toInteger(literal.get()) : operand);
        }
        return result;
    }

    private E toInteger(BitVecValue literal) {
        logger.debug("规范化: 将定宽字面量 {} 替换为整数 {}", literal, literal.getSignedValue());
        return inspector.mkIntLiteral(literal.getSignedValue());
    }
}
