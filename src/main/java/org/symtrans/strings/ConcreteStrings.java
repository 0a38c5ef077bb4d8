package org.symtrans.strings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symtrans.core.BitVecValue;
import org.symtrans.core.StringValue;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 具体字符串操作，与符号字符串操作一一对应，供具体求值路径使用。
 * 长度与下标按 Unicode 码点计算，与求解器的字符串理论一致。
 * 所有方法都是纯函数，返回新的不可变值。
 * @author Ayalyt
 */
public final class ConcreteStrings {

    private static final Logger logger = LoggerFactory.getLogger(ConcreteStrings.class);

    private static final BigInteger MINUS_ONE = BigInteger.ONE.negate();

    private ConcreteStrings() {
    }

    /**
     * 按顺序连接。
     */
    public static StringValue concat(StringValue... parts) {
        StringBuilder sb = new StringBuilder();
        for (StringValue part : parts) {
            sb.append(Objects.requireNonNull(part, "concat: part 不能为 null").getValue());
        }
        return StringValue.of(sb.toString());
    }

    /**
     * 取子串，区间两端都包含：返回下标 start 到 end 的字符，start == end 时返回单个字符。
     * @throws IndexOutOfBoundsException 如果区间越界或 start > end。
     */
    public static StringValue substr(int start, int end, StringValue s) {
        String value = s.getValue();
        int length = s.length();
        if (start < 0 || end >= length || start > end) {
            logger.error("substr: 区间 [{}, {}] 超出长度为 {} 的字符串", start, end, length);
            throw new IndexOutOfBoundsException("Substring [" + start + ", " + end + "] out of range for length " + length);
        }
        int from = value.offsetByCodePoints(0, start);
        int to = value.offsetByCodePoints(from, end - start + 1);
        return StringValue.of(value.substring(from, to));
    }

    /**
     * 只替换第一次出现的 pattern；不存在时原样返回。空 pattern 时把 replacement 插入到最前面。
     */
    public static StringValue replace(StringValue s, StringValue pattern, StringValue replacement) {
        String value = s.getValue();
        int index = value.indexOf(pattern.getValue());
        if (index < 0) {
            return s;
        }
        return StringValue.of(value.substring(0, index)
                + replacement.getValue()
                + value.substring(index + pattern.getValue().length()));
    }

    /**
     * 字符串长度，表示为给定位宽的定宽数值。
     */
    public static BitVecValue length(StringValue s, int width) {
        return BitVecValue.valueOf(s.length(), width);
    }

    public static boolean contains(StringValue s, StringValue sub) {
        return s.getValue().contains(sub.getValue());
    }

    /**
     * prefix 是否是 s 的前缀。按字面比较，不解释任何模式字符。
     */
    public static boolean prefixOf(StringValue prefix, StringValue s) {
        return s.getValue().startsWith(prefix.getValue());
    }

    public static boolean suffixOf(StringValue suffix, StringValue s) {
        return s.getValue().endsWith(suffix.getValue());
    }

    /**
     * sub 在 s 中第一次出现的下标；不存在时为 -1（该位宽下全 1）。
     */
    public static BitVecValue indexOf(StringValue s, StringValue sub, int width) {
        String value = s.getValue();
        int index = value.indexOf(sub.getValue());
        return BitVecValue.valueOf(index < 0 ? -1 : value.codePointCount(0, index), width);
    }

    /**
     * 十进制数字串的值；空串或含非数字字符时为 -1。
     */
    public static BitVecValue toInt(StringValue s, int width) {
        String value = s.getValue();
        if (value.isEmpty() || !value.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return BitVecValue.valueOf(MINUS_ONE, width);
        }
        return BitVecValue.valueOf(new BigInteger(value), width);
    }
}
