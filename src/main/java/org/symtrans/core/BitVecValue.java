package org.symtrans.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 定宽二进制数值 (bit-vector value)。
 * 内部按无符号形式存储，规范化到 [0, 2^width) 区间；
 * 通过 {@link #getSignedValue()} 获取其补码意义下的有符号值。
 * 此类是不可变的。
 */
public final class BitVecValue implements Comparable<BitVecValue> {

    private static final Logger logger = LoggerFactory.getLogger(BitVecValue.class);

    /**
     * 无符号值，位于 [0, 2^width)
     */
    @Getter
    private final BigInteger value;
    @Getter
    private final int width;

    private final int hashCode;

    private BitVecValue(BigInteger value, int width) {
        this.value = value;
        this.width = width;
        this.hashCode = Objects.hash(value, width);
        logger.debug("创建了一个BitVecValue: {} (宽度 {})", value, width);
    }

    // ========== 工厂方法 ==========

    /**
     * 以给定位宽创建数值，超出范围的值按 2^width 取模（负数取补码）。
     * @param value 任意整数值。
     * @param width 位宽，必须为正。
     * @return 规范化后的 BitVecValue。
     * @throws IllegalArgumentException 如果位宽不为正。
     */
    public static BitVecValue valueOf(BigInteger value, int width) {
        Objects.requireNonNull(value, "BitVecValue value cannot be null");
        if (width <= 0) {
            logger.error("BitVecValue.valueOf: 非法位宽 {}", width);
            throw new IllegalArgumentException("Bit-vector width must be positive, got " + width);
        }
        BigInteger modulus = BigInteger.ONE.shiftLeft(width);
        return new BitVecValue(value.mod(modulus), width);
    }

    public static BitVecValue valueOf(long value, int width) {
        return valueOf(BigInteger.valueOf(value), width);
    }

    // ========== 视图 ==========

    /**
     * 返回补码意义下的有符号值，例如宽度 32 的 0xFFFFFFFF 返回 -1。
     */
    public BigInteger getSignedValue() {
        if (value.testBit(width - 1)) {
            return value.subtract(BigInteger.ONE.shiftLeft(width));
        }
        return value;
    }

    public Sort getSort() {
        return Sort.bitVector(width);
    }

    public boolean isNegative() {
        return value.testBit(width - 1);
    }

    /**
     * 返回 SMT-LIB 字面量，形如 {@code (_ bv5 32)}。
     */
    public String toSmtLib() {
        return "(_ bv" + value + " " + width + ")";
    }

    // --- Object 方法 ---
    @Override
    public int compareTo(BitVecValue other) {
        int cmp = Integer.compare(width, other.width);
        if (cmp != 0) {
            return cmp;
        }
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BitVecValue that)) {
            return false;
        }
        return width == that.width && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "BVV(" + getSignedValue() + ", " + width + ")";
    }
}
