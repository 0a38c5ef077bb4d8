package org.symtrans.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 表达式与符号的类型 (sort)：String | Int | Bool | BitVec(width)。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class Sort implements Comparable<Sort> {

    private static final Logger logger = LoggerFactory.getLogger(Sort.class);

    /**
     * 类型种类
     */
    public enum Kind {
        STRING,
        INT,
        BOOL,
        BITVECTOR
    }

    public static final Sort STRING = new Sort(Kind.STRING, 0);
    public static final Sort INT = new Sort(Kind.INT, 0);
    public static final Sort BOOL = new Sort(Kind.BOOL, 0);

    private final Kind kind;
    // 仅对 BITVECTOR 有意义，其余为 0
    private final int width;

    private final int hashCode;

    private Sort(Kind kind, int width) {
        this.kind = kind;
        this.width = width;
        this.hashCode = Objects.hash(kind, width);
    }

    /**
     * 创建定宽位向量类型。
     * @param width 位宽，必须为正。
     * @return BitVec(width) 类型。
     * @throws IllegalArgumentException 如果位宽不为正。
     */
    public static Sort bitVector(int width) {
        if (width <= 0) {
            logger.error("Sort.bitVector: 非法位宽 {}", width);
            throw new IllegalArgumentException("Bit-vector width must be positive, got " + width);
        }
        return new Sort(Kind.BITVECTOR, width);
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public boolean isInt() {
        return kind == Kind.INT;
    }

    public boolean isBitVector() {
        return kind == Kind.BITVECTOR;
    }

    /**
     * 返回此类型的 SMT-LIB 名称，例如 {@code String}、{@code (_ BitVec 32)}。
     */
    public String toSmtLib() {
        return switch (kind) {
            case STRING -> "String";
            case INT -> "Int";
            case BOOL -> "Bool";
            case BITVECTOR -> "(_ BitVec " + width + ")";
        };
    }

    @Override
    public int compareTo(Sort other) {
        int cmp = kind.compareTo(other.kind);
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(width, other.width);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Sort sort = (Sort) o;
        return kind == sort.kind && width == sort.width;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return toSmtLib();
    }
}
