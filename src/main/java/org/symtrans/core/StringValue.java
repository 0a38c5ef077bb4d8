package org.symtrans.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 具体字符串值，供具体求值路径使用。
 * 此类是不可变的。
 */
@Getter
public final class StringValue implements Comparable<StringValue> {

    public static final StringValue EMPTY = new StringValue("");

    private final String value;

    private StringValue(String value) {
        this.value = Objects.requireNonNull(value, "StringValue value cannot be null.");
    }

    public static StringValue of(String value) {
        if (value.isEmpty()) {
            return EMPTY;
        }
        return new StringValue(value);
    }

    /**
     * 码点个数。
     */
    public int length() {
        return value.codePointCount(0, value.length());
    }

    /**
     * 按 SMT-LIB 2.6 字符串理论转义：反斜杠和可打印 ASCII 以外的字符写作 u{hex} 形式的转义序列，
     * 其余字符原样保留。双引号不在此处处理。
     */
    public static String escapeCodePoints(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        value.codePoints().forEach(cp -> {
            if (cp == '\\' || cp < 0x20 || cp > 0x7E) {
                sb.append("\\u{").append(Integer.toHexString(cp)).append('}');
            } else {
                sb.appendCodePoint(cp);
            }
        });
        return sb.toString();
    }

    @Override
    public int compareTo(StringValue other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value.equals(((StringValue) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "StringV(" + value + ")";
    }
}
