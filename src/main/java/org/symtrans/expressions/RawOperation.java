package org.symtrans.expressions;

import lombok.Getter;

/**
 * 组合操作：先按深度优先、从左到右翻译子节点，再组合已翻译的子表达式。
 * 组合操作没有副作用。
 * 标记为 normalizing 的操作在组合前会先经过 {@link TypeNormalizer}。
 */
@Getter
public enum RawOperation implements Operation {

    // --- 算术（以无界整数模拟定宽数值） ---
    ADD("__add__", 2, Integer.MAX_VALUE, true),
    SUB("__sub__", 2, Integer.MAX_VALUE, true),

    // --- 通用 ---
    EQ("__eq__", 2, 2, true),
    NE("__ne__", 2, 2, true),
    LT("__lt__", 2, 2, true),
    LE("__le__", 2, 2, true),
    GT("__gt__", 2, 2, true),
    GE("__ge__", 2, 2, true),
    OR("Or", 1, Integer.MAX_VALUE, false),
    AND("And", 1, Integer.MAX_VALUE, false),
    NOT("Not", 1, 1, false),

    // --- 字符串 ---
    STR_CONCAT("StrConcat", 1, Integer.MAX_VALUE, false),
    STR_SUBSTR("StrSubstr", 3, 3, false),        // (start, count, s)
    STR_EXTRACT("StrExtract", 3, 3, false),      // (start, count, s)，start/count 为整数字面量
    STR_LEN("StrLen", 1, 2, false),              // (s[, width])
    STR_REPLACE("StrReplace", 3, 3, false),      // (s, pattern, replacement)
    STR_CONTAINS("StrContains", 2, 2, false),    // (s, sub)
    STR_PREFIX_OF("StrPrefixOf", 2, 2, false),   // (prefix, s)
    STR_SUFFIX_OF("StrSuffixOf", 2, 2, false),   // (suffix, s)
    STR_INDEX_OF("StrIndexOf", 2, 3, false),     // (s, sub[, width])
    STR_TO_INT("StrToInt", 1, 2, false);         // (s[, width])

    private final String name;
    private final int minArity;
    private final int maxArity;
    private final boolean normalizing;

    RawOperation(String name, int minArity, int maxArity, boolean normalizing) {
        this.name = name;
        this.minArity = minArity;
        this.maxArity = maxArity;
        this.normalizing = normalizing;
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    public boolean acceptsArity(int count) {
        return count >= minArity && count <= maxArity;
    }
}
