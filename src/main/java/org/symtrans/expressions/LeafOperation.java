package org.symtrans.expressions;

import lombok.Getter;

/**
 * 叶操作：构造常量或引入新符号。参数是具体字面量，不会被递归翻译。
 * 引入符号的叶操作会产生一个声明。
 */
@Getter
public enum LeafOperation implements Operation {

    STRING_V("StringV", 1, 2),   // (value[, length])
    STRING_S("StringS", 1, 2),   // (name[, length])
    BOOL_V("BoolV", 1, 1),       // (value)
    BVV("BVV", 2, 2),            // (value, width)
    BVS("BVS", 2, 2);            // (name, width)

    private final String name;
    private final int minArgs;
    private final int maxArgs;

    LeafOperation(String name, int minArgs, int maxArgs) {
        this.name = name;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    /**
     * 此叶操作是否引入新符号。
     */
    public boolean introducesSymbol() {
        return this == STRING_S || this == BVS;
    }

    public boolean acceptsArity(int count) {
        return count >= minArgs && count <= maxArgs;
    }
}
