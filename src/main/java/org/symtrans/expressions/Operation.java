package org.symtrans.expressions;

/**
 * 上游引擎可能产生的操作。词汇表是封闭的，由 {@link LeafOperation} 与 {@link RawOperation} 两个枚举组成。
 */
public interface Operation {

    /**
     * 上游表达式树中使用的操作名，例如 {@code StringV}、{@code __eq__}。
     */
    String getName();

    /**
     * 是否为叶操作（直接接收字面量参数，不递归翻译子节点）。
     */
    boolean isLeaf();
}
