package org.symtrans.expressions;

import static org.symtrans.expressions.AstNode.bvs;
import static org.symtrans.expressions.AstNode.bvv;
import static org.symtrans.expressions.AstNode.stringS;
import static org.symtrans.expressions.AstNode.stringV;

/**
 * 为词汇表中的每个操作构造一个结构合法的示例节点，供各后端测试共用。
 */
public final class SampleNodes {

    private SampleNodes() {
    }

    public static AstNode sample(Operation op) {
        if (op instanceof LeafOperation leaf) {
            return switch (leaf) {
                case STRING_V -> AstNode.of(leaf, "abc", 3);
                case STRING_S -> AstNode.of(leaf, "s", 8);
                case BOOL_V -> AstNode.boolV(true);
                case BVV -> bvv(7, 32);
                case BVS -> bvs("n", 32);
            };
        }
        RawOperation raw = (RawOperation) op;
        return switch (raw) {
            case ADD, SUB -> AstNode.of(raw, bvs("n", 32), bvv(1, 32), bvv(2, 32));
            case EQ, NE, LT, LE, GT, GE -> AstNode.of(raw, AstNode.of(RawOperation.STR_LEN, stringS("s"), 32), bvv(3, 32));
            case OR, AND -> AstNode.of(raw, AstNode.boolV(true), AstNode.of(RawOperation.STR_CONTAINS, stringS("s"), "a"));
            case NOT -> AstNode.of(raw, AstNode.of(RawOperation.STR_PREFIX_OF, "a", stringS("s")));
            case STR_CONCAT -> AstNode.of(raw, stringS("s"), stringV("-"), "tail");
            case STR_SUBSTR -> AstNode.of(raw, bvs("n", 32), 2, stringS("s"));
            case STR_EXTRACT -> AstNode.of(raw, 1, 2, stringS("s"));
            case STR_LEN -> AstNode.of(raw, stringS("s"), 32);
            case STR_REPLACE -> AstNode.of(raw, stringS("s"), "a", "b");
            case STR_CONTAINS -> AstNode.of(raw, stringS("s"), "a");
            case STR_PREFIX_OF -> AstNode.of(raw, "a", stringS("s"));
            case STR_SUFFIX_OF -> AstNode.of(raw, "z", stringS("s"));
            case STR_INDEX_OF -> AstNode.of(raw, stringS("s"), "a", 32);
            case STR_TO_INT -> AstNode.of(raw, stringS("s"), 32);
        };
    }
}
