package org.symtrans.expressions;

import lombok.Getter;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 上游引擎产出的符号表达式树节点：{@code op(args...)}。
 * 参数要么是嵌套的 {@link AstNode}，要么是具体字面量
 * （{@link String}、{@link Boolean}、{@link Integer}、{@link Long}、{@link BigInteger}）。
 * 操作名在分派时才解析，未知操作名由后端报告为 {@code UnsupportedOperationError}。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class AstNode {

    private final String op;
    private final List<Object> args;

    private final int hashCode;

    private AstNode(String op, List<Object> args) {
        this.op = Objects.requireNonNull(op, "AstNode-构造函数: op 不能为 null");
        List<Object> copy = new ArrayList<>(args.size());
        for (Object arg : args) {
            Objects.requireNonNull(arg, "AstNode-构造函数: 参数不能为 null");
            if (!isAllowedArgument(arg)) {
                throw new IllegalArgumentException("AstNode-构造函数: 不支持的参数类型 " + arg.getClass().getName());
            }
            copy.add(arg);
        }
        this.args = Collections.unmodifiableList(copy);
        this.hashCode = Objects.hash(op, this.args);
    }

    private static boolean isAllowedArgument(Object arg) {
        return arg instanceof AstNode
                || arg instanceof String
                || arg instanceof Boolean
                || arg instanceof Integer
                || arg instanceof Long
                || arg instanceof BigInteger;
    }

    // --- 工厂方法 ---
    public static AstNode of(String op, Object... args) {
        return new AstNode(op, Arrays.asList(args));
    }

    public static AstNode of(String op, List<?> args) {
        return new AstNode(op, new ArrayList<>(args));
    }

    public static AstNode of(Operation op, Object... args) {
        return new AstNode(op.getName(), Arrays.asList(args));
    }

    public static AstNode stringV(String value) {
        return of(LeafOperation.STRING_V, value);
    }

    public static AstNode stringS(String name) {
        return of(LeafOperation.STRING_S, name);
    }

    public static AstNode boolV(boolean value) {
        return of(LeafOperation.BOOL_V, value);
    }

    public static AstNode bvv(long value, int width) {
        return of(LeafOperation.BVV, value, width);
    }

    public static AstNode bvs(String name, int width) {
        return of(LeafOperation.BVS, name, width);
    }

    /**
     * 参数个数
     */
    public int arity() {
        return args.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AstNode that = (AstNode) o;
        return op.equals(that.op) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return op + args.stream()
                .map(arg -> arg instanceof String ? "'" + arg + "'" : arg.toString())
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
