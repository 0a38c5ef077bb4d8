package org.symtrans.smtlib;

import lombok.AccessLevel;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.symtrans.backends.DeclarationConflictError;
import org.symtrans.core.BitVecValue;
import org.symtrans.core.Declaration;
import org.symtrans.core.Sort;
import org.symtrans.core.StringValue;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * SMT-LIB 项：符号、字面量或函数应用。
 * 每个项都带有其类型，并在构造时汇总它传递引用的全部符号声明（自由变量）。
 * 此类是不可变的，可以在多个断言之间共享。
 * @author Ayalyt
 */
@Getter
public final class Term {

    private static final Logger logger = LoggerFactory.getLogger(Term.class);

    public enum Kind {
        SYMBOL,
        LITERAL,
        APPLICATION
    }

    private final Kind kind;
    private final Sort sort;
    // 符号名、字面量文本或函数名
    private final String head;
    private final List<Term> args;
    // 按名称排序的自由变量
    private final SortedMap<String, Declaration> freeVariables;

    @Getter(AccessLevel.NONE)
    private final BitVecValue bitVecValue; // 仅定宽字面量非 null

    private final int hashCode;

    private Term(Kind kind, Sort sort, String head, List<Term> args, BitVecValue bitVecValue,
                 SortedMap<String, Declaration> freeVariables) {
        this.kind = kind;
        this.sort = sort;
        this.head = head;
        this.args = args;
        this.bitVecValue = bitVecValue;
        this.freeVariables = Collections.unmodifiableSortedMap(freeVariables);
        this.hashCode = Objects.hash(kind, sort, head, args);
    }

    // --- 工厂方法 ---

    public static Term symbol(Declaration declaration) {
        SortedMap<String, Declaration> free = new TreeMap<>();
        free.put(declaration.getName(), declaration);
        return new Term(Kind.SYMBOL, declaration.getSort(), declaration.getName(), List.of(), null, free);
    }

    public static Term stringLiteral(String value) {
        return literal(Sort.STRING, quote(value), null);
    }

    public static Term intLiteral(BigInteger value) {
        String text = value.signum() < 0 ? "(- " + value.negate() + ")" : value.toString();
        return literal(Sort.INT, text, null);
    }

    public static Term boolLiteral(boolean value) {
        return literal(Sort.BOOL, value ? "true" : "false", null);
    }

    public static Term bitVecLiteral(BitVecValue value) {
        return literal(value.getSort(), value.toSmtLib(), value);
    }

    private static Term literal(Sort sort, String text, BitVecValue bitVecValue) {
        return new Term(Kind.LITERAL, sort, text, List.of(), bitVecValue, new TreeMap<>());
    }

    /**
     * 函数应用 {@code (operator args...)}。
     * @throws DeclarationConflictError 如果参数中同名符号的类型不一致。
     */
    public static Term apply(String operator, Sort sort, List<Term> args) {
        Objects.requireNonNull(operator, "Term-apply: operator 不能为 null");
        Objects.requireNonNull(sort, "Term-apply: sort 不能为 null");
        SortedMap<String, Declaration> free = new TreeMap<>();
        for (Term arg : args) {
            for (Declaration declaration : arg.freeVariables.values()) {
                Declaration existing = free.putIfAbsent(declaration.getName(), declaration);
                if (existing != null && existing.conflictsWith(declaration)) {
                    logger.error("Term-apply: 符号 {} 在 {} 的参数中类型不一致", declaration.getName(), operator);
                    throw new DeclarationConflictError(existing, declaration);
                }
            }
        }
        return new Term(Kind.APPLICATION, sort, operator, List.copyOf(args), null, free);
    }

    public static Term apply(String operator, Sort sort, Term... args) {
        return apply(operator, sort, List.of(args));
    }

    // --- 查询 ---

    public Optional<BitVecValue> getBitVecValue() {
        return Optional.ofNullable(bitVecValue);
    }

    public boolean isApplication() {
        return kind == Kind.APPLICATION;
    }

    /**
     * 是否属于字符串理论一侧：String 类型或无界整数类型。
     */
    public boolean isStringTheoryTerm() {
        return sort.isString() || sort.isInt();
    }

    public String toSmtLib() {
        return TermPrinter.print(this, false);
    }

    /**
     * SMT-LIB 2.6 字符串字面量：双引号内的双引号写作两个双引号，其余字符按 {@link StringValue#escapeCodePoints} 转义。
     */
    static String quote(String value) {
        return '"' + StringValue.escapeCodePoints(value).replace("\"", "\"\"") + '"';
    }

    // --- Object 方法 ---
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Term that = (Term) o;
        return hashCode == that.hashCode
                && kind == that.kind
                && sort.equals(that.sort)
                && head.equals(that.head)
                && args.equals(that.args);
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
