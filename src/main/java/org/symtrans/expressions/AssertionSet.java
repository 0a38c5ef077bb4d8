package org.symtrans.expressions;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 已翻译的顶层约束的有序集合，语义为其中所有断言的合取。
 * 顺序即断言在查询脚本中出现的顺序。
 * 此类是不可变的。
 * @param <E> 后端的表达式类型。
 */
@Getter
public final class AssertionSet<E> implements Iterable<E> {

    private static final Logger logger = LoggerFactory.getLogger(AssertionSet.class);

    private static final AssertionSet<?> EMPTY = new AssertionSet<>(Collections.emptyList());

    private final List<E> assertions;

    private AssertionSet(List<E> assertions) {
        Objects.requireNonNull(assertions, "Assertions list cannot be null");
        List<E> copy = new ArrayList<>(assertions.size());
        for (E assertion : assertions) {
            copy.add(Objects.requireNonNull(assertion, "Assertion cannot be null"));
        }
        this.assertions = Collections.unmodifiableList(copy);
        logger.debug("创建 AssertionSet，共 {} 条断言", this.assertions.size());
    }

    @SuppressWarnings("unchecked")
    public static <E> AssertionSet<E> empty() {
        return (AssertionSet<E>) EMPTY;
    }

    public static <E> AssertionSet<E> of(List<E> assertions) {
        return new AssertionSet<>(assertions);
    }

    @SafeVarargs
    public static <E> AssertionSet<E> of(E... assertions) {
        return new AssertionSet<>(List.of(assertions));
    }

    /**
     * 在末尾追加一条断言。
     * @return 新的 AssertionSet。
     */
    public AssertionSet<E> and(E assertion) {
        List<E> merged = new ArrayList<>(assertions);
        merged.add(assertion);
        return new AssertionSet<>(merged);
    }

    /**
     * 将额外约束放在当前断言之前，用于仅在一次调用范围内生效的查询。
     * @param extra 额外约束。
     * @return 新的 AssertionSet：extra 在前，原断言在后。
     */
    public AssertionSet<E> prepend(List<E> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        List<E> merged = new ArrayList<>(extra.size() + assertions.size());
        merged.addAll(extra);
        merged.addAll(assertions);
        logger.debug("合并 {} 条额外约束到 AssertionSet 之前", extra.size());
        return new AssertionSet<>(merged);
    }

    public boolean isEmpty() {
        return assertions.isEmpty();
    }

    public int size() {
        return assertions.size();
    }

    @Override
    public Iterator<E> iterator() {
        return assertions.iterator();
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
        return assertions.equals(((AssertionSet<?>) o).assertions);
    }

    @Override
    public int hashCode() {
        return assertions.hashCode();
    }

    @Override
    public String toString() {
        if (assertions.isEmpty()) {
            return "TRUE";
        }
        return assertions.stream()
                .map(Object::toString)
                .collect(Collectors.joining(" /\\ ", "(", ")"));
    }
}
