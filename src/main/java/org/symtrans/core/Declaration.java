package org.symtrans.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 一个符号声明：名称及其类型。
 * 在一次查询中每个名称至多声明一次，并且类型在其生命周期内固定。
 * 按名称排序，用于生成确定性的声明块。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class Declaration implements Comparable<Declaration> {

    private static final Logger logger = LoggerFactory.getLogger(Declaration.class);

    private final String name;
    private final Sort sort;

    private final int hashCode;

    private Declaration(String name, Sort sort) {
        this.name = Objects.requireNonNull(name, "Declaration name cannot be null.");
        this.sort = Objects.requireNonNull(sort, "Declaration sort cannot be null.");
        this.hashCode = Objects.hash(name, sort);
        logger.debug("创建了一个Declaration: {} : {}", name, sort);
    }

    public static Declaration of(String name, Sort sort) {
        return new Declaration(name, sort);
    }

    /**
     * 检查此声明与另一个同名声明的类型是否冲突。
     * @param other 另一个声明。
     * @return 如果名称相同但类型不同则返回 true。
     */
    public boolean conflictsWith(Declaration other) {
        return name.equals(other.name) && !sort.equals(other.sort);
    }

    /**
     * 返回 SMT-LIB 声明命令，形如 {@code (declare-fun s () String)}。
     */
    public String toSmtLib() {
        return "(declare-fun " + name + " () " + sort.toSmtLib() + ")";
    }

    @Override
    public int compareTo(Declaration other) {
        int cmp = name.compareTo(other.name);
        if (cmp != 0) {
            return cmp;
        }
        return sort.compareTo(other.sort);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Declaration that = (Declaration) o;
        return name.equals(that.name) && sort.equals(that.sort);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name + " : " + sort;
    }
}
