package org.symtrans.backends;

import java.util.List;

/**
 * 外部求解编排对象：提供当前的有序约束序列，作为查询的默认输入。
 * @param <E> 后端的表达式类型。
 */
@FunctionalInterface
public interface ConstraintProvider<E> {

    List<E> getConstraints();
}
