package org.symtrans.expressions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 操作名到 {@link Operation} 的查找表，由两个枚举的全部常量构成。
 */
public final class Operations {

    private static final Logger logger = LoggerFactory.getLogger(Operations.class);

    private static final Map<String, Operation> BY_NAME;

    static {
        Map<String, Operation> byName = new TreeMap<>();
        for (LeafOperation op : LeafOperation.values()) {
            byName.put(op.getName(), op);
        }
        for (RawOperation op : RawOperation.values()) {
            byName.put(op.getName(), op);
        }
        BY_NAME = Collections.unmodifiableMap(byName);
        logger.debug("已登记 {} 个操作", BY_NAME.size());
    }

    private Operations() {
    }

    /**
     * 按上游操作名查找操作。
     * @param name 操作名。
     * @return 对应的操作；不在词汇表中时为空。
     */
    public static Optional<Operation> lookup(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    /**
     * 返回全部已知操作名（按字典序）。
     */
    public static Iterable<String> names() {
        return BY_NAME.keySet();
    }
}
