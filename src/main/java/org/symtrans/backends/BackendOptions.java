package org.symtrans.backends;

import lombok.Builder;
import lombok.Getter;

/**
 * 后端配置。
 */
@Getter
@Builder
public final class BackendOptions {

    private static final BackendOptions DEFAULTS = BackendOptions.builder().build();

    /**
     * {@code (set-logic ...)} 中使用的逻辑
     */
    @Builder.Default
    private final String logic = "ALL";

    /**
     * 为同一断言中重复出现的子项生成 let 绑定
     */
    @Builder.Default
    private final boolean daggify = true;

    public static BackendOptions defaults() {
        return DEFAULTS;
    }
}
