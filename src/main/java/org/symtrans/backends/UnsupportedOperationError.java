package org.symtrans.backends;

import lombok.Getter;

/**
 * 请求的操作名没有可用的翻译策略。
 * 对当前后端实例不可恢复，调用方应改用其他后端或使整个查询失败。
 */
@Getter
public class UnsupportedOperationError extends BackendException {

    private final String operationName;
    private final String backendName;

    public UnsupportedOperationError(String operationName, String backendName) {
        super("Backend '" + backendName + "' has no translation for operation '" + operationName + "'");
        this.operationName = operationName;
        this.backendName = backendName;
    }
}
