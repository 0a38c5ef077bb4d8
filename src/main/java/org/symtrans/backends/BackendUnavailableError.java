package org.symtrans.backends;

/**
 * 后端只能产出表达式或查询文本，自身无法判定可满足性。
 * 与翻译失败不同，它提示调用方改用专门的求解后端。
 */
public class BackendUnavailableError extends BackendException {

    public BackendUnavailableError(String message) {
        super(message);
    }
}
