package org.symtrans.backends;

/**
 * 所有翻译失败的根异常。
 * 翻译过程是快速失败的：异常在出错点同步抛出，不会产生任何部分输出。
 */
public class BackendException extends RuntimeException {

    public BackendException(String message) {
        super(message);
    }
}
