package org.symtrans.backends;

/**
 * 叶节点的具体载荷与其声明的类型不符，
 * 例如符号名不是合法标识符，或常量值的 Java 类型不对。
 */
public class MalformedLiteralError extends BackendException {

    public MalformedLiteralError(String message) {
        super(message);
    }
}
