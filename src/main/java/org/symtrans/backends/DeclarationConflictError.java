package org.symtrans.backends;

import lombok.Getter;
import org.symtrans.core.Declaration;

/**
 * 同一个符号名以两种不同的类型被引入。
 */
@Getter
public class DeclarationConflictError extends BackendException {

    private final Declaration existing;
    private final Declaration conflicting;

    public DeclarationConflictError(Declaration existing, Declaration conflicting) {
        super("Symbol '" + existing.getName() + "' is already declared as " + existing.getSort()
                + ", cannot redeclare it as " + conflicting.getSort());
        this.existing = existing;
        this.conflicting = conflicting;
    }
}
