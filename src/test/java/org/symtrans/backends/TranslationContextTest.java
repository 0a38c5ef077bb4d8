package org.symtrans.backends;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.symtrans.core.Declaration;
import org.symtrans.core.Sort;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TranslationContextTest {

    private TranslationContext ctx;

    @BeforeEach
    void setUp() {
        ctx = TranslationContext.create();
    }

    @Test
    @DisplayName("声明按首次出现的顺序记录，重复声明只记录一次")
    void testDeclare_RecordsInInsertionOrder() {
        Declaration y = Declaration.of("y", Sort.STRING);
        Declaration x = Declaration.of("x", Sort.INT);

        assertAll("Declarations",
                () -> assertTrue(ctx.declare(y)),
                () -> assertTrue(ctx.declare(x)),
                () -> assertFalse(ctx.declare(Declaration.of("y", Sort.STRING))),
                () -> assertEquals(List.of(y, x), ctx.getPendingDeclarations()),
                () -> assertEquals(x, ctx.lookup("x").orElseThrow()),
                () -> assertTrue(ctx.lookup("z").isEmpty()),
                () -> assertTrue(ctx.isValid())
        );
    }

    @Test
    @DisplayName("同名不同类型的声明使上下文失效")
    void testDeclare_ConflictInvalidatesContext() {
        ctx.declare(Declaration.of("x", Sort.STRING));

        DeclarationConflictError error = assertThrows(DeclarationConflictError.class,
                () -> ctx.declare(Declaration.of("x", Sort.bitVector(8))));
        IllegalStateException afterwards = assertThrows(IllegalStateException.class, () -> ctx.lookup("x"));

        assertAll("Invalidated context",
                () -> assertFalse(ctx.isValid()),
                () -> assertSame(error, afterwards.getCause()),
                () -> assertThrows(IllegalStateException.class, () -> ctx.declare(Declaration.of("y", Sort.BOOL)))
        );
    }

    @Test
    @DisplayName("返回的声明列表不可修改")
    void testPendingDeclarations_AreUnmodifiable() {
        ctx.declare(Declaration.of("x", Sort.STRING));
        assertThrows(UnsupportedOperationException.class,
                () -> ctx.getPendingDeclarations().add(Declaration.of("y", Sort.STRING)));
    }
}
