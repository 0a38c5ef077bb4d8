package org.symtrans.smtlib;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.symtrans.backends.DeclarationConflictError;
import org.symtrans.core.BitVecValue;
import org.symtrans.core.Declaration;
import org.symtrans.core.Sort;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TermPrinterTest {

    private static Term s;
    private static Term t;

    @BeforeAll
    static void setUp() {
        s = Term.symbol(Declaration.of("s", Sort.STRING));
        t = Term.symbol(Declaration.of("t", Sort.STRING));
    }

    @Nested
    @DisplayName("字面量 (Literals)")
    class LiteralTests {

        @Test
        @DisplayName("各类字面量的 SMT-LIB 形式")
        void testLiteralRendering() {
            assertAll("Literal rendering",
                    () -> assertEquals("42", Term.intLiteral(BigInteger.valueOf(42)).toSmtLib()),
                    () -> assertEquals("(- 7)", Term.intLiteral(BigInteger.valueOf(-7)).toSmtLib()),
                    () -> assertEquals("true", Term.boolLiteral(true).toSmtLib()),
                    () -> assertEquals("(_ bv255 8)", Term.bitVecLiteral(BitVecValue.valueOf(-1, 8)).toSmtLib()),
                    () -> assertEquals("\"hi\"", Term.stringLiteral("hi").toSmtLib())
            );
        }

        @Test
        @DisplayName("只有定宽字面量带有数值")
        void testBitVecValue_OnlyOnBitVecLiterals() {
            assertAll("Bit-vector value",
                    () -> assertEquals(BitVecValue.valueOf(3, 4), Term.bitVecLiteral(BitVecValue.valueOf(3, 4)).getBitVecValue().orElseThrow()),
                    () -> assertTrue(Term.intLiteral(BigInteger.ONE).getBitVecValue().isEmpty()),
                    () -> assertTrue(s.getBitVecValue().isEmpty())
            );
        }
    }

    @Nested
    @DisplayName("共享子项 (Daggify)")
    class DaggifyTests {

        @Test
        @DisplayName("重复出现的子项只写一次")
        void testSharedSubterm_IsBoundOnce() {
            Term concat = Term.apply("str.++", Sort.STRING, s, Term.stringLiteral("a"));
            Term root = Term.apply("or", Sort.BOOL,
                    Term.apply("=", Sort.BOOL, concat, Term.stringLiteral("ab")),
                    Term.apply("=", Sort.BOOL, concat, Term.stringLiteral("ba")));

            assertAll("Daggified output",
                    () -> assertEquals("(let ((?def_0 (str.++ s \"a\"))) (or (= ?def_0 \"ab\") (= ?def_0 \"ba\")))",
                            TermPrinter.print(root, true)),
                    () -> assertEquals("(or (= (str.++ s \"a\") \"ab\") (= (str.++ s \"a\") \"ba\"))",
                            TermPrinter.print(root, false))
            );
        }

        @Test
        @DisplayName("嵌套的共享子项按后序命名")
        void testNestedSharing_PostOrderNames() {
            Term inner = Term.apply("str.++", Sort.STRING, s, t);
            Term len = Term.apply("str.len", Sort.INT, inner);
            Term root = Term.apply("and", Sort.BOOL,
                    Term.apply("=", Sort.BOOL, len, Term.intLiteral(BigInteger.ONE)),
                    Term.apply("<", Sort.BOOL, len, Term.intLiteral(BigInteger.TEN)),
                    Term.apply("str.contains", Sort.BOOL, inner, s));

            assertEquals("(let ((?def_0 (str.++ s t))) (let ((?def_1 (str.len ?def_0))) "
                            + "(and (= ?def_1 1) (< ?def_1 10) (str.contains ?def_0 s))))",
                    TermPrinter.print(root, true));
        }

        @Test
        @DisplayName("没有共享子项时两种模式输出相同")
        void testNoSharing_SameOutput() {
            Term root = Term.apply("=", Sort.BOOL, Term.apply("str.len", Sort.INT, s), Term.apply("str.len", Sort.INT, t));
            assertEquals(TermPrinter.print(root, false), TermPrinter.print(root, true));
        }

        @Test
        @DisplayName("重复的符号与字面量不绑定")
        void testRepeatedLeaves_AreNotBound() {
            Term root = Term.apply("=", Sort.BOOL, s, s);
            assertEquals("(= s s)", TermPrinter.print(root, true));
        }
    }

    @Nested
    @DisplayName("自由变量 (Free variables)")
    class FreeVariableTests {

        @Test
        @DisplayName("函数应用汇总参数的自由变量")
        void testApply_CollectsFreeVariables() {
            Term root = Term.apply("str.++", Sort.STRING, t, Term.apply("str.++", Sort.STRING, s, t));
            assertEquals(List.of("s", "t"), List.copyOf(root.getFreeVariables().keySet()));
        }

        @Test
        @DisplayName("同名不同类型的符号不能出现在同一项中")
        void testApply_RejectsConflictingSymbols() {
            Term intS = Term.symbol(Declaration.of("s", Sort.INT));
            assertThrows(DeclarationConflictError.class,
                    () -> Term.apply("=", Sort.BOOL, Term.apply("str.len", Sort.INT, s), intS));
        }
    }
}
