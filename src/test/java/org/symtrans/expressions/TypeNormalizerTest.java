package org.symtrans.expressions;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.symtrans.core.BitVecValue;
import org.symtrans.core.Declaration;
import org.symtrans.core.Sort;
import org.symtrans.smtlib.Term;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TypeNormalizerTest {

    private static TypeNormalizer<Term> normalizer;

    private static Term s;
    private static Term n;
    private static Term flag;
    private static Term five;
    private static Term minusOne;
    private static Term bvSymbol;

    @BeforeAll
    static void setUp() {
        normalizer = new TypeNormalizer<>(new TermInspector<>() {
            @Override
            public boolean isStringTheoryTerm(Term expr) {
                return expr.isStringTheoryTerm();
            }

            @Override
            public Optional<BitVecValue> bitVecLiteral(Term expr) {
                return expr.getBitVecValue();
            }

            @Override
            public Term mkIntLiteral(BigInteger value) {
                return Term.intLiteral(value);
            }
        });

        s = Term.symbol(Declaration.of("s", Sort.STRING));
        n = Term.symbol(Declaration.of("n", Sort.INT));
        flag = Term.symbol(Declaration.of("flag", Sort.BOOL));
        five = Term.bitVecLiteral(BitVecValue.valueOf(5, 32));
        minusOne = Term.bitVecLiteral(BitVecValue.valueOf(-1, 32));
        bvSymbol = Term.symbol(Declaration.of("v", Sort.bitVector(32)));
    }

    private static Term integer(long value) {
        return Term.intLiteral(BigInteger.valueOf(value));
    }

    @Nested
    @DisplayName("二元规范化 (Binary normalization)")
    class BinaryTests {

        @Test
        @DisplayName("字符串理论项与定宽字面量：字面量在原位置被替换为整数")
        void testStringTermAndLiteral_ReplacesLiteralInPlace() {
            Pair<Term, Term> right = normalizer.normalize(n, five);
            Pair<Term, Term> left = normalizer.normalize(five, s);

            assertAll("Literal replaced in place",
                    () -> assertEquals(n, right.getLeft()),
                    () -> assertEquals(integer(5), right.getRight()),
                    () -> assertEquals(integer(5), left.getLeft()),
                    () -> assertEquals(s, left.getRight())
            );
        }

        @Test
        @DisplayName("定宽字面量按补码解释为有符号值")
        void testLiteral_UsesSignedValue() {
            Pair<Term, Term> result = normalizer.normalize(n, minusOne);
            assertEquals("(- 1)", result.getRight().toSmtLib());
        }

        @Test
        @DisplayName("其他组合原样返回")
        void testOtherCombinations_Unchanged() {
            assertAll("No coercion",
                    () -> assertEquals(Pair.of(five, minusOne), normalizer.normalize(five, minusOne)),
                    () -> assertEquals(Pair.of(s, n), normalizer.normalize(s, n)),
                    () -> assertEquals(Pair.of(s, bvSymbol), normalizer.normalize(s, bvSymbol)),
                    () -> assertEquals(Pair.of(flag, five), normalizer.normalize(flag, five))
            );
        }

        @Test
        @DisplayName("规范化是对称的")
        void testNormalize_IsSymmetric() {
            List<Term> terms = List.of(s, n, flag, five, minusOne, bvSymbol, integer(3));
            for (Term a : terms) {
                for (Term b : terms) {
                    Pair<Term, Term> forward = normalizer.normalize(a, b);
                    Pair<Term, Term> backward = normalizer.normalize(b, a);
                    assertAll("normalize(" + a + ", " + b + ")",
                            () -> assertEquals(forward.getLeft(), backward.getRight()),
                            () -> assertEquals(forward.getRight(), backward.getLeft())
                    );
                }
            }
        }
    }

    @Nested
    @DisplayName("n 元规范化 (N-ary normalization)")
    class NaryTests {

        @Test
        @DisplayName("有字符串理论项时替换所有定宽字面量")
        void testNormalizeAll_ReplacesEveryLiteral() {
            List<Term> result = normalizer.normalizeAll(List.of(five, n, minusOne));
            assertEquals(List.of(integer(5), n, integer(-1)), result);
        }

        @Test
        @DisplayName("没有字符串理论项时原样返回")
        void testNormalizeAll_WithoutStringTerms() {
            List<Term> operands = List.of(five, minusOne, bvSymbol);
            assertEquals(operands, normalizer.normalizeAll(operands));
        }

        @Test
        @DisplayName("两个操作数时与二元规范化一致")
        void testNormalizeAll_TwoOperands() {
            Pair<Term, Term> pair = normalizer.normalize(five, s);
            assertEquals(List.of(pair.getLeft(), pair.getRight()), normalizer.normalizeAll(List.of(five, s)));
        }
    }
}
