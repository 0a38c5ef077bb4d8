package org.symtrans.strings;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.symtrans.core.BitVecValue;
import org.symtrans.core.StringValue;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConcreteStringsTest {

    private static StringValue str(String value) {
        return StringValue.of(value);
    }

    @Nested
    @DisplayName("构造字符串 (Building strings)")
    class BuildingTests {

        @Test
        @DisplayName("连接后的长度与前缀、后缀")
        void testConcat() {
            StringValue a = str("foo");
            StringValue b = str("bar");
            StringValue ab = ConcreteStrings.concat(a, b);

            assertAll("Concatenation",
                    () -> assertEquals(str("foobar"), ab),
                    () -> assertEquals(BitVecValue.valueOf(6, 32), ConcreteStrings.length(ab, 32)),
                    () -> assertTrue(ConcreteStrings.prefixOf(a, ab)),
                    () -> assertTrue(ConcreteStrings.suffixOf(b, ab)),
                    () -> assertEquals(StringValue.EMPTY, ConcreteStrings.concat())
            );
        }

        @Test
        @DisplayName("子串区间两端都包含")
        void testSubstr_Inclusive() {
            StringValue hello = str("hello");
            assertAll("Inclusive substring",
                    () -> assertEquals(str("ell"), ConcreteStrings.substr(1, 3, hello)),
                    () -> assertEquals(str("h"), ConcreteStrings.substr(0, 0, hello)),
                    () -> assertEquals(str("hello"), ConcreteStrings.substr(0, 4, hello)),
                    () -> assertThrows(IndexOutOfBoundsException.class, () -> ConcreteStrings.substr(2, 5, hello)),
                    () -> assertThrows(IndexOutOfBoundsException.class, () -> ConcreteStrings.substr(3, 1, hello))
            );
        }

        @Test
        @DisplayName("只替换第一次出现")
        void testReplace_FirstOccurrenceOnly() {
            assertAll("Replace",
                    () -> assertEquals(str("bxaa"), ConcreteStrings.replace(str("aaxaa"), str("aa"), str("b"))),
                    () -> assertEquals(str("abc"), ConcreteStrings.replace(str("abc"), str("z"), str("y"))),
                    () -> assertEquals(str("!abc"), ConcreteStrings.replace(str("abc"), StringValue.EMPTY, str("!")))
            );
        }
    }

    @Nested
    @DisplayName("查询 (Queries)")
    class QueryTests {

        @Test
        @DisplayName("length(\"hello\", 32) == 5")
        void testLength() {
            assertEquals(BigInteger.valueOf(5), ConcreteStrings.length(str("hello"), 32).getValue());
        }

        @Test
        @DisplayName("子串下标，不存在时为 -1")
        void testIndexOf() {
            assertAll("indexOf",
                    () -> assertEquals(BitVecValue.valueOf(2, 32), ConcreteStrings.indexOf(str("hello"), str("l"), 32)),
                    () -> assertEquals(BitVecValue.valueOf(-1, 32), ConcreteStrings.indexOf(str("hello"), str("z"), 32)),
                    () -> assertEquals(BigInteger.valueOf(-1), ConcreteStrings.indexOf(str("hello"), str("z"), 16).getSignedValue()),
                    () -> assertEquals(BitVecValue.valueOf(0, 8), ConcreteStrings.indexOf(str("hello"), StringValue.EMPTY, 8))
            );
        }

        @Test
        @DisplayName("返回第一次出现的下标 (index_of(\"abcabc\", \"bc\") == 1)")
        void testIndexOf_FirstOccurrenceWins() {
            assertEquals(BitVecValue.valueOf(1, 32), ConcreteStrings.indexOf(str("abcabc"), str("bc"), 32));
        }

        @Test
        @DisplayName("BMP 以外的字符按一个码点计数")
        void testSupplementaryCharacters_CountAsOneCodePoint() {
            String grin = new String(Character.toChars(0x1F600));
            StringValue s = str("a" + grin + "b");

            assertAll("Code point semantics",
                    () -> assertEquals(BitVecValue.valueOf(3, 32), ConcreteStrings.length(s, 32)),
                    () -> assertEquals(BitVecValue.valueOf(2, 32), ConcreteStrings.indexOf(s, str("b"), 32)),
                    () -> assertEquals(BitVecValue.valueOf(1, 32), ConcreteStrings.indexOf(s, str(grin), 32)),
                    () -> assertEquals(str(grin), ConcreteStrings.substr(1, 1, s)),
                    () -> assertEquals(str(grin + "b"), ConcreteStrings.substr(1, 2, s)),
                    () -> assertThrows(IndexOutOfBoundsException.class, () -> ConcreteStrings.substr(0, 3, s)),
                    () -> assertEquals(str("axb"), ConcreteStrings.replace(s, str(grin), str("x")))
            );
        }

        @Test
        @DisplayName("包含、前缀与后缀按字面匹配")
        void testLiteralMatching() {
            assertAll("Literal matching",
                    () -> assertTrue(ConcreteStrings.contains(str("a.b"), str("."))),
                    () -> assertFalse(ConcreteStrings.prefixOf(str("."), str("ab"))),
                    () -> assertFalse(ConcreteStrings.suffixOf(str("b*"), str("ab"))),
                    () -> assertTrue(ConcreteStrings.prefixOf(StringValue.EMPTY, str("ab")))
            );
        }

        @Test
        @DisplayName("数字串转整数")
        void testToInt() {
            assertAll("toInt",
                    () -> assertEquals(BitVecValue.valueOf(42, 32), ConcreteStrings.toInt(str("042"), 32)),
                    () -> assertEquals(BitVecValue.valueOf(-1, 32), ConcreteStrings.toInt(str("-1"), 32)),
                    () -> assertEquals(BitVecValue.valueOf(-1, 32), ConcreteStrings.toInt(StringValue.EMPTY, 32))
            );
        }
    }
}
