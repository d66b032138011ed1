package org.csu.algolisp.compiler.lexer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: 标识符命名转换规则测试
 */
public class NameTranslatorTest {

    @Test
    void testSpecialPatterns() {
        System.out.println("--- Running test: testSpecialPatterns ---");
        assertEquals("null?", NameTranslator.translate("is_null"));
        assertEquals("string->list", NameTranslator.translate("string_to_list"));
        assertEquals("vector-set!", NameTranslator.translate("vector_set"));
        assertEquals("set-box!", NameTranslator.translate("set_box"));
        assertEquals("fx+", NameTranslator.translate("fx_add"));
        assertEquals("fx-", NameTranslator.translate("fx_sub"));
        assertEquals("fx*", NameTranslator.translate("fx_mul"));
        assertEquals("char=", NameTranslator.translate("char_eq"));
        assertEquals("string<", NameTranslator.translate("string_lt"));
        assertEquals("string>", NameTranslator.translate("string_gt"));
        assertEquals("reverse!", NameTranslator.translate("reverse_bang"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testFirstMatchingRuleWins() {
        System.out.println("--- Running test: testFirstMatchingRuleWins ---");
        // is_ 优先于 _to_, 捕获部分只做下划线替换
        assertEquals("char-to-integer?", NameTranslator.translate("is_char_to_integer"));
        // 非贪婪匹配: 第一个 _to_ 被替换
        assertEquals("list->string-to-x", NameTranslator.translate("list_to_string_to_x"));
        // is_ 优先于 _set
        assertEquals("set?", NameTranslator.translate("is_set"));
        assertEquals("set-car!", NameTranslator.translate("set_car"));
        assertEquals("hash-table-set!", NameTranslator.translate("hash_table_set"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testPlainHyphenation() {
        System.out.println("--- Running test: testPlainHyphenation ---");
        assertEquals("call-with-current-continuation", NameTranslator.translate("call_with_current_continuation"));
        assertEquals("x", NameTranslator.translate("x"));
        assertEquals("isnull", NameTranslator.translate("isnull"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSymbolicConstants() {
        System.out.println("--- Running test: testSymbolicConstants ---");
        assertTrue(NameTranslator.isConstant("RED"));
        assertTrue(NameTranslator.isConstant("MAX_SIZE"));
        assertTrue(NameTranslator.isConstant("X1"));
        assertFalse(NameTranslator.isConstant("Red"));
        assertFalse(NameTranslator.isConstant("x"));
        assertEquals("max-size", NameTranslator.translateConstant("MAX_SIZE"));
        System.out.println("Result: Test PASSED.\n");
    }
}
