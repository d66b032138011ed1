package org.csu.algolisp.compiler.lexer;

import org.csu.algolisp.common.exception.LexicalException;
import org.csu.algolisp.common.model.Datum;
import org.csu.algolisp.reader.StandardEscapeDelegate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: 词法分析器测试
 */
public class LexerTest {

    private List<Token> tokenize(String source) {
        return tokenize(source, false);
    }

    private List<Token> tokenize(String source, boolean charHexTerminatorRequired) {
        System.out.println("Input: " + source);
        List<Token> tokens = new Lexer(source, new StandardEscapeDelegate(), charHexTerminatorRequired).tokenize();
        tokens.forEach(System.out::println);
        return tokens;
    }

    private List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    void testKeywordsAndIdentifiers() {
        System.out.println("--- Running test: testKeywordsAndIdentifiers ---");
        List<Token> tokens = tokenize("val is_null = fn x -> exposing");
        assertEquals(List.of(TokenType.VAL, TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.FN,
                TokenType.IDENTIFIER, TokenType.ARROW, TokenType.IDENTIFIER, TokenType.EOF), types(tokens));
        // 标识符的 value 是转换后的 Scheme 名字, lexeme 保持原文
        assertEquals("null?", tokens.get(1).name());
        assertEquals("is_null", tokens.get(1).lexeme());
        // 上下文关键字只是普通标识符
        assertEquals("exposing", tokens.get(6).name());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSymbolicConstant() {
        System.out.println("--- Running test: testSymbolicConstant ---");
        List<Token> tokens = tokenize("RED MAX_SIZE Red");
        assertEquals(TokenType.CONSTANT, tokens.get(0).type());
        assertEquals("red", tokens.get(0).name());
        assertEquals("max-size", tokens.get(1).name());
        assertEquals(TokenType.IDENTIFIER, tokens.get(2).type());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testLoneUnderscoreIsWildcard() {
        System.out.println("--- Running test: testLoneUnderscoreIsWildcard ---");
        List<Token> tokens = tokenize("s(_, x)");
        assertEquals(TokenType.IDENTIFIER, tokens.get(2).type());
        assertEquals("_", tokens.get(2).name());
        assertEquals(TokenType.COMMA, tokens.get(3).type());
        // 以 _ 开头的名字仍然非法
        assertThrows(LexicalException.class, () -> tokenize("_x"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testHexEscapeTakesAsciiDigitsOnly() {
        System.out.println("--- Running test: testHexEscapeTakesAsciiDigitsOnly ---");
        assertThrows(LexicalException.class, () -> tokenize("\"\\x\uFF11;\""));
        assertThrows(LexicalException.class, () -> tokenize("'\\x\uFF11'"));
        assertThrows(LexicalException.class, () -> tokenize("\"\\x110000;\""));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testOperatorsAndDelimiters() {
        System.out.println("--- Running test: testOperatorsAndDelimiters ---");
        List<Token> tokens = tokenize("-> == <= >= ... #[ x ] include_ci");
        assertEquals(List.of(TokenType.ARROW, TokenType.EQUAL_EQUAL, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
                TokenType.ELLIPSIS, TokenType.VECTOR_OPEN, TokenType.IDENTIFIER, TokenType.RBRACKET,
                TokenType.INCLUDE_CI, TokenType.EOF), types(tokens));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testNumbers() {
        System.out.println("--- Running test: testNumbers ---");
        List<Token> tokens = tokenize("42 3.14 1e10 2i #x1F #e1.5");
        assertEquals(List.of(TokenType.INTEGER, TokenType.DECIMAL, TokenType.DECIMAL, TokenType.IMAGINARY,
                TokenType.PREFIXED_NUMBER, TokenType.PREFIXED_NUMBER, TokenType.EOF), types(tokens));
        assertEquals("#x1F", tokens.get(4).lexeme());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testMalformedNumerals() {
        System.out.println("--- Running test: testMalformedNumerals ---");
        assertThrows(LexicalException.class, () -> tokenize("12abc"));
        assertThrows(LexicalException.class, () -> tokenize("2if"));
        // 二进制中不能出现 2
        assertThrows(LexicalException.class, () -> tokenize("#b102"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testStringEscapes() {
        System.out.println("--- Running test: testStringEscapes ---");
        List<Token> tokens = tokenize("\"a\\nb\\x41;\\\"q\\\"\"");
        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals("a\nbA\"q\"", tokens.get(0).value());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testStringHexEscapeNeedsTerminator() {
        System.out.println("--- Running test: testStringHexEscapeNeedsTerminator ---");
        LexicalException e = assertThrows(LexicalException.class, () -> tokenize("\"\\x41\""));
        System.out.println("Caught: " + e.getMessage());
        assertTrue(e.getMessage().contains("';'"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testStringContinuation() {
        System.out.println("--- Running test: testStringContinuation ---");
        // 反斜杠换行: 续行的前导空格和一个可选的反斜杠都被去掉
        List<Token> tokens = tokenize("\"abc\\\n    \\def\" x");
        assertEquals("abcdef", tokens.get(0).value());
        assertEquals(2, tokens.get(1).line());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testCharacters() {
        System.out.println("--- Running test: testCharacters ---");
        List<Token> tokens = tokenize("'a' '\\n' '\\x41' '\\x42;'");
        assertEquals(97, tokens.get(0).value());
        assertEquals(10, tokens.get(1).value());
        assertEquals(65, tokens.get(2).value());
        assertEquals(66, tokens.get(3).value());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testCharHexTerminatorCanBeRequired() {
        System.out.println("--- Running test: testCharHexTerminatorCanBeRequired ---");
        assertThrows(LexicalException.class, () -> tokenize("'\\x41'", true));
        assertEquals(65, tokenize("'\\x41;'", true).get(0).value());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUnterminatedLiterals() {
        System.out.println("--- Running test: testUnterminatedLiterals ---");
        assertThrows(LexicalException.class, () -> tokenize("\"abc"));
        assertThrows(LexicalException.class, () -> tokenize("'ab'"));
        assertThrows(LexicalException.class, () -> tokenize("x {- never closed"));
        assertThrows(LexicalException.class, () -> tokenize("\"\\q\""));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testComments() {
        System.out.println("--- Running test: testComments ---");
        List<Token> tokens = tokenize("x -- line comment\n{- outer {- inner -} still outer -} y");
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF), types(tokens));
        assertEquals("y", tokens.get(1).name());
        assertTrue(tokens.get(1).lineStart());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testPositionsAndLineStart() {
        System.out.println("--- Running test: testPositionsAndLineStart ---");
        List<Token> tokens = tokenize("val x =\n  1");
        assertTrue(tokens.get(0).lineStart());
        assertFalse(tokens.get(1).lineStart());
        Token one = tokens.get(3);
        assertEquals(2, one.line());
        assertEquals(3, one.column());
        assertTrue(one.lineStart());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testRejectedCharacters() {
        System.out.println("--- Running test: testRejectedCharacters ---");
        LexicalException tab = assertThrows(LexicalException.class, () -> tokenize("x\t= 1"));
        assertEquals(1, tab.getLine());
        assertEquals(2, tab.getColumn());
        assertThrows(LexicalException.class, () -> tokenize("x $ y"));
        assertThrows(LexicalException.class, () -> tokenize("#q"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEscapedDatum() {
        System.out.println("--- Running test: testEscapedDatum ---");
        List<Token> tokens = tokenize("\\(a b) x");
        assertEquals(TokenType.ESCAPED_DATUM, tokens.get(0).type());
        assertEquals(Datum.list(Datum.symbol("a"), Datum.symbol("b")), tokens.get(0).value());
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testMalformedEscapedDatum() {
        System.out.println("--- Running test: testMalformedEscapedDatum ---");
        LexicalException e = assertThrows(LexicalException.class, () -> tokenize("x \\(a b"));
        assertEquals(3, e.getColumn());
        System.out.println("Result: Test PASSED.\n");
    }
}
