package org.csu.algolisp.compiler.lexer;

import org.csu.algolisp.common.exception.LexicalException;
import org.csu.algolisp.reader.StandardEscapeDelegate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 复合数字字面量的重建测试 (有符号数、分数、复数、极坐标)
 */
public class NumeralReconstructorTest {

    private List<Token> tokenize(String source) {
        List<Token> tokens = new Lexer(source, new StandardEscapeDelegate()).tokenize();
        System.out.println(source + "  =>  " + tokens.stream().map(Token::lexeme).collect(Collectors.toList()));
        return tokens;
    }

    private List<TokenType> types(String source) {
        return tokenize(source).stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    void testRectangularComplex() {
        System.out.println("--- Running test: testRectangularComplex ---");
        List<Token> tokens = tokenize("3+4i");
        assertEquals(2, tokens.size());
        assertEquals(TokenType.COMPLEX, tokens.get(0).type());
        assertEquals("3+4i", tokens.get(0).lexeme());
        assertEquals("1-2.5i", tokenize("1-2.5i").get(0).lexeme());
        assertEquals("-1+2i", tokenize("-1+2i").get(0).lexeme());
        assertEquals("1/2+3/4i", tokenize("1/2+3/4i").get(0).lexeme());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testImaginaryAfterIdentifierStaysOperator() {
        System.out.println("--- Running test: testImaginaryAfterIdentifierStaysOperator ---");
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.PLUS, TokenType.IMAGINARY, TokenType.EOF), types("x+2i"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.PLUS, TokenType.INTEGER, TokenType.EOF), types("x+2"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testBareI() {
        System.out.println("--- Running test: testBareI ---");
        assertEquals(List.of(TokenType.MINUS, TokenType.IDENTIFIER, TokenType.EOF), types("-i"));
        assertEquals(List.of(TokenType.PLUS, TokenType.IDENTIFIER, TokenType.EOF), types("+i"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.EOF), types("i"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSignedLiterals() {
        System.out.println("--- Running test: testSignedLiterals ---");
        List<Token> tokens = tokenize("[-5, +2.5, -3i]");
        assertEquals("-5", tokens.get(1).lexeme());
        assertEquals(TokenType.INTEGER, tokens.get(1).type());
        assertEquals("+2.5", tokens.get(3).lexeme());
        assertEquals(TokenType.IMAGINARY, tokens.get(5).type());
        // 前面是操作数时 - 是二元运算符
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.MINUS, TokenType.INTEGER, TokenType.EOF), types("x-5"));
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.RPAREN, TokenType.MINUS,
                TokenType.INTEGER, TokenType.EOF), types("f() -1"));
        // 中间有空格则不合并
        assertEquals(List.of(TokenType.MINUS, TokenType.INTEGER, TokenType.EOF), types("- 5"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testRationals() {
        System.out.println("--- Running test: testRationals ---");
        List<Token> tokens = tokenize("1/2");
        assertEquals(TokenType.RATIONAL, tokens.get(0).type());
        assertEquals("-1/2", tokenize("-1/2").get(0).lexeme());
        assertEquals(TokenType.IMAGINARY, tokenize("1/2i").get(0).type());
        assertEquals(List.of(TokenType.INTEGER, TokenType.SLASH, TokenType.INTEGER, TokenType.EOF), types("1 / 2"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testPolar() {
        System.out.println("--- Running test: testPolar ---");
        List<Token> tokens = tokenize("1.5@2");
        assertEquals(TokenType.COMPLEX, tokens.get(0).type());
        assertEquals("1.5@2", tokens.get(0).lexeme());
        // 标识符不参与极坐标合并, @ 仍然是 append
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.AT, TokenType.IDENTIFIER, TokenType.EOF), types("a@b"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testAmbiguousNumerals() {
        System.out.println("--- Running test: testAmbiguousNumerals ---");
        assertThrows(LexicalException.class, () -> tokenize("1/2/3"));
        assertThrows(LexicalException.class, () -> tokenize("3+4i*2"));
        assertThrows(LexicalException.class, () -> tokenize("x*3+4i"));
        assertThrows(LexicalException.class, () -> tokenize("1@2@3"));
        // 加上空格就不再歧义
        assertEquals(List.of(TokenType.COMPLEX, TokenType.STAR, TokenType.INTEGER, TokenType.EOF), types("3+4i * 2"));
        System.out.println("Result: Test PASSED.\n");
    }
}
