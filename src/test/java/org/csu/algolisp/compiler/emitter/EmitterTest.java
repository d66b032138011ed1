package org.csu.algolisp.compiler.emitter;

import org.csu.algolisp.common.model.Datum;
import org.csu.algolisp.common.model.DatumPrinter;
import org.csu.algolisp.compiler.layout.LayoutEngine;
import org.csu.algolisp.compiler.lexer.Lexer;
import org.csu.algolisp.compiler.parser.Parser;
import org.csu.algolisp.compiler.parser.ast.AstNode;
import org.csu.algolisp.engine.GuardPolicy;
import org.csu.algolisp.engine.SpliceStyle;
import org.csu.algolisp.reader.StandardEscapeDelegate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: 代码生成器测试
 * 每个用例: 源码 -> 词法 -> 布局 -> 语法 -> 生成, 比较打印出的规范形式
 */
public class EmitterTest {

    private String emit(String source) {
        return emit(source, new Emitter());
    }

    private String emit(String source, Emitter emitter) {
        List<AstNode> ast = new Parser(new LayoutEngine(new Lexer(source, new StandardEscapeDelegate()).tokenize())).parse();
        List<Datum> forms = emitter.emit(ast);
        assertEquals(1, forms.size());
        String printed = DatumPrinter.print(forms.get(0));
        System.out.println(source + "\n  =>  " + printed);
        return printed;
    }

    @Test
    void testOperators() {
        System.out.println("--- Running test: testOperators ---");
        assertEquals("(+ 1 (* 2 3))", emit("1 + 2 * 3"));
        assertEquals("(remainder (quotient a b) c)", emit("a quo b rem c"));
        assertEquals("(floor-quotient a b)", emit("a div b"));
        assertEquals("(modulo a b)", emit("a mod b"));
        assertEquals("(or (and (not a) b) c)", emit("not a and b or c"));
        assertEquals("(cons x (append xs ys))", emit("x : xs @ ys"));
        assertEquals("(equal? a b)", emit("a == b"));
        assertEquals("(= a b)", emit("a = b"));
        assertEquals("(>= (/ a b) 1)", emit("a / b >= 1"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testLiteralsAndNames() {
        System.out.println("--- Running test: testLiteralsAndNames ---");
        assertEquals("'red", emit("RED"));
        assertEquals("null?", emit("is_null"));
        assertEquals("3+4i", emit("3+4i"));
        // 无符号虚数补上 +
        assertEquals("(+ x +2i)", emit("x+2i"));
        assertEquals("(- i)", emit("-i"));
        assertEquals("(+ i)", emit("+i"));
        assertEquals("-5", emit("-5"));
        assertEquals("1/2", emit("1/2"));
        assertEquals("#\\a", emit("'a'"));
        assertEquals("\"hi\\n\"", emit("\"hi\\n\""));
        assertEquals("#t", emit("true"));
        assertEquals("#x1F", emit("#x1F"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEscapedDatumIsEmbeddedVerbatim() {
        System.out.println("--- Running test: testEscapedDatumIsEmbeddedVerbatim ---");
        assertEquals("'(1 2)", emit("\\'(1 2)"));
        assertEquals("(f #(1 2) (a . b))", emit("f(\\#(1 2), \\(a . b))"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testCallsValuesAndConstructors() {
        System.out.println("--- Running test: testCallsValuesAndConstructors ---");
        assertEquals("((f x) y)", emit("f(x)(y)"));
        assertEquals("(apply f a r)", emit("f(a, @r)"));
        assertEquals("(values a b)", emit("(a, b)"));
        assertEquals("(apply values a r)", emit("(a, @r)"));
        assertEquals("(list 1 2)", emit("[1, 2]"));
        assertEquals("'()", emit("[]"));
        assertEquals("(apply list a b rest)", emit("[a, b, @rest]"));
        assertEquals("(apply vector a b rest)", emit("#[a, b, @rest]"));
        assertEquals("(vector)", emit("#[]"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testConsStarSpliceStyle() {
        System.out.println("--- Running test: testConsStarSpliceStyle ---");
        Emitter emitter = new Emitter(SpliceStyle.CONS_STAR, GuardPolicy.RERAISE);
        assertEquals("(cons* a b rest)", emit("[a, b, @rest]", emitter));
        assertEquals("(list->vector (cons* a b rest))", emit("#[a, b, @rest]", emitter));
        // 没有展开项时两种风格一致
        assertEquals("(list a b)", emit("[a, b]", emitter));
        // 函数调用不受影响
        assertEquals("(apply f a r)", emit("f(a, @r)", emitter));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testFunctions() {
        System.out.println("--- Running test: testFunctions ---");
        assertEquals("(lambda (x) (+ x 1))", emit("fn x -> x + 1"));
        assertEquals("(lambda args args)", emit("fn (@args) -> args"));
        assertEquals("(lambda (a . r) r)", emit("fn (a, @r) -> r"));
        assertEquals("(case-lambda (() 0) ((x) x) ((x . r) r))",
                emit("fn of\n  () -> 0\n  (x) -> x\n  (x, @r) -> r"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testConditionals() {
        System.out.println("--- Running test: testConditionals ---");
        assertEquals("(if (< x 0) (- x) x)", emit("if x < 0 then -x else x"));
        assertEquals("(cond ((< n 0) -1) ((equal? n 0) 0) (else 1))",
                emit("cond\n  n < 0 -> -1\n  n == 0 -> 0\n  1"));
        assertEquals("(cond ((assv k al) => cdr) ((lookup k)) (else #f))",
                emit("cond\n  assv(k, al) -> . cdr\n  lookup(k) -> .\n  false"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testCase() {
        System.out.println("--- Running test: testCase ---");
        assertEquals("(case c ((red) 1) ((green blue) 2) (else => f))",
                emit("case c of\n  RED -> 1\n  GREEN, BLUE -> 2\n  -> . f"));
        assertEquals("(case c ((1) => f) (else x))", emit("case c of 1 -> . f | x"));
        assertEquals("(case c ((#\\a \"s\") 1))", emit("case c of 'a', \"s\" -> 1"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testDoBlocks() {
        System.out.println("--- Running test: testDoBlocks ---");
        assertEquals("1", emit("do 1"));
        assertEquals("(begin (display 1) 2)", emit("do\n  display(1)\n  2"));
        assertEquals("(let () (define y 2) (display y) y)", emit("do\n  val y = 2\n  display(y)\n  y"));
        assertEquals("(begin (f) (g))", emit("{ f(); g() }"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testLetFamily() {
        System.out.println("--- Running test: testLetFamily ---");
        assertEquals("(let ((x 1) (y 2)) (+ x y))", emit("let val x = 1, y = 2 in x + y"));
        assertEquals("(let ((sq (lambda (n) (* n n)))) (sq 3))", emit("let val sq(n) = n * n in sq(3)"));
        assertEquals("(let-values (((q r) (floor-div 7 2)) ((s) 1)) q)",
                emit("let val (q, r) = floor_div(7, 2), s = 1 in q"));
        assertEquals("(let loop ((i 0)) (loop (+ i 1)))", emit("let loop(i = 0) in loop(i + 1)"));
        assertEquals("(parameterize ((radix 16)) (show n))", emit("let param radix = 16 in show(n)"));
        assertEquals("(letrec ((f (lambda (n) (f n)))) (f 1))", emit("letrec val f(n) = f(n) in f(1)"));
        assertEquals("(let-syntax ((m (syntax-rules () ((m) 1)))) (m))",
                emit("let syntax m = rules () of m() -> 1 in m()"));
        assertEquals("(letrec-syntax ((m (syntax-rules () ((m) 1)))) (m))",
                emit("letrec syntax m = rules () of m() -> 1 in m()"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testFor() {
        System.out.println("--- Running test: testFor ---");
        assertEquals("(do ((i 0 (+ i 1)) (acc 1 (* acc 2))) ((equal? i 5) acc) (display i))",
                emit("for i = 0 then i + 1, acc = 1 then acc * 2 until i == 5 -> acc do display(i)"));
        assertEquals("(do ((i 0 (+ i 1)) (v (make-vector 3))) ((equal? i 3)) (vector-set! v i i) (display v))",
                emit("for i = 0 then i + 1, v = make_vector(3) until i == 3 do\n  vector_set(v, i, i)\n  display(v)"));
        // 循环体中的定义需要 let () 作用域
        assertEquals("(do ((i 0 (+ i 1))) ((equal? i 3)) (let () (define sq (* i i)) (display sq)))",
                emit("for i = 0 then i + 1 until i == 3 do\n  val sq = i * i\n  display(sq)"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testGuard() {
        System.out.println("--- Running test: testGuard ---");
        assertEquals("(guard (e ((string? e) e) (else (raise-continuable e))) (risky))",
                emit("guard e of is_string(e) -> e do risky()"));
        assertEquals("(guard (e ((error? e) => error-object-message) (else (handle e))) (risky))",
                emit("guard e of is_error(e) -> . error_object_message | -> . handle do risky()"));
        assertEquals("(guard (e (#t 0)) (risky))", emit("guard e of true -> 0 do risky()"));
        assertEquals("(guard (e ((string? e)) (else (raise-continuable e))) (risky))",
                emit("guard e of is_string(e) -> . do risky()"));
        assertEquals("(if x (cond (a)) 0)", emit("if x then cond a -> . else 0"));
        assertEquals("(f (cond (a)) 1)", emit("f(cond a -> ., 1)"));
        // REQUIRE_CATCH_ALL 策略下语法分析阶段已经保证有兜底子句, 生成器不再追加
        Emitter strict = new Emitter(SpliceStyle.APPLY, GuardPolicy.REQUIRE_CATCH_ALL);
        assertEquals("(guard (e (#t 0)) (risky))", emit("guard e of true -> 0 do risky()", strict));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testDefinitions() {
        System.out.println("--- Running test: testDefinitions ---");
        assertEquals("(define x (+ 1 (* 2 3)))", emit("val x = 1 + 2 * 3"));
        assertEquals("(define f (lambda (x y) (* x y)))", emit("val f(x, y) = x * y"));
        assertEquals("(define-values (q r) (floor-div 7 2))", emit("val (q, r) = floor_div(7, 2)"));
        assertEquals("(define-syntax swap (syntax-rules () ((swap a b) (list b a))))",
                emit("syntax swap = rules () of swap(a, b) -> [b, a]"));
        assertEquals("(define-syntax my-or (syntax-rules (otherwise) ((my-or) #f) ((my-or e ...) (if e #t #f))))",
                emit("syntax my_or = rules (otherwise) of\n  my_or() -> false\n  my_or(e, ...) -> if e then true else false"));
        assertEquals("(define-syntax my-if (syntax-rules (else) ((my-if c a else b) (if c a b))))",
                emit("syntax my_if = rules (else) of my_if(c, a, \\else, b) -> if c then a else b"));
        assertEquals("(define-syntax second (syntax-rules () ((second _ x) x)))",
                emit("syntax second = rules () of second(_, x) -> x"));
        assertEquals("(define-record-type point (make-point x y) point? (x point-x) (y point-y set-point-y!))",
                emit("record point = make_point(x, y), is_point of\n  x -> point_x\n  y -> point_y, set_point_y"));
        assertEquals("(include \"a.scm\" \"b.scm\")", emit("include \"a.scm\", \"b.scm\""));
        assertEquals("(include-ci \"c.scm\")", emit("include_ci \"c.scm\""));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testImports() {
        System.out.println("--- Running test: testImports ---");
        assertEquals("(import (prefix (only (scheme base) car cdr) s-) (srfi 1))",
                emit("import scheme.base exposing (car, cdr) qualifying s, srfi.1"));
        assertEquals("(import (except (rename (scheme base) (car first)) cdr))",
                emit("import scheme.base renaming (car as first) hiding (cdr)"));
        assertEquals("(import (srfi 1 2))", emit("import srfi.1.2"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testLibrary() {
        System.out.println("--- Running test: testLibrary ---");
        assertEquals("(define-library (my lib) (export (rename f g) h) (import (scheme base)) "
                        + "(begin (define f (lambda (x) x)) (define h 1)))",
                emit("library my.lib with\n  export f as g, h\n  import scheme.base\n  val f(x) = x\n  val h = 1"));
        assertEquals("(define-library (a) (begin (define x 1)) (include \"b.scm\") (begin (define y 2)))",
                emit("library a with\n  val x = 1\n  include \"b.scm\"\n  val y = 2"));
        System.out.println("Result: Test PASSED.\n");
    }
}
