package org.csu.algolisp.common.model;

import org.csu.algolisp.reader.DatumReader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hidyouth
 * @description: 规范输出格式测试
 */
public class DatumPrinterTest {

    private void assertPrints(String expected, Datum datum) {
        String actual = DatumPrinter.print(datum);
        System.out.println(actual);
        assertEquals(expected, actual);
    }

    @Test
    void testListsAndQuotes() {
        System.out.println("--- Running test: testListsAndQuotes ---");
        assertPrints("(define x 1)", Datum.list(Datum.symbol("define"), Datum.symbol("x"), new NumberDatum("1")));
        assertPrints("'red", Datum.quote(Datum.symbol("red")));
        assertPrints("'()", Datum.quote(Datum.EMPTY));
        assertPrints("(a . b)", new ListDatum(List.of(Datum.symbol("a")), Datum.symbol("b")));
        assertPrints("(lambda (a . r) r)", Datum.list(Datum.symbol("lambda"),
                new ListDatum(List.of(Datum.symbol("a")), Datum.symbol("r")), Datum.symbol("r")));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testVectorsAndBooleans() {
        System.out.println("--- Running test: testVectorsAndBooleans ---");
        assertPrints("#(1 #t)", new VectorDatum(List.of(new NumberDatum("1"), BooleanDatum.TRUE)));
        assertPrints("#u8(1 255)", new BytevectorDatum(List.of(1, 255)));
        assertPrints("#f", BooleanDatum.FALSE);
        assertThrows(IllegalArgumentException.class, () -> new BytevectorDatum(List.of(256)));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testStringsAndChars() {
        System.out.println("--- Running test: testStringsAndChars ---");
        assertPrints("\"a\\\"b\\\\c\\n\"", new StringDatum("a\"b\\c\n"));
        assertPrints("#\\a", new CharDatum('a'));
        assertPrints("#\\space", new CharDatum(' '));
        assertPrints("#\\newline", new CharDatum('\n'));
        assertPrints("#\\alarm", new CharDatum(7));
        assertPrints("#\\x1", new CharDatum(1));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSymbolsNeedingBars() {
        System.out.println("--- Running test: testSymbolsNeedingBars ---");
        assertPrints("null?", Datum.symbol("null?"));
        assertPrints("|hello world|", Datum.symbol("hello world"));
        // 看起来像数字的符号必须加竖线
        assertPrints("|1|", Datum.symbol("1"));
        assertPrints("||", Datum.symbol(""));
        assertPrints("|a\\|b|", Datum.symbol("a|b"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testPrintAll() {
        System.out.println("--- Running test: testPrintAll ---");
        assertEquals("a\n(b)\n", DatumPrinter.printAll(List.of(Datum.symbol("a"), Datum.list(Datum.symbol("b")))));
        assertEquals("", DatumPrinter.printAll(List.of()));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testPrintedFormReadsBack() {
        System.out.println("--- Running test: testPrintedFormReadsBack ---");
        Datum datum = Datum.list(Datum.symbol("f"), new StringDatum("x\ty"), new CharDatum(' '),
                Datum.symbol("odd name"), new VectorDatum(List.of(new NumberDatum("3+4i"))),
                Datum.quote(Datum.list(Datum.symbol("a"))), new ListDatum(List.of(Datum.symbol("p")), new NumberDatum("1")));
        String text = DatumPrinter.print(datum);
        System.out.println(text);
        assertEquals(datum, new DatumReader(text).read());
        System.out.println("Result: Test PASSED.\n");
    }
}
