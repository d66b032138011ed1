package org.csu.algolisp.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 命令行入口测试: 退出码, 选项解析, 多文件翻译.
 */
public class TranslatorShellTest {

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;
    private TranslatorShell shell;

    @BeforeEach
    void setUp() {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
        shell = new TranslatorShell(new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
    }

    private InputStream stdin(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private String out() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testTranslatesStandardInput() {
        System.out.println("--- Running test: testTranslatesStandardInput ---");
        int status = shell.run(new String[0], stdin("val x = 1 + 2\ndisplay(x)\n"));

        assertEquals(0, status);
        assertEquals("(define x (+ 1 2))\n(display x)\n", out());
        assertEquals("", err());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUnknownOption() {
        System.out.println("--- Running test: testUnknownOption ---");
        int status = shell.run(new String[]{"--verbose"}, stdin("1"));

        assertEquals(2, status);
        assertTrue(err().contains("Unknown option: --verbose"), err());
        assertEquals("", out());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSpliceStyleOption() {
        System.out.println("--- Running test: testSpliceStyleOption ---");
        int status = shell.run(new String[]{"--splice-style=cons-star"}, stdin("[a, @rest]"));
        assertEquals(0, status);
        assertEquals("(cons* a rest)\n", out());

        int bad = shell.run(new String[]{"--splice-style=bogus"}, stdin("f(a)"));
        assertEquals(2, bad);
        assertTrue(err().startsWith("[Shell] "), err());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEachFileIsItsOwnUnit(@TempDir Path dir) throws IOException {
        System.out.println("--- Running test: testEachFileIsItsOwnUnit ---");
        Path good = dir.resolve("good.al");
        Path bad = dir.resolve("bad.al");
        Path alsoGood = dir.resolve("also_good.al");
        Files.writeString(good, "val a = 1\n");
        Files.writeString(bad, "val = 2\n");
        Files.writeString(alsoGood, "val b = [1, 2]\n");

        int status = shell.run(new String[]{good.toString(), bad.toString(), alsoGood.toString()}, stdin(""));

        assertEquals(1, status);
        assertEquals("(define a 1)\n(define b (list 1 2))\n", out());
        assertTrue(err().startsWith(bad + ": Syntax Error at line 1, column 5"), err());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        System.out.println("--- Running test: testMissingFile ---");
        Path missing = dir.resolve("nowhere.al");
        int status = shell.run(new String[]{missing.toString()}, stdin(""));

        assertEquals(1, status);
        assertTrue(err().contains("Could not read " + missing), err());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testDumpOptions() {
        System.out.println("--- Running test: testDumpOptions ---");
        int status = shell.run(new String[]{"--tokens", "--ast"}, stdin("case x of\n  RED -> 0\n"));

        assertEquals(0, status);
        String printed = out();
        assertTrue(printed.contains("VIRTUAL_OPEN"), printed);
        assertTrue(printed.contains("virtual"), printed);
        assertTrue(printed.contains("CaseNode["), printed);
        assertTrue(printed.endsWith("(case x ((red) 0))\n"), printed);
        System.out.println("Result: Test PASSED.\n");
    }
}
