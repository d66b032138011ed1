package org.csu.algolisp.cli;

import org.csu.algolisp.common.exception.TranslationException;
import org.csu.algolisp.compiler.lexer.Token;
import org.csu.algolisp.compiler.parser.ast.AstNode;
import org.csu.algolisp.engine.GuardPolicy;
import org.csu.algolisp.engine.SpliceStyle;
import org.csu.algolisp.engine.TranslationResult;
import org.csu.algolisp.engine.Translator;
import org.csu.algolisp.engine.TranslatorConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 命令行入口
 *
 * Usage: TranslatorShell [--tokens] [--ast] [--splice-style=apply|cons-star]
 * [--char-hex-terminator-required] [--guard-policy=reraise|require-catch-all] [file ...]
 * Without files the unit is read from standard input.
 */
public class TranslatorShell {

    private final PrintStream out;
    private final PrintStream err;

    public TranslatorShell(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int status = new TranslatorShell(System.out, System.err).run(args, System.in);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return 0 when every unit translated, 1 when at least one failed, 2 for bad options
     */
    public int run(String[] args, InputStream stdin) {
        TranslatorConfig config = TranslatorConfig.load();
        boolean dumpTokens = false;
        boolean dumpAst = false;
        List<String> files = new ArrayList<>();
        try {
            for (String arg : args) {
                if (arg.equals("--tokens")) {
                    dumpTokens = true;
                } else if (arg.equals("--ast")) {
                    dumpAst = true;
                } else if (arg.startsWith("--splice-style=")) {
                    config.setSpliceStyle(SpliceStyle.fromText(arg.substring("--splice-style=".length())));
                } else if (arg.equals("--char-hex-terminator-required")) {
                    config.setCharHexTerminatorRequired(true);
                } else if (arg.startsWith("--guard-policy=")) {
                    config.setGuardPolicy(GuardPolicy.fromText(arg.substring("--guard-policy=".length())));
                } else if (arg.equals("--debug")) {
                    config.setDebug(true);
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unknown option: " + arg);
                } else {
                    files.add(arg);
                }
            }
        } catch (IllegalArgumentException e) {
            err.println("[Shell] " + e.getMessage());
            return 2;
        }

        Translator translator = new Translator(config);
        boolean failed = false;
        if (files.isEmpty()) {
            try {
                String source = new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
                failed = !translateUnit(translator, "<stdin>", source, dumpTokens, dumpAst);
            } catch (IOException e) {
                err.println("[Shell] Could not read standard input: " + e.getMessage());
                failed = true;
            }
        }
        for (String file : files) {
            String source;
            try {
                source = Files.readString(Path.of(file), StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println("[Shell] Could not read " + file + ": " + e.getMessage());
                failed = true;
                continue;
            }
            // 每个文件都是独立的翻译单元, 一个失败不影响后续文件
            if (!translateUnit(translator, file, source, dumpTokens, dumpAst)) {
                failed = true;
            }
        }
        return failed ? 1 : 0;
    }

    private boolean translateUnit(Translator translator, String name, String source, boolean dumpTokens, boolean dumpAst) {
        try {
            if (dumpTokens) {
                for (Token token : translator.layoutTokens(source)) {
                    out.println(token);
                }
            }
            if (dumpAst) {
                for (AstNode node : translator.parse(source)) {
                    out.println(node);
                }
            }
            TranslationResult result = translator.translate(source);
            if (!result.forms().isEmpty()) {
                out.print(result.toText());
            }
            return true;
        } catch (TranslationException e) {
            err.println(name + ": " + e.getMessage());
            return false;
        }
    }
}
