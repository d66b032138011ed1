package org.csu.algolisp.engine;

import lombok.Getter;
import org.csu.algolisp.common.model.Datum;
import org.csu.algolisp.compiler.emitter.Emitter;
import org.csu.algolisp.compiler.layout.LayoutEngine;
import org.csu.algolisp.compiler.lexer.Lexer;
import org.csu.algolisp.compiler.lexer.Token;
import org.csu.algolisp.compiler.parser.Parser;
import org.csu.algolisp.compiler.parser.ast.AstNode;
import org.csu.algolisp.reader.EscapeDelegate;
import org.csu.algolisp.reader.StandardEscapeDelegate;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 翻译器门面
 * 负责串联 词法分析 -> 布局 -> 语法分析 -> 代码生成. Every call builds its own lexer,
 * layout engine and parser, so one instance can serve several threads.
 */
public class Translator {

    @Getter
    private final TranslatorConfig config;
    private final EscapeDelegate escapeDelegate;

    public Translator() {
        this(TranslatorConfig.defaults());
    }

    public Translator(TranslatorConfig config) {
        this(config, new StandardEscapeDelegate());
    }

    public Translator(TranslatorConfig config, EscapeDelegate escapeDelegate) {
        this.config = config;
        this.escapeDelegate = escapeDelegate;
    }

    /**
     * Translates one unit. The first error aborts the unit and no forms are returned.
     */
    public TranslationResult translate(String source) {
        List<AstNode> ast = parse(source);
        Emitter emitter = new Emitter(config.getSpliceStyle(), config.getGuardPolicy());
        List<Datum> forms = emitter.emit(ast);
        debug("Emitted " + forms.size() + " top-level form(s).");
        return new TranslationResult(forms);
    }

    public String translateToText(String source) {
        return translate(source).toText();
    }

    public List<Token> tokenize(String source) {
        Lexer lexer = new Lexer(source, escapeDelegate, config.isCharHexTerminatorRequired());
        List<Token> tokens = lexer.tokenize();
        debug("Scanned " + tokens.size() + " token(s).");
        return tokens;
    }

    /**
     * The token stream as the parser sees it, virtual layout tokens included. Blocks are
     * opened by the parser, so this runs a full parse alongside.
     */
    public List<Token> layoutTokens(String source) {
        List<Token> seen = new ArrayList<>();
        LayoutEngine layout = new LayoutEngine(tokenize(source)) {
            @Override
            public Token next() {
                Token token = super.next();
                seen.add(token);
                return token;
            }
        };
        new Parser(layout, config.getGuardPolicy()).parse();
        seen.add(layout.peek());
        return seen;
    }

    public List<AstNode> parse(String source) {
        LayoutEngine layout = new LayoutEngine(tokenize(source));
        Parser parser = new Parser(layout, config.getGuardPolicy());
        List<AstNode> ast = parser.parse();
        debug("Parsed " + ast.size() + " top-level entr" + (ast.size() == 1 ? "y." : "ies."));
        return ast;
    }

    private void debug(String message) {
        if (config.isDebug()) {
            System.out.println("[Translator] " + message);
        }
    }
}
