package org.csu.algolisp.compiler.layout;

import org.csu.algolisp.common.exception.LayoutException;
import org.csu.algolisp.compiler.lexer.Token;
import org.csu.algolisp.compiler.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * @author hidyouth
 * @description: 布局引擎 (off-side rule)
 *
 * Sits between the lexer and the parser and turns indentation into virtual
 * open/separator/close tokens. Raw tokens are processed lazily, one at a time, so that
 * the parser can open a block with {@link #openLayout} right after consuming a trigger.
 */
public class LayoutEngine {

    private final List<Token> raw;
    private int rawPosition = 0;
    private final Deque<LayoutContext> stack = new ArrayDeque<>();
    private final List<Token> pending = new ArrayList<>();
    // 刚刚确定参考列的Token，不再做换行处理
    private Token referenceToken;
    private Token eof;

    public LayoutEngine(List<Token> raw) {
        if (raw.isEmpty() || raw.get(raw.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token stream must end with EOF");
        }
        this.raw = raw;
    }

    public Token peek() {
        return peek(0);
    }

    /**
     * Looks {@code k} tokens ahead without consuming. Looking ahead never crosses more raw
     * tokens than needed, so at most one raw token beyond the current one is processed for k = 1.
     */
    public Token peek(int k) {
        while (pending.size() <= k && eof == null) {
            processNextRaw();
        }
        return k < pending.size() ? pending.get(k) : eof;
    }

    public Token next() {
        Token token = peek();
        if (!pending.isEmpty()) {
            pending.remove(0);
        }
        return token;
    }

    /**
     * Called by the parser immediately after it consumed a layout trigger.
     */
    public void openLayout(LayoutContext.Kind kind) {
        if (kind != LayoutContext.Kind.BLOCK && kind != LayoutContext.Kind.ALTERNATIVE) {
            throw new IllegalArgumentException("Only BLOCK and ALTERNATIVE layouts are opened by the parser");
        }
        if (!pending.isEmpty()) {
            throw new IllegalStateException("Layout opened after the parser looked past its trigger");
        }
        ensureStarted();
        Token next = eof != null ? eof : raw.get(rawPosition);
        if (next.type() == TokenType.LBRACE) {
            return;
        }
        if (next.type() == TokenType.EOF || (next.lineStart() && next.column() <= enclosingColumn())) {
            pending.add(Token.virtual(TokenType.VIRTUAL_OPEN, "{", next));
            pending.add(Token.virtual(TokenType.VIRTUAL_CLOSE, "}", next));
            return;
        }
        stack.push(new LayoutContext(kind, next.column(), next));
        pending.add(Token.virtual(TokenType.VIRTUAL_OPEN, "{", next));
        referenceToken = next;
    }

    /**
     * Closes the innermost block before the next token, which the parser cannot accept as
     * part of it. A virtual separator at the head of the queue is replaced by the close.
     */
    public void closeLayout() {
        Token head = peek();
        LayoutContext top = stack.peek();
        if (top == null || (top.kind() != LayoutContext.Kind.BLOCK && top.kind() != LayoutContext.Kind.ALTERNATIVE)) {
            throw new IllegalStateException("No implicit block is open");
        }
        stack.pop();
        if (head.virtual() && (head.type() == TokenType.SEMICOLON || head.type() == TokenType.BAR)) {
            pending.remove(0);
        }
        pending.add(0, Token.virtual(TokenType.VIRTUAL_CLOSE, "}", head));
    }

    public int depth() {
        return stack.size();
    }

    private void ensureStarted() {
        if (stack.isEmpty()) {
            Token first = raw.get(0);
            int column = first.type() == TokenType.EOF ? 1 : first.column();
            stack.push(new LayoutContext(LayoutContext.Kind.TOP, column, null));
            referenceToken = first;
        }
    }

    private void processNextRaw() {
        ensureStarted();
        Token token = raw.get(rawPosition++);

        if (token.type() == TokenType.EOF) {
            while (stack.peek().kind() == LayoutContext.Kind.BLOCK
                    || stack.peek().kind() == LayoutContext.Kind.ALTERNATIVE) {
                stack.pop();
                pending.add(Token.virtual(TokenType.VIRTUAL_CLOSE, "}", token));
            }
            pending.add(token);
            eof = token;
            return;
        }

        if (token.lineStart() && token != referenceToken) {
            handleLineStart(token);
        }
        if (token == referenceToken) {
            referenceToken = null;
        }

        switch (token.type()) {
            case LBRACE -> {
                pending.add(token);
                stack.push(new LayoutContext(LayoutContext.Kind.EXPLICIT, 0, token));
            }
            case LPAREN, LBRACKET, VECTOR_OPEN -> {
                pending.add(token);
                stack.push(new LayoutContext(LayoutContext.Kind.BRACKET, 0, token));
            }
            case RBRACE, RPAREN, RBRACKET -> {
                closeUpTo(token);
                pending.add(token);
            }
            default -> pending.add(token);
        }
    }

    private void handleLineStart(Token token) {
        int column = token.column();
        boolean popped = false;
        while (true) {
            LayoutContext top = stack.peek();
            if (!top.isImplicit()) {
                return;
            }
            int reference = top.referenceColumn();
            if (column == reference) {
                TokenType separator = top.separator();
                pending.add(Token.virtual(separator, separator == TokenType.BAR ? "|" : ";", token));
                return;
            }
            if (column > reference) {
                if (popped) {
                    throw new LayoutException(token, "Dedent to column " + column
                            + " does not align with any enclosing block (expected column " + reference + ")");
                }
                return;
            }
            if (top.kind() == LayoutContext.Kind.TOP) {
                throw new LayoutException(token, "Line is indented less than the first line of the unit (column "
                        + reference + ")");
            }
            stack.pop();
            pending.add(Token.virtual(TokenType.VIRTUAL_CLOSE, "}", token));
            popped = true;
        }
    }

    private void closeUpTo(Token closer) {
        while (true) {
            LayoutContext top = stack.peek();
            switch (top.kind()) {
                case TOP -> throw new LayoutException(closer, "'" + closer.lexeme() + "' has no matching opener");
                case BLOCK, ALTERNATIVE -> {
                    stack.pop();
                    pending.add(Token.virtual(TokenType.VIRTUAL_CLOSE, "}", closer));
                }
                default -> {
                    if (!top.closedBy(closer.type())) {
                        throw new LayoutException(closer, String.format("'%s' does not match '%s' opened at line %d, column %d",
                                closer.lexeme(), top.opener().lexeme(), top.opener().line(), top.opener().column()));
                    }
                    stack.pop();
                    return;
                }
            }
        }
    }

    private int enclosingColumn() {
        LayoutContext top = stack.peek();
        return top.isImplicit() ? top.referenceColumn() : 0;
    }
}
