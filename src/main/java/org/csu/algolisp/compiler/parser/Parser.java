package org.csu.algolisp.compiler.parser;

import org.csu.algolisp.common.exception.NameException;
import org.csu.algolisp.common.exception.ParseException;
import org.csu.algolisp.common.model.Datum;
import org.csu.algolisp.common.model.NumberDatum;
import org.csu.algolisp.compiler.layout.LayoutContext;
import org.csu.algolisp.compiler.layout.LayoutEngine;
import org.csu.algolisp.compiler.lexer.Token;
import org.csu.algolisp.compiler.lexer.TokenType;
import org.csu.algolisp.compiler.parser.ast.AstNode;
import org.csu.algolisp.compiler.parser.ast.DefinitionNode;
import org.csu.algolisp.compiler.parser.ast.ExpressionNode;
import org.csu.algolisp.compiler.parser.ast.definition.*;
import org.csu.algolisp.compiler.parser.ast.expression.EscapedDatumNode;
import org.csu.algolisp.compiler.parser.ast.expression.LiteralNode;
import org.csu.algolisp.compiler.parser.ast.expression.SymbolicConstantNode;
import org.csu.algolisp.compiler.parser.ast.form.*;
import org.csu.algolisp.engine.GuardPolicy;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * @author hidyouth
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)。Keyword-headed forms, blocks and
 * definitions live here; operator expressions are handled by {@link ExpressionParser}.
 */
public class Parser extends ExpressionParser {

    private static final Pattern LIBRARY_DECIMAL = Pattern.compile("([0-9]+)\\.([0-9]+)");

    private static final Set<TokenType> CLAUSE_FOLLOWERS = Set.of(
            TokenType.BAR, TokenType.SEMICOLON, TokenType.COMMA, TokenType.ARROW,
            TokenType.RBRACE, TokenType.RPAREN, TokenType.RBRACKET, TokenType.VIRTUAL_CLOSE,
            TokenType.DO, TokenType.THEN, TokenType.ELSE, TokenType.IN, TokenType.UNTIL,
            TokenType.OF, TokenType.EOF
    );

    private final GuardPolicy guardPolicy;

    // 条目出现的位置, decides which definitions are allowed
    private enum Scope {
        TOP,
        LIBRARY,
        BLOCK
    }

    private record Entry(AstNode node, Token start) {
    }

    public Parser(LayoutEngine layout) {
        this(layout, GuardPolicy.RERAISE);
    }

    public Parser(LayoutEngine layout, GuardPolicy guardPolicy) {
        super(layout);
        this.guardPolicy = guardPolicy;
    }

    /**
     * Parses a whole translation unit.
     * @return 顶层条目列表, empty for a unit without entries
     */
    public List<AstNode> parse() {
        List<AstNode> entries = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.SEMICOLON)) {
                continue;
            }
            entries.add(parseEntry(Scope.TOP));
            if (!isAtEnd()) {
                consume(TokenType.SEMICOLON, "';' or a new line between top-level entries");
            }
        }
        return entries;
    }

    private AstNode parseEntry(Scope scope) {
        Token start = peek();
        switch (start.type()) {
            case VAL:
                advance();
                return new ValDefinitionNode(parseValBinding(true));
            case SYNTAX:
                return parseSyntaxDefinition();
            case RECORD:
                return parseRecordDefinition();
            case INCLUDE:
            case INCLUDE_CI:
                requireScope(scope != Scope.BLOCK, start, "'include' is only allowed at top level or in a library");
                return parseInclude();
            case IMPORT:
                requireScope(scope != Scope.BLOCK, start, "'import' is only allowed at top level or in a library");
                return parseImport();
            case LIBRARY:
                requireScope(scope == Scope.TOP, start, "'library' is only allowed at top level");
                return parseLibrary();
            case EXPORT:
                requireScope(scope == Scope.LIBRARY, start, "'export' is only allowed in a library body");
                return parseExport();
            default:
                return parseExpression();
        }
    }

    private void requireScope(boolean allowed, Token token, String reason) {
        if (!allowed) {
            throw ParseException.because(token, reason);
        }
    }

    // --- 关键字形式 ---

    @Override
    protected ExpressionNode parseKeywordForm() {
        switch (peek().type()) {
            case FN:
                return parseFunction();
            case IF:
                return parseIf();
            case COND:
                return parseCond();
            case CASE:
                return parseCase();
            case DO:
                advance();
                return parseDoBody(true, "do block");
            case LET:
                return parseLet();
            case LETREC:
                return parseLetrec();
            case FOR:
                return parseFor();
            case GUARD:
                return parseGuard();
            default:
                return null;
        }
    }

    @Override
    protected ExpressionNode parseBraceBlock() {
        List<Entry> entries = parseDelimited(TokenType.SEMICOLON, "block", () -> blockEntry());
        return buildDoNode(entries, true);
    }

    private ExpressionNode parseFunction() {
        consume(TokenType.FN, "'fn'");
        if (match(TokenType.OF)) {
            List<LambdaNode> clauses = parseLayoutBlock(LayoutContext.Kind.ALTERNATIVE, "function clause list", () -> {
                FormalsNode formals = parseFormals();
                consume(TokenType.ARROW, "'->' after the parameters");
                return new LambdaNode(formals, parseExpression());
            });
            return new CaseLambdaNode(clauses);
        }
        FormalsNode formals = parseFormals();
        consume(TokenType.ARROW, "'->' after the parameters");
        return new LambdaNode(formals, parseExpression());
    }

    private IfNode parseIf() {
        consume(TokenType.IF, "'if'");
        ExpressionNode test = parseExpression();
        consumeContinuation(TokenType.THEN, "'then' after the condition");
        ExpressionNode consequent = parseExpression();
        consumeContinuation(TokenType.ELSE, "'else' branch");
        ExpressionNode alternative = parseExpression();
        return new IfNode(test, consequent, alternative);
    }

    private CondNode parseCond() {
        consume(TokenType.COND, "'cond'");
        List<ClauseNode> clauses = parseLayoutBlock(LayoutContext.Kind.ALTERNATIVE, "cond clause list", this::parseClause);
        for (int i = 0; i < clauses.size(); i++) {
            ClauseNode clause = clauses.get(i);
            if (clause.kind() == ClauseKind.ELSE_RECEIVER) {
                throw ParseException.because(clause.token(), "A bare '-> . f' clause is only allowed in case and guard");
            }
            if (clause.kind() == ClauseKind.ELSE && i != clauses.size() - 1) {
                throw ParseException.because(clause.token(), "A clause without '->' is the else clause and must be last");
            }
        }
        return new CondNode(clauses);
    }

    private CaseNode parseCase() {
        consume(TokenType.CASE, "'case'");
        ExpressionNode subject = parseExpression();
        consume(TokenType.OF, "'of' after the case subject");
        List<CaseClauseNode> clauses = parseLayoutBlock(LayoutContext.Kind.ALTERNATIVE, "case clause list", this::parseCaseClause);
        for (int i = 0; i < clauses.size() - 1; i++) {
            CaseClauseNode clause = clauses.get(i);
            if (clause.kind() == ClauseKind.ELSE || clause.kind() == ClauseKind.ELSE_RECEIVER) {
                throw ParseException.because(clause.token(), "The else clause of a case must be last");
            }
        }
        return new CaseNode(subject, clauses);
    }

    private ClauseNode parseClause() {
        Token start = peek();
        if (match(TokenType.ARROW)) {
            consume(TokenType.DOT, "'.' after a bare '->'");
            return new ClauseNode(null, ClauseKind.ELSE_RECEIVER, parseExpression(), start);
        }
        ExpressionNode test = parseExpression();
        if (!match(TokenType.ARROW)) {
            return new ClauseNode(null, ClauseKind.ELSE, test, start);
        }
        if (match(TokenType.DOT)) {
            if (isClauseEnd()) {
                return new ClauseNode(test, ClauseKind.TEST_ONLY, null, start);
            }
            return new ClauseNode(test, ClauseKind.RECEIVER, parseExpression(), start);
        }
        return new ClauseNode(test, ClauseKind.VALUE, parseExpression(), start);
    }

    private CaseClauseNode parseCaseClause() {
        Token start = peek();
        if (match(TokenType.ARROW)) {
            consume(TokenType.DOT, "'.' after a bare '->'");
            return new CaseClauseNode(List.of(), ClauseKind.ELSE_RECEIVER, parseExpression(), start);
        }
        ExpressionNode first = parseExpression();
        if (!check(TokenType.COMMA) && !check(TokenType.ARROW)) {
            return new CaseClauseNode(List.of(), ClauseKind.ELSE, first, start);
        }
        List<Datum> patterns = new ArrayList<>();
        patterns.add(toPattern(first, start));
        while (match(TokenType.COMMA)) {
            Token patternStart = peek();
            patterns.add(toPattern(parseExpression(), patternStart));
        }
        consume(TokenType.ARROW, "'->' after the case patterns");
        if (match(TokenType.DOT)) {
            return new CaseClauseNode(patterns, ClauseKind.RECEIVER, parseExpression(), start);
        }
        return new CaseClauseNode(patterns, ClauseKind.VALUE, parseExpression(), start);
    }

    private Datum toPattern(ExpressionNode pattern, Token start) {
        if (pattern instanceof LiteralNode literal) {
            return literal.toDatum();
        }
        if (pattern instanceof SymbolicConstantNode constant) {
            return Datum.symbol(constant.name());
        }
        if (pattern instanceof EscapedDatumNode escaped) {
            return escaped.datum();
        }
        throw ParseException.because(start, "A case pattern must be a literal, a constant or an escaped datum");
    }

    // `test -> .` 之后不能开始接收者表达式的 Token, 包括外层结构的关键字
    private boolean isClauseEnd() {
        return CLAUSE_FOLLOWERS.contains(peek().type());
    }

    private LetNode parseLet() {
        consume(TokenType.LET, "'let'");
        LetKind kind;
        String name = null;
        List<BindingNode> bindings;
        if (match(TokenType.VAL)) {
            kind = LetKind.LET;
            bindings = parseBindings(() -> parseValBinding(true));
        } else if (match(TokenType.SYNTAX)) {
            kind = LetKind.LET_SYNTAX;
            bindings = parseBindings(this::parseSyntaxBinding);
        } else if (checkContextual("param") && layout.peek(1).type() == TokenType.IDENTIFIER) {
            advance();
            kind = LetKind.PARAMETERIZE;
            bindings = parseBindings(this::parseSimpleBinding);
        } else if (check(TokenType.IDENTIFIER)) {
            kind = LetKind.NAMED_LET;
            name = advance().name();
            consume(TokenType.LPAREN, "'(' after the loop name");
            bindings = new ArrayList<>();
            if (!check(TokenType.RPAREN)) {
                bindings = parseBindings(this::parseSimpleBinding);
            }
            consume(TokenType.RPAREN, "')' to close the loop bindings");
        } else if (peek().type().isKeyword()) {
            throw new NameException(peek());
        } else {
            throw new ParseException(peek(), "'val', 'syntax', 'param' or a loop name after 'let'");
        }
        consumeContinuation(TokenType.IN, "'in' after the bindings");
        return new LetNode(kind, name, bindings, parseExpression());
    }

    private LetNode parseLetrec() {
        consume(TokenType.LETREC, "'letrec'");
        LetKind kind;
        List<BindingNode> bindings;
        if (match(TokenType.VAL)) {
            kind = LetKind.LETREC;
            bindings = parseBindings(() -> parseValBinding(false));
        } else if (match(TokenType.SYNTAX)) {
            kind = LetKind.LETREC_SYNTAX;
            bindings = parseBindings(this::parseSyntaxBinding);
        } else {
            throw new ParseException(peek(), "'val' or 'syntax' after 'letrec'");
        }
        consumeContinuation(TokenType.IN, "'in' after the bindings");
        return new LetNode(kind, null, bindings, parseExpression());
    }

    private ForNode parseFor() {
        consume(TokenType.FOR, "'for'");
        List<SteppedBindingNode> stepped = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        do {
            Token name = consumeIdentifier("a loop variable");
            if (!seen.add(name.name())) {
                throw ParseException.because(name, "Duplicate loop variable '" + name.lexeme() + "'");
            }
            consume(TokenType.EQUAL, "'=' after the loop variable");
            ExpressionNode init = parseExpression();
            ExpressionNode step = match(TokenType.THEN) ? parseExpression() : null;
            stepped.add(new SteppedBindingNode(name.name(), init, step));
        } while (match(TokenType.COMMA));
        consumeContinuation(TokenType.UNTIL, "'until' after the loop variables");
        ExpressionNode until = parseExpression();
        ExpressionNode result = match(TokenType.ARROW) ? parseExpression() : null;
        consumeContinuation(TokenType.DO, "'do' before the loop body");
        DoNode body = parseDoBody(false, "loop body");
        return new ForNode(stepped, until, result, body);
    }

    private GuardNode parseGuard() {
        Token guardToken = consume(TokenType.GUARD, "'guard'");
        Token variable = consumeIdentifier("the condition variable after 'guard'");
        consume(TokenType.OF, "'of' after the condition variable");
        layout.openLayout(LayoutContext.Kind.ALTERNATIVE);
        List<ClauseNode> clauses = parseDelimited(TokenType.BAR, "guard clause list", this::parseClause, TokenType.DO);
        for (int i = 0; i < clauses.size(); i++) {
            ClauseNode clause = clauses.get(i);
            if (clause.kind() == ClauseKind.ELSE) {
                throw ParseException.because(clause.token(), "A guard clause needs a test; write '-> . handler' to catch everything");
            }
            if (clause.kind() == ClauseKind.ELSE_RECEIVER && i != clauses.size() - 1) {
                throw ParseException.because(clause.token(), "A bare '-> . f' clause must be the last guard clause");
            }
        }
        consumeContinuation(TokenType.DO, "'do' before the guarded body");
        DoNode body = parseDoBody(true, "guard body");
        GuardNode guard = new GuardNode(variable.name(), clauses, body, guardToken);
        if (guardPolicy == GuardPolicy.REQUIRE_CATCH_ALL && !guard.hasCatchAll()) {
            throw ParseException.because(guardToken, "This guard has no catch-all clause; end it with '-> . handler' or 'true -> ...'");
        }
        return guard;
    }

    // --- 代码块 ---

    private DoNode parseDoBody(boolean requireTail, String what) {
        List<Entry> entries = parseLayoutBlock(LayoutContext.Kind.BLOCK, what, this::blockEntry);
        return buildDoNode(entries, requireTail);
    }

    private Entry blockEntry() {
        Token start = peek();
        return new Entry(parseEntry(Scope.BLOCK), start);
    }

    private DoNode buildDoNode(List<Entry> entries, boolean requireTail) {
        List<DefinitionNode> definitions = new ArrayList<>();
        List<ExpressionNode> expressions = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.node() instanceof DefinitionNode definition) {
                if (!expressions.isEmpty()) {
                    throw ParseException.because(entry.start(), "Definitions must come before the expressions of a block");
                }
                definitions.add(definition);
            } else {
                expressions.add((ExpressionNode) entry.node());
            }
        }
        Token last = entries.get(entries.size() - 1).start();
        if (expressions.isEmpty()) {
            throw ParseException.because(last, requireTail
                    ? "The last entry of a block must be an expression"
                    : "A loop body needs at least one command");
        }
        if (!requireTail) {
            return new DoNode(definitions, expressions, null);
        }
        ExpressionNode tail = expressions.remove(expressions.size() - 1);
        return new DoNode(definitions, expressions, tail);
    }

    /**
     * Opens a layout block right after its trigger and parses its entries.
     */
    private <T> List<T> parseLayoutBlock(LayoutContext.Kind kind, String what, Supplier<T> entry) {
        layout.openLayout(kind);
        TokenType separator = kind == LayoutContext.Kind.ALTERNATIVE ? TokenType.BAR : TokenType.SEMICOLON;
        return parseDelimited(separator, what, entry);
    }

    private <T> List<T> parseDelimited(TokenType separator, String what, Supplier<T> entry) {
        return parseDelimited(separator, what, entry, null);
    }

    /**
     * @param terminator keyword that ends an implicit block when it starts a line at the
     *                   block's own column, or null
     */
    private <T> List<T> parseDelimited(TokenType separator, String what, Supplier<T> entry, TokenType terminator) {
        Token open;
        TokenType closer;
        if (check(TokenType.LBRACE)) {
            open = advance();
            closer = TokenType.RBRACE;
        } else {
            open = consume(TokenType.VIRTUAL_OPEN, "'{' or an indented " + what);
            closer = TokenType.VIRTUAL_CLOSE;
        }
        String separatorText = separator == TokenType.BAR ? "'|'" : "';'";
        List<T> items = new ArrayList<>();
        while (true) {
            while (match(separator)) {
                // 跳过空条目
            }
            if (check(closer)) {
                break;
            }
            items.add(entry.get());
            if (closer == TokenType.VIRTUAL_CLOSE) {
                if (terminator != null && check(separator) && peek().virtual()
                        && layout.peek(1).type() == terminator) {
                    layout.closeLayout();
                } else if (!check(separator) && !check(closer)) {
                    // 不能继续当前块的 Token 结束隐式块, e.g. the else of an enclosing if
                    layout.closeLayout();
                }
            }
            if (check(closer)) {
                break;
            }
            consume(separator, separatorText + " or the end of the " + what);
        }
        advance();
        if (items.isEmpty()) {
            throw ParseException.because(open, "Empty " + what);
        }
        return items;
    }

    // --- 参数与绑定 ---

    private FormalsNode parseFormals() {
        if (check(TokenType.LPAREN)) {
            return parseFormalsList();
        }
        Token name = consumeIdentifier("a parameter name or '('");
        return FormalsNode.single(name.name(), name);
    }

    private FormalsNode parseFormalsList() {
        Token open = consume(TokenType.LPAREN, "'(' to start a parameter list");
        List<String> names = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String rest = null;
        if (!check(TokenType.RPAREN)) {
            do {
                if (match(TokenType.AT)) {
                    Token restName = consumeIdentifier("a rest parameter name after '@'");
                    checkDuplicate(seen, restName);
                    rest = restName.name();
                    if (!check(TokenType.RPAREN)) {
                        throw ParseException.because(peek(), "The rest parameter '@" + restName.lexeme() + "' must be last");
                    }
                    break;
                }
                Token name = consumeIdentifier("a parameter name");
                checkDuplicate(seen, name);
                names.add(name.name());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "')' to close the parameter list");
        return new FormalsNode(names, rest, false, open);
    }

    private void checkDuplicate(Set<String> seen, Token name) {
        if (!seen.add(name.name())) {
            throw ParseException.because(name, "Duplicate parameter '" + name.lexeme() + "'");
        }
    }

    private List<BindingNode> parseBindings(Supplier<BindingNode> binding) {
        List<BindingNode> bindings = new ArrayList<>();
        do {
            bindings.add(binding.get());
        } while (match(TokenType.COMMA));
        return bindings;
    }

    private BindingNode parseValBinding(boolean allowDestructuring) {
        Token start = peek();
        if (check(TokenType.LPAREN)) {
            if (!allowDestructuring) {
                throw ParseException.because(start, "Destructuring bindings are not allowed in letrec");
            }
            FormalsNode target = parseFormalsList();
            consume(TokenType.EQUAL, "'=' after the binding pattern");
            return new BindingNode(target, null, parseExpression(), start);
        }
        Token name = consumeIdentifier("a name to bind");
        FormalsNode parameters = check(TokenType.LPAREN) ? parseFormalsList() : null;
        consume(TokenType.EQUAL, "'=' after '" + name.lexeme() + "'");
        return new BindingNode(FormalsNode.single(name.name(), name), parameters, parseExpression(), start);
    }

    private BindingNode parseSimpleBinding() {
        Token name = consumeIdentifier("a name to bind");
        consume(TokenType.EQUAL, "'=' after '" + name.lexeme() + "'");
        return new BindingNode(FormalsNode.single(name.name(), name), null, parseExpression(), name);
    }

    private BindingNode parseSyntaxBinding() {
        Token name = consumeIdentifier("a keyword name to bind");
        consume(TokenType.EQUAL, "'=' after '" + name.lexeme() + "'");
        return new BindingNode(FormalsNode.single(name.name(), name), null, parseTransformer(), name);
    }

    // --- 定义 ---

    private SyntaxDefinitionNode parseSyntaxDefinition() {
        consume(TokenType.SYNTAX, "'syntax'");
        Token name = consumeIdentifier("a keyword name after 'syntax'");
        consume(TokenType.EQUAL, "'=' after '" + name.lexeme() + "'");
        return new SyntaxDefinitionNode(name.name(), parseTransformer());
    }

    private ExpressionNode parseTransformer() {
        if (!match(TokenType.RULES)) {
            return parseExpression();
        }
        consume(TokenType.LPAREN, "'(' after 'rules'");
        List<String> literals = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                // 保留字也可以作为字面量, 例如 rules(else)
                if (peek().type().isKeyword()) {
                    literals.add(advance().lexeme());
                } else {
                    literals.add(consumeIdentifier("a literal name").name());
                }
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "')' to close the literal list");
        consume(TokenType.OF, "'of' before the rules");
        List<RuleNode> rules = parseLayoutBlock(LayoutContext.Kind.ALTERNATIVE, "rule list", () -> {
            ExpressionNode pattern = parseExpression();
            consume(TokenType.ARROW, "'->' between pattern and template");
            return new RuleNode(pattern, parseExpression());
        });
        return new SyntaxRulesNode(literals, rules);
    }

    private RecordDefinitionNode parseRecordDefinition() {
        consume(TokenType.RECORD, "'record'");
        Token typeName = consumeIdentifier("a record type name");
        consume(TokenType.EQUAL, "'=' after the record type name");
        Token constructor = consumeIdentifier("a constructor name");
        consume(TokenType.LPAREN, "'(' after the constructor name");
        List<Token> constructorFields = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                constructorFields.add(consumeIdentifier("a field name"));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "')' to close the constructor fields");
        consume(TokenType.COMMA, "',' before the predicate name");
        Token predicate = consumeIdentifier("a predicate name");
        consume(TokenType.OF, "'of' before the field list");
        Set<String> declared = new HashSet<>();
        List<FieldSpecNode> fields = parseLayoutBlock(LayoutContext.Kind.ALTERNATIVE, "field list", () -> {
            Token field = consumeIdentifier("a field name");
            if (!declared.add(field.name())) {
                throw ParseException.because(field, "Duplicate field '" + field.lexeme() + "'");
            }
            consume(TokenType.ARROW, "'->' before the accessor name");
            String accessor = consumeIdentifier("an accessor name").name();
            String modifier = match(TokenType.COMMA) ? consumeIdentifier("a modifier name").name() : null;
            return new FieldSpecNode(field.name(), accessor, modifier);
        });
        List<String> constructorNames = new ArrayList<>();
        for (Token field : constructorFields) {
            if (!declared.contains(field.name())) {
                throw ParseException.because(field, "Constructor field '" + field.lexeme() + "' is not declared in the field list");
            }
            constructorNames.add(field.name());
        }
        return new RecordDefinitionNode(typeName.name(), constructor.name(), constructorNames, predicate.name(), fields);
    }

    private IncludeNode parseInclude() {
        boolean caseInsensitive = advance().type() == TokenType.INCLUDE_CI;
        List<String> files = new ArrayList<>();
        do {
            files.add((String) consume(TokenType.STRING, "a file name string").value());
        } while (match(TokenType.COMMA));
        return new IncludeNode(caseInsensitive, files);
    }

    private ImportNode parseImport() {
        consume(TokenType.IMPORT, "'import'");
        List<ImportSetNode> sets = new ArrayList<>();
        do {
            sets.add(parseImportSet());
        } while (match(TokenType.COMMA));
        return new ImportNode(sets);
    }

    // 修饰符从左到右逐层向外包裹
    private ImportSetNode parseImportSet() {
        ImportSetNode set = ImportSetNode.library(parseLibraryName());
        while (true) {
            if (matchContextual("exposing")) {
                set = set.exposing(parseNameList());
            } else if (matchContextual("hiding")) {
                set = set.hiding(parseNameList());
            } else if (matchContextual("renaming")) {
                consume(TokenType.LPAREN, "'(' after 'renaming'");
                List<RenamingNode> pairs = new ArrayList<>();
                do {
                    String from = consumeIdentifier("a name to rename").name();
                    if (!matchContextual("as")) {
                        throw new ParseException(peek(), "'as' in a renaming");
                    }
                    pairs.add(new RenamingNode(from, consumeIdentifier("the new name after 'as'").name()));
                } while (match(TokenType.COMMA));
                consume(TokenType.RPAREN, "')' to close the renamings");
                set = set.renaming(pairs);
            } else if (matchContextual("qualifying")) {
                set = set.qualifying(consumeIdentifier("a qualifier after 'qualifying'").name());
            } else {
                return set;
            }
        }
    }

    private List<String> parseNameList() {
        consume(TokenType.LPAREN, "'(' to start a name list");
        List<String> names = new ArrayList<>();
        do {
            names.add(consumeIdentifier("an identifier").name());
        } while (match(TokenType.COMMA));
        consume(TokenType.RPAREN, "')' to close the name list");
        return names;
    }

    private List<Datum> parseLibraryName() {
        List<Datum> segments = new ArrayList<>();
        do {
            Token segment = peek();
            if (check(TokenType.IDENTIFIER)) {
                segments.add(Datum.symbol(advance().name()));
            } else if (check(TokenType.INTEGER) && Character.isDigit(segment.lexeme().charAt(0))) {
                segments.add(new NumberDatum(advance().lexeme()));
            } else if (check(TokenType.DECIMAL) && LIBRARY_DECIMAL.matcher(segment.lexeme()).matches()) {
                // srfi.1.2 在词法上是 srfi . 1.2
                String[] parts = advance().lexeme().split("\\.");
                segments.add(new NumberDatum(parts[0]));
                segments.add(new NumberDatum(parts[1]));
            } else if (segment.type().isKeyword()) {
                throw new NameException(segment);
            } else {
                throw new ParseException(segment, "a library name segment (identifier or integer)");
            }
        } while (match(TokenType.DOT));
        return segments;
    }

    private ExportNode parseExport() {
        consume(TokenType.EXPORT, "'export'");
        List<ExportSpec> specs = new ArrayList<>();
        do {
            String name = consumeIdentifier("a name to export").name();
            String alias = matchContextual("as") ? consumeIdentifier("the exported name after 'as'").name() : null;
            specs.add(new ExportSpec(name, alias));
        } while (match(TokenType.COMMA));
        return new ExportNode(specs);
    }

    private LibraryNode parseLibrary() {
        consume(TokenType.LIBRARY, "'library'");
        List<Datum> name = parseLibraryName();
        if (!matchContextual("with")) {
            throw new ParseException(peek(), "'with' after the library name");
        }
        List<AstNode> entries = parseLayoutBlock(LayoutContext.Kind.BLOCK, "library body", () -> parseEntry(Scope.LIBRARY));
        return new LibraryNode(name, entries);
    }
}
