package org.csu.algolisp.compiler.emitter;

import org.csu.algolisp.common.model.Datum;
import org.csu.algolisp.common.model.ListDatum;
import org.csu.algolisp.common.model.StringDatum;
import org.csu.algolisp.common.model.SymbolDatum;
import org.csu.algolisp.compiler.lexer.TokenType;
import org.csu.algolisp.compiler.parser.ast.AstNode;
import org.csu.algolisp.compiler.parser.ast.DefinitionNode;
import org.csu.algolisp.compiler.parser.ast.ExpressionNode;
import org.csu.algolisp.compiler.parser.ast.definition.*;
import org.csu.algolisp.compiler.parser.ast.expression.*;
import org.csu.algolisp.compiler.parser.ast.form.*;
import org.csu.algolisp.engine.GuardPolicy;
import org.csu.algolisp.engine.SpliceStyle;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * @author hidyouth
 * @description: 代码生成器
 * 负责将AST转换为规范的Scheme数据 (canonical S-expressions). The mapping is mechanical:
 * one case per node type, no analysis.
 */
public class Emitter {

    private static final Map<TokenType, String> OPERATORS = new EnumMap<>(TokenType.class);

    static {
        OPERATORS.put(TokenType.AT, "append");
        OPERATORS.put(TokenType.COLON, "cons");
        OPERATORS.put(TokenType.OR, "or");
        OPERATORS.put(TokenType.AND, "and");
        OPERATORS.put(TokenType.NOT, "not");
        OPERATORS.put(TokenType.EQUAL_EQUAL, "equal?");
        OPERATORS.put(TokenType.EQUAL, "=");
        OPERATORS.put(TokenType.LESS, "<");
        OPERATORS.put(TokenType.LESS_EQUAL, "<=");
        OPERATORS.put(TokenType.GREATER, ">");
        OPERATORS.put(TokenType.GREATER_EQUAL, ">=");
        OPERATORS.put(TokenType.PLUS, "+");
        OPERATORS.put(TokenType.MINUS, "-");
        OPERATORS.put(TokenType.STAR, "*");
        OPERATORS.put(TokenType.SLASH, "/");
        OPERATORS.put(TokenType.QUO, "quotient");
        OPERATORS.put(TokenType.REM, "remainder");
        OPERATORS.put(TokenType.DIV, "floor-quotient");
        OPERATORS.put(TokenType.MOD, "modulo");
    }

    private static final SymbolDatum ELSE = Datum.symbol("else");
    private static final SymbolDatum ARROW = Datum.symbol("=>");

    private final SpliceStyle spliceStyle;
    private final GuardPolicy guardPolicy;

    public Emitter() {
        this(SpliceStyle.APPLY, GuardPolicy.RERAISE);
    }

    public Emitter(SpliceStyle spliceStyle, GuardPolicy guardPolicy) {
        this.spliceStyle = spliceStyle;
        this.guardPolicy = guardPolicy;
    }

    public List<Datum> emit(List<AstNode> nodes) {
        List<Datum> forms = new ArrayList<>();
        for (AstNode node : nodes) {
            forms.add(emit(node));
        }
        return forms;
    }

    public Datum emit(AstNode node) {
        if (node instanceof ExpressionNode expression) {
            return emitExpression(expression);
        }
        if (node instanceof DefinitionNode definition) {
            return emitDefinition(definition);
        }
        throw new IllegalStateException("Unsupported AST node: " + node.getClass().getSimpleName());
    }

    // --- 表达式 ---

    private Datum emitExpression(ExpressionNode expr) {
        if (expr instanceof LiteralNode literal) {
            return literal.toDatum();
        }
        if (expr instanceof IdentifierNode identifier) {
            return Datum.symbol(identifier.name());
        }
        if (expr instanceof SymbolicConstantNode constant) {
            return Datum.quote(Datum.symbol(constant.name()));
        }
        if (expr instanceof EscapedDatumNode escaped) {
            return escaped.datum();
        }
        if (expr instanceof OperatorExpressionNode operation) {
            List<Datum> form = new ArrayList<>();
            form.add(Datum.symbol(OPERATORS.get(operation.operator().type())));
            operation.operands().forEach(operand -> form.add(emitExpression(operand)));
            return Datum.list(form);
        }
        if (expr instanceof ApplicationNode application) {
            return emitCall(emitExpression(application.callee()), application.arguments(), application.hasSplice());
        }
        if (expr instanceof ValuesNode values) {
            return emitCall(Datum.symbol("values"), values.expressions(), values.hasSplice());
        }
        if (expr instanceof ListConstructorNode list) {
            return emitListConstructor(list);
        }
        if (expr instanceof VectorConstructorNode vector) {
            return emitVectorConstructor(vector);
        }
        if (expr instanceof LambdaNode lambda) {
            return Datum.list(Datum.symbol("lambda"), emitFormals(lambda.formals()), emitExpression(lambda.body()));
        }
        if (expr instanceof CaseLambdaNode caseLambda) {
            List<Datum> form = new ArrayList<>();
            form.add(Datum.symbol("case-lambda"));
            for (LambdaNode clause : caseLambda.clauses()) {
                form.add(Datum.list(emitFormals(clause.formals()), emitExpression(clause.body())));
            }
            return Datum.list(form);
        }
        if (expr instanceof IfNode ifNode) {
            return Datum.list(Datum.symbol("if"), emitExpression(ifNode.test()),
                    emitExpression(ifNode.consequent()), emitExpression(ifNode.alternative()));
        }
        if (expr instanceof CondNode cond) {
            List<Datum> form = new ArrayList<>();
            form.add(Datum.symbol("cond"));
            cond.clauses().forEach(clause -> form.add(emitClause(clause, null)));
            return Datum.list(form);
        }
        if (expr instanceof CaseNode caseNode) {
            return emitCase(caseNode);
        }
        if (expr instanceof DoNode block) {
            return emitBlock(block);
        }
        if (expr instanceof LetNode let) {
            return emitLet(let);
        }
        if (expr instanceof ForNode loop) {
            return emitFor(loop);
        }
        if (expr instanceof GuardNode guard) {
            return emitGuard(guard);
        }
        if (expr instanceof SyntaxRulesNode rules) {
            List<Datum> form = new ArrayList<>();
            form.add(Datum.symbol("syntax-rules"));
            form.add(symbols(rules.literals()));
            for (RuleNode rule : rules.rules()) {
                form.add(Datum.list(emitExpression(rule.pattern()), emitExpression(rule.template())));
            }
            return Datum.list(form);
        }
        throw new IllegalStateException("Unsupported expression: " + expr.getClass().getSimpleName());
    }

    /**
     * {@code (f a b)}, or {@code (apply f a r)} when the last argument is spliced.
     */
    private Datum emitCall(Datum callee, List<ExpressionNode> arguments, boolean spliced) {
        List<Datum> form = new ArrayList<>();
        if (spliced) {
            form.add(Datum.symbol("apply"));
        }
        form.add(callee);
        arguments.forEach(argument -> form.add(emitExpression(argument)));
        return Datum.list(form);
    }

    private Datum emitListConstructor(ListConstructorNode list) {
        if (list.items().isEmpty()) {
            return Datum.quote(Datum.EMPTY);
        }
        if (list.hasSplice() && spliceStyle == SpliceStyle.CONS_STAR) {
            return emitCall(Datum.symbol("cons*"), list.items(), false);
        }
        return emitCall(Datum.symbol("list"), list.items(), list.hasSplice());
    }

    private Datum emitVectorConstructor(VectorConstructorNode vector) {
        if (vector.hasSplice() && spliceStyle == SpliceStyle.CONS_STAR) {
            return Datum.list(Datum.symbol("list->vector"), emitCall(Datum.symbol("cons*"), vector.items(), false));
        }
        return emitCall(Datum.symbol("vector"), vector.items(), vector.hasSplice());
    }

    private Datum emitFormals(FormalsNode formals) {
        List<Datum> names = new ArrayList<>();
        formals.names().forEach(name -> names.add(Datum.symbol(name)));
        if (!formals.hasRest()) {
            return Datum.list(names);
        }
        if (names.isEmpty()) {
            return Datum.symbol(formals.rest());
        }
        return new ListDatum(names, Datum.symbol(formals.rest()));
    }

    /**
     * A cond or guard clause; {@code guardVariable} is non-null inside a guard.
     */
    private Datum emitClause(ClauseNode clause, String guardVariable) {
        switch (clause.kind()) {
            case VALUE:
                return Datum.list(emitExpression(clause.test()), emitExpression(clause.result()));
            case TEST_ONLY:
                return Datum.list(emitExpression(clause.test()));
            case RECEIVER:
                return Datum.list(emitExpression(clause.test()), ARROW, emitExpression(clause.result()));
            case ELSE:
                return Datum.list(ELSE, emitExpression(clause.result()));
            case ELSE_RECEIVER:
                return Datum.list(ELSE, Datum.list(emitExpression(clause.result()), Datum.symbol(guardVariable)));
            default:
                throw new IllegalStateException("Unknown clause kind: " + clause.kind());
        }
    }

    private Datum emitCase(CaseNode caseNode) {
        List<Datum> form = new ArrayList<>();
        form.add(Datum.symbol("case"));
        form.add(emitExpression(caseNode.subject()));
        for (CaseClauseNode clause : caseNode.clauses()) {
            Datum patterns = Datum.list(clause.patterns());
            Datum result = emitExpression(clause.result());
            switch (clause.kind()) {
                case VALUE -> form.add(Datum.list(patterns, result));
                case RECEIVER -> form.add(Datum.list(patterns, ARROW, result));
                case ELSE -> form.add(Datum.list(ELSE, result));
                case ELSE_RECEIVER -> form.add(Datum.list(ELSE, ARROW, result));
                default -> throw new IllegalStateException("Clause kind not valid in case: " + clause.kind());
            }
        }
        return Datum.list(form);
    }

    /**
     * A single expression stays as it is, several become {@code (begin ...)}, and a block with
     * definitions becomes {@code (let () ...)}.
     */
    private Datum emitBlock(DoNode block) {
        if (block.definitions().isEmpty() && block.commands().isEmpty()) {
            return emitExpression(block.tail());
        }
        List<Datum> form = new ArrayList<>();
        if (block.definitions().isEmpty()) {
            form.add(Datum.symbol("begin"));
        } else {
            form.add(Datum.symbol("let"));
            form.add(Datum.EMPTY);
        }
        form.addAll(bodyForms(block));
        return Datum.list(form);
    }

    private List<Datum> bodyForms(DoNode block) {
        List<Datum> forms = new ArrayList<>();
        block.definitions().forEach(definition -> forms.add(emitDefinition(definition)));
        block.expressions().forEach(expression -> forms.add(emitExpression(expression)));
        return forms;
    }

    private Datum emitLet(LetNode let) {
        List<Datum> form = new ArrayList<>();
        Datum body = emitExpression(let.body());
        switch (let.kind()) {
            case LET -> {
                boolean values = let.hasDestructuring();
                form.add(Datum.symbol(values ? "let-values" : "let"));
                List<Datum> bindings = new ArrayList<>();
                for (BindingNode binding : let.bindings()) {
                    Datum target = values ? emitFormals(binding.target()) : Datum.symbol(binding.name());
                    bindings.add(Datum.list(target, bindingValue(binding)));
                }
                form.add(Datum.list(bindings));
            }
            case NAMED_LET -> {
                form.add(Datum.symbol("let"));
                form.add(Datum.symbol(let.name()));
                form.add(simpleBindings(let.bindings()));
            }
            case LETREC -> {
                form.add(Datum.symbol("letrec"));
                form.add(simpleBindings(let.bindings()));
            }
            case LET_SYNTAX -> {
                form.add(Datum.symbol("let-syntax"));
                form.add(simpleBindings(let.bindings()));
            }
            case LETREC_SYNTAX -> {
                form.add(Datum.symbol("letrec-syntax"));
                form.add(simpleBindings(let.bindings()));
            }
            case PARAMETERIZE -> {
                form.add(Datum.symbol("parameterize"));
                form.add(simpleBindings(let.bindings()));
            }
            default -> throw new IllegalStateException("Unknown let kind: " + let.kind());
        }
        form.add(body);
        return Datum.list(form);
    }

    private Datum simpleBindings(List<BindingNode> bindings) {
        List<Datum> result = new ArrayList<>();
        for (BindingNode binding : bindings) {
            result.add(Datum.list(Datum.symbol(binding.name()), bindingValue(binding)));
        }
        return Datum.list(result);
    }

    // 函数简写 f(x) = e 绑定为 (lambda (x) e)
    private Datum bindingValue(BindingNode binding) {
        Datum value = emitExpression(binding.value());
        if (binding.parameters() == null) {
            return value;
        }
        return Datum.list(Datum.symbol("lambda"), emitFormals(binding.parameters()), value);
    }

    private Datum emitFor(ForNode loop) {
        List<Datum> specs = new ArrayList<>();
        for (SteppedBindingNode stepped : loop.steppedBindings()) {
            List<Datum> spec = new ArrayList<>();
            spec.add(Datum.symbol(stepped.name()));
            spec.add(emitExpression(stepped.init()));
            if (stepped.step() != null) {
                spec.add(emitExpression(stepped.step()));
            }
            specs.add(Datum.list(spec));
        }
        List<Datum> exit = new ArrayList<>();
        exit.add(emitExpression(loop.until()));
        if (loop.result() != null) {
            exit.add(emitExpression(loop.result()));
        }
        List<Datum> form = new ArrayList<>();
        form.add(Datum.symbol("do"));
        form.add(Datum.list(specs));
        form.add(Datum.list(exit));
        DoNode body = loop.body();
        if (body.definitions().isEmpty()) {
            body.expressions().forEach(command -> form.add(emitExpression(command)));
        } else {
            // do 的循环体中不能直接出现定义
            List<Datum> scope = new ArrayList<>();
            scope.add(Datum.symbol("let"));
            scope.add(Datum.EMPTY);
            scope.addAll(bodyForms(body));
            form.add(Datum.list(scope));
        }
        return Datum.list(form);
    }

    private Datum emitGuard(GuardNode guard) {
        List<Datum> spec = new ArrayList<>();
        spec.add(Datum.symbol(guard.variable()));
        guard.clauses().forEach(clause -> spec.add(emitClause(clause, guard.variable())));
        if (guardPolicy == GuardPolicy.RERAISE && !guard.hasCatchAll()) {
            spec.add(Datum.list(ELSE, Datum.list(Datum.symbol("raise-continuable"), Datum.symbol(guard.variable()))));
        }
        List<Datum> form = new ArrayList<>();
        form.add(Datum.symbol("guard"));
        form.add(Datum.list(spec));
        form.addAll(bodyForms(guard.body()));
        return Datum.list(form);
    }

    // --- 定义 ---

    private Datum emitDefinition(DefinitionNode definition) {
        if (definition instanceof ValDefinitionNode val) {
            BindingNode binding = val.binding();
            if (binding.isDestructuring()) {
                return Datum.list(Datum.symbol("define-values"), emitFormals(binding.target()), emitExpression(binding.value()));
            }
            return Datum.list(Datum.symbol("define"), Datum.symbol(binding.name()), bindingValue(binding));
        }
        if (definition instanceof SyntaxDefinitionNode syntax) {
            return Datum.list(Datum.symbol("define-syntax"), Datum.symbol(syntax.name()), emitExpression(syntax.transformer()));
        }
        if (definition instanceof RecordDefinitionNode record) {
            return emitRecord(record);
        }
        if (definition instanceof IncludeNode include) {
            List<Datum> form = new ArrayList<>();
            form.add(Datum.symbol(include.caseInsensitive() ? "include-ci" : "include"));
            include.files().forEach(file -> form.add(new StringDatum(file)));
            return Datum.list(form);
        }
        if (definition instanceof ImportNode importNode) {
            List<Datum> form = new ArrayList<>();
            form.add(Datum.symbol("import"));
            importNode.importSets().forEach(set -> form.add(emitImportSet(set)));
            return Datum.list(form);
        }
        if (definition instanceof ExportNode export) {
            List<Datum> form = new ArrayList<>();
            form.add(Datum.symbol("export"));
            for (ExportSpec spec : export.specs()) {
                if (spec.alias() == null) {
                    form.add(Datum.symbol(spec.name()));
                } else {
                    form.add(Datum.list(Datum.symbol("rename"), Datum.symbol(spec.name()), Datum.symbol(spec.alias())));
                }
            }
            return Datum.list(form);
        }
        if (definition instanceof LibraryNode library) {
            return emitLibrary(library);
        }
        throw new IllegalStateException("Unsupported definition: " + definition.getClass().getSimpleName());
    }

    private Datum emitRecord(RecordDefinitionNode record) {
        List<Datum> form = new ArrayList<>();
        form.add(Datum.symbol("define-record-type"));
        form.add(Datum.symbol(record.typeName()));
        List<Datum> constructor = new ArrayList<>();
        constructor.add(Datum.symbol(record.constructor()));
        record.constructorFields().forEach(field -> constructor.add(Datum.symbol(field)));
        form.add(Datum.list(constructor));
        form.add(Datum.symbol(record.predicate()));
        for (FieldSpecNode field : record.fields()) {
            if (field.modifier() == null) {
                form.add(Datum.list(Datum.symbol(field.field()), Datum.symbol(field.accessor())));
            } else {
                form.add(Datum.list(Datum.symbol(field.field()), Datum.symbol(field.accessor()), Datum.symbol(field.modifier())));
            }
        }
        return Datum.list(form);
    }

    private Datum emitImportSet(ImportSetNode set) {
        switch (set.modifier()) {
            case LIBRARY:
                return Datum.list(set.libraryName());
            case EXPOSING:
                return modifiedSet("only", set, symbols(set.names()).items());
            case HIDING:
                return modifiedSet("except", set, symbols(set.names()).items());
            case RENAMING: {
                List<Datum> pairs = new ArrayList<>();
                for (RenamingNode renaming : set.renamings()) {
                    pairs.add(Datum.list(Datum.symbol(renaming.from()), Datum.symbol(renaming.to())));
                }
                return modifiedSet("rename", set, pairs);
            }
            case QUALIFYING:
                // qualifying m 使得 m_name 可以引用 name
                return modifiedSet("prefix", set, List.of(Datum.symbol(set.qualifier() + "-")));
            default:
                throw new IllegalStateException("Unknown import modifier: " + set.modifier());
        }
    }

    private Datum modifiedSet(String keyword, ImportSetNode set, List<Datum> arguments) {
        List<Datum> form = new ArrayList<>();
        form.add(Datum.symbol(keyword));
        form.add(emitImportSet(set.inner()));
        form.addAll(arguments);
        return Datum.list(form);
    }

    /**
     * Declarations (export, import, include) stay at library level; runs of other entries
     * are wrapped in {@code (begin ...)}.
     */
    private Datum emitLibrary(LibraryNode library) {
        List<Datum> form = new ArrayList<>();
        form.add(Datum.symbol("define-library"));
        form.add(Datum.list(library.name()));
        List<Datum> group = new ArrayList<>();
        for (AstNode entry : library.entries()) {
            if (entry instanceof ExportNode || entry instanceof ImportNode || entry instanceof IncludeNode) {
                flushBegin(form, group);
                form.add(emit(entry));
            } else {
                group.add(emit(entry));
            }
        }
        flushBegin(form, group);
        return Datum.list(form);
    }

    private void flushBegin(List<Datum> form, List<Datum> group) {
        if (group.isEmpty()) {
            return;
        }
        List<Datum> begin = new ArrayList<>();
        begin.add(Datum.symbol("begin"));
        begin.addAll(group);
        form.add(Datum.list(begin));
        group.clear();
    }

    private ListDatum symbols(List<String> names) {
        List<Datum> result = new ArrayList<>();
        names.forEach(name -> result.add(Datum.symbol(name)));
        return Datum.list(result);
    }
}
