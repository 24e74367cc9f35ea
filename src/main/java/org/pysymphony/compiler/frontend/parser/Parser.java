package org.pysymphony.compiler.frontend.parser;

import org.pysymphony.compiler.api.ParseFailureException;
import org.pysymphony.compiler.frontend.lexer.Lexer;
import org.pysymphony.compiler.frontend.lexer.Token;
import org.pysymphony.compiler.frontend.lexer.TokenType;
import org.pysymphony.compiler.frontend.parser.ast.AnnAssignNode;
import org.pysymphony.compiler.frontend.parser.ast.AssertNode;
import org.pysymphony.compiler.frontend.parser.ast.AssignNode;
import org.pysymphony.compiler.frontend.parser.ast.AttributeNode;
import org.pysymphony.compiler.frontend.parser.ast.AugAssignNode;
import org.pysymphony.compiler.frontend.parser.ast.AwaitNode;
import org.pysymphony.compiler.frontend.parser.ast.CallNode;
import org.pysymphony.compiler.frontend.parser.ast.ClassDefNode;
import org.pysymphony.compiler.frontend.parser.ast.CollectionNode;
import org.pysymphony.compiler.frontend.parser.ast.ComprehensionForNode;
import org.pysymphony.compiler.frontend.parser.ast.ComprehensionNode;
import org.pysymphony.compiler.frontend.parser.ast.ConstantNode;
import org.pysymphony.compiler.frontend.parser.ast.DeleteNode;
import org.pysymphony.compiler.frontend.parser.ast.DictNode;
import org.pysymphony.compiler.frontend.parser.ast.ExceptHandlerNode;
import org.pysymphony.compiler.frontend.parser.ast.ExprContext;
import org.pysymphony.compiler.frontend.parser.ast.ExprStmtNode;
import org.pysymphony.compiler.frontend.parser.ast.ForNode;
import org.pysymphony.compiler.frontend.parser.ast.FormattedStringNode;
import org.pysymphony.compiler.frontend.parser.ast.FunctionDefNode;
import org.pysymphony.compiler.frontend.parser.ast.GlobalNode;
import org.pysymphony.compiler.frontend.parser.ast.IfExpNode;
import org.pysymphony.compiler.frontend.parser.ast.IfNode;
import org.pysymphony.compiler.frontend.parser.ast.ImportAlias;
import org.pysymphony.compiler.frontend.parser.ast.ImportFromNode;
import org.pysymphony.compiler.frontend.parser.ast.ImportNode;
import org.pysymphony.compiler.frontend.parser.ast.KeywordNode;
import org.pysymphony.compiler.frontend.parser.ast.KeywordStatementNode;
import org.pysymphony.compiler.frontend.parser.ast.LambdaNode;
import org.pysymphony.compiler.frontend.parser.ast.ModuleNode;
import org.pysymphony.compiler.frontend.parser.ast.NameNode;
import org.pysymphony.compiler.frontend.parser.ast.NamedExprNode;
import org.pysymphony.compiler.frontend.parser.ast.Node;
import org.pysymphony.compiler.frontend.parser.ast.NodeStore;
import org.pysymphony.compiler.frontend.parser.ast.NonlocalNode;
import org.pysymphony.compiler.frontend.parser.ast.OperationNode;
import org.pysymphony.compiler.frontend.parser.ast.ParameterNode;
import org.pysymphony.compiler.frontend.parser.ast.RaiseNode;
import org.pysymphony.compiler.frontend.parser.ast.ReturnNode;
import org.pysymphony.compiler.frontend.parser.ast.SliceNode;
import org.pysymphony.compiler.frontend.parser.ast.Span;
import org.pysymphony.compiler.frontend.parser.ast.StarredNode;
import org.pysymphony.compiler.frontend.parser.ast.SubscriptNode;
import org.pysymphony.compiler.frontend.parser.ast.TryNode;
import org.pysymphony.compiler.frontend.parser.ast.WhileNode;
import org.pysymphony.compiler.frontend.parser.ast.WithItemNode;
import org.pysymphony.compiler.frontend.parser.ast.WithNode;
import org.pysymphony.compiler.frontend.parser.ast.YieldNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.IntSupplier;

/**
 * Recursive descent parser for Python 3 source. It builds the {@link NodeStore} of one file;
 * assignment targets are marked with their store/delete context before the store is frozen.
 * {@code match} statements are not supported.
 */
public class Parser {

    private static final Set<String> AUGMENTED_ASSIGNMENT = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "^=", "|=", "@=");
    private static final Set<String> COMPARISON = Set.of("==", "!=", "<", ">", "<=", ">=");
    private static final Set<String> EXPRESSION_START_OPERATORS = Set.of("(", "[", "{", "-", "+", "~", "*", "...");
    private static final Set<String> EXPRESSION_START_KEYWORDS = Set.of(
            "None", "True", "False", "not", "lambda", "await", "yield");

    private final String source;
    private final String fileName;
    private final List<Token> tokens;
    private final NodeStore.Builder builder;
    private int current;
    private int lastEnd;

    /**
     * Tokenizes the given source.
     * @param source The file content.
     * @param fileName The file name used in nodes and errors.
     * @throws ParseFailureException if the source cannot be tokenized.
     */
    public Parser(String source, String fileName) throws ParseFailureException {
        this(source, fileName, new Lexer(source, fileName).scanTokens(), new NodeStore.Builder());
    }

    private Parser(String source, String fileName, List<Token> tokens, NodeStore.Builder builder) {
        this.source = source;
        this.fileName = fileName;
        this.tokens = tokens;
        this.builder = builder;
    }

    /**
     * Convenience for {@code new Parser(source, fileName).parse()}.
     */
    public static NodeStore parse(String source, String fileName) throws ParseFailureException {
        return new Parser(source, fileName).parse();
    }

    /**
     * Parses the whole file.
     * @return The frozen node store.
     * @throws ParseFailureException on the first syntax error.
     */
    public NodeStore parse() throws ParseFailureException {
        try {
            List<Integer> body = new ArrayList<>();
            while (!isAtEnd()) {
                if (check(TokenType.NEWLINE)) {
                    advance();
                    continue;
                }
                statement(body);
            }
            int root = builder.add(new ModuleNode(new Span(0, source.length(), 1, 0), body));
            return builder.build(fileName, source, root);
        } catch (SyntaxError e) {
            throw new ParseFailureException(e.getMessage(), fileName, e.line);
        }
    }

    // === Statements ===

    private void statement(List<Integer> out) {
        Token token = peek();
        if (token.type() == TokenType.INDENT) {
            throw error("unexpected indent");
        }
        if (token.isOp("@")) {
            out.add(decorated());
            return;
        }
        int compound = compoundStatement(token);
        if (compound >= 0) {
            out.add(compound);
        } else {
            simpleStatements(out);
        }
    }

    private int compoundStatement(Token token) {
        if (token.type() != TokenType.KEYWORD) {
            return -1;
        }
        switch (token.text()) {
            case "def":
                return functionDef(token, List.of(), false);
            case "class":
                return classDef(token, List.of());
            case "if":
                return ifStatement(token);
            case "while":
                return whileStatement(token);
            case "for":
                return forStatement(token, false);
            case "try":
                return tryStatement(token);
            case "with":
                return withStatement(token, false);
            case "async":
                Token next = peekAt(1);
                if (next.isKeyword("def")) {
                    advance();
                    return functionDef(token, List.of(), true);
                }
                if (next.isKeyword("for")) {
                    advance();
                    return forStatement(token, true);
                }
                if (next.isKeyword("with")) {
                    advance();
                    return withStatement(token, true);
                }
                throw error("invalid syntax");
            default:
                return -1;
        }
    }

    private int decorated() {
        Token start = peek();
        List<Integer> decorators = new ArrayList<>();
        while (matchOp("@")) {
            decorators.add(namedExpression());
            expect(TokenType.NEWLINE, "expected newline after decorator");
        }
        if (checkKeyword("def")) {
            return functionDef(start, decorators, false);
        }
        if (checkKeyword("async") && peekAt(1).isKeyword("def")) {
            advance();
            return functionDef(start, decorators, true);
        }
        if (checkKeyword("class")) {
            return classDef(start, decorators);
        }
        throw error("expected a function or class definition after decorator");
    }

    private int functionDef(Token start, List<Integer> decorators, boolean async) {
        expectKeyword("def");
        Token name = expectName();
        expectOp("(");
        List<Integer> parameters = parameters(")", true);
        expectOp(")");
        int returns = matchOp("->") ? expression() : -1;
        List<Integer> body = block();
        return add(new FunctionDefNode(spanFrom(start), name.text(), spanOf(name), async, decorators,
                parameters, returns, body));
    }

    private List<Integer> parameters(String closer, boolean annotated) {
        List<Integer> parameters = new ArrayList<>();
        ParameterNode.Kind kind = ParameterNode.Kind.POSITIONAL;
        while (!checkOp(closer)) {
            if (matchOp("/")) {
                // positional-only marker, nothing to record
            } else if (matchOp("**")) {
                parameters.add(parameter(ParameterNode.Kind.VAR_KEYWORD, annotated));
            } else if (matchOp("*")) {
                if (check(TokenType.NAME)) {
                    parameters.add(parameter(ParameterNode.Kind.VAR_POSITIONAL, annotated));
                }
                kind = ParameterNode.Kind.KEYWORD_ONLY;
            } else {
                parameters.add(parameter(kind, annotated));
            }
            if (!matchOp(",")) {
                break;
            }
        }
        return parameters;
    }

    private int parameter(ParameterNode.Kind kind, boolean annotated) {
        Token name = expectName();
        int annotation = annotated && matchOp(":") ? expression() : -1;
        boolean defaultable = kind == ParameterNode.Kind.POSITIONAL || kind == ParameterNode.Kind.KEYWORD_ONLY;
        int defaultValue = defaultable && matchOp("=") ? expression() : -1;
        return add(new ParameterNode(spanOf(name), name.text(), kind, annotation, defaultValue));
    }

    private int classDef(Token start, List<Integer> decorators) {
        expectKeyword("class");
        Token name = expectName();
        List<Integer> bases = List.of();
        if (matchOp("(")) {
            bases = arguments();
            expectOp(")");
        }
        List<Integer> body = block();
        return add(new ClassDefNode(spanFrom(start), name.text(), spanOf(name), decorators, bases, body));
    }

    private int ifStatement(Token start) {
        advance();
        int test = namedExpression();
        List<Integer> body = block();
        List<Integer> orElse = List.of();
        if (checkKeyword("elif")) {
            orElse = List.of(ifStatement(peek()));
        } else if (matchKeyword("else")) {
            orElse = block();
        }
        return add(new IfNode(spanFrom(start), test, body, orElse));
    }

    private int whileStatement(Token start) {
        advance();
        int test = namedExpression();
        List<Integer> body = block();
        List<Integer> orElse = matchKeyword("else") ? block() : List.of();
        return add(new WhileNode(spanFrom(start), test, body, orElse));
    }

    private int forStatement(Token start, boolean async) {
        expectKeyword("for");
        int target = targetList();
        markTarget(target, ExprContext.STORE);
        expectKeyword("in");
        int iterable = starExpressions();
        List<Integer> body = block();
        List<Integer> orElse = matchKeyword("else") ? block() : List.of();
        return add(new ForNode(spanFrom(start), async, target, iterable, body, orElse));
    }

    private int tryStatement(Token start) {
        advance();
        List<Integer> body = block();
        List<Integer> handlers = new ArrayList<>();
        while (checkKeyword("except")) {
            Token handlerStart = advance();
            matchOp("*");
            int type = -1;
            Token name = null;
            if (!checkOp(":")) {
                type = expression();
                if (matchKeyword("as")) {
                    name = expectName();
                }
            }
            List<Integer> handlerBody = block();
            handlers.add(add(new ExceptHandlerNode(spanFrom(handlerStart), type,
                    name == null ? null : name.text(), name == null ? null : spanOf(name), handlerBody)));
        }
        List<Integer> orElse = matchKeyword("else") ? block() : List.of();
        List<Integer> finalBody = matchKeyword("finally") ? block() : List.of();
        if (handlers.isEmpty() && finalBody.isEmpty()) {
            throw error("expected 'except' or 'finally' block");
        }
        return add(new TryNode(spanFrom(start), body, handlers, orElse, finalBody));
    }

    private int withStatement(Token start, boolean async) {
        expectKeyword("with");
        List<Integer> items = new ArrayList<>();
        if (checkOp("(") && isParenthesizedWithItems()) {
            advance();
            while (!checkOp(")")) {
                items.add(withItem());
                if (!matchOp(",")) {
                    break;
                }
            }
            expectOp(")");
        } else {
            do {
                items.add(withItem());
            } while (matchOp(","));
        }
        List<Integer> body = block();
        return add(new WithNode(spanFrom(start), async, items, body));
    }

    private int withItem() {
        Token start = peek();
        int context = expression();
        int target = -1;
        if (matchKeyword("as")) {
            target = starTarget();
            markTarget(target, ExprContext.STORE);
        }
        return add(new WithItemNode(spanFrom(start), context, target));
    }

    /**
     * Distinguishes {@code with (a as b, c as d):} from a parenthesized context expression.
     */
    private boolean isParenthesizedWithItems() {
        int depth = 0;
        boolean sawAs = false;
        for (int i = current; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                depth++;
            } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                depth--;
                if (depth == 0) {
                    return sawAs && i + 1 < tokens.size() && tokens.get(i + 1).isOp(":");
                }
            } else if (depth == 1 && token.isKeyword("as")) {
                sawAs = true;
            } else if (token.type() == TokenType.END_OF_FILE) {
                return false;
            }
        }
        return false;
    }

    private List<Integer> block() {
        expectOp(":");
        List<Integer> body = new ArrayList<>();
        if (match(TokenType.NEWLINE)) {
            if (!check(TokenType.INDENT)) {
                throw error("expected an indented block");
            }
            advance();
            while (!check(TokenType.DEDENT) && !isAtEnd()) {
                statement(body);
            }
            match(TokenType.DEDENT);
        } else {
            simpleStatements(body);
        }
        return body;
    }

    private void simpleStatements(List<Integer> out) {
        do {
            if (check(TokenType.NEWLINE) || isAtEnd()) {
                break;
            }
            out.add(simpleStatement());
        } while (matchOp(";"));
        if (!isAtEnd()) {
            expect(TokenType.NEWLINE, "invalid syntax");
        }
    }

    private int simpleStatement() {
        Token start = peek();
        if (start.type() == TokenType.KEYWORD) {
            switch (start.text()) {
                case "pass", "break", "continue" -> {
                    advance();
                    return add(new KeywordStatementNode(spanFrom(start), start.text()));
                }
                case "return" -> {
                    advance();
                    int value = isEndOfSimpleStatement() ? -1 : starExpressions();
                    return add(new ReturnNode(spanFrom(start), value));
                }
                case "raise" -> {
                    advance();
                    int exception = -1;
                    int cause = -1;
                    if (!isEndOfSimpleStatement()) {
                        exception = expression();
                        if (matchKeyword("from")) {
                            cause = expression();
                        }
                    }
                    return add(new RaiseNode(spanFrom(start), exception, cause));
                }
                case "global", "nonlocal" -> {
                    advance();
                    List<String> names = new ArrayList<>();
                    List<Span> spans = new ArrayList<>();
                    do {
                        Token name = expectName();
                        names.add(name.text());
                        spans.add(spanOf(name));
                    } while (matchOp(","));
                    return start.text().equals("global")
                            ? add(new GlobalNode(spanFrom(start), names, spans))
                            : add(new NonlocalNode(spanFrom(start), names, spans));
                }
                case "del" -> {
                    advance();
                    List<Integer> targets = new ArrayList<>();
                    do {
                        if (isEndOfSimpleStatement()) {
                            break;
                        }
                        int target = starTarget();
                        markTarget(target, ExprContext.DEL);
                        targets.add(target);
                    } while (matchOp(","));
                    return add(new DeleteNode(spanFrom(start), targets));
                }
                case "assert" -> {
                    advance();
                    int test = expression();
                    int message = matchOp(",") ? expression() : -1;
                    return add(new AssertNode(spanFrom(start), test, message));
                }
                case "import" -> {
                    return importStatement(start);
                }
                case "from" -> {
                    return fromImportStatement(start);
                }
                default -> {
                    // an expression statement starting with a keyword such as 'not' or 'await'
                }
            }
        }
        return expressionStatement(start);
    }

    private int importStatement(Token start) {
        advance();
        List<ImportAlias> aliases = new ArrayList<>();
        do {
            Token first = peek();
            String name = dottedName();
            String asName = matchKeyword("as") ? expectName().text() : null;
            aliases.add(new ImportAlias(name, asName, spanFrom(first)));
        } while (matchOp(","));
        return add(new ImportNode(spanFrom(start), aliases));
    }

    private int fromImportStatement(Token start) {
        advance();
        int level = 0;
        while (true) {
            if (matchOp(".")) {
                level++;
            } else if (matchOp("...")) {
                level += 3;
            } else {
                break;
            }
        }
        String module = check(TokenType.NAME) ? dottedName() : "";
        if (level == 0 && module.isEmpty()) {
            throw error("expected a module name");
        }
        expectKeyword("import");
        List<ImportAlias> aliases = new ArrayList<>();
        if (checkOp("*")) {
            Token star = advance();
            aliases.add(new ImportAlias("*", null, spanOf(star)));
        } else {
            boolean parenthesized = matchOp("(");
            do {
                if (parenthesized && checkOp(")")) {
                    break;
                }
                Token name = expectName();
                String asName = matchKeyword("as") ? expectName().text() : null;
                aliases.add(new ImportAlias(name.text(), asName, spanFrom(name)));
            } while (matchOp(","));
            if (parenthesized) {
                expectOp(")");
            }
        }
        return add(new ImportFromNode(spanFrom(start), module, level, aliases));
    }

    private String dottedName() {
        StringBuilder name = new StringBuilder(expectName().text());
        while (checkOp(".") && peekAt(1).type() == TokenType.NAME) {
            advance();
            name.append('.').append(advance().text());
        }
        return name.toString();
    }

    private int expressionStatement(Token start) {
        int first = starExpressionsOrYield();
        if (matchOp(":")) {
            int annotation = expression();
            int value = matchOp("=") ? starExpressionsOrYield() : -1;
            markTarget(first, ExprContext.STORE);
            return add(new AnnAssignNode(spanFrom(start), first, annotation, value));
        }
        if (peek().type() == TokenType.OP && AUGMENTED_ASSIGNMENT.contains(peek().text())) {
            String operator = advance().text();
            int value = starExpressionsOrYield();
            markTarget(first, ExprContext.STORE);
            return add(new AugAssignNode(spanFrom(start), first, operator, value));
        }
        if (checkOp("=")) {
            List<Integer> parts = new ArrayList<>();
            parts.add(first);
            while (matchOp("=")) {
                parts.add(starExpressionsOrYield());
            }
            int value = parts.remove(parts.size() - 1);
            for (int target : parts) {
                markTarget(target, ExprContext.STORE);
            }
            return add(new AssignNode(spanFrom(start), parts, value));
        }
        return add(new ExprStmtNode(spanFrom(start), first));
    }

    private void markTarget(int index, ExprContext ctx) {
        Node node = builder.get(index);
        if (node instanceof NameNode name) {
            builder.set(index, name.withContext(ctx));
        } else if (node instanceof AttributeNode attribute) {
            builder.set(index, attribute.withContext(ctx));
        } else if (node instanceof SubscriptNode subscript) {
            builder.set(index, subscript.withContext(ctx));
        } else if (node instanceof StarredNode starred) {
            builder.set(index, starred.withContext(ctx));
            markTarget(starred.value(), ctx);
        } else if (node instanceof CollectionNode collection && collection.kind() != CollectionNode.Kind.SET) {
            for (int element : collection.elements()) {
                markTarget(element, ctx);
            }
        } else {
            throw new SyntaxError(ctx == ExprContext.DEL ? "cannot delete expression" : "cannot assign to expression",
                    node.span().line());
        }
    }

    // === Expressions ===

    private int starExpressionsOrYield() {
        return checkKeyword("yield") ? yieldExpression() : starExpressions();
    }

    private int starExpressions() {
        Token start = peek();
        int first = starExpression();
        if (!checkOp(",")) {
            return first;
        }
        List<Integer> elements = new ArrayList<>();
        elements.add(first);
        while (matchOp(",")) {
            if (!canStartExpression()) {
                break;
            }
            elements.add(starExpression());
        }
        return add(new CollectionNode(spanFrom(start), CollectionNode.Kind.TUPLE, elements));
    }

    private int starExpression() {
        if (checkOp("*")) {
            Token start = advance();
            int value = bitwiseOr();
            return add(new StarredNode(spanFrom(start), value, ExprContext.LOAD));
        }
        return namedExpression();
    }

    private int namedExpression() {
        if (check(TokenType.NAME) && peekAt(1).isOp(":=")) {
            Token name = advance();
            advance();
            int target = add(new NameNode(spanOf(name), name.text(), ExprContext.STORE));
            int value = expression();
            return add(new NamedExprNode(spanFrom(name), target, value));
        }
        return expression();
    }

    private int expression() {
        if (checkKeyword("lambda")) {
            return lambda();
        }
        Token start = peek();
        int body = disjunction();
        if (matchKeyword("if")) {
            int test = disjunction();
            expectKeyword("else");
            int orElse = expression();
            return add(new IfExpNode(spanFrom(start), test, body, orElse));
        }
        return body;
    }

    private int lambda() {
        Token start = advance();
        List<Integer> parameters = parameters(":", false);
        expectOp(":");
        int body = expression();
        return add(new LambdaNode(spanFrom(start), parameters, body));
    }

    private int disjunction() {
        return booleanOperation("or", this::conjunction);
    }

    private int conjunction() {
        return booleanOperation("and", this::inversion);
    }

    private int booleanOperation(String keyword, IntSupplier operand) {
        Token start = peek();
        int first = operand.getAsInt();
        if (!checkKeyword(keyword)) {
            return first;
        }
        List<Integer> operands = new ArrayList<>();
        operands.add(first);
        while (matchKeyword(keyword)) {
            operands.add(operand.getAsInt());
        }
        return add(new OperationNode(spanFrom(start), keyword, operands));
    }

    private int inversion() {
        if (checkKeyword("not")) {
            Token start = advance();
            int operand = inversion();
            return add(new OperationNode(spanFrom(start), "not", List.of(operand)));
        }
        return comparison();
    }

    private int comparison() {
        Token start = peek();
        int first = bitwiseOr();
        List<String> operators = new ArrayList<>();
        List<Integer> operands = new ArrayList<>();
        operands.add(first);
        for (String operator = comparisonOperator(); operator != null; operator = comparisonOperator()) {
            operators.add(operator);
            operands.add(bitwiseOr());
        }
        if (operators.isEmpty()) {
            return first;
        }
        return add(new OperationNode(spanFrom(start), String.join(" ", operators), operands));
    }

    private String comparisonOperator() {
        Token token = peek();
        if (token.type() == TokenType.OP && COMPARISON.contains(token.text())) {
            return advance().text();
        }
        if (token.isKeyword("in")) {
            advance();
            return "in";
        }
        if (token.isKeyword("not") && peekAt(1).isKeyword("in")) {
            advance();
            advance();
            return "not in";
        }
        if (token.isKeyword("is")) {
            advance();
            return matchKeyword("not") ? "is not" : "is";
        }
        return null;
    }

    private int bitwiseOr() {
        return binary(this::bitwiseXor, "|");
    }

    private int bitwiseXor() {
        return binary(this::bitwiseAnd, "^");
    }

    private int bitwiseAnd() {
        return binary(this::shift, "&");
    }

    private int shift() {
        return binary(this::sum, "<<", ">>");
    }

    private int sum() {
        return binary(this::term, "+", "-");
    }

    private int term() {
        return binary(this::factor, "*", "/", "//", "%", "@");
    }

    private int binary(IntSupplier operand, String... operators) {
        Token start = peek();
        int left = operand.getAsInt();
        while (true) {
            String operator = matchAnyOp(operators);
            if (operator == null) {
                return left;
            }
            int right = operand.getAsInt();
            left = add(new OperationNode(spanFrom(start), operator, List.of(left, right)));
        }
    }

    private int factor() {
        if (checkOp("+") || checkOp("-") || checkOp("~")) {
            Token start = advance();
            int operand = factor();
            return add(new OperationNode(spanFrom(start), start.text(), List.of(operand)));
        }
        return power();
    }

    private int power() {
        Token start = peek();
        int base = awaitPrimary();
        if (matchOp("**")) {
            int exponent = factor();
            return add(new OperationNode(spanFrom(start), "**", List.of(base, exponent)));
        }
        return base;
    }

    private int awaitPrimary() {
        if (checkKeyword("await")) {
            Token start = advance();
            int value = primary();
            return add(new AwaitNode(spanFrom(start), value));
        }
        return primary();
    }

    private int primary() {
        Token start = peek();
        int node = atom();
        while (true) {
            if (matchOp(".")) {
                Token name = expectName();
                node = add(new AttributeNode(spanFrom(start), node, name.text(), spanOf(name), ExprContext.LOAD));
            } else if (matchOp("(")) {
                List<Integer> arguments = arguments();
                expectOp(")");
                node = add(new CallNode(spanFrom(start), node, arguments));
            } else if (matchOp("[")) {
                int slice = slices();
                expectOp("]");
                node = add(new SubscriptNode(spanFrom(start), node, slice, ExprContext.LOAD));
            } else {
                return node;
            }
        }
    }

    /**
     * Parses call arguments up to, not including, the closing parenthesis.
     */
    private List<Integer> arguments() {
        List<Integer> arguments = new ArrayList<>();
        while (!checkOp(")")) {
            Token start = peek();
            if (matchOp("*")) {
                int value = expression();
                arguments.add(add(new StarredNode(spanFrom(start), value, ExprContext.LOAD)));
            } else if (matchOp("**")) {
                int value = expression();
                arguments.add(add(new KeywordNode(spanFrom(start), null, value)));
            } else if (check(TokenType.NAME) && peekAt(1).isOp("=")) {
                Token name = advance();
                advance();
                int value = expression();
                arguments.add(add(new KeywordNode(spanFrom(start), name.text(), value)));
            } else {
                int value = namedExpression();
                if (checkComprehensionFor()) {
                    List<Integer> generators = generators();
                    value = add(new ComprehensionNode(spanFrom(start), ComprehensionNode.Kind.GENERATOR,
                            value, -1, generators));
                }
                arguments.add(value);
            }
            if (!matchOp(",")) {
                break;
            }
        }
        return arguments;
    }

    private int slices() {
        Token start = peek();
        int first = slice();
        if (!checkOp(",")) {
            return first;
        }
        List<Integer> elements = new ArrayList<>();
        elements.add(first);
        while (matchOp(",")) {
            if (checkOp("]")) {
                break;
            }
            elements.add(slice());
        }
        return add(new CollectionNode(spanFrom(start), CollectionNode.Kind.TUPLE, elements));
    }

    private int slice() {
        Token start = peek();
        int lower = -1;
        if (!checkOp(":")) {
            lower = starExpression();
            if (!checkOp(":")) {
                return lower;
            }
        }
        expectOp(":");
        int upper = isSliceEnd() ? -1 : expression();
        int step = -1;
        if (matchOp(":")) {
            step = checkOp("]") || checkOp(",") ? -1 : expression();
        }
        return add(new SliceNode(spanFrom(start), lower, upper, step));
    }

    private boolean isSliceEnd() {
        return checkOp(":") || checkOp("]") || checkOp(",");
    }

    private int atom() {
        Token token = peek();
        switch (token.type()) {
            case NAME:
                advance();
                return add(new NameNode(spanOf(token), token.text(), ExprContext.LOAD));
            case NUMBER:
                advance();
                return add(new ConstantNode(spanOf(token), ConstantNode.Kind.NUMBER, token.text()));
            case STRING:
                return strings();
            case KEYWORD:
                if (token.isKeyword("None") || token.isKeyword("True") || token.isKeyword("False")) {
                    advance();
                    ConstantNode.Kind kind = switch (token.text()) {
                        case "None" -> ConstantNode.Kind.NONE;
                        case "True" -> ConstantNode.Kind.TRUE;
                        default -> ConstantNode.Kind.FALSE;
                    };
                    return add(new ConstantNode(spanOf(token), kind, token.text()));
                }
                break;
            case OP:
                if (token.isOp("(")) {
                    return parenthesized();
                }
                if (token.isOp("[")) {
                    return listDisplay();
                }
                if (token.isOp("{")) {
                    return braceDisplay();
                }
                if (token.isOp("...")) {
                    advance();
                    return add(new ConstantNode(spanOf(token), ConstantNode.Kind.ELLIPSIS, "..."));
                }
                break;
            default:
                break;
        }
        throw error("invalid syntax");
    }

    private int parenthesized() {
        Token open = advance();
        if (matchOp(")")) {
            return add(new CollectionNode(spanFrom(open), CollectionNode.Kind.TUPLE, List.of()));
        }
        if (checkKeyword("yield")) {
            int value = yieldExpression();
            expectOp(")");
            return value;
        }
        int first = starExpression();
        if (checkComprehensionFor()) {
            List<Integer> generators = generators();
            expectOp(")");
            return add(new ComprehensionNode(spanFrom(open), ComprehensionNode.Kind.GENERATOR, first, -1, generators));
        }
        if (checkOp(",")) {
            List<Integer> elements = new ArrayList<>();
            elements.add(first);
            while (matchOp(",")) {
                if (checkOp(")")) {
                    break;
                }
                elements.add(starExpression());
            }
            expectOp(")");
            return add(new CollectionNode(spanFrom(open), CollectionNode.Kind.TUPLE, elements));
        }
        expectOp(")");
        return first;
    }

    private int listDisplay() {
        Token open = advance();
        if (matchOp("]")) {
            return add(new CollectionNode(spanFrom(open), CollectionNode.Kind.LIST, List.of()));
        }
        int first = starExpression();
        if (checkComprehensionFor()) {
            List<Integer> generators = generators();
            expectOp("]");
            return add(new ComprehensionNode(spanFrom(open), ComprehensionNode.Kind.LIST, first, -1, generators));
        }
        List<Integer> elements = new ArrayList<>();
        elements.add(first);
        while (matchOp(",")) {
            if (checkOp("]")) {
                break;
            }
            elements.add(starExpression());
        }
        expectOp("]");
        return add(new CollectionNode(spanFrom(open), CollectionNode.Kind.LIST, elements));
    }

    private int braceDisplay() {
        Token open = advance();
        List<Integer> keys = new ArrayList<>();
        List<Integer> values = new ArrayList<>();
        if (matchOp("}")) {
            return add(new DictNode(spanFrom(open), keys, values));
        }
        if (matchOp("**")) {
            keys.add(-1);
            values.add(bitwiseOr());
            return dictEntries(open, keys, values);
        }
        int first = starExpression();
        if (matchOp(":")) {
            int value = expression();
            if (checkComprehensionFor()) {
                List<Integer> generators = generators();
                expectOp("}");
                return add(new ComprehensionNode(spanFrom(open), ComprehensionNode.Kind.DICT, first, value, generators));
            }
            keys.add(first);
            values.add(value);
            return dictEntries(open, keys, values);
        }
        if (checkComprehensionFor()) {
            List<Integer> generators = generators();
            expectOp("}");
            return add(new ComprehensionNode(spanFrom(open), ComprehensionNode.Kind.SET, first, -1, generators));
        }
        List<Integer> elements = new ArrayList<>();
        elements.add(first);
        while (matchOp(",")) {
            if (checkOp("}")) {
                break;
            }
            elements.add(starExpression());
        }
        expectOp("}");
        return add(new CollectionNode(spanFrom(open), CollectionNode.Kind.SET, elements));
    }

    private int dictEntries(Token open, List<Integer> keys, List<Integer> values) {
        while (matchOp(",")) {
            if (checkOp("}")) {
                break;
            }
            if (matchOp("**")) {
                keys.add(-1);
                values.add(bitwiseOr());
            } else {
                keys.add(expression());
                expectOp(":");
                values.add(expression());
            }
        }
        expectOp("}");
        return add(new DictNode(spanFrom(open), keys, values));
    }

    private boolean checkComprehensionFor() {
        return checkKeyword("for") || (checkKeyword("async") && peekAt(1).isKeyword("for"));
    }

    private List<Integer> generators() {
        List<Integer> generators = new ArrayList<>();
        while (checkComprehensionFor()) {
            Token start = peek();
            boolean async = matchKeyword("async");
            expectKeyword("for");
            int target = targetList();
            markTarget(target, ExprContext.STORE);
            expectKeyword("in");
            int iterable = disjunction();
            List<Integer> conditions = new ArrayList<>();
            while (matchKeyword("if")) {
                conditions.add(disjunction());
            }
            generators.add(add(new ComprehensionForNode(spanFrom(start), async, target, iterable, conditions)));
        }
        return generators;
    }

    private int targetList() {
        Token start = peek();
        int first = starTarget();
        if (!checkOp(",")) {
            return first;
        }
        List<Integer> elements = new ArrayList<>();
        elements.add(first);
        while (matchOp(",")) {
            if (checkKeyword("in") || checkOp("=") || checkOp(":")) {
                break;
            }
            elements.add(starTarget());
        }
        return add(new CollectionNode(spanFrom(start), CollectionNode.Kind.TUPLE, elements));
    }

    private int starTarget() {
        if (checkOp("*")) {
            Token start = advance();
            int value = bitwiseOr();
            return add(new StarredNode(spanFrom(start), value, ExprContext.LOAD));
        }
        return bitwiseOr();
    }

    private int yieldExpression() {
        Token start = advance();
        if (matchKeyword("from")) {
            int value = expression();
            return add(new YieldNode(spanFrom(start), true, value));
        }
        int value = canStartExpression() ? starExpressions() : -1;
        return add(new YieldNode(spanFrom(start), false, value));
    }

    // === Strings ===

    private int strings() {
        Token first = peek();
        List<Integer> values = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        boolean formatted = false;
        while (check(TokenType.STRING)) {
            Token token = advance();
            String raw = token.text();
            int prefixLength = 0;
            while (raw.charAt(prefixLength) != '"' && raw.charAt(prefixLength) != '\'') {
                prefixLength++;
            }
            String prefix = raw.substring(0, prefixLength).toLowerCase();
            boolean triple = raw.startsWith("\"\"\"", prefixLength) || raw.startsWith("'''", prefixLength);
            int quoteLength = triple && raw.length() - prefixLength >= 6 ? 3 : 1;
            int bodyStart = token.offset() + prefixLength + quoteLength;
            int bodyEnd = token.endOffset() - quoteLength;
            text.append(source, bodyStart, bodyEnd);
            if (prefix.indexOf('f') >= 0) {
                formatted = true;
                scanFormattedBody(token, bodyStart, bodyEnd, prefix.indexOf('r') >= 0, values);
            }
        }
        if (formatted) {
            return add(new FormattedStringNode(spanFrom(first), values));
        }
        return add(new ConstantNode(spanFrom(first), ConstantNode.Kind.STRING, text.toString()));
    }

    private void scanFormattedBody(Token token, int start, int end, boolean raw, List<Integer> values) {
        int i = start;
        while (i < end) {
            char c = source.charAt(i);
            if (c == '{') {
                if (i + 1 < end && source.charAt(i + 1) == '{') {
                    i += 2;
                } else {
                    i = scanReplacementField(token, i + 1, end, values) + 1;
                }
            } else if (c == '\\' && !raw) {
                i += 2;
            } else {
                i++;
            }
        }
    }

    /**
     * Parses one replacement field starting after its opening brace, including nested
     * fields of its format specification.
     * @return The offset of the closing brace.
     */
    private int scanReplacementField(Token token, int start, int end, List<Integer> values) {
        int i = start;
        int depth = 0;
        while (i < end) {
            char c = source.charAt(i);
            char next = i + 1 < end ? source.charAt(i + 1) : '\0';
            char previous = i > start ? source.charAt(i - 1) : '\0';
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == '}') {
                if (depth == 0) {
                    break;
                }
                depth--;
            } else if (c == '\'' || c == '"') {
                i = skipQuoted(i, end);
                continue;
            } else if (depth == 0 && c == '!' && next != '=') {
                break;
            } else if (depth == 0 && c == ':') {
                break;
            } else if (depth == 0 && c == '=' && next != '=' && "=!<>".indexOf(previous) < 0) {
                break;
            }
            i++;
        }
        if (i >= end) {
            throw new SyntaxError("f-string: expecting '}'", token.line());
        }
        values.add(embeddedExpression(token, start, i));
        if (source.charAt(i) == '=') {
            i++;
        }
        if (i < end && source.charAt(i) == '!') {
            i += 2;
        }
        if (i < end && source.charAt(i) == ':') {
            i++;
            while (i < end && source.charAt(i) != '}') {
                i = source.charAt(i) == '{' ? scanReplacementField(token, i + 1, end, values) + 1 : i + 1;
            }
        }
        if (i >= end || source.charAt(i) != '}') {
            throw new SyntaxError("f-string: expecting '}'", token.line());
        }
        return i;
    }

    private int skipQuoted(int at, int end) {
        char quote = source.charAt(at);
        int i = at + 1;
        while (i < end && source.charAt(i) != quote) {
            if (source.charAt(i) == '\\') {
                i++;
            }
            i++;
        }
        return i + 1;
    }

    private int embeddedExpression(Token token, int start, int end) {
        if (source.substring(start, end).isBlank()) {
            throw new SyntaxError("f-string: empty expression not allowed", token.line());
        }
        int line = token.line();
        int lineStart = token.offset() - token.column();
        for (int k = token.offset(); k < start; k++) {
            if (source.charAt(k) == '\n') {
                line++;
                lineStart = k + 1;
            }
        }
        List<Token> embedded;
        try {
            embedded = Lexer.forExpression(source, fileName, start, end, line, lineStart).scanTokens();
        } catch (ParseFailureException e) {
            throw new SyntaxError(e.getDetail(), e.getLine());
        }
        Parser nested = new Parser(source, fileName, embedded, builder);
        int value = nested.starExpressions();
        if (!nested.isAtEnd()) {
            throw nested.error("f-string: invalid expression");
        }
        return value;
    }

    // === Token helpers ===

    private boolean canStartExpression() {
        Token token = peek();
        return switch (token.type()) {
            case NAME, NUMBER, STRING -> true;
            case KEYWORD -> EXPRESSION_START_KEYWORDS.contains(token.text());
            case OP -> EXPRESSION_START_OPERATORS.contains(token.text());
            default -> false;
        };
    }

    private boolean isEndOfSimpleStatement() {
        return check(TokenType.NEWLINE) || checkOp(";") || isAtEnd();
    }

    private int add(Node node) {
        return builder.add(node);
    }

    private Span spanFrom(Token start) {
        return new Span(start.offset(), Math.max(lastEnd, start.endOffset()), start.line(), start.column());
    }

    private static Span spanOf(Token token) {
        return new Span(token.offset(), token.endOffset(), token.line(), token.column());
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAt(int ahead) {
        return tokens.get(Math.min(current + ahead, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (!isAtEnd()) {
            current++;
        }
        if (!token.isLayout()) {
            lastEnd = token.endOffset();
        }
        return token;
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean checkOp(String op) {
        return peek().isOp(op);
    }

    private boolean checkKeyword(String keyword) {
        return peek().isKeyword(keyword);
    }

    private boolean matchOp(String op) {
        if (checkOp(op)) {
            advance();
            return true;
        }
        return false;
    }

    private String matchAnyOp(String... ops) {
        for (String op : ops) {
            if (checkOp(op)) {
                advance();
                return op;
            }
        }
        return null;
    }

    private boolean matchKeyword(String keyword) {
        if (checkKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expectOp(String op) {
        if (!checkOp(op)) {
            throw error("expected '" + op + "'");
        }
        return advance();
    }

    private Token expectKeyword(String keyword) {
        if (!checkKeyword(keyword)) {
            throw error("expected '" + keyword + "'");
        }
        return advance();
    }

    private Token expectName() {
        if (!check(TokenType.NAME)) {
            throw error("expected a name");
        }
        return advance();
    }

    private void expect(TokenType type, String message) {
        if (!match(type)) {
            throw error(message);
        }
    }

    private SyntaxError error(String message) {
        Token token = peek();
        String near = switch (token.type()) {
            case NEWLINE -> " at end of line";
            case END_OF_FILE -> " at end of file";
            case INDENT, DEDENT -> "";
            default -> " near '" + token.text() + "'";
        };
        return new SyntaxError(message + near, token.line());
    }

    /**
     * Unwinds the recursive descent; converted to {@link ParseFailureException} at the top.
     */
    private static final class SyntaxError extends RuntimeException {
        private final int line;

        SyntaxError(String message, int line) {
            super(message);
            this.line = line;
        }
    }
}
