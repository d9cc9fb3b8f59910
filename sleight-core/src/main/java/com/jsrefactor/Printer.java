package com.jsrefactor;

import com.jsrefactor.ast.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Prints nodes back to JavaScript source. Parentheses are added only where
 * operator precedence requires them. Literals keep their raw text, so
 * printing a parsed expression reproduces its quoting and number format.
 *
 * <p>When printing a replacement for part of a source text, nodes that still
 * carry a source range are copied from that text, and the comments of the
 * replaced range are kept next to the statements they were written around.</p>
 */
public class Printer {
    // Precedence levels, aligned with the parser's binding powers
    private static final int PREC_ASSIGNMENT = 2;
    private static final int PREC_TERNARY = 3;
    private static final int PREC_NULLISH = 4;
    private static final int PREC_OR = 5;
    private static final int PREC_AND = 6;
    private static final int PREC_BIT_OR = 7;
    private static final int PREC_BIT_XOR = 8;
    private static final int PREC_BIT_AND = 9;
    private static final int PREC_EQUALITY = 10;
    private static final int PREC_RELATIONAL = 11;
    private static final int PREC_SHIFT = 12;
    private static final int PREC_ADDITIVE = 13;
    private static final int PREC_MULTIPLICATIVE = 14;
    private static final int PREC_UNARY = 16;
    private static final int PREC_POSTFIX = 17;
    private static final int PREC_PRIMARY = 18;

    private final String indentUnit;
    private StringBuilder out;
    private int level;

    // Set only while printing against a source text
    private String source;
    private List<Comment> comments = List.of();
    private List<Token> templates = List.of();
    private Set<Comment> emitted = new HashSet<>();
    private String baseIndentation = "";

    public Printer(int indentSize) {
        this.indentUnit = " ".repeat(indentSize);
    }

    public Printer() {
        this(2);
    }

    /**
     * Prints a node from its fields alone. Multi-line output is indented
     * relative to column zero.
     */
    public synchronized String print(Node node) {
        baseIndentation = "";
        source = null;
        comments = List.of();
        templates = List.of();
        return render(node);
    }

    /**
     * Prints {@code replacement} as the new text for the range of
     * {@code replaced} in {@code source}, indented to fit the line
     * {@code replaced} starts on. Comments of that range that are not part
     * of a copied node or adjacent to a kept statement are put on their own
     * lines before the output, so no comment is lost.
     *
     * @throws ParseException if {@code source} does not tokenize
     */
    public synchronized String print(Node replacement, String source, Node replaced) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();
        this.source = source;
        this.comments = lexer.comments().stream()
            .filter(comment -> comment.start() >= replaced.start() && comment.end() <= replaced.end())
            .toList();
        this.templates = tokens.stream().filter(token -> isTemplate(token.type())).toList();
        this.emitted = new HashSet<>();
        this.baseIndentation = lineIndentation(replaced.start());
        try {
            String printed = render(replacement);
            StringBuilder unplaced = new StringBuilder();
            level = 0;
            for (Comment comment : comments) {
                if (!emitted.contains(comment)) {
                    unplaced.append(sourceText(comment.start(), comment.end())).append('\n').append(baseIndentation);
                }
            }
            return unplaced + printed;
        } finally {
            this.baseIndentation = "";
            this.source = null;
            this.comments = List.of();
            this.templates = List.of();
        }
    }

    private String render(Node node) {
        out = new StringBuilder();
        level = 0;
        if (node instanceof Program program) {
            for (int i = 0; i < program.body().size(); i++) {
                if (i > 0) {
                    newline();
                }
                statement(program.body().get(i));
            }
        } else if (node instanceof Statement statement) {
            statement(statement);
        } else if (node instanceof Expression expression) {
            expression(expression, PREC_ASSIGNMENT);
        } else if (node instanceof SwitchCase switchCase) {
            switchCase(switchCase);
        } else if (node instanceof Property property) {
            property(property);
        } else if (node instanceof VariableDeclarator declarator) {
            declarator(declarator);
        } else if (node instanceof TemplateElement element) {
            out.append(element.value().raw());
        }
        return out.toString();
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private void statement(Statement statement) {
        if (copiesSource(statement)) {
            appendSource(statement);
        } else if (statement instanceof ExpressionStatement s) {
            // A leading { would start a block
            boolean wrap = startsWithObject(s.expression());
            if (wrap) out.append('(');
            expression(s.expression(), PREC_ASSIGNMENT);
            if (wrap) out.append(')');
            out.append(';');
        } else if (statement instanceof BlockStatement s) {
            block(s.body());
        } else if (statement instanceof IfStatement s) {
            ifStatement(s);
        } else if (statement instanceof SwitchStatement s) {
            switchStatement(s);
        } else if (statement instanceof ReturnStatement s) {
            out.append("return");
            if (s.argument() != null) {
                out.append(' ');
                expression(s.argument(), PREC_ASSIGNMENT);
            }
            out.append(';');
        } else if (statement instanceof BreakStatement) {
            out.append("break;");
        } else if (statement instanceof ThrowStatement s) {
            out.append("throw ");
            expression(s.argument(), PREC_ASSIGNMENT);
            out.append(';');
        } else if (statement instanceof EmptyStatement) {
            out.append(';');
        } else if (statement instanceof VariableDeclaration s) {
            out.append(s.kind()).append(' ');
            for (int i = 0; i < s.declarations().size(); i++) {
                if (i > 0) out.append(", ");
                declarator(s.declarations().get(i));
            }
            out.append(';');
        } else if (statement instanceof FunctionDeclaration s) {
            out.append("function ").append(s.id().name());
            parameters(s.params());
            out.append(' ');
            block(s.body().body());
        } else {
            throw new IllegalArgumentException("Cannot print " + statement.type());
        }
    }

    private void block(List<Statement> body) {
        if (body.isEmpty()) {
            out.append("{}");
            return;
        }
        out.append('{');
        level++;
        statements(body);
        level--;
        newline();
        out.append('}');
    }

    private void statements(List<Statement> body) {
        for (Statement statement : body) {
            newline();
            leadingComments(statement);
            statement(statement);
            trailingComments(statement);
        }
    }

    private void ifStatement(IfStatement s) {
        out.append("if (");
        expression(s.test(), PREC_ASSIGNMENT);
        out.append(") ");
        statement(s.consequent());
        if (s.alternate() == null) {
            return;
        }
        if (s.consequent() instanceof BlockStatement) {
            out.append(' ');
        } else {
            newline();
        }
        out.append("else ");
        statement(s.alternate());
    }

    private void switchStatement(SwitchStatement s) {
        out.append("switch (");
        expression(s.discriminant(), PREC_ASSIGNMENT);
        out.append(") {");
        if (s.cases().isEmpty()) {
            out.append('}');
            return;
        }
        level++;
        for (SwitchCase switchCase : s.cases()) {
            newline();
            switchCase(switchCase);
        }
        level--;
        newline();
        out.append('}');
    }

    private void switchCase(SwitchCase switchCase) {
        if (switchCase.test() == null) {
            out.append("default:");
        } else {
            out.append("case ");
            expression(switchCase.test(), PREC_ASSIGNMENT);
            out.append(':');
        }
        level++;
        statements(switchCase.consequent());
        level--;
    }

    private void declarator(VariableDeclarator declarator) {
        pattern(declarator.id());
        if (declarator.init() != null) {
            out.append(" = ");
            expression(declarator.init(), PREC_ASSIGNMENT);
        }
    }

    private void pattern(Pattern pattern) {
        if (pattern instanceof ObjectPattern objectPattern) {
            properties(objectPattern.properties());
        } else if (pattern instanceof Identifier identifier) {
            out.append(identifier.name());
        }
    }

    private void parameters(List<Identifier> params) {
        out.append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) out.append(", ");
            out.append(params.get(i).name());
        }
        out.append(')');
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private void expression(Expression expression, int minPrecedence) {
        boolean parenthesize = precedence(expression) < minPrecedence;
        if (parenthesize) out.append('(');
        if (copiesSource(expression)) {
            appendSource(expression);
        } else if (expression instanceof Identifier e) {
            out.append(e.name());
        } else if (expression instanceof ThisExpression) {
            out.append("this");
        } else if (expression instanceof Literal e) {
            out.append(e.raw() != null ? e.raw() : literalSource(e.value()));
        } else if (expression instanceof TemplateLiteral e) {
            template(e);
        } else if (expression instanceof ObjectExpression e) {
            properties(e.properties());
        } else if (expression instanceof ArrayExpression e) {
            out.append('[');
            for (int i = 0; i < e.elements().size(); i++) {
                if (i > 0) out.append(", ");
                expression(e.elements().get(i), PREC_ASSIGNMENT);
            }
            out.append(']');
        } else if (expression instanceof MemberExpression e) {
            expression(e.object(), PREC_POSTFIX);
            if (e.computed()) {
                out.append('[');
                expression(e.property(), PREC_ASSIGNMENT);
                out.append(']');
            } else {
                out.append('.');
                expression(e.property(), PREC_PRIMARY);
            }
        } else if (expression instanceof CallExpression e) {
            expression(e.callee(), PREC_POSTFIX);
            out.append('(');
            for (int i = 0; i < e.arguments().size(); i++) {
                if (i > 0) out.append(", ");
                expression(e.arguments().get(i), PREC_ASSIGNMENT);
            }
            out.append(')');
        } else if (expression instanceof UnaryExpression e) {
            out.append(e.operator());
            if (Character.isLetter(e.operator().charAt(0))) {
                out.append(' ');
            } else if (e.argument() instanceof UnaryExpression inner
                && (e.operator().equals("-") || e.operator().equals("+"))
                && inner.operator().equals(e.operator())) {
                out.append(' ');
            }
            expression(e.argument(), PREC_UNARY);
        } else if (expression instanceof BinaryExpression e) {
            binary(e.operator(), e.left(), e.right());
        } else if (expression instanceof LogicalExpression e) {
            binary(e.operator(), e.left(), e.right());
        } else if (expression instanceof ConditionalExpression e) {
            expression(e.test(), PREC_NULLISH);
            out.append(" ? ");
            expression(e.consequent(), PREC_ASSIGNMENT);
            out.append(" : ");
            expression(e.alternate(), PREC_ASSIGNMENT);
        } else if (expression instanceof AssignmentExpression e) {
            expression(e.left(), PREC_POSTFIX);
            out.append(' ').append(e.operator()).append(' ');
            expression(e.right(), PREC_ASSIGNMENT);
        } else if (expression instanceof ArrowFunctionExpression e) {
            parameters(e.params());
            out.append(" => ");
            if (e.body() instanceof BlockStatement body) {
                block(body.body());
            } else if (e.body() instanceof Expression body && startsWithObject(body)) {
                out.append('(');
                expression(body, PREC_ASSIGNMENT);
                out.append(')');
            } else {
                expression((Expression) e.body(), PREC_ASSIGNMENT);
            }
        } else {
            throw new IllegalArgumentException("Cannot print " + expression.type());
        }
        if (parenthesize) out.append(')');
    }

    private void binary(String operator, Expression left, Expression right) {
        int precedence = binaryPrecedence(operator);
        expression(left, mixesCoalesce(operator, left) ? PREC_PRIMARY : precedence);
        out.append(' ').append(operator).append(' ');
        expression(right, mixesCoalesce(operator, right) ? PREC_PRIMARY : precedence + 1);
    }

    // ?? next to && or || needs parentheses whatever the precedence
    private static boolean mixesCoalesce(String operator, Expression operand) {
        if (!(operand instanceof LogicalExpression logical)) {
            return false;
        }
        boolean coalesce = operator.equals("??");
        boolean operandCoalesce = logical.operator().equals("??");
        return coalesce != operandCoalesce;
    }

    /**
     * Whether printing starts with an object literal: the expression itself
     * or its leftmost operand, object or callee.
     */
    static boolean startsWithObject(Expression expression) {
        Expression leftmost = expression;
        while (true) {
            if (leftmost instanceof ObjectExpression) {
                return true;
            }
            if (leftmost instanceof MemberExpression e) {
                leftmost = e.object();
            } else if (leftmost instanceof CallExpression e) {
                leftmost = e.callee();
            } else if (leftmost instanceof BinaryExpression e) {
                leftmost = e.left();
            } else if (leftmost instanceof LogicalExpression e) {
                leftmost = e.left();
            } else if (leftmost instanceof ConditionalExpression e) {
                leftmost = e.test();
            } else if (leftmost instanceof AssignmentExpression e) {
                leftmost = e.left();
            } else {
                return false;
            }
        }
    }

    private void template(TemplateLiteral template) {
        out.append('`');
        List<TemplateElement> quasis = template.quasis();
        for (int i = 0; i < quasis.size(); i++) {
            out.append(quasis.get(i).value().raw());
            if (i < template.expressions().size()) {
                out.append("${");
                expression(template.expressions().get(i), PREC_ASSIGNMENT);
                out.append('}');
            }
        }
        out.append('`');
    }

    private void properties(List<Property> properties) {
        if (properties.isEmpty()) {
            out.append("{}");
            return;
        }
        out.append("{ ");
        for (int i = 0; i < properties.size(); i++) {
            if (i > 0) out.append(", ");
            property(properties.get(i));
        }
        out.append(" }");
    }

    private void property(Property property) {
        if (property.shorthand()) {
            propertyValue(property.value());
            return;
        }
        if (property.computed()) {
            out.append('[');
            expression((Expression) property.key(), PREC_ASSIGNMENT);
            out.append(']');
        } else {
            expression((Expression) property.key(), PREC_PRIMARY);
        }
        out.append(": ");
        propertyValue(property.value());
    }

    private void propertyValue(Node value) {
        if (value instanceof Expression expression) {
            expression(expression, PREC_ASSIGNMENT);
        } else if (value instanceof Pattern pattern) {
            pattern(pattern);
        }
    }

    private static int precedence(Expression expression) {
        if (expression instanceof AssignmentExpression || expression instanceof ArrowFunctionExpression) {
            return PREC_ASSIGNMENT;
        }
        if (expression instanceof ConditionalExpression) {
            return PREC_TERNARY;
        }
        if (expression instanceof LogicalExpression e) {
            return binaryPrecedence(e.operator());
        }
        if (expression instanceof BinaryExpression e) {
            return binaryPrecedence(e.operator());
        }
        if (expression instanceof UnaryExpression) {
            return PREC_UNARY;
        }
        if (expression instanceof MemberExpression || expression instanceof CallExpression) {
            return PREC_POSTFIX;
        }
        return PREC_PRIMARY;
    }

    private static int binaryPrecedence(String operator) {
        return switch (operator) {
            case "??" -> PREC_NULLISH;
            case "||" -> PREC_OR;
            case "&&" -> PREC_AND;
            case "|" -> PREC_BIT_OR;
            case "^" -> PREC_BIT_XOR;
            case "&" -> PREC_BIT_AND;
            case "==", "!=", "===", "!==" -> PREC_EQUALITY;
            case "<", "<=", ">", ">=", "in", "instanceof" -> PREC_RELATIONAL;
            case "<<", ">>", ">>>" -> PREC_SHIFT;
            case "+", "-" -> PREC_ADDITIVE;
            case "*", "/", "%" -> PREC_MULTIPLICATIVE;
            default -> throw new IllegalArgumentException("Unknown operator: " + operator);
        };
    }

    private static String literalSource(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String string) {
            return Nodes.quote(string);
        }
        if (value instanceof Double number && number == Math.rint(number) && Math.abs(number) < 1e21) {
            return Long.toString(number.longValue());
        }
        return value.toString();
    }

    // ========================================================================
    // Source copies and comments
    // ========================================================================

    private boolean copiesSource(Node node) {
        return source != null && node.hasLocation() && node.end() <= source.length();
    }

    private void appendSource(Node node) {
        out.append(sourceText(node.start(), node.end()));
        for (Comment comment : comments) {
            if (comment.start() >= node.start() && comment.end() <= node.end()) {
                emitted.add(comment);
            }
        }
    }

    /**
     * Source text moved to the current indentation level: continuation
     * lines lose the indentation of the first line's line and gain the
     * current one. Lines inside template literals are kept as written.
     */
    private String sourceText(int start, int end) {
        String text = source.substring(start, end);
        if (text.indexOf('\n') < 0) {
            return text;
        }
        String base = lineIndentation(start);
        String indentation = baseIndentation + indentUnit.repeat(level);
        StringBuilder sb = new StringBuilder();
        int lineStart = start;
        for (String line : text.split("\n", -1)) {
            if (lineStart == start) {
                sb.append(line);
            } else {
                sb.append('\n');
                if (line.isEmpty() || insideTemplate(lineStart) || !line.startsWith(base)) {
                    sb.append(line);
                } else {
                    sb.append(indentation).append(line.substring(base.length()));
                }
            }
            lineStart += line.length() + 1;
        }
        return sb.toString();
    }

    private String lineIndentation(int offset) {
        int lineStart = offset;
        while (lineStart > 0 && source.charAt(lineStart - 1) != '\n' && source.charAt(lineStart - 1) != '\r') {
            lineStart--;
        }
        int end = lineStart;
        while (end < offset && (source.charAt(end) == ' ' || source.charAt(end) == '\t')) {
            end++;
        }
        return source.substring(lineStart, end);
    }

    private boolean insideTemplate(int offset) {
        for (Token template : templates) {
            if (template.position() < offset && offset < template.endPosition()) {
                return true;
            }
        }
        return false;
    }

    // Comments directly above a kept statement, separated only by whitespace
    private void leadingComments(Statement statement) {
        if (!copiesSource(statement)) {
            return;
        }
        int index = comments.size() - 1;
        while (index >= 0 && comments.get(index).end() > statement.start()) {
            index--;
        }
        int first = index + 1;
        int cursor = statement.start();
        while (index >= 0 && isBlank(comments.get(index).end(), cursor)) {
            cursor = comments.get(index).start();
            first = index;
            index--;
        }
        for (int i = first; i < comments.size() && comments.get(i).end() <= statement.start(); i++) {
            Comment comment = comments.get(i);
            if (emitted.add(comment)) {
                out.append(sourceText(comment.start(), comment.end()));
                if (comment.isBlock() && !hasLineBreak(comment.end(), statement.start())) {
                    out.append(' ');
                } else {
                    newline();
                }
            }
        }
    }

    // Comments right after a kept statement, on its line or the lines below
    private void trailingComments(Statement statement) {
        if (!copiesSource(statement)) {
            return;
        }
        int cursor = statement.end();
        for (Comment comment : comments) {
            if (comment.start() < statement.end()) {
                continue;
            }
            if (!isBlank(cursor, comment.start())) {
                return;
            }
            if (emitted.add(comment)) {
                if (hasLineBreak(cursor, comment.start())) {
                    newline();
                } else {
                    out.append(' ');
                }
                out.append(sourceText(comment.start(), comment.end()));
            }
            cursor = comment.end();
        }
    }

    private boolean isBlank(int from, int to) {
        for (int i = from; i < to; i++) {
            if (!Character.isWhitespace(source.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private boolean hasLineBreak(int from, int to) {
        for (int i = from; i < to; i++) {
            char c = source.charAt(i);
            if (c == '\n' || c == '\r') {
                return true;
            }
        }
        return false;
    }

    private static boolean isTemplate(TokenType type) {
        return type == TokenType.TEMPLATE_LITERAL || type == TokenType.TEMPLATE_HEAD
            || type == TokenType.TEMPLATE_MIDDLE || type == TokenType.TEMPLATE_TAIL;
    }

    private void newline() {
        out.append('\n');
        out.append(baseIndentation).append(indentUnit.repeat(level));
    }
}
