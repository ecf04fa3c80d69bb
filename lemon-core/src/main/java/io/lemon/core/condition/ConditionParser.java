package io.lemon.core.condition;

import io.lemon.core.condition.ConditionNode.BoolOp;
import io.lemon.core.condition.ConditionNode.Compare;
import io.lemon.core.condition.ConditionNode.ListLiteral;
import io.lemon.core.condition.ConditionNode.Literal;
import io.lemon.core.condition.ConditionNode.Name;
import io.lemon.core.condition.ConditionNode.UnaryOp;
import io.lemon.core.condition.ConditionNode.UnaryOperator;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/// Recursive-descent parser for the condition language.
///
/// ### Grammar (lowest to highest precedence)
/// ```
/// condition  := or END
/// or         := and ("or" and)*
/// and        := not ("and" not)*
/// not        := "not" not | comparison
/// comparison := unary (compOp unary)*
/// compOp     := "<" | "<=" | ">" | ">=" | "==" | "!=" | "in" | "not" "in"
/// unary      := ("-" | "+") unary | postfix
/// postfix    := primary          // followed by "(", "." or "[" is rejected
/// primary    := NUMBER | STRING | NAME | "[" items "]" | "(" or ")" | "(" items ")"
/// ```
///
/// Every construct outside the grammar fails with an
/// {@link InvalidConditionException} that names it, so authors see
/// "Function calls are not allowed in conditions" rather than a generic
/// syntax error.
final class ConditionParser {

    static final Set<String> FORBIDDEN_KEYWORDS =
            Set.of(
                    "import", "from", "lambda", "def", "class", "for", "while", "if", "else",
                    "yield", "await", "async", "del", "global", "nonlocal", "exec", "return",
                    "with", "assert", "raise", "try", "except", "pass");

    private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "//", "%", "**");

    private final String source;
    private final List<Token> tokens;
    private int index;

    private ConditionParser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    /// Parses condition text into a tree.
    ///
    /// @param source condition text, not null
    /// @return root node, never null
    /// @throws InvalidConditionException if the text is empty, malformed or uses
    ///         a disallowed construct
    static ConditionNode parse(String source) throws InvalidConditionException {
        if (source == null || source.isBlank()) {
            throw new InvalidConditionException("Condition cannot be empty", source);
        }
        ConditionParser parser = new ConditionParser(source, new ConditionLexer(source).tokenize());
        ConditionNode root = parser.parseOr();
        parser.expectEnd();
        return root;
    }

    private ConditionNode parseOr() throws InvalidConditionException {
        ConditionNode first = parseAnd();
        if (!peek().isKeyword("or")) {
            return first;
        }
        List<ConditionNode> values = new ArrayList<>();
        values.add(first);
        while (peek().isKeyword("or")) {
            advance();
            values.add(parseAnd());
        }
        return new BoolOp(false, values);
    }

    private ConditionNode parseAnd() throws InvalidConditionException {
        ConditionNode first = parseNot();
        if (!peek().isKeyword("and")) {
            return first;
        }
        List<ConditionNode> values = new ArrayList<>();
        values.add(first);
        while (peek().isKeyword("and")) {
            advance();
            values.add(parseNot());
        }
        return new BoolOp(true, values);
    }

    private ConditionNode parseNot() throws InvalidConditionException {
        if (peek().isKeyword("not")) {
            advance();
            return new UnaryOp(UnaryOperator.NOT, parseNot());
        }
        return parseComparison();
    }

    private ConditionNode parseComparison() throws InvalidConditionException {
        ConditionNode left = parseArithmeticGuard();
        List<ComparisonOperator> ops = new ArrayList<>();
        List<ConditionNode> comparators = new ArrayList<>();
        while (true) {
            ComparisonOperator op = comparisonOperator();
            if (op == null) {
                break;
            }
            ops.add(op);
            comparators.add(parseArithmeticGuard());
        }
        return ops.isEmpty() ? left : new Compare(left, ops, comparators);
    }

    /// Reads a comparison operator, consuming it, or returns null if none follows.
    private ComparisonOperator comparisonOperator() throws InvalidConditionException {
        Token token = peek();
        if (token.is(Token.Type.OPERATOR)) {
            ComparisonOperator op =
                    switch (token.text()) {
                        case "<" -> ComparisonOperator.LT;
                        case "<=" -> ComparisonOperator.LTE;
                        case ">" -> ComparisonOperator.GT;
                        case ">=" -> ComparisonOperator.GTE;
                        case "==" -> ComparisonOperator.EQ;
                        case "!=" -> ComparisonOperator.NEQ;
                        default -> null;
                    };
            if (op != null) {
                advance();
            }
            return op;
        }
        if (token.isKeyword("in")) {
            advance();
            return ComparisonOperator.IN;
        }
        if (token.isKeyword("not") && peekAhead(1).isKeyword("in")) {
            advance();
            advance();
            return ComparisonOperator.NOT_IN;
        }
        if (token.isKeyword("is")) {
            throw new InvalidConditionException(
                    "Unsupported comparison operator: 'is' (use '==' or '!=')", source);
        }
        return null;
    }

    private ConditionNode parseArithmeticGuard() throws InvalidConditionException {
        ConditionNode operand = parseUnary();
        Token next = peek();
        if (next.is(Token.Type.OPERATOR) && ARITHMETIC.contains(next.text())) {
            throw new InvalidConditionException(
                    "Arithmetic operations are not allowed in conditions", source);
        }
        return operand;
    }

    private ConditionNode parseUnary() throws InvalidConditionException {
        Token token = peek();
        if (token.isOperator("-") || token.isOperator("+")) {
            advance();
            ConditionNode operand = parseUnary();
            boolean negate = token.isOperator("-");
            if (operand instanceof Literal literal && literal.value() instanceof Number number) {
                return new Literal(negate ? negateNumber(number) : number);
            }
            return new UnaryOp(negate ? UnaryOperator.NEGATE : UnaryOperator.PLUS, operand);
        }
        return parsePostfix();
    }

    private ConditionNode parsePostfix() throws InvalidConditionException {
        ConditionNode primary = parsePrimary();
        Token next = peek();
        if (next.is(Token.Type.LPAREN)) {
            throw new InvalidConditionException(
                    "Function calls are not allowed in conditions", source);
        }
        if (next.is(Token.Type.DOT)) {
            throw new InvalidConditionException(
                    "Attribute access is not allowed in conditions", source);
        }
        if (next.is(Token.Type.LBRACKET)) {
            throw new InvalidConditionException(
                    "Subscript access is not allowed in conditions", source);
        }
        return primary;
    }

    private ConditionNode parsePrimary() throws InvalidConditionException {
        Token token = advance();
        switch (token.type()) {
            case NUMBER:
                return new Literal(parseNumber(token));
            case STRING:
                return new Literal(token.text());
            case NAME:
                return name(token);
            case LBRACKET:
                return new ListLiteral(items(Token.Type.RBRACKET));
            case LPAREN:
                return parenthesized();
            case OPERATOR:
                if (ARITHMETIC.contains(token.text())) {
                    throw new InvalidConditionException(
                            "Arithmetic operations are not allowed in conditions", source);
                }
                throw unexpected(token);
            default:
                throw unexpected(token);
        }
    }

    private ConditionNode name(Token token) throws InvalidConditionException {
        String text = token.text();
        switch (text) {
            case "true":
            case "True":
                return new Literal(Boolean.TRUE);
            case "false":
            case "False":
                return new Literal(Boolean.FALSE);
            case "none":
            case "None":
                return new Literal(null);
            case "and":
            case "or":
            case "in":
            case "not":
            case "is":
                throw unexpected(token);
            default:
                break;
        }
        if (FORBIDDEN_KEYWORDS.contains(text)) {
            throw forbiddenKeyword(text);
        }
        return new Name(text);
    }

    private ConditionNode parenthesized() throws InvalidConditionException {
        if (peek().is(Token.Type.RPAREN)) {
            advance();
            return new ListLiteral(List.of());
        }
        ConditionNode first = parseOr();
        if (peek().is(Token.Type.RPAREN)) {
            advance();
            return first;
        }
        if (!peek().is(Token.Type.COMMA)) {
            throw unexpected(peek());
        }
        List<ConditionNode> elements = new ArrayList<>();
        elements.add(first);
        while (peek().is(Token.Type.COMMA)) {
            advance();
            if (peek().is(Token.Type.RPAREN)) {
                break;
            }
            elements.add(parseOr());
        }
        expect(Token.Type.RPAREN);
        return new ListLiteral(elements);
    }

    private List<ConditionNode> items(Token.Type closing) throws InvalidConditionException {
        List<ConditionNode> elements = new ArrayList<>();
        while (!peek().is(closing)) {
            elements.add(parseOr());
            if (!peek().is(Token.Type.COMMA)) {
                break;
            }
            advance();
        }
        expect(closing);
        return elements;
    }

    private void expectEnd() throws InvalidConditionException {
        Token token = peek();
        if (!token.is(Token.Type.END)) {
            if (token.is(Token.Type.NAME) && FORBIDDEN_KEYWORDS.contains(token.text())) {
                throw forbiddenKeyword(token.text());
            }
            throw unexpected(token);
        }
    }

    private void expect(Token.Type type) throws InvalidConditionException {
        Token token = advance();
        if (!token.is(type)) {
            throw unexpected(token);
        }
    }

    private Number parseNumber(Token token) throws InvalidConditionException {
        String text = token.text();
        try {
            if (text.contains(".") || text.contains("e") || text.contains("E")) {
                return Double.parseDouble(text);
            }
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new InvalidConditionException(
                    "Invalid condition syntax: bad number literal '" + text + "'", source);
        }
    }

    private static Number negateNumber(Number number) {
        if (number instanceof Long value) {
            return -value;
        }
        return -number.doubleValue();
    }

    private InvalidConditionException forbiddenKeyword(String keyword) {
        return new InvalidConditionException(
                "'" + keyword + "' is not allowed in conditions", source);
    }

    private InvalidConditionException unexpected(Token token) {
        return new InvalidConditionException(
                "Invalid condition syntax: unexpected "
                        + token.describe()
                        + (token.is(Token.Type.END) ? "" : " at position " + token.position()),
                source);
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (index < tokens.size() - 1) {
            index++;
        }
        return token;
    }
}
