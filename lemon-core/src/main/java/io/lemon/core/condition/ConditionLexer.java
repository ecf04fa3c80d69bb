package io.lemon.core.condition;

import java.util.ArrayList;
import java.util.List;

/// Splits condition text into tokens.
///
/// Recognises numbers, quoted strings (single or double quotes with backslash
/// escapes), identifiers, brackets, commas, dots and the operator set
/// `< <= > >= == != + - * / // % **`. Operators outside the comparison set are
/// tokenised so the parser can reject them by name.
final class ConditionLexer {

    private final String source;
    private int pos;

    ConditionLexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() throws InvalidConditionException {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(Token.Type.END, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() throws InvalidConditionException {
        int start = pos;
        char c = source.charAt(pos);

        if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
            return number(start);
        }
        if (Character.isLetter(c) || c == '_') {
            while (pos < source.length()
                    && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            return new Token(Token.Type.NAME, source.substring(start, pos), start);
        }
        if (c == '"' || c == '\'') {
            return string(start, c);
        }

        pos++;
        switch (c) {
            case '(':
                return new Token(Token.Type.LPAREN, "(", start);
            case ')':
                return new Token(Token.Type.RPAREN, ")", start);
            case '[':
                return new Token(Token.Type.LBRACKET, "[", start);
            case ']':
                return new Token(Token.Type.RBRACKET, "]", start);
            case ',':
                return new Token(Token.Type.COMMA, ",", start);
            case '.':
                return new Token(Token.Type.DOT, ".", start);
            case '<':
            case '>':
                return operator(start, String.valueOf(c), '=');
            case '=':
                if (peek() == '=') {
                    pos++;
                    return new Token(Token.Type.OPERATOR, "==", start);
                }
                throw syntaxError("assignment '=' at position " + start + ", use '=='");
            case '!':
                if (peek() == '=') {
                    pos++;
                    return new Token(Token.Type.OPERATOR, "!=", start);
                }
                throw syntaxError("unexpected character '!' at position " + start);
            case '*':
                return operator(start, "*", '*');
            case '/':
                return operator(start, "/", '/');
            case '+':
            case '-':
            case '%':
                return new Token(Token.Type.OPERATOR, String.valueOf(c), start);
            default:
                throw syntaxError("unexpected character '" + c + "' at position " + start);
        }
    }

    private Token operator(int start, String first, char doubled) {
        if (peek() == doubled) {
            pos++;
            return new Token(Token.Type.OPERATOR, first + doubled, start);
        }
        return new Token(Token.Type.OPERATOR, first, start);
    }

    private Token number(int start) throws InvalidConditionException {
        boolean seenDot = false;
        boolean seenExponent = false;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isDigit(c) || c == '_') {
                pos++;
            } else if (c == '.' && !seenDot && !seenExponent) {
                seenDot = true;
                pos++;
            } else if ((c == 'e' || c == 'E') && !seenExponent) {
                seenExponent = true;
                pos++;
                if (peek() == '+' || peek() == '-') {
                    pos++;
                }
            } else {
                break;
            }
        }
        if (pos < source.length()
                && (Character.isLetter(source.charAt(pos)) || source.charAt(pos) == '_')) {
            throw syntaxError("invalid number literal at position " + start);
        }
        return new Token(Token.Type.NUMBER, source.substring(start, pos).replace("_", ""), start);
    }

    private Token string(int start, char quote) throws InvalidConditionException {
        StringBuilder text = new StringBuilder();
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new Token(Token.Type.STRING, text.toString(), start);
            }
            if (c == '\\' && pos < source.length()) {
                char escaped = source.charAt(pos++);
                switch (escaped) {
                    case 'n' -> text.append('\n');
                    case 't' -> text.append('\t');
                    case 'r' -> text.append('\r');
                    case '\\', '\'', '"' -> text.append(escaped);
                    default -> text.append('\\').append(escaped);
                }
            } else {
                text.append(c);
            }
        }
        throw syntaxError("unterminated string starting at position " + start);
    }

    private char peek() {
        return pos < source.length() ? source.charAt(pos) : '\0';
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private InvalidConditionException syntaxError(String detail) {
        return new InvalidConditionException("Invalid condition syntax: " + detail, source);
    }
}
