package io.lemon.core.condition;

/// Lexical token of the condition language.
///
/// @param type token kind
/// @param text source text of the token (unescaped content for strings)
/// @param position zero-based offset into the source
record Token(Type type, String text, int position) {

    enum Type {
        NUMBER,
        STRING,
        NAME,
        OPERATOR,
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        COMMA,
        DOT,
        END
    }

    boolean is(Type expected) {
        return type == expected;
    }

    boolean isOperator(String symbol) {
        return type == Type.OPERATOR && text.equals(symbol);
    }

    boolean isKeyword(String keyword) {
        return type == Type.NAME && text.equals(keyword);
    }

    String describe() {
        return type == Type.END ? "end of condition" : "'" + text + "'";
    }
}
