package de.netcompliance.infrastructure.resolving;

record Token(Type type, String text, int position) {

    enum Type {
        NUMBER,
        STRING,
        IDENTIFIER,
        OPERATOR,
        LEFT_PAREN,
        RIGHT_PAREN,
        LEFT_BRACKET,
        RIGHT_BRACKET,
        COMMA,
        DOT,
        PIPE,
        ASSIGN,
        END
    }

    boolean is(final Type expectedType) {
        return type == expectedType;
    }

    boolean isKeyword(final String keyword) {
        return type == Type.IDENTIFIER && text.equals(keyword);
    }
}
