package de.netcompliance.infrastructure.resolving;

import de.netcompliance.core.exception.ExpressionException;

import java.util.ArrayList;
import java.util.List;

final class ExpressionTokenizer {

    private final String source;
    private int position;

    ExpressionTokenizer(final String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipWhitespace();
            if (position >= source.length()) {
                tokens.add(new Token(Token.Type.END, "", position));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = position;
        char c = source.charAt(position);
        if (Character.isDigit(c)) return number(start);
        if (c == '\'' || c == '"') return string(start, c);
        if (Character.isLetter(c) || c == '_') return identifier(start);

        var twoChars = position + 1 < source.length() ? source.substring(position, position + 2) : "";
        switch (twoChars) {
            case "==", "!=", "<=", ">=" -> {
                position += 2;
                return new Token(Token.Type.OPERATOR, twoChars, start);
            }
            default -> {
                // single character tokens below
            }
        }
        position++;
        return switch (c) {
            case '<', '>' -> new Token(Token.Type.OPERATOR, String.valueOf(c), start);
            case '=' -> new Token(Token.Type.ASSIGN, "=", start);
            case '(' -> new Token(Token.Type.LEFT_PAREN, "(", start);
            case ')' -> new Token(Token.Type.RIGHT_PAREN, ")", start);
            case '[' -> new Token(Token.Type.LEFT_BRACKET, "[", start);
            case ']' -> new Token(Token.Type.RIGHT_BRACKET, "]", start);
            case ',' -> new Token(Token.Type.COMMA, ",", start);
            case '.' -> new Token(Token.Type.DOT, ".", start);
            case '|' -> new Token(Token.Type.PIPE, "|", start);
            case '!' -> throw new ExpressionException("Use 'not' instead of '!' at %d in '%s'".formatted(start, source));
            default -> throw new ExpressionException("Unexpected character '%c' at %d in '%s'".formatted(c, start, source));
        };
    }

    private Token number(final int start) {
        while (position < source.length() && Character.isDigit(source.charAt(position))) position++;
        if (position + 1 < source.length() && source.charAt(position) == '.' && Character.isDigit(source.charAt(position + 1))) {
            position++;
            while (position < source.length() && Character.isDigit(source.charAt(position))) position++;
        }
        return new Token(Token.Type.NUMBER, source.substring(start, position), start);
    }

    private Token string(final int start, final char quote) {
        var text = new StringBuilder();
        position++;
        while (position < source.length()) {
            char c = source.charAt(position++);
            if (c == quote) return new Token(Token.Type.STRING, text.toString(), start);
            if (c == '\\' && position < source.length()) {
                char escaped = source.charAt(position++);
                text.append(switch (escaped) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    default -> escaped;
                });
            } else {
                text.append(c);
            }
        }
        throw new ExpressionException("Unterminated string starting at %d in '%s'".formatted(start, source));
    }

    private Token identifier(final int start) {
        while (position < source.length()
                && (Character.isLetterOrDigit(source.charAt(position)) || source.charAt(position) == '_' || source.charAt(position) == '-')) {
            position++;
        }
        return new Token(Token.Type.IDENTIFIER, source.substring(start, position), start);
    }

    private void skipWhitespace() {
        while (position < source.length() && Character.isWhitespace(source.charAt(position))) position++;
    }
}
