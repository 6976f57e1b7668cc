package de.netcompliance.infrastructure.resolving;

import com.google.common.base.Strings;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import de.netcompliance.core.exception.ExpressionException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;

/**
 * Recursive descent parser for conditions and template expressions.
 * <pre>
 * or      := and ('or' and)*
 * and     := not ('and' not)*
 * not     := 'not' not | compare
 * compare := postfix (op postfix)?     op: == != &lt; &lt;= &gt; &gt;= in 'not in' contains
 * postfix := primary ('|' name ('(' args ')')?)*
 * primary := number | string | true | false | null | list | '(' or ')' | path
 * </pre>
 */
public final class ExpressionParser {

    private static final Cache<String, Expression> CACHE = CacheBuilder.newBuilder()
            .maximumSize(1_000)
            .build();

    private final String source;
    private final List<Token> tokens;
    private int index;

    private ExpressionParser(final String source) {
        this.source = source;
        this.tokens = new ExpressionTokenizer(source).tokenize();
    }

    /**
     * Parses an expression, optionally wrapped in {@code {{ }}}. Results are cached by source text.
     *
     * @throws ExpressionException when the text is not a valid expression
     */
    public static Expression parse(final String expression) {
        if (Strings.isNullOrEmpty(expression) || expression.isBlank()) {
            throw new ExpressionException("Expression must not be empty");
        }
        var unwrapped = unwrap(expression.trim());
        try {
            return CACHE.get(unwrapped, () -> new ExpressionParser(unwrapped).parseAll());
        } catch (ExecutionException | UncheckedExecutionException e) {
            if (e.getCause() instanceof ExpressionException expressionException) throw expressionException;
            throw new ExpressionException("Cannot parse '%s'".formatted(unwrapped), e.getCause());
        }
    }

    public static Object evaluate(final String expression, final Map<String, Object> scope) {
        return parse(expression).evaluate(scope);
    }

    static String unwrap(final String expression) {
        if (expression.startsWith("{{") && expression.endsWith("}}") && expression.indexOf("{{", 2) < 0) {
            return expression.substring(2, expression.length() - 2).trim();
        }
        return expression;
    }

    private Expression parseAll() {
        var expression = parseOr();
        if (!peek().is(Token.Type.END)) {
            throw error("Unexpected '%s'".formatted(peek().text()));
        }
        return expression;
    }

    private Expression parseOr() {
        var left = parseAnd();
        while (peek().isKeyword("or")) {
            index++;
            left = new Expression.Or(left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        var left = parseNot();
        while (peek().isKeyword("and")) {
            index++;
            left = new Expression.And(left, parseNot());
        }
        return left;
    }

    private Expression parseNot() {
        if (peek().isKeyword("not")) {
            index++;
            return new Expression.Not(parseNot());
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        var left = parsePostfix();
        var token = peek();
        String operator = null;
        if (token.is(Token.Type.OPERATOR)) {
            operator = token.text();
            index++;
        } else if (token.isKeyword("in") || token.isKeyword("contains")) {
            operator = token.text();
            index++;
        } else if (token.isKeyword("not") && tokens.get(index + 1).isKeyword("in")) {
            operator = "not in";
            index += 2;
        } else if (token.is(Token.Type.ASSIGN)) {
            throw error("Use '==' for comparison");
        }
        if (Objects.isNull(operator)) return left;
        return new Expression.Comparison(operator, left, parsePostfix());
    }

    private Expression parsePostfix() {
        var expression = parsePrimary();
        while (peek().is(Token.Type.PIPE)) {
            index++;
            var name = expect(Token.Type.IDENTIFIER, "filter name").text();
            var arguments = new ArrayList<Expression>();
            if (peek().is(Token.Type.LEFT_PAREN)) {
                index++;
                if (!peek().is(Token.Type.RIGHT_PAREN)) {
                    arguments.add(parseOr());
                    while (peek().is(Token.Type.COMMA)) {
                        index++;
                        arguments.add(parseOr());
                    }
                }
                expect(Token.Type.RIGHT_PAREN, "')'");
            }
            expression = new Expression.Filter(name, expression, List.copyOf(arguments));
        }
        return expression;
    }

    private Expression parsePrimary() {
        var token = peek();
        switch (token.type()) {
            case NUMBER -> {
                index++;
                var number = new BigDecimal(token.text());
                return new Expression.Literal(token.text().contains(".") ? number : (Object) number.longValueExact());
            }
            case STRING -> {
                index++;
                return new Expression.Literal(token.text());
            }
            case LEFT_PAREN -> {
                index++;
                var inner = parseOr();
                expect(Token.Type.RIGHT_PAREN, "')'");
                return inner;
            }
            case LEFT_BRACKET -> {
                return parseList();
            }
            case IDENTIFIER -> {
                return parseIdentifier(token);
            }
            default -> throw error(token.is(Token.Type.END) ? "Unexpected end of expression" : "Unexpected '%s'".formatted(token.text()));
        }
    }

    private Expression parseList() {
        index++;
        var elements = new ArrayList<Expression>();
        if (!peek().is(Token.Type.RIGHT_BRACKET)) {
            elements.add(parseOr());
            while (peek().is(Token.Type.COMMA)) {
                index++;
                elements.add(parseOr());
            }
        }
        expect(Token.Type.RIGHT_BRACKET, "']'");
        return new Expression.ListLiteral(List.copyOf(elements));
    }

    private Expression parseIdentifier(final Token token) {
        index++;
        switch (token.text()) {
            case "true", "True" -> {
                return new Expression.Literal(Boolean.TRUE);
            }
            case "false", "False" -> {
                return new Expression.Literal(Boolean.FALSE);
            }
            case "null", "none", "None" -> {
                return new Expression.Literal(null);
            }
            default -> {
                // variable path below
            }
        }
        var keys = new ArrayList<>();
        while (true) {
            if (peek().is(Token.Type.DOT)) {
                index++;
                var key = peek();
                if (key.is(Token.Type.IDENTIFIER) || key.is(Token.Type.NUMBER)) {
                    index++;
                    keys.add(key.is(Token.Type.NUMBER) ? (Object) Integer.parseInt(key.text()) : key.text());
                } else {
                    throw error("Expected attribute name after '.'");
                }
            } else if (peek().is(Token.Type.LEFT_BRACKET)) {
                index++;
                var key = peek();
                if (key.is(Token.Type.STRING)) {
                    keys.add(key.text());
                } else if (key.is(Token.Type.NUMBER)) {
                    keys.add(Integer.parseInt(key.text()));
                } else {
                    throw error("Only literal subscripts are supported");
                }
                index++;
                expect(Token.Type.RIGHT_BRACKET, "']'");
            } else {
                break;
            }
        }
        if (peek().is(Token.Type.LEFT_PAREN)) {
            throw error("Function calls are not supported: '%s'".formatted(token.text()));
        }
        return new Expression.Variable(token.text(), List.copyOf(keys));
    }

    private Token peek() {
        return tokens.get(Math.min(index, tokens.size() - 1));
    }

    private Token expect(final Token.Type type, final String description) {
        var token = peek();
        if (!token.is(type)) {
            throw error("Expected %s but found '%s'".formatted(description, token.text()));
        }
        index++;
        return token;
    }

    private ExpressionException error(final String message) {
        return new ExpressionException("%s at %d in '%s'".formatted(message, peek().position(), source));
    }
}
