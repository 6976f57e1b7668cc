package de.netcompliance.infrastructure.resolving;

import de.netcompliance.core.exception.ExpressionException;
import de.netcompliance.infrastructure.utils.CanonicalForm;
import de.netcompliance.infrastructure.utils.ResolverUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiled expression of the restricted condition language. Evaluation only reads the scope.
 */
public interface Expression {

    Object evaluate(final Map<String, Object> scope);

    default boolean test(final Map<String, Object> scope) {
        return Values.isTruthy(evaluate(scope));
    }

    record Literal(Object value) implements Expression {
        @Override
        public Object evaluate(final Map<String, Object> scope) {
            return value;
        }
    }

    record Variable(String name, List<Object> keys) implements Expression {
        @Override
        public Object evaluate(final Map<String, Object> scope) {
            Object current = scope.get(name);
            for (Object key : keys) {
                current = ResolverUtils.getChild(current, key);
                if (Objects.isNull(current)) return null;
            }
            return current;
        }
    }

    record ListLiteral(List<Expression> elements) implements Expression {
        @Override
        public Object evaluate(final Map<String, Object> scope) {
            var values = new ArrayList<>();
            elements.forEach(element -> values.add(element.evaluate(scope)));
            return values;
        }
    }

    record Not(Expression operand) implements Expression {
        @Override
        public Object evaluate(final Map<String, Object> scope) {
            return !operand.test(scope);
        }
    }

    record And(Expression left, Expression right) implements Expression {
        @Override
        public Object evaluate(final Map<String, Object> scope) {
            return left.test(scope) && right.test(scope);
        }
    }

    record Or(Expression left, Expression right) implements Expression {
        @Override
        public Object evaluate(final Map<String, Object> scope) {
            return left.test(scope) || right.test(scope);
        }
    }

    record Comparison(String operator, Expression left, Expression right) implements Expression {
        @Override
        public Object evaluate(final Map<String, Object> scope) {
            var l = left.evaluate(scope);
            var r = right.evaluate(scope);
            return switch (operator) {
                case "==" -> Values.looseEquals(l, r);
                case "!=" -> !Values.looseEquals(l, r);
                case "<" -> Values.compare(l, r) < 0;
                case "<=" -> Values.compare(l, r) <= 0;
                case ">" -> Values.compare(l, r) > 0;
                case ">=" -> Values.compare(l, r) >= 0;
                case "in" -> Values.contains(r, l);
                case "not in" -> !Values.contains(r, l);
                case "contains" -> Values.contains(l, r);
                default -> throw new ExpressionException("Unknown operator '%s'".formatted(operator));
            };
        }
    }

    /**
     * {@code value | filter} or {@code value | filter(argument)}.
     */
    record Filter(String name, Expression input, List<Expression> arguments) implements Expression {
        @Override
        public Object evaluate(final Map<String, Object> scope) {
            var value = input.evaluate(scope);
            return switch (name) {
                case "length", "count" -> value instanceof CharSequence text ? text.length() : CanonicalForm.size(value);
                case "lower" -> Objects.isNull(value) ? null : Values.render(value).toLowerCase();
                case "upper" -> Objects.isNull(value) ? null : Values.render(value).toUpperCase();
                case "trim" -> Objects.isNull(value) ? null : Values.render(value).trim();
                case "string" -> Values.render(value);
                case "int" -> {
                    var decimal = Values.asDecimal(value);
                    yield Objects.isNull(decimal) ? 0 : decimal.intValue();
                }
                case "default" -> Objects.isNull(value) && !arguments.isEmpty() ? arguments.get(0).evaluate(scope) : value;
                case "join" -> value instanceof Collection<?> collection
                        ? String.join(arguments.isEmpty() ? "" : Values.render(arguments.get(0).evaluate(scope)),
                                collection.stream().map(Values::render).toList())
                        : Values.render(value);
                default -> throw new ExpressionException("Unknown filter '%s'".formatted(name));
            };
        }
    }
}
