package de.netcompliance.infrastructure.resolving;

import de.netcompliance.core.exception.ExpressionException;
import de.netcompliance.infrastructure.utils.CanonicalForm;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Truthiness, equality and ordering rules of the expression language.
 */
public final class Values {

    public static boolean isTruthy(final Object value) {
        if (Objects.isNull(value)) return false;
        if (value instanceof Boolean bool) return bool;
        if (value instanceof Number number) return toDecimal(number).signum() != 0;
        return !CanonicalForm.isEmpty(value);
    }

    public static boolean looseEquals(final Object left, final Object right) {
        if (Objects.isNull(left) || Objects.isNull(right)) return Objects.isNull(left) && Objects.isNull(right);
        var leftNumber = asDecimal(left);
        var rightNumber = asDecimal(right);
        if (Objects.nonNull(leftNumber) && Objects.nonNull(rightNumber)
                && (left instanceof Number || right instanceof Number)) {
            return leftNumber.compareTo(rightNumber) == 0;
        }
        if (left instanceof Boolean || right instanceof Boolean) {
            return Objects.equals(String.valueOf(left).toLowerCase(), String.valueOf(right).toLowerCase());
        }
        return CanonicalForm.of(left).equals(CanonicalForm.of(right));
    }

    public static int compare(final Object left, final Object right) {
        var leftNumber = asDecimal(left);
        var rightNumber = asDecimal(right);
        if (Objects.nonNull(leftNumber) && Objects.nonNull(rightNumber)) return leftNumber.compareTo(rightNumber);
        if (left instanceof CharSequence && right instanceof CharSequence) {
            return left.toString().compareTo(right.toString());
        }
        throw new ExpressionException("Cannot order %s and %s".formatted(describe(left), describe(right)));
    }

    public static boolean contains(final Object container, final Object item) {
        if (Objects.isNull(container)) return false;
        if (container instanceof Collection<?> collection) {
            return collection.stream().anyMatch(element -> looseEquals(element, item));
        }
        if (container instanceof Map<?, ?> map) {
            return map.containsKey(CanonicalForm.of(item));
        }
        return CanonicalForm.of(container).contains(CanonicalForm.of(item));
    }

    public static String render(final Object value) {
        return CanonicalForm.of(value);
    }

    static BigDecimal asDecimal(final Object value) {
        if (value instanceof Number number) return toDecimal(number);
        if (value instanceof CharSequence text) {
            try {
                return new BigDecimal(text.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static BigDecimal toDecimal(final Number number) {
        return number instanceof BigDecimal decimal ? decimal : new BigDecimal(number.toString());
    }

    private static String describe(final Object value) {
        return Objects.isNull(value) ? "null" : value.getClass().getSimpleName() + " '" + value + "'";
    }

    private Values() {}
}
