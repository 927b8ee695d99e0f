package com.obsinity.invoker.urivar;

import java.lang.reflect.Method;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import com.obsinity.invoker.dispatch.ParameterDescriptor;
import com.obsinity.invoker.exceptions.RejectedValueException;

/**
 * Decides whether a raw value satisfies a declared parameter type, and narrows accepted values to that type.
 *
 * <p>A single declared builtin type is lenient ("coerce for me"): {@code int} takes {@code "123"}, {@code String}
 * takes {@code 42}. A union declared with {@code @UnionOf} is strict per member, with no cross-kind coercion.
 * Both the URI variable resolver and the value-object instantiator go through this class so the two never
 * disagree on what a value means.
 */
public final class TypeAcceptance {

	private static final Set<Object> TRUTHY = Set.of("true", "1", 1, 1L);
	private static final Set<Object> FALSY = Set.of("false", "0", 0, 0L);

	private static final BigInteger BYTE_MIN = BigInteger.valueOf(Byte.MIN_VALUE);
	private static final BigInteger BYTE_MAX = BigInteger.valueOf(Byte.MAX_VALUE);
	private static final BigInteger SHORT_MIN = BigInteger.valueOf(Short.MIN_VALUE);
	private static final BigInteger SHORT_MAX = BigInteger.valueOf(Short.MAX_VALUE);
	private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
	private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
	private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
	private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

	/** Digits in {@link Long#MAX_VALUE}. */
	private static final int LONG_DIGITS = 19;

	private TypeAcceptance() {}

	public static boolean accepts(ParameterDescriptor parameter, Object value) {
		return accepts(parameter.declaredTypes(), parameter.nullable(), value);
	}

	/**
	 * @param declaredTypes declared types of the parameter; more than one means a union, none means untyped
	 * @param nullable whether the parameter admits {@code null}
	 * @param value the raw value
	 */
	public static boolean accepts(List<Class<?>> declaredTypes, boolean nullable, Object value) {
		if (declaredTypes == null || declaredTypes.isEmpty()) return true;

		if (value == null) {
			if (nullable) return declaredTypes.stream().noneMatch(Class::isPrimitive);
			return declaredTypes.stream().anyMatch(t -> ParamKind.of(t) == ParamKind.ANY);
		}

		boolean union = declaredTypes.size() > 1;
		for (Class<?> type : declaredTypes) {
			if (acceptsNonNull(type, value, union)) return true;
		}
		return false;
	}

	/** Lenient single-type acceptance of a value; {@code null} is only accepted by {@link Object}. */
	public static boolean accepts(Class<?> type, Object value) {
		return accepts(List.of(type), false, value);
	}

	private static boolean acceptsNonNull(Class<?> type, Object value, boolean strict) {
		switch (ParamKind.of(type)) {
			case ANY:
				return true;
			case STRING:
				if (type.isInstance(value)) return true;
				return !strict && (isIntegral(value) || isFloating(value) || value instanceof Boolean
						|| value instanceof Character || isStringable(value));
			case INTEGER: {
				if (isIntegral(value)) return fits(type, toBigInteger(value));
				if (strict || !(value instanceof String)) return false;
				BigInteger truncated = truncate(type, (String) value);
				return truncated != null && fits(type, truncated);
			}
			case FLOAT:
				if (isFloating(value)) return true;
				return !strict && (isIntegral(value) || (value instanceof String && parseNumeric((String) value) != null));
			case BOOLEAN:
				if (value instanceof Boolean) return true;
				return !strict && (TRUTHY.contains(value) || FALSY.contains(value));
			default:
				return ClassUtils.resolvePrimitiveIfNecessary(type).isInstance(value);
		}
	}

	/**
	 * Narrows an accepted value to {@code target}: numeric strings become the exact integral or floating type,
	 * scalars and stringable objects become {@code String}, the canonical truthy set becomes {@code Boolean}.
	 * Values of non-builtin kinds are returned as-is.
	 *
	 * @throws RejectedValueException if the value cannot be narrowed
	 */
	public static Object coerce(Class<?> target, Object value) {
		if (value == null) return null;
		switch (ParamKind.of(target)) {
			case STRING:
				return target.isInstance(value) ? value : String.valueOf(value);
			case INTEGER:
				return toIntegral(target, value);
			case FLOAT:
				return toFloating(target, value);
			case BOOLEAN:
				if (value instanceof Boolean) return value;
				if (TRUTHY.contains(value)) return Boolean.TRUE;
				if (FALSY.contains(value)) return Boolean.FALSE;
				throw rejected(target, value);
			default:
				return value;
		}
	}

	/* --- helpers --- */

	private static Object toIntegral(Class<?> target, Object value) {
		BigInteger n;
		if (isIntegral(value)) {
			n = toBigInteger(value);
		} else {
			n = (value instanceof String s) ? truncate(target, s) : null;
			if (n == null) throw rejected(target, value);
		}
		if (!fits(target, n)) throw rejected(target, value);

		Class<?> boxed = ClassUtils.resolvePrimitiveIfNecessary(target);
		if (boxed == Integer.class) return n.intValue();
		if (boxed == Long.class) return n.longValue();
		if (boxed == Short.class) return n.shortValue();
		if (boxed == Byte.class) return n.byteValue();
		return n;
	}

	private static Object toFloating(Class<?> target, Object value) {
		Class<?> boxed = ClassUtils.resolvePrimitiveIfNecessary(target);
		if (value instanceof Number num && !(value instanceof BigDecimal)) {
			if (boxed == Double.class) return num.doubleValue();
			if (boxed == Float.class) return num.floatValue();
			if (value instanceof BigInteger bi) return new BigDecimal(bi);
			if (isIntegral(value)) return BigDecimal.valueOf(num.longValue());
			return BigDecimal.valueOf(num.doubleValue());
		}

		BigDecimal d;
		if (value instanceof BigDecimal bd) d = bd;
		else if (value instanceof String s) d = parseNumeric(s);
		else d = null;
		if (d == null) throw rejected(target, value);

		if (boxed == Double.class) return d.doubleValue();
		if (boxed == Float.class) return d.floatValue();
		return d;
	}

	private static boolean isIntegral(Object v) {
		return v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte
				|| v instanceof BigInteger;
	}

	private static boolean isFloating(Object v) {
		return v instanceof Double || v instanceof Float || v instanceof BigDecimal;
	}

	private static BigInteger toBigInteger(Object v) {
		return (v instanceof BigInteger bi) ? bi : BigInteger.valueOf(((Number) v).longValue());
	}

	private static boolean fits(Class<?> type, BigInteger n) {
		Class<?> boxed = ClassUtils.resolvePrimitiveIfNecessary(type);
		if (boxed == Integer.class) return n.compareTo(INT_MIN) >= 0 && n.compareTo(INT_MAX) <= 0;
		if (boxed == Long.class) return n.compareTo(LONG_MIN) >= 0 && n.compareTo(LONG_MAX) <= 0;
		if (boxed == Short.class) return n.compareTo(SHORT_MIN) >= 0 && n.compareTo(SHORT_MAX) <= 0;
		if (boxed == Byte.class) return n.compareTo(BYTE_MIN) >= 0 && n.compareTo(BYTE_MAX) <= 0;
		return true;
	}

	/**
	 * Parses {@code s} and truncates it toward zero. Returns {@code null} when it is not numeric or its integer part
	 * has more digits than the target holds; a {@code BigInteger} target holds no more digits than were written.
	 */
	private static BigInteger truncate(Class<?> target, String s) {
		BigDecimal d = parseNumeric(s);
		if (d == null) return null;
		int integerDigits = d.precision() - d.scale();
		if (d.signum() == 0 || integerDigits <= 0) return BigInteger.ZERO;
		int limit = (target == BigInteger.class) ? Math.max(LONG_DIGITS, s.length()) : LONG_DIGITS;
		if (integerDigits > limit) return null;
		return d.setScale(0, RoundingMode.DOWN).toBigInteger();
	}

	/** Decimal notation with optional sign, fraction and exponent, surrounding whitespace allowed. */
	private static BigDecimal parseNumeric(String s) {
		String t = s.strip();
		if (t.isEmpty()) return null;
		try {
			return new BigDecimal(t);
		} catch (NumberFormatException e) {
			return null;
		}
	}

	/** Objects that declare their own {@code toString()}; containers never count. */
	private static boolean isStringable(Object v) {
		if (v.getClass().isArray() || v instanceof Collection<?> || v instanceof Map<?, ?>) return false;
		Method m = ReflectionUtils.findMethod(v.getClass(), "toString");
		return m != null && m.getDeclaringClass() != Object.class;
	}

	private static RejectedValueException rejected(Class<?> target, Object value) {
		return new RejectedValueException(
				"Value " + describe(value) + " cannot be converted to " + target.getName(), value);
	}

	static String describe(Object value) {
		if (value == null) return "null";
		return "'" + value + "' (" + value.getClass().getSimpleName() + ")";
	}
}
