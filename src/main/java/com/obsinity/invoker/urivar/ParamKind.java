package com.obsinity.invoker.urivar;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;

/** Coarse classification of a declared parameter type, driving acceptance and coercion of raw values. */
public enum ParamKind {
	STRING,
	INTEGER,
	FLOAT,
	BOOLEAN,
	/** Java arrays, collections and maps. */
	ARRAY,
	/** {@link Object}: the untyped parameter. */
	ANY,
	/** Any other class or interface; satisfied by instances only. */
	REFERENCE;

	/** @return true for every kind the engine converts itself rather than constructing a value object. */
	public boolean isBuiltin() {
		return this != REFERENCE;
	}

	public static ParamKind of(Class<?> type) {
		if (type == null || type == Object.class) return ANY;
		if (type == String.class || type == CharSequence.class) return STRING;
		if (type == int.class || type == Integer.class
				|| type == long.class || type == Long.class
				|| type == short.class || type == Short.class
				|| type == byte.class || type == Byte.class
				|| type == BigInteger.class) {
			return INTEGER;
		}
		if (type == double.class || type == Double.class
				|| type == float.class || type == Float.class
				|| type == BigDecimal.class) {
			return FLOAT;
		}
		if (type == boolean.class || type == Boolean.class) return BOOLEAN;
		if (type.isArray() || Collection.class.isAssignableFrom(type) || Map.class.isAssignableFrom(type)) {
			return ARRAY;
		}
		return REFERENCE;
	}
}
