package com.obsinity.invoker.dispatch;

import java.util.Map;

/** Coarse shape of a handler's return value. */
public enum ResultShape {
	NULL,
	/** Strings, numbers, booleans and characters. */
	SCALAR,
	/** Arrays, iterables and maps. */
	COLLECTION,
	OBJECT;

	public static ResultShape of(Object result) {
		if (result == null) return NULL;
		if (result instanceof CharSequence || result instanceof Number || result instanceof Boolean
				|| result instanceof Character) {
			return SCALAR;
		}
		if (result.getClass().isArray() || result instanceof Iterable<?> || result instanceof Map<?, ?>) {
			return COLLECTION;
		}
		return OBJECT;
	}
}
