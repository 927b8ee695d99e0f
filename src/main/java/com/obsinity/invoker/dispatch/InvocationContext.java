package com.obsinity.invoker.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.obsinity.invoker.model.Operation;
import com.obsinity.invoker.model.RequestCarrier;

/**
 * Per-call view handed to parameter resolvers. Built fresh for every invocation and never shared.
 *
 * @param rawNamedValues merged URI variables
 * @param payload input of a write call, {@code null} for reads
 * @param carrier the request carrier
 * @param operation the matched operation, may be {@code null}
 */
public record InvocationContext(
		Map<String, Object> rawNamedValues, Object payload, RequestCarrier carrier, Operation operation) {

	public InvocationContext {
		rawNamedValues = (rawNamedValues == null)
				? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(rawNamedValues));
	}

	public boolean hasNamedValue(String key) {
		return rawNamedValues.containsKey(key);
	}

	public Object namedValue(String key) {
		return rawNamedValues.get(key);
	}
}
