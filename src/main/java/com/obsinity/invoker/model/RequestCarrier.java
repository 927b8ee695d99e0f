package com.obsinity.invoker.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request-scoped attribute bag threaded through a single invocation.
 *
 * <p>The host framework owns the carrier; the invokers only merge URI variables into it and record the reserved
 * entries {@link #ROUTE_PARAMS}, {@link #OPERATION} and {@link #DATA} for parameter resolvers to read back.
 *
 * <h2>Thread-safety</h2>
 *
 * Not thread-safe. A carrier belongs to exactly one in-flight request.
 */
public class RequestCarrier {

	/** Context map key under which the fixed contracts pass the carrier. */
	public static final String CONTEXT_KEY = "request";

	/** Merged URI variables of the current call ({@code Map<String, Object>}). */
	public static final String ROUTE_PARAMS = "route-params";

	/** The matched {@link Operation}. */
	public static final String OPERATION = "operation";

	/** The deserialized input of a write call. */
	public static final String DATA = "data";

	private final Map<String, Object> attributes;

	public RequestCarrier() {
		this.attributes = new LinkedHashMap<>();
	}

	public RequestCarrier(Map<String, ?> initialAttributes) {
		this.attributes = new LinkedHashMap<>(initialAttributes);
	}

	public boolean hasAttribute(String key) {
		return attributes.containsKey(key);
	}

	public Object getAttribute(String key) {
		return attributes.get(key);
	}

	public void setAttribute(String key, Object value) {
		attributes.put(key, value);
	}

	/** Write-once: keeps an existing entry (even a {@code null} one) untouched. */
	public boolean setAttributeIfAbsent(String key, Object value) {
		if (attributes.containsKey(key)) return false;
		attributes.put(key, value);
		return true;
	}

	public Object removeAttribute(String key) {
		return attributes.remove(key);
	}

	public Map<String, Object> getAttributes() {
		return Collections.unmodifiableMap(attributes);
	}

	@Override
	public String toString() {
		return "RequestCarrier" + attributes.keySet();
	}
}
