package com.obsinity.invoker.exceptions;

import java.util.List;

/** Thrown when an untagged type offers more than one constructor or factory able to take the raw value. */
public class AmbiguousConstructionException extends InvokerException {

	private final Class<?> targetType;
	private final List<String> candidates;

	public AmbiguousConstructionException(Class<?> targetType, List<String> candidates) {
		super("Ambiguous factories for " + targetType.getName() + " " + candidates
				+ "; add @UriVarFactory(...) to disambiguate.");
		this.targetType = targetType;
		this.candidates = List.copyOf(candidates);
	}

	public Class<?> targetType() {
		return targetType;
	}

	public List<String> candidates() {
		return candidates;
	}
}
