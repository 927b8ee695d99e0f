package com.obsinity.invoker.exceptions;

import java.util.Set;
import java.util.TreeSet;

/** Thrown when no resolver produced a value for a required, non-nullable handler parameter. */
public class UnresolvedParameterException extends InvokerException {

	private final String parameter;

	/** @param uriVariables names of the URI variables present in the call */
	public UnresolvedParameterException(String handler, String parameter, Class<?> type, Set<String> uriVariables) {
		super("Could not resolve argument \"" + parameter + "\" (" + type.getName() + ") of " + handler
				+ "; no resolver provided a value and the parameter is not @Nullable. No URI variable \""
				+ parameter + "\" or @UriVar key matched; URI variables: " + new TreeSet<>(uriVariables));
		this.parameter = parameter;
	}

	public String parameter() {
		return parameter;
	}
}
