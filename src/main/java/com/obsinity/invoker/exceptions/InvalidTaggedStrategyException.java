package com.obsinity.invoker.exceptions;

/** Thrown when the method named by {@code @UriVarFactory} is missing, overloaded, or has the wrong shape. */
public class InvalidTaggedStrategyException extends InvokerException {

	private final Class<?> targetType;
	private final String method;

	public InvalidTaggedStrategyException(Class<?> targetType, String method, String reason) {
		super("Invalid @UriVarFactory " + targetType.getName() + "#" + method + "(): " + reason);
		this.targetType = targetType;
		this.method = method;
	}

	public Class<?> targetType() {
		return targetType;
	}

	public String method() {
		return method;
	}
}
