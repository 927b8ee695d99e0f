package com.obsinity.invoker.exceptions;

/** Thrown when an untagged type offers no constructor or factory able to take the raw value. */
public class NoConstructionStrategyException extends InvokerException {

	private final Class<?> targetType;

	public NoConstructionStrategyException(Class<?> targetType) {
		super("No usable constructor/factory for " + targetType.getName() + ".");
		this.targetType = targetType;
	}

	public Class<?> targetType() {
		return targetType;
	}
}
