package com.obsinity.invoker.exceptions;

/** Thrown when a construction strategy produced something other than an instance of the exact requested type. */
public class InvalidFactoryResultException extends InvokerException {

	public InvalidFactoryResultException(Class<?> targetType, String strategy, Object produced) {
		super("Factory " + strategy + " for " + targetType.getName() + " did not return an instance of "
				+ targetType.getName() + " (got " + (produced == null ? "null" : produced.getClass().getName()) + ")");
	}
}
