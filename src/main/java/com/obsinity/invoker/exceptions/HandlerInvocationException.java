package com.obsinity.invoker.exceptions;

/** Wraps a checked exception thrown by an invokable handler or a value-object factory. */
public class HandlerInvocationException extends InvokerException {

	public HandlerInvocationException(String target, Throwable cause) {
		super("Invocation of " + target + " failed: " + cause, cause);
	}
}
