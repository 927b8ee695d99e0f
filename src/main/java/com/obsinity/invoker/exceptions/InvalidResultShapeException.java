package com.obsinity.invoker.exceptions;

/** Thrown when an invokable handler returns a value its contract does not allow. */
public class InvalidResultShapeException extends InvokerException {

	private final Object result;

	public InvalidResultShapeException(String message, Object result) {
		super(message);
		this.result = result;
	}

	public Object result() {
		return result;
	}
}
