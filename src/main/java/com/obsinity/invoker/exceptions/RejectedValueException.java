package com.obsinity.invoker.exceptions;

/** Thrown when a raw value does not satisfy the declared type it must be bound to. */
public class RejectedValueException extends InvokerException {

	private final Object value;

	public RejectedValueException(String message, Object value) {
		super(message);
		this.value = value;
	}

	public Object value() {
		return value;
	}
}
