package com.obsinity.invoker.exceptions;

/**
 * Base type of every configuration or programming error raised on the dynamic invocation path. None of these are
 * retried; they surface to the caller of the invoker unchanged.
 */
public abstract class InvokerException extends RuntimeException {

	protected InvokerException(String message) {
		super(message);
	}

	protected InvokerException(String message, Throwable cause) {
		super(message, cause);
	}
}
