package com.obsinity.invoker.exceptions;

/** Thrown when the dynamic path is entered without a {@code RequestCarrier} in the framework context. */
public class MissingCarrierException extends InvokerException {

	public MissingCarrierException(String handlerKind) {
		super("No RequestCarrier in context; invokable " + handlerKind
				+ "s are carrier-only. Ensure the framework passes the request under \"request\".");
	}
}
