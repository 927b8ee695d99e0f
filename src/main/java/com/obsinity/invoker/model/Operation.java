package com.obsinity.invoker.model;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Metadata of the matched operation: HTTP method, URI template and the identifiers of the processor and provider
 * registered for it.
 *
 * <p>Handler parameters typed {@code Operation} (or one of its subtypes) receive the current operation.
 */
@Getter
@ToString
@SuperBuilder
public abstract class Operation {

	/** Optional operation name, e.g. {@code "user_get"}. */
	private final String name;

	private final String uriTemplate;

	/** Registry identifier of the provider serving reads for this operation. */
	private final String provider;

	/** Registry identifier of the processor serving writes for this operation. */
	private final String processor;

	/** HTTP method this operation is bound to. */
	public abstract String getMethod();

	public boolean isCollection() {
		return false;
	}
}
