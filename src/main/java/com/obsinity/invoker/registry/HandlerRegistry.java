package com.obsinity.invoker.registry;

/** Looks up handlers by the identifier an {@code Operation} names as its processor or provider. */
public interface HandlerRegistry {

	boolean has(String id);

	/** @throws IllegalArgumentException when no handler is registered under {@code id} */
	Object get(String id);
}
