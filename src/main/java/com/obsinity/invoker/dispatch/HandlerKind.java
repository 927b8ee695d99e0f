package com.obsinity.invoker.dispatch;

import java.util.Optional;

/** Which path a registered handler takes for a given fixed contract. */
public enum HandlerKind {
	/** Implements the fixed contract, or exposes no invocable method: handled by the wrapped implementation. */
	CONVENTIONAL,
	/** Exposes an invocable method and does not implement the contract: called through parameter binding. */
	DYNAMIC;

	public static HandlerKind classify(Object handler, Class<?> contract, Optional<InvocableMethod> invocable) {
		if (handler == null || contract.isInstance(handler)) return CONVENTIONAL;
		return invocable.isPresent() ? DYNAMIC : CONVENTIONAL;
	}
}
