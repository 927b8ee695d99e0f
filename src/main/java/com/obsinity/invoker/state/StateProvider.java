package com.obsinity.invoker.state;

import java.util.Map;

import com.obsinity.invoker.model.Operation;

/** Fixed read contract: returns a resource, a collection of resources, or {@code null} when nothing matches. */
public interface StateProvider {

	Object provide(Operation operation, Map<String, Object> uriVariables, Map<String, Object> context);
}
