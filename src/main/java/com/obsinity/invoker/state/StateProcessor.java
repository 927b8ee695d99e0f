package com.obsinity.invoker.state;

import java.util.Map;

import com.obsinity.invoker.model.Operation;

/** Fixed write contract: handles the input of a write operation and returns the persisted resource. */
public interface StateProcessor {

	/**
	 * @param data the deserialized input
	 * @param operation the matched operation
	 * @param uriVariables raw URI variables of the request
	 * @param context framework context; carries the request carrier under {@code "request"}
	 * @return the processed resource
	 */
	Object process(Object data, Operation operation, Map<String, Object> uriVariables, Map<String, Object> context);
}
