package com.obsinity.invoker.processor;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import com.obsinity.invoker.dispatch.AbstractHandlerInvoker;
import com.obsinity.invoker.dispatch.ArgumentResolver;
import com.obsinity.invoker.dispatch.HandlerMethodIntrospector;
import com.obsinity.invoker.dispatch.ResultShape;
import com.obsinity.invoker.model.Operation;

/**
 * Calls an invokable processor for a write operation. The payload is recorded on the carrier under {@code data}
 * and the handler must return an object.
 */
public class ProcessorInvoker extends AbstractHandlerInvoker {

	private static final Set<ResultShape> ALLOWED = EnumSet.of(ResultShape.OBJECT);

	public ProcessorInvoker(HandlerMethodIntrospector introspector, ArgumentResolver argumentResolver) {
		super(introspector, argumentResolver);
	}

	public Object invoke(
			Object processor,
			Object data,
			Operation operation,
			Map<String, Object> uriVariables,
			Map<String, Object> context) {
		return doInvoke(processor, operation, uriVariables, context, data);
	}

	@Override
	protected String handlerKind() {
		return "processor";
	}

	@Override
	protected Set<ResultShape> allowedShapes() {
		return ALLOWED;
	}
}
