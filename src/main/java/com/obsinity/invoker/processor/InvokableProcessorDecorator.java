package com.obsinity.invoker.processor;

import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.invoker.dispatch.HandlerKind;
import com.obsinity.invoker.dispatch.HandlerMethodIntrospector;
import com.obsinity.invoker.dispatch.InvocableMethod;
import com.obsinity.invoker.model.Operation;
import com.obsinity.invoker.registry.HandlerRegistry;
import com.obsinity.invoker.state.StateProcessor;

import lombok.RequiredArgsConstructor;

/**
 * Wraps the host's {@link StateProcessor}. Operations whose processor is an invokable handler are called through
 * {@link ProcessorInvoker}; everything else is passed to the wrapped processor untouched.
 */
@RequiredArgsConstructor
public class InvokableProcessorDecorator implements StateProcessor {

	private static final Logger log = LoggerFactory.getLogger(InvokableProcessorDecorator.class);

	private final StateProcessor inner;
	private final HandlerRegistry registry;
	private final HandlerMethodIntrospector introspector;
	private final ProcessorInvoker invoker;

	@Override
	public Object process(
			Object data, Operation operation, Map<String, Object> uriVariables, Map<String, Object> context) {
		String id = (operation == null) ? null : operation.getProcessor();
		if (id == null || id.isBlank() || !registry.has(id)) {
			return inner.process(data, operation, uriVariables, context);
		}

		Object handler = registry.get(id);
		Optional<InvocableMethod> invocable = introspector.find(handler);
		if (HandlerKind.classify(handler, StateProcessor.class, invocable) == HandlerKind.DYNAMIC) {
			log.debug("INVOKER: processor '{}' -> {}", id, invocable.get().debugName());
			return invoker.invoke(handler, data, operation, uriVariables, context);
		}
		log.debug("INVOKER: processor '{}' is conventional, delegating", id);
		return inner.process(data, operation, uriVariables, context);
	}

	public StateProcessor getDelegate() {
		return inner;
	}
}
