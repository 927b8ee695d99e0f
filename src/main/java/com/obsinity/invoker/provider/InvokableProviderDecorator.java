package com.obsinity.invoker.provider;

import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.invoker.dispatch.HandlerKind;
import com.obsinity.invoker.dispatch.HandlerMethodIntrospector;
import com.obsinity.invoker.dispatch.InvocableMethod;
import com.obsinity.invoker.model.Operation;
import com.obsinity.invoker.registry.HandlerRegistry;
import com.obsinity.invoker.state.StateProvider;

import lombok.RequiredArgsConstructor;

/** Read-side counterpart of {@code InvokableProcessorDecorator}. */
@RequiredArgsConstructor
public class InvokableProviderDecorator implements StateProvider {

	private static final Logger log = LoggerFactory.getLogger(InvokableProviderDecorator.class);

	private final StateProvider inner;
	private final HandlerRegistry registry;
	private final HandlerMethodIntrospector introspector;
	private final ProviderInvoker invoker;

	@Override
	public Object provide(Operation operation, Map<String, Object> uriVariables, Map<String, Object> context) {
		String id = (operation == null) ? null : operation.getProvider();
		if (id == null || id.isBlank() || !registry.has(id)) {
			return inner.provide(operation, uriVariables, context);
		}

		Object handler = registry.get(id);
		Optional<InvocableMethod> invocable = introspector.find(handler);
		if (HandlerKind.classify(handler, StateProvider.class, invocable) == HandlerKind.DYNAMIC) {
			log.debug("INVOKER: provider '{}' -> {}", id, invocable.get().debugName());
			return invoker.invoke(handler, operation, uriVariables, context);
		}
		log.debug("INVOKER: provider '{}' is conventional, delegating", id);
		return inner.provide(operation, uriVariables, context);
	}

	public StateProvider getDelegate() {
		return inner;
	}
}
