package com.obsinity.invoker.dispatch;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.invoker.exceptions.InvalidResultShapeException;
import com.obsinity.invoker.exceptions.MissingCarrierException;
import com.obsinity.invoker.model.Operation;
import com.obsinity.invoker.model.RequestCarrier;

/**
 * Shared call path of the invokable processor and provider bridges: record the call on the request carrier,
 * resolve the handler's arguments from it, invoke, and check the shape of the result.
 */
public abstract class AbstractHandlerInvoker {

	private static final Logger log = LoggerFactory.getLogger(AbstractHandlerInvoker.class);

	private final HandlerMethodIntrospector introspector;
	private final ArgumentResolver argumentResolver;

	protected AbstractHandlerInvoker(HandlerMethodIntrospector introspector, ArgumentResolver argumentResolver) {
		this.introspector = introspector;
		this.argumentResolver = argumentResolver;
	}

	/** "processor" or "provider", used in messages. */
	protected abstract String handlerKind();

	/** Shapes this kind of handler may return. */
	protected abstract Set<ResultShape> allowedShapes();

	protected final Object doInvoke(
			Object handler,
			Operation operation,
			Map<String, Object> uriVariables,
			Map<String, Object> context,
			Object payload) {

		RequestCarrier carrier = requireCarrier(context);
		InvocableMethod invocable = introspector
				.find(handler)
				.orElseThrow(() -> new IllegalStateException("Invalid handler ["
						+ handler.getClass().getSimpleName() + "]: no @Invoke method or single public invoke method"));

		Map<String, Object> vars = (uriVariables == null) ? Map.of() : uriVariables;
		vars.forEach(carrier::setAttributeIfAbsent);
		Map<String, Object> routeParams = mergeRouteParams(carrier, vars);
		carrier.setAttribute(RequestCarrier.ROUTE_PARAMS, routeParams);
		carrier.setAttribute(RequestCarrier.OPERATION, operation);
		if (payload != null) {
			carrier.setAttribute(RequestCarrier.DATA, payload);
		}

		// the payload comes from the call only; a carrier attribute named "data" may be a URI variable
		InvocationContext ctx = new InvocationContext(routeParams, payload, carrier, operation);
		Object[] args = argumentResolver.resolveArguments(invocable, ctx);

		log.debug("INVOKER: invoking {} {} with {} arg(s)", handlerKind(), invocable.debugName(), args.length);
		Object result = invocable.invoke(handler, args);

		ResultShape shape = ResultShape.of(result);
		if (!allowedShapes().contains(shape)) {
			throw new InvalidResultShapeException(
					"Invokable " + handlerKind() + " " + invocable.debugName() + " returned " + describe(result)
							+ "; allowed: " + allowedShapes(),
					result);
		}
		return result;
	}

	private RequestCarrier requireCarrier(Map<String, Object> context) {
		Object candidate = (context == null) ? null : context.get(RequestCarrier.CONTEXT_KEY);
		if (candidate instanceof RequestCarrier carrier) return carrier;
		throw new MissingCarrierException(handlerKind());
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> mergeRouteParams(RequestCarrier carrier, Map<String, Object> vars) {
		Map<String, Object> merged = new LinkedHashMap<>();
		if (carrier.getAttribute(RequestCarrier.ROUTE_PARAMS) instanceof Map<?, ?> existing) {
			merged.putAll((Map<String, Object>) existing);
		}
		merged.putAll(vars);
		return merged;
	}

	private static String describe(Object result) {
		return (result == null) ? "null" : result.getClass().getSimpleName() + " (" + ResultShape.of(result) + ")";
	}
}
