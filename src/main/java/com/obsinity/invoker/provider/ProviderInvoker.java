package com.obsinity.invoker.provider;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import com.obsinity.invoker.dispatch.AbstractHandlerInvoker;
import com.obsinity.invoker.dispatch.ArgumentResolver;
import com.obsinity.invoker.dispatch.HandlerMethodIntrospector;
import com.obsinity.invoker.dispatch.ResultShape;
import com.obsinity.invoker.model.Operation;

/** Calls an invokable provider for a read operation. It may return an object, a collection or nothing. */
public class ProviderInvoker extends AbstractHandlerInvoker {

	private static final Set<ResultShape> ALLOWED =
			EnumSet.of(ResultShape.NULL, ResultShape.OBJECT, ResultShape.COLLECTION);

	public ProviderInvoker(HandlerMethodIntrospector introspector, ArgumentResolver argumentResolver) {
		super(introspector, argumentResolver);
	}

	public Object invoke(
			Object provider, Operation operation, Map<String, Object> uriVariables, Map<String, Object> context) {
		return doInvoke(provider, operation, uriVariables, context, null);
	}

	@Override
	protected String handlerKind() {
		return "provider";
	}

	@Override
	protected Set<ResultShape> allowedShapes() {
		return ALLOWED;
	}
}
