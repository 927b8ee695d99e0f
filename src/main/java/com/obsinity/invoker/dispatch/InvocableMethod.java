package com.obsinity.invoker.dispatch;

import java.lang.reflect.Method;
import java.util.List;

/**
 * Precompiled entry point of an invokable handler, discovered once per handler class.
 *
 * @param handlerClass user class of the handler (proxies unwrapped)
 * @param method the entry point
 * @param parameters its parameters in declaration order
 */
public record InvocableMethod(Class<?> handlerClass, Method method, List<ParameterDescriptor> parameters) {

	public static InvocableMethod of(Class<?> handlerClass, Method method) {
		return new InvocableMethod(handlerClass, method, ParameterDescriptor.describeAll(method));
	}

	public Object invoke(Object handler, Object[] args) {
		return InvocationSupport.invoke(method, handler, args);
	}

	/** Human-friendly id for logs and errors, e.g. {@code CreateUserProcessor#create}. */
	public String debugName() {
		return handlerClass.getSimpleName() + "#" + method.getName();
	}
}
