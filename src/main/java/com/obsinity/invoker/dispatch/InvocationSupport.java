package com.obsinity.invoker.dispatch;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

import org.springframework.util.ReflectionUtils;

import com.obsinity.invoker.exceptions.HandlerInvocationException;

/**
 * Reflective calls with exception unwrapping: runtime exceptions and errors thrown by the target propagate
 * unchanged, checked ones are wrapped in {@link HandlerInvocationException}.
 */
public final class InvocationSupport {

	private InvocationSupport() {}

	public static Object invoke(Method method, Object target, Object[] args) {
		ReflectionUtils.makeAccessible(method);
		try {
			return method.invoke(target, args);
		} catch (InvocationTargetException e) {
			throw rethrow(describe(method), e.getTargetException());
		} catch (IllegalAccessException e) {
			throw new HandlerInvocationException(describe(method), e);
		}
	}

	public static Object newInstance(Constructor<?> ctor, Object[] args) {
		ReflectionUtils.makeAccessible(ctor);
		try {
			return ctor.newInstance(args);
		} catch (InvocationTargetException e) {
			throw rethrow(ctor.getDeclaringClass().getSimpleName() + "#<init>", e.getTargetException());
		} catch (InstantiationException | IllegalAccessException e) {
			throw new HandlerInvocationException(ctor.getDeclaringClass().getSimpleName() + "#<init>", e);
		}
	}

	private static RuntimeException rethrow(String target, Throwable t) {
		if (t instanceof RuntimeException re) return re;
		if (t instanceof Error err) throw err;
		return new HandlerInvocationException(target, t);
	}

	private static String describe(Method m) {
		return m.getDeclaringClass().getSimpleName() + "#" + m.getName();
	}
}
