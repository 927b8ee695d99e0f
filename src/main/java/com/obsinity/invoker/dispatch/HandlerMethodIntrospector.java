package com.obsinity.invoker.dispatch;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import com.obsinity.invoker.annotations.Invoke;

/**
 * Finds the entry point of a handler that is called through dynamic parameter binding.
 *
 * <p>Rules, applied to the user class (CGLIB proxies unwrapped):
 *
 * <ul>
 *   <li>exactly one public method annotated {@link Invoke}, directly or on a method it overrides: that method;
 *       two or more is a configuration error, as is {@code @Invoke} on a non-public or static method
 *   <li>no {@code @Invoke}: the single public instance method named {@code invoke}, if there is exactly one
 *   <li>otherwise the handler is not invocable
 * </ul>
 *
 * Results are cached per class.
 */
public class HandlerMethodIntrospector {

	static final String CONVENTIONAL_NAME = "invoke";

	private final Map<Class<?>, Optional<InvocableMethod>> cache = new ConcurrentHashMap<>();

	public Optional<InvocableMethod> find(Object handler) {
		if (handler == null) return Optional.empty();
		return find(ClassUtils.getUserClass(handler));
	}

	public Optional<InvocableMethod> find(Class<?> handlerClass) {
		return cache.computeIfAbsent(handlerClass, HandlerMethodIntrospector::introspect);
	}

	private static Optional<InvocableMethod> introspect(Class<?> userClass) {
		ReflectionUtils.doWithMethods(
				userClass,
				m -> {
					throw new IllegalStateException("Invalid handler [" + userClass.getSimpleName() + "#" + m.getName()
							+ "]: @Invoke method must be public and non-static");
				},
				m -> m.isAnnotationPresent(Invoke.class)
						&& (!Modifier.isPublic(m.getModifiers()) || Modifier.isStatic(m.getModifiers())));

		List<Method> publicMethods = Arrays.stream(userClass.getMethods())
				.filter(m -> !m.isSynthetic() && !m.isBridge() && !Modifier.isStatic(m.getModifiers()))
				.toList();

		List<Method> annotated = publicMethods.stream()
				.filter(m -> AnnotatedElementUtils.hasAnnotation(m, Invoke.class))
				.toList();
		if (annotated.size() > 1) {
			throw new IllegalStateException("Invalid handler [" + userClass.getSimpleName()
					+ "]: more than one @Invoke method -> "
					+ annotated.stream().map(Method::getName).collect(Collectors.joining(", ")));
		}
		if (annotated.size() == 1) {
			return Optional.of(InvocableMethod.of(userClass, annotated.get(0)));
		}

		List<Method> named = publicMethods.stream().filter(m -> m.getName().equals(CONVENTIONAL_NAME)).toList();
		if (named.size() == 1) {
			return Optional.of(InvocableMethod.of(userClass, named.get(0)));
		}
		return Optional.empty();
	}
}
