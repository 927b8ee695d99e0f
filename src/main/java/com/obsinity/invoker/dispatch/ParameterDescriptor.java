package com.obsinity.invoker.dispatch;

import java.lang.annotation.Annotation;
import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.core.annotation.MergedAnnotation;
import org.springframework.core.annotation.MergedAnnotations;
import org.springframework.util.ClassUtils;

import com.obsinity.invoker.annotations.UnionOf;
import com.obsinity.invoker.annotations.UriVar;

/**
 * Immutable, precompiled description of one parameter of a handler method, constructor or factory.
 *
 * @param name parameter name (compiled with {@code -parameters}; otherwise {@code argN})
 * @param index zero-based position
 * @param type erased Java type
 * @param genericType full generic type
 * @param declaredTypes accepted types; a single entry unless the parameter carries {@link UnionOf}
 * @param nullable true when the parameter carries a {@code @Nullable} annotation (any package)
 * @param bindingTag URI variable key from {@link UriVar}, or {@code null}
 * @param variadic true for a trailing varargs parameter
 * @param annotations annotations present on the parameter, for external resolvers
 */
public record ParameterDescriptor(
		String name,
		int index,
		Class<?> type,
		Type genericType,
		List<Class<?>> declaredTypes,
		boolean nullable,
		String bindingTag,
		boolean variadic,
		List<Annotation> annotations) {

	private static final ParameterNameDiscoverer NAMES = new DefaultParameterNameDiscoverer();

	public boolean isUnion() {
		return declaredTypes.size() > 1;
	}

	public boolean hasBindingTag() {
		return bindingTag != null;
	}

	public <A extends Annotation> A getAnnotation(Class<A> annotationType) {
		for (Annotation a : annotations) {
			if (annotationType.isInstance(a)) return annotationType.cast(a);
		}
		return null;
	}

	/** Describes every parameter of {@code executable}, in declaration order. */
	public static List<ParameterDescriptor> describeAll(Executable executable) {
		Parameter[] params = executable.getParameters();
		String[] names = discoverNames(executable);
		List<ParameterDescriptor> out = new ArrayList<>(params.length);
		for (int i = 0; i < params.length; i++) {
			String name = (names != null && i < names.length) ? names[i] : params[i].getName();
			out.add(describe(executable, params[i], i, name));
		}
		return List.copyOf(out);
	}

	private static ParameterDescriptor describe(Executable owner, Parameter p, int index, String name) {
		Class<?> type = p.getType();
		List<Annotation> anns = Arrays.asList(p.getAnnotations());

		return new ParameterDescriptor(
				name,
				index,
				type,
				p.getParameterizedType(),
				declaredTypes(owner, p, type),
				!type.isPrimitive() && hasNullableAnnotation(anns),
				bindingTag(p),
				owner.isVarArgs() && index == owner.getParameterCount() - 1,
				List.copyOf(anns));
	}

	private static List<Class<?>> declaredTypes(Executable owner, Parameter p, Class<?> type) {
		UnionOf union = p.getAnnotation(UnionOf.class);
		if (union == null) return List.of(type);

		Class<?>[] members = union.value();
		if (members.length == 0) {
			throw new IllegalStateException(errPrefix(owner) + "@UnionOf on parameter '" + p.getName()
					+ "' must declare at least one type");
		}
		Class<?> boxedParam = ClassUtils.resolvePrimitiveIfNecessary(type);
		for (Class<?> m : members) {
			if (!boxedParam.isAssignableFrom(ClassUtils.resolvePrimitiveIfNecessary(m))) {
				throw new IllegalStateException(errPrefix(owner) + "@UnionOf member " + m.getSimpleName()
						+ " is not assignable to parameter type " + type.getSimpleName());
			}
		}
		return List.of(members);
	}

	private static String bindingTag(Parameter p) {
		MergedAnnotation<UriVar> ma = MergedAnnotations.from(p).get(UriVar.class);
		if (!ma.isPresent()) return null;
		String key = ma.getString("value");
		return (key == null || key.isBlank()) ? null : key;
	}

	/** Same convention as Spring's {@code MethodParameter}: any annotation whose simple name is "Nullable". */
	private static boolean hasNullableAnnotation(List<Annotation> anns) {
		for (Annotation a : anns) {
			if ("Nullable".equals(a.annotationType().getSimpleName())) return true;
		}
		return false;
	}

	private static String[] discoverNames(Executable e) {
		if (e instanceof Method m) return NAMES.getParameterNames(m);
		if (e instanceof Constructor<?> c) return NAMES.getParameterNames(c);
		return null;
	}

	static String errPrefix(Executable e) {
		return "Invalid handler [" + e.getDeclaringClass().getSimpleName() + "#" + e.getName() + "]: ";
	}
}
