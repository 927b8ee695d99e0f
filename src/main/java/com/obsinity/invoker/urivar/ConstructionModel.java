package com.obsinity.invoker.urivar;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.core.annotation.MergedAnnotation;
import org.springframework.core.annotation.MergedAnnotations;

import com.obsinity.invoker.annotations.UriVarFactory;
import com.obsinity.invoker.dispatch.InvocationSupport;
import com.obsinity.invoker.dispatch.ParameterDescriptor;

/**
 * Static construction facts about a value-object type, computed once per type.
 *
 * <p>Holds either the strategy named by {@link UriVarFactory} (or the reason it is invalid), or every
 * shape-eligible constructor and static factory. Whether a candidate accepts a given raw value is decided per call.
 *
 * @param type the value-object type
 * @param taggedMethod method name from {@link UriVarFactory}, or {@code null} when the type is untagged
 * @param tagged the validated tagged strategy, {@code null} when untagged or invalid
 * @param taggedError why the tagged method is unusable, {@code null} otherwise
 * @param candidates shape-eligible constructors and factories of an untagged type
 */
record ConstructionModel(
		Class<?> type,
		String taggedMethod,
		Candidate tagged,
		String taggedError,
		List<Candidate> candidates) {

	boolean isTagged() {
		return taggedMethod != null;
	}

	static ConstructionModel introspect(Class<?> type) {
		MergedAnnotation<UriVarFactory> tag = MergedAnnotations.from(type).get(UriVarFactory.class);
		if (tag.isPresent()) {
			return introspectTagged(type, tag.getString("value"));
		}

		List<Candidate> candidates = new ArrayList<>();
		if (!Modifier.isAbstract(type.getModifiers())) {
			for (Constructor<?> ctor : type.getConstructors()) {
				if (requiredParameterCount(ctor) == 1) candidates.add(Candidate.of(ctor));
			}
		}
		for (Method m : type.getDeclaredMethods()) {
			if (m.isSynthetic() || m.isBridge()) continue;
			int mod = m.getModifiers();
			if (!Modifier.isPublic(mod) || !Modifier.isStatic(mod)) continue;
			if (m.getReturnType() != type) continue;
			if (requiredParameterCount(m) != 1) continue;
			candidates.add(Candidate.of(m));
		}
		return new ConstructionModel(type, null, null, null, List.copyOf(candidates));
	}

	private static ConstructionModel introspectTagged(Class<?> type, String name) {
		if (name == null || name.isBlank()) {
			return new ConstructionModel(type, "", null, "method name must not be blank", List.of());
		}
		List<Method> named = Arrays.stream(type.getDeclaredMethods())
				.filter(m -> m.getName().equals(name) && !m.isSynthetic() && !m.isBridge())
				.toList();

		String error = null;
		if (named.isEmpty()) {
			error = "no such method";
		} else if (named.size() > 1) {
			error = "method is overloaded (" + named.size() + " declarations)";
		} else {
			Method m = named.get(0);
			int count = requiredParameterCount(m);
			if (!Modifier.isPublic(m.getModifiers())) error = "method must be public";
			else if (!Modifier.isStatic(m.getModifiers())) error = "method must be static";
			else if (count != 1) error = "method must take exactly one required parameter (takes " + count + ")";
		}

		Candidate tagged = (error == null) ? Candidate.of(named.get(0)) : null;
		return new ConstructionModel(type, name, tagged, error, List.of());
	}

	/** Trailing varargs are optional. */
	static int requiredParameterCount(Executable e) {
		return e.isVarArgs() ? e.getParameterCount() - 1 : e.getParameterCount();
	}

	/**
	 * A single-argument construction strategy.
	 *
	 * @param executable constructor or static factory
	 * @param parameter descriptor of its one required parameter
	 */
	record Candidate(Executable executable, ParameterDescriptor parameter) {

		static Candidate of(Executable e) {
			return new Candidate(e, ParameterDescriptor.describeAll(e).get(0));
		}

		boolean accepts(Object raw) {
			return TypeAcceptance.accepts(parameter, raw);
		}

		/** Coerces against this candidate's own parameter kind, then invokes it. */
		Object create(Object raw) {
			Object arg = parameter.isUnion() ? raw : TypeAcceptance.coerce(parameter.type(), raw);
			Object[] args = new Object[executable.getParameterCount()];
			args[0] = arg;
			if (executable.isVarArgs() && args.length == 2) {
				Class<?> component = executable.getParameterTypes()[1].getComponentType();
				args[1] = Array.newInstance(component, 0);
			}
			if (executable instanceof Constructor<?> ctor) {
				return InvocationSupport.newInstance(ctor, args);
			}
			return InvocationSupport.invoke((Method) executable, null, args);
		}

		String describe() {
			String owner = executable.getDeclaringClass().getSimpleName();
			String name = (executable instanceof Constructor<?>) ? "<init>" : executable.getName();
			return owner + "#" + name + "(" + parameter.type().getSimpleName() + ")";
		}
	}
}
