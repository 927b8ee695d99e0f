package com.obsinity.invoker.processor;

import java.util.List;
import java.util.Set;

import org.springframework.core.Ordered;

import com.obsinity.invoker.dispatch.InvocationContext;
import com.obsinity.invoker.dispatch.ParameterDescriptor;
import com.obsinity.invoker.dispatch.ParameterValueResolver;
import com.obsinity.invoker.dispatch.ResolvedValue;

/**
 * Injects the payload of a write call. A parameter receives it when its name is one of the payload aliases
 * ({@code data} and {@code input} by default) or when the payload is an instance of the parameter type.
 */
public class DataValueResolver implements ParameterValueResolver, Ordered {

	public static final int ORDER = 200;

	public static final List<String> DEFAULT_ALIASES = List.of("data", "input");

	private final Set<String> aliases;

	public DataValueResolver() {
		this(DEFAULT_ALIASES);
	}

	public DataValueResolver(List<String> aliases) {
		this.aliases = Set.copyOf(aliases);
	}

	@Override
	public ResolvedValue resolve(ParameterDescriptor parameter, InvocationContext context) {
		Object data = context.payload();
		if (data == null) return ResolvedValue.none();

		if (aliases.contains(parameter.name())) {
			return ResolvedValue.of(data);
		}
		if (parameter.type() != Object.class && parameter.type().isInstance(data)) {
			return ResolvedValue.of(data);
		}
		return ResolvedValue.none();
	}

	@Override
	public int getOrder() {
		return ORDER;
	}
}
