package com.obsinity.invoker.dispatch;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;

import com.obsinity.invoker.exceptions.UnresolvedParameterException;

/**
 * Builds the argument list of an invocable method by asking the resolver chain for each parameter, in declaration
 * order. The first resolver with a present value wins.
 *
 * <p>A parameter no resolver claims gets {@code null} if it is {@code @Nullable}, an empty array if it is variadic,
 * and otherwise fails with {@link UnresolvedParameterException}.
 */
public class ArgumentResolver {

	private static final Logger log = LoggerFactory.getLogger(ArgumentResolver.class);

	private final List<ParameterValueResolver> resolvers;

	public ArgumentResolver(List<? extends ParameterValueResolver> resolvers) {
		List<ParameterValueResolver> sorted = new ArrayList<>(resolvers);
		AnnotationAwareOrderComparator.sort(sorted);
		this.resolvers = List.copyOf(sorted);
	}

	public List<ParameterValueResolver> getResolvers() {
		return resolvers;
	}

	public Object[] resolveArguments(InvocableMethod invocable, InvocationContext context) {
		List<ParameterDescriptor> params = invocable.parameters();
		Object[] args = new Object[params.size()];
		for (ParameterDescriptor p : params) {
			args[p.index()] = resolveOne(invocable, p, context);
		}
		return args;
	}

	private Object resolveOne(InvocableMethod invocable, ParameterDescriptor p, InvocationContext context) {
		for (ParameterValueResolver r : resolvers) {
			ResolvedValue v = r.resolve(p, context);
			if (v.isPresent()) {
				log.debug("INVOKER: {} param[{}]='{}' <- {}", invocable.debugName(), p.index(), p.name(),
						r.getClass().getSimpleName());
				return v.value();
			}
		}

		if (p.variadic()) return Array.newInstance(p.type().getComponentType(), 0);
		if (p.nullable()) return null;
		throw new UnresolvedParameterException(
				invocable.debugName(), p.name(), p.type(), context.rawNamedValues().keySet());
	}
}
