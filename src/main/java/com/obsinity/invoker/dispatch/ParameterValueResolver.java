package com.obsinity.invoker.dispatch;

/**
 * Supplies the value of one handler parameter from the current invocation, or declines.
 *
 * <p>Resolvers form an ordered chain ({@link org.springframework.core.Ordered} or
 * {@link org.springframework.core.annotation.Order}); the first one returning a present value wins. Any Spring bean
 * implementing this interface joins the chain.
 */
@FunctionalInterface
public interface ParameterValueResolver {
	ResolvedValue resolve(ParameterDescriptor parameter, InvocationContext context);
}
