package com.obsinity.invoker.dispatch;

import org.springframework.core.Ordered;

/** Injects the {@link com.obsinity.invoker.model.RequestCarrier} itself. */
public class CarrierValueResolver implements ParameterValueResolver, Ordered {

	public static final int ORDER = 400;

	@Override
	public ResolvedValue resolve(ParameterDescriptor parameter, InvocationContext context) {
		if (context.carrier() != null && parameter.type().isInstance(context.carrier())
				&& parameter.type() != Object.class) {
			return ResolvedValue.of(context.carrier());
		}
		return ResolvedValue.none();
	}

	@Override
	public int getOrder() {
		return ORDER;
	}
}
