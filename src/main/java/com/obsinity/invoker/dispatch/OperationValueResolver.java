package com.obsinity.invoker.dispatch;

import org.springframework.core.Ordered;

import com.obsinity.invoker.model.Operation;

/**
 * Injects the matched {@link Operation} into parameters typed {@code Operation} or one of its subtypes.
 *
 * <p>A {@code @Nullable} parameter always resolves: to the operation when it matches the declared subtype, to
 * {@code null} otherwise.
 */
public class OperationValueResolver implements ParameterValueResolver, Ordered {

	public static final int ORDER = 300;

	@Override
	public ResolvedValue resolve(ParameterDescriptor parameter, InvocationContext context) {
		Class<?> type = parameter.type();
		if (!Operation.class.isAssignableFrom(type)) return ResolvedValue.none();

		Operation operation = context.operation();
		if (operation != null && type.isInstance(operation)) {
			return ResolvedValue.of(operation);
		}
		return parameter.nullable() ? ResolvedValue.of(null) : ResolvedValue.none();
	}

	@Override
	public int getOrder() {
		return ORDER;
	}
}
