package com.obsinity.invoker.urivar;

import org.springframework.core.Ordered;
import org.springframework.util.ClassUtils;

import com.obsinity.invoker.dispatch.InvocationContext;
import com.obsinity.invoker.dispatch.ParameterDescriptor;
import com.obsinity.invoker.dispatch.ParameterValueResolver;
import com.obsinity.invoker.dispatch.ResolvedValue;
import com.obsinity.invoker.exceptions.RejectedValueException;

/**
 * Binds URI variables to handler parameters.
 *
 * <p>The key is the {@code @UriVar} value when present; otherwise the parameter's own name, but only if a URI
 * variable of that name exists ("magic" mapping). A missing key declines rather than failing. Builtin kinds are
 * coerced, unions are checked strictly, and value-object types are built by the {@link ValueObjectInstantiator}.
 */
public class UriVarValueResolver implements ParameterValueResolver, Ordered {

	public static final int ORDER = 100;

	private final ValueObjectInstantiator instantiator;
	private final boolean magicMapping;

	public UriVarValueResolver(ValueObjectInstantiator instantiator) {
		this(instantiator, true);
	}

	public UriVarValueResolver(ValueObjectInstantiator instantiator, boolean magicMapping) {
		this.instantiator = instantiator;
		this.magicMapping = magicMapping;
	}

	@Override
	public ResolvedValue resolve(ParameterDescriptor parameter, InvocationContext context) {
		String key;
		if (parameter.hasBindingTag()) {
			key = parameter.bindingTag();
		} else {
			if (!magicMapping || !context.hasNamedValue(parameter.name())) return ResolvedValue.none();
			key = parameter.name();
		}

		if (!context.hasNamedValue(key)) return ResolvedValue.none();

		return ResolvedValue.of(convert(parameter, key, context.namedValue(key)));
	}

	private Object convert(ParameterDescriptor parameter, String key, Object raw) {
		if (raw == null || parameter.isUnion()) {
			if (TypeAcceptance.accepts(parameter, raw)) return raw;
			throw rejected(parameter, key, raw);
		}

		Class<?> type = parameter.type();
		if (ParamKind.of(type).isBuiltin()) {
			if (!TypeAcceptance.accepts(parameter, raw)) throw rejected(parameter, key, raw);
			return TypeAcceptance.coerce(type, raw);
		}

		if (ClassUtils.resolvePrimitiveIfNecessary(type).isInstance(raw)) return raw;
		return instantiator.instantiate(type, raw);
	}

	private static RejectedValueException rejected(ParameterDescriptor parameter, String key, Object raw) {
		return new RejectedValueException(
				"URI variable '" + key + "' = " + TypeAcceptance.describe(raw) + " is not accepted by parameter '"
						+ parameter.name() + "' (" + parameter.declaredTypes().stream().map(Class::getSimpleName).toList()
						+ (parameter.nullable() ? ", nullable" : "") + ")",
				raw);
	}

	@Override
	public int getOrder() {
		return ORDER;
	}
}
