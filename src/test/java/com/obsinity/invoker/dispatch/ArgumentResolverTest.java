package com.obsinity.invoker.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.core.annotation.Order;
import org.springframework.lang.Nullable;

import com.obsinity.invoker.annotations.Invoke;
import com.obsinity.invoker.exceptions.UnresolvedParameterException;
import com.obsinity.invoker.model.Get;
import com.obsinity.invoker.model.Operation;
import com.obsinity.invoker.model.RequestCarrier;
import com.obsinity.invoker.processor.DataValueResolver;
import com.obsinity.invoker.urivar.UriVarValueResolver;
import com.obsinity.invoker.urivar.ValueObjectInstantiator;

class ArgumentResolverTest {

	static class Handler {
		@Invoke
		public Object handle(String data, Operation operation, RequestCarrier request, @Nullable Integer note,
				String... tags) {
			return null;
		}
	}

	static class Strict {
		@Invoke
		public Object handle(String missing) {
			return null;
		}
	}

	/** Claims every parameter; ordered ahead of the core resolvers. */
	@Order(1)
	static class Everything implements ParameterValueResolver {
		@Override
		public ResolvedValue resolve(ParameterDescriptor parameter, InvocationContext context) {
			return ResolvedValue.of("custom:" + parameter.name());
		}
	}

	private final List<ParameterValueResolver> core = List.of(
			new CarrierValueResolver(),
			new OperationValueResolver(),
			new DataValueResolver(),
			new UriVarValueResolver(new ValueObjectInstantiator()));

	private final HandlerMethodIntrospector introspector = new HandlerMethodIntrospector();

	@Test
	void resolvers_are_sorted_by_order() {
		ArgumentResolver ar = new ArgumentResolver(core);
		assertThat(ar.getResolvers())
				.extracting(r -> r.getClass().getSimpleName())
				.containsExactly("UriVarValueResolver", "DataValueResolver", "OperationValueResolver",
						"CarrierValueResolver");
	}

	@Test
	void each_parameter_gets_its_value_and_leftovers_get_defaults() {
		RequestCarrier carrier = new RequestCarrier();
		Operation op = Get.builder().uriTemplate("/users/{id}").build();
		InvocationContext ctx = new InvocationContext(Map.of(), "payload", carrier, op);

		Object[] args = new ArgumentResolver(core).resolveArguments(introspector.find(new Handler()).orElseThrow(), ctx);

		assertThat(args).hasSize(5);
		assertThat(args[0]).isEqualTo("payload");
		assertThat(args[1]).isSameAs(op);
		assertThat(args[2]).isSameAs(carrier);
		assertThat(args[3]).isNull();
		assertThat((String[]) args[4]).isEmpty();
	}

	@Test
	void first_resolver_with_a_value_wins() {
		List<ParameterValueResolver> withCustom = new ArrayList<>(core);
		withCustom.add(new Everything());
		InvocationContext ctx = new InvocationContext(Map.of(), "payload", new RequestCarrier(), null);

		Object[] args = new ArgumentResolver(withCustom)
				.resolveArguments(introspector.find(new Handler()).orElseThrow(), ctx);

		assertThat(args[0]).isEqualTo("custom:data");
	}

	@Test
	void required_parameter_without_a_value_fails() {
		InvocationContext ctx =
				new InvocationContext(Map.of("missingId", "7", "companyId", "acme"), null, new RequestCarrier(), null);

		assertThatThrownBy(() -> new ArgumentResolver(core)
						.resolveArguments(introspector.find(new Strict()).orElseThrow(), ctx))
				.isInstanceOf(UnresolvedParameterException.class)
				.hasMessageContaining("\"missing\"")
				.hasMessageContaining("Strict#handle")
				.hasMessageContaining("URI variables: [companyId, missingId]")
				.satisfies(e -> assertThat(((UnresolvedParameterException) e).parameter()).isEqualTo("missing"));
	}
}
