package com.obsinity.invoker.urivar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.lang.Nullable;

import com.obsinity.invoker.annotations.UnionOf;
import com.obsinity.invoker.annotations.UriVar;
import com.obsinity.invoker.dispatch.InvocationContext;
import com.obsinity.invoker.dispatch.ParameterDescriptor;
import com.obsinity.invoker.dispatch.ResolvedValue;
import com.obsinity.invoker.exceptions.NoConstructionStrategyException;
import com.obsinity.invoker.exceptions.RejectedValueException;
import com.obsinity.invoker.fixtures.AccountId;
import com.obsinity.invoker.fixtures.CompanyId;

class UriVarValueResolverTest {

	@SuppressWarnings("unused")
	static class Handlers {
		public void tagged(@UriVar("companyId") CompanyId company, String userId) {}

		public void shadow(@UriVar(name = "tenant") String companyId) {}

		public void scalars(int count, @Nullable String note, String required) {}

		public void union(@UnionOf({String.class, Integer.class}) Object id) {}

		public void references(AccountId accountId, CompanyId companyId) {}
	}

	private final UriVarValueResolver resolver = new UriVarValueResolver(new ValueObjectInstantiator());

	private static ParameterDescriptor param(String method, int index) {
		Method m = Arrays.stream(Handlers.class.getDeclaredMethods())
				.filter(x -> x.getName().equals(method))
				.findFirst()
				.orElseThrow();
		return ParameterDescriptor.describeAll(m).get(index);
	}

	private static InvocationContext ctx(Map<String, Object> vars) {
		return new InvocationContext(vars, null, null, null);
	}

	@Test
	void tag_and_magic_resolve_independently() {
		InvocationContext c = ctx(Map.of("companyId", "acme-corp", "userId", "u-1", "company", "ignored"));

		ResolvedValue company = resolver.resolve(param("tagged", 0), c);
		ResolvedValue user = resolver.resolve(param("tagged", 1), c);

		assertThat(company.isPresent()).isTrue();
		assertThat(company.value()).isEqualTo(new CompanyId("acme-corp"));
		assertThat(user.value()).isEqualTo("u-1");
	}

	@Test
	void explicit_tag_is_never_shadowed_by_a_same_named_variable() {
		InvocationContext c = ctx(Map.of("companyId", "by-name", "tenant", "by-tag"));
		assertThat(resolver.resolve(param("shadow", 0), c).value()).isEqualTo("by-tag");
	}

	@Test
	void missing_keys_decline() {
		InvocationContext c = ctx(Map.of("other", "x"));
		assertThat(resolver.resolve(param("tagged", 0), c).isPresent()).isFalse();
		assertThat(resolver.resolve(param("tagged", 1), c).isPresent()).isFalse();
		assertThat(resolver.resolve(param("shadow", 0), ctx(Map.of("companyId", "x"))).isPresent()).isFalse();
	}

	@Test
	void magic_mapping_can_be_disabled() {
		UriVarValueResolver strict = new UriVarValueResolver(new ValueObjectInstantiator(), false);
		InvocationContext c = ctx(Map.of("companyId", "acme-corp", "userId", "u-1"));

		assertThat(strict.resolve(param("tagged", 0), c).isPresent()).isTrue();
		assertThat(strict.resolve(param("tagged", 1), c).isPresent()).isFalse();
	}

	@Test
	void builtin_kinds_are_coerced_or_rejected() {
		assertThat(resolver.resolve(param("scalars", 0), ctx(Map.of("count", "123"))).value()).isEqualTo(123);

		assertThatThrownBy(() -> resolver.resolve(param("scalars", 0), ctx(Map.of("count", "abc"))))
				.isInstanceOf(RejectedValueException.class)
				.hasMessageContaining("'count'");
	}

	@Test
	@Timeout(2)
	void exponent_notation_fails_fast() {
		assertThatThrownBy(() -> resolver.resolve(param("scalars", 0), ctx(Map.of("count", "1e30000000"))))
				.isInstanceOf(RejectedValueException.class);
		assertThatThrownBy(() -> resolver.resolve(param("references", 0), ctx(Map.of("accountId", "1e999999999"))))
				.isInstanceOf(NoConstructionStrategyException.class);
	}

	@Test
	void null_values_follow_nullability() {
		Map<String, Object> vars = new HashMap<>();
		vars.put("note", null);
		vars.put("required", null);

		ResolvedValue note = resolver.resolve(param("scalars", 1), ctx(vars));
		assertThat(note.isPresent()).isTrue();
		assertThat(note.value()).isNull();

		assertThatThrownBy(() -> resolver.resolve(param("scalars", 2), ctx(vars)))
				.isInstanceOf(RejectedValueException.class);
	}

	@Test
	void union_values_pass_unchanged_when_a_member_accepts() {
		assertThat(resolver.resolve(param("union", 0), ctx(Map.of("id", 7))).value()).isEqualTo(7);
		assertThat(resolver.resolve(param("union", 0), ctx(Map.of("id", "7"))).value()).isEqualTo("7");
		assertThatThrownBy(() -> resolver.resolve(param("union", 0), ctx(Map.of("id", 1.5))))
				.isInstanceOf(RejectedValueException.class);
	}

	@Test
	void value_objects_are_built_or_passed_through() {
		CompanyId existing = new CompanyId("given");
		InvocationContext c = ctx(Map.of("accountId", "456", "companyId", existing));

		Object account = resolver.resolve(param("references", 0), c).value();
		assertThat(account).isInstanceOf(AccountId.class);
		assertThat(((AccountId) account).id()).isEqualTo(456);
		assertThat(resolver.resolve(param("references", 1), c).value()).isSameAs(existing);
	}
}
