package com.obsinity.invoker.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.lang.Nullable;

import com.obsinity.invoker.annotations.Invoke;
import com.obsinity.invoker.annotations.UriVar;
import com.obsinity.invoker.dispatch.ArgumentResolver;
import com.obsinity.invoker.dispatch.CarrierValueResolver;
import com.obsinity.invoker.dispatch.HandlerMethodIntrospector;
import com.obsinity.invoker.dispatch.OperationValueResolver;
import com.obsinity.invoker.exceptions.HandlerInvocationException;
import com.obsinity.invoker.exceptions.InvalidResultShapeException;
import com.obsinity.invoker.exceptions.MissingCarrierException;
import com.obsinity.invoker.fixtures.AccountId;
import com.obsinity.invoker.fixtures.CompanyId;
import com.obsinity.invoker.fixtures.UserInput;
import com.obsinity.invoker.fixtures.UserResource;
import com.obsinity.invoker.model.Operation;
import com.obsinity.invoker.model.Post;
import com.obsinity.invoker.model.RequestCarrier;
import com.obsinity.invoker.urivar.UriVarValueResolver;
import com.obsinity.invoker.urivar.ValueObjectInstantiator;

class ProcessorInvokerTest {

	/* ===== Handlers ===== */

	static class CreateUser {
		CompanyId seenCompany;
		AccountId seenAccount;
		Operation seenOperation;
		RequestCarrier seenCarrier;

		@Invoke
		public UserResource create(UserInput data, @UriVar("companyId") CompanyId company, AccountId accountId,
				Operation operation, RequestCarrier request) {
			this.seenCompany = company;
			this.seenAccount = accountId;
			this.seenOperation = operation;
			this.seenCarrier = request;
			return new UserResource("u-" + accountId.id(), data.name(), company.value());
		}
	}

	static class ReturnsString {
		public String invoke(UserInput data) {
			return "created";
		}
	}

	static class ReturnsList {
		public List<String> invoke(UserInput data) {
			return List.of("a");
		}
	}

	static class ThrowsChecked {
		public Object invoke() throws IOException {
			throw new IOException("disk full");
		}
	}

	static class ThrowsUnchecked {
		public Object invoke() {
			throw new IllegalArgumentException("bad input");
		}
	}

	record Seen(UserInput input) {}

	static class Touch {
		public Seen invoke(@Nullable UserInput input) {
			return new Seen(input);
		}
	}

	private ProcessorInvoker invoker;
	private RequestCarrier carrier;
	private Map<String, Object> context;
	private final Operation operation = Post.builder()
			.uriTemplate("/companies/{companyId}/users")
			.processor("user.create")
			.build();
	private final UserInput input = new UserInput("Ann", "ann@example.com");

	@BeforeEach
	void setUp() {
		HandlerMethodIntrospector introspector = new HandlerMethodIntrospector();
		ArgumentResolver resolver = new ArgumentResolver(List.of(
				new UriVarValueResolver(new ValueObjectInstantiator()),
				new DataValueResolver(),
				new OperationValueResolver(),
				new CarrierValueResolver()));
		invoker = new ProcessorInvoker(introspector, resolver);
		carrier = new RequestCarrier();
		context = Map.of(RequestCarrier.CONTEXT_KEY, carrier);
	}

	@Test
	void binds_payload_uri_variables_operation_and_carrier() {
		CreateUser handler = new CreateUser();

		Object result = invoker.invoke(
				handler, input, operation, Map.of("companyId", "acme-corp", "accountId", "456"), context);

		assertThat(result).isEqualTo(new UserResource("u-456", "Ann", "acme-corp"));
		assertThat(handler.seenCompany).isEqualTo(new CompanyId("acme-corp"));
		assertThat(handler.seenAccount.id()).isEqualTo(456);
		assertThat(handler.seenOperation).isSameAs(operation);
		assertThat(handler.seenCarrier).isSameAs(carrier);
	}

	@Test
	void records_the_call_on_the_carrier() {
		carrier.setAttribute("companyId", "pre-existing");
		carrier.setAttribute(RequestCarrier.ROUTE_PARAMS, Map.of("locale", "en", "accountId", "1"));

		invoker.invoke(new CreateUser(), input, operation, Map.of("companyId", "acme-corp", "accountId", "456"),
				context);

		assertThat(carrier.getAttribute("companyId")).isEqualTo("pre-existing");
		assertThat(carrier.getAttribute("accountId")).isEqualTo("456");
		assertThat(carrier.getAttribute(RequestCarrier.ROUTE_PARAMS))
				.isEqualTo(Map.of("locale", "en", "accountId", "456", "companyId", "acme-corp"));
		assertThat(carrier.getAttribute(RequestCarrier.OPERATION)).isSameAs(operation);
		assertThat(carrier.getAttribute(RequestCarrier.DATA)).isSameAs(input);
	}

	@Test
	@DisplayName("a write handler returning a string is rejected")
	void string_result_is_rejected() {
		assertThatThrownBy(() -> invoker.invoke(new ReturnsString(), input, operation, Map.of(), context))
				.isInstanceOf(InvalidResultShapeException.class)
				.hasMessageContaining("ReturnsString#invoke")
				.satisfies(e -> assertThat(((InvalidResultShapeException) e).result()).isEqualTo("created"));
	}

	@Test
	void collection_result_is_rejected() {
		assertThatThrownBy(() -> invoker.invoke(new ReturnsList(), input, operation, Map.of(), context))
				.isInstanceOf(InvalidResultShapeException.class);
	}

	@Test
	void write_without_payload_ignores_a_data_attribute_on_the_carrier() {
		carrier.setAttribute(RequestCarrier.DATA, new UserInput("stale", null));

		Object result = invoker.invoke(new Touch(), null, operation, Map.of("data", "file-42"), context);

		assertThat(result).isEqualTo(new Seen(null));
	}

	@Test
	void carrier_is_required() {
		assertThatThrownBy(() -> invoker.invoke(new CreateUser(), input, operation, Map.of(), Map.of()))
				.isInstanceOf(MissingCarrierException.class)
				.hasMessageContaining("processor");

		Map<String, Object> wrongType = new HashMap<>();
		wrongType.put(RequestCarrier.CONTEXT_KEY, "not a carrier");
		assertThatThrownBy(() -> invoker.invoke(new CreateUser(), input, operation, Map.of(), wrongType))
				.isInstanceOf(MissingCarrierException.class);
	}

	@Test
	void handler_exceptions_are_unwrapped() {
		assertThatThrownBy(() -> invoker.invoke(new ThrowsUnchecked(), input, operation, Map.of(), context))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("bad input");

		assertThatThrownBy(() -> invoker.invoke(new ThrowsChecked(), input, operation, Map.of(), context))
				.isInstanceOf(HandlerInvocationException.class)
				.hasCauseInstanceOf(IOException.class);
	}
}
