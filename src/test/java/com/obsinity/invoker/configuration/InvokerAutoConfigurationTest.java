package com.obsinity.invoker.configuration;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import com.obsinity.invoker.dispatch.ArgumentResolver;
import com.obsinity.invoker.processor.InvokableProcessorDecorator;
import com.obsinity.invoker.registry.HandlerRegistry;
import com.obsinity.invoker.registry.MapHandlerRegistry;
import com.obsinity.invoker.state.StateProcessor;
import com.obsinity.invoker.urivar.UriVarValueResolver;

class InvokerAutoConfigurationTest {

	private final ApplicationContextRunner runner = new ApplicationContextRunner()
			.withConfiguration(AutoConfigurations.of(InvokerAutoConfiguration.class));

	private static final StateProcessor NOOP = (data, operation, uriVariables, context) -> Map.of();

	@Test
	void registers_the_resolver_chain() {
		runner.run(ctx -> {
			assertThat(ctx).hasSingleBean(ArgumentResolver.class);
			assertThat(ctx.getBean(ArgumentResolver.class).getResolvers()).hasSize(4);
			assertThat(ctx.getBean(ArgumentResolver.class).getResolvers().get(0))
					.isInstanceOf(UriVarValueResolver.class);
		});
	}

	@Test
	void can_be_disabled() {
		runner.withPropertyValues("obsinity.invoker.enabled=false")
				.withBean("stateProcessor", StateProcessor.class, () -> NOOP)
				.run(ctx -> {
					assertThat(ctx).doesNotHaveBean(ArgumentResolver.class);
					assertThat(ctx.getBean("stateProcessor")).isSameAs(NOOP);
				});
	}

	@Test
	void decorates_the_configured_bean_name() {
		runner.withPropertyValues("obsinity.invoker.processor-bean=hostProcessor")
				.withBean("hostProcessor", StateProcessor.class, () -> NOOP)
				.withBean("stateProcessor", StateProcessor.class, () -> (d, o, u, c) -> Map.of())
				.run(ctx -> {
					assertThat(ctx.getBean("hostProcessor")).isInstanceOf(InvokableProcessorDecorator.class);
					assertThat(((InvokableProcessorDecorator) ctx.getBean("hostProcessor")).getDelegate())
							.isSameAs(NOOP);
					assertThat(ctx.getBean("stateProcessor")).isNotInstanceOf(InvokableProcessorDecorator.class);
				});
	}

	@Test
	void host_registry_replaces_the_default() {
		MapHandlerRegistry registry = new MapHandlerRegistry();
		runner.withBean(HandlerRegistry.class, () -> registry)
				.run(ctx -> assertThat(ctx.getBean(HandlerRegistry.class)).isSameAs(registry));
	}

	@Test
	void binds_properties() {
		runner.withPropertyValues("obsinity.invoker.magic-mapping=false", "obsinity.invoker.payload-aliases=body")
				.run(ctx -> {
					InvokerProperties props = ctx.getBean(InvokerProperties.class);
					assertThat(props.isMagicMapping()).isFalse();
					assertThat(props.getPayloadAliases()).containsExactly("body");
				});
	}
}
