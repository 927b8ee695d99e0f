package com.obsinity.invoker.configuration;

import static org.springframework.core.Ordered.HIGHEST_PRECEDENCE;

import java.util.List;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigureOrder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.obsinity.invoker.dispatch.ArgumentResolver;
import com.obsinity.invoker.dispatch.CarrierValueResolver;
import com.obsinity.invoker.dispatch.HandlerMethodIntrospector;
import com.obsinity.invoker.dispatch.OperationValueResolver;
import com.obsinity.invoker.dispatch.ParameterValueResolver;
import com.obsinity.invoker.processor.DataValueResolver;
import com.obsinity.invoker.processor.ProcessorInvoker;
import com.obsinity.invoker.provider.ProviderInvoker;
import com.obsinity.invoker.registry.BeanFactoryHandlerRegistry;
import com.obsinity.invoker.registry.HandlerRegistry;
import com.obsinity.invoker.urivar.UriVarValueResolver;
import com.obsinity.invoker.urivar.ValueObjectInstantiator;

@AutoConfiguration
@AutoConfigureOrder(value = HIGHEST_PRECEDENCE)
@EnableConfigurationProperties(InvokerProperties.class)
@ConditionalOnProperty(prefix = "obsinity.invoker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InvokerAutoConfiguration {

	@Bean
	@ConditionalOnMissingBean
	public ValueObjectInstantiator valueObjectInstantiator() {
		return new ValueObjectInstantiator();
	}

	@Bean
	public UriVarValueResolver uriVarValueResolver(ValueObjectInstantiator instantiator, InvokerProperties props) {
		return new UriVarValueResolver(instantiator, props.isMagicMapping());
	}

	@Bean
	public DataValueResolver dataValueResolver(InvokerProperties props) {
		return new DataValueResolver(props.getPayloadAliases());
	}

	@Bean
	public OperationValueResolver operationValueResolver() {
		return new OperationValueResolver();
	}

	@Bean
	public CarrierValueResolver carrierValueResolver() {
		return new CarrierValueResolver();
	}

	/** Every {@link ParameterValueResolver} bean in the context joins the chain, ordered by {@code Ordered}. */
	@Bean
	@ConditionalOnMissingBean
	public ArgumentResolver argumentResolver(List<ParameterValueResolver> resolvers) {
		return new ArgumentResolver(resolvers);
	}

	@Bean
	@ConditionalOnMissingBean
	public HandlerMethodIntrospector handlerMethodIntrospector() {
		return new HandlerMethodIntrospector();
	}

	@Bean
	@ConditionalOnMissingBean
	public HandlerRegistry handlerRegistry(ListableBeanFactory beanFactory) {
		return new BeanFactoryHandlerRegistry(beanFactory);
	}

	@Bean
	@ConditionalOnMissingBean
	public ProcessorInvoker processorInvoker(HandlerMethodIntrospector introspector, ArgumentResolver resolver) {
		return new ProcessorInvoker(introspector, resolver);
	}

	@Bean
	@ConditionalOnMissingBean
	public ProviderInvoker providerInvoker(HandlerMethodIntrospector introspector, ArgumentResolver resolver) {
		return new ProviderInvoker(introspector, resolver);
	}

	@Bean
	public static InvokableStateDecoratorPostProcessor invokableStateDecoratorPostProcessor(
			ObjectProvider<InvokerProperties> properties,
			ObjectProvider<HandlerRegistry> registry,
			ObjectProvider<HandlerMethodIntrospector> introspector,
			ObjectProvider<ProcessorInvoker> processorInvoker,
			ObjectProvider<ProviderInvoker> providerInvoker) {
		return new InvokableStateDecoratorPostProcessor(
				properties, registry, introspector, processorInvoker, providerInvoker);
	}
}
