package com.obsinity.invoker.configuration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;

import com.obsinity.invoker.dispatch.HandlerMethodIntrospector;
import com.obsinity.invoker.processor.InvokableProcessorDecorator;
import com.obsinity.invoker.processor.ProcessorInvoker;
import com.obsinity.invoker.provider.InvokableProviderDecorator;
import com.obsinity.invoker.provider.ProviderInvoker;
import com.obsinity.invoker.registry.HandlerRegistry;
import com.obsinity.invoker.state.StateProcessor;
import com.obsinity.invoker.state.StateProvider;

import lombok.RequiredArgsConstructor;

/**
 * Replaces the host's processor and provider beans with their invokable decorators. Collaborators are looked up
 * lazily so this post-processor can be registered before them.
 */
@RequiredArgsConstructor
public class InvokableStateDecoratorPostProcessor implements BeanPostProcessor {

	private static final Logger log = LoggerFactory.getLogger(InvokableStateDecoratorPostProcessor.class);

	private final ObjectProvider<InvokerProperties> properties;
	private final ObjectProvider<HandlerRegistry> registry;
	private final ObjectProvider<HandlerMethodIntrospector> introspector;
	private final ObjectProvider<ProcessorInvoker> processorInvoker;
	private final ObjectProvider<ProviderInvoker> providerInvoker;

	@Override
	public Object postProcessAfterInitialization(Object bean, String beanName) throws BeansException {
		if (!(bean instanceof StateProcessor) && !(bean instanceof StateProvider)) return bean;
		InvokerProperties props = properties.getObject();

		if (beanName.equals(props.getProcessorBean())
				&& bean instanceof StateProcessor processor
				&& !(bean instanceof InvokableProcessorDecorator)) {
			log.debug("INVOKER: decorating processor bean '{}'", beanName);
			return new InvokableProcessorDecorator(
					processor, registry.getObject(), introspector.getObject(), processorInvoker.getObject());
		}

		if (beanName.equals(props.getProviderBean())
				&& bean instanceof StateProvider provider
				&& !(bean instanceof InvokableProviderDecorator)) {
			log.debug("INVOKER: decorating provider bean '{}'", beanName);
			return new InvokableProviderDecorator(
					provider, registry.getObject(), introspector.getObject(), providerInvoker.getObject());
		}
		return bean;
	}
}
