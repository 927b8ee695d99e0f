package com.obsinity.invoker.registry;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.util.ClassUtils;

import lombok.RequiredArgsConstructor;

/**
 * Resolves handler ids against the Spring container: first as a bean name, then as a fully qualified class name
 * with exactly one bean of that type.
 */
@RequiredArgsConstructor
public class BeanFactoryHandlerRegistry implements HandlerRegistry {

	private final ListableBeanFactory beanFactory;

	@Override
	public boolean has(String id) {
		if (id == null || id.isBlank()) return false;
		if (beanFactory.containsBean(id)) return true;
		Class<?> type = loadType(id);
		return type != null && beanFactory.getBeanNamesForType(type).length == 1;
	}

	@Override
	public Object get(String id) {
		if (id != null && beanFactory.containsBean(id)) return beanFactory.getBean(id);
		Class<?> type = (id == null) ? null : loadType(id);
		if (type != null) {
			String[] names = beanFactory.getBeanNamesForType(type);
			if (names.length == 1) return beanFactory.getBean(names[0]);
		}
		throw new IllegalArgumentException("No handler registered under '" + id + "'");
	}

	private Class<?> loadType(String id) {
		if (!id.contains(".")) return null;
		ClassLoader cl = (beanFactory instanceof ConfigurableBeanFactory cbf)
				? cbf.getBeanClassLoader()
				: ClassUtils.getDefaultClassLoader();
		return ClassUtils.isPresent(id, cl) ? ClassUtils.resolveClassName(id, cl) : null;
	}
}
