package com.obsinity.invoker.registry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Registry backed by a plain map; handy for tests and for hosts without a bean container. */
public class MapHandlerRegistry implements HandlerRegistry {

	private final Map<String, Object> handlers = new ConcurrentHashMap<>();

	public MapHandlerRegistry() {}

	public MapHandlerRegistry(Map<String, ?> handlers) {
		this.handlers.putAll(handlers);
	}

	public MapHandlerRegistry register(String id, Object handler) {
		handlers.put(id, handler);
		return this;
	}

	@Override
	public boolean has(String id) {
		return id != null && handlers.containsKey(id);
	}

	@Override
	public Object get(String id) {
		Object handler = (id == null) ? null : handlers.get(id);
		if (handler == null) throw new IllegalArgumentException("No handler registered under '" + id + "'");
		return handler;
	}
}
