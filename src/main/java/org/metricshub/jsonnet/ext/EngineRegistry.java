package org.metricshub.jsonnet.ext;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jsonnet CLI
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.metricshub.jsonnet.util.JsonnetLogger;
import org.slf4j.Logger;

/**
 * Registry used by the CLI and the scripting API to find the
 * {@link JsonnetEngine} that implements the language.
 */
public final class EngineRegistry {

	private static final Logger LOG = JsonnetLogger.getLogger(EngineRegistry.class);

	private static final ConcurrentMap<String, JsonnetEngine> REGISTERED = new ConcurrentHashMap<String, JsonnetEngine>();

	private EngineRegistry() {}

	/**
	 * Registers an engine instance under the supplied name.
	 *
	 * @param name identifying name
	 * @param engine engine instance
	 */
	public static void register(String name, JsonnetEngine engine) {
		Objects.requireNonNull(name, "Engine name must not be null");
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Engine name must not be empty");
		}
		REGISTERED.put(name, Objects.requireNonNull(engine, "Engine instance must not be null"));
	}

	/**
	 * Removes the engine registered under the supplied name.
	 *
	 * @param name identifying name
	 * @return the removed engine, or {@code null} if none was registered
	 */
	public static JsonnetEngine unregister(String name) {
		return name == null ? null : REGISTERED.remove(name);
	}

	/**
	 * Returns a snapshot of all registered engines sorted by name.
	 *
	 * @return immutable view of registered engines
	 */
	public static Map<String, JsonnetEngine> listEngines() {
		List<Map.Entry<String, JsonnetEngine>> entries = new ArrayList<Map.Entry<String, JsonnetEngine>>(
				REGISTERED.entrySet());
		Collections.sort(entries, Comparator.comparing(Map.Entry::getKey, String.CASE_INSENSITIVE_ORDER));
		Map<String, JsonnetEngine> snapshot = new LinkedHashMap<String, JsonnetEngine>();
		for (Map.Entry<String, JsonnetEngine> entry : entries) {
			snapshot.put(entry.getKey(), entry.getValue());
		}
		return Collections.unmodifiableMap(snapshot);
	}

	/**
	 * Resolves an engine name to the registered instance. The lookup is
	 * case-insensitive and also supports class names. When the engine has not
	 * yet been registered, the method attempts to load the class by name and
	 * instantiate it.
	 *
	 * @param name name or class name of the engine
	 * @return engine instance, or {@code null} when the name cannot be resolved
	 */
	public static JsonnetEngine resolve(String name) {
		if (name == null || name.isEmpty()) {
			return null;
		}
		JsonnetEngine engine = REGISTERED.get(name);
		if (engine != null) {
			return engine;
		}
		for (Map.Entry<String, JsonnetEngine> entry : REGISTERED.entrySet()) {
			if (entry.getKey().equalsIgnoreCase(name)) {
				return entry.getValue();
			}
		}
		for (JsonnetEngine candidate : REGISTERED.values()) {
			Class<? extends JsonnetEngine> type = candidate.getClass();
			if (type.getName().equals(name) || type.getSimpleName().equalsIgnoreCase(name)) {
				return candidate;
			}
		}
		return instantiateByClassName(name);
	}

	/**
	 * Returns the engine to use when none was requested explicitly: the first
	 * registered engine in name order, otherwise the first provider found by
	 * {@link ServiceLoader}, which is then registered.
	 *
	 * @return the default engine
	 * @throws IllegalStateException when no engine is available
	 */
	public static JsonnetEngine defaultEngine() {
		Map<String, JsonnetEngine> engines = listEngines();
		if (!engines.isEmpty()) {
			return engines.values().iterator().next();
		}
		Iterator<JsonnetEngine> providers = ServiceLoader.load(JsonnetEngine.class).iterator();
		try {
			if (providers.hasNext()) {
				JsonnetEngine engine = providers.next();
				LOG.debug("Discovered Jsonnet engine {} ({})", engine.getEngineName(), engine.getClass().getName());
				JsonnetEngine existing = REGISTERED.putIfAbsent(engine.getEngineName(), engine);
				return existing != null ? existing : engine;
			}
		} catch (ServiceConfigurationError e) {
			throw new IllegalStateException("Cannot load Jsonnet engine: " + e.getMessage(), e);
		}
		throw new IllegalStateException("No Jsonnet engine available on the class path");
	}

	private static JsonnetEngine instantiateByClassName(String name) {
		try {
			Class<?> clazz = Class.forName(name);
			if (!JsonnetEngine.class.isAssignableFrom(clazz)) {
				return null;
			}
			JsonnetEngine created = clazz.asSubclass(JsonnetEngine.class).getDeclaredConstructor().newInstance();
			JsonnetEngine existing = REGISTERED.putIfAbsent(created.getEngineName(), created);
			JsonnetEngine instance = existing != null ? existing : created;
			register(name, instance);
			return instance;
		} catch (ClassNotFoundException ex) {
			return null;
		} catch (InstantiationException | IllegalAccessException | NoSuchMethodException e) {
			throw new IllegalStateException("Cannot instantiate engine " + name, e);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			throw new IllegalStateException("Cannot instantiate engine " + name, cause);
		}
	}
}
