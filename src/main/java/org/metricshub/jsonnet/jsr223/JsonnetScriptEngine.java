package org.metricshub.jsonnet.jsr223;

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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import org.metricshub.jsonnet.Jsonnet;
import org.metricshub.jsonnet.backend.JsonnetRuntimeException;
import org.metricshub.jsonnet.frontend.LocationRange;
import org.metricshub.jsonnet.frontend.StaticException;
import org.metricshub.jsonnet.util.JsonnetSettings;
import org.metricshub.jsonnet.util.ScriptSource;

/**
 * Simple JSR-223 script engine for Jsonnet. The result of the evaluation is
 * written to the writer of the context and returned.
 * <p>
 * The context attributes <code>maxStack</code>, <code>gcMinObjects</code>
 * and <code>gcGrowthTrigger</code> override the resource limits, and
 * {@link ScriptEngine#FILENAME} names the program in error messages.
 */
public class JsonnetScriptEngine extends AbstractScriptEngine {

	private final ScriptEngineFactory factory;

	public JsonnetScriptEngine(ScriptEngineFactory factory) {
		this.factory = factory;
	}

	@Override
	public Object eval(Reader scriptReader, ScriptContext context) throws ScriptException {
		Object fileName = context.getAttribute(ScriptEngine.FILENAME);
		String description = fileName != null ? fileName.toString() : ScriptSource.DESCRIPTION_COMMAND_LINE;
		try {
			JsonnetSettings settings = new JsonnetSettings();
			Object maxStack = context.getAttribute("maxStack");
			if (maxStack instanceof Number) {
				settings.setMaxStack(((Number) maxStack).intValue());
			}
			Object gcMinObjects = context.getAttribute("gcMinObjects");
			if (gcMinObjects instanceof Number) {
				settings.setGcMinObjects(((Number) gcMinObjects).intValue());
			}
			Object gcGrowthTrigger = context.getAttribute("gcGrowthTrigger");
			if (gcGrowthTrigger instanceof Number) {
				settings.setGcGrowthTrigger(((Number) gcGrowthTrigger).doubleValue());
			}
			String out = new Jsonnet().evaluate(new ScriptSource(description, scriptReader), settings);
			Writer writer = context.getWriter();
			if (writer != null) {
				writer.write(out);
				writer.write('\n');
				writer.flush();
			}
			return out;
		} catch (StaticException e) {
			LocationRange location = e.getLocation();
			if (location != null && location.isSet()) {
				ScriptException se = new ScriptException(
						e.getMessage(),
						description,
						location.getBegin().getLine(),
						location.getBegin().getColumn());
				se.initCause(e);
				throw se;
			}
			throw new ScriptException(e);
		} catch (JsonnetRuntimeException | IOException | IllegalArgumentException | IllegalStateException e) {
			throw new ScriptException(e);
		}
	}

	@Override
	public Object eval(String script, ScriptContext context) throws ScriptException {
		return eval(new StringReader(script), context);
	}

	@Override
	public Bindings createBindings() {
		return new SimpleBindings();
	}

	@Override
	public ScriptEngineFactory getFactory() {
		return factory;
	}
}
