package org.metricshub.jtt.jsr223;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jtt
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import org.metricshub.jtt.Jtt;
import org.metricshub.jtt.backend.Evaluator;
import org.metricshub.jtt.jrt.Severity;
import org.metricshub.jtt.util.JttSettings;
import org.metricshub.jtt.util.ScriptSource;

/**
 * Simple JSR-223 script engine for Jtt. The script holds one token per line
 * and runs in sandbox mode. The output of {@code print} commands, followed by
 * the final stack as printed by {@link Evaluator#printData(Appendable)}, is
 * written to the context writer and returned.
 * <p>
 * The optional {@code approvedLevel} attribute of the context (a
 * {@link Severity} or its name) sets the severity threshold.
 */
public class JttScriptEngine extends AbstractScriptEngine {

	private final ScriptEngineFactory factory;

	public JttScriptEngine(ScriptEngineFactory factory) {
		this.factory = factory;
	}

	@Override
	public Object eval(Reader scriptReader, ScriptContext context) throws ScriptException {
		try {
			JttSettings settings = new JttSettings();
			settings.setSandbox(true);
			Object level = context.getAttribute("approvedLevel");
			if (level instanceof Severity) {
				settings.setApprovedLevel((Severity) level);
			} else if (level instanceof String) {
				settings.setApprovedLevel(Severity.parse((String) level));
			}
			ByteArrayOutputStream printed = new ByteArrayOutputStream();
			settings.setOutputStream(new PrintStream(printed, true, StandardCharsets.UTF_8.name()));
			ByteArrayOutputStream errors = new ByteArrayOutputStream();
			settings.setErrorStream(new PrintStream(errors, true, StandardCharsets.UTF_8.name()));
			settings.addScriptSource(new ScriptSource(ScriptSource.DESCRIPTION_INLINE_SCRIPT, scriptReader));

			Evaluator evaluator = new Jtt().invoke(settings);
			String out = printed.toString(StandardCharsets.UTF_8.name()) + evaluator.dataToString();
			Writer writer = context.getWriter();
			if (writer != null) {
				writer.write(out);
				writer.flush();
			}
			String reported = errors.toString(StandardCharsets.UTF_8.name());
			if (!reported.isEmpty()) {
				throw new ScriptException(reported.trim());
			}
			return out;
		} catch (ScriptException e) {
			throw e;
		} catch (Exception e) {
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
