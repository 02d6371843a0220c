package org.metricshub.jtt;

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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import org.metricshub.jtt.backend.Evaluator;
import org.metricshub.jtt.ext.HostExtension;
import org.metricshub.jtt.ext.JttExtension;
import org.metricshub.jtt.ext.SandboxedHostExtension;
import org.metricshub.jtt.jrt.EvaluationException;
import org.metricshub.jtt.util.JttLogger;
import org.metricshub.jtt.util.JttSettings;
import org.metricshub.jtt.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the evaluation of Jtt command streams.
 * This entry point is used both when Jtt is embedded as a library and when
 * invoked from the command line.
 * <p>
 * A session reads its input one line at a time. Every line, trimmed, is one
 * token handed to an {@link Evaluator} set up with the built-in operations,
 * the host commands ({@code print}, {@code system}, {@code exit}) and the
 * extensions given to the constructor. A failure that the evaluator
 * propagates is reported on the error stream and the session goes on with
 * the next line; {@code exit} ends the session with an {@link ExitException}.
 *
 * @see org.metricshub.jtt.backend.Evaluator
 */
public class Jtt {

	private static final Logger LOG = JttLogger.getLogger(Jtt.class);

	private final List<JttExtension> extensions;

	/**
	 * Create a new instance of Jtt without additional extensions
	 */
	public Jtt() {
		this(Collections.<JttExtension>emptyList());
	}

	/**
	 * Create a new instance of Jtt with the specified extension instances.
	 *
	 * @param extensions extensions installed after the built-in and host commands
	 */
	public Jtt(Collection<? extends JttExtension> extensions) {
		this.extensions = Collections.unmodifiableList(new ArrayList<JttExtension>(extensions));
	}

	/**
	 * Create a new instance of Jtt with the specified extension instances.
	 *
	 * @param extensions extensions installed after the built-in and host commands
	 */
	public Jtt(JttExtension... extensions) {
		this(Arrays.asList(extensions));
	}

	/**
	 * Creates an evaluator configured from the settings.
	 *
	 * @param settings session parameters
	 * @return a new evaluator
	 */
	public Evaluator createEvaluator(JttSettings settings) {
		Evaluator evaluator = new Evaluator().loadDefault();
		if (settings.isSandbox()) {
			evaluator.install(new SandboxedHostExtension(settings.getOutputStream()));
		} else {
			evaluator.install(new HostExtension(settings.getOutputStream()));
		}
		for (JttExtension extension : extensions) {
			evaluator.install(extension);
		}
		evaluator.setApprovedLevel(settings.getApprovedLevel());
		evaluator.setIndent(settings.getIndent());
		evaluator.setSection(settings.getSection());
		evaluator.setLineTerminator(settings.getLineTerminator());
		return evaluator;
	}

	/**
	 * Runs a session: reads the script sources of the settings, or its input
	 * stream when there is none, until the end of input or {@code exit}.
	 *
	 * @param settings session parameters
	 * @return the evaluator, holding the final stack and log
	 * @throws IOException when reading the input fails
	 * @throws ExitException when the {@code exit} command runs
	 */
	public Evaluator invoke(JttSettings settings) throws IOException {
		if (LOG.isDebugEnabled()) {
			LOG.debug("Session settings:\n{}", settings.toDescriptionString());
		}
		Evaluator evaluator = createEvaluator(settings);
		List<ScriptSource> sources = settings.getScriptSources();
		if (sources.isEmpty()) {
			run(new InputStreamReader(settings.getInput(), StandardCharsets.UTF_8), evaluator, settings.getErrorStream());
		} else {
			for (ScriptSource source : sources) {
				LOG.debug("Reading tokens from {}", source.getDescription());
				try (Reader reader = source.getReader()) {
					run(reader, evaluator, settings.getErrorStream());
				}
			}
		}
		return evaluator;
	}

	/**
	 * Evaluates each line of the reader as one trimmed token.
	 *
	 * @param reader token source
	 * @param evaluator evaluator to feed
	 * @param err stream where propagated failures are reported
	 * @throws IOException when reading fails
	 */
	public static void run(Reader reader, Evaluator evaluator, PrintStream err) throws IOException {
		BufferedReader lines = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
		String line;
		while ((line = lines.readLine()) != null) {
			try {
				evaluator.evaluate(line.trim());
			} catch (EvaluationException e) {
				err.printf("%s: %s%n", e.getClass().getSimpleName(), e.getDecoratedMessage());
				err.flush();
			}
		}
	}
}
