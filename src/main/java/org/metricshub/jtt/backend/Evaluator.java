package org.metricshub.jtt.backend;

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

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.metricshub.jtt.ext.Command;
import org.metricshub.jtt.ext.CommandRegistry;
import org.metricshub.jtt.ext.CoreExtension;
import org.metricshub.jtt.ext.JttExtension;
import org.metricshub.jtt.jrt.EvaluationException;
import org.metricshub.jtt.jrt.Severity;
import org.metricshub.jtt.jrt.TreeWriter;
import org.metricshub.jtt.tree.Leaf;
import org.metricshub.jtt.tree.TreeNode;
import org.metricshub.jtt.util.JttLogger;
import org.slf4j.Logger;

/**
 * Executes command tokens against a data stack.
 * <p>
 * A token naming a registered {@link Command} runs that command; any other
 * non-empty token is pushed verbatim as a {@link Leaf}. When a command fails
 * with an {@link EvaluationException}, the failure is written to the log and
 * then absorbed if its severity does not exceed the approved level, or
 * re-thrown otherwise.
 * <p>
 * An evaluator owns its stack, log, registry and approved level. It is not
 * thread-safe.
 */
public class Evaluator {

	private static final Logger LOG = JttLogger.getLogger(Evaluator.class);

	private final CommandRegistry registry = new CommandRegistry();

	private final DataStack data = new DataStack();

	private final Deque<String> log = new ArrayDeque<String>();

	private Severity approvedLevel = Severity.WARNING;

	private String indent = TreeWriter.DEFAULT_INDENT;

	private String section = TreeWriter.DEFAULT_SECTION;

	private String lineTerminator = TreeWriter.DEFAULT_LINE_TERMINATOR;

	/**
	 * Creates an evaluator with an empty registry. Use {@link #loadDefault()}
	 * to install the built-in operations.
	 */
	public Evaluator() {}

	/**
	 * Creates an evaluator and installs the supplied extensions, in order.
	 *
	 * @param extensions extensions to install
	 */
	public Evaluator(JttExtension... extensions) {
		for (JttExtension extension : extensions) {
			install(extension);
		}
	}

	/**
	 * Installs the built-in operations.
	 *
	 * @return this evaluator
	 */
	public Evaluator loadDefault() {
		return install(CoreExtension.INSTANCE);
	}

	/**
	 * Installs the commands of an extension.
	 *
	 * @param extension extension to install
	 * @return this evaluator
	 * @throws IllegalStateException when a command name is already taken
	 */
	public Evaluator install(JttExtension extension) {
		Objects.requireNonNull(extension, "extension").install(registry);
		LOG.debug("Installed extension {}, {} commands registered", extension.getExtensionName(), registry.size());
		return this;
	}

	/**
	 * Registers a single command.
	 *
	 * @param name command token
	 * @param command operation
	 * @return this evaluator
	 */
	public Evaluator register(String name, Command command) {
		registry.register(name, command);
		return this;
	}

	/**
	 * Evaluates one token, logging any failure.
	 *
	 * @param token command name or literal, empty tokens are ignored
	 * @throws EvaluationException when a failure exceeds the approved level
	 */
	public void evaluate(String token) {
		evaluate(token, true);
	}

	/**
	 * Evaluates one token.
	 *
	 * @param token command name or literal, empty tokens are ignored
	 * @param logFailure whether a failure is appended to the log
	 * @throws EvaluationException when a failure exceeds the approved level
	 */
	public void evaluate(String token, boolean logFailure) {
		try {
			dispatch(token);
		} catch (EvaluationException e) {
			if (logFailure) {
				log.addLast(describe(e, token));
			}
			handle(e, token);
		}
	}

	/**
	 * Evaluates tokens in order. A failure is logged once, together with the
	 * trace of the tokens evaluated so far. A failure above the approved level
	 * aborts the remaining tokens.
	 *
	 * @param tokens tokens to evaluate
	 * @throws EvaluationException when a failure exceeds the approved level
	 */
	public void evaluateBatch(List<String> tokens) {
		for (int i = 0; i < tokens.size(); i++) {
			String token = tokens.get(i);
			try {
				dispatch(token);
			} catch (EvaluationException e) {
				StringBuilder entry = new StringBuilder(describe(e, token));
				entry.append("\nCommand trace:");
				for (int j = 0; j <= i; j++) {
					entry.append("\n\t").append(tokens.get(j));
				}
				log.addLast(entry.toString());
				handle(e, token);
			}
		}
	}

	/**
	 * @param tokens tokens to evaluate
	 * @see #evaluateBatch(List)
	 */
	public void evaluateBatch(String... tokens) {
		evaluateBatch(Arrays.asList(tokens));
	}

	private void dispatch(String token) {
		if (token.isEmpty()) {
			return;
		}
		Command command = registry.resolve(token);
		if (command == null) {
			data.push(new Leaf(token));
		} else {
			command.apply(this);
		}
	}

	private void handle(EvaluationException e, String token) {
		if (e.getSeverity().exceeds(approvedLevel)) {
			LOG.debug("Propagating {} failure of '{}': {}", e.getKind(), token, e.getMessage());
			throw e;
		}
		LOG.warn("Absorbed {} failure of '{}': {}", e.getKind(), token, e.getDecoratedMessage());
	}

	private static String describe(EvaluationException e, String token) {
		return e.getDecoratedMessage() + "\nCaused during invoking: " + token;
	}

	/**
	 * Writes the stack, top first, with the configured indent, section marker
	 * and line terminator. The stack is left unchanged.
	 *
	 * @param out destination
	 * @throws IOException when the destination fails
	 */
	public void printData(Appendable out) throws IOException {
		TreeWriter writer = new TreeWriter(out);
		writer.setIndent(indent);
		writer.setSection(section);
		writer.setLineTerminator(lineTerminator);
		for (TreeNode node : data.topFirst()) {
			writer.write(node);
		}
	}

	/**
	 * @return the stack rendered by {@link #printData(Appendable)}
	 */
	public String dataToString() {
		StringBuilder out = new StringBuilder();
		try {
			printData(out);
		} catch (IOException e) {
			throw new IllegalStateException("StringBuilder cannot fail", e);
		}
		return out.toString();
	}

	public DataStack getData() {
		return data;
	}

	public CommandRegistry getRegistry() {
		return registry;
	}

	/**
	 * @return the log entries, oldest first
	 */
	public List<String> getLog() {
		return Collections.unmodifiableList(new ArrayList<String>(log));
	}

	/**
	 * @return the most recent log entry, or {@code null} when the log is empty
	 */
	public String peekLog() {
		return log.peekLast();
	}

	public void clearLog() {
		log.clear();
	}

	public Severity getApprovedLevel() {
		return approvedLevel;
	}

	/**
	 * @param approvedLevel highest severity absorbed instead of propagated
	 */
	public void setApprovedLevel(Severity approvedLevel) {
		this.approvedLevel = Objects.requireNonNull(approvedLevel, "approvedLevel");
	}

	public String getIndent() {
		return indent;
	}

	public void setIndent(String indent) {
		this.indent = Objects.requireNonNull(indent, "indent");
	}

	public String getSection() {
		return section;
	}

	public void setSection(String section) {
		this.section = Objects.requireNonNull(section, "section");
	}

	public String getLineTerminator() {
		return lineTerminator;
	}

	public void setLineTerminator(String lineTerminator) {
		this.lineTerminator = Objects.requireNonNull(lineTerminator, "lineTerminator");
	}
}
