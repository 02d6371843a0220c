package org.metricshub.jtt.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.jtt.jrt.Severity;
import org.metricshub.jtt.jrt.TreeWriter;

/**
 * A simple container for the parameters of a single Jtt session.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Jtt programmatically, from within Java code.
 */
public class JttSettings {

	/**
	 * Where tokens are read from when no script source is given.
	 * By default, this is {@link System#in}.
	 */
	private InputStream input = System.in;

	/**
	 * Script sources read, in order, instead of {@link #input}.
	 */
	private List<ScriptSource> scriptSources = new ArrayList<ScriptSource>();

	/**
	 * Output stream of the {@code print} and {@code system} commands;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Stream where propagated failures are reported;
	 * <code>System.err</code> by default.
	 */
	private PrintStream errorStream = System.err;

	/**
	 * Highest severity absorbed by the evaluator;
	 * <code>WARNING</code> by default.
	 */
	private Severity approvedLevel = Severity.WARNING;

	/**
	 * Whether the {@code system} command is refused;
	 * <code>false</code> by default.
	 */
	private boolean sandbox = false;

	private String indent = TreeWriter.DEFAULT_INDENT;

	private String section = TreeWriter.DEFAULT_SECTION;

	private String lineTerminator = TreeWriter.DEFAULT_LINE_TERMINATOR;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("scriptSources = ").append(scriptSources).append(newLine);
		desc.append("approvedLevel = ").append(approvedLevel).append(newLine);
		desc.append("sandbox = ").append(sandbox).append(newLine);
		desc.append("section = ").append(section).append(newLine);

		return desc.toString();
	}

	public InputStream getInput() {
		return input;
	}

	public void setInput(InputStream input) {
		this.input = input;
	}

	public List<ScriptSource> getScriptSources() {
		return new ArrayList<ScriptSource>(scriptSources);
	}

	public void addScriptSource(ScriptSource scriptSource) {
		scriptSources.add(scriptSource);
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getErrorStream() {
		return errorStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setErrorStream(PrintStream errorStream) {
		this.errorStream = errorStream;
	}

	public Severity getApprovedLevel() {
		return approvedLevel;
	}

	public void setApprovedLevel(Severity approvedLevel) {
		this.approvedLevel = approvedLevel;
	}

	public boolean isSandbox() {
		return sandbox;
	}

	public void setSandbox(boolean sandbox) {
		this.sandbox = sandbox;
	}

	/**
	 * Indentation unit of printed trees, one tab by default.
	 *
	 * @return the indent unit
	 */
	public String getIndent() {
		return indent;
	}

	public void setIndent(String indent) {
		this.indent = indent;
	}

	/**
	 * Marker line printed for a branch, {@code ./section} by default.
	 *
	 * @return the section marker
	 */
	public String getSection() {
		return section;
	}

	public void setSection(String section) {
		this.section = section;
	}

	public String getLineTerminator() {
		return lineTerminator;
	}

	public void setLineTerminator(String lineTerminator) {
		this.lineTerminator = lineTerminator;
	}
}
