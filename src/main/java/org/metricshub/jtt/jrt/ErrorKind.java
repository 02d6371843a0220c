package org.metricshub.jtt.jrt;

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

/**
 * Kinds of failures raised while evaluating commands, each with the severity
 * it is reported with.
 */
public enum ErrorKind {
	/** An operation needs more stack items than are present. */
	MISSING_ARGUMENT(Severity.CRITICAL),
	/** A leaf was required but a branch was found, or the reverse. */
	TYPE_MISMATCH(Severity.CRITICAL),
	/** A value used as an unsigned integer is empty, too long or not all digits. */
	INVALID_INTEGER(Severity.CRITICAL),
	/** Row split with an empty separator. */
	EMPTY_SEPARATOR(Severity.CRITICAL),
	/** Column extraction below depth 1. */
	INVALID_DEPTH(Severity.CRITICAL),
	/** Unknown opcode or unbalanced scope in a shape pattern. */
	PATTERN_SYNTAX_ERROR(Severity.CRITICAL),
	/** A child position beyond the end of a branch. */
	INDEX_OUT_OF_RANGE(Severity.CRITICAL),
	/** A host command could not run. */
	HOST_FAILURE(Severity.CRITICAL),
	/** A host command refused in sandbox mode. */
	SANDBOX_VIOLATION(Severity.FATAL);

	private final Severity severity;

	ErrorKind(Severity severity) {
		this.severity = severity;
	}

	public Severity getSeverity() {
		return severity;
	}
}
