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

import java.util.Objects;

/**
 * A runtime exception raised by a command while it manipulates the data
 * stack. Every instance carries an {@link ErrorKind} and a {@link Severity};
 * the evaluator decides from the severity whether the failure is absorbed into
 * its log or propagated to the caller.
 */
public class EvaluationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ErrorKind kind;

	private final Severity severity;

	/**
	 * Creates an exception reported with the default severity of its kind.
	 *
	 * @param kind failure kind
	 * @param msg human readable description
	 */
	public EvaluationException(ErrorKind kind, String msg) {
		this(kind, kind.getSeverity(), msg, null);
	}

	/**
	 * Creates an exception reported with the default severity of its kind.
	 *
	 * @param kind failure kind
	 * @param msg human readable description
	 * @param cause underlying failure
	 */
	public EvaluationException(ErrorKind kind, String msg, Throwable cause) {
		this(kind, kind.getSeverity(), msg, cause);
	}

	/**
	 * Creates an exception with an explicit severity. Extension commands use
	 * this to report failures that may be absorbed (e.g. {@link Severity#WARNING}).
	 *
	 * @param kind failure kind
	 * @param severity severity to report
	 * @param msg human readable description
	 * @param cause underlying failure, may be {@code null}
	 */
	public EvaluationException(ErrorKind kind, Severity severity, String msg, Throwable cause) {
		super(msg, cause);
		this.kind = Objects.requireNonNull(kind, "kind");
		this.severity = Objects.requireNonNull(severity, "severity");
	}

	public ErrorKind getKind() {
		return kind;
	}

	public Severity getSeverity() {
		return severity;
	}

	/**
	 * Returns the message suffixed with the severity label, as it appears in
	 * the evaluator log: {@code Required argument, but not passed [Critical]}.
	 *
	 * @return the decorated message
	 */
	public String getDecoratedMessage() {
		return getMessage() + " [" + severity.getLabel() + "]";
	}
}
