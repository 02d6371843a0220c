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
 * Ordered classification of evaluation failures.
 * <p>
 * The declaration order is significant: the evaluator compares a failure's
 * severity against its approved level with {@link #compareTo(Enum)}, and
 * absorbs the failure when it is not strictly greater.
 */
public enum Severity {
	WARNING("Warning"),
	MINOR("Minor"),
	CRITICAL("Critical"),
	FATAL("Fatal");

	private final String label;

	Severity(String label) {
		this.label = label;
	}

	/**
	 * @return the label used in log entries, e.g. {@code Critical}
	 */
	public String getLabel() {
		return label;
	}

	/**
	 * Tells whether a failure of this severity is above the supplied threshold
	 * and must therefore be propagated.
	 *
	 * @param approvedLevel highest severity that is absorbed
	 * @return {@code true} when this severity is strictly greater
	 */
	public boolean exceeds(Severity approvedLevel) {
		return compareTo(approvedLevel) > 0;
	}

	/**
	 * Parses a severity name, ignoring case.
	 *
	 * @param name one of {@code warning}, {@code minor}, {@code critical}, {@code fatal}
	 * @return the matching severity
	 * @throws IllegalArgumentException when the name is unknown
	 */
	public static Severity parse(String name) {
		if (name != null) {
			for (Severity severity : values()) {
				if (severity.name().equalsIgnoreCase(name.trim())) {
					return severity;
				}
			}
		}
		throw new IllegalArgumentException("Unknown severity: " + name);
	}
}
