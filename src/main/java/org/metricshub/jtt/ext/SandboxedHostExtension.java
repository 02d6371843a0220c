package org.metricshub.jtt.ext;

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

import java.io.PrintStream;
import org.metricshub.jtt.JttSandboxException;
import org.metricshub.jtt.backend.Evaluator;

/**
 * Host commands for sandbox mode: {@code print} and {@code exit} behave as in
 * {@link HostExtension}, {@code system} raises {@link JttSandboxException}
 * and leaves the stack untouched.
 */
public class SandboxedHostExtension extends HostExtension {

	public SandboxedHostExtension(PrintStream out) {
		super(out);
	}

	@Override
	public String getExtensionName() {
		return "Sandboxed Host";
	}

	@Override
	protected void system(Evaluator evaluator) {
		throw new JttSandboxException("system is disabled in sandbox mode");
	}
}
