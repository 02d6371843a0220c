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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps command names to {@link Command} instances. Lookup is by exact string
 * equality and every name is registered at most once.
 * <p>
 * Each {@link org.metricshub.jtt.backend.Evaluator} owns its own registry.
 */
public final class CommandRegistry {

	private final Map<String, Command> commands = new HashMap<String, Command>();

	/**
	 * Registers a command under the supplied name.
	 *
	 * @param name command token
	 * @param command operation to run for the token
	 * @throws IllegalArgumentException when the name is empty
	 * @throws IllegalStateException when the name is already registered
	 */
	public void register(String name, Command command) {
		Objects.requireNonNull(name, "Command name must not be null");
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Command name must not be empty");
		}
		Objects.requireNonNull(command, "Command must not be null");
		Command existing = commands.putIfAbsent(name, command);
		if (existing != null) {
			throw new IllegalStateException("Command '" + name + "' is already registered");
		}
	}

	/**
	 * @param name command token
	 * @return the command, or {@code null} when the token is not registered
	 */
	public Command resolve(String name) {
		return commands.get(name);
	}

	public boolean contains(String name) {
		return commands.containsKey(name);
	}

	public int size() {
		return commands.size();
	}

	/**
	 * @return the registered names, sorted
	 */
	public List<String> names() {
		List<String> names = new ArrayList<String>(commands.keySet());
		Collections.sort(names);
		return Collections.unmodifiableList(names);
	}
}
