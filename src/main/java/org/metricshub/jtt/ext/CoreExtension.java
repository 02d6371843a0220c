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

import org.metricshub.jtt.jrt.TreeOperations;

/**
 * Binds the built-in operations to their tokens.
 * <p>
 * Token alphabet:
 * <ul>
 * <li>{@code ^} pack, {@code t} top only, {@code c} count argument
 * <li>{@code |} generative, {@code i} index argument, {@code d} depth argument,
 * {@code g} grouped
 * <li>{@code #} removal, {@code $} row operation, {@code _} reverse,
 * {@code ?} validation
 * </ul>
 */
public final class CoreExtension implements JttExtension {

	public static final CoreExtension INSTANCE = new CoreExtension();

	private CoreExtension() {}

	@Override
	public String getExtensionName() {
		return "Core";
	}

	@Override
	public void install(CommandRegistry registry) {
		registry.register("^t", e -> TreeOperations.packTop(e.getData()));
		registry.register("^", e -> TreeOperations.packSameDepth(e.getData()));
		registry.register("^_t", e -> TreeOperations.unpackTop(e.getData()));
		registry.register("^tc", e -> TreeOperations.packTopCount(e.getData()));

		registry.register("|Eb", e -> TreeOperations.makeEmptyBranch(e.getData()));
		registry.register("|Ev", e -> TreeOperations.makeEmptyLeaf(e.getData()));
		registry.register("|i", e -> TreeOperations.copyChildAtIndex(e.getData()));
		registry.register("|[", e -> TreeOperations.copyChildAtIndex(e.getData()));
		registry.register("|id", e -> TreeOperations.extractColumn(e.getData()));
		registry.register("|]", e -> TreeOperations.extractColumn(e.getData()));
		registry.register("|]g", e -> TreeOperations.extractGroupedColumn(e.getData()));

		registry.register("|", e -> TreeOperations.copy(e.getData()));
		registry.register("|c", e -> TreeOperations.duplicate(e.getData()));

		registry.register("#", e -> TreeOperations.pop(e.getData()));
		registry.register("#d", e -> TreeOperations.deepRemove(e.getData()));

		registry.register("$", e -> TreeOperations.undot(e.getData()));
		registry.register("$^", e -> TreeOperations.concatRow(e.getData()));
		registry.register("$_", e -> TreeOperations.splitRow(e.getData()));

		registry.register("_", e -> TreeOperations.reverse(e.getData()));

		registry.register("?s", e -> TreeOperations.requireShape(e.getData()));
	}
}
