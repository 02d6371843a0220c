package org.metricshub.jtt.tree;

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
 * Terminal node holding a text payload. The payload may be empty but never
 * {@code null}.
 */
public final class Leaf extends TreeNode {

	private String text;

	/**
	 * Creates a leaf with empty text.
	 */
	public Leaf() {
		this("");
	}

	/**
	 * @param text payload, must not be {@code null}
	 */
	public Leaf(String text) {
		this.text = Objects.requireNonNull(text, "text");
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.LEAF;
	}

	@Override
	public int depth() {
		return 0;
	}

	@Override
	public Leaf copy() {
		return new Leaf(text);
	}

	@Override
	public Leaf asLeaf() {
		return this;
	}

	public String getText() {
		return text;
	}

	public void setText(String text) {
		this.text = Objects.requireNonNull(text, "text");
	}

	public boolean isEmpty() {
		return text.isEmpty();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Leaf)) {
			return false;
		}
		return text.equals(((Leaf) obj).text);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	@Override
	public String toString() {
		return text;
	}
}
