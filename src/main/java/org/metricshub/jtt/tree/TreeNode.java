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

import org.metricshub.jtt.jrt.ErrorKind;
import org.metricshub.jtt.jrt.EvaluationException;

/**
 * A node of the recursive structure the command language operates on: either
 * a {@link Leaf} holding text or a {@link Branch} holding ordered children.
 * <p>
 * Nodes are owned by exactly one stack slot or one parent branch. Code that
 * needs to keep a node it does not own must {@link #copy()} it.
 */
public abstract class TreeNode {

	TreeNode() {}

	/**
	 * @return the variant tag of this node
	 */
	public abstract NodeKind getKind();

	/**
	 * Computes the depth of this node: 0 for a leaf, one more than the deepest
	 * child for a branch, 1 for an empty branch. The value is not cached.
	 *
	 * @return the structural depth
	 */
	public abstract int depth();

	/**
	 * Produces a fully independent clone of this node and everything below it.
	 *
	 * @return the clone
	 */
	public abstract TreeNode copy();

	public boolean isLeaf() {
		return getKind() == NodeKind.LEAF;
	}

	public boolean isBranch() {
		return getKind() == NodeKind.BRANCH;
	}

	/**
	 * Returns this node viewed as a leaf.
	 *
	 * @return this node
	 * @throws EvaluationException of kind {@link ErrorKind#TYPE_MISMATCH} when
	 *         this node is a branch
	 */
	public Leaf asLeaf() {
		throw new EvaluationException(ErrorKind.TYPE_MISMATCH, "Branch as value argument");
	}

	/**
	 * Returns this node viewed as a branch.
	 *
	 * @return this node
	 * @throws EvaluationException of kind {@link ErrorKind#TYPE_MISMATCH} when
	 *         this node is a leaf
	 */
	public Branch asBranch() {
		throw new EvaluationException(ErrorKind.TYPE_MISMATCH, "Value as branch argument");
	}
}
