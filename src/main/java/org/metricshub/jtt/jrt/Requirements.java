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

import org.metricshub.jtt.tree.Branch;
import org.metricshub.jtt.tree.Leaf;
import org.metricshub.jtt.tree.TreeNode;

/**
 * Single-node argument checks shared by the built-in operations and by
 * extension commands. Every violation raises an {@link EvaluationException}
 * of severity {@link Severity#CRITICAL}.
 */
public final class Requirements {

	/** Longest digit string accepted as an unsigned integer. */
	public static final int MAX_INTEGER_DIGITS = 8;

	private Requirements() {}

	/**
	 * @param node node to check
	 * @return the node as a leaf
	 * @throws EvaluationException {@link ErrorKind#TYPE_MISMATCH} when it is a branch
	 */
	public static Leaf requireLeaf(TreeNode node) {
		return node.asLeaf();
	}

	/**
	 * @param node node to check
	 * @return the node as a branch
	 * @throws EvaluationException {@link ErrorKind#TYPE_MISMATCH} when it is a leaf
	 */
	public static Branch requireBranch(TreeNode node) {
		return node.asBranch();
	}

	/**
	 * Checks that the node is a leaf whose text is 1 to 8 ASCII digits, with no
	 * sign, whitespace or prefix.
	 *
	 * @param node node to check
	 * @return the node as a leaf
	 * @throws EvaluationException {@link ErrorKind#TYPE_MISMATCH} for a branch,
	 *         {@link ErrorKind#INVALID_INTEGER} for a malformed value
	 */
	public static Leaf requireUnsignedInteger(TreeNode node) {
		Leaf leaf = requireLeaf(node);
		String text = leaf.getText();
		if (text.length() > MAX_INTEGER_DIGITS) {
			throw new EvaluationException(ErrorKind.INVALID_INTEGER, "Number larger than integer");
		}
		if (text.isEmpty()) {
			throw new EvaluationException(ErrorKind.INVALID_INTEGER, "Passing empty as number");
		}
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c < '0' || c > '9') {
				throw new EvaluationException(ErrorKind.INVALID_INTEGER, "Not a number passed as an integer");
			}
		}
		return leaf;
	}

	/**
	 * Validates the node with {@link #requireUnsignedInteger(TreeNode)} and
	 * returns its value. Eight digits always fit in an {@code int}.
	 *
	 * @param node node to read
	 * @return the decimal value
	 */
	public static int toUnsignedInt(TreeNode node) {
		return Integer.parseInt(requireUnsignedInteger(node).getText());
	}

	/**
	 * Returns the child at a position, checking bounds first.
	 *
	 * @param branch branch to index
	 * @param index zero-based position
	 * @return the child (not a copy)
	 * @throws EvaluationException {@link ErrorKind#INDEX_OUT_OF_RANGE} when out of bounds
	 */
	public static TreeNode requireChild(Branch branch, int index) {
		if (index < 0 || index >= branch.size()) {
			throw new EvaluationException(
					ErrorKind.INDEX_OUT_OF_RANGE,
					"Index " + index + " out of range for branch of size " + branch.size());
		}
		return branch.get(index);
	}
}
