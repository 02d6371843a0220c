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

import java.util.ArrayDeque;
import java.util.Deque;
import org.metricshub.jtt.tree.Branch;
import org.metricshub.jtt.tree.TreeNode;

/**
 * Interpreter of the compact shape patterns used to validate a whole branch
 * in one pass.
 * <p>
 * Opcodes are read left to right against a stack of cursors. The first cursor
 * points at the first child of the validated branch.
 * <ul>
 * <li>{@code b}: the child under the cursor must be a branch; the cursor
 * advances and a new cursor opens at the first child of that branch
 * <li>{@code v}: the child must be a leaf
 * <li>{@code i}: the child must be an unsigned integer leaf
 * <li>{@code e}: any child, skipped
 * <li>{@code .}: closes the innermost open branch
 * </ul>
 * Children left after the last opcode are not checked, so a pattern asserts a
 * prefix of each branch. A pattern holds at least one opcode.
 */
public final class ShapeValidator {

	private ShapeValidator() {}

	/**
	 * Validates a node against a pattern.
	 *
	 * @param pattern opcode string, not empty
	 * @param node node to validate, must be a branch
	 * @throws EvaluationException {@link ErrorKind#TYPE_MISMATCH},
	 *         {@link ErrorKind#INVALID_INTEGER},
	 *         {@link ErrorKind#INDEX_OUT_OF_RANGE} or
	 *         {@link ErrorKind#PATTERN_SYNTAX_ERROR}
	 */
	public static void require(String pattern, TreeNode node) {
		Branch root = Requirements.requireBranch(node);
		if (pattern.isEmpty()) {
			throw syntaxError("empty pattern");
		}
		Deque<Cursor> cursors = new ArrayDeque<Cursor>();
		cursors.push(new Cursor(root));
		for (int idx = 0; idx < pattern.length(); idx++) {
			char opcode = pattern.charAt(idx);
			Cursor cursor = cursors.peek();
			if (cursor == null) {
				throw syntaxError("opcode '" + opcode + "' at position " + idx + " follows the closed root");
			}
			switch (opcode) {
			case '.':
				cursors.pop();
				break;
			case 'b':
				cursors.push(new Cursor(Requirements.requireBranch(cursor.next())));
				break;
			case 'v':
				Requirements.requireLeaf(cursor.next());
				break;
			case 'i':
				Requirements.requireUnsignedInteger(cursor.next());
				break;
			case 'e':
				cursor.next();
				break;
			default:
				throw syntaxError("unknown opcode '" + opcode + "' at position " + idx);
			}
		}
	}

	private static EvaluationException syntaxError(String detail) {
		return new EvaluationException(ErrorKind.PATTERN_SYNTAX_ERROR, "Require syntax error: " + detail);
	}

	/**
	 * Position within one open branch.
	 */
	private static final class Cursor {
		private final Branch branch;
		private int position;

		Cursor(Branch branch) {
			this.branch = branch;
		}

		TreeNode next() {
			return Requirements.requireChild(branch, position++);
		}
	}
}
