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
import java.util.Iterator;
import java.util.List;
import org.metricshub.jtt.backend.DataStack;
import org.metricshub.jtt.tree.Branch;
import org.metricshub.jtt.tree.Leaf;
import org.metricshub.jtt.tree.TreeNode;

/**
 * The built-in stack operations. Each method reads its arguments from the top
 * of the supplied stack, the last argument being on top.
 * <p>
 * Operations are not transactional: when an argument check fails, arguments
 * already consumed stay consumed.
 */
public final class TreeOperations {

	private TreeOperations() {}

	/**
	 * Wraps the top node alone in a new branch.
	 *
	 * @param stack data stack
	 */
	public static void packTop(DataStack stack) {
		stack.push(Branch.of(stack.pop()));
	}

	/**
	 * Pops every node from the top that has the same depth as the top node and
	 * wraps them in a branch. The children are in pop order, so the former top
	 * becomes the first child.
	 *
	 * @param stack data stack
	 */
	public static void packSameDepth(DataStack stack) {
		int depth = stack.peek().depth();
		Branch packed = new Branch();
		while (!stack.isEmpty() && stack.peek().depth() == depth) {
			packed.add(stack.pop());
		}
		stack.push(packed);
	}

	/**
	 * Pops a count {@code c}, then wraps the top {@code c} nodes in a branch,
	 * keeping their bottom-to-top order.
	 *
	 * @param stack data stack
	 */
	public static void packTopCount(DataStack stack) {
		int count = stack.popUnsignedInt();
		if (stack.size() < count) {
			throw new EvaluationException(ErrorKind.MISSING_ARGUMENT, "Too few arguments to pack");
		}
		stack.push(new Branch(stack.pop(count)));
	}

	/**
	 * Pops a branch and pushes its children in order, the last child ending on
	 * top. The popped branch is discarded, so its children change owner
	 * without being shared.
	 *
	 * @param stack data stack
	 */
	public static void unpackTop(DataStack stack) {
		stack.pushAll(stack.popBranch().detachChildren());
	}

	public static void makeEmptyBranch(DataStack stack) {
		stack.push(new Branch());
	}

	public static void makeEmptyLeaf(DataStack stack) {
		stack.push(new Leaf());
	}

	/**
	 * Pops an index {@code i} and pushes a copy of child {@code i} of the
	 * branch below it. The branch stays on the stack.
	 *
	 * @param stack data stack
	 */
	public static void copyChildAtIndex(DataStack stack) {
		int index = stack.popUnsignedInt();
		Branch branch = stack.peekBranch();
		stack.push(Requirements.requireChild(branch, index).copy());
	}

	public static void copy(DataStack stack) {
		stack.push(stack.peek().copy());
	}

	/**
	 * Pops a count {@code c} and pushes copies of the new top until {@code c}
	 * equal nodes are on top. A count of 0 or 1 leaves the stack unchanged
	 * below the count.
	 *
	 * @param stack data stack
	 */
	public static void duplicate(DataStack stack) {
		int count = stack.popUnsignedInt();
		TreeNode top = stack.peek();
		for (int i = 1; i < count; i++) {
			stack.push(top.copy());
		}
	}

	public static void pop(DataStack stack) {
		stack.pop();
	}

	/**
	 * Pops a count {@code c} and removes the node under the top {@code c}
	 * nodes, which keep their order.
	 *
	 * @param stack data stack
	 */
	public static void deepRemove(DataStack stack) {
		int count = stack.popUnsignedInt();
		stack.requireSize(count + 1);
		List<TreeNode> kept = stack.pop(count);
		stack.pop();
		stack.pushAll(kept);
	}

	/**
	 * Strips one leading dot from the top leaf, if present.
	 *
	 * @param stack data stack
	 */
	public static void undot(DataStack stack) {
		Leaf leaf = stack.peekLeaf();
		if (leaf.getText().startsWith(".")) {
			leaf.setText(leaf.getText().substring(1));
		}
	}

	/**
	 * Pops a separator and a source leaf and pushes a branch of the segments
	 * of the source.
	 *
	 * @param stack data stack
	 * @see #split(String, String)
	 */
	public static void splitRow(DataStack stack) {
		String separator = stack.peekLeaf().getText();
		if (separator.isEmpty()) {
			throw new EvaluationException(ErrorKind.EMPTY_SEPARATOR, "Empty passed as split");
		}
		stack.pop();
		String source = stack.popLeaf().getText();
		stack.push(split(source, separator));
	}

	/**
	 * Splits text on each literal, non-overlapping occurrence of a separator,
	 * scanning left to right. Empty segments are kept, so {@code n}
	 * occurrences always give {@code n + 1} leaves.
	 *
	 * @param source text to split
	 * @param separator non-empty separator
	 * @return a branch of leaves
	 */
	public static Branch split(String source, String separator) {
		Branch row = new Branch();
		int start = 0;
		int found = source.indexOf(separator, start);
		while (found >= 0) {
			row.add(new Leaf(source.substring(start, found)));
			start = found + separator.length();
			found = source.indexOf(separator, start);
		}
		row.add(new Leaf(source.substring(start)));
		return row;
	}

	/**
	 * Pops a separator and a branch, and pushes a leaf joining the texts of
	 * the direct leaf children of the branch. Branch children are skipped.
	 *
	 * @param stack data stack
	 */
	public static void concatRow(DataStack stack) {
		String separator = stack.popLeaf().getText();
		Branch row = stack.popBranch();
		StringBuilder joined = new StringBuilder();
		boolean first = true;
		for (TreeNode child : row.getChildren()) {
			if (child.isLeaf()) {
				if (!first) {
					joined.append(separator);
				}
				first = false;
				joined.append(child.asLeaf().getText());
			}
		}
		stack.push(new Leaf(joined.toString()));
	}

	/**
	 * Reverses the top node in place: the characters of a leaf, or the direct
	 * children of a branch.
	 *
	 * @param stack data stack
	 */
	public static void reverse(DataStack stack) {
		TreeNode top = stack.peek();
		switch (top.getKind()) {
		case LEAF:
			Leaf leaf = top.asLeaf();
			leaf.setText(new StringBuilder(leaf.getText()).reverse().toString());
			break;
		case BRANCH:
			top.asBranch().reverse();
			break;
		default:
			throw new IllegalStateException("Unknown node kind " + top.getKind());
		}
	}

	/**
	 * Pops a column index and a depth, then pushes a flat branch holding a copy
	 * of the child at that index of every branch found at that depth below the
	 * tree on top. The tree itself is at depth 1.
	 * <p>
	 * A row without a child at the index adds nothing, so columns of
	 * irregular rows do not line up.
	 *
	 * @param stack data stack
	 */
	public static void extractColumn(DataStack stack) {
		extract(stack, false);
	}

	/**
	 * Same extraction as {@link #extractColumn(DataStack)}, but every branch
	 * crossed above the target depth gets an empty counterpart in the output,
	 * so the extracted values keep their original grouping.
	 *
	 * @param stack data stack
	 */
	public static void extractGroupedColumn(DataStack stack) {
		extract(stack, true);
	}

	private static void extract(DataStack stack, boolean grouped) {
		int index = stack.popUnsignedInt();
		int depth = stack.popUnsignedInt();
		if (depth < 1) {
			throw new EvaluationException(ErrorKind.INVALID_DEPTH, "Cannot extract from zero depth");
		}
		Branch tree = stack.peekBranch();
		Branch column = new Branch();
		collectColumn(tree, depth, index, column, grouped);
		stack.push(column);
	}

	private static void collectColumn(Branch tree, int depth, int index, Branch out, boolean grouped) {
		if (depth == 1) {
			takeColumn(tree, index, out);
			return;
		}
		// one entry per open branch above the target depth; the root is level 1
		Deque<Iterator<TreeNode>> open = new ArrayDeque<Iterator<TreeNode>>();
		Deque<Branch> targets = new ArrayDeque<Branch>();
		open.push(tree.getChildren().iterator());
		targets.push(out);
		while (!open.isEmpty()) {
			Iterator<TreeNode> it = open.peek();
			if (!it.hasNext()) {
				open.pop();
				targets.pop();
				continue;
			}
			TreeNode child = it.next();
			if (!child.isBranch()) {
				continue;
			}
			Branch target = targets.peek();
			if (grouped) {
				Branch group = new Branch();
				target.add(group);
				target = group;
			}
			if (open.size() + 1 == depth) {
				takeColumn(child.asBranch(), index, target);
			} else {
				open.push(child.asBranch().getChildren().iterator());
				targets.push(target);
			}
		}
	}

	private static void takeColumn(Branch row, int index, Branch out) {
		if (index < row.size()) {
			out.add(row.get(index).copy());
		}
	}

	/**
	 * Pops a shape pattern and validates the branch below it, which stays on
	 * the stack.
	 *
	 * @param stack data stack
	 * @see ShapeValidator
	 */
	public static void requireShape(DataStack stack) {
		String pattern = stack.popLeaf().getText();
		ShapeValidator.require(pattern, stack.peek());
	}
}
