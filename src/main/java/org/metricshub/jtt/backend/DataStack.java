package org.metricshub.jtt.backend;

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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.metricshub.jtt.jrt.ErrorKind;
import org.metricshub.jtt.jrt.EvaluationException;
import org.metricshub.jtt.jrt.Requirements;
import org.metricshub.jtt.tree.Branch;
import org.metricshub.jtt.tree.Leaf;
import org.metricshub.jtt.tree.TreeNode;

/**
 * The LIFO sequence of nodes all commands operate on.
 * <p>
 * Each slot owns its node. Pushing a node that is still reachable from
 * another slot or branch breaks the no-sharing rule; copy it first.
 */
public class DataStack {

	private final Deque<TreeNode> nodes = new ArrayDeque<TreeNode>();

	public void push(TreeNode node) {
		nodes.push(Objects.requireNonNull(node, "node"));
	}

	/**
	 * Pushes nodes so that the last one ends up on top.
	 *
	 * @param bottomToTop nodes in push order
	 */
	public void pushAll(List<? extends TreeNode> bottomToTop) {
		for (TreeNode node : bottomToTop) {
			push(node);
		}
	}

	/**
	 * @return the removed top node
	 * @throws EvaluationException {@link ErrorKind#MISSING_ARGUMENT} when empty
	 */
	public TreeNode pop() {
		requireSize(1);
		return nodes.pop();
	}

	/**
	 * @return the top node, still owned by the stack
	 * @throws EvaluationException {@link ErrorKind#MISSING_ARGUMENT} when empty
	 */
	public TreeNode peek() {
		requireSize(1);
		return nodes.peek();
	}

	/**
	 * Removes the top {@code count} nodes.
	 *
	 * @param count number of nodes
	 * @return the removed nodes in bottom-to-top order
	 * @throws EvaluationException {@link ErrorKind#MISSING_ARGUMENT} when fewer are present
	 */
	public List<TreeNode> pop(int count) {
		requireSize(count);
		List<TreeNode> removed = new ArrayList<TreeNode>(count);
		for (int i = 0; i < count; i++) {
			removed.add(nodes.pop());
		}
		Collections.reverse(removed);
		return removed;
	}

	public Leaf popLeaf() {
		Requirements.requireLeaf(peek());
		return nodes.pop().asLeaf();
	}

	public Leaf peekLeaf() {
		return Requirements.requireLeaf(peek());
	}

	public Branch popBranch() {
		Requirements.requireBranch(peek());
		return nodes.pop().asBranch();
	}

	public Branch peekBranch() {
		return Requirements.requireBranch(peek());
	}

	/**
	 * Pops the top node as an unsigned integer. The node stays on the stack
	 * when it is not a valid integer.
	 *
	 * @return the decimal value
	 */
	public int popUnsignedInt() {
		int value = Requirements.toUnsignedInt(peek());
		nodes.pop();
		return value;
	}

	/**
	 * @param count minimum number of nodes
	 * @throws EvaluationException {@link ErrorKind#MISSING_ARGUMENT} when fewer are present
	 */
	public void requireSize(int count) {
		if (nodes.size() < count) {
			throw new EvaluationException(ErrorKind.MISSING_ARGUMENT, "Required argument, but not passed");
		}
	}

	public int size() {
		return nodes.size();
	}

	public boolean isEmpty() {
		return nodes.isEmpty();
	}

	public void clear() {
		nodes.clear();
	}

	/**
	 * @return read-only view of the nodes, top first
	 */
	public List<TreeNode> topFirst() {
		return Collections.unmodifiableList(new ArrayList<TreeNode>(nodes));
	}

	@Override
	public String toString() {
		return nodes.toString();
	}
}
