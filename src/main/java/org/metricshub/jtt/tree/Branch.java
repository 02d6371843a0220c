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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Internal node owning an ordered list of children. Order is significant,
 * equal children may repeat and the list may be empty.
 * <p>
 * The branch owns its children outright: a node added here must not be
 * reachable from anywhere else.
 * <p>
 * Walks over the subtree ({@link #depth()}, {@link #copy()}, equality,
 * hashing and {@link #toString()}) keep their own stack of pending branches,
 * so nesting depth is bounded by memory, not by the thread stack.
 */
public final class Branch extends TreeNode {

	private final List<TreeNode> children;

	/**
	 * Creates an empty branch.
	 */
	public Branch() {
		this.children = new ArrayList<TreeNode>();
	}

	/**
	 * Creates a branch that takes ownership of the supplied nodes, in order.
	 *
	 * @param nodes children of the new branch
	 */
	public Branch(Collection<? extends TreeNode> nodes) {
		this.children = new ArrayList<TreeNode>(nodes.size());
		for (TreeNode node : nodes) {
			add(node);
		}
	}

	/**
	 * Convenience factory for tests and extensions.
	 *
	 * @param nodes children of the new branch
	 * @return a branch owning the nodes
	 */
	public static Branch of(TreeNode... nodes) {
		Branch branch = new Branch();
		for (TreeNode node : nodes) {
			branch.add(node);
		}
		return branch;
	}

	/**
	 * Builds a branch of leaves from plain strings.
	 *
	 * @param texts leaf payloads
	 * @return a branch of leaves
	 */
	public static Branch ofLeaves(String... texts) {
		Branch branch = new Branch();
		for (String text : texts) {
			branch.add(new Leaf(text));
		}
		return branch;
	}

	@Override
	public NodeKind getKind() {
		return NodeKind.BRANCH;
	}

	/**
	 * The depth of a branch is the nesting level of its deepest branch,
	 * counting this one as level 1.
	 */
	@Override
	public int depth() {
		int max = 1;
		Deque<Branch> pending = new ArrayDeque<Branch>();
		Deque<Integer> levels = new ArrayDeque<Integer>();
		pending.push(this);
		levels.push(1);
		while (!pending.isEmpty()) {
			Branch branch = pending.pop();
			int level = levels.pop();
			max = Math.max(max, level);
			for (TreeNode child : branch.children) {
				if (child.isBranch()) {
					pending.push(child.asBranch());
					levels.push(level + 1);
				}
			}
		}
		return max;
	}

	@Override
	public Branch copy() {
		Branch clone = new Branch();
		Deque<Branch> sources = new ArrayDeque<Branch>();
		Deque<Branch> targets = new ArrayDeque<Branch>();
		sources.push(this);
		targets.push(clone);
		while (!sources.isEmpty()) {
			Branch source = sources.pop();
			Branch target = targets.pop();
			for (TreeNode child : source.children) {
				if (child.isBranch()) {
					Branch nested = new Branch();
					target.children.add(nested);
					sources.push(child.asBranch());
					targets.push(nested);
				} else {
					target.children.add(child.copy());
				}
			}
		}
		return clone;
	}

	@Override
	public Branch asBranch() {
		return this;
	}

	/**
	 * Appends a child. The branch becomes its owner.
	 *
	 * @param child node to append
	 */
	public void add(TreeNode child) {
		children.add(Objects.requireNonNull(child, "child"));
	}

	/**
	 * @param index zero-based position
	 * @return the child at that position
	 * @throws IndexOutOfBoundsException when the position is out of range
	 */
	public TreeNode get(int index) {
		return children.get(index);
	}

	public int size() {
		return children.size();
	}

	public boolean isEmpty() {
		return children.isEmpty();
	}

	/**
	 * @return read-only view of the children
	 */
	public List<TreeNode> getChildren() {
		return Collections.unmodifiableList(children);
	}

	/**
	 * Reverses the order of the direct children in place.
	 */
	public void reverse() {
		Collections.reverse(children);
	}

	/**
	 * Removes and returns all children, leaving this branch empty. Ownership
	 * passes to the caller.
	 *
	 * @return the former children, in order
	 */
	public List<TreeNode> detachChildren() {
		List<TreeNode> detached = new ArrayList<TreeNode>(children);
		children.clear();
		return detached;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Branch)) {
			return false;
		}
		Deque<Branch> left = new ArrayDeque<Branch>();
		Deque<Branch> right = new ArrayDeque<Branch>();
		left.push(this);
		right.push((Branch) obj);
		while (!left.isEmpty()) {
			List<TreeNode> a = left.pop().children;
			List<TreeNode> b = right.pop().children;
			if (a.size() != b.size()) {
				return false;
			}
			for (int i = 0; i < a.size(); i++) {
				TreeNode x = a.get(i);
				TreeNode y = b.get(i);
				if (x.getKind() != y.getKind()) {
					return false;
				}
				if (x.isBranch()) {
					left.push(x.asBranch());
					right.push(y.asBranch());
				} else if (!x.equals(y)) {
					return false;
				}
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		// pre-order over sizes and leaf texts
		int hash = 1;
		Deque<Branch> pending = new ArrayDeque<Branch>();
		pending.push(this);
		while (!pending.isEmpty()) {
			Branch branch = pending.pop();
			hash = 31 * hash + branch.children.size();
			for (TreeNode child : branch.children) {
				if (child.isBranch()) {
					pending.push(child.asBranch());
				} else {
					hash = 31 * hash + child.hashCode();
				}
			}
		}
		return hash;
	}

	/**
	 * @return the children in brackets, e.g. {@code [a, [b, c], []]}
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		Deque<Iterator<TreeNode>> open = new ArrayDeque<Iterator<TreeNode>>();
		Deque<Boolean> first = new ArrayDeque<Boolean>();
		sb.append('[');
		open.push(children.iterator());
		first.push(Boolean.TRUE);
		while (!open.isEmpty()) {
			Iterator<TreeNode> it = open.peek();
			if (!it.hasNext()) {
				sb.append(']');
				open.pop();
				first.pop();
				continue;
			}
			TreeNode child = it.next();
			if (!first.pop()) {
				sb.append(", ");
			}
			first.push(Boolean.FALSE);
			if (child.isBranch()) {
				sb.append('[');
				open.push(child.asBranch().children.iterator());
				first.push(Boolean.TRUE);
			} else {
				sb.append(child);
			}
		}
		return sb.toString();
	}
}
