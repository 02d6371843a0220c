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

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;
import org.metricshub.jtt.tree.TreeNode;

/**
 * Renders tree nodes as indented text.
 * <p>
 * A leaf is written as its text on its own line. A branch is written as the
 * section marker, followed by its children one indentation level deeper:
 *
 * <pre>
 * ./section
 * 	a
 * 	./section
 * 		b
 * </pre>
 */
public class TreeWriter {

	/** Default indentation unit: one tab per level. */
	public static final String DEFAULT_INDENT = "\t";

	/** Default marker line written for a branch. */
	public static final String DEFAULT_SECTION = "./section";

	/** Default line terminator. */
	public static final String DEFAULT_LINE_TERMINATOR = "\n";

	private final Appendable out;

	private String indent = DEFAULT_INDENT;

	private String section = DEFAULT_SECTION;

	private String lineTerminator = DEFAULT_LINE_TERMINATOR;

	/**
	 * @param out destination of the rendered text
	 */
	public TreeWriter(Appendable out) {
		this.out = Objects.requireNonNull(out, "out");
	}

	public String getIndent() {
		return indent;
	}

	public void setIndent(String indent) {
		this.indent = Objects.requireNonNull(indent, "indent");
	}

	public String getSection() {
		return section;
	}

	public void setSection(String section) {
		this.section = Objects.requireNonNull(section, "section");
	}

	public String getLineTerminator() {
		return lineTerminator;
	}

	public void setLineTerminator(String lineTerminator) {
		this.lineTerminator = Objects.requireNonNull(lineTerminator, "lineTerminator");
	}

	/**
	 * Writes a node at nesting level 0.
	 *
	 * @param node node to render
	 * @return this writer
	 * @throws IOException when the destination fails
	 */
	public TreeWriter write(TreeNode node) throws IOException {
		writeLine(node, 0);
		if (node.isBranch()) {
			Deque<Iterator<TreeNode>> open = new ArrayDeque<Iterator<TreeNode>>();
			open.push(node.asBranch().getChildren().iterator());
			while (!open.isEmpty()) {
				Iterator<TreeNode> it = open.peek();
				if (!it.hasNext()) {
					open.pop();
					continue;
				}
				TreeNode child = it.next();
				writeLine(child, open.size());
				if (child.isBranch()) {
					open.push(child.asBranch().getChildren().iterator());
				}
			}
		}
		return this;
	}

	private void writeLine(TreeNode node, int level) throws IOException {
		if (!indent.isEmpty()) {
			for (int i = 0; i < level; i++) {
				out.append(indent);
			}
		}
		switch (node.getKind()) {
		case LEAF:
			out.append(node.asLeaf().getText());
			break;
		case BRANCH:
			out.append(section);
			break;
		default:
			throw new IllegalStateException("Unknown node kind " + node.getKind());
		}
		out.append(lineTerminator);
	}
}
