package org.metricshub.jtt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.jtt.jrt.ErrorKind;
import org.metricshub.jtt.jrt.EvaluationException;
import org.metricshub.jtt.tree.Branch;
import org.metricshub.jtt.tree.Leaf;
import org.metricshub.jtt.tree.NodeKind;

public class TreeNodeTest {

	@Test
	public void testDepth() {
		assertEquals(0, new Leaf("a").depth());
		assertEquals(0, new Leaf().depth());
		assertEquals(1, new Branch().depth());
		assertEquals(1, Branch.ofLeaves("a", "b").depth());
		assertEquals(2, Branch.of(new Leaf("a"), new Branch()).depth());
		assertEquals(3, Branch.of(new Leaf("x"), Branch.of(Branch.ofLeaves("y")), new Branch()).depth());
	}

	@Test
	public void testDepthIsRecomputed() {
		Branch inner = new Branch();
		Branch outer = Branch.of(inner);
		assertEquals(2, outer.depth());
		inner.add(new Branch());
		assertEquals(3, outer.depth());
	}

	@Test
	public void testKindTags() {
		assertEquals(NodeKind.LEAF, new Leaf("a").getKind());
		assertEquals(NodeKind.BRANCH, new Branch().getKind());
		assertTrue(new Leaf().isLeaf());
		assertFalse(new Leaf().isBranch());
		assertTrue(new Branch().isBranch());
	}

	@Test
	public void testTypedViews() {
		Leaf leaf = new Leaf("a");
		Branch branch = new Branch();
		assertSame(leaf, leaf.asLeaf());
		assertSame(branch, branch.asBranch());

		EvaluationException e = assertThrows(EvaluationException.class, leaf::asBranch);
		assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
		e = assertThrows(EvaluationException.class, branch::asLeaf);
		assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
	}

	@Test
	public void testCopyIsDeep() {
		Branch original = Branch.of(new Leaf("abc"), Branch.ofLeaves("x", "y"));
		Branch clone = original.copy();

		assertEquals(original, clone);
		assertNotSame(original, clone);
		assertNotSame(original.get(0), clone.get(0));
		assertNotSame(original.get(1), clone.get(1));

		clone.get(0).asLeaf().setText("changed");
		clone.get(1).asBranch().reverse();
		clone.get(1).asBranch().add(new Leaf("z"));

		assertEquals(Branch.of(new Leaf("abc"), Branch.ofLeaves("x", "y")), original);
	}

	@Test
	public void testCopyOfOriginalNotAffectedByOriginalChanges() {
		Leaf original = new Leaf("keep");
		Leaf clone = original.copy();
		original.setText("other");
		assertEquals("keep", clone.getText());
	}

	@Test
	public void testDetachChildren() {
		Branch branch = Branch.ofLeaves("a", "b");
		assertEquals(2, branch.detachChildren().size());
		assertTrue(branch.isEmpty());
	}

	@Test
	public void testToString() {
		assertEquals("[a, [b, c], []]", Branch.of(new Leaf("a"), Branch.ofLeaves("b", "c"), new Branch()).toString());
	}

	@Test
	public void testChildrenViewIsReadOnly() {
		Branch branch = Branch.ofLeaves("a");
		assertThrows(UnsupportedOperationException.class, () -> branch.getChildren().add(new Leaf("b")));
	}
}
