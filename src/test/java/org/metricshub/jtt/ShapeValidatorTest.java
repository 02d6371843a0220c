package org.metricshub.jtt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.metricshub.jtt.jrt.ErrorKind;
import org.metricshub.jtt.jrt.EvaluationException;
import org.metricshub.jtt.jrt.ShapeValidator;
import org.metricshub.jtt.tree.Branch;
import org.metricshub.jtt.tree.Leaf;
import org.metricshub.jtt.tree.TreeNode;

public class ShapeValidatorTest {

	// [name, [12, x], 7]
	private static Branch sample() {
		return Branch.of(new Leaf("name"), Branch.ofLeaves("12", "x"), new Leaf("7"));
	}

	@Test
	public void testMatchingPatterns() {
		ShapeValidator.require("vbiv.i", sample());
		ShapeValidator.require("vbie.i", sample());
		ShapeValidator.require("ebe", sample());
		ShapeValidator.require("v", sample());
		ShapeValidator.require("vb.e", sample());
	}

	@Test
	public void testClosingRootAtEnd() {
		ShapeValidator.require("vbiv.i.", sample());
	}

	@Test
	public void testTypeViolations() {
		assertKind(ErrorKind.TYPE_MISMATCH, "b", sample());
		assertKind(ErrorKind.TYPE_MISMATCH, "vv", sample());
		assertKind(ErrorKind.INVALID_INTEGER, "i", sample());
		assertKind(ErrorKind.INVALID_INTEGER, "vbii", sample());
	}

	@Test
	public void testRootMustBeBranch() {
		assertKind(ErrorKind.TYPE_MISMATCH, "v", new Leaf("a"));
	}

	@Test
	public void testPastLastChild() {
		assertKind(ErrorKind.INDEX_OUT_OF_RANGE, "eeee", sample());
		assertKind(ErrorKind.INDEX_OUT_OF_RANGE, "ebeee", sample());
		assertKind(ErrorKind.INDEX_OUT_OF_RANGE, "e", new Branch());
	}

	@Test
	public void testEmptyPatternIsSyntaxError() {
		assertKind(ErrorKind.PATTERN_SYNTAX_ERROR, "", sample());
		assertKind(ErrorKind.PATTERN_SYNTAX_ERROR, "", new Branch());
	}

	@Test
	public void testSyntaxErrors() {
		assertKind(ErrorKind.PATTERN_SYNTAX_ERROR, "vx", sample());
		assertKind(ErrorKind.PATTERN_SYNTAX_ERROR, "B", sample());
		assertKind(ErrorKind.PATTERN_SYNTAX_ERROR, "..", sample());
		assertKind(ErrorKind.PATTERN_SYNTAX_ERROR, ".v", sample());
	}

	@Test
	public void testScopeReturnsToParentCursor() {
		// after closing [12, x] the parent cursor points at "7"
		ShapeValidator.require("ebe.i", sample());
		assertKind(ErrorKind.TYPE_MISMATCH, "eb.b", sample());
	}

	private static void assertKind(ErrorKind kind, String pattern, TreeNode node) {
		EvaluationException e = assertThrows(
				"pattern '" + pattern + "'",
				EvaluationException.class,
				() -> ShapeValidator.require(pattern, node));
		assertEquals("pattern '" + pattern + "'", kind, e.getKind());
	}
}
