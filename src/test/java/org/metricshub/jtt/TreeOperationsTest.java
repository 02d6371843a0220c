package org.metricshub.jtt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.jtt.JttTestSupport.TestResult;
import org.metricshub.jtt.backend.Evaluator;
import org.metricshub.jtt.jrt.ErrorKind;
import org.metricshub.jtt.jrt.Severity;
import org.metricshub.jtt.tree.Branch;
import org.metricshub.jtt.tree.Leaf;
import org.metricshub.jtt.tree.TreeNode;

public class TreeOperationsTest {

	@Test
	public void testSplitRowScenario() {
		JttTestSupport
				.jttTest("split a,b,c")
				.tokens("a,b,c", ",", "$_")
				.expectTopFirst(Branch.ofLeaves("a", "b", "c"))
				.runAndAssert();
	}

	@Test
	public void testPackSameDepthReversesStackOrder() {
		JttTestSupport
				.jttTest("pack same depth")
				.tokens("x", "y", "z", "^")
				.expectTopFirst(Branch.ofLeaves("z", "y", "x"))
				.runAndAssert();
	}

	@Test
	public void testPackSameDepthStopsAtOtherDepth() {
		JttTestSupport
				.jttTest("pack same depth stops at a branch")
				.tokens("a", "^t", "b", "c", "^")
				.expectTopFirst(Branch.ofLeaves("c", "b"), Branch.ofLeaves("a"))
				.runAndAssert();
	}

	@Test
	public void testPackSameDepthOnEmptyStack() {
		JttTestSupport.jttTest("pack same depth on empty stack").tokens("^").expectThrow(ErrorKind.MISSING_ARGUMENT).runAndAssert();
	}

	@Test
	public void testPackTopCountScenario() {
		JttTestSupport
				.jttTest("pack count")
				.tokens("5", "3", "2", "^tc")
				.expectTopFirst(Branch.ofLeaves("5", "3"))
				.runAndAssert();
	}

	@Test
	public void testPackTopCountKeepsNodesBelow() {
		JttTestSupport
				.jttTest("pack count keeps the rest")
				.tokens("1", "5", "3", "2", "^tc")
				.expectTopFirst(Branch.ofLeaves("5", "3"), new Leaf("1"))
				.runAndAssert();
	}

	@Test
	public void testPackTopCountZero() {
		JttTestSupport
				.jttTest("pack zero")
				.tokens("a", "0", "^tc")
				.expectTopFirst(new Branch(), new Leaf("a"))
				.runAndAssert();
	}

	@Test
	public void testPackTopCountTooFew() {
		JttTestSupport
				.jttTest("pack count too few")
				.tokens("a", "3", "^tc")
				.expectThrow(ErrorKind.MISSING_ARGUMENT)
				.expectTopFirst(new Leaf("a"))
				.runAndAssert();
	}

	@Test
	public void testPackTopCountInvalidCount() {
		JttTestSupport
				.jttTest("pack count not a number")
				.tokens("a", "-1", "^tc")
				.expectThrow(ErrorKind.INVALID_INTEGER)
				.expectTopFirst(new Leaf("-1"), new Leaf("a"))
				.runAndAssert();
	}

	@Test
	public void testPackCountUnpackRoundTrip() {
		String[] values = { "a", "b", "c", "d" };
		for (int c = 0; c <= values.length; c++) {
			TestResult result = JttTestSupport
					.jttTest("round trip " + c)
					.tokens(values)
					.tokens(String.valueOf(c), "^tc", "^_t")
					.runAndAssert();
			assertEquals(
					"round trip " + c,
					Arrays.asList(new Leaf("d"), new Leaf("c"), new Leaf("b"), new Leaf("a")),
					result.stack());
		}
	}

	@Test
	public void testPackTop() {
		JttTestSupport
				.jttTest("pack top")
				.tokens("a", "b", "^t")
				.expectTopFirst(Branch.ofLeaves("b"), new Leaf("a"))
				.runAndAssert();
		JttTestSupport.jttTest("pack top on empty stack").tokens("^t").expectThrow(ErrorKind.MISSING_ARGUMENT).runAndAssert();
	}

	@Test
	public void testUnpackTop() {
		JttTestSupport
				.jttTest("unpack nested")
				.tokens("a", "b", "^t", "2", "^tc", "^_t")
				.expectTopFirst(Branch.ofLeaves("b"), new Leaf("a"))
				.runAndAssert();
		JttTestSupport.jttTest("unpack a leaf").tokens("a", "^_t").expectThrow(ErrorKind.TYPE_MISMATCH).runAndAssert();
	}

	@Test
	public void testEmptyConstructors() {
		JttTestSupport
				.jttTest("empty branch and leaf")
				.tokens("|Eb", "|Ev")
				.expectTopFirst(new Leaf(""), new Branch())
				.runAndAssert();
	}

	@Test
	public void testCopyChildAtIndex() {
		JttTestSupport
				.jttTest("copy child")
				.tokens("a,b,c", ",", "$_", "1", "|i")
				.expectTopFirst(new Leaf("b"), Branch.ofLeaves("a", "b", "c"))
				.runAndAssert();
		JttTestSupport
				.jttTest("copy child alias")
				.tokens("a,b,c", ",", "$_", "2", "|[")
				.expectTopFirst(new Leaf("c"), Branch.ofLeaves("a", "b", "c"))
				.runAndAssert();
	}

	@Test
	public void testCopyChildOutOfRange() {
		JttTestSupport
				.jttTest("copy child out of range")
				.tokens("a,b", ",", "$_", "2", "|i")
				.expectThrow(ErrorKind.INDEX_OUT_OF_RANGE)
				.expectTopFirst(Branch.ofLeaves("a", "b"))
				.runAndAssert();
	}

	@Test
	public void testCopyChildIsIndependent() {
		TestResult result = JttTestSupport
				.jttTest("copied child is a clone")
				.tokens("ab,c", ",", "$_", "0", "|i", "_")
				.expectTopFirst(new Leaf("ba"), Branch.ofLeaves("ab", "c"))
				.runAndAssert();
		assertNotSame(result.stack().get(0), result.stack().get(1).asBranch().get(0));
	}

	@Test
	public void testCopyThenReverseLeavesOriginal() {
		JttTestSupport
				.jttTest("copy then reverse")
				.tokens("abc", "|", "_")
				.expectTopFirst(new Leaf("cba"), new Leaf("abc"))
				.expectPrintedLines("cba", "abc")
				.runAndAssert();
		JttTestSupport
				.jttTest("copy branch then reverse")
				.tokens("a b", " ", "$_", "|", "_")
				.expectTopFirst(Branch.ofLeaves("b", "a"), Branch.ofLeaves("a", "b"))
				.runAndAssert();
	}

	@Test
	public void testDuplicate() {
		TestResult result = JttTestSupport
				.jttTest("duplicate")
				.tokens("x", "3", "|c")
				.expectTopFirst(new Leaf("x"), new Leaf("x"), new Leaf("x"))
				.runAndAssert();
		List<TreeNode> stack = result.stack();
		assertNotSame(stack.get(0), stack.get(1));
		assertNotSame(stack.get(1), stack.get(2));

		JttTestSupport.jttTest("duplicate once").tokens("x", "1", "|c").expectTopFirst(new Leaf("x")).runAndAssert();
		JttTestSupport.jttTest("duplicate zero").tokens("x", "0", "|c").expectTopFirst(new Leaf("x")).runAndAssert();
		JttTestSupport.jttTest("duplicate nothing").tokens("2", "|c").expectThrow(ErrorKind.MISSING_ARGUMENT).runAndAssert();
	}

	@Test
	public void testPop() {
		JttTestSupport.jttTest("pop").tokens("a", "b", "#").expectTopFirst(new Leaf("a")).runAndAssert();
	}

	@Test
	public void testPopOnEmptyStackPropagates() {
		TestResult result = JttTestSupport.jttTest("pop on empty stack").tokens("#").expectThrow(ErrorKind.MISSING_ARGUMENT).runAndAssert();
		assertEquals(Severity.CRITICAL, result.thrownException().getSeverity());
	}

	@Test
	public void testDeepRemove() {
		JttTestSupport
				.jttTest("deep remove")
				.tokens("a", "b", "c", "d", "2", "#d")
				.expectTopFirst(new Leaf("d"), new Leaf("c"), new Leaf("a"))
				.runAndAssert();
		JttTestSupport
				.jttTest("deep remove zero is a pop")
				.tokens("a", "b", "0", "#d")
				.expectTopFirst(new Leaf("a"))
				.runAndAssert();
		JttTestSupport
				.jttTest("deep remove too deep")
				.tokens("a", "b", "2", "#d")
				.expectThrow(ErrorKind.MISSING_ARGUMENT)
				.expectTopFirst(new Leaf("b"), new Leaf("a"))
				.runAndAssert();
	}

	@Test
	public void testUndot() {
		JttTestSupport.jttTest("undot").tokens(".name", "$").expectTopFirst(new Leaf("name")).runAndAssert();
		JttTestSupport.jttTest("undot once").tokens("..x", "$").expectTopFirst(new Leaf(".x")).runAndAssert();
		JttTestSupport.jttTest("undot no dot").tokens("a.b", "$").expectTopFirst(new Leaf("a.b")).runAndAssert();
		JttTestSupport.jttTest("undot empty").tokens("|Ev", "$").expectTopFirst(new Leaf()).runAndAssert();
		JttTestSupport.jttTest("undot branch").tokens("|Eb", "$").expectThrow(ErrorKind.TYPE_MISMATCH).runAndAssert();
	}

	@Test
	public void testSplitRowEdgeSegments() {
		JttTestSupport
				.jttTest("split keeps empty segments")
				.tokens(";a;;b;", ";", "$_")
				.expectTopFirst(Branch.ofLeaves("", "a", "", "b", ""))
				.runAndAssert();
		JttTestSupport
				.jttTest("split multi-character separator")
				.tokens("a::b:c", "::", "$_")
				.expectTopFirst(Branch.ofLeaves("a", "b:c"))
				.runAndAssert();
		JttTestSupport
				.jttTest("split non-overlapping")
				.tokens("aaa", "aa", "$_")
				.expectTopFirst(Branch.ofLeaves("", "a"))
				.runAndAssert();
		JttTestSupport
				.jttTest("split without separator occurrence")
				.tokens("abc", ",", "$_")
				.expectTopFirst(Branch.ofLeaves("abc"))
				.runAndAssert();
	}

	@Test
	public void testSplitConcatRoundTrip() {
		String[][] cases = {
				{ "a,b,c", "," },
				{ ",a,,b,", "," },
				{ ",,", "," },
				{ "no separator", ";" },
				{ "x--y----z--", "--" },
				{ "a b\tc", "\t" } };
		for (String[] c : cases) {
			JttTestSupport
					.jttTest("split then concat '" + c[0] + "' on '" + c[1] + "'")
					.tokens(c[0], c[1], "$_", c[1], "$^")
					.expectTopFirst(new Leaf(c[0]))
					.runAndAssert();
		}
	}

	@Test
	public void testSplitConcatRoundTripOfEmptyText() {
		JttTestSupport
				.jttTest("split then concat empty text")
				.tokens("|Ev", ",", "$_", ",", "$^")
				.expectTopFirst(new Leaf())
				.runAndAssert();
	}

	@Test
	public void testSplitRowEmptySeparator() {
		JttTestSupport
				.jttTest("split with empty separator")
				.tokens("abc", "|Ev", "$_")
				.expectThrow(ErrorKind.EMPTY_SEPARATOR)
				.expectTopFirst(new Leaf(), new Leaf("abc"))
				.runAndAssert();
	}

	@Test
	public void testConcatRow() {
		JttTestSupport
				.jttTest("concat")
				.tokens("a", "b", "c", "3", "^tc", "-", "$^")
				.expectTopFirst(new Leaf("a-b-c"))
				.runAndAssert();
		JttTestSupport
				.jttTest("concat skips branches")
				.tokens("a", "b", "^t", "c", "3", "^tc", "+", "$^")
				.expectTopFirst(new Leaf("a+c"))
				.runAndAssert();
		JttTestSupport
				.jttTest("concat empty branch")
				.tokens("|Eb", ",", "$^")
				.expectTopFirst(new Leaf(""))
				.runAndAssert();
		JttTestSupport
				.jttTest("concat of a leaf")
				.tokens("a", ",", "$^")
				.expectThrow(ErrorKind.TYPE_MISMATCH)
				.runAndAssert();
	}

	@Test
	public void testReverse() {
		JttTestSupport.jttTest("reverse leaf").tokens("abc", "_").expectTopFirst(new Leaf("cba")).runAndAssert();
		JttTestSupport
				.jttTest("reverse branch")
				.tokens("1 2 3", " ", "$_", "_")
				.expectTopFirst(Branch.ofLeaves("3", "2", "1"))
				.runAndAssert();
		JttTestSupport.jttTest("reverse nothing").tokens("_").expectThrow(ErrorKind.MISSING_ARGUMENT).runAndAssert();
	}

	// table: [[a, 1], [b, 2], [c]]
	private static final String[] TABLE = { "a", "1", "2", "^tc", "b", "2", "2", "^tc", "c", "^t", "3", "^tc" };

	@Test
	public void testExtractColumn() {
		Branch table = Branch.of(Branch.ofLeaves("a", "1"), Branch.ofLeaves("b", "2"), Branch.ofLeaves("c"));
		JttTestSupport
				.jttTest("extract first column")
				.tokens(TABLE)
				.tokens("2", "0", "|]")
				.expectTopFirst(Branch.ofLeaves("a", "b", "c"), table)
				.runAndAssert();
		JttTestSupport
				.jttTest("extract second column skips short rows")
				.tokens(TABLE)
				.tokens("2", "1", "|id")
				.expectTopFirst(Branch.ofLeaves("1", "2"), table)
				.runAndAssert();
		JttTestSupport
				.jttTest("extract at depth one")
				.tokens(TABLE)
				.tokens("1", "2", "|]")
				.expectTopFirst(Branch.of(Branch.ofLeaves("c")), table)
				.runAndAssert();
	}

	@Test
	public void testExtractColumnIgnoresLeavesAboveDepth() {
		// [x, [a, 1], [b, 2]]
		JttTestSupport
				.jttTest("leaves above the target depth are skipped")
				.tokens("x", "a", "1", "2", "^tc", "b", "2", "2", "^tc", "3", "^tc")
				.tokens("2", "1", "|]")
				.expectPrintedLines(
						"./section",
						"\t1",
						"\t2",
						"./section",
						"\tx",
						"\t./section",
						"\t\ta",
						"\t\t1",
						"\t./section",
						"\t\tb",
						"\t\t2")
				.runAndAssert();
	}

	@Test
	public void testExtractGroupedColumn() {
		// [[[a, 1], [b, 2]], [[c, 3]], [[d]]]
		TestResult result = JttTestSupport
				.jttTest("grouped extraction keeps grouping")
				.tokens("a", "1", "2", "^tc", "b", "2", "2", "^tc", "2", "^tc")
				.tokens("c", "3", "2", "^tc", "^t")
				.tokens("d", "^t", "^t")
				.tokens("3", "^tc")
				.tokens("3", "1", "|]g")
				.runAndAssert();
		assertEquals(
				Branch.of(
						Branch.of(Branch.ofLeaves("1"), Branch.ofLeaves("2")),
						Branch.of(Branch.ofLeaves("3")),
						Branch.of(new Branch())),
				result.stack().get(0));
	}

	@Test
	public void testExtractFlatColumnOfNestedGroups() {
		TestResult result = JttTestSupport
				.jttTest("flat extraction of nested groups")
				.tokens("a", "1", "2", "^tc", "b", "2", "2", "^tc", "2", "^tc")
				.tokens("c", "3", "2", "^tc", "^t")
				.tokens("2", "^tc")
				.tokens("3", "0", "|]")
				.runAndAssert();
		assertEquals(Branch.ofLeaves("a", "b", "c"), result.stack().get(0));
	}

	@Test
	public void testExtractColumnErrors() {
		JttTestSupport
				.jttTest("depth zero")
				.tokens(TABLE)
				.tokens("0", "0", "|]")
				.expectThrow(ErrorKind.INVALID_DEPTH)
				.runAndAssert();
		JttTestSupport
				.jttTest("extract from a leaf")
				.tokens("a", "1", "0", "|]g")
				.expectThrow(ErrorKind.TYPE_MISMATCH)
				.runAndAssert();
		JttTestSupport
				.jttTest("depth not a number")
				.tokens(TABLE)
				.tokens("deep", "0", "|]")
				.expectThrow(ErrorKind.INVALID_INTEGER)
				.runAndAssert();
	}

	@Test
	public void testExtractedValuesAreClones() {
		// [[ab, 1]]
		JttTestSupport
				.jttTest("extracted values are clones")
				.tokens("ab", "1", "2", "^tc", "^t")
				.tokens("2", "0", "|]", "^_t", "_")
				.expectTopFirst(new Leaf("ba"), Branch.of(Branch.ofLeaves("ab", "1")))
				.runAndAssert();
	}


	private static final int DEEP = 200000;

	// a wrapped DEEP times: [[[...[a]...]]]
	private static Evaluator deepNest() {
		Evaluator evaluator = new Evaluator().loadDefault();
		evaluator.evaluate("a");
		for (int i = 0; i < DEEP; i++) {
			evaluator.evaluate("^t");
		}
		return evaluator;
	}

	@Test
	public void testDeepNestCopyAndPack() {
		Evaluator evaluator = deepNest();
		assertEquals(DEEP, evaluator.getData().peek().depth());

		evaluator.evaluate("|");
		List<TreeNode> stack = evaluator.getData().topFirst();
		assertNotSame(stack.get(0), stack.get(1));
		assertEquals(stack.get(1), stack.get(0));
		assertEquals(stack.get(1).hashCode(), stack.get(0).hashCode());

		evaluator.evaluate("^");
		assertEquals(1, evaluator.getData().size());
		assertEquals(DEEP + 1, evaluator.getData().peek().depth());
		assertTrue(evaluator.getLog().isEmpty());
	}

	@Test
	public void testDeepNestColumnExtraction() {
		Evaluator evaluator = deepNest();
		TreeNode tree = evaluator.getData().peek();

		evaluator.evaluateBatch(String.valueOf(DEEP), "0", "|]");
		assertEquals(Branch.ofLeaves("a"), evaluator.getData().pop());

		// every crossed branch gets a counterpart, so the chain is rebuilt
		evaluator.evaluateBatch(String.valueOf(DEEP), "0", "|]g");
		TreeNode grouped = evaluator.getData().pop();
		assertNotSame(tree, grouped);
		assertEquals(tree, grouped);
		assertEquals(DEEP, grouped.depth());
	}

	@Test
	public void testDeepNestSerialization() {
		Evaluator evaluator = deepNest();
		evaluator.setIndent("");
		String printed = evaluator.dataToString();
		assertEquals(DEEP * "./section\n".length() + "a\n".length(), printed.length());
		assertTrue(printed.startsWith("./section\n./section\n"));
		assertTrue(printed.endsWith("./section\na\n"));

		String text = evaluator.getData().peek().toString();
		assertEquals(2 * DEEP + 1, text.length());
		assertTrue(text.startsWith("[[[") && text.endsWith("a]]]"));
	}

	@Test
	public void testRequireShape() {
		JttTestSupport
				.jttTest("shape matches")
				.tokens(TABLE)
				.tokens("bvi.bvi.bv", "?s")
				.expectTopFirst(Branch.of(Branch.ofLeaves("a", "1"), Branch.ofLeaves("b", "2"), Branch.ofLeaves("c")))
				.runAndAssert();
		JttTestSupport
				.jttTest("shape mismatch")
				.tokens(TABLE)
				.tokens("bvi.bvi.bvi", "?s")
				.expectThrow(ErrorKind.INDEX_OUT_OF_RANGE)
				.runAndAssert();
		JttTestSupport
				.jttTest("shape syntax")
				.tokens(TABLE)
				.tokens("bq", "?s")
				.expectThrow(ErrorKind.PATTERN_SYNTAX_ERROR)
				.runAndAssert();
	}
}
