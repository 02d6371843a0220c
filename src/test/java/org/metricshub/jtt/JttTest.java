package org.metricshub.jtt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.jtt.backend.Evaluator;
import org.metricshub.jtt.ext.CommandRegistry;
import org.metricshub.jtt.ext.JttExtension;
import org.metricshub.jtt.jrt.Severity;
import org.metricshub.jtt.tree.Branch;
import org.metricshub.jtt.tree.Leaf;
import org.metricshub.jtt.util.JttSettings;
import org.metricshub.jtt.util.ScriptSource;

public class JttTest {

	private ByteArrayOutputStream outBytes;
	private ByteArrayOutputStream errBytes;
	private JttSettings settings;

	@Before
	public void setUp() throws Exception {
		outBytes = new ByteArrayOutputStream();
		errBytes = new ByteArrayOutputStream();
		settings = new JttSettings();
		settings.setOutputStream(new PrintStream(outBytes, true, StandardCharsets.UTF_8.name()));
		settings.setErrorStream(new PrintStream(errBytes, true, StandardCharsets.UTF_8.name()));
	}

	private void input(String text) {
		settings.setInput(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
	}

	private String out() {
		return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
	}

	private String err() {
		return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void testReadLoopTrimsLines() throws Exception {
		input("  a,b  \n\t,\n$_\n\nprint\n");
		Evaluator evaluator = new Jtt().invoke(settings);
		assertEquals("./section\n\ta\n\tb\n", out());
		assertEquals(Arrays.asList(Branch.ofLeaves("a", "b")), evaluator.getData().topFirst());
	}

	@Test
	public void testReadLoopContinuesAfterFailure() throws Exception {
		input("a\n#\n#\nb\nprint\n");
		Evaluator evaluator = new Jtt().invoke(settings);
		assertEquals("EvaluationException: Required argument, but not passed [Critical]" + System.lineSeparator(), err());
		assertEquals("b\n", out());
		assertEquals(1, evaluator.getLog().size());
	}


	@Test
	public void testReadLoopHandlesDeepNesting() throws Exception {
		StringBuilder script = new StringBuilder("a\n");
		for (int i = 0; i < 200000; i++) {
			script.append("^t\n");
		}
		script.append("|\n^\nprint\n^_t\n#\n200000\n0\n|]\nprint\n");
		settings.setIndent("");
		input(script.toString());
		Evaluator evaluator = new Jtt().invoke(settings);
		assertEquals("", err());
		// first print: the packed pair, second print: the column, then the remaining copy
		String printed = out();
		assertTrue(printed.contains("a\n./section\na\n./section\n./section\n"));
		assertEquals(3 * 200000 + 6, printed.split("\n", -1).length - 1);
		assertEquals(Branch.ofLeaves("a"), evaluator.getData().peek());
		assertEquals(2, evaluator.getData().size());
	}

	@Test
	public void testApprovedLevelFromSettings() throws Exception {
		settings.setApprovedLevel(Severity.CRITICAL);
		input("#\nx\n");
		Evaluator evaluator = new Jtt().invoke(settings);
		assertEquals("", err());
		assertEquals(Arrays.asList(new Leaf("x")), evaluator.getData().topFirst());
		assertEquals(1, evaluator.getLog().size());
	}

	@Test
	public void testExitStopsTheSession() {
		input("a\nexit\nprint\n");
		ExitException e = assertThrows(ExitException.class, () -> new Jtt().invoke(settings));
		assertEquals(0, e.getCode());
		assertEquals("", out());
	}

	@Test
	public void testScriptSourcesReplaceInput() throws Exception {
		input("from-stdin\n");
		settings.addScriptSource(new ScriptSource("first", new StringReader("a\nb\n")));
		settings.addScriptSource(new ScriptSource("second", new StringReader("2\n^tc\n")));
		Evaluator evaluator = new Jtt().invoke(settings);
		assertEquals(Arrays.asList(Branch.ofLeaves("a", "b")), evaluator.getData().topFirst());
	}

	@Test
	public void testSandboxSetting() throws Exception {
		settings.setSandbox(true);
		input("echo hello\nsystem\nprint\n");
		new Jtt().invoke(settings);
		assertEquals("JttSandboxException: system is disabled in sandbox mode [Fatal]" + System.lineSeparator(), err());
		assertEquals("echo hello\n", out());
	}

	@Test
	public void testSerializerSettings() throws Exception {
		settings.setIndent("  ");
		settings.setSection("+");
		input("a\n^t\nprint\n");
		new Jtt().invoke(settings);
		assertEquals("+\n  a\n", out());
	}

	@Test
	public void testExtensionsAreInstalled() throws Exception {
		JttExtension hello = new JttExtension() {
			@Override
			public String getExtensionName() {
				return "Hello";
			}

			@Override
			public void install(CommandRegistry registry) {
				registry.register("hello", e -> e.getData().push(new Leaf("world")));
			}
		};
		input("hello\n");
		Evaluator evaluator = new Jtt(hello).invoke(settings);
		assertEquals(Arrays.asList(new Leaf("world")), evaluator.getData().topFirst());
		assertTrue(evaluator.getRegistry().contains("print"));
	}

	@Test
	public void testExtensionCannotShadowBuiltIns() {
		JttExtension clash = new JttExtension() {
			@Override
			public String getExtensionName() {
				return "Clash";
			}

			@Override
			public void install(CommandRegistry registry) {
				registry.register("print", e -> {});
			}
		};
		assertThrows(IllegalStateException.class, () -> new Jtt(clash).createEvaluator(settings));
	}
}
