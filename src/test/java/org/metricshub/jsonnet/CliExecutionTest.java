package org.metricshub.jsonnet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.metricshub.jsonnet.JsonnetTestSupport.cliTest;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.After;
import org.junit.Test;
import org.metricshub.jsonnet.JsonnetTestSupport.TestResult;
import org.metricshub.jsonnet.backend.JsonnetRuntimeException;
import org.metricshub.jsonnet.backend.TraceFrame;
import org.metricshub.jsonnet.ext.EngineRegistry;
import org.metricshub.jsonnet.frontend.Location;
import org.metricshub.jsonnet.frontend.LocationRange;
import org.metricshub.jsonnet.frontend.StaticException;

/**
 * Runs the command line end to end against a {@link RecordingEngine}.
 */
public class CliExecutionTest {

	@After
	public void unregisterEngines() {
		for (String name : EngineRegistry.listEngines().keySet()) {
			EngineRegistry.unregister(name);
		}
	}

	private static PrintStream utf8(ByteArrayOutputStream bytes) throws Exception {
		return new PrintStream(bytes, true, StandardCharsets.UTF_8.name());
	}

	private static String text(ByteArrayOutputStream bytes) throws Exception {
		return bytes.toString(StandardCharsets.UTF_8.name()).replace(System.lineSeparator(), "\n");
	}

	@Test
	public void testResultGoesToSettingsOutputStream() throws Exception {
		ByteArrayOutputStream constructed = new ByteArrayOutputStream();
		ByteArrayOutputStream configured = new ByteArrayOutputStream();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		Cli cli = new Cli(new ByteArrayInputStream(new byte[0]), utf8(constructed), utf8(err), new RecordingEngine());
		cli.getSettings().setOutputStream(utf8(configured));

		assertEquals(Cli.EXIT_SUCCESS, cli.execute(new String[] { "-e", "1" }));
		assertEquals("1\n", text(configured));
		assertEquals("", text(constructed));
		assertEquals("", text(err));
	}

	@Test
	public void testUsageGoesToSettingsOutputStream() throws Exception {
		ByteArrayOutputStream constructed = new ByteArrayOutputStream();
		ByteArrayOutputStream configured = new ByteArrayOutputStream();
		Cli cli = new Cli(
				new ByteArrayInputStream(new byte[0]),
				utf8(constructed),
				utf8(new ByteArrayOutputStream()),
				new RecordingEngine());
		cli.getSettings().setOutputStream(utf8(configured));

		assertEquals(Cli.EXIT_SUCCESS, cli.execute(new String[] { "--help" }));
		assertTrue(text(configured).startsWith("Usage:\n"));
		assertEquals("", text(constructed));
	}

	@Test
	public void testMissingFileIsReportedBeforeEngineLookup() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		Cli cli = new Cli(new ByteArrayInputStream(new byte[0]), utf8(out), utf8(err));

		assertEquals(Cli.EXIT_FAILURE, cli.execute(new String[] { "does-not-exist.jsonnet" }));
		assertEquals("Opening input file: does-not-exist.jsonnet: No such file or directory\n", text(err));
		assertEquals("", text(out));
		assertFalse("default engine is not looked up", EngineRegistry.listEngines().containsKey("recording"));
	}

	@Test
	public void testDefaultEngineRunsTheProgram() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		Cli cli = new Cli(new ByteArrayInputStream(new byte[0]), utf8(out), utf8(new ByteArrayOutputStream()));
		assertEquals(Cli.EXIT_SUCCESS, cli.execute(new String[] { "-e", "[]" }));
		assertEquals("[]\n", text(out));
		assertTrue(EngineRegistry.listEngines().containsKey("recording"));
	}

	@Test
	public void testExecPrintsResult() throws Exception {
		TestResult result = cliTest("--exec {}").argument("--exec", "{}").expect("{}\n").runAndAssert();
		assertEquals("<cmdline>", result.engine().lastDisplayName());
		assertEquals("{}", result.engine().lastSource());
		assertEquals(Arrays.asList("parse", "analyze", "execute"), result.engine().calls());
		assertEquals("", result.error());
	}

	@Test
	public void testExecWithTerminator() throws Exception {
		TestResult result = cliTest("program starting with a dash")
				.argument("-e", "--", "-1")
				.expect("-1\n")
				.runAndAssert();
		assertEquals("-1", result.engine().lastSource());
	}

	@Test
	public void testStdin() throws Exception {
		TestResult result = cliTest("program on stdin").stdin("{ a: 1 }\n").expect("{ a: 1 }\n").runAndAssert();
		assertEquals("<stdin>", result.engine().lastDisplayName());
		assertEquals("{ a: 1 }\n", result.engine().lastSource());
	}

	@Test
	public void testExplicitStdin() throws Exception {
		TestResult result = cliTest("dash reads stdin").argument("-").stdin("[]").expect("[]\n").runAndAssert();
		assertEquals("<stdin>", result.engine().lastDisplayName());
	}

	@Test
	public void testFile() throws Exception {
		TestResult result = cliTest("program file")
				.file("main.jsonnet", "{ x: 'y' }")
				.argument("{{main.jsonnet}}")
				.expect("{ x: 'y' }\n")
				.runAndAssert();
		assertTrue(result.engine().lastDisplayName().endsWith("main.jsonnet"));
		assertEquals(result.cli().getSettings().getFilename(), result.engine().lastDisplayName());
	}

	@Test
	public void testLimitsReachTheEngine() throws Exception {
		TestResult result = cliTest("limits")
				.argument("--max-stack", "5", "--gc-min-objects", "20", "--gc-growth-trigger", "1.5", "-e", "1")
				.expect("1\n")
				.runAndAssert();
		assertEquals(5, result.engine().lastMaxStack());
		assertEquals(20, result.engine().lastGcMinObjects());
		assertEquals(1.5, result.engine().lastGcGrowthTrigger(), 0.0);
	}

	@Test
	public void testDefaultLimitsReachTheEngine() throws Exception {
		TestResult result = cliTest("default limits").argument("-e", "1").expect("1\n").runAndAssert();
		assertEquals(500, result.engine().lastMaxStack());
		assertEquals(1000, result.engine().lastGcMinObjects());
		assertEquals(2.0, result.engine().lastGcGrowthTrigger(), 0.0);
	}

	@Test
	public void testDebugAstSkipsExecution() throws Exception {
		RecordingEngine engine = new RecordingEngine().unparsingTo("{ }");
		TestResult result = cliTest("--debug-ast")
				.withEngine(engine)
				.argument("--debug-ast", "-e", "{}")
				.expect("{ }\n")
				.runAndAssert();
		assertEquals(1, result.engine().count("unparse"));
		assertEquals(0, result.engine().count("analyze"));
		assertEquals(0, result.engine().count("execute"));
	}

	@Test
	public void testDebugAstSkipsAnalysisFailures() throws Exception {
		RecordingEngine engine = new RecordingEngine()
				.failAnalysisWith(new StaticException(new LocationRange("<cmdline>"), "Unknown variable: x"));
		cliTest("--debug-ast on an unbound variable")
				.withEngine(engine)
				.argument("--debug-ast", "-e", "x")
				.expect("x\n")
				.runAndAssert();
	}

	@Test
	public void testMissingFile() throws Exception {
		TestResult result = cliTest("missing file")
				.argument("does-not-exist.jsonnet")
				.expectError("Opening input file: does-not-exist.jsonnet: No such file or directory")
				.runAndAssert();
		assertEquals(0, result.engine().count("parse"));
	}

	@Test
	public void testDirectory() throws Exception {
		String dir = JsonnetTestSupport.sharedTempDirectory().toString();
		TestResult result = cliTest("directory as program")
				.argument(dir)
				.expectError("Opening input file: " + dir + ": Is a directory")
				.runAndAssert();
		assertEquals(0, result.engine().count("parse"));
	}

	@Test
	public void testParseError() throws Exception {
		RecordingEngine engine = new RecordingEngine()
				.failParsingWith(
						new StaticException(
								new LocationRange("<cmdline>", new Location(1, 3), new Location(1, 4)),
								"Unexpected: \"}\" while parsing field definition"));
		TestResult result = cliTest("syntax error")
				.withEngine(engine)
				.argument("-e", "{ }}")
				.expectError("STATIC ERROR: <cmdline>:1:3: Unexpected: \"}\" while parsing field definition")
				.runAndAssert();
		assertEquals(Arrays.asList("parse"), result.engine().calls());
		assertEquals(1, result.errorLines().size());
	}

	@Test
	public void testAnalysisError() throws Exception {
		RecordingEngine engine = new RecordingEngine()
				.failAnalysisWith(
						new StaticException(
								new LocationRange("<cmdline>", new Location(1, 1), new Location(1, 2)),
								"Unknown variable: x"));
		TestResult result = cliTest("unbound variable")
				.withEngine(engine)
				.argument("-e", "x")
				.expectError("STATIC ERROR: <cmdline>:1:1: Unknown variable: x")
				.runAndAssert();
		assertEquals(0, result.engine().count("execute"));
	}

	@Test
	public void testRuntimeErrorWithShortTrace() throws Exception {
		List<TraceFrame> trace = Arrays.asList(
				new TraceFrame(new LocationRange("<cmdline>", new Location(1, 1), new Location(1, 13)), "error statement"));
		RecordingEngine engine = new RecordingEngine().failExecutionWith(new JsonnetRuntimeException("oops", trace));
		TestResult result = cliTest("error 'oops'")
				.withEngine(engine)
				.argument("-e", "error 'oops'")
				.expectError("RUNTIME ERROR: oops")
				.runAndAssert();
		assertEquals(Arrays.asList("RUNTIME ERROR: oops", "\t<cmdline>:1:1-13\terror statement"), result.errorLines());
	}

	@Test
	public void testRuntimeErrorWithDeepTrace() throws Exception {
		List<TraceFrame> trace = new ArrayList<>();
		for (int i = 0; i < 25; i++) {
			trace.add(new TraceFrame(new LocationRange("deep.jsonnet", new Location(i + 1, 5), new Location(i + 1, 9)), "function <f>"));
		}
		RecordingEngine engine = new RecordingEngine()
				.failExecutionWith(new JsonnetRuntimeException("Max stack frames exceeded.", trace));
		TestResult result = cliTest("stack overflow")
				.withEngine(engine)
				.argument("-e", "local f(x) = f(x); f(1)")
				.expectError("RUNTIME ERROR: Max stack frames exceeded.")
				.runAndAssert();
		List<String> lines = result.errorLines();
		assertEquals(22, lines.size());
		assertEquals("\tdeep.jsonnet:1:5-9\tfunction <f>", lines.get(1));
		assertEquals("\tdeep.jsonnet:10:5-9\tfunction <f>", lines.get(10));
		assertEquals("\t...", lines.get(11));
		assertEquals("\tdeep.jsonnet:16:5-9\tfunction <f>", lines.get(12));
		assertEquals("\tdeep.jsonnet:25:5-9\tfunction <f>", lines.get(21));
	}

	@Test
	public void testHelpGoesToStdout() throws Exception {
		TestResult result = cliTest("--help").argument("--help").runAndAssert();
		assertTrue(result.output().startsWith("Usage:"));
		assertTrue(result.output().contains("--debug-ast"));
		assertEquals("", result.error());
		assertTrue(result.engine().calls().isEmpty());
	}

	@Test
	public void testHelpAfterFilename() throws Exception {
		TestResult result = cliTest("help ignores the rest").argument("a.jsonnet", "-h", "b.jsonnet").runAndAssert();
		assertTrue(result.output().startsWith("Usage:"));
	}

	@Test
	public void testUsageErrorPrintsUsageOnStderr() throws Exception {
		TestResult result = cliTest("invalid stack")
				.argument("--max-stack", "0")
				.expectError("ERROR: Invalid --max-stack value 0")
				.runAndAssert();
		List<String> lines = result.errorLines();
		assertEquals("ERROR: Invalid --max-stack value 0", lines.get(0));
		assertEquals("", lines.get(1));
		assertEquals("Usage:", lines.get(2));
		assertTrue(result.engine().calls().isEmpty());
	}

	@Test
	public void testTwoFilenames() throws Exception {
		cliTest("two filenames")
				.argument("a.jsonnet", "b.jsonnet")
				.expectError("ERROR: Filename already specified as \"a.jsonnet\"")
				.expectError("Usage:")
				.runAndAssert();
	}

	@Test
	public void testExecWithoutProgram() throws Exception {
		cliTest("-e alone").argument("-e").expectError("ERROR: Must give filename when using -e, --exec").runAndAssert();
	}

	@Test
	public void testMissingValueHasNoUsage() throws Exception {
		TestResult result = cliTest("missing value")
				.argument("-s")
				.expectError("Expected another commandline argument.")
				.runAndAssert();
		assertEquals(Arrays.asList("Expected another commandline argument."), result.errorLines());
	}

	@Test
	public void testExitCodes() throws Exception {
		assertEquals(Cli.EXIT_SUCCESS, cliTest("ok").argument("-e", "true").run().exitCode());
		assertEquals(Cli.EXIT_FAILURE, cliTest("bad").argument("--gc-min-objects", "x").run().exitCode());
	}
}
