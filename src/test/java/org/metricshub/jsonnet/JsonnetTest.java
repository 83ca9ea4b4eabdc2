package org.metricshub.jsonnet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.After;
import org.junit.Test;
import org.metricshub.jsonnet.backend.JsonnetRuntimeException;
import org.metricshub.jsonnet.ext.EngineRegistry;
import org.metricshub.jsonnet.ext.JsonnetEngine;
import org.metricshub.jsonnet.frontend.LocationRange;
import org.metricshub.jsonnet.frontend.StaticException;
import org.metricshub.jsonnet.util.JsonnetSettings;
import org.metricshub.jsonnet.util.ScriptSource;

/**
 * Stage ordering of {@link Jsonnet#evaluate(ScriptSource, JsonnetSettings)}.
 */
public class JsonnetTest {

	@After
	public void unregisterEngines() {
		for (String name : EngineRegistry.listEngines().keySet()) {
			EngineRegistry.unregister(name);
		}
	}

	@Test
	public void testStagesRunInOrder() throws Exception {
		RecordingEngine engine = new RecordingEngine().evaluatingTo("{\n   \"a\": 1\n}");
		String result = new Jsonnet(engine).evaluate(ScriptSource.fromCode("{ a: 1 }"), new JsonnetSettings());
		assertEquals("{\n   \"a\": 1\n}", result);
		assertEquals(Arrays.asList("parse", "analyze", "execute"), engine.calls());
	}

	@Test
	public void testDebugAstOnlyUnparses() throws Exception {
		RecordingEngine engine = new RecordingEngine().unparsingTo("{ a: 1 }");
		JsonnetSettings settings = new JsonnetSettings();
		settings.setDebugAst(true);
		assertEquals("{ a: 1 }", new Jsonnet(engine).evaluate(ScriptSource.fromCode("{a:1}"), settings));
		assertEquals(Arrays.asList("parse", "unparse"), engine.calls());
	}

	@Test
	public void testParseFailureStopsEvaluation() {
		StaticException failure = new StaticException(new LocationRange("<cmdline>"), "Unexpected end of file");
		RecordingEngine engine = new RecordingEngine().failParsingWith(failure);
		StaticException thrown = assertThrows(StaticException.class, () -> new Jsonnet(engine).evaluate("{"));
		assertSame(failure, thrown);
		assertEquals(Arrays.asList("parse"), engine.calls());
	}

	@Test
	public void testAnalysisFailureStopsEvaluation() {
		RecordingEngine engine = new RecordingEngine().failAnalysisWith(new StaticException("Unknown variable: x"));
		assertThrows(StaticException.class, () -> new Jsonnet(engine).evaluate("x"));
		assertEquals(Arrays.asList("parse", "analyze"), engine.calls());
	}

	@Test
	public void testRuntimeFailurePropagates() {
		RecordingEngine engine = new RecordingEngine().failExecutionWith(new JsonnetRuntimeException("oops"));
		JsonnetRuntimeException thrown = assertThrows(JsonnetRuntimeException.class, () -> new Jsonnet(engine).evaluate("error 'oops'"));
		assertEquals("oops", thrown.getMessage());
	}

	@Test
	public void testEvaluateCode() {
		RecordingEngine engine = new RecordingEngine();
		assertEquals("[1, 2]", new Jsonnet(engine).evaluate("  [1, 2]\n"));
		assertEquals("<cmdline>", engine.lastDisplayName());
		assertEquals(500, engine.lastMaxStack());
	}

	@Test
	public void testEvaluateFile() throws IOException {
		Path file = Files.createTempFile("jsonnet", ".jsonnet");
		try {
			Files.write(file, "{ file: true }".getBytes(StandardCharsets.UTF_8));
			RecordingEngine engine = new RecordingEngine();
			assertEquals("{ file: true }", new Jsonnet(engine).evaluate(file.toFile()));
			assertEquals(file.toString(), engine.lastDisplayName());
		} finally {
			Files.delete(file);
		}
	}

	@Test
	public void testUnreadableFileIsNotParsed() {
		RecordingEngine engine = new RecordingEngine();
		assertThrows(NoSuchFileException.class, () -> new Jsonnet(engine).evaluate(new File("no/such/file.jsonnet")));
		assertTrue(engine.calls().isEmpty());
	}

	@Test
	public void testDefaultEngineIsResolvedAfterReading() {
		Jsonnet jsonnet = new Jsonnet();
		assertThrows(NoSuchFileException.class, () -> jsonnet.evaluate(new File("no/such/file.jsonnet")));
		assertTrue("no engine looked up for an unreadable program", EngineRegistry.listEngines().isEmpty());

		assertEquals("{ b: 2 }", jsonnet.evaluate("{ b: 2 }"));
		assertTrue(EngineRegistry.resolve("recording") instanceof RecordingEngine);
	}

	@Test
	public void testDefaultEngineIsResolvedOnce() {
		Jsonnet jsonnet = new Jsonnet();
		JsonnetEngine engine = jsonnet.getEngine();
		assertTrue(engine instanceof RecordingEngine);
		EngineRegistry.unregister("recording");
		EngineRegistry.register("other", new RecordingEngine());
		assertSame(engine, jsonnet.getEngine());
	}

	@Test
	public void testEngineIsRequired() {
		assertThrows(NullPointerException.class, () -> new Jsonnet(null));
	}
}
