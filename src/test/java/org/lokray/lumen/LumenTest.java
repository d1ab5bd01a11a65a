package org.lokray.lumen;

import org.junit.jupiter.api.Test;
import org.lokray.lumen.interpreter.Value;
import org.lokray.lumen.util.CompilationError;
import org.lokray.lumen.util.Debug;
import org.lokray.lumen.util.ErrorKind;
import org.lokray.lumen.util.InterpreterConfig;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests through the {@link Lumen} entry point.
 */
class LumenTest
{
	private final Lumen lumen = new Lumen(InterpreterConfig.defaults());

	@Test
	void testValidProgramHasNoErrorsAndEveryAssignedVariable()
	{
		RunResult result = lumen.run("""
				base = 2.5
				altura = 4
				area = base * altura / 2
				grande = area > 4 AND NOT (area == 100)
				""");

		assertFalse(result.hasErrors());
		assertEquals("[base, altura, area, grande]", result.getEvaluatedValues().keySet().toString());
		assertEquals(5.0, result.getValue("area").toDouble());
		assertEquals(Value.TRUE, result.getValue("grande"));
	}

	@Test
	void testStaticErrorSkipsEvaluation()
	{
		RunResult result = lumen.run("x = 1\nz = unknown_var + 1");

		assertEquals(1, result.getErrors().size());
		assertEquals("Variable 'unknown_var' no declarada.", result.getErrors().get(0).getMessage());
		assertTrue(result.getEvaluatedValues().isEmpty());
		assertEquals(2, result.getProgram().getStatements().size());
	}

	@Test
	void testTypeMismatchSkipsEvaluation()
	{
		RunResult result = lumen.run("w = 5 AND true");

		assertEquals(1, result.getErrors().size());
		assertTrue(result.getErrors().get(0).getMessage().contains("'AND'"));
		assertTrue(result.getEvaluatedValues().isEmpty());
	}

	@Test
	void testRuntimeErrorKeepsComputedValues()
	{
		RunResult result = lumen.run("a = 1\ny = 5 / 0\nb = a + 1");

		assertEquals(1, result.getErrors().size());
		assertEquals(ErrorKind.SEMANTIC, result.getErrors().get(0).getKind());
		assertEquals(Double.POSITIVE_INFINITY, result.getValue("y").toDouble());
		assertEquals(2.0, result.getValue("b").toDouble());
	}

	@Test
	void testErrorsAreOrderedByKind()
	{
		RunResult result = lumen.run("x = u + 1\nbad = $");

		List<CompilationError> errors = result.getErrors();
		assertEquals(ErrorKind.LEXICAL, errors.get(0).getKind());
		assertEquals(ErrorKind.SYNTACTIC, errors.get(1).getKind());
		assertEquals(ErrorKind.SEMANTIC, errors.get(2).getKind());
		assertEquals(3, errors.size());
	}

	@Test
	void testIllegalCharacterDoesNotStopParsing()
	{
		RunResult result = lumen.run("bad = $\ngood = 1");

		long lexical = result.getErrors().stream().filter(e -> e.getKind() == ErrorKind.LEXICAL).count();
		assertEquals(1, lexical);
		CompilationError error = result.getErrors().get(0);
		assertEquals(1, error.getLine());
		assertEquals(7, error.getColumn());
		assertFalse(result.getProgram().isEmpty());
	}

	@Test
	void testRunsAreIndependent()
	{
		String source = "contador = 0\nsuma = 0\nWHILE (contador < 5) {\n  suma = suma + contador\n  contador = contador + 1\n}\nq = suma / 0";

		RunResult first = lumen.run(source);
		RunResult second = lumen.run(source);

		assertEquals(first.getProgram().toString(), second.getProgram().toString());
		assertEquals(first.getErrors(), second.getErrors());
		assertEquals(first.getEvaluatedValues(), second.getEvaluatedValues());
		assertEquals(10.0, second.getValue("suma").toDouble());
	}

	@Test
	void testSymbolTableIsExposed()
	{
		RunResult result = lumen.run("x = 1\nflag = x > 0");

		assertEquals("float", result.getSymbolTable().resolve("x").getType().getName());
		assertEquals("boolean", result.getSymbolTable().resolve("flag").getType().getName());
	}

	@Test
	void testErrorRecordShape()
	{
		RunResult result = lumen.run("x = (1 + 2");

		Map<String, Object> record = result.getErrors().get(0).toMap();
		assertEquals("[type, message, line, column]", record.keySet().toString());
		assertEquals("Sintáctico", record.get("type"));
		assertNull(record.get("line"));
		assertNull(record.get("column"));
	}

	@Test
	void testExportDot()
	{
		RunResult result = lumen.run("x = 1 + 2");

		String dot = lumen.exportDot(result.getProgram());
		assertTrue(dot.startsWith("// Abstract Syntax Tree\ndigraph {"));
		assertTrue(dot.contains("rankdir=TB"));
		assertTrue(dot.contains("0 [label=\"Program\" shape=box style=filled fillcolor=lightblue]"));
		assertTrue(dot.contains("3 [label=\"+\"]"));
		assertTrue(dot.contains("0 -> 1"));
	}

	@Test
	void testDeeplyNestedParenthesesAreASyntaxError()
	{
		String source = "x = " + "(".repeat(100_000) + "1" + ")".repeat(100_000);

		RunResult result = lumen.run(source);

		assertEquals(1, result.getErrors().size());
		CompilationError error = result.getErrors().get(0);
		assertEquals(ErrorKind.SYNTACTIC, error.getKind());
		assertEquals("Error sintáctico: expresión demasiado anidada.", error.getMessage());
		assertNull(error.getLine());
		assertTrue(result.getProgram().isEmpty());
		assertTrue(result.getEvaluatedValues().isEmpty());
	}

	@Test
	void testOverlyLongChainIsAnInternalError()
	{
		String source = "a = 1\nx = 1" + " + 1".repeat(300_000);

		RunResult result = lumen.run(source);

		assertEquals(1, result.getErrors().size());
		CompilationError error = result.getErrors().get(0);
		assertEquals(ErrorKind.SEMANTIC, error.getKind());
		assertEquals("Error interno durante la ejecución: expresión demasiado anidada.", error.getMessage());
		assertNull(error.getLine());
		assertTrue(result.getEvaluatedValues().isEmpty());
		assertEquals(2, result.getProgram().getStatements().size());
	}

	@Test
	void testDebugLoggingFollowsEachConfig()
	{
		Properties props = new Properties();
		props.setProperty("debug", "true");
		PrintStream original = System.out;
		ByteArrayOutputStream captured = new ByteArrayOutputStream();
		System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
		try
		{
			new Lumen(new InterpreterConfig(props)).run("x = 1");
			assertTrue(captured.toString(StandardCharsets.UTF_8).contains("[DEBUG]"));

			captured.reset();
			new Lumen(InterpreterConfig.defaults()).run("x = 1");
			assertEquals("", captured.toString(StandardCharsets.UTF_8));
		}
		finally
		{
			System.setOut(original);
			Debug.setEnabled(false);
		}
	}
}
