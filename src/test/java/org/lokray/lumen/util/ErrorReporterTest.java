package org.lokray.lumen.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErrorReporterTest
{
	@Test
	void testErrorsAreConcatenatedByKind()
	{
		ErrorReporter reporter = new ErrorReporter();
		reporter.semantic(3, 1, "semantic");
		reporter.syntactic(2, 1, "syntactic");
		reporter.lexical(1, 1, "lexical");

		List<CompilationError> errors = reporter.getErrors();
		assertEquals(3, errors.size());
		assertEquals("lexical", errors.get(0).getMessage());
		assertEquals("syntactic", errors.get(1).getMessage());
		assertEquals("semantic", errors.get(2).getMessage());
	}

	@Test
	void testHasErrors()
	{
		ErrorReporter reporter = new ErrorReporter();
		assertFalse(reporter.hasErrors());

		reporter.lexical(1, 1, "x");

		assertTrue(reporter.hasErrors());
		assertEquals(1, reporter.getLexicalErrors().size());
	}

	@Test
	void testListsAreReadOnly()
	{
		ErrorReporter reporter = new ErrorReporter();

		assertThrows(UnsupportedOperationException.class,
				() -> reporter.getSemanticErrors().add(new CompilationError(ErrorKind.SEMANTIC, "x", null, null)));
	}

	@Test
	void testToStringWithAndWithoutPosition()
	{
		CompilationError positioned = new CompilationError(ErrorKind.LEXICAL, "Caracter ilegal '$'", 1, 7);
		CompilationError unpositioned = new CompilationError(ErrorKind.SYNTACTIC, "Error sintáctico: Fin de archivo inesperado o incompleto.", null, null);

		assertEquals("Léxico: Caracter ilegal '$' (Línea: 1, Columna: 7)", positioned.toString());
		assertEquals("Sintáctico: Error sintáctico: Fin de archivo inesperado o incompleto. (Línea: N/A, Columna: N/A)",
				unpositioned.toString());
		assertTrue(positioned.hasPosition());
		assertFalse(unpositioned.hasPosition());
	}

	@Test
	void testToMap()
	{
		CompilationError error = new CompilationError(ErrorKind.SEMANTIC, "Error de ejecución: División por cero.", 2, 9);

		assertEquals("Semántico", error.toMap().get("type"));
		assertEquals(2, error.toMap().get("line"));
		assertEquals(9, error.toMap().get("column"));
	}
}
