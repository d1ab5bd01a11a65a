package org.lokray.lumen.parser;

import org.junit.jupiter.api.Test;
import org.lokray.lumen.ast.Program;
import org.lokray.lumen.ast.statements.AssignmentStatement;
import org.lokray.lumen.ast.statements.IfStatement;
import org.lokray.lumen.ast.statements.WhileStatement;
import org.lokray.lumen.lexer.Lexer;
import org.lokray.lumen.semantics.SymbolTable;
import org.lokray.lumen.semantics.TypeChecker;
import org.lokray.lumen.util.CompilationError;
import org.lokray.lumen.util.ErrorReporter;
import org.lokray.lumen.util.InterpreterConfig;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the recursive-descent parser: precedence, statement forms and syntax error recovery.
 */
class LumenParserTest
{
	private ErrorReporter errors;

	private Program parse(String source)
	{
		errors = new ErrorReporter();
		TypeChecker typeChecker = new TypeChecker(new SymbolTable(), errors, InterpreterConfig.defaults());
		return new LumenParser(new Lexer(source, errors).scanTokens(), errors, typeChecker).parse();
	}

	@Test
	void testMultiplicationBindsTighterThanAddition()
	{
		Program program = parse("x = 2 + 3 * 4");

		assertEquals("x = (2.0 + (3.0 * 4.0))", program.getStatements().get(0).toString());
		assertFalse(errors.hasErrors());
	}

	@Test
	void testBinaryOperatorsAreLeftAssociative()
	{
		Program program = parse("x = 10 - 4 - 3");

		assertEquals("x = ((10.0 - 4.0) - 3.0)", program.getStatements().get(0).toString());
	}

	@Test
	void testNotBindsLooserThanEquality()
	{
		Program program = parse("a = 1\nb = NOT a == 2");

		assertEquals("b = (NOT (a == 2.0))", program.getStatements().get(1).toString());
		assertFalse(errors.hasErrors());
	}

	@Test
	void testAndBindsTighterThanOr()
	{
		Program program = parse("x = TRUE OR FALSE AND FALSE");

		assertEquals("x = (true OR (false AND false))", program.getStatements().get(0).toString());
	}

	@Test
	void testUnaryMinusAppliesToNextOperand()
	{
		Program program = parse("x = -2 * 3");

		assertEquals("x = ((-2.0) * 3.0)", program.getStatements().get(0).toString());
	}

	@Test
	void testParenthesesOverridePrecedence()
	{
		Program program = parse("x = (2 + 3) * 4");

		assertEquals("x = ((2.0 + 3.0) * 4.0)", program.getStatements().get(0).toString());
	}

	@Test
	void testIfElseStatement()
	{
		Program program = parse("x = 1\nIF (x > 0) { y = 1 } ELSE { y = 2 z = 3 }");

		assertEquals(2, program.getStatements().size());
		IfStatement statement = assertInstanceOf(IfStatement.class, program.getStatements().get(1));
		assertTrue(statement.hasElse());
		assertEquals(1, statement.getThenBlock().size());
		assertEquals(2, statement.getElseBlock().size());
		assertFalse(errors.hasErrors());
	}

	@Test
	void testWhileStatementWithEmptyBody()
	{
		Program program = parse("while (FALSE) { }");

		WhileStatement statement = assertInstanceOf(WhileStatement.class, program.getStatements().get(0));
		assertTrue(statement.getBody().isEmpty());
		assertFalse(errors.hasErrors());
	}

	@Test
	void testMissingBraceIsReportedAndParsingResumes()
	{
		Program program = parse("IF (TRUE) y = 1");

		assertEquals(1, errors.getSyntacticErrors().size());
		CompilationError error = errors.getSyntacticErrors().get(0);
		assertEquals("Error sintáctico cerca de 'y': se esperaba '{' para abrir el bloque de IF.", error.getMessage());
		assertEquals(1, error.getLine());
		assertEquals(11, error.getColumn());

		assertEquals(1, program.getStatements().size());
		assertInstanceOf(AssignmentStatement.class, program.getStatements().get(0));
	}

	@Test
	void testUnexpectedEndOfInputHasNoPosition()
	{
		Program program = parse("x = (1 + 2");

		assertTrue(program.isEmpty());
		assertEquals(1, errors.getSyntacticErrors().size());
		CompilationError error = errors.getSyntacticErrors().get(0);
		assertEquals("Error sintáctico: Fin de archivo inesperado o incompleto.", error.getMessage());
		assertNull(error.getLine());
		assertNull(error.getColumn());
	}

	@Test
	void testStrayClosingBraceIsSkipped()
	{
		Program program = parse("x = 1 } y = 2");

		assertEquals(2, program.getStatements().size());
		assertEquals(1, errors.getSyntacticErrors().size());
		assertEquals("Error sintáctico cerca de '}': no hay ningún bloque abierto que cerrar.",
				errors.getSyntacticErrors().get(0).getMessage());
	}

	@Test
	void testRecoveryInsideBlockKeepsTheRestOfTheBlock()
	{
		Program program = parse("WHILE (TRUE) { x = 1 + * 2 y = 3 }");

		assertEquals(1, errors.getSyntacticErrors().size());
		assertEquals("Error sintáctico cerca de '*': se esperaba una expresión.", errors.getSyntacticErrors().get(0).getMessage());

		WhileStatement loop = assertInstanceOf(WhileStatement.class, program.getStatements().get(0));
		assertEquals(1, loop.getBody().size());
		assertEquals("y = 3.0", loop.getBody().get(0).toString());
	}

	@Test
	void testEachBrokenStatementReportsOnce()
	{
		Program program = parse("a = 1 +\nb = 2\nc = * 3\nd = 4");

		assertEquals(2, errors.getSyntacticErrors().size());
		assertEquals(2, program.getStatements().size());
		assertEquals("b = 2.0", program.getStatements().get(0).toString());
		assertEquals("d = 4.0", program.getStatements().get(1).toString());
	}

	@Test
	void testEmptyProgram()
	{
		Program program = parse("# nothing here\n");

		assertNotNull(program);
		assertTrue(program.isEmpty());
		assertFalse(errors.hasErrors());
	}
}
