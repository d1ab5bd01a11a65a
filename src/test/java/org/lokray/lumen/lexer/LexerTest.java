package org.lokray.lumen.lexer;

import org.junit.jupiter.api.Test;
import org.lokray.lumen.util.CompilationError;
import org.lokray.lumen.util.ErrorKind;
import org.lokray.lumen.util.ErrorReporter;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the Lumen lexer.
 */
class LexerTest
{
	private ErrorReporter errors;

	private List<Token> scan(String source)
	{
		errors = new ErrorReporter();
		return new Lexer(source, errors).scanTokens();
	}

	private static List<TokenType> types(List<Token> tokens)
	{
		List<TokenType> types = new ArrayList<>();
		for (Token token : tokens)
		{
			types.add(token.getType());
		}
		return types;
	}

	@Test
	void testTwoCharacterOperatorsAreAtomic()
	{
		List<Token> tokens = scan("a <= b");

		assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LESS_EQUAL, TokenType.IDENTIFIER, TokenType.EOF), types(tokens));
		assertEquals("<=", tokens.get(1).getLexeme());
		assertFalse(errors.hasErrors());
	}

	@Test
	void testAllComparisonOperators()
	{
		List<Token> tokens = scan("< <= > >= == != =");

		assertEquals(List.of(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL,
				TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.ASSIGN, TokenType.EOF), types(tokens));
	}

	@Test
	void testKeywordsAreCaseInsensitive()
	{
		List<Token> tokens = scan("while If ELSE and Or not");

		assertEquals(List.of(TokenType.WHILE, TokenType.IF, TokenType.ELSE, TokenType.AND, TokenType.OR, TokenType.NOT,
				TokenType.EOF), types(tokens));
	}

	@Test
	void testBooleanLiterals()
	{
		List<Token> tokens = scan("TRUE false");

		assertEquals(TokenType.BOOLEAN_LITERAL, tokens.get(0).getType());
		assertEquals(Boolean.TRUE, tokens.get(0).getLiteral());
		assertEquals(TokenType.BOOLEAN_LITERAL, tokens.get(1).getType());
		assertEquals(Boolean.FALSE, tokens.get(1).getLiteral());
	}

	@Test
	void testKeywordPrefixIsIdentifier()
	{
		List<Token> tokens = scan("iffy whiles _x1");

		assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF), types(tokens));
		assertEquals("_x1", tokens.get(2).getLexeme());
	}

	@Test
	void testNumbersAreDoubles()
	{
		List<Token> tokens = scan("3 2.5 .5 5.");

		assertEquals(3.0, tokens.get(0).getLiteral());
		assertEquals(2.5, tokens.get(1).getLiteral());
		assertEquals(0.5, tokens.get(2).getLiteral());
		assertEquals(5.0, tokens.get(3).getLiteral());
		assertEquals(".5", tokens.get(2).getLexeme());
	}

	@Test
	void testCommentsAreSkipped()
	{
		List<Token> tokens = scan("x = 1 # the answer is 42\ny");

		assertEquals(List.of(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NUMBER_LITERAL, TokenType.IDENTIFIER,
				TokenType.EOF), types(tokens));
		assertEquals(2, tokens.get(3).getLine());
		assertEquals(1, tokens.get(3).getColumn());
	}

	@Test
	void testLineAndColumnTracking()
	{
		List<Token> tokens = scan("x = 1\n  y = 2");

		Token y = tokens.get(3);
		assertEquals("y", y.getLexeme());
		assertEquals(2, y.getLine());
		assertEquals(3, y.getColumn());

		Token two = tokens.get(5);
		assertEquals(2, two.getLine());
		assertEquals(7, two.getColumn());
	}

	@Test
	void testIllegalCharacterIsReportedAndSkipped()
	{
		List<Token> tokens = scan("bad = $");

		assertEquals(List.of(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.EOF), types(tokens));
		assertEquals(1, errors.getLexicalErrors().size());

		CompilationError error = errors.getLexicalErrors().get(0);
		assertEquals(ErrorKind.LEXICAL, error.getKind());
		assertEquals("Caracter ilegal '$'", error.getMessage());
		assertEquals(1, error.getLine());
		assertEquals(7, error.getColumn());
	}

	@Test
	void testLoneBangIsIllegal()
	{
		List<Token> tokens = scan("a ! b");

		assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF), types(tokens));
		assertEquals("Caracter ilegal '!'", errors.getLexicalErrors().get(0).getMessage());
	}

	@Test
	void testScanningContinuesAfterSeveralIllegalCharacters()
	{
		List<Token> tokens = scan("a @ b\n? c");

		assertEquals(3, tokens.size() - 1);
		assertEquals(2, errors.getLexicalErrors().size());
		assertEquals(2, errors.getLexicalErrors().get(1).getLine());
		assertEquals(1, errors.getLexicalErrors().get(1).getColumn());
	}

	@Test
	void testEmptySourceProducesOnlyEof()
	{
		List<Token> tokens = scan("");

		assertEquals(1, tokens.size());
		assertEquals(TokenType.EOF, tokens.get(0).getType());
	}

	@Test
	void testIteratorRestartsFromTheBeginning()
	{
		Lexer lexer = new Lexer("x = 1\ny = x", new ErrorReporter());

		List<String> first = new ArrayList<>();
		lexer.forEach(token -> first.add(token.toString()));
		List<String> second = new ArrayList<>();
		lexer.forEach(token -> second.add(token.toString()));

		assertEquals(7, second.size());
		assertEquals(first, second);
		assertEquals("IDENTIFIER 'y' at 2:1", second.get(3));
	}
}
