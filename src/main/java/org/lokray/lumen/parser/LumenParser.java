package org.lokray.lumen.parser;

import org.lokray.lumen.ast.Program;
import org.lokray.lumen.ast.expressions.Expression;
import org.lokray.lumen.ast.expressions.LiteralExpression;
import org.lokray.lumen.ast.statements.ExpressionStatement;
import org.lokray.lumen.ast.statements.IfStatement;
import org.lokray.lumen.ast.statements.Statement;
import org.lokray.lumen.ast.statements.WhileStatement;
import org.lokray.lumen.lexer.Token;
import org.lokray.lumen.lexer.TokenType;
import org.lokray.lumen.semantics.TypeChecker;
import org.lokray.lumen.util.Debug;
import org.lokray.lumen.util.ErrorReporter;

import java.util.ArrayList;
import java.util.List;

/**
 * The LumenParser performs syntactic analysis.
 * It takes the list of tokens from the lexer and builds the Abstract Syntax Tree,
 * handing every node to the {@link TypeChecker} as it is built, so parsing and type checking are a single pass.
 * This parser uses a recursive-descent approach.
 * <p>
 * Grammar:
 * <pre>
 * program    := statement*
 * statement  := IF '(' expression ')' block (ELSE block)?
 *             | WHILE '(' expression ')' block
 *             | IDENTIFIER '=' expression
 *             | expression
 * block      := '{' statement* '}'
 * </pre>
 * On a syntax error the current statement is dropped, one error is reported, and parsing resumes at the next
 * statement start ({@code IF}, {@code WHILE}, {@code IDENTIFIER '='}), at the {@code '}'} closing the current block,
 * or at the end of input.
 */
public class LumenParser
{
	private final List<Token> tokens; // The list of tokens from the lexer
	private final ErrorReporter errorReporter; // For reporting parsing errors
	private final TypeChecker typeChecker; // Grammar actions
	private int current = 0; // Current position in the token list

	/**
	 * Constructs a LumenParser.
	 *
	 * @param tokens        The list of tokens produced by the lexer, ending with EOF.
	 * @param errorReporter An instance of ErrorReporter for handling parsing errors.
	 * @param typeChecker   The checker that types each node and maintains the symbol table.
	 */
	public LumenParser(List<Token> tokens, ErrorReporter errorReporter, TypeChecker typeChecker)
	{
		if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF))
		{
			throw new IllegalArgumentException("Token list must end with an EOF token.");
		}
		this.tokens = tokens;
		this.errorReporter = errorReporter;
		this.typeChecker = typeChecker;
	}

	/**
	 * Starts the parsing process for the entire program.
	 *
	 * @return The root of the AST. Never null; statements that failed to parse are left out.
	 */
	public Program parse()
	{
		List<Statement> statements = new ArrayList<>();
		while (!isAtEnd())
		{
			int statementStart = current;
			try
			{
				if (check(TokenType.RIGHT_BRACE))
				{
					throw error(peek(), "no hay ningún bloque abierto que cerrar");
				}
				statements.add(statement());
			}
			catch (ParseError e)
			{
				synchronize(statementStart);
			}
		}
		Debug.log("Parsed %d top-level statements.", statements.size());
		return new Program(statements);
	}

	/**
	 * Parses a single statement.
	 * This method acts as a dispatcher for different statement types.
	 */
	private Statement statement() throws ParseError
	{
		if (match(TokenType.IF))
		{
			return ifStatement();
		}
		if (match(TokenType.WHILE))
		{
			return whileStatement();
		}
		if (check(TokenType.IDENTIFIER) && check(1, TokenType.ASSIGN))
		{
			return assignment();
		}
		return new ExpressionStatement(expression());
	}

	/**
	 * Grammar: {@code IDENTIFIER '=' EXPRESSION}
	 */
	private Statement assignment() throws ParseError
	{
		Token name = advance();
		advance(); // '='
		Expression value = expression();
		return typeChecker.assignment(name, value);
	}

	/**
	 * Grammar: {@code IF '(' EXPRESSION ')' BLOCK (ELSE BLOCK)?}
	 */
	private IfStatement ifStatement() throws ParseError
	{
		Token ifKeyword = previous();

		consume(TokenType.LEFT_PAREN, "se esperaba '(' después de IF");
		Expression condition = expression();
		consume(TokenType.RIGHT_PAREN, "se esperaba ')' después de la condición del IF");
		typeChecker.condition(ifKeyword, condition);

		List<Statement> thenBlock = block("IF");
		List<Statement> elseBlock = null;
		if (match(TokenType.ELSE))
		{
			elseBlock = block("ELSE");
		}
		return new IfStatement(ifKeyword, condition, thenBlock, elseBlock);
	}

	/**
	 * Grammar: {@code WHILE '(' EXPRESSION ')' BLOCK}
	 */
	private WhileStatement whileStatement() throws ParseError
	{
		Token whileKeyword = previous();

		consume(TokenType.LEFT_PAREN, "se esperaba '(' después de WHILE");
		Expression condition = expression();
		consume(TokenType.RIGHT_PAREN, "se esperaba ')' después de la condición del WHILE");
		typeChecker.condition(whileKeyword, condition);

		List<Statement> body = block("WHILE");
		return new WhileStatement(whileKeyword, condition, body);
	}

	/**
	 * Parses a brace-delimited block. Braces are mandatory, even around a single statement.
	 * A statement that fails inside the block is dropped and parsing continues with the rest of the block.
	 *
	 * @param owner The keyword owning the block, for error messages.
	 */
	private List<Statement> block(String owner) throws ParseError
	{
		consume(TokenType.LEFT_BRACE, "se esperaba '{' para abrir el bloque de " + owner);
		List<Statement> statements = new ArrayList<>();

		while (!check(TokenType.RIGHT_BRACE) && !isAtEnd())
		{
			int statementStart = current;
			try
			{
				statements.add(statement());
			}
			catch (ParseError e)
			{
				synchronize(statementStart);
			}
		}

		consume(TokenType.RIGHT_BRACE, "se esperaba '}' para cerrar el bloque de " + owner);
		return statements;
	}

	/**
	 * Parses an expression based on operator precedence.
	 * This is a chain of methods, each handling a higher precedence level:
	 * OR -> AND -> NOT -> Equality -> Comparison -> Additive -> Multiplicative -> Unary minus -> Primary.
	 * All binary levels are left-associative.
	 */
	private Expression expression() throws ParseError
	{
		return or();
	}

	private Expression or() throws ParseError
	{
		Expression expr = and();

		while (match(TokenType.OR))
		{
			Token operator = previous();
			Expression right = and();
			expr = typeChecker.binary(expr, operator, right);
		}
		return expr;
	}

	private Expression and() throws ParseError
	{
		Expression expr = not();

		while (match(TokenType.AND))
		{
			Token operator = previous();
			Expression right = not();
			expr = typeChecker.binary(expr, operator, right);
		}
		return expr;
	}

	/**
	 * NOT binds looser than comparisons: {@code NOT a == b} is {@code NOT (a == b)}.
	 */
	private Expression not() throws ParseError
	{
		if (match(TokenType.NOT))
		{
			Token operator = previous();
			Expression operand = not();
			return typeChecker.not(operator, operand);
		}
		return equality();
	}

	private Expression equality() throws ParseError
	{
		Expression expr = comparison();

		while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL))
		{
			Token operator = previous();
			Expression right = comparison();
			expr = typeChecker.binary(expr, operator, right);
		}
		return expr;
	}

	private Expression comparison() throws ParseError
	{
		Expression expr = additive();

		while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL))
		{
			Token operator = previous();
			Expression right = additive();
			expr = typeChecker.binary(expr, operator, right);
		}
		return expr;
	}

	private Expression additive() throws ParseError
	{
		Expression expr = multiplicative();

		while (match(TokenType.PLUS, TokenType.MINUS))
		{
			Token operator = previous();
			Expression right = multiplicative();
			expr = typeChecker.binary(expr, operator, right);
		}
		return expr;
	}

	private Expression multiplicative() throws ParseError
	{
		Expression expr = unary();

		while (match(TokenType.STAR, TokenType.SLASH))
		{
			Token operator = previous();
			Expression right = unary();
			expr = typeChecker.binary(expr, operator, right);
		}
		return expr;
	}

	/**
	 * Parses prefix operators in operand position, e.g. {@code -x} or the {@code NOT b} in {@code a == NOT b}.
	 * Unary minus takes the next unary expression; NOT takes everything that binds tighter than NOT.
	 */
	private Expression unary() throws ParseError
	{
		if (match(TokenType.MINUS))
		{
			Token operator = previous();
			Expression operand = unary();
			return typeChecker.negate(operator, operand);
		}
		if (check(TokenType.NOT))
		{
			return not();
		}
		return primary();
	}

	/**
	 * Parses the most basic expressions: literals, identifiers and parenthesized expressions.
	 */
	private Expression primary() throws ParseError
	{
		if (match(TokenType.NUMBER_LITERAL, TokenType.BOOLEAN_LITERAL))
		{
			return new LiteralExpression(previous());
		}
		if (match(TokenType.IDENTIFIER))
		{
			return typeChecker.identifier(previous());
		}
		if (match(TokenType.LEFT_PAREN))
		{
			Expression expr = expression();
			consume(TokenType.RIGHT_PAREN, "se esperaba ')' después de la expresión");
			return expr;
		}
		throw error(peek(), "se esperaba una expresión");
	}

	/**
	 * Consumes the current token if its type matches any of the given types.
	 *
	 * @param types The TokenType(s) to match against.
	 * @return True if a match was found and the token was consumed, false otherwise.
	 */
	private boolean match(TokenType... types)
	{
		for (TokenType type : types)
		{
			if (check(type))
			{
				advance();
				return true;
			}
		}
		return false;
	}

	/**
	 * Consumes the current token if it is of the expected type, otherwise reports a syntax error.
	 *
	 * @param type    The expected TokenType.
	 * @param message What was expected, used in the error message.
	 * @return The consumed Token.
	 * @throws ParseError if the current token's type does not match the expected type.
	 */
	private Token consume(TokenType type, String message) throws ParseError
	{
		if (check(type))
		{
			return advance();
		}
		throw error(peek(), message);
	}

	private boolean check(TokenType type)
	{
		if (isAtEnd())
		{
			return false;
		}
		return peek().is(type);
	}

	/**
	 * Checks a token type at a given offset from the current position.
	 *
	 * @param offset The offset from the current token (0 for current, 1 for next, etc.)
	 * @param type   The TokenType to check for.
	 * @return True if the token at the offset exists and matches the type, false otherwise.
	 */
	private boolean check(int offset, TokenType type)
	{
		if (current + offset >= tokens.size())
		{
			return false;
		}
		return tokens.get(current + offset).is(type);
	}

	private Token advance()
	{
		if (!isAtEnd())
		{
			current++;
		}
		return previous();
	}

	private Token peek()
	{
		return tokens.get(current);
	}

	private Token previous()
	{
		return tokens.get(current - 1);
	}

	private boolean isAtEnd()
	{
		return peek().is(TokenType.EOF);
	}

	/**
	 * Reports a syntax error at {@code token} and creates the ParseError used to unwind to the statement level.
	 * An error at EOF has no position.
	 */
	private ParseError error(Token token, String expectation)
	{
		if (token.is(TokenType.EOF))
		{
			errorReporter.syntactic(null, null, "Error sintáctico: Fin de archivo inesperado o incompleto.");
		}
		else
		{
			errorReporter.syntactic(token.getLine(), token.getColumn(),
					"Error sintáctico cerca de '" + token.getLexeme() + "': " + expectation + ".");
		}
		return new ParseError();
	}

	/**
	 * Skips tokens after a syntax error until the next place a statement can start.
	 * Always consumes at least one token when the failed statement consumed none, so parsing cannot stall.
	 *
	 * @param statementStart Token index where the failed statement began.
	 */
	private void synchronize(int statementStart)
	{
		if (current == statementStart)
		{
			advance();
		}

		while (!isAtEnd())
		{
			switch (peek().getType())
			{
				case IF:
				case WHILE:
				case RIGHT_BRACE:
					return;
				case IDENTIFIER:
					if (check(1, TokenType.ASSIGN))
					{
						return;
					}
					break;
				default:
			}
			advance();
		}
	}

	/**
	 * Unwinds the parser to the enclosing statement after a syntax error has been reported.
	 */
	private static class ParseError extends RuntimeException
	{
	}
}
