package org.lokray.lumen.lexer;

/**
 * One lexeme of a Lumen program with its kind and where it starts.
 * Number tokens carry their Double value and TRUE/FALSE their Boolean; other tokens carry none.
 */
public class Token
{
	private final TokenType type;
	private final String lexeme;
	private final Object literal;
	private final int line;   // 1-based
	private final int column; // 1-based

	public Token(TokenType type, String lexeme, Object literal, int line, int column)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.literal = literal;
		this.line = line;
		this.column = column;
	}

	public TokenType getType()
	{
		return type;
	}

	public boolean is(TokenType expected)
	{
		return type == expected;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public Object getLiteral()
	{
		return literal;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	@Override
	public String toString()
	{
		return type + " '" + lexeme + "' at " + line + ":" + column;
	}
}
