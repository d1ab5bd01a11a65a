package org.lokray.lumen.ast.expressions;

import org.lokray.lumen.ast.ASTVisitor;
import org.lokray.lumen.lexer.Token;
import org.lokray.lumen.lexer.TokenType;
import org.lokray.lumen.semantics.Type;

/**
 * AST node representing a variable read.
 */
public class IdentifierExpression implements Expression
{
	private final Token name; // The IDENTIFIER token
	private final Type resolvedType; // The variable's type at the point of the read

	public IdentifierExpression(Token name, Type resolvedType)
	{
		if (!name.is(TokenType.IDENTIFIER))
		{
			throw new IllegalArgumentException("Token for IdentifierExpression must be an IDENTIFIER.");
		}
		this.name = name;
		this.resolvedType = resolvedType;
	}

	public Token getName()
	{
		return name;
	}

	public String getNameLexeme()
	{
		return name.getLexeme();
	}

	@Override
	public Type getResolvedType()
	{
		return resolvedType;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIdentifierExpression(this);
	}

	@Override
	public String toString()
	{
		return name.getLexeme();
	}
}
