package org.lokray.lumen.ast.expressions;

import org.lokray.lumen.ast.ASTVisitor;
import org.lokray.lumen.lexer.Token;
import org.lokray.lumen.lexer.TokenType;
import org.lokray.lumen.semantics.PrimitiveType;
import org.lokray.lumen.semantics.Type;

/**
 * AST node for a number ({@code 2}, {@code 3.5}, {@code .5}) or boolean ({@code TRUE}, {@code FALSE}) literal.
 */
public class LiteralExpression implements Expression
{
	private final Object value; // Double or Boolean

	public LiteralExpression(Token literalToken)
	{
		if (!literalToken.is(TokenType.NUMBER_LITERAL) && !literalToken.is(TokenType.BOOLEAN_LITERAL))
		{
			throw new IllegalArgumentException("Token for LiteralExpression must be a number or boolean literal.");
		}
		this.value = literalToken.getLiteral();
	}

	public Object getValue()
	{
		return value;
	}

	public boolean isNumber()
	{
		return value instanceof Double;
	}

	@Override
	public Type getResolvedType()
	{
		return isNumber() ? PrimitiveType.FLOAT : PrimitiveType.BOOLEAN;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLiteralExpression(this);
	}

	@Override
	public String toString()
	{
		return String.valueOf(value);
	}
}
