package org.lokray.lumen.ast.expressions;

import org.lokray.lumen.ast.ASTVisitor;
import org.lokray.lumen.lexer.Token;
import org.lokray.lumen.lexer.TokenType;
import org.lokray.lumen.semantics.Type;

/**
 * AST node representing a unary operation: logical {@code NOT a} or numeric negation {@code -b}.
 */
public class UnaryExpression implements Expression
{
	private final Token operator; // NOT or MINUS
	private final Expression right; // The operand expression
	private final Type resolvedType;

	public UnaryExpression(Token operator, Expression right, Type resolvedType)
	{
		this.operator = operator;
		this.right = right;
		this.resolvedType = resolvedType;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	public boolean isNegation()
	{
		return operator.is(TokenType.MINUS);
	}

	@Override
	public Type getResolvedType()
	{
		return resolvedType;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitUnaryExpression(this);
	}

	@Override
	public String toString()
	{
		return isNegation() ? "(-" + right + ")" : "(NOT " + right + ")";
	}
}
