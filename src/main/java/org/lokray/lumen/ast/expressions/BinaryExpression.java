package org.lokray.lumen.ast.expressions;

import org.lokray.lumen.ast.ASTVisitor;
import org.lokray.lumen.lexer.Token;
import org.lokray.lumen.semantics.Type;

/**
 * AST node representing a binary operation (e.g., a + b, x == y, c AND d).
 * It has a left operand, an operator token, and a right operand.
 */
public class BinaryExpression implements Expression
{
	private final Expression left;
	private final Token operator; // PLUS, MINUS, STAR, SLASH, a comparison, AND or OR
	private final Expression right;
	private final Type resolvedType;

	public BinaryExpression(Expression left, Token operator, Expression right, Type resolvedType)
	{
		this.left = left;
		this.operator = operator;
		this.right = right;
		this.resolvedType = resolvedType;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public Type getResolvedType()
	{
		return resolvedType;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator.getLexeme() + " " + right + ")";
	}
}
