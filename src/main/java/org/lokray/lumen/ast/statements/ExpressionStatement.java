package org.lokray.lumen.ast.statements;

import org.lokray.lumen.ast.ASTVisitor;
import org.lokray.lumen.ast.expressions.ErrorExpression;
import org.lokray.lumen.ast.expressions.Expression;

/**
 * AST node representing a bare expression used as a statement.
 */
public class ExpressionStatement implements Statement
{
	private final Expression expression;

	public ExpressionStatement(Expression expression)
	{
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public boolean isErroneous()
	{
		return expression instanceof ErrorExpression;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitExpressionStatement(this);
	}

	@Override
	public String toString()
	{
		return expression.toString();
	}
}
