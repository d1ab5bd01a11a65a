package org.lokray.lumen.ast.statements;

import org.lokray.lumen.ast.ASTVisitor;
import org.lokray.lumen.ast.expressions.Expression;
import org.lokray.lumen.lexer.Token;

import java.util.List;

/**
 * AST node representing a 'WHILE' loop statement.
 * Includes a condition expression and a loop body.
 */
public class WhileStatement implements Statement
{
	private final Token whileKeyword;
	private final Expression condition;
	private final List<Statement> body;

	public WhileStatement(Token whileKeyword, Expression condition, List<Statement> body)
	{
		this.whileKeyword = whileKeyword;
		this.condition = condition;
		this.body = List.copyOf(body);
	}

	public Token getWhileKeyword()
	{
		return whileKeyword;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public List<Statement> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitWhileStatement(this);
	}

	@Override
	public String toString()
	{
		return "WHILE (" + condition + ") " + Statement.formatBlock(body);
	}
}
