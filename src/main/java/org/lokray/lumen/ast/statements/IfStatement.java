package org.lokray.lumen.ast.statements;

import org.lokray.lumen.ast.ASTVisitor;
import org.lokray.lumen.ast.expressions.Expression;
import org.lokray.lumen.lexer.Token;

import java.util.List;

/**
 * AST node representing an {@code IF} statement, with or without an {@code ELSE} block.
 * Both branches are brace-delimited blocks.
 */
public class IfStatement implements Statement
{
	private final Token ifKeyword;       // The 'IF' keyword token
	private final Expression condition;
	private final List<Statement> thenBlock;
	private final List<Statement> elseBlock;  // Null when there is no ELSE

	/**
	 * Constructs an IfStatement.
	 *
	 * @param ifKeyword The 'IF' keyword token.
	 * @param condition The expression for the condition.
	 * @param thenBlock The statements to execute if the condition is true.
	 * @param elseBlock The statements to execute if the condition is false, or null if there is no ELSE.
	 */
	public IfStatement(Token ifKeyword, Expression condition, List<Statement> thenBlock, List<Statement> elseBlock)
	{
		this.ifKeyword = ifKeyword;
		this.condition = condition;
		this.thenBlock = List.copyOf(thenBlock);
		this.elseBlock = elseBlock != null ? List.copyOf(elseBlock) : null;
	}

	public Token getIfKeyword()
	{
		return ifKeyword;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public List<Statement> getThenBlock()
	{
		return thenBlock;
	}

	public List<Statement> getElseBlock()
	{
		return elseBlock;
	}

	public boolean hasElse()
	{
		return elseBlock != null;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("IF (").append(condition).append(") ");
		sb.append(Statement.formatBlock(thenBlock));
		if (elseBlock != null)
		{
			sb.append(" ELSE ").append(Statement.formatBlock(elseBlock));
		}
		return sb.toString();
	}
}
