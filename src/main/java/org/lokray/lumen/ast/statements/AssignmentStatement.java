package org.lokray.lumen.ast.statements;

import org.lokray.lumen.ast.ASTVisitor;
import org.lokray.lumen.ast.expressions.Expression;
import org.lokray.lumen.lexer.Token;

/**
 * AST node for {@code name = value}.
 */
public class AssignmentStatement implements Statement
{
	private final Token name; // The target IDENTIFIER token
	private final Expression value;

	public AssignmentStatement(Token name, Expression value)
	{
		this.name = name;
		this.value = value;
	}

	public Token getName()
	{
		return name;
	}

	public String getNameLexeme()
	{
		return name.getLexeme();
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAssignmentStatement(this);
	}

	@Override
	public String toString()
	{
		return name.getLexeme() + " = " + value;
	}
}
