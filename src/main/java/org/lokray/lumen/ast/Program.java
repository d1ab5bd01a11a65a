package org.lokray.lumen.ast;

import org.lokray.lumen.ast.statements.Statement;

import java.util.Collections;
import java.util.List;

/**
 * The root AST node representing an entire Lumen program: its top-level statements, in source order.
 */
public class Program implements ASTNode
{
	private final List<Statement> statements;

	public Program(List<Statement> statements)
	{
		this.statements = List.copyOf(statements);
	}

	public static Program empty()
	{
		return new Program(Collections.emptyList());
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	public boolean isEmpty()
	{
		return statements.isEmpty();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (Statement statement : statements)
		{
			sb.append(statement).append("\n");
		}
		return sb.toString();
	}
}
