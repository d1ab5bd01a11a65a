package org.lokray.lumen.ast.statements;

import org.lokray.lumen.ast.ASTNode;

import java.util.List;

/**
 * Base interface for all statement nodes.
 */
public interface Statement extends ASTNode
{
	/**
	 * @return True if this statement only wraps an expression that failed type checking; such statements are skipped at runtime.
	 */
	default boolean isErroneous()
	{
		return false;
	}

	/**
	 * Renders a brace-delimited block, one statement per indented line.
	 */
	static String formatBlock(List<Statement> statements)
	{
		StringBuilder sb = new StringBuilder("{\n");
		for (Statement statement : statements)
		{
			for (String line : statement.toString().split("\n"))
			{
				sb.append("  ").append(line).append("\n");
			}
		}
		return sb.append("}").toString();
	}
}
