package org.lokray.lumen.semantics;

import org.lokray.lumen.ast.expressions.Expression;

/**
 * Represents a variable in the symbol table.
 * Holds the type inferred from the variable's most recent assignment and the expression that assignment stored.
 * Both are replaced by every later assignment to the same name, so a variable's type may change along the program.
 */
public class VariableSymbol
{
	private final String name;
	private Type type;
	private Expression definingExpression; // Null for the placeholder of an undeclared variable

	/**
	 * Constructs a VariableSymbol.
	 *
	 * @param name               The name of the variable.
	 * @param type               The inferred type of the variable.
	 * @param definingExpression The right-hand side of the assignment that defined it, or null.
	 */
	public VariableSymbol(String name, Type type, Expression definingExpression)
	{
		this.name = name;
		this.type = type;
		this.definingExpression = definingExpression;
	}

	public String getName()
	{
		return name;
	}

	public Type getType()
	{
		return type;
	}

	public Expression getDefiningExpression()
	{
		return definingExpression;
	}

	/**
	 * Records a new assignment: last assignment wins.
	 */
	public void redefine(Type type, Expression definingExpression)
	{
		this.type = type;
		this.definingExpression = definingExpression;
	}

	/**
	 * @return True for the placeholder created when the variable was referenced before any assignment.
	 */
	public boolean isUndeclared()
	{
		return type == UnknownType.UNDECLARED && definingExpression == null;
	}

	@Override
	public String toString()
	{
		return name + " : " + type.getName();
	}
}
