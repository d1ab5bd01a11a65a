package org.lokray.lumen.semantics;

/**
 * Abstract base class for the static types of Lumen expressions.
 * There are two value types ({@link PrimitiveType#FLOAT} and {@link PrimitiveType#BOOLEAN}),
 * two "unresolved" types for expressions whose type cannot be proven ({@link UnknownType}),
 * and {@link ErrorType} for expressions that already failed type checking.
 */
public abstract class Type
{
	protected final String name;

	protected Type(String name)
	{
		this.name = name;
	}

	public String getName()
	{
		return name;
	}

	public boolean isNumeric()
	{
		return false;
	}

	public boolean isBoolean()
	{
		return false;
	}

	/**
	 * Unresolved types come from undeclared variables. Checks involving them are skipped
	 * so a single missing declaration does not cascade into more errors.
	 */
	public boolean isUnresolved()
	{
		return false;
	}

	public boolean isError()
	{
		return false;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
