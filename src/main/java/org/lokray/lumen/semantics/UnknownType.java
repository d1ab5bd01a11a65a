package org.lokray.lumen.semantics;

/**
 * Type of an expression that cannot be checked statically.
 */
public final class UnknownType extends Type
{
	/**
	 * Result of an operation over an unresolved operand.
	 */
	public static final UnknownType UNKNOWN = new UnknownType("unknown");

	/**
	 * Type of the placeholder symbol created for a variable used before any assignment.
	 */
	public static final UnknownType UNDECLARED = new UnknownType("unknown_error");

	private UnknownType(String name)
	{
		super(name);
	}

	@Override
	public boolean isUnresolved()
	{
		return true;
	}
}
