package org.lokray.lumen.semantics;

/**
 * The value types of the language. Every number is a {@code float}; comparisons and logical operators produce {@code boolean}.
 */
public final class PrimitiveType extends Type
{
	public static final PrimitiveType FLOAT = new PrimitiveType("float");
	public static final PrimitiveType BOOLEAN = new PrimitiveType("boolean");

	private PrimitiveType(String name)
	{
		super(name);
	}

	@Override
	public boolean isNumeric()
	{
		return this == FLOAT;
	}

	@Override
	public boolean isBoolean()
	{
		return this == BOOLEAN;
	}
}
