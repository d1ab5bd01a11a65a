package org.lokray.lumen.semantics;

/**
 * Represents an error type, used to propagate type checking errors.
 * This is a singleton.
 */
public final class ErrorType extends Type
{
	public static final ErrorType INSTANCE = new ErrorType();

	private ErrorType()
	{
		super("error");
	}

	@Override
	public boolean isError()
	{
		return true;
	}
}
