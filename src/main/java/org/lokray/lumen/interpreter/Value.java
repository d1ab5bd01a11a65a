package org.lokray.lumen.interpreter;

/**
 * Runtime value of a Lumen program: a number or a boolean.
 * There is no "void" value; an operation that produces nothing returns Java {@code null},
 * which the interpreter propagates as "absent".
 */
public interface Value
{
	Value TRUE = new Bool(true);
	Value FALSE = new Bool(false);

	/**
	 * Every Lumen number is a double, including the ones written without a fraction.
	 */
	record Number(double value) implements Value
	{
		@Override
		public String toString()
		{
			return String.valueOf(value);
		}
	}

	record Bool(boolean value) implements Value
	{
		@Override
		public String toString()
		{
			return value ? "TRUE" : "FALSE";
		}
	}

	static Value of(double value)
	{
		return new Number(value);
	}

	static Value of(boolean value)
	{
		return value ? TRUE : FALSE;
	}

	/**
	 * Wraps a literal produced by the lexer (a {@link Double} or a {@link Boolean}).
	 */
	static Value fromLiteral(Object literal)
	{
		if (literal instanceof Double d)
		{
			return of(d);
		}
		if (literal instanceof Boolean b)
		{
			return of(b.booleanValue());
		}
		throw new IllegalArgumentException("Not a Lumen literal: " + literal);
	}

	default boolean isNumber()
	{
		return this instanceof Number;
	}

	default boolean isBool()
	{
		return this instanceof Bool;
	}

	default double toDouble()
	{
		if (this instanceof Number n)
		{
			return n.value();
		}
		throw new IllegalStateException("Not a number: " + this);
	}

	default boolean toBoolean()
	{
		if (this instanceof Bool b)
		{
			return b.value();
		}
		throw new IllegalStateException("Not a boolean: " + this);
	}
}
