package org.lokray.lumen.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single diagnostic produced while compiling or running a Lumen program.
 * Line and column are null when the error has no originating token
 * (for example an unexpected end of input, or a failure inside a lazily resolved variable).
 */
public final class CompilationError
{
	private final ErrorKind kind;
	private final String message;
	private final Integer line;
	private final Integer column;

	public CompilationError(ErrorKind kind, String message, Integer line, Integer column)
	{
		this.kind = Objects.requireNonNull(kind, "kind");
		this.message = Objects.requireNonNull(message, "message");
		this.line = line;
		this.column = column;
	}

	public ErrorKind getKind()
	{
		return kind;
	}

	public String getMessage()
	{
		return message;
	}

	public Integer getLine()
	{
		return line;
	}

	public Integer getColumn()
	{
		return column;
	}

	public boolean hasPosition()
	{
		return line != null;
	}

	/**
	 * Converts this error to the flat record consumed by editor front-ends:
	 * {@code {type, message, line, column}}.
	 */
	public Map<String, Object> toMap()
	{
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("type", kind.getLabel());
		map.put("message", message);
		map.put("line", line);
		map.put("column", column);
		return map;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		CompilationError that = (CompilationError) o;
		return kind == that.kind
				&& message.equals(that.message)
				&& Objects.equals(line, that.line)
				&& Objects.equals(column, that.column);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, message, line, column);
	}

	@Override
	public String toString()
	{
		if (!hasPosition())
		{
			return kind.getLabel() + ": " + message + " (Línea: N/A, Columna: N/A)";
		}
		return kind.getLabel() + ": " + message + " (Línea: " + line + ", Columna: " + column + ")";
	}
}
