package org.lokray.lumen.util;

/**
 * The phase that detected a {@link CompilationError}.
 * The label is the user-facing name shown by editors and the command line runner.
 */
public enum ErrorKind
{
	LEXICAL("Léxico"),
	SYNTACTIC("Sintáctico"),
	SEMANTIC("Semántico");

	private final String label;

	ErrorKind(String label)
	{
		this.label = label;
	}

	public String getLabel()
	{
		return label;
	}
}
