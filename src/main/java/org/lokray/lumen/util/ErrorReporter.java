package org.lokray.lumen.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the errors of one compile-and-run request.
 * Lexical, syntactic and semantic errors are kept in separate ordered lists
 * and concatenated in that order when reported back to the caller.
 * A reporter is never shared between requests.
 */
public class ErrorReporter
{
	private final List<CompilationError> lexicalErrors = new ArrayList<>();
	private final List<CompilationError> syntacticErrors = new ArrayList<>();
	private final List<CompilationError> semanticErrors = new ArrayList<>();

	/**
	 * Reports an illegal character.
	 *
	 * @param line    The line number where the error occurred.
	 * @param column  The column number where the error occurred.
	 * @param message The error message.
	 */
	public void lexical(int line, int column, String message)
	{
		add(lexicalErrors, new CompilationError(ErrorKind.LEXICAL, message, line, column));
	}

	/**
	 * Reports a grammar violation. Pass null for both positions when the input ended unexpectedly.
	 */
	public void syntactic(Integer line, Integer column, String message)
	{
		add(syntacticErrors, new CompilationError(ErrorKind.SYNTACTIC, message, line, column));
	}

	/**
	 * Reports a static or runtime semantic error. Runtime errors with no source token pass null positions.
	 */
	public void semantic(Integer line, Integer column, String message)
	{
		add(semanticErrors, new CompilationError(ErrorKind.SEMANTIC, message, line, column));
	}

	private void add(List<CompilationError> target, CompilationError error)
	{
		target.add(error);
		Debug.log("%s", error);
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return !lexicalErrors.isEmpty() || !syntacticErrors.isEmpty() || !semanticErrors.isEmpty();
	}

	public List<CompilationError> getLexicalErrors()
	{
		return Collections.unmodifiableList(lexicalErrors);
	}

	public List<CompilationError> getSyntacticErrors()
	{
		return Collections.unmodifiableList(syntacticErrors);
	}

	public List<CompilationError> getSemanticErrors()
	{
		return Collections.unmodifiableList(semanticErrors);
	}

	/**
	 * @return Lexical, then syntactic, then semantic errors, each in report order.
	 */
	public List<CompilationError> getErrors()
	{
		List<CompilationError> all = new ArrayList<>(lexicalErrors.size() + syntacticErrors.size() + semanticErrors.size());
		all.addAll(lexicalErrors);
		all.addAll(syntacticErrors);
		all.addAll(semanticErrors);
		return all;
	}
}
