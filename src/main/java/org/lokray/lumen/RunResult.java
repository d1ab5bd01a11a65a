package org.lokray.lumen;

import org.lokray.lumen.ast.Program;
import org.lokray.lumen.interpreter.Value;
import org.lokray.lumen.semantics.SymbolTable;
import org.lokray.lumen.util.CompilationError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one {@link Lumen#run(String)} call produced.
 */
public class RunResult
{
	private final Program program;
	private final List<CompilationError> errors;
	private final Map<String, Value> evaluatedValues;
	private final SymbolTable symbolTable;

	public RunResult(Program program, List<CompilationError> errors, Map<String, Value> evaluatedValues, SymbolTable symbolTable)
	{
		this.program = program;
		this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
		this.evaluatedValues = Collections.unmodifiableMap(new LinkedHashMap<>(evaluatedValues));
		this.symbolTable = symbolTable;
	}

	/**
	 * @return The parsed program. Never null; statements that failed to parse are missing from it.
	 */
	public Program getProgram()
	{
		return program;
	}

	/**
	 * @return Lexical, then syntactic, then semantic errors (runtime errors included).
	 */
	public List<CompilationError> getErrors()
	{
		return errors;
	}

	/**
	 * @return The final value of every variable that got one, in first-seen order. Empty when evaluation was skipped.
	 */
	public Map<String, Value> getEvaluatedValues()
	{
		return evaluatedValues;
	}

	/**
	 * Convenience lookup for a variable's final value.
	 *
	 * @return The value, or null if the variable has none.
	 */
	public Value getValue(String name)
	{
		return evaluatedValues.get(name);
	}

	public SymbolTable getSymbolTable()
	{
		return symbolTable;
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}
}
