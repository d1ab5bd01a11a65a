package org.lokray.lumen.semantics;

import org.lokray.lumen.ast.expressions.Expression;
import org.lokray.lumen.lexer.Token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single, program-wide scope of a Lumen program: a map from variable name to its symbol,
 * kept in the order names were first seen.
 * A table belongs to one compile-and-run request; it is filled by the parser and read by the interpreter.
 */
public class SymbolTable
{
	private final Map<String, VariableSymbol> symbols = new LinkedHashMap<>();

	/**
	 * Records an assignment {@code name = expression}. Creates the symbol on the first assignment,
	 * otherwise replaces its type and defining expression.
	 *
	 * @return The symbol for {@code name}.
	 */
	public VariableSymbol assign(Token name, Type type, Expression definingExpression)
	{
		VariableSymbol symbol = symbols.get(name.getLexeme());
		if (symbol == null)
		{
			symbol = new VariableSymbol(name.getLexeme(), type, definingExpression);
			symbols.put(symbol.getName(), symbol);
		}
		else
		{
			symbol.redefine(type, definingExpression);
		}
		return symbol;
	}

	/**
	 * Inserts the placeholder for a variable that was read before being assigned.
	 * Its type is {@link UnknownType#UNDECLARED} and it has no defining expression.
	 */
	public VariableSymbol defineUndeclared(Token name)
	{
		VariableSymbol symbol = new VariableSymbol(name.getLexeme(), UnknownType.UNDECLARED, null);
		symbols.put(symbol.getName(), symbol);
		return symbol;
	}

	/**
	 * Looks up a symbol.
	 *
	 * @param name The name of the symbol to look up.
	 * @return The found symbol, or null if the name was never seen.
	 */
	public VariableSymbol resolve(String name)
	{
		return symbols.get(name);
	}

	public Map<String, VariableSymbol> getSymbols()
	{
		return Collections.unmodifiableMap(symbols);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("Scope 'Global':\n");
		for (VariableSymbol symbol : symbols.values())
		{
			sb.append("  ").append(symbol).append("\n");
		}
		return sb.toString();
	}
}
