package org.lokray.lumen;

import org.lokray.lumen.interpreter.Value;
import org.lokray.lumen.semantics.VariableSymbol;
import org.lokray.lumen.util.CompilationError;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point for the Lumen interpreter.
 * Runs one source file and prints its errors, its symbol table and the final variable values.
 */
public class Main
{
	private static final String USAGE = "Usage: lumen [--dot <file.dot>] <source-file>";

	public static void main(String[] args)
	{
		// 1. Argument parsing for flags
		Path dotFile = null;
		List<String> mainArgs = new ArrayList<>();
		for (int i = 0; i < args.length; i++)
		{
			if (args[i].equals("--dot"))
			{
				if (i + 1 >= args.length)
				{
					System.err.println(USAGE);
					System.exit(2);
				}
				dotFile = Paths.get(args[++i]);
			}
			else
			{
				mainArgs.add(args[i]);
			}
		}

		if (mainArgs.size() != 1)
		{
			System.err.println(USAGE);
			System.exit(2);
		}

		Path inputPath = Paths.get(mainArgs.get(0));
		if (!Files.exists(inputPath))
		{
			System.err.println("Error: Input file not found: " + inputPath);
			System.exit(2);
		}

		// 2. Run
		String sourceCode;
		try
		{
			sourceCode = Files.readString(inputPath, StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			System.err.println("An I/O error occurred while reading " + inputPath + ": " + e.getMessage());
			System.exit(1);
			return;
		}

		Lumen lumen = new Lumen();
		RunResult result = lumen.run(sourceCode);

		// 3. Report
		for (CompilationError error : result.getErrors())
		{
			System.err.println(error);
		}

		System.out.println("--- Symbol Table ---");
		Map<String, Value> values = result.getEvaluatedValues();
		for (VariableSymbol symbol : result.getSymbolTable().getSymbols().values())
		{
			Value value = values.get(symbol.getName());
			System.out.println(symbol.getName() + " : " + symbol.getType().getName() + " = " + (value != null ? value : "-"));
		}

		if (dotFile != null)
		{
			try
			{
				Files.writeString(dotFile, lumen.exportDot(result.getProgram()), StandardCharsets.UTF_8);
				System.out.println("AST graph written to " + dotFile);
			}
			catch (IOException e)
			{
				System.err.println("Error writing AST graph: " + e.getMessage());
				System.exit(1);
			}
		}

		System.exit(result.hasErrors() ? 1 : 0);
	}
}
