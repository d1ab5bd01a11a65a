package org.lokray.lumen;

import org.lokray.lumen.ast.Program;
import org.lokray.lumen.graph.AstGraph;
import org.lokray.lumen.graph.AstGraphBuilder;
import org.lokray.lumen.graph.DotWriter;
import org.lokray.lumen.interpreter.Interpreter;
import org.lokray.lumen.interpreter.Value;
import org.lokray.lumen.lexer.Lexer;
import org.lokray.lumen.lexer.Token;
import org.lokray.lumen.parser.LumenParser;
import org.lokray.lumen.semantics.SymbolTable;
import org.lokray.lumen.semantics.TypeChecker;
import org.lokray.lumen.util.Debug;
import org.lokray.lumen.util.ErrorReporter;
import org.lokray.lumen.util.InterpreterConfig;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Compiles and runs Lumen programs.
 * <p>
 * Each {@link #run(String)} call creates its own error reporter, symbol table and environment,
 * so one instance can serve concurrent callers.
 */
public class Lumen
{
	private static final String TOO_DEEP = "expresión demasiado anidada.";

	private final InterpreterConfig config;

	public Lumen()
	{
		this(InterpreterConfig.load());
	}

	public Lumen(InterpreterConfig config)
	{
		this.config = config;
		Debug.setEnabled(config.isDebug());
	}

	/**
	 * Lexes, parses and type checks {@code source}, then runs it if no error was found.
	 * Runtime errors are added to the error list; the values computed before them are still returned.
	 */
	public RunResult run(String source)
	{
		ErrorReporter errorReporter = new ErrorReporter();
		SymbolTable symbolTable = new SymbolTable();

		Debug.log("--- Lexical Analysis Phase ---");
		Lexer lexer = new Lexer(source, errorReporter);
		List<Token> tokens = lexer.scanTokens();

		Debug.log("--- Parsing Phase ---");
		TypeChecker typeChecker = new TypeChecker(symbolTable, errorReporter, config);
		LumenParser parser = new LumenParser(tokens, errorReporter, typeChecker);
		Program program;
		try
		{
			program = parser.parse();
		}
		catch (StackOverflowError e)
		{
			errorReporter.syntactic(null, null, "Error sintáctico: " + TOO_DEEP);
			program = Program.empty();
		}

		if (errorReporter.hasErrors())
		{
			Debug.log("Execution skipped: %d errors before execution.", errorReporter.getErrors().size());
			return new RunResult(program, errorReporter.getErrors(), Collections.emptyMap(), symbolTable);
		}

		Debug.log("--- Execution Phase ---");
		Interpreter interpreter = new Interpreter(symbolTable, errorReporter, config);
		Map<String, Value> evaluated;
		try
		{
			interpreter.execute(program);
			evaluated = interpreter.getEvaluatedValues();
		}
		catch (RuntimeException e)
		{
			errorReporter.semantic(null, null, "Error interno durante la ejecución: " + e.getMessage());
			evaluated = Collections.emptyMap();
		}
		catch (StackOverflowError e)
		{
			errorReporter.semantic(null, null, "Error interno durante la ejecución: " + TOO_DEEP);
			evaluated = Collections.emptyMap();
		}
		return new RunResult(program, errorReporter.getErrors(), evaluated, symbolTable);
	}

	public AstGraph exportGraph(Program program)
	{
		return new AstGraphBuilder().build(program);
	}

	/**
	 * @return The program's tree as Graphviz DOT text.
	 */
	public String exportDot(Program program)
	{
		return new DotWriter().write(exportGraph(program));
	}
}
