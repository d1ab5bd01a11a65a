package org.lokray.lumen.interpreter;

import org.lokray.lumen.ast.ASTVisitor;
import org.lokray.lumen.ast.Program;
import org.lokray.lumen.ast.expressions.BinaryExpression;
import org.lokray.lumen.ast.expressions.ErrorExpression;
import org.lokray.lumen.ast.expressions.Expression;
import org.lokray.lumen.ast.expressions.IdentifierExpression;
import org.lokray.lumen.ast.expressions.LiteralExpression;
import org.lokray.lumen.ast.expressions.UnaryExpression;
import org.lokray.lumen.ast.statements.AssignmentStatement;
import org.lokray.lumen.ast.statements.ExpressionStatement;
import org.lokray.lumen.ast.statements.IfStatement;
import org.lokray.lumen.ast.statements.Statement;
import org.lokray.lumen.ast.statements.WhileStatement;
import org.lokray.lumen.lexer.Token;
import org.lokray.lumen.semantics.SymbolTable;
import org.lokray.lumen.semantics.VariableSymbol;
import org.lokray.lumen.util.Debug;
import org.lokray.lumen.util.ErrorReporter;
import org.lokray.lumen.util.InterpreterConfig;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Executes a type-checked program by walking its tree.
 * <p>
 * Every visit returns the node's {@link Value}, or null when the node produced nothing: a failed operation,
 * an IF whose condition was false, a loop that never ran. Null propagates upward; runtime errors are
 * reported to the ErrorReporter as semantic errors and never thrown.
 * <p>
 * Variable reads are bound once: the first read of a variable that no assignment has executed yet
 * evaluates the expression recorded for it in the symbol table and keeps the result.
 * Executing an assignment always overwrites the stored value.
 */
public class Interpreter implements ASTVisitor<Value>
{
	private final SymbolTable symbolTable;
	private final ErrorReporter errorReporter;
	private final long maxLoopIterations; // 0 = unlimited
	private final Environment environment = new Environment();
	private final Set<String> resolving = new HashSet<>(); // Variables whose defining expression is being evaluated

	public Interpreter(SymbolTable symbolTable, ErrorReporter errorReporter, InterpreterConfig config)
	{
		this.symbolTable = symbolTable;
		this.errorReporter = errorReporter;
		this.maxLoopIterations = config.getMaxLoopIterations();
	}

	/**
	 * Runs every statement of the program in order.
	 *
	 * @return The result of the last executed statement, or null.
	 */
	public Value execute(Program program)
	{
		Debug.log("Executing program (%d statements).", program.getStatements().size());
		Debug.indent();
		try
		{
			return program.accept(this);
		}
		finally
		{
			Debug.dedent();
		}
	}

	/**
	 * @return Every variable that ended the run with a value, in the order the symbol table first saw them.
	 */
	public Map<String, Value> getEvaluatedValues()
	{
		Map<String, Value> results = new LinkedHashMap<>();
		for (String name : symbolTable.getSymbols().keySet())
		{
			Value value = environment.get(name);
			if (value != null)
			{
				results.put(name, value);
			}
		}
		return results;
	}

	// --- Statements ---

	@Override
	public Value visitProgram(Program program)
	{
		Value last = null;
		for (Statement statement : program.getStatements())
		{
			if (statement.isErroneous())
			{
				continue;
			}
			last = statement.accept(this);
		}
		return last;
	}

	/**
	 * Runs a block. Statements that failed type checking are skipped;
	 * any other statement that produces nothing, except an assignment, aborts the block.
	 */
	private BlockOutcome executeBlock(List<Statement> statements)
	{
		Value last = null;
		for (Statement statement : statements)
		{
			if (statement.isErroneous())
			{
				continue;
			}
			Value result = statement.accept(this);
			if (result == null && !(statement instanceof AssignmentStatement))
			{
				return BlockOutcome.ABORTED;
			}
			last = result;
		}
		return new BlockOutcome(last, false);
	}

	/**
	 * Result of running a block: the last statement's value, and whether the block stopped early.
	 */
	private record BlockOutcome(Value value, boolean aborted)
	{
		static final BlockOutcome ABORTED = new BlockOutcome(null, true);
	}

	@Override
	public Value visitAssignmentStatement(AssignmentStatement statement)
	{
		Value value = evaluate(statement.getValue());
		if (value == null)
		{
			return null; // The variable keeps its previous value, if any
		}
		environment.define(statement.getNameLexeme(), value);
		Debug.log("%s = %s", statement.getNameLexeme(), value);
		return value;
	}

	@Override
	public Value visitExpressionStatement(ExpressionStatement statement)
	{
		return evaluate(statement.getExpression());
	}

	@Override
	public Value visitIfStatement(IfStatement statement)
	{
		Value condition = evaluate(statement.getCondition());
		if (condition == null)
		{
			return null;
		}
		if (!condition.isBool())
		{
			String construct = statement.hasElse() ? "IF/ELSE" : "IF";
			runtimeError(statement.getIfKeyword(), "Error de ejecución: La condición " + construct + " debe ser booleana.");
			return null;
		}

		if (condition.toBoolean())
		{
			return executeBlock(statement.getThenBlock()).value();
		}
		if (statement.hasElse())
		{
			return executeBlock(statement.getElseBlock()).value();
		}
		return null;
	}

	@Override
	public Value visitWhileStatement(WhileStatement statement)
	{
		Value last = null;
		long passes = 0;

		while (true)
		{
			Value condition = evaluate(statement.getCondition());
			if (condition == null)
			{
				return null;
			}
			if (!condition.isBool())
			{
				runtimeError(statement.getWhileKeyword(), "Error de ejecución: La condición WHILE debe ser booleana.");
				return null;
			}
			if (!condition.toBoolean())
			{
				break;
			}
			if (maxLoopIterations > 0 && passes >= maxLoopIterations)
			{
				runtimeError(statement.getWhileKeyword(),
						"Error de ejecución: el bucle WHILE superó el límite de " + maxLoopIterations + " iteraciones.");
				return null;
			}
			passes++;

			BlockOutcome outcome = executeBlock(statement.getBody());
			if (outcome.aborted())
			{
				return null;
			}
			last = outcome.value();
		}
		Debug.log("WHILE finished after %d passes.", passes);
		return last;
	}

	// --- Expressions ---

	private Value evaluate(Expression expression)
	{
		return expression.accept(this);
	}

	@Override
	public Value visitLiteralExpression(LiteralExpression expression)
	{
		return Value.fromLiteral(expression.getValue());
	}

	@Override
	public Value visitIdentifierExpression(IdentifierExpression expression)
	{
		String name = expression.getNameLexeme();
		Value cached = environment.get(name);
		if (cached != null)
		{
			return cached;
		}

		VariableSymbol symbol = symbolTable.resolve(name);
		if (symbol == null)
		{
			runtimeError(expression.getName(), "Variable '" + name + "' no definida durante la ejecución.");
			return null;
		}
		if (symbol.getDefiningExpression() == null)
		{
			return null;
		}
		if (!resolving.add(name))
		{
			runtimeError(expression.getName(), "Definición circular de la variable '" + name + "'.");
			return null;
		}

		try
		{
			Debug.log("Resolving '%s' from its definition.", name);
			Value value = evaluate(symbol.getDefiningExpression());
			if (value != null)
			{
				environment.define(name, value);
			}
			return value;
		}
		finally
		{
			resolving.remove(name);
		}
	}

	@Override
	public Value visitBinaryExpression(BinaryExpression expression)
	{
		Token operator = expression.getOperator();
		switch (operator.getType())
		{
			case AND:
				return and(expression);
			case OR:
				return or(expression);
			default:
				break;
		}

		Value left = evaluate(expression.getLeft());
		Value right = evaluate(expression.getRight());
		if (left == null || right == null)
		{
			return null;
		}

		switch (operator.getType())
		{
			case PLUS:
			case MINUS:
			case STAR:
			case SLASH:
				return arithmetic(operator, left, right);
			case EQUAL_EQUAL:
				return Value.of(sameValue(left, right));
			case BANG_EQUAL:
				return Value.of(!sameValue(left, right));
			case LESS:
			case LESS_EQUAL:
			case GREATER:
			case GREATER_EQUAL:
				return ordering(operator, left, right);
			default:
				throw new IllegalStateException("Unexpected binary operator: " + operator);
		}
	}

	private Value arithmetic(Token operator, Value left, Value right)
	{
		if (!left.isNumber() || !right.isNumber())
		{
			runtimeError(operator, "Error de ejecución: Operación '" + operator.getLexeme() + "' con tipos no numéricos.");
			return null;
		}

		double a = left.toDouble();
		double b = right.toDouble();
		switch (operator.getType())
		{
			case PLUS:
				return Value.of(a + b);
			case MINUS:
				return Value.of(a - b);
			case STAR:
				return Value.of(a * b);
			case SLASH:
				if (b == 0)
				{
					runtimeError(operator, "Error de ejecución: División por cero.");
					return Value.of(Double.POSITIVE_INFINITY);
				}
				return Value.of(a / b);
			default:
				throw new IllegalStateException("Unexpected arithmetic operator: " + operator);
		}
	}

	/**
	 * Numbers compare numerically and booleans by value; a number never equals a boolean.
	 */
	private static boolean sameValue(Value left, Value right)
	{
		if (left.isNumber() && right.isNumber())
		{
			return left.toDouble() == right.toDouble();
		}
		return left.equals(right);
	}

	private Value ordering(Token operator, Value left, Value right)
	{
		if (!left.isNumber() || !right.isNumber())
		{
			runtimeError(operator, "Error de ejecución: Comparación '" + operator.getLexeme() + "' con tipos no numéricos.");
			return null;
		}

		double a = left.toDouble();
		double b = right.toDouble();
		switch (operator.getType())
		{
			case LESS:
				return Value.of(a < b);
			case LESS_EQUAL:
				return Value.of(a <= b);
			case GREATER:
				return Value.of(a > b);
			case GREATER_EQUAL:
				return Value.of(a >= b);
			default:
				throw new IllegalStateException("Unexpected comparison operator: " + operator);
		}
	}

	/**
	 * Short-circuit AND: the right operand is evaluated only when the left one is TRUE.
	 */
	private Value and(BinaryExpression expression)
	{
		Value left = evaluate(expression.getLeft());
		if (left == null)
		{
			return null;
		}
		if (!left.isBool())
		{
			runtimeError(expression.getOperator(), "Error de ejecución: Operación 'AND' con operando izquierdo no booleano.");
			return Value.FALSE;
		}
		if (!left.toBoolean())
		{
			return Value.FALSE;
		}

		Value right = evaluate(expression.getRight());
		if (right == null)
		{
			return null;
		}
		if (!right.isBool())
		{
			runtimeError(expression.getOperator(), "Error de ejecución: Operación 'AND' con operando derecho no booleano.");
			return Value.FALSE;
		}
		return right;
	}

	/**
	 * Short-circuit OR: the right operand is evaluated only when the left one is FALSE.
	 */
	private Value or(BinaryExpression expression)
	{
		Value left = evaluate(expression.getLeft());
		if (left == null)
		{
			return null;
		}
		if (!left.isBool())
		{
			runtimeError(expression.getOperator(), "Error de ejecución: Operación 'OR' con operando izquierdo no booleano.");
			return Value.FALSE;
		}
		if (left.toBoolean())
		{
			return Value.TRUE;
		}

		Value right = evaluate(expression.getRight());
		if (right == null)
		{
			return null;
		}
		if (!right.isBool())
		{
			runtimeError(expression.getOperator(), "Error de ejecución: Operación 'OR' con operando derecho no booleano.");
			return Value.FALSE;
		}
		return right;
	}

	@Override
	public Value visitUnaryExpression(UnaryExpression expression)
	{
		Value operand = evaluate(expression.getRight());
		if (operand == null)
		{
			return null;
		}

		if (expression.isNegation())
		{
			if (!operand.isNumber())
			{
				runtimeError(expression.getOperator(), "Error de ejecución: Negación unaria con tipo no numérico.");
				return null;
			}
			return Value.of(-operand.toDouble());
		}

		if (!operand.isBool())
		{
			runtimeError(expression.getOperator(), "Error de ejecución: Operación 'NOT' con tipo no booleano.");
			return Value.FALSE;
		}
		return Value.of(!operand.toBoolean());
	}

	/**
	 * Operations that failed type checking are never run.
	 */
	@Override
	public Value visitErrorExpression(ErrorExpression expression)
	{
		return null;
	}

	private void runtimeError(Token token, String message)
	{
		errorReporter.semantic(token.getLine(), token.getColumn(), message);
	}
}
