package org.lokray.lumen.semantics;

import org.lokray.lumen.ast.expressions.BinaryExpression;
import org.lokray.lumen.ast.expressions.ErrorExpression;
import org.lokray.lumen.ast.expressions.Expression;
import org.lokray.lumen.ast.expressions.IdentifierExpression;
import org.lokray.lumen.ast.expressions.UnaryExpression;
import org.lokray.lumen.ast.statements.AssignmentStatement;
import org.lokray.lumen.lexer.Token;
import org.lokray.lumen.lexer.TokenType;
import org.lokray.lumen.util.Debug;
import org.lokray.lumen.util.ErrorReporter;
import org.lokray.lumen.util.InterpreterConfig;

import java.util.List;

/**
 * Infers and checks types while the parser builds the tree.
 * The parser calls one method per grammar action; each method returns the node to put in the tree,
 * typed from the symbol table as it stands at that point of the program.
 * <p>
 * Rules:
 * <ul>
 *     <li>an operand whose type is unresolved (an undeclared variable) suppresses further checks;</li>
 *     <li>an operand that already failed a check turns the enclosing operation into an {@link ErrorExpression}
 *     without reporting again, so one mistake produces one error;</li>
 *     <li>any other mismatch is reported at the operator and produces an {@link ErrorExpression}.</li>
 * </ul>
 */
public class TypeChecker
{
	private static final String OPERAND_ERROR = "Operando con error de tipo";

	private final SymbolTable symbolTable;
	private final ErrorReporter errorReporter;
	private final boolean reportEachUndeclaredUse;

	public TypeChecker(SymbolTable symbolTable, ErrorReporter errorReporter, InterpreterConfig config)
	{
		this.symbolTable = symbolTable;
		this.errorReporter = errorReporter;
		this.reportEachUndeclaredUse = config.isReportEachUndeclaredUse();
	}

	/**
	 * Types a variable read. A name with no symbol is reported and gets a placeholder of type {@code unknown_error};
	 * later reads of the same name are reported again only when {@code semantic.report_each_undeclared_use} is set.
	 */
	public Expression identifier(Token name)
	{
		VariableSymbol symbol = symbolTable.resolve(name.getLexeme());
		if (symbol == null)
		{
			error(name, "Variable '" + name.getLexeme() + "' no declarada.");
			symbol = symbolTable.defineUndeclared(name);
		}
		else if (reportEachUndeclaredUse && symbol.isUndeclared())
		{
			error(name, "Variable '" + name.getLexeme() + "' no declarada.");
		}
		return new IdentifierExpression(name, symbol.getType());
	}

	/**
	 * Types {@code left op right} for the arithmetic, comparison and logical operators.
	 */
	public Expression binary(Expression left, Token operator, Expression right)
	{
		Type leftType = left.getResolvedType();
		Type rightType = right.getResolvedType();

		if (leftType.isError() || rightType.isError())
		{
			return new ErrorExpression(operator, List.of(left, right), OPERAND_ERROR);
		}

		switch (operator.getType())
		{
			case PLUS:
			case MINUS:
			case STAR:
			case SLASH:
				if (leftType.isUnresolved() || rightType.isUnresolved())
				{
					return new BinaryExpression(left, operator, right, UnknownType.UNKNOWN);
				}
				if (leftType.isNumeric() && rightType.isNumeric())
				{
					return new BinaryExpression(left, operator, right, PrimitiveType.FLOAT);
				}
				return mismatch(left, operator, right, "Operación", "Tipo incompatible");

			case LESS:
			case LESS_EQUAL:
			case GREATER:
			case GREATER_EQUAL:
			case EQUAL_EQUAL:
			case BANG_EQUAL:
				if (leftType.isUnresolved() || rightType.isUnresolved() || isComparable(operator, leftType, rightType))
				{
					return new BinaryExpression(left, operator, right, PrimitiveType.BOOLEAN);
				}
				return mismatch(left, operator, right, "Comparación", "Tipo incompatible en comparación");

			case AND:
			case OR:
				if (leftType.isUnresolved() || rightType.isUnresolved() || (leftType.isBoolean() && rightType.isBoolean()))
				{
					return new BinaryExpression(left, operator, right, PrimitiveType.BOOLEAN);
				}
				return mismatch(left, operator, right, "Operación lógica", "Tipo incompatible en operación lógica");

			default:
				throw new IllegalArgumentException("Not a binary operator: " + operator);
		}
	}

	/**
	 * Numbers compare with every comparison operator; booleans only with {@code ==} and {@code !=}.
	 */
	private boolean isComparable(Token operator, Type leftType, Type rightType)
	{
		if (leftType.isNumeric() && rightType.isNumeric())
		{
			return true;
		}
		boolean equality = operator.is(TokenType.EQUAL_EQUAL) || operator.is(TokenType.BANG_EQUAL);
		return equality && leftType.isBoolean() && rightType.isBoolean();
	}

	private Expression mismatch(Expression left, Token operator, Expression right, String operation, String reason)
	{
		error(operator, "Error de tipo: " + operation + " '" + operatorName(operator) + "' no definida para '"
				+ left.getResolvedType().getName() + "' y '" + right.getResolvedType().getName() + "'.");
		return new ErrorExpression(operator, List.of(left, right), reason);
	}

	/**
	 * Types {@code NOT operand}.
	 */
	public Expression not(Token operator, Expression operand)
	{
		Type type = operand.getResolvedType();
		if (type.isError())
		{
			return new ErrorExpression(operator, List.of(operand), OPERAND_ERROR);
		}
		if (!type.isBoolean() && !type.isUnresolved())
		{
			error(operator, "Error de tipo: Operador 'NOT' solo aplica a booleanos, se encontró '" + type.getName() + "'.");
			return new ErrorExpression(operator, List.of(operand), "Tipo incompatible para NOT");
		}
		return new UnaryExpression(operator, operand, PrimitiveType.BOOLEAN);
	}

	/**
	 * Types {@code -operand}. The operand's type passes through unchanged; a non-numeric operand is caught at runtime.
	 */
	public Expression negate(Token operator, Expression operand)
	{
		Type type = operand.getResolvedType();
		if (type.isError())
		{
			return new ErrorExpression(operator, List.of(operand), OPERAND_ERROR);
		}
		return new UnaryExpression(operator, operand, type);
	}

	/**
	 * Records {@code name = value}: the value's type becomes the variable's type and the value its defining expression.
	 */
	public AssignmentStatement assignment(Token name, Expression value)
	{
		VariableSymbol symbol = symbolTable.assign(name, value.getResolvedType(), value);
		Debug.log("Assigned '%s' : %s", symbol.getName(), symbol.getType().getName());
		return new AssignmentStatement(name, value);
	}

	/**
	 * Checks that an IF or WHILE condition is boolean. Unresolved conditions are tolerated,
	 * and a condition that already failed a check is not reported twice.
	 */
	public void condition(Token keyword, Expression condition)
	{
		Type type = condition.getResolvedType();
		if (type.isBoolean() || type.isUnresolved() || type.isError())
		{
			return;
		}
		error(keyword, "Error de tipo: La condición " + operatorName(keyword) + " debe ser booleana, se encontró '" + type.getName() + "'.");
	}

	/**
	 * Keywords are reported in their canonical upper-case spelling whatever case the source used.
	 */
	private static String operatorName(Token operator)
	{
		switch (operator.getType())
		{
			case AND:
			case OR:
			case NOT:
			case IF:
			case WHILE:
				return operator.getType().name();
			default:
				return operator.getLexeme();
		}
	}

	private void error(Token token, String message)
	{
		errorReporter.semantic(token.getLine(), token.getColumn(), message);
	}
}
