package org.lokray.lumen.ast.expressions;

import org.lokray.lumen.ast.ASTVisitor;
import org.lokray.lumen.lexer.Token;
import org.lokray.lumen.semantics.ErrorType;
import org.lokray.lumen.semantics.Type;

import java.util.List;

/**
 * Marks an operation whose operands failed type checking.
 * It keeps the operator and operands for display, but is never evaluated.
 */
public class ErrorExpression implements Expression
{
	private final Token operator;
	private final List<Expression> operands;
	private final String reason;

	public ErrorExpression(Token operator, List<Expression> operands, String reason)
	{
		this.operator = operator;
		this.operands = List.copyOf(operands);
		this.reason = reason;
	}

	public Token getOperator()
	{
		return operator;
	}

	public List<Expression> getOperands()
	{
		return operands;
	}

	@Override
	public Type getResolvedType()
	{
		return ErrorType.INSTANCE;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitErrorExpression(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("<error ").append(operator.getLexeme());
		for (Expression operand : operands)
		{
			sb.append(" ").append(operand);
		}
		return sb.append(": ").append(reason).append(">").toString();
	}
}
