package org.lokray.lumen.graph;

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
import org.lokray.lumen.lexer.TokenType;

import java.util.List;

/**
 * Traverses the AST and builds its {@link AstGraph}.
 * Each visit adds the node for the visited AST node, links its children to it, and returns the new node's id.
 * <p>
 * Statement lists are drawn as direct children of {@code Program}, {@code if} and {@code while}.
 * The two branches of an {@code if_else} each get a dashed {@code Statements} node so they stay apart.
 */
public class AstGraphBuilder implements ASTVisitor<String>
{
	private AstGraph graph;

	public AstGraph build(Program program)
	{
		graph = new AstGraph();
		program.accept(this);
		return graph;
	}

	@Override
	public String visitProgram(Program program)
	{
		String id = graph.addNode("Program", "box", "filled", "lightblue").id();
		addStatements(id, program.getStatements());
		return id;
	}

	@Override
	public String visitAssignmentStatement(AssignmentStatement statement)
	{
		String id = node("assign");
		String target = node("id(" + statement.getNameLexeme() + ")");
		graph.addEdge(id, target);
		addChild(id, statement.getValue());
		return id;
	}

	@Override
	public String visitExpressionStatement(ExpressionStatement statement)
	{
		return statement.getExpression().accept(this);
	}

	@Override
	public String visitIfStatement(IfStatement statement)
	{
		if (!statement.hasElse())
		{
			String id = node("if");
			addChild(id, statement.getCondition());
			addStatements(id, statement.getThenBlock());
			return id;
		}

		String id = node("if_else");
		addChild(id, statement.getCondition());
		addGroup(id, statement.getThenBlock());
		addGroup(id, statement.getElseBlock());
		return id;
	}

	@Override
	public String visitWhileStatement(WhileStatement statement)
	{
		String id = node("while");
		addChild(id, statement.getCondition());
		addStatements(id, statement.getBody());
		return id;
	}

	@Override
	public String visitLiteralExpression(LiteralExpression expression)
	{
		String kind = expression.isNumber() ? "number" : "boolean";
		return node(kind + "(" + expression.getValue() + ")");
	}

	@Override
	public String visitIdentifierExpression(IdentifierExpression expression)
	{
		return node("id(" + expression.getNameLexeme() + ")");
	}

	@Override
	public String visitBinaryExpression(BinaryExpression expression)
	{
		TokenType type = expression.getOperator().getType();
		String label = (type == TokenType.AND || type == TokenType.OR) ? type.name() : expression.getOperator().getLexeme();
		String id = node(label);
		addChild(id, expression.getLeft());
		addChild(id, expression.getRight());
		return id;
	}

	@Override
	public String visitUnaryExpression(UnaryExpression expression)
	{
		String id = node(expression.isNegation() ? "uminus" : "NOT");
		addChild(id, expression.getRight());
		return id;
	}

	@Override
	public String visitErrorExpression(ErrorExpression expression)
	{
		String id = node("error");
		for (Expression operand : expression.getOperands())
		{
			addChild(id, operand);
		}
		return id;
	}

	private String node(String label)
	{
		return graph.addNode(label, null, null, null).id();
	}

	private void addChild(String parentId, Expression child)
	{
		graph.addEdge(parentId, child.accept(this));
	}

	private void addStatements(String parentId, List<Statement> statements)
	{
		for (Statement statement : statements)
		{
			graph.addEdge(parentId, statement.accept(this));
		}
	}

	private void addGroup(String parentId, List<Statement> statements)
	{
		String groupId = graph.addNode("Statements", "box", "dashed", null).id();
		graph.addEdge(parentId, groupId);
		addStatements(groupId, statements);
	}
}
