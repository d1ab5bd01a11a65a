package org.lokray.lumen.ast;

import org.lokray.lumen.ast.expressions.BinaryExpression;
import org.lokray.lumen.ast.expressions.ErrorExpression;
import org.lokray.lumen.ast.expressions.IdentifierExpression;
import org.lokray.lumen.ast.expressions.LiteralExpression;
import org.lokray.lumen.ast.expressions.UnaryExpression;
import org.lokray.lumen.ast.statements.AssignmentStatement;
import org.lokray.lumen.ast.statements.ExpressionStatement;
import org.lokray.lumen.ast.statements.IfStatement;
import org.lokray.lumen.ast.statements.WhileStatement;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * Each {@code visit} method corresponds to one node type; the set of node types is closed.
 *
 * @param <R> The result of visiting a node (a runtime value for the interpreter, a graph node id for the exporter).
 */
public interface ASTVisitor<R>
{
	R visitProgram(Program program);

	// --- Statements ---
	R visitAssignmentStatement(AssignmentStatement statement);

	R visitExpressionStatement(ExpressionStatement statement);

	R visitIfStatement(IfStatement statement);

	R visitWhileStatement(WhileStatement statement);

	// --- Expressions ---
	R visitLiteralExpression(LiteralExpression expression);

	R visitIdentifierExpression(IdentifierExpression expression);

	R visitBinaryExpression(BinaryExpression expression);

	R visitUnaryExpression(UnaryExpression expression);

	R visitErrorExpression(ErrorExpression expression);
}
