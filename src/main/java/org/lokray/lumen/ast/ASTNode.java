package org.lokray.lumen.ast;

/**
 * Base interface for all nodes in the Abstract Syntax Tree (AST).
 * Nodes are immutable once the parser has built them.
 */
public interface ASTNode
{
	/**
	 * Accepts an ASTVisitor to traverse this node.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ASTVisitor<R> visitor);
}
