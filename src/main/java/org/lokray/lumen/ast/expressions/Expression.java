package org.lokray.lumen.ast.expressions;

import org.lokray.lumen.ast.ASTNode;
import org.lokray.lumen.semantics.Type;

/**
 * Base interface for all expression nodes.
 * The type of an expression is inferred when the parser builds the node and never changes afterwards.
 */
public interface Expression extends ASTNode
{
	/**
	 * @return The static type inferred for this expression.
	 */
	Type getResolvedType();
}
