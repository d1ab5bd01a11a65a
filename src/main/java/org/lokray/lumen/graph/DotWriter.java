package org.lokray.lumen.graph;

/**
 * Renders an {@link AstGraph} as Graphviz DOT text, drawn top to bottom.
 */
public class DotWriter
{
	public String write(AstGraph graph)
	{
		StringBuilder sb = new StringBuilder();
		sb.append("// Abstract Syntax Tree\n");
		sb.append("digraph {\n");
		sb.append("\trankdir=TB\n");

		for (AstGraph.Node node : graph.getNodes())
		{
			sb.append("\t").append(node.id()).append(" [label=").append(quote(node.label()));
			appendAttribute(sb, "shape", node.shape());
			appendAttribute(sb, "style", node.style());
			appendAttribute(sb, "fillcolor", node.fillColor());
			sb.append("]\n");
		}
		for (AstGraph.Edge edge : graph.getEdges())
		{
			sb.append("\t").append(edge.from()).append(" -> ").append(edge.to()).append("\n");
		}

		sb.append("}\n");
		return sb.toString();
	}

	private static void appendAttribute(StringBuilder sb, String name, String value)
	{
		if (value != null)
		{
			sb.append(" ").append(name).append("=").append(value);
		}
	}

	private static String quote(String text)
	{
		return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}
}
