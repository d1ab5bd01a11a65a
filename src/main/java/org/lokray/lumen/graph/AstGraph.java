package org.lokray.lumen.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A drawable tree of a program: one node per AST node (plus grouping nodes) and one edge per parent-child link.
 * Node ids are assigned in depth-first order starting at "0", which is always the root.
 */
public class AstGraph
{
	private final List<Node> nodes = new ArrayList<>();
	private final List<Edge> edges = new ArrayList<>();

	/**
	 * A graph node. {@code shape}, {@code style} and {@code fillColor} are Graphviz attribute values, or null for the default.
	 */
	public record Node(String id, String label, String shape, String style, String fillColor)
	{
	}

	public record Edge(String from, String to)
	{
	}

	Node addNode(String label, String shape, String style, String fillColor)
	{
		Node node = new Node(String.valueOf(nodes.size()), label, shape, style, fillColor);
		nodes.add(node);
		return node;
	}

	void addEdge(String from, String to)
	{
		edges.add(new Edge(from, to));
	}

	public List<Node> getNodes()
	{
		return Collections.unmodifiableList(nodes);
	}

	public List<Edge> getEdges()
	{
		return Collections.unmodifiableList(edges);
	}

	public Node getRoot()
	{
		return nodes.get(0);
	}

	public Node getNode(String id)
	{
		return nodes.get(Integer.parseInt(id));
	}

	/**
	 * @return The children of {@code id}, in insertion order.
	 */
	public List<Node> getChildren(String id)
	{
		List<Node> children = new ArrayList<>();
		for (Edge edge : edges)
		{
			if (edge.from().equals(id))
			{
				children.add(getNode(edge.to()));
			}
		}
		return children;
	}
}
