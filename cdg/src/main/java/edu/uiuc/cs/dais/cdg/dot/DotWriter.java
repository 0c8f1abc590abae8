package edu.uiuc.cs.dais.cdg.dot;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import com.ibm.wala.util.WalaException;
import com.ibm.wala.util.viz.NodeDecorator;

import edu.uiuc.cs.dais.cdg.ControlDependenceEdge;
import edu.uiuc.cs.dais.cdg.ControlDependenceGraph;
import edu.uiuc.cs.dais.cdg.ControlDependenceNode;

/**
 * Renders a control dependence graph in the Graphviz dot language. Region nodes are labeled REGION, the root ENTRY
 * and block nodes by the block decorator. True and false edges are labeled T and F.
 */
public class DotWriter<T> {

	public static final String GRAPH_NAME = "Control dependence graph";

	private final ControlDependenceGraph<T> cdg;
	private final NodeDecorator<T> blockLabels;

	public DotWriter(ControlDependenceGraph<T> cdg, NodeDecorator<T> blockLabels) {
		this.cdg = cdg;
		this.blockLabels = blockLabels;
	}

	/**
	 * Labels blocks with their string value.
	 */
	public DotWriter(ControlDependenceGraph<T> cdg) {
		this(cdg, new NodeDecorator<T>() {
			@Override
			public String getLabel(T block) {
				return String.valueOf(block);
			}
		});
	}

	public String getNodeLabel(ControlDependenceNode<T> node) throws WalaException {
		if (node.isRegion())
			return "REGION";
		if (node.isRoot())
			return "ENTRY";
		String label = blockLabels.getLabel(node.getBlock());
		return label == null || label.isEmpty() ? "ENTRY" : label;
	}

	public String toDot() throws WalaException {
		StringBuilder sb = new StringBuilder();
		sb.append("digraph \"").append(GRAPH_NAME).append("\" {\n");
		sb.append("  label=\"").append(GRAPH_NAME).append("\";\n");
		for (ControlDependenceNode<T> node : cdg) {
			sb.append("  n").append(node.getNumber()).append(" [label=\"").append(escape(getNodeLabel(node)))
					.append("\"");
			if (node.isRegion())
				sb.append(",shape=box");
			sb.append("];\n");
		}
		for (ControlDependenceNode<T> node : cdg) {
			for (ControlDependenceEdge<T> edge : cdg.getEdgeManager().getOutEdges(node)) {
				sb.append("  n").append(edge.getSource().getNumber()).append(" -> n")
						.append(edge.getSink().getNumber());
				String label = edge.getType().getLabel();
				if (!label.isEmpty())
					sb.append(" [label=\"").append(label).append("\"]");
				sb.append(";\n");
			}
		}
		sb.append("}\n");
		return sb.toString();
	}

	public void write(Writer out) throws IOException, WalaException {
		out.write(toDot());
		out.flush();
	}

	public void write(File file) throws IOException, WalaException {
		try (Writer out = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
			write(out);
		}
	}

	static String escape(String label) {
		return label.replace("\\", "\\\\").replace("\"", "\\\"");
	}

}
