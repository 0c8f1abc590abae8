package edu.uiuc.cs.dais.cdg;

/**
 * A labeled parent-child link of a {@link ControlDependenceGraph}.
 */
public class ControlDependenceEdge<T> {

	final ControlDependenceNode<T> source;
	final ControlDependenceNode<T> sink;
	final EdgeType type;

	public ControlDependenceEdge(ControlDependenceNode<T> source, ControlDependenceNode<T> sink, EdgeType type) {
		this.source = source;
		this.sink = sink;
		this.type = type;
	}

	public ControlDependenceNode<T> getSource() {
		return source;
	}

	public ControlDependenceNode<T> getSink() {
		return sink;
	}

	public EdgeType getType() {
		return type;
	}

	@Override
	public int hashCode() {
		return 31 * (31 * source.hashCode() + sink.hashCode()) + type.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ControlDependenceEdge))
			return false;
		ControlDependenceEdge<?> other = (ControlDependenceEdge<?>) obj;
		return source == other.source && sink == other.sink && type == other.type;
	}

	@Override
	public String toString() {
		return getSource() + "-" + getType().getLabel() + ">" + getSink();
	}
}
