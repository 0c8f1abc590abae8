package edu.uiuc.cs.dais.cdg;

import java.util.List;

import com.ibm.wala.util.graph.EdgeManager;

/**
 * An {@link EdgeManager} that also hands out the labeled edges behind the successor relation.
 */
public interface LabeledEdgeManager<T, E> extends EdgeManager<T> {
	List<E> getEdges();

	List<E> getInEdges(T node);

	List<E> getOutEdges(T node);
}
