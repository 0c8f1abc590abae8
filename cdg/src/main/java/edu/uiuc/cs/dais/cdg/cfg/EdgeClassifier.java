package edu.uiuc.cs.dais.cdg.cfg;

import edu.uiuc.cs.dais.cdg.EdgeType;

/**
 * Labels control flow edges. Must be total: every edge of the graph gets a label.
 *
 * @param <T>
 *            basic block type
 */
public interface EdgeClassifier<T> {

	/**
	 * @return {@link EdgeType#TRUE} or {@link EdgeType#FALSE} for the two arms of a two-way conditional branch,
	 *         {@link EdgeType#OTHER} for every other edge
	 */
	EdgeType classify(T source, T target);
}
