package edu.uiuc.cs.dais.cdg.cfg;

/**
 * Post-dominator tree of a procedure, rooted at its (possibly virtual) exit. A block X post-dominates Y if every path
 * from Y to the exit passes through X; every block post-dominates itself.
 *
 * @param <T>
 *            basic block type
 */
public interface PostDominatorTree<T> {

	T getRoot();

	/**
	 * @return whether the block is a node of the tree, i.e. the exit is reachable from it
	 */
	boolean contains(T block);

	boolean postDominates(T x, T y);

	/**
	 * @return the parent of the block in the tree, or null for the root
	 */
	T getImmediatePostDominator(T block);

	/**
	 * @return the lowest block that post-dominates both blocks
	 */
	T getNearestCommonAncestor(T x, T y);
}
