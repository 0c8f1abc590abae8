package edu.uiuc.cs.dais.cdg.cfg;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import com.ibm.wala.util.graph.Graph;
import com.ibm.wala.util.graph.dominators.Dominators;
import com.ibm.wala.util.graph.impl.GraphInverter;
import com.ibm.wala.util.graph.traverse.DFS;

/**
 * Post-dominator tree computed as the dominator tree of the inverted control flow graph.
 */
public class WalaPostDominatorTree<T> implements PostDominatorTree<T> {

	private final T exit;
	private final Dominators<T> postDominators;
	private final Set<T> blocks;

	WalaPostDominatorTree(T exit, Dominators<T> postDominators, Set<T> blocks) {
		this.exit = exit;
		this.postDominators = postDominators;
		this.blocks = blocks;
	}

	public static <T> WalaPostDominatorTree<T> make(Graph<T> cfg, T exit) {
		if (exit == null || !cfg.containsNode(exit))
			throw new IllegalArgumentException("Exit block " + exit + " is not in the control flow graph");
		Graph<T> inverted = GraphInverter.invert(cfg);
		Dominators<T> pDoms = Dominators.make(inverted, exit);
		// blocks that cannot reach the exit have no post-dominator
		Set<T> blocks = DFS.getReachableNodes(inverted, Collections.singleton(exit));
		return new WalaPostDominatorTree<>(exit, pDoms, blocks);
	}

	@Override
	public T getRoot() {
		return exit;
	}

	@Override
	public boolean contains(T block) {
		return blocks.contains(block);
	}

	@Override
	public boolean postDominates(T x, T y) {
		check(x);
		check(y);
		return postDominators.isDominatedBy(y, x);
	}

	@Override
	public T getImmediatePostDominator(T block) {
		check(block);
		if (block.equals(exit))
			return null;
		return postDominators.getIdom(block);
	}

	@Override
	public T getNearestCommonAncestor(T x, T y) {
		Set<T> ancestors = new HashSet<>();
		for (T cur = x; cur != null; cur = getImmediatePostDominator(cur))
			ancestors.add(cur);
		for (T cur = y; cur != null; cur = getImmediatePostDominator(cur))
			if (ancestors.contains(cur))
				return cur;
		// both chains end at the exit
		throw new IllegalStateException("No common post-dominator of " + x + " and " + y);
	}

	private void check(T block) {
		if (!contains(block))
			throw new IllegalArgumentException("Block " + block + " is not in the post-dominator tree rooted at "
					+ exit);
	}

}
