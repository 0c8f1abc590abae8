package edu.uiuc.cs.dais.cdg;

import java.util.Collections;
import java.util.Iterator;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.ibm.wala.util.graph.Graph;
import com.ibm.wala.util.graph.traverse.DFS;

import edu.uiuc.cs.dais.cdg.cfg.EdgeClassifier;
import edu.uiuc.cs.dais.cdg.cfg.PostDominatorTree;

/**
 * Computes the control dependences of a control flow graph as described by Ferrante, Ottenstein and Warren in
 * "The Program Dependence Graph and Its Use in Optimization".
 */
class DependenceBuilder<T> {

	private static final Logger LOGGER = Logger.getLogger(DependenceBuilder.class.getName());

	private final Graph<T> cfg;
	private final T entry;
	private final EdgeClassifier<T> classifier;
	private final PostDominatorTree<T> pDoms;

	DependenceBuilder(Graph<T> cfg, T entry, EdgeClassifier<T> classifier, PostDominatorTree<T> pDoms) {
		this.cfg = cfg;
		this.entry = entry;
		this.classifier = classifier;
		this.pDoms = pDoms;
	}

	void build(ControlDependenceGraph<T> cdg) {
		if (entry == null || !cfg.containsNode(entry))
			throw new IllegalArgumentException("Entry block " + entry + " is not in the control flow graph");

		// one node per reachable block, in graph order so that node numbers are reproducible
		Set<T> reachable = DFS.getReachableNodes(cfg, Collections.singleton(entry));
		for (T block : cfg) {
			if (!reachable.contains(block))
				continue;
			if (!pDoms.contains(block))
				throw new IllegalArgumentException("Block " + block
						+ " is missing from the post-dominator tree; does it reach the exit?");
			cdg.addBlockNode(block);
		}

		int links = 0;
		// the root acts as the entry predicate: everything on the entry's post-dominator chain depends on it
		links += markDependent(cdg.getRoot(), EdgeType.OTHER, entry, pDoms.getRoot(), cdg);

		for (T a : cfg) {
			if (!reachable.contains(a))
				continue;
			ControlDependenceNode<T> aNode = cdg.getNode(a);
			for (Iterator<T> succs = cfg.getSuccNodes(a); succs.hasNext();) {
				T b = succs.next();
				// post-domination is reflexive, so a block branching to itself never depends on itself
				if (pDoms.postDominates(b, a))
					continue;
				T l = pDoms.getNearestCommonAncestor(a, b);
				links += markDependent(aNode, classifier.classify(a, b), b, l, cdg);
			}
		}

		// blocks that execute on every path
		for (ControlDependenceNode<T> node : cdg.getNodeList())
			if (!node.isRoot() && node.getNumParents() == 0 && cdg.getRoot().addChild(EdgeType.OTHER, node))
				links++;

		if (LOGGER.isLoggable(Level.FINE))
			LOGGER.fine("Computed " + links + " control dependences between " + cdg.getNumberOfNodes() + " nodes ("
					+ (cfg.getNumberOfNodes() - reachable.size()) + " unreachable blocks skipped)");
	}

	/**
	 * Walks up the post-dominator tree from the given block and makes every block before the stop block a child of
	 * the controlling node.
	 */
	private int markDependent(ControlDependenceNode<T> controller, EdgeType type, T from, T stop,
			ControlDependenceGraph<T> cdg) {
		int links = 0;
		for (T cur = from; cur != null && !cur.equals(stop); cur = pDoms.getImmediatePostDominator(cur)) {
			ControlDependenceNode<T> node = cdg.getNode(cur);
			if (node == null)
				throw new IllegalStateException("Post-dominator " + cur + " of reachable block " + from
						+ " is not reachable from the entry");
			if (controller.addChild(type, node))
				links++;
		}
		return links;
	}

}
