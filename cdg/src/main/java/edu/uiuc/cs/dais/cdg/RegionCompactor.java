package edu.uiuc.cs.dais.cdg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.ibm.wala.util.collections.Pair;

/**
 * Folds nodes that depend on exactly the same (label, parent) pairs under a shared region node, so that every region
 * of the graph stands for one distinct set of control conditions.
 */
class RegionCompactor<T> {

	private static final Logger LOGGER = Logger.getLogger(RegionCompactor.class.getName());

	private final ControlDependenceGraph<T> cdg;

	RegionCompactor(ControlDependenceGraph<T> cdg) {
		this.cdg = cdg;
	}

	/**
	 * The control context of a node: the pairs of label and parent it hangs off.
	 */
	static <T> Set<Pair<EdgeType, ControlDependenceNode<T>>> signature(ControlDependenceNode<T> node) {
		Set<Pair<EdgeType, ControlDependenceNode<T>>> signature = new LinkedHashSet<>();
		for (ControlDependenceNode<T> parent : node.getParents())
			for (EdgeType type : parent.getEdgeTypes(node))
				signature.add(Pair.make(type, parent));
		return signature;
	}

	void compact() {
		Map<Set<Pair<EdgeType, ControlDependenceNode<T>>>, List<ControlDependenceNode<T>>> partitions = new LinkedHashMap<>();
		for (ControlDependenceNode<T> node : cdg.getNodeList()) {
			if (node.isRoot())
				continue;
			Set<Pair<EdgeType, ControlDependenceNode<T>>> signature = signature(node);
			List<ControlDependenceNode<T>> members = partitions.get(signature);
			if (members == null)
				partitions.put(signature, members = new ArrayList<>());
			members.add(node);
		}

		// nodes that hang off nothing but the root are already in the root's region
		Set<Pair<EdgeType, ControlDependenceNode<T>>> rootSignature = Collections.singleton(Pair.make(EdgeType.OTHER,
				cdg.getRoot()));

		int regions = 0;
		for (Entry<Set<Pair<EdgeType, ControlDependenceNode<T>>>, List<ControlDependenceNode<T>>> partition : partitions
				.entrySet()) {
			List<ControlDependenceNode<T>> members = partition.getValue();
			if (members.size() < 2 || partition.getKey().equals(rootSignature))
				continue;
			ControlDependenceNode<T> region = cdg.addRegionNode();
			for (Pair<EdgeType, ControlDependenceNode<T>> dependence : partition.getKey())
				dependence.snd.addChild(dependence.fst, region);
			for (ControlDependenceNode<T> member : members) {
				member.clearParents();
				region.addChild(EdgeType.OTHER, member);
			}
			regions++;
		}

		if (LOGGER.isLoggable(Level.FINE))
			LOGGER.fine("Inserted " + regions + " regions for " + partitions.size() + " distinct control contexts");
	}

}
