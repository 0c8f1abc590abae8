package edu.uiuc.cs.dais.cdg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Stack;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import com.ibm.wala.cfg.ControlFlowGraph;
import com.ibm.wala.cfg.IBasicBlock;
import com.ibm.wala.ipa.cfg.ExceptionPrunedCFG;
import com.ibm.wala.ssa.IR;
import com.ibm.wala.ssa.ISSABasicBlock;
import com.ibm.wala.ssa.SSAInstruction;
import com.ibm.wala.util.graph.AbstractGraph;
import com.ibm.wala.util.graph.Graph;
import com.ibm.wala.util.graph.NodeManager;
import com.ibm.wala.util.graph.traverse.DFS;
import com.ibm.wala.util.intset.BitVector;

import edu.uiuc.cs.dais.cdg.cfg.ConditionalBranchClassifier;
import edu.uiuc.cs.dais.cdg.cfg.EdgeClassifier;
import edu.uiuc.cs.dais.cdg.cfg.PostDominatorTree;
import edu.uiuc.cs.dais.cdg.cfg.WalaPostDominatorTree;

/**
 * Control dependence graph of a single procedure, based on Ferrante et al's
 * "The Program Dependence Graph and Its Use in Optimization".
 * <p>
 * A node is a child of another node if the block it stands for executes only when the parent's branch takes the arm
 * given by the edge label. Blocks that execute on every path hang off the {@link #getRoot() root}. Blocks sharing
 * the same control dependences are grouped under region nodes.
 * <p>
 * Successors in the WALA graph view are children, predecessors are parents. The graph cannot be modified through
 * that view. Once built, the graph may be read from several threads.
 *
 * @param <T>
 *            basic block type
 */
public class ControlDependenceGraph<T> extends AbstractGraph<ControlDependenceNode<T>> {

	private static final Logger LOGGER = Logger.getLogger(ControlDependenceGraph.class.getName());

	private final List<ControlDependenceNode<T>> nodes;
	private final Map<T, ControlDependenceNode<T>> nodeMap;
	private final ControlDependenceNode<T> root;
	private final NodeManager<ControlDependenceNode<T>> nodeManager;
	private final LabeledEdgeManager<ControlDependenceNode<T>, ControlDependenceEdge<T>> edgeManager;

	ControlDependenceGraph() {
		this.nodes = new ArrayList<>();
		this.nodeMap = new HashMap<>();
		this.root = new ControlDependenceNode<>(0, null, true);
		this.nodes.add(root);
		this.nodeManager = new NodeManager<ControlDependenceNode<T>>() {
			@Override
			public Iterator<ControlDependenceNode<T>> iterator() {
				return Collections.unmodifiableList(nodes).iterator();
			}

			@Override
			public Stream<ControlDependenceNode<T>> stream() {
				return nodes.stream();
			}

			@Override
			public int getNumberOfNodes() {
				return nodes.size();
			}

			@Override
			public void addNode(ControlDependenceNode<T> n) {
				throw new UnsupportedOperationException();
			}

			@Override
			public void removeNode(ControlDependenceNode<T> n) throws UnsupportedOperationException {
				throw new UnsupportedOperationException();
			}

			@Override
			public boolean containsNode(ControlDependenceNode<T> n) {
				return n != null && n.getNumber() < nodes.size() && nodes.get(n.getNumber()) == n;
			}
		};
		this.edgeManager = new LabeledEdgeManager<ControlDependenceNode<T>, ControlDependenceEdge<T>>() {

			@Override
			public Iterator<ControlDependenceNode<T>> getPredNodes(ControlDependenceNode<T> n) {
				return n.getParents().iterator();
			}

			@Override
			public int getPredNodeCount(ControlDependenceNode<T> n) {
				return n.getNumParents();
			}

			@Override
			public Iterator<ControlDependenceNode<T>> getSuccNodes(ControlDependenceNode<T> n) {
				return n.getChildren().iterator();
			}

			@Override
			public int getSuccNodeCount(ControlDependenceNode<T> n) {
				return n.getNumChildren();
			}

			@Override
			public List<ControlDependenceEdge<T>> getEdges() {
				List<ControlDependenceEdge<T>> edges = new ArrayList<>();
				for (ControlDependenceNode<T> node : nodes)
					edges.addAll(getOutEdges(node));
				return edges;
			}

			@Override
			public List<ControlDependenceEdge<T>> getInEdges(ControlDependenceNode<T> node) {
				List<ControlDependenceEdge<T>> edges = new ArrayList<>();
				for (ControlDependenceNode<T> parent : node.getParents())
					for (EdgeType type : parent.getEdgeTypes(node))
						edges.add(new ControlDependenceEdge<>(parent, node, type));
				return edges;
			}

			@Override
			public List<ControlDependenceEdge<T>> getOutEdges(ControlDependenceNode<T> node) {
				List<ControlDependenceEdge<T>> edges = new ArrayList<>();
				for (EdgeType type : EdgeType.values())
					for (ControlDependenceNode<T> child : node.getChildren(type))
						edges.add(new ControlDependenceEdge<>(node, child, type));
				return edges;
			}

			@Override
			public boolean hasEdge(ControlDependenceNode<T> src, ControlDependenceNode<T> dst) {
				return src.hasChild(dst);
			}

			@Override
			public void addEdge(ControlDependenceNode<T> src, ControlDependenceNode<T> dst) {
				throw new UnsupportedOperationException();
			}

			@Override
			public void removeEdge(ControlDependenceNode<T> src, ControlDependenceNode<T> dst)
					throws UnsupportedOperationException {
				throw new UnsupportedOperationException();
			}

			@Override
			public void removeAllIncidentEdges(ControlDependenceNode<T> node) throws UnsupportedOperationException {
				throw new UnsupportedOperationException();
			}

			@Override
			public void removeIncomingEdges(ControlDependenceNode<T> node) throws UnsupportedOperationException {
				throw new UnsupportedOperationException();
			}

			@Override
			public void removeOutgoingEdges(ControlDependenceNode<T> node) throws UnsupportedOperationException {
				throw new UnsupportedOperationException();
			}
		};
	}

	/**
	 * Builds the control dependence graph of a control flow graph, computing its post-dominators.
	 *
	 * @param entry
	 *            the block every execution starts in
	 * @param exit
	 *            the block every terminating execution ends in; every block reachable from the entry must reach it
	 */
	public static <T> ControlDependenceGraph<T> make(Graph<T> cfg, T entry, T exit, EdgeClassifier<T> classifier) {
		return make(cfg, entry, classifier, WalaPostDominatorTree.make(cfg, exit), new ControlDependenceOptions());
	}

	public static <T> ControlDependenceGraph<T> make(Graph<T> cfg, T entry, EdgeClassifier<T> classifier,
			PostDominatorTree<T> pDoms, ControlDependenceOptions options) {
		if (cfg == null || classifier == null || pDoms == null || options == null)
			throw new IllegalArgumentException("null argument");
		ControlDependenceGraph<T> cdg = new ControlDependenceGraph<>();
		new DependenceBuilder<>(cfg, entry, classifier, pDoms).build(cdg);
		if (options.getInsertRegions())
			new RegionCompactor<>(cdg).compact();
		if (LOGGER.isLoggable(Level.FINE))
			LOGGER.fine("Control dependence graph of " + cfg.getNumberOfNodes() + " blocks has " + cdg
					.getNumberOfNodes() + " nodes");
		return cdg;
	}

	public static <I extends SSAInstruction, T extends IBasicBlock<I>> ControlDependenceGraph<T> make(
			ControlFlowGraph<I, T> cfg) {
		return make(cfg, new ControlDependenceOptions());
	}

	public static <I extends SSAInstruction, T extends IBasicBlock<I>> ControlDependenceGraph<T> make(
			ControlFlowGraph<I, T> cfg, ControlDependenceOptions options) {
		return make(cfg, cfg.entry(), new ConditionalBranchClassifier<>(cfg), WalaPostDominatorTree.make(cfg,
				cfg.exit()), options);
	}

	public static ControlDependenceGraph<ISSABasicBlock> load(IR ir) {
		return load(ir, new ControlDependenceOptions());
	}

	public static ControlDependenceGraph<ISSABasicBlock> load(IR ir, ControlDependenceOptions options) {
		ControlFlowGraph<SSAInstruction, ISSABasicBlock> cfg = ir.getControlFlowGraph();
		if (options.getPruneExceptionalEdges())
			cfg = ExceptionPrunedCFG.make(cfg);
		return make(cfg, options);
	}

	void addBlockNode(T block) {
		if (nodeMap.containsKey(block))
			throw new IllegalStateException("Block " + block + " already has a node");
		ControlDependenceNode<T> node = new ControlDependenceNode<>(nodes.size(), block, false);
		nodes.add(node);
		nodeMap.put(block, node);
	}

	ControlDependenceNode<T> addRegionNode() {
		ControlDependenceNode<T> region = new ControlDependenceNode<>(nodes.size(), null, false);
		nodes.add(region);
		return region;
	}

	List<ControlDependenceNode<T>> getNodeList() {
		return Collections.unmodifiableList(nodes);
	}

	public ControlDependenceNode<T> getRoot() {
		return root;
	}

	/**
	 * @return the node of the block, or null if the block is not part of the graph (e.g. it is unreachable)
	 */
	public ControlDependenceNode<T> getNode(T block) {
		return nodeMap.get(block);
	}

	/**
	 * @return the blocks of this graph, in node order
	 */
	public List<T> getBlocks() {
		List<T> blocks = new ArrayList<>(nodeMap.size());
		for (ControlDependenceNode<T> node : nodes)
			if (node.getBlock() != null)
				blocks.add(node.getBlock());
		return blocks;
	}

	/**
	 * @return whether b (transitively) depends on a, i.e. whether b's node can be reached from a's node along one or
	 *         more child edges. A block never controls itself.
	 * @throws IllegalArgumentException
	 *             if either block is not part of the graph
	 */
	public boolean controls(T a, T b) {
		ControlDependenceNode<T> from = checkedNode(a);
		ControlDependenceNode<T> to = checkedNode(b);
		if (from == to)
			return false;
		BitVector visited = new BitVector(nodes.size());
		Stack<ControlDependenceNode<T>> workList = new Stack<>();
		workList.addAll(from.getChildren());
		while (!workList.isEmpty()) {
			ControlDependenceNode<T> cur = workList.pop();
			if (cur == to)
				return true;
			if (visited.get(cur.getNumber()))
				continue;
			visited.set(cur.getNumber());
			workList.addAll(cur.getChildren());
		}
		return false;
	}

	/**
	 * @return whether one of the blocks controls the other, in either direction
	 * @throws IllegalArgumentException
	 *             if either block is not part of the graph
	 */
	public boolean influences(T a, T b) {
		return controls(a, b) || controls(b, a);
	}

	/**
	 * @return the nodes reachable from the given node along one or more child edges
	 */
	public Set<ControlDependenceNode<T>> getDescendants(ControlDependenceNode<T> node) {
		return DFS.getReachableNodes(this, node.getChildren());
	}

	private ControlDependenceNode<T> checkedNode(T block) {
		ControlDependenceNode<T> node = nodeMap.get(block);
		if (node == null)
			throw new IllegalArgumentException("Block " + block + " is not in the control dependence graph");
		return node;
	}

	@Override
	public NodeManager<ControlDependenceNode<T>> getNodeManager() {
		return nodeManager;
	}

	@Override
	public LabeledEdgeManager<ControlDependenceNode<T>, ControlDependenceEdge<T>> getEdgeManager() {
		return edgeManager;
	}

}
