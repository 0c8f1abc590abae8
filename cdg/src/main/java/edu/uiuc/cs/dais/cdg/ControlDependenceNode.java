package edu.uiuc.cs.dais.cdg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A node of a {@link ControlDependenceGraph}. A node either stands for a basic block, for a region (a set of blocks
 * executed under the same control conditions) or for the root of the graph.
 *
 * @param <T>
 *            basic block type
 */
public class ControlDependenceNode<T> {

	private final int number;
	private final T block;
	private final boolean root;
	private final List<ControlDependenceNode<T>> parents;
	private final Map<EdgeType, List<ControlDependenceNode<T>>> children;

	ControlDependenceNode(int number, T block, boolean root) {
		this.number = number;
		this.block = block;
		this.root = root;
		this.parents = new ArrayList<>();
		this.children = new EnumMap<>(EdgeType.class);
		for (EdgeType type : EdgeType.values())
			children.put(type, new ArrayList<ControlDependenceNode<T>>());
	}

	/**
	 * @return the position of this node in its graph; stable for the lifetime of the graph
	 */
	public int getNumber() {
		return number;
	}

	/**
	 * @return the block, or null for the root and for region nodes
	 */
	public T getBlock() {
		return block;
	}

	public boolean isRoot() {
		return root;
	}

	public boolean isRegion() {
		return block == null && !root;
	}

	public List<ControlDependenceNode<T>> getParents() {
		return Collections.unmodifiableList(parents);
	}

	public List<ControlDependenceNode<T>> getChildren(EdgeType type) {
		return Collections.unmodifiableList(children.get(type));
	}

	/**
	 * @return all children, true children first, then false, then other
	 */
	public List<ControlDependenceNode<T>> getChildren() {
		List<ControlDependenceNode<T>> all = new ArrayList<>(getNumChildren());
		for (EdgeType type : EdgeType.values())
			all.addAll(children.get(type));
		return all;
	}

	/**
	 * @return the labels under which the given node is a child of this node; empty if it is not a child
	 */
	public Set<EdgeType> getEdgeTypes(ControlDependenceNode<T> child) {
		Set<EdgeType> types = EnumSet.noneOf(EdgeType.class);
		for (EdgeType type : EdgeType.values())
			if (children.get(type).contains(child))
				types.add(type);
		return types;
	}

	public boolean hasChild(ControlDependenceNode<T> child) {
		return !getEdgeTypes(child).isEmpty();
	}

	public int getNumParents() {
		return parents.size();
	}

	public int getNumChildren() {
		int count = 0;
		for (List<ControlDependenceNode<T>> list : children.values())
			count += list.size();
		return count;
	}

	/**
	 * Links the given child under the given label and registers this node as its parent. Adding the same link twice
	 * has no effect.
	 *
	 * @return whether the link is new
	 */
	boolean addChild(EdgeType type, ControlDependenceNode<T> child) {
		if (child.isRoot())
			throw new IllegalArgumentException("The root cannot be a child");
		List<ControlDependenceNode<T>> list = children.get(type);
		if (list.contains(child))
			return false;
		list.add(child);
		if (!child.parents.contains(this))
			child.parents.add(this);
		return true;
	}

	boolean removeChild(EdgeType type, ControlDependenceNode<T> child) {
		if (!children.get(type).remove(child))
			return false;
		// still linked under another label
		if (!hasChild(child))
			child.parents.remove(this);
		return true;
	}

	/** Unlinks this node from all of its parents. */
	void clearParents() {
		for (ControlDependenceNode<T> parent : new ArrayList<>(parents))
			for (EdgeType type : EdgeType.values())
				parent.removeChild(type, this);
	}

	@Override
	public String toString() {
		if (root)
			return "ENTRY";
		if (block == null)
			return "REGION#" + number;
		return String.valueOf(block);
	}

}
