package edu.uiuc.cs.dais.cdg;

/**
 * Settings for building a {@link ControlDependenceGraph}.
 */
public class ControlDependenceOptions {

	private boolean insertRegions = true;
	private boolean pruneExceptionalEdges = false;

	public boolean getInsertRegions() {
		return insertRegions;
	}

	/**
	 * Whether nodes sharing the same control dependences are folded under region nodes. On by default; turn it off
	 * to inspect the raw Ferrante relation.
	 */
	public ControlDependenceOptions setInsertRegions(boolean insertRegions) {
		this.insertRegions = insertRegions;
		return this;
	}

	public boolean getPruneExceptionalEdges() {
		return pruneExceptionalEdges;
	}

	/**
	 * Whether exceptional edges are dropped from an IR's control flow graph before the dependences are computed.
	 * Only used when loading from an IR. Off by default.
	 */
	public ControlDependenceOptions setPruneExceptionalEdges(boolean pruneExceptionalEdges) {
		this.pruneExceptionalEdges = pruneExceptionalEdges;
		return this;
	}

	@Override
	public String toString() {
		return "insertRegions=" + insertRegions + ", pruneExceptionalEdges=" + pruneExceptionalEdges;
	}
}
