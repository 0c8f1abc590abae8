package edu.uiuc.cs.dais.cdg.cfg;

import java.util.HashMap;
import java.util.Map;

import com.ibm.wala.util.collections.Pair;

import edu.uiuc.cs.dais.cdg.EdgeType;

/**
 * Edge classifier backed by an explicit table of two-way branches, for control flow graphs that do not come from a
 * WALA IR.
 */
public class BranchTable<T> implements EdgeClassifier<T> {

	private final Map<T, Pair<T, T>> branches = new HashMap<>();

	/**
	 * Declares that the given block ends in a two-way conditional branch.
	 *
	 * @return this table
	 */
	public BranchTable<T> addBranch(T block, T whenTrue, T whenFalse) {
		if (block == null || whenTrue == null || whenFalse == null)
			throw new IllegalArgumentException("null block in branch " + block + " ? " + whenTrue + " : " + whenFalse);
		branches.put(block, Pair.make(whenTrue, whenFalse));
		return this;
	}

	public boolean isBranch(T block) {
		return branches.containsKey(block);
	}

	@Override
	public EdgeType classify(T source, T target) {
		Pair<T, T> arms = branches.get(source);
		if (arms == null)
			return EdgeType.OTHER;
		if (arms.fst.equals(target))
			return EdgeType.TRUE;
		if (arms.snd.equals(target))
			return EdgeType.FALSE;
		return EdgeType.OTHER;
	}

}
