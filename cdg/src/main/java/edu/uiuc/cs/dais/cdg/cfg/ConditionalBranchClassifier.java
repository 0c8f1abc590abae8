package edu.uiuc.cs.dais.cdg.cfg;

import com.ibm.wala.cfg.ControlFlowGraph;
import com.ibm.wala.cfg.IBasicBlock;
import com.ibm.wala.cfg.Util;
import com.ibm.wala.ssa.SSAInstruction;

import edu.uiuc.cs.dais.cdg.EdgeType;

/**
 * Labels the edges of a WALA SSA control flow graph. For a block ending in a conditional branch the taken successor is
 * the true arm and the fall-through successor the false arm; switch, goto and exceptional edges are other edges.
 */
public class ConditionalBranchClassifier<I extends SSAInstruction, T extends IBasicBlock<I>>
		implements EdgeClassifier<T> {

	private final ControlFlowGraph<I, T> cfg;

	public ConditionalBranchClassifier(ControlFlowGraph<I, T> cfg) {
		this.cfg = cfg;
	}

	@Override
	public EdgeType classify(T source, T target) {
		if (!Util.endsWithConditionalBranch(cfg, source))
			return EdgeType.OTHER;
		if (target.equals(Util.getTakenSuccessor(cfg, source)))
			return EdgeType.TRUE;
		if (target.equals(Util.getNotTakenSuccessor(cfg, source)))
			return EdgeType.FALSE;
		return EdgeType.OTHER;
	}

}
