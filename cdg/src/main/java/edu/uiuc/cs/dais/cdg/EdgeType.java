package edu.uiuc.cs.dais.cdg;

/**
 * Label of a control dependence edge: the arm of the controlling branch the dependent node hangs off.
 */
public enum EdgeType {
	TRUE("T"), FALSE("F"), OTHER("");

	private final String label;

	private EdgeType(String label) {
		this.label = label;
	}

	/**
	 * @return the short label used when rendering the edge ("T", "F" or empty)
	 */
	public String getLabel() {
		return label;
	}
}
