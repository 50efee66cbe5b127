package edu.isi.hyperkbest.hypergraph;

import java.util.List;

/**
 * A node of the search hypergraph as the k-best extractor sees it. Nodes are
 * identified by reference; the extractor never changes them.
 */
public interface Hypothesis {
	public String getId();
	/** incoming hyperedges; the first is the node's own best arc, the rest were recombined into it */
	public List<Hyperedge> getIncomingEdges();
	/** score of the node's single best derivation; NaN if never computed */
	public double getBestScore();
	public boolean isRoot();
}
