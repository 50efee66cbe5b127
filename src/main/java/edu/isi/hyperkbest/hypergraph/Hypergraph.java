package edu.isi.hyperkbest.hypergraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;

import edu.isi.hyperkbest.Debug;
import edu.isi.hyperkbest.Semiring;
import edu.isi.hyperkbest.UnusualConditionException;

/**
 * The search hypergraph of one sentence: its nodes, keyed by id, and the
 * top-level (root) nodes that span the whole input.
 */
public class Hypergraph {
	private final LinkedHashMap<String, ChartHypothesis> nodes;
	private final ArrayList<ChartHypothesis> roots;
	// set once best scores are known, so roots can be ranked
	private Semiring semiring = null;

	public Hypergraph() {
		nodes = new LinkedHashMap<String, ChartHypothesis>();
		roots = new ArrayList<ChartHypothesis>();
	}

	public ChartHypothesis getOrCreateNode(String id) {
		ChartHypothesis h = nodes.get(id);
		if (h == null) {
			h = new ChartHypothesis(id);
			nodes.put(id, h);
		}
		return h;
	}

	public ChartHypothesis getNode(String id) {
		return nodes.get(id);
	}

	public Collection<ChartHypothesis> getNodes() {
		return Collections.unmodifiableCollection(nodes.values());
	}

	public int getNumNodes() {
		return nodes.size();
	}

	public int getNumEdges() {
		int n = 0;
		for (ChartHypothesis h : nodes.values())
			n += h.getIncomingEdges().size();
		return n;
	}

	public void addRoot(ChartHypothesis h) {
		if (nodes.get(h.getId()) != h)
			throw new IllegalArgumentException("Root "+h.getId()+" is not a node of this hypergraph");
		h.setRoot(true);
		roots.add(h);
	}

	// roots in the order they were added
	public List<ChartHypothesis> getRoots() {
		return Collections.unmodifiableList(roots);
	}

	/**
	 * Roots ranked best-first by their best score, ties kept in the order the
	 * roots were added. Before {@link #computeBestScores} runs, the roots are
	 * returned as added.
	 */
	public List<Hypothesis> getRankedRoots() {
		List<Hypothesis> ret = new ArrayList<Hypothesis>(roots);
		if (semiring == null)
			return ret;
		final Semiring sr = semiring;
		// List.sort is stable
		ret.sort(new Comparator<Hypothesis>() {
			public int compare(Hypothesis a, Hypothesis b) {
				return sr.compare(a.getBestScore(), b.getBestScore());
			}
		});
		return ret;
	}

	// bottom-up pass that sets the best (viterbi) score of every node
	public void computeBestScores(Semiring sr) throws UnusualConditionException {
		boolean debug = false;
		IdentityHashMap<Hypothesis, Boolean> done = new IdentityHashMap<Hypothesis, Boolean>();
		for (ChartHypothesis h : nodes.values())
			computeBestScore(h, sr, done);
		semiring = sr;
		if (debug) Debug.debug(debug, "Best scores computed for "+nodes.size()+" nodes");
	}

	// done maps a node to false while it is in progress, to true once scored
	private double computeBestScore(Hypothesis h, Semiring sr, IdentityHashMap<Hypothesis, Boolean> done)
			throws UnusualConditionException {
		Boolean state = done.get(h);
		if (state != null) {
			if (!state)
				throw new UnusualConditionException("Cycle in hypergraph through node "+h.getId());
			return h.getBestScore();
		}
		if (h.getIncomingEdges().isEmpty())
			throw new UnusualConditionException("Node "+h.getId()+" has no incoming hyperedges");
		done.put(h, Boolean.FALSE);
		double best = sr.ZERO();
		for (Hyperedge e : h.getIncomingEdges()) {
			double score = e.getLocalScore();
			for (Hypothesis ant : e.getAntecedents())
				score = sr.times(score, computeBestScore(ant, sr, done));
			if (sr.better(score, best))
				best = score;
		}
		if (h instanceof ChartHypothesis)
			((ChartHypothesis)h).setBestScore(best);
		done.put(h, Boolean.TRUE);
		return best;
	}
}
