package edu.isi.hyperkbest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.PriorityQueue;

import edu.isi.hyperkbest.hypergraph.Hypothesis;

/**
 * Memo node for one hypothesis during one extraction: the derivations found
 * so far, best first, and the frontier of candidates that may come next.
 */
public class Vertex {
	private final Hypothesis hypothesis;

	// D(v) in the paper. append-only, so ranks handed out stay valid
	final ArrayList<Derivation> kBestList;
	// cand[v] in the paper
	final PriorityQueue<Derivation> candidates;
	// everything ever pushed onto candidates, by (edge, back pointers)
	final HashSet<Derivation> seen;
	// frontier has been seeded
	boolean visited;
	// number of kBestList entries whose successors are already on the frontier
	int expanded;
	// growth of this vertex is on the call stack; re-entry means a cycle
	boolean inProgress;

	Vertex(Hypothesis h, ChartKBestExtractor.DerivationOrderer orderer) {
		hypothesis = h;
		kBestList = new ArrayList<Derivation>();
		candidates = new PriorityQueue<Derivation>(11, orderer);
		seen = new HashSet<Derivation>();
		visited = false;
		expanded = 0;
		inProgress = false;
	}

	public Hypothesis getHypothesis() {
		return hypothesis;
	}

	public List<Derivation> getKBestList() {
		return Collections.unmodifiableList(kBestList);
	}

	/** number of derivations discovered so far */
	public int size() {
		return kBestList.size();
	}

	public Derivation getDerivation(int rank) {
		return kBestList.get(rank);
	}

	int numSeen() {
		return seen.size();
	}

	public String toString() {
		return "V("+hypothesis.getId()+": "+kBestList.size()+" found, "+candidates.size()+" pending)";
	}
}
