package edu.isi.hyperkbest;

// implementation of lazy k-best (algorithm 3) as described in huang/chiang 05,
// "Better k-best parsing", over the hypergraph left behind by chart decoding

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;

import edu.isi.hyperkbest.hypergraph.Hyperedge;
import edu.isi.hyperkbest.hypergraph.Hypothesis;
import edu.isi.hyperkbest.hypergraph.Phrase;
import edu.isi.hyperkbest.hypergraph.TargetRule;
import edu.stanford.nlp.util.FixedPrioritiesPriorityQueue;

/**
 * Extracts the k best derivations from a hypergraph without enumerating it.
 * Each hypothesis visited gets a {@link Vertex} that remembers the derivations
 * found so far and a frontier of candidates; ranks are filled on demand.
 * <p>
 * An extractor is the memo for one extraction context (typically one
 * sentence). Calls to {@link #extract} on the same extractor share and reuse
 * vertices; use a fresh extractor, or {@link #reset}, for a different
 * hypergraph. Not thread safe: give each thread its own extractor.
 */
public class ChartKBestExtractor {

	// frontier order: better score first. ties broken by structure, so
	// extraction is deterministic: lower edge index, then smaller back pointers
	static class DerivationOrderer implements Comparator<Derivation> {
		private final Semiring semiring;
		DerivationOrderer(Semiring s) {
			semiring = s;
		}
		public int compare(Derivation d1, Derivation d2) {
			int c = semiring.compare(d1.getScore(), d2.getScore());
			if (c != 0)
				return c;
			Hyperarc e1 = d1.getEdge();
			Hyperarc e2 = d2.getEdge();
			if (e1.getEdgeIndex() != e2.getEdgeIndex())
				return e1.getEdgeIndex() < e2.getEdgeIndex() ? -1 : 1;
			int n = Math.min(d1.getArity(), d2.getArity());
			for (int i = 0; i < n; i++) {
				if (d1.getBackPointer(i) != d2.getBackPointer(i))
					return d1.getBackPointer(i) < d2.getBackPointer(i) ? -1 : 1;
			}
			return d1.getArity() - d2.getArity();
		}
	}

	// position in one root's k-best list, for the cross-root merge
	private static class RootCursor {
		final Vertex vertex;
		final int rank;
		RootCursor(Vertex v, int r) {
			vertex = v;
			rank = r;
		}
		Derivation get() {
			return vertex.getDerivation(rank);
		}
	}

	private final Semiring semiring;
	private final DerivationOrderer orderer;
	private final IdentityHashMap<Hypothesis, Vertex> vertexMap;

	public ChartKBestExtractor() {
		this(new MaxPlusSemiring());
	}

	public ChartKBestExtractor(Semiring s) {
		semiring = s;
		orderer = new DerivationOrderer(s);
		vertexMap = new IdentityHashMap<Hypothesis, Vertex>();
	}

	public Semiring getSemiring() {
		return semiring;
	}

	// forget all vertices, e.g. between sentences
	public void reset() {
		vertexMap.clear();
	}

	/**
	 * The globally best k derivations over all roots, best first. Roots are
	 * expected in the decoder's own ranking; a root listed twice is used once.
	 * Fewer than k derivations come back if fewer exist.
	 */
	public List<Derivation> extract(List<? extends Hypothesis> topHypos, int k) throws UnusualConditionException {
		boolean debug = false;
		if (k < 0)
			throw new IllegalArgumentException("Asked for "+k+" derivations");
		List<Derivation> ret = new ArrayList<Derivation>();
		if (k == 0)
			return ret;
		FixedPrioritiesPriorityQueue<RootCursor> q = new FixedPrioritiesPriorityQueue<RootCursor>();
		IdentityHashMap<Hypothesis, Boolean> used = new IdentityHashMap<Hypothesis, Boolean>();
		for (Hypothesis h : topHypos) {
			if (used.put(h, Boolean.TRUE) != null) {
				if (debug) Debug.debug(debug, "Skipping repeated root "+h.getId());
				continue;
			}
			Vertex v = findOrCreateVertex(h);
			lazyKthBest(v, 0);
			if (v.size() > 0)
				addCursor(q, new RootCursor(v, 0));
		}
		while (ret.size() < k && !q.isEmpty()) {
			RootCursor c = q.removeFirst();
			ret.add(c.get());
			if (debug) Debug.debug(debug, "Output "+ret.size()+" is "+c.get()+" from root "+c.vertex.getHypothesis().getId());
			if (ret.size() == k)
				break;
			lazyKthBest(c.vertex, c.rank+1);
			if (c.vertex.size() > c.rank+1)
				addCursor(q, new RootCursor(c.vertex, c.rank+1));
		}
		if (debug && ret.size() < k)
			Debug.debug(debug, "Returning "+ret.size()+" derivations; "+k+" requested");
		return ret;
	}

	private void addCursor(FixedPrioritiesPriorityQueue<RootCursor> q, RootCursor c) throws UnusualConditionException {
		double p = semiring.priority(c.get().getScore());
		if (!q.add(c, p))
			throw new UnusualConditionException("Couldn't add rank "+c.rank+" of "+c.vertex.getHypothesis().getId()+" with priority "+p);
	}

	/**
	 * Like {@link #extract}, but keeps only the first derivation for each
	 * distinct output string. Up to k*factor derivations are examined.
	 */
	public List<Derivation> extractDistinct(List<? extends Hypothesis> topHypos, int k, int factor) throws UnusualConditionException {
		boolean debug = false;
		if (factor < 1)
			throw new IllegalArgumentException("n-best factor must be at least 1, not "+factor);
		long wanted = Math.min((long)k * factor, Integer.MAX_VALUE);
		List<Derivation> all = extract(topHypos, (int)wanted);
		List<Derivation> ret = new ArrayList<Derivation>();
		HashSet<String> strings = new HashSet<String>();
		for (Derivation d : all) {
			if (ret.size() >= k)
				break;
			if (strings.add(getOutputPhrase(d).toString()))
				ret.add(d);
			else if (debug) Debug.debug(debug, "Dropping duplicate string of "+d);
		}
		return ret;
	}

	/** kth best (0-based) derivation of a single hypothesis, or null if it has fewer */
	public Derivation getKthBest(Hypothesis h, int k) throws UnusualConditionException {
		Vertex v = findOrCreateVertex(h);
		lazyKthBest(v, k);
		return v.size() > k ? v.getDerivation(k) : null;
	}

	// at most one vertex per hypothesis per extractor
	Vertex findOrCreateVertex(Hypothesis h) {
		Vertex v = vertexMap.get(h);
		if (v == null) {
			v = new Vertex(h, orderer);
			vertexMap.put(h, v);
		}
		return v;
	}

	// the vertex of h, if it was ever visited. for inspection
	Vertex getVertex(Hypothesis h) {
		return vertexMap.get(h);
	}

	int getNumVertices() {
		return vertexMap.size();
	}

	// seed the frontier with the best derivation along each incoming hyperedge.
	// this is the skeleton of the k-best problem; everything else is reached
	// from here by moving one back pointer at a time
	private void getCandidates(Vertex v) throws UnusualConditionException {
		boolean debug = false;
		Hypothesis h = v.getHypothesis();
		List<Hyperedge> edges = h.getIncomingEdges();
		if (edges.isEmpty())
			throw new UnusualConditionException("Hypothesis "+h.getId()+" has no incoming hyperedges");
		if (debug) Debug.debug(debug, "Getting candidates for "+h.getId()+" from "+edges.size()+" edges");
		for (int idx = 0; idx < edges.size(); idx++) {
			Hyperedge e = edges.get(idx);
			List<Hypothesis> ants = e.getAntecedents();
			Vertex[] tail = new Vertex[ants.size()];
			for (int i = 0; i < tail.length; i++) {
				Hypothesis ant = ants.get(i);
				if (ant == null)
					throw new UnusualConditionException("Hyperedge "+idx+" of "+h.getId()+" has a missing antecedent at "+i);
				tail[i] = findOrCreateVertex(ant);
				lazyKthBest(tail[i], 0);
				if (tail[i].size() == 0)
					throw new UnusualConditionException("Unable to get top best for "+ant.getId()+
							"; needed by hyperedge "+idx+" of "+h.getId());
			}
			Derivation d = new Derivation(new Hyperarc(v, idx, e, tail), semiring);
			if (v.seen.add(d)) {
				if (debug) Debug.debug(debug, "Adding "+d+" to frontier of "+h.getId());
				v.candidates.add(d);
			}
		}
		// the decoder's own idea of the best score should agree with ours
		double expected = h.getBestScore();
		double found = v.candidates.peek().getScore();
		if (!Double.isNaN(expected) && !Double.isNaN(found) && Math.abs(expected-found) > 1e-6*Math.max(1, Math.abs(expected)))
			Debug.warn("Best derivation of "+h.getId()+" scores "+found+" but the hypothesis claims "+expected);
	}

	// make sure rank k (0-based) of v exists, if it can. stops early, without
	// complaint, once the frontier runs dry
	private void lazyKthBest(Vertex v, int k) throws UnusualConditionException {
		boolean debug = false;
		if (v.size() > k)
			return;
		if (v.inProgress)
			throw new UnusualConditionException("Cycle in hypergraph: "+v.getHypothesis().getId()+
					" is needed to derive itself");
		v.inProgress = true;
		try {
			if (!v.visited) {
				getCandidates(v);
				v.visited = true;
			}
			while (v.size() <= k) {
				// successors of everything accepted so far go on the frontier first
				while (v.expanded < v.size()) {
					lazyNext(v, v.getDerivation(v.expanded));
					v.expanded++;
				}
				if (v.candidates.isEmpty()) {
					if (debug) Debug.debug(debug, v.getHypothesis().getId()+" exhausted at "+v.size()+" derivations");
					break;
				}
				Derivation next = v.candidates.poll();
				if (debug) Debug.debug(debug, "Rank "+v.size()+" of "+v.getHypothesis().getId()+" is "+next);
				v.kBestList.add(next);
			}
		}
		finally {
			v.inProgress = false;
		}
	}

	// lazily advance the frontier: one successor per back pointer of d
	private void lazyNext(Vertex v, Derivation d) throws UnusualConditionException {
		boolean debug = false;
		for (int i = 0; i < d.getArity(); i++) {
			Vertex pred = d.getEdge().getTail(i);
			int j = d.getBackPointer(i)+1;
			lazyKthBest(pred, j);
			// pred's derivations have been exhausted
			if (pred.size() <= j)
				continue;
			Derivation next = new Derivation(d, i, semiring);
			if (v.seen.add(next)) {
				if (debug) Debug.debug(debug, "Lazily adding "+next);
				v.candidates.add(next);
			}
			else if (debug) Debug.debug(debug, "Duplicate "+next+" not added");
		}
	}

	/**
	 * The target string of a derivation: the rule's words, with each
	 * non-terminal slot replaced by the output of the sub-derivation bound to it.
	 */
	public static Phrase getOutputPhrase(Derivation d) {
		Phrase ret = new Phrase();
		TargetRule rule = d.getEdge().getHyperedge().getRule();
		for (int pos = 0; pos < rule.getSize(); pos++) {
			if (rule.isNonTerminal(pos))
				ret.append(getOutputPhrase(d.getSubderivation(rule.getNonTermIndex(pos))));
			else
				ret.addWord(rule.getWord(pos));
		}
		return ret;
	}

	/** bracketed tree of a derivation: one bracket per rule, labelled with its left-hand side */
	public static String getOutputTree(Derivation d) {
		StringBuilder sb = new StringBuilder();
		buildOutputTree(d, sb);
		return sb.toString();
	}

	private static void buildOutputTree(Derivation d, StringBuilder sb) {
		TargetRule rule = d.getEdge().getHyperedge().getRule();
		sb.append('(').append(rule.getLHS());
		for (int pos = 0; pos < rule.getSize(); pos++) {
			sb.append(' ');
			if (rule.isNonTerminal(pos))
				buildOutputTree(d.getSubderivation(rule.getNonTermIndex(pos)), sb);
			else
				sb.append(rule.getWord(pos));
		}
		sb.append(')');
	}

	// every vertex visited so far, for inspection
	List<Vertex> getVertices() {
		return Collections.unmodifiableList(new ArrayList<Vertex>(vertexMap.values()));
	}
}
