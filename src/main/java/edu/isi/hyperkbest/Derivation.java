package edu.isi.hyperkbest;

import java.util.Arrays;

import edu.isi.hyperkbest.features.ScoreBreakdown;
import edu.isi.hyperkbest.hypergraph.Hyperedge;

/**
 * One concrete derivation: a hyperarc plus, for each tail vertex, the rank of
 * the sub-derivation used there. Identity is (edge, back pointers); score and
 * breakdown are derived from it when the derivation is built.
 */
public final class Derivation {
	private final Hyperarc edge;
	private final int[] backPointers;
	private final double score;
	private final ScoreBreakdown scoreBreakdown;
	private final int hsh;
	private String sval = null;

	// best derivation through edge: every back pointer at rank 0
	Derivation(Hyperarc edge, Semiring semiring) {
		this(edge, new int[edge.getArity()], semiring);
	}

	// successor of d: same edge, back pointer i moved one rank down
	Derivation(Derivation d, int i, Semiring semiring) {
		this(d.edge, bump(d.backPointers, i), semiring);
	}

	private static int[] bump(int[] bp, int i) {
		int[] ret = Arrays.copyOf(bp, bp.length);
		ret[i]++;
		return ret;
	}

	private Derivation(Hyperarc edge, int[] backPointers, Semiring semiring) {
		this.edge = edge;
		this.backPointers = backPointers;
		Hyperedge e = edge.getHyperedge();
		double s = e.getLocalScore();
		ScoreBreakdown b = e.getLocalBreakdown();
		// children must already sit in their vertex's k-best list
		for (int i = 0; i < backPointers.length; i++) {
			Vertex pred = edge.getTail(i);
			if (backPointers[i] >= pred.size())
				throw new IllegalStateException("Rank "+backPointers[i]+" of "+pred.getHypothesis().getId()+
						" requested by "+edge+" before it was derived");
			Derivation sub = pred.getDerivation(backPointers[i]);
			s = semiring.times(s, sub.score);
			b = b.plus(sub.scoreBreakdown);
		}
		score = s;
		scoreBreakdown = b;
		hsh = 31*edge.hashCode() + Arrays.hashCode(backPointers);
	}

	public Hyperarc getEdge() {
		return edge;
	}
	public int getArity() {
		return backPointers.length;
	}
	public int getBackPointer(int i) {
		return backPointers[i];
	}
	public int[] getBackPointers() {
		return Arrays.copyOf(backPointers, backPointers.length);
	}
	public double getScore() {
		return score;
	}
	public ScoreBreakdown getScoreBreakdown() {
		return scoreBreakdown;
	}

	/** the derivation used for tail vertex i, looked up by rank */
	public Derivation getSubderivation(int i) {
		return edge.getTail(i).getDerivation(backPointers[i]);
	}

	// hashset equality: same edge, same back pointers. score is not compared
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Derivation))
			return false;
		Derivation d = (Derivation)o;
		return edge.equals(d.edge) && Arrays.equals(backPointers, d.backPointers);
	}
	public int hashCode() {
		return hsh;
	}

	public String toString() {
		if (sval == null)
			sval = score+":"+edge+":"+Arrays.toString(backPointers);
		return sval;
	}
}
