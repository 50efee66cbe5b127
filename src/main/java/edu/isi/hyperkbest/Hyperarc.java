package edu.isi.hyperkbest;

import edu.isi.hyperkbest.hypergraph.Hyperedge;

/**
 * Unweighted identity of a hyperedge inside one extraction: the head vertex,
 * which of the head's incoming edges it is, and the ordered tail vertices.
 * Vertices are unique per hypothesis within an extraction, so they compare by
 * reference.
 */
public final class Hyperarc {
	private final Vertex head;
	private final int edgeIndex;
	private final Vertex[] tail;
	private final Hyperedge hyperedge;
	private final int hsh;

	Hyperarc(Vertex head, int edgeIndex, Hyperedge hyperedge, Vertex[] tail) {
		this.head = head;
		this.edgeIndex = edgeIndex;
		this.hyperedge = hyperedge;
		this.tail = tail;
		int h = System.identityHashCode(head);
		h = 31*h + edgeIndex;
		for (Vertex v : tail)
			h = 31*h + System.identityHashCode(v);
		hsh = h;
	}

	public Vertex getHead() {
		return head;
	}
	public int getEdgeIndex() {
		return edgeIndex;
	}
	public Hyperedge getHyperedge() {
		return hyperedge;
	}
	public int getArity() {
		return tail.length;
	}
	public Vertex getTail(int i) {
		return tail[i];
	}

	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Hyperarc))
			return false;
		Hyperarc a = (Hyperarc)o;
		if (head != a.head || edgeIndex != a.edgeIndex || tail.length != a.tail.length)
			return false;
		for (int i = 0; i < tail.length; i++)
			if (tail[i] != a.tail[i])
				return false;
		return true;
	}
	public int hashCode() {
		return hsh;
	}
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(head.getHypothesis().getId()).append('#').append(edgeIndex).append(" <-");
		for (Vertex v : tail)
			sb.append(' ').append(v.getHypothesis().getId());
		return sb.toString();
	}
}
