package edu.isi.hyperkbest.hypergraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// concrete hypergraph node, as read from a file or built by hand
public class ChartHypothesis implements Hypothesis {
	private final String id;
	private final ArrayList<Hyperedge> edges;
	private double bestScore;
	private boolean root;

	public ChartHypothesis(String id) {
		this.id = id;
		edges = new ArrayList<Hyperedge>();
		bestScore = Double.NaN;
		root = false;
	}

	public String getId() {
		return id;
	}
	public List<Hyperedge> getIncomingEdges() {
		return Collections.unmodifiableList(edges);
	}
	public void addIncomingEdge(Hyperedge e) {
		edges.add(e);
	}
	public double getBestScore() {
		return bestScore;
	}
	void setBestScore(double s) {
		bestScore = s;
	}
	public boolean isRoot() {
		return root;
	}
	void setRoot(boolean r) {
		root = r;
	}
	public String toString() {
		return id;
	}
}
