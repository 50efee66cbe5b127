package edu.isi.hyperkbest;

/**
 * for hypergraphs that break the extractor's assumptions: cycles, vertices
 * entered while their own growth is in progress, nodes without incoming edges
 */
public class UnusualConditionException extends Exception {
	public UnusualConditionException(String message) { super(message); }
	public UnusualConditionException(String message, Throwable cause) { super(message, cause); }
}
