package edu.isi.hyperkbest;

// max-plus is max, +, -INF, 0. log-linear model scores: higher is better
public class MaxPlusSemiring extends Semiring {
	public double times(double a, double b) {
		return a+b;
	}
	public boolean better(double a, double b) {
		return a>b;
	}
	public double ZERO() { return Double.NEGATIVE_INFINITY; }
	public double ONE() { return 0; }
	public double priority(double a) { return a; }
	public String toString() { return "maxplus"; }
}
