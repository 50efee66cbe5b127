package edu.isi.hyperkbest;

// tropical is min, +, +INF, 0. costs: lower is better
public class TropicalSemiring extends Semiring {
	public double times(double a, double b) {
		return a+b;
	}
	// fewest paths always the best
	public boolean better(double a, double b) {
		return a<b;
	}
	public double ZERO() { return Double.POSITIVE_INFINITY; }
	public double ONE() { return 0; }
	public double priority(double a) { return -a; }
	public String toString() { return "tropical"; }
}
