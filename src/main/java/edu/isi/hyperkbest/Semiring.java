package edu.isi.hyperkbest;

import java.io.Serializable;

// the scoring semiring. times combines a rule's local score with its children's,
// better decides rank order. Subclasses do the operations
public abstract class Semiring implements Serializable {
	public abstract double times(double a, double b);
	// better means "ranks ahead of"
	public abstract boolean better(double a, double b);
	public abstract double ONE();
	public abstract double ZERO();
	// maps a score onto a scale where larger is always better, for max-priority queues
	public abstract double priority(double a);

	// comparator-style: negative if a ranks ahead of b
	public int compare(double a, double b) {
		if (better(a, b))
			return -1;
		if (better(b, a))
			return 1;
		return 0;
	}

	public static Semiring get(String name) throws ConfigureException {
		if (name.equals("maxplus"))
			return new MaxPlusSemiring();
		else if (name.equals("tropical"))
			return new TropicalSemiring();
		throw new ConfigureException("Unexpected semiring type: "+name+"; valid values are maxplus, tropical");
	}
}
