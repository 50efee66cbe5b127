package edu.isi.hyperkbest.hypergraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.isi.hyperkbest.ConfigureException;
import edu.isi.hyperkbest.features.FeatureWeights;
import edu.isi.hyperkbest.features.ScoreBreakdown;

// one rule application: a target rule, the antecedent nodes filling its slots,
// and the rule's own (local) contribution to the score
public class Hyperedge {
	private final TargetRule rule;
	private final List<Hypothesis> antecedents;
	private final ScoreBreakdown localBreakdown;
	private final double localScore;

	public Hyperedge(TargetRule rule, List<? extends Hypothesis> antecedents,
			ScoreBreakdown localBreakdown, double localScore) {
		if (rule.getArity() != antecedents.size())
			throw new IllegalArgumentException("Rule "+rule+" has "+rule.getArity()+
					" slots but "+antecedents.size()+" antecedents were given");
		this.rule = rule;
		this.antecedents = Collections.unmodifiableList(new ArrayList<Hypothesis>(antecedents));
		this.localBreakdown = localBreakdown;
		this.localScore = localScore;
	}

	// local score is the weighted sum of the local features
	public static Hyperedge weighted(TargetRule rule, List<? extends Hypothesis> antecedents,
			ScoreBreakdown localBreakdown, FeatureWeights weights) throws ConfigureException {
		return new Hyperedge(rule, antecedents, localBreakdown, localBreakdown.innerProduct(weights));
	}

	public TargetRule getRule() {
		return rule;
	}
	public List<Hypothesis> getAntecedents() {
		return antecedents;
	}
	public int getArity() {
		return antecedents.size();
	}
	public ScoreBreakdown getLocalBreakdown() {
		return localBreakdown;
	}
	public double getLocalScore() {
		return localScore;
	}

	public String toString() {
		StringBuilder sb = new StringBuilder(rule.toString());
		sb.append(" <-");
		for (Hypothesis h : antecedents)
			sb.append(' ').append(h.getId());
		sb.append(" # ").append(localScore);
		return sb.toString();
	}
}
