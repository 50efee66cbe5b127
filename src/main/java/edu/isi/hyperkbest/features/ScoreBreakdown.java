package edu.isi.hyperkbest.features;

import gnu.trove.map.hash.TObjectDoubleHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import edu.isi.hyperkbest.ConfigureException;

/**
 * Named feature values of a rule application or a whole derivation. Breakdowns
 * compose additively: the breakdown of a derivation is the breakdown of its
 * top hyperedge plus the breakdowns of the sub-derivations it uses.
 *
 * Instances are never changed once built; {@link #plus} returns a new one.
 */
public class ScoreBreakdown {

	public static final ScoreBreakdown EMPTY = new ScoreBreakdown(new TObjectDoubleHashMap<String>());

	private final TObjectDoubleHashMap<String> values;
	private String sval = null;

	private ScoreBreakdown(TObjectDoubleHashMap<String> v) {
		values = v;
	}

	public static ScoreBreakdown of(Map<String, Double> feats) {
		TObjectDoubleHashMap<String> v = new TObjectDoubleHashMap<String>();
		for (Map.Entry<String, Double> e : feats.entrySet())
			v.put(e.getKey(), e.getValue());
		return new ScoreBreakdown(v);
	}

	// single-feature convenience, mostly for building small graphs by hand
	public static ScoreBreakdown of(String name, double value) {
		TObjectDoubleHashMap<String> v = new TObjectDoubleHashMap<String>();
		v.put(name, value);
		return new ScoreBreakdown(v);
	}

	/** value of the named feature; 0 if the feature never fired */
	public double get(String name) {
		return values.containsKey(name) ? values.get(name) : 0.0;
	}

	public boolean contains(String name) {
		return values.containsKey(name);
	}

	public int size() {
		return values.size();
	}

	public ScoreBreakdown plus(ScoreBreakdown other) {
		if (other.values.isEmpty())
			return this;
		if (values.isEmpty())
			return other;
		TObjectDoubleHashMap<String> sum = new TObjectDoubleHashMap<String>(values);
		for (String name : other.values.keySet())
			sum.adjustOrPutValue(name, other.values.get(name), other.values.get(name));
		return new ScoreBreakdown(sum);
	}

	public double innerProduct(FeatureWeights weights) throws ConfigureException {
		double total = 0;
		for (String name : getNames())
			total += weights.getWeight(name) * values.get(name);
		return total;
	}

	// feature names in sorted order, so printing and summation are stable
	public List<String> getNames() {
		List<String> names = new ArrayList<String>(values.keySet());
		Collections.sort(names);
		return names;
	}

	public boolean equals(Object o) {
		if (!(o instanceof ScoreBreakdown))
			return false;
		return values.equals(((ScoreBreakdown)o).values);
	}
	public int hashCode() {
		return values.hashCode();
	}

	public String toString() {
		if (sval == null) {
			StringBuilder ret = new StringBuilder();
			for (String name : getNames()) {
				if (ret.length() > 0)
					ret.append(' ');
				ret.append(name).append('=').append(values.get(name));
			}
			sval = ret.toString();
		}
		return sval;
	}
}
