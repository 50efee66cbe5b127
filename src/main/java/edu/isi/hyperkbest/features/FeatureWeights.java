package edu.isi.hyperkbest.features;

import gnu.trove.map.hash.TObjectDoubleHashMap;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import edu.isi.hyperkbest.ConfigureException;
import edu.isi.hyperkbest.DataFormatException;
import edu.isi.hyperkbest.Debug;

// feature name -> weight. the model score of a rule is the inner product of these
// weights with the rule's score breakdown
public class FeatureWeights {

	private final TObjectDoubleHashMap<String> weights;
	// uniform weights give every feature weight 1, so the score is the plain sum
	private final boolean uniform;

	private FeatureWeights(TObjectDoubleHashMap<String> w, boolean u) {
		weights = w;
		uniform = u;
	}

	public static FeatureWeights uniform() {
		return new FeatureWeights(new TObjectDoubleHashMap<String>(), true);
	}

	public static FeatureWeights empty() {
		return new FeatureWeights(new TObjectDoubleHashMap<String>(), false);
	}

	public FeatureWeights set(String name, double weight) {
		weights.put(name, weight);
		return this;
	}

	public double getWeight(String name) throws ConfigureException {
		if (weights.containsKey(name))
			return weights.get(name);
		if (uniform)
			return 1.0;
		throw new ConfigureException("No weight given for feature "+name);
	}

	public boolean isUniform() {
		return uniform;
	}

	public int size() {
		return weights.size();
	}

	// empty spaces or comments regions
	private static Pattern commentPat = Pattern.compile("\\s*(%.*)?");
	// name value, possibly followed by a comment
	private static Pattern weightPat = Pattern.compile("\\s*(\\S+)\\s+(\\S+)\\s*(%.*)?");

	// read "name value" lines. Does not close the reader
	public static FeatureWeights read(BufferedReader br) throws IOException, DataFormatException {
		boolean debug = false;
		FeatureWeights ret = empty();
		String line;
		int lineNum = 0;
		while ((line = br.readLine()) != null) {
			lineNum++;
			if (commentPat.matcher(line).matches())
				continue;
			Matcher m = weightPat.matcher(line);
			if (!m.matches())
				throw new DataFormatException("Expected \"name value\" in weight file but got "+line, lineNum);
			double w;
			try {
				w = Double.parseDouble(m.group(2));
			}
			catch (NumberFormatException e) {
				throw new DataFormatException("Bad weight for "+m.group(1)+": "+m.group(2), lineNum, e);
			}
			if (ret.weights.containsKey(m.group(1)))
				throw new DataFormatException("Weight for "+m.group(1)+" given twice", lineNum);
			if (debug) Debug.debug(debug, "Weight of "+m.group(1)+" is "+w);
			ret.weights.put(m.group(1), w);
		}
		return ret;
	}
}
