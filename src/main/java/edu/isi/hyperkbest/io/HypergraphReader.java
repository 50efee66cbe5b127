package edu.isi.hyperkbest.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import edu.isi.hyperkbest.ConfigureException;
import edu.isi.hyperkbest.DataFormatException;
import edu.isi.hyperkbest.Debug;
import edu.isi.hyperkbest.features.FeatureWeights;
import edu.isi.hyperkbest.features.ScoreBreakdown;
import edu.isi.hyperkbest.hypergraph.ChartHypothesis;
import edu.isi.hyperkbest.hypergraph.Hyperedge;
import edu.isi.hyperkbest.hypergraph.Hypergraph;
import edu.isi.hyperkbest.hypergraph.TargetRule;

/**
 * Reads a hypergraph in the line format
 * <pre>
 * ROOTS: s1 s2
 * head ||| lhs ||| target words and [i] slots ||| antecedent ids ||| name=value ...
 * </pre>
 * with % comments. Each hyperedge line adds one incoming edge to its head, in
 * file order. Local scores are weighted with the given feature weights.
 */
public class HypergraphReader {

	// empty spaces or comments regions
	private static Pattern commentPat = Pattern.compile("\\s*(%.*)?");
	// the roots line, which must come first
	private static Pattern rootsPat = Pattern.compile("\\s*ROOTS:\\s*(.*?)\\s*(%.*)?");
	private static Pattern fieldSepPat = Pattern.compile("\\s*\\|\\|\\|\\s*");
	private static Pattern featurePat = Pattern.compile("([^=\\s]+)=(\\S+)");
	private static Pattern idPat = Pattern.compile("[^\\s\\[\\]|%]+");

	private final FeatureWeights weights;

	public HypergraphReader(FeatureWeights w) {
		weights = w;
	}

	public Hypergraph read(String filename, String encoding) throws IOException, DataFormatException, ConfigureException {
		BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(filename), encoding));
		try {
			return read(br);
		}
		finally {
			br.close();
		}
	}

	// does not close br
	public Hypergraph read(BufferedReader br) throws IOException, DataFormatException, ConfigureException {
		boolean debug = false;
		Hypergraph hg = new Hypergraph();
		int lineNum = 0;
		String line;

		// 1) skip header comments, then get the roots
		List<String> rootIds = null;
		int rootLine = -1;
		while ((line = br.readLine()) != null) {
			lineNum++;
			if (commentPat.matcher(line).matches())
				continue;
			Matcher m = rootsPat.matcher(line);
			if (!m.matches())
				throw new DataFormatException("Expected ROOTS: line but got "+line, lineNum);
			rootIds = new ArrayList<String>();
			for (String id : m.group(1).split("\\s+"))
				if (id.length() > 0)
					rootIds.add(id);
			if (rootIds.isEmpty())
				throw new DataFormatException("No roots listed", lineNum);
			rootLine = lineNum;
			break;
		}
		if (rootIds == null)
			throw new DataFormatException("Could not find ROOTS: line");

		// 2) hyperedges. remember where each node was first used as an antecedent
		HashMap<String, Integer> firstUse = new LinkedHashMap<String, Integer>();
		while ((line = br.readLine()) != null) {
			lineNum++;
			if (commentPat.matcher(line).matches())
				continue;
			String[] fields = fieldSepPat.split(line.trim(), -1);
			if (fields.length != 5)
				throw new DataFormatException("Expected 5 |||-separated fields but got "+fields.length+" in "+line, lineNum);
			String head = checkId(fields[0], lineNum);
			String lhs = fields[1];
			if (lhs.length() == 0)
				throw new DataFormatException("Empty left-hand side in "+line, lineNum);
			TargetRule rule;
			try {
				rule = TargetRule.parse(lhs, fields[2]);
			}
			catch (DataFormatException e) {
				throw new DataFormatException(e.getMessage(), lineNum, e);
			}
			List<ChartHypothesis> ants = new ArrayList<ChartHypothesis>();
			for (String id : fields[3].split("\\s+")) {
				if (id.length() == 0)
					continue;
				checkId(id, lineNum);
				ants.add(hg.getOrCreateNode(id));
				if (!firstUse.containsKey(id))
					firstUse.put(id, lineNum);
			}
			if (ants.size() != rule.getArity())
				throw new DataFormatException("Rule "+rule+" has "+rule.getArity()+" slots but "+ants.size()+" antecedents", lineNum);
			ScoreBreakdown feats = readFeatures(fields[4], lineNum);
			Hyperedge e;
			try {
				e = Hyperedge.weighted(rule, ants, feats, weights);
			}
			catch (ConfigureException ce) {
				throw new ConfigureException("line "+lineNum+": "+ce.getMessage(), ce);
			}
			hg.getOrCreateNode(head).addIncomingEdge(e);
			if (debug) Debug.debug(debug, "Read edge "+e+" into "+head);
		}

		// 3) every referenced node needs at least one way to be derived
		for (String id : firstUse.keySet()) {
			if (hg.getNode(id).getIncomingEdges().isEmpty())
				throw new DataFormatException("Antecedent "+id+" has no hyperedges", firstUse.get(id));
		}
		for (String id : rootIds) {
			ChartHypothesis r = hg.getNode(id);
			if (r == null || r.getIncomingEdges().isEmpty())
				throw new DataFormatException("Root "+id+" has no hyperedges", rootLine);
			hg.addRoot(r);
		}
		if (debug) Debug.debug(debug, "Read "+hg.getNumNodes()+" nodes, "+hg.getNumEdges()+" edges, "+rootIds.size()+" roots");
		return hg;
	}

	private String checkId(String id, int lineNum) throws DataFormatException {
		if (!idPat.matcher(id).matches())
			throw new DataFormatException("Bad node id \""+id+"\"", lineNum);
		return id;
	}

	private ScoreBreakdown readFeatures(String field, int lineNum) throws DataFormatException {
		LinkedHashMap<String, Double> feats = new LinkedHashMap<String, Double>();
		for (String tok : field.split("\\s+")) {
			if (tok.length() == 0)
				continue;
			Matcher m = featurePat.matcher(tok);
			if (!m.matches())
				throw new DataFormatException("Expected name=value but got "+tok, lineNum);
			double v;
			try {
				v = Double.parseDouble(m.group(2));
			}
			catch (NumberFormatException e) {
				throw new DataFormatException("Bad value for feature "+m.group(1)+": "+m.group(2), lineNum, e);
			}
			if (feats.put(m.group(1), v) != null)
				throw new DataFormatException("Feature "+m.group(1)+" given twice", lineNum);
		}
		return ScoreBreakdown.of(feats);
	}
}
