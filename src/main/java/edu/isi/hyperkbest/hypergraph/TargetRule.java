package edu.isi.hyperkbest.hypergraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import edu.isi.hyperkbest.DataFormatException;

/**
 * Target side of a translation rule: a left-hand side label and a sequence of
 * terminal words and non-terminal slots. Each slot is bound to one antecedent of
 * the hyperedge by its antecedent index, so the target order of slots may
 * differ from the antecedent order (reordering rules).
 */
public class TargetRule {

	// a non-terminal slot in the target template: [i] binds antecedent i
	private static final Pattern slotPat = Pattern.compile("\\[(\\d+)\\]");

	private final String lhs;
	private final String[] words;
	// position -> antecedent index, -1 for terminals
	private final int[] nonTermIndexMap;
	private final int arity;

	public TargetRule(String lhs, List<String> tokens) throws DataFormatException {
		this.lhs = lhs;
		words = tokens.toArray(new String[0]);
		nonTermIndexMap = new int[words.length];
		int slots = 0;
		for (int i = 0; i < words.length; i++) {
			Matcher m = slotPat.matcher(words[i]);
			if (m.matches()) {
				try {
					nonTermIndexMap[i] = Integer.parseInt(m.group(1));
				}
				catch (NumberFormatException e) {
					throw new DataFormatException("Slot "+words[i]+" out of range in "+this, -1, e);
				}
				slots++;
			}
			else
				nonTermIndexMap[i] = -1;
		}
		// every antecedent is bound exactly once
		boolean[] bound = new boolean[slots];
		for (int idx : nonTermIndexMap) {
			if (idx < 0)
				continue;
			if (idx >= slots)
				throw new DataFormatException("Slot ["+idx+"] out of range in "+this+"; only "+slots+" slots");
			if (bound[idx])
				throw new DataFormatException("Slot ["+idx+"] used twice in "+this);
			bound[idx] = true;
		}
		arity = slots;
	}

	// whitespace-separated template, e.g. "the [1] of [0]"
	public static TargetRule parse(String lhs, String template) throws DataFormatException {
		List<String> toks = new ArrayList<String>();
		for (String t : template.trim().split("\\s+"))
			if (t.length() > 0)
				toks.add(t);
		return new TargetRule(lhs, toks);
	}

	public String getLHS() {
		return lhs;
	}
	public int getSize() {
		return words.length;
	}
	public String getWord(int pos) {
		return words[pos];
	}
	public boolean isNonTerminal(int pos) {
		return nonTermIndexMap[pos] >= 0;
	}
	public int getNonTermIndex(int pos) {
		return nonTermIndexMap[pos];
	}
	public int getArity() {
		return arity;
	}

	public String toString() {
		return lhs+" -> "+String.join(" ", Arrays.asList(words));
	}
}
