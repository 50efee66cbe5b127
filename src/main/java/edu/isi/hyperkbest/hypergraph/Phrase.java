package edu.isi.hyperkbest.hypergraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// a concrete sequence of target words, as built by output reconstruction
public class Phrase {
	private final ArrayList<String> words;

	public Phrase() {
		words = new ArrayList<String>();
	}
	public void addWord(String w) {
		words.add(w);
	}
	public void append(Phrase p) {
		words.addAll(p.words);
	}
	public int getSize() {
		return words.size();
	}
	public String getWord(int pos) {
		return words.get(pos);
	}
	public List<String> getWords() {
		return Collections.unmodifiableList(words);
	}
	public boolean equals(Object o) {
		return (o instanceof Phrase) && words.equals(((Phrase)o).words);
	}
	public int hashCode() {
		return words.hashCode();
	}
	public String toString() {
		return String.join(" ", words);
	}
}
