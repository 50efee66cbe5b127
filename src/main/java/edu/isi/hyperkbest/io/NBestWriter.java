package edu.isi.hyperkbest.io;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

import edu.isi.hyperkbest.ChartKBestExtractor;
import edu.isi.hyperkbest.Derivation;
import edu.isi.hyperkbest.Rounding;
import edu.isi.hyperkbest.features.ScoreBreakdown;

// writes derivations as n-best lines: id ||| phrase ||| features ||| score [||| tree]
public class NBestWriter {
	private static final int PLACES = 6;

	private final Writer w;
	private final boolean printTree;

	public NBestWriter(Writer w, boolean printTree) {
		this.w = w;
		this.printTree = printTree;
	}

	public static String format(int id, Derivation d, boolean printTree) {
		StringBuilder sb = new StringBuilder();
		sb.append(id).append(" ||| ");
		sb.append(ChartKBestExtractor.getOutputPhrase(d));
		sb.append(" ||| ");
		sb.append(formatBreakdown(d.getScoreBreakdown()));
		sb.append(" ||| ");
		sb.append(Rounding.round(d.getScore(), PLACES));
		if (printTree)
			sb.append(" ||| ").append(ChartKBestExtractor.getOutputTree(d));
		return sb.toString();
	}

	static String formatBreakdown(ScoreBreakdown b) {
		StringBuilder sb = new StringBuilder();
		for (String name : b.getNames()) {
			if (sb.length() > 0)
				sb.append(' ');
			sb.append(name).append('=').append(Rounding.round(b.get(name), PLACES));
		}
		return sb.toString();
	}

	public void write(int id, List<Derivation> nbest) throws IOException {
		for (Derivation d : nbest)
			w.write(format(id, d, printTree)+"\n");
		w.flush();
	}
}
