package edu.isi.hyperkbest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import edu.isi.hyperkbest.features.ScoreBreakdown;
import edu.isi.hyperkbest.hypergraph.ChartHypothesis;
import edu.isi.hyperkbest.hypergraph.Hyperedge;
import edu.isi.hyperkbest.hypergraph.TargetRule;

// small hand-built hypergraphs for tests
final class Graphs {
    private Graphs() {
    }

    static ChartHypothesis node(String id) {
        return new ChartHypothesis(id);
    }

    // adds an edge "X -> target" with the given antecedents and a single feature "f"
    static Hyperedge edge(ChartHypothesis head, String target, double score, ChartHypothesis... ants)
            throws DataFormatException {
        Hyperedge e = new Hyperedge(TargetRule.parse("X", target), Arrays.asList(ants),
                ScoreBreakdown.of("f", score), score);
        head.addIncomingEdge(e);
        return e;
    }

    // a leaf with one terminal edge per score, words w0, w1, ...
    static ChartHypothesis leaf(String id, double... scores) throws DataFormatException {
        ChartHypothesis h = node(id);
        for (int i = 0; i < scores.length; i++)
            edge(h, id + "_" + i, scores[i]);
        return h;
    }

    static List<Double> scores(List<Derivation> ds) {
        List<Double> ret = new ArrayList<>();
        for (Derivation d : ds)
            ret.add(d.getScore());
        return ret;
    }

    static List<String> phrases(List<Derivation> ds) {
        List<String> ret = new ArrayList<>();
        for (Derivation d : ds)
            ret.add(ChartKBestExtractor.getOutputPhrase(d).toString());
        return ret;
    }
}
