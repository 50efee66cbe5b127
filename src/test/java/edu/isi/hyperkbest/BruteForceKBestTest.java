package edu.isi.hyperkbest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import edu.isi.hyperkbest.hypergraph.ChartHypothesis;
import edu.isi.hyperkbest.hypergraph.Hyperedge;
import edu.isi.hyperkbest.hypergraph.Hypothesis;

// compares lazy extraction against full enumeration on small random DAGs
final class BruteForceKBestTest {

    private static final int LIMIT = 3000;

    @Test
    void lazyMatchesEnumeration() throws Exception {
        int checked = 0;
        for (long seed = 1; checked < 40 && seed < 2000; seed++) {
            Random r = new Random(seed);
            List<ChartHypothesis> nodes = randomDag(r, 3 + r.nextInt(4));
            List<Hypothesis> roots = new ArrayList<>();
            roots.add(nodes.get(nodes.size() - 1));
            if (nodes.size() > 3 && r.nextBoolean())
                roots.add(nodes.get(nodes.size() - 2));
            if (count(roots) > LIMIT)
                continue;

            List<Double> expected = new ArrayList<>();
            for (Hypothesis h : roots)
                expected.addAll(enumerate(h));
            expected.sort(Collections.reverseOrder());

            int k = 1 + r.nextInt(60);
            List<Derivation> ds = new ChartKBestExtractor().extract(roots, k);
            final long s = seed;
            assertEquals(Math.min(k, expected.size()), ds.size(), () -> "seed " + s);
            assertEquals(expected.subList(0, ds.size()), Graphs.scores(ds), () -> "seed " + s);
            assertEquals(ds.size(), new HashSet<>(ds).size(), () -> "seed " + s);
            for (String p : Graphs.phrases(ds))
                assertFalse(p.contains("["), p);
            checked++;
        }
        assertTrue(checked >= 20, "only " + checked + " graphs small enough to enumerate");
    }

    // node i only uses nodes below it, so the graph is acyclic
    private static List<ChartHypothesis> randomDag(Random r, int n) throws Exception {
        List<ChartHypothesis> nodes = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            ChartHypothesis h = Graphs.node("n" + i);
            int edges = 1 + r.nextInt(3);
            for (int e = 0; e < edges; e++) {
                int arity = i == 0 ? 0 : r.nextInt(Math.min(2, i) + 1);
                ChartHypothesis[] ants = new ChartHypothesis[arity];
                StringBuilder target = new StringBuilder("w" + i + "_" + e);
                for (int a = 0; a < arity; a++)
                    ants[a] = nodes.get(r.nextInt(i));
                // reverse the slots half the time
                boolean reorder = r.nextBoolean();
                for (int a = 0; a < arity; a++)
                    target.append(" [").append(reorder ? arity - 1 - a : a).append(']');
                Graphs.edge(h, target.toString(), r.nextInt(11) - 5, ants);
            }
            nodes.add(h);
        }
        return nodes;
    }

    private static long count(List<Hypothesis> roots) {
        long total = 0;
        for (Hypothesis h : roots)
            total += count(h);
        return total;
    }

    private static long count(Hypothesis h) {
        long total = 0;
        for (Hyperedge e : h.getIncomingEdges()) {
            long prod = 1;
            for (Hypothesis ant : e.getAntecedents())
                prod = Math.min(prod * count(ant), LIMIT + 1);
            total = Math.min(total + prod, LIMIT + 1);
        }
        return total;
    }

    // every derivation score of h
    private static List<Double> enumerate(Hypothesis h) {
        List<Double> ret = new ArrayList<>();
        for (Hyperedge e : h.getIncomingEdges()) {
            List<Double> partial = new ArrayList<>();
            partial.add(e.getLocalScore());
            for (Hypothesis ant : e.getAntecedents()) {
                List<Double> sub = enumerate(ant);
                List<Double> next = new ArrayList<>();
                for (double p : partial)
                    for (double q : sub)
                        next.add(p + q);
                partial = next;
            }
            ret.addAll(partial);
        }
        return ret;
    }
}
