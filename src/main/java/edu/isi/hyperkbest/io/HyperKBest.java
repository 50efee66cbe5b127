package edu.isi.hyperkbest.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.Date;
import java.util.Iterator;
import java.util.List;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.IntegerStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

import edu.isi.hyperkbest.ChartKBestExtractor;
import edu.isi.hyperkbest.ConfigureException;
import edu.isi.hyperkbest.DataFormatException;
import edu.isi.hyperkbest.Debug;
import edu.isi.hyperkbest.Derivation;
import edu.isi.hyperkbest.Semiring;
import edu.isi.hyperkbest.UnusualConditionException;
import edu.isi.hyperkbest.features.FeatureWeights;
import edu.isi.hyperkbest.hypergraph.Hypergraph;

// command line options, etc. reads one hypergraph per input file and writes its n-best list
public class HyperKBest {
	// version number. change this when updating!
	static final String VERSION = "1.0";

	// everything having to do with the JSAP parameters and config exceptions based on this.
	// Sets the jsap object
	private static JSAPResult processParameters(JSAP jsap, String[] argv) throws ConfigureException, JSAPException {

		// HELP OPTION
		Switch helpsw = new Switch("help",
				'h',
				"help",
		"print this help message");
		jsap.registerParameter(helpsw);

		// format of the input (and output data) - assumed utf-8 but can be changed here
		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of input and output files, if other than utf-8. Use the same "+
		"naming you would use if specifying this charset in a java program");
		jsap.registerParameter(encodingopt);

		// semiring specification: how do scores combine and which is better?
		FlaggedOption semiringtype =
			new FlaggedOption("semiring",
					EnumeratedStringParser.getParser("maxplus; tropical"),
					"maxplus",
					true,
					'm',
					"semiring",
					"type of scores: maxplus (log-linear model scores, higher is better) or tropical "+
			"(costs, lower is better)");
		jsap.registerParameter(semiringtype);

		// feature weights. without them every feature has weight 1
		FlaggedOption weightsopt = new FlaggedOption("weights",
				FileStringParser.getParser(),
				null,
				false,
				'w',
				"weights",
				"file of \"name value\" feature weights. Every feature in the hypergraph must be listed. "+
		"If absent, all features have weight 1");
		jsap.registerParameter(weightsopt);

		FlaggedOption kopt = new FlaggedOption("kbest",
				IntegerStringParser.getParser(),
				"1",
				true,
				'k',
				"kbest",
		"return the <kbest> highest ranked derivations of each hypergraph");
		jsap.registerParameter(kopt);

		// only keep the first derivation of each output string
		Switch distinctsw = new Switch("distinct",
				'u',
				"distinct",
		"only return derivations with distinct output strings");
		jsap.registerParameter(distinctsw);

		FlaggedOption factoropt = new FlaggedOption("factor",
				IntegerStringParser.getParser(),
				"20",
				true,
				JSAP.NO_SHORTFLAG,
				"nbest-factor",
				"with --distinct, examine up to <factor> times <kbest> derivations to find distinct ones. Default is 20");
		jsap.registerParameter(factoropt);

		Switch treesw = new Switch("tree",
				't',
				"tree",
		"also print the derivation tree of each output");
		jsap.registerParameter(treesw);

		FlaggedOption timeopt = new FlaggedOption("time",
				IntegerStringParser.getParser(),
				null,
				false,
				JSAP.NO_SHORTFLAG,
				"timedebug",
				"Print timing information to stderr at a variety of levels: 0+ for "+
		"total operation, 1+ for each input file, 2+ for each processing stage");
		jsap.registerParameter(timeopt);

		// output file - if specified, whatever is written is written here. otherwise to stdout
		FlaggedOption outfileopt =
			new FlaggedOption("outfile",
					FileStringParser.getParser(),
					null,
					false,
					'o',
					"outputfile",
					"file to write n-best lists to. If absent, writing is done "+
			"to stdout");
		jsap.registerParameter(outfileopt);

		// set of input files, one hypergraph (sentence) each
		UnflaggedOption infileopt = new UnflaggedOption("infiles",
				FileStringParser.getParser(),
				null,
				true,
				true,
				"list of hypergraph files. Each is one sentence; sentence ids in the output "+
		"count from 0 in the order given");
		jsap.registerParameter(infileopt);

		JSAPResult config = jsap.parse(argv);
		if (config.success()) {
			if (config.getInt("kbest") < 0)
				throw new ConfigureException("--kbest must not be negative");
			if (config.getInt("factor") < 1)
				throw new ConfigureException("--nbest-factor must be at least 1");
			if (config.userSpecified("factor") && !config.getBoolean("distinct"))
				throw new ConfigureException("--nbest-factor only makes sense with --distinct");
		}
		return config;
	}

	public static FeatureWeights readWeights(File f, String encoding) throws IOException, DataFormatException {
		BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(f), encoding));
		try {
			return FeatureWeights.read(br);
		}
		finally {
			br.close();
		}
	}

	// n-best list of one hypergraph, with its own extractor
	static List<Derivation> nbest(Hypergraph hg, Semiring semiring, int k, boolean distinct, int factor, int timeLevel)
			throws UnusualConditionException {
		Date preBestTime = new Date();
		hg.computeBestScores(semiring);
		Date preKBestTime = new Date();
		Debug.dbtime(timeLevel, 2, preBestTime, preKBestTime, "compute best scores");
		ChartKBestExtractor extractor = new ChartKBestExtractor(semiring);
		List<Derivation> ret;
		if (distinct)
			ret = extractor.extractDistinct(hg.getRankedRoots(), k, factor);
		else
			ret = extractor.extract(hg.getRankedRoots(), k);
		Debug.dbtime(timeLevel, 2, preKBestTime, new Date(), "obtain the kbest derivations");
		if (ret.size() < k)
			Debug.warn("Returning "+ret.size()+" derivations; "+k+" requested");
		return ret;
	}

	/**
	 * Runs with the given arguments, writing n-best lists to defaultOut unless an
	 * output file is given (System.out if defaultOut is null).
	 * @return process exit code
	 */
	public static int run(String[] argv, Writer defaultOut) {
		boolean debug = false;
		Date startTime = new Date();
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		int timeLevel = -1;

		// 1) Set up all parameters. Die on bad combinations.
		try {
			config = processParameters(jsap, argv);
		}
		catch (JSAPException e) {
			System.err.println("Options improperly configured: "+e.getMessage());
			System.err.println("Try 'hyperkbest -h' for a detailed help message");
			return 1;
		}
		catch (ConfigureException e) {
			System.err.println("Options improperly configured: "+e.getMessage());
			System.err.println("Try 'hyperkbest -h' for a detailed help message");
			return 1;
		}

		if (config.contains("help") && config.getBoolean("help")) {
			Debug.prettyDebug("Usage: hyperkbest ");
			Debug.prettyDebug("             "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			return 0;
		}

		if (!config.success()) {
			for (Iterator<?> errs = config.getErrorMessageIterator(); errs.hasNext();) {
				System.err.println("Error: " + errs.next());
			}
			System.err.println("Usage: hyperkbest ");
			System.err.println("             "+jsap.getUsage());
			return 1;
		}

		String encoding = config.getString("encoding");
		int k = config.getInt("kbest");
		boolean distinct = config.getBoolean("distinct");
		int factor = config.getInt("factor");
		if (config.contains("time"))
			timeLevel = config.getInt("time");
		File[] infiles = config.getFileArray("infiles");
		File outfile = config.contains("outfile") ? config.getFile("outfile") : null;

		// 2) read weights, then each hypergraph in turn, writing as we go
		Writer w = null;
		try {
			Semiring semiring = Semiring.get(config.getString("semiring"));
			FeatureWeights weights = FeatureWeights.uniform();
			if (config.contains("weights"))
				weights = readWeights(config.getFile("weights"), encoding);
			if (debug) Debug.debug(debug, "Read "+weights.size()+" weights; semiring is "+semiring);

			if (outfile != null)
				w = new OutputStreamWriter(new FileOutputStream(outfile), encoding);
			else if (defaultOut != null)
				w = defaultOut;
			else
				w = new OutputStreamWriter(System.out, encoding);
			NBestWriter out = new NBestWriter(w, config.getBoolean("tree"));
			HypergraphReader reader = new HypergraphReader(weights);

			for (int id = 0; id < infiles.length; id++) {
				Date preReadTime = new Date();
				Hypergraph hg = reader.read(infiles[id].getPath(), encoding);
				Date postReadTime = new Date();
				Debug.dbtime(timeLevel, 2, preReadTime, postReadTime, "read "+infiles[id]);
				out.write(id, nbest(hg, semiring, k, distinct, factor, timeLevel));
				Debug.dbtime(timeLevel, 1, preReadTime, new Date(), "sentence "+id);
			}
		}
		catch (ConfigureException e) {
			System.err.println("Configuration problem: "+e.getMessage());
			return 1;
		}
		catch (FileNotFoundException e) {
			System.err.println("Input file not found: "+e.getMessage());
			return 1;
		}
		catch (DataFormatException e) {
			System.err.println("Syntax error while reading input file: "+e.getMessage());
			return 1;
		}
		catch (UnusualConditionException e) {
			System.err.println("Malformed hypergraph: "+e.getMessage());
			return 1;
		}
		catch (IOException e) {
			System.err.println("Problem processing input file: "+e.getMessage());
			return 1;
		}
		finally {
			if (w != null && outfile != null) {
				try {
					w.close();
				}
				catch (IOException e) {
					System.err.println("Couldn't close "+outfile+": "+e.getMessage());
				}
			}
		}
		Debug.dbtime(timeLevel, 0, startTime, new Date(), "total operation");
		return 0;
	}

	public static void main(String argv[]) {
		Debug.prettyDebug("This is hyperkbest, version "+VERSION);
		System.exit(run(argv, null));
	}
}
