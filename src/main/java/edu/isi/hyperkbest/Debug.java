package edu.isi.hyperkbest;

import java.util.Date;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// debugging things. messages are routed to an slf4j logger named for the calling class
public class Debug {

	private static final String PRETTY = "hyperkbest";

	private static final ConcurrentHashMap<String, Logger> loggers = new ConcurrentHashMap<String, Logger>();

	private static Logger getLogger(String name) {
		Logger l = loggers.get(name);
		if (l == null) {
			l = LoggerFactory.getLogger(name);
			Logger prev = loggers.putIfAbsent(name, l);
			if (prev != null)
				l = prev;
		}
		return l;
	}

	// stuff we always print
	public static void prettyDebug(String s) {
		getLogger(PRETTY).info(s);
	}

	// warnings that are not errors, e.g. returning fewer items than requested
	public static void warn(String s) {
		getLogger(PRETTY).warn(s);
	}

	// true debugging stuff
	public static void debug(boolean d, String s) {
		if (!d)
			return;
		StackTraceElement caller = new Throwable().getStackTrace()[1];
		debug(caller, s);
	}
	private static void debug(StackTraceElement caller, String s) {
		// explicitly requested output goes out at info so the default binding shows it
		getLogger(caller.getClassName()).info(caller.getMethodName()+" : "+s);
	}

	// print time debug info if the level is proper
	public static void dbtime(int currlevel, int needlevel, Date pta, Date ptb, String msg) {
		if (currlevel < needlevel)
			return;
		long x = ptb.getTime() - pta.getTime();
		getLogger(PRETTY).info(msg+": "+x+" ms");
	}
}
