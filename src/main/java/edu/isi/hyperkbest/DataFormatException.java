package edu.isi.hyperkbest;

/** for errors in the format of hypergraph or weight files. carries the offending line, if known */
public class DataFormatException extends Exception {

	private final int lineNumber;

	public DataFormatException(String message) {
		this(message, -1);
	}
	/** line is 1-based; negative if no line applies */
	public DataFormatException(String message, int line) {
		super(line < 0 ? message : "line "+line+": "+message);
		lineNumber = line;
	}
	public DataFormatException(String message, int line, Throwable cause) {
		super(line < 0 ? message : "line "+line+": "+message, cause);
		lineNumber = line;
	}
	public int getLineNumber() {
		return lineNumber;
	}
}
