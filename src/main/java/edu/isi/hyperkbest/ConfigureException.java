package edu.isi.hyperkbest;

/** for errors in the configuration: bad option combinations, unknown features in a weight file, etc. */
public class ConfigureException extends Exception {
	public ConfigureException(String message) { super(message); }
	public ConfigureException(String message, Throwable cause) { super(message, cause); }
}
