package com.github.micycle1.mirrorsurf4j;

/**
 * Raised for request parameters outside what the model supports, such as an
 * aberration basis order beyond the tabulated maximum. Always thrown before
 * any numeric work starts.
 */
public class ConfigurationException extends MirrorModelException {

	private static final long serialVersionUID = 1L;

	public ConfigurationException(String message) {
		super(message);
	}
}
