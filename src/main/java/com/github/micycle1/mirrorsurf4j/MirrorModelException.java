package com.github.micycle1.mirrorsurf4j;

/**
 * Base type of the failures raised while modelling a mirror surface.
 * <p>
 * All model failures are fatal for the request that raised them; nothing is
 * retried and no state is shared between requests.
 */
public class MirrorModelException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public MirrorModelException(String message) {
		super(message);
	}

	public MirrorModelException(String message, Throwable cause) {
		super(message, cause);
	}
}
