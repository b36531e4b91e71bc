package org.janelia.saalfeldlab.moco.registration;

/**
 * The registration engine succeeded but an output file is missing or
 * cannot be parsed.
 */
public class EngineOutputCorruptException extends RegistrationEngineException {

	private static final long serialVersionUID = 3172650963325106548L;

	public EngineOutputCorruptException(final String message) {

		super(message);
	}

	public EngineOutputCorruptException(final String message, final Throwable cause) {

		super(message, cause);
	}
}
