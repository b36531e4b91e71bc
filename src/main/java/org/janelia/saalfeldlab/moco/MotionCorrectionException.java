package org.janelia.saalfeldlab.moco;

/**
 * Base class of all errors raised while motion correcting a dynamic series.
 * Subclasses distinguish the failures that abort a run from those that are
 * recorded per frame.
 */
public class MotionCorrectionException extends Exception {

	private static final long serialVersionUID = -3188217740414393052L;

	public MotionCorrectionException(final String message) {

		super(message);
	}

	public MotionCorrectionException(final String message, final Throwable cause) {

		super(message, cause);
	}
}
