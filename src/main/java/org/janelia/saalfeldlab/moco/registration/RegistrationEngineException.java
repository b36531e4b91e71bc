package org.janelia.saalfeldlab.moco.registration;

import org.janelia.saalfeldlab.moco.MotionCorrectionException;

/**
 * A registration job failed.  Affects one frame pair only.
 */
public class RegistrationEngineException extends MotionCorrectionException {

	private static final long serialVersionUID = 5531046117036318215L;

	public RegistrationEngineException(final String message) {

		super(message);
	}

	public RegistrationEngineException(final String message, final Throwable cause) {

		super(message, cause);
	}
}
