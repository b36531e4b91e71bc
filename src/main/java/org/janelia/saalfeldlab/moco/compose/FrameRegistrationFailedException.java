package org.janelia.saalfeldlab.moco.compose;

import java.util.Arrays;

import org.janelia.saalfeldlab.moco.MotionCorrectionException;

/**
 * Frames failed to register and the failure policy does not allow to
 * continue without them.
 */
public class FrameRegistrationFailedException extends MotionCorrectionException {

	private static final long serialVersionUID = -2293815705125340946L;

	private final int[] failedIndices;

	public FrameRegistrationFailedException(final int[] failedIndices) {

		super("Registration failed for frames " + Arrays.toString(failedIndices));
		this.failedIndices = failedIndices.clone();
	}

	public int[] getFailedIndices() {

		return failedIndices.clone();
	}
}
