package org.janelia.saalfeldlab.moco.schedule;

import org.janelia.saalfeldlab.moco.MotionCorrectionException;

/**
 * A frame of a rolling registration failed, so no frame further from the
 * reference can be composed.
 */
public class RegistrationChainException extends MotionCorrectionException {

	private static final long serialVersionUID = 1948216037458227916L;

	private final int frameIndex;
	private final transient RegistrationLedger ledger;

	public RegistrationChainException(final int frameIndex, final RegistrationLedger ledger, final Throwable cause) {

		super("Rolling registration broke at frame " + frameIndex + ": " + cause.getMessage(), cause);
		this.frameIndex = frameIndex;
		this.ledger = ledger;
	}

	public int getFrameIndex() {

		return frameIndex;
	}

	/**
	 * @return the ledger at the time of failure
	 */
	public RegistrationLedger getLedger() {

		return ledger;
	}
}
