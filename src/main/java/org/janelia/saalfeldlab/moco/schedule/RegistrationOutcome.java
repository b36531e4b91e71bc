package org.janelia.saalfeldlab.moco.schedule;

import org.janelia.saalfeldlab.moco.transform.FrameTransform;

/**
 * Terminal result of one frame.
 */
public class RegistrationOutcome {

	private final RegistrationState state;
	private final FrameTransform transform;
	private final String reason;
	private final Exception error;

	private RegistrationOutcome(
			final RegistrationState state,
			final FrameTransform transform,
			final String reason,
			final Exception error) {

		this.state = state;
		this.transform = transform;
		this.reason = reason;
		this.error = error;
	}

	public static RegistrationOutcome succeeded(final FrameTransform transform) {

		return new RegistrationOutcome(RegistrationState.SUCCEEDED, transform, null, null);
	}

	/**
	 * @param reason
	 * @param transform identity for the reference, null otherwise
	 */
	public static RegistrationOutcome skipped(final String reason, final FrameTransform transform) {

		return new RegistrationOutcome(RegistrationState.SKIPPED, transform, reason, null);
	}

	public static RegistrationOutcome failed(final Exception error) {

		return new RegistrationOutcome(RegistrationState.FAILED, null, error.getMessage(), error);
	}

	public RegistrationState getState() {

		return state;
	}

	public FrameTransform getTransform() {

		return transform;
	}

	public String getReason() {

		return reason;
	}

	public Exception getError() {

		return error;
	}

	@Override
	public String toString() {

		return reason == null ? state.toString() : state + " (" + reason + ")";
	}
}
