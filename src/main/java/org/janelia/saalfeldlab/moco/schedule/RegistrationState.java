package org.janelia.saalfeldlab.moco.schedule;

public enum RegistrationState {

	PENDING,
	REGISTERING,
	SUCCEEDED,
	FAILED,
	SKIPPED;

	public boolean isTerminal() {

		return this == SUCCEEDED || this == FAILED || this == SKIPPED;
	}
}
