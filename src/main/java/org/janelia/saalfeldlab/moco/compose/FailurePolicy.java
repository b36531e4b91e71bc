package org.janelia.saalfeldlab.moco.compose;

/**
 * What composition does with frames whose registration failed.
 */
public enum FailurePolicy {

	/** write nothing and fail */
	ABORT,

	/** leave failed frames out of the 4D volume and record them */
	EXCLUDE
}
