package org.janelia.saalfeldlab.moco.schedule;

/**
 * How frames find their way into the reference frame.
 */
public enum ReferenceStrategy {

	/** every frame registers to the reference, frames are independent */
	FIXED,

	/** every frame registers to its neighbour towards the reference, transforms are composed */
	ROLLING
}
