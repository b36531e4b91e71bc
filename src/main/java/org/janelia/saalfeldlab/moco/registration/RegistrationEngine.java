package org.janelia.saalfeldlab.moco.registration;

import java.io.IOException;

import org.janelia.saalfeldlab.moco.transform.FrameTransform;
import org.janelia.saalfeldlab.moco.volume.Frame;

/**
 * Registers one moving frame to one fixed frame.  Implementations are
 * stateless and may be called concurrently for independent pairs.  They
 * never retry.
 */
public interface RegistrationEngine {

	/**
	 * @param moving
	 * @param fixed
	 * @param mode
	 * @param schedule
	 * @return the transform mapping fixed into moving physical coordinates
	 * @throws RegistrationEngineException if this pair cannot be registered
	 * @throws IOException if the job cannot be set up
	 * @throws InterruptedException if cancelled, nothing is returned then
	 */
	public FrameTransform register(
			final Frame moving,
			final Frame fixed,
			final RegistrationMode mode,
			final IterationSchedule schedule) throws RegistrationEngineException, IOException, InterruptedException;
}
