package org.janelia.saalfeldlab.moco.registration;

import java.util.Locale;

/**
 * Registration model, fixed for a whole run.  Each mode knows the degrees
 * of freedom of its linear part and the resources one engine job needs.
 */
public enum RegistrationMode {

	RIGID(6, 4, 2),
	AFFINE(12, 8, 4),
	DEFORMABLE(12, 16, 8);

	private static final long GIGABYTE = 1024L * 1024L * 1024L;

	private final int degreesOfFreedom;
	private final int memoryGigabytes;
	private final int threads;

	private RegistrationMode(final int degreesOfFreedom, final int memoryGigabytes, final int threads) {

		this.degreesOfFreedom = degreesOfFreedom;
		this.memoryGigabytes = memoryGigabytes;
		this.threads = threads;
	}

	public int getDegreesOfFreedom() {

		return degreesOfFreedom;
	}

	/**
	 * @return memory one engine job needs in bytes
	 */
	public long getMemoryPerJob() {

		return memoryGigabytes * GIGABYTE;
	}

	/**
	 * @return threads one engine job uses
	 */
	public int getThreadsPerJob() {

		return threads;
	}

	/**
	 * @return lower case name as used in file paths
	 */
	public String getName() {

		return name().toLowerCase(Locale.ROOT);
	}
}
