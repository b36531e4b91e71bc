package org.janelia.saalfeldlab.moco.schedule;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

import org.janelia.saalfeldlab.moco.registration.RegistrationMode;

/**
 * How many engine jobs run at once.  Each job takes several cores and a
 * lot of memory by itself, so the job count is bounded by both.
 */
public class ResourceBudget {

	private ResourceBudget() {}

	/**
	 * @param mode
	 * @param cores available cores
	 * @param freeMemory available memory in bytes
	 * @param threadsPerJob threads per job, &lt;= 0 for the mode's default
	 * @param maxJobs upper bound, &lt;= 0 for none
	 * @return the number of concurrent jobs, at least 1
	 */
	public static int numJobs(
			final RegistrationMode mode,
			final int cores,
			final long freeMemory,
			final int threadsPerJob,
			final int maxJobs) {

		final int threads = threadsPerJob > 0 ? threadsPerJob : mode.getThreadsPerJob();
		final long byMemory = freeMemory / mode.getMemoryPerJob();
		final long byCores = cores / threads;

		int jobs = (int)Math.max(1, Math.min(byMemory, byCores));
		if (maxJobs > 0)
			jobs = Math.min(jobs, maxJobs);
		return jobs;
	}

	/**
	 * Budget for this machine.
	 */
	public static int numJobs(final RegistrationMode mode, final int threadsPerJob, final int maxJobs) {

		return numJobs(mode, Runtime.getRuntime().availableProcessors(), freeMemory(), threadsPerJob, maxJobs);
	}

	/**
	 * @return free physical memory if the platform reports it, the JVM's
	 *     maximum heap otherwise
	 */
	public static long freeMemory() {

		final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
		if (os instanceof com.sun.management.OperatingSystemMXBean)
			return ((com.sun.management.OperatingSystemMXBean)os).getFreeMemorySize();

		return Runtime.getRuntime().maxMemory();
	}
}
