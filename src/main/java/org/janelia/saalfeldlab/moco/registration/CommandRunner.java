package org.janelia.saalfeldlab.moco.registration;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs an external command to completion.
 */
public interface CommandRunner {

	/**
	 * Run a command and wait for it to exit.  If the calling thread is
	 * interrupted, the process is killed and {@link InterruptedException}
	 * thrown.
	 *
	 * @param command the executable followed by its arguments
	 * @param workingDirectory
	 * @return
	 */
	public CommandResult run(final List<String> command, final Path workingDirectory)
			throws IOException, InterruptedException;
}
