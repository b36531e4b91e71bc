package org.janelia.saalfeldlab.moco.registration;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs commands with {@link ProcessBuilder}.  Output streams are redirected
 * into files in the working directory so that verbose engines cannot block
 * on a full pipe.
 */
public class ProcessCommandRunner implements CommandRunner {

	@Override
	public CommandResult run(final List<String> command, final Path workingDirectory)
			throws IOException, InterruptedException {

		final File stdout = workingDirectory.resolve("stdout.log").toFile();
		final File stderr = workingDirectory.resolve("stderr.log").toFile();

		final Process process = new ProcessBuilder(command)
				.directory(workingDirectory.toFile())
				.redirectOutput(stdout)
				.redirectError(stderr)
				.start();

		final int exitCode;
		try {
			exitCode = process.waitFor();
		} catch (final InterruptedException e) {
			process.destroyForcibly();
			throw e;
		}

		return new CommandResult(
				exitCode,
				new String(Files.readAllBytes(stdout.toPath()), StandardCharsets.UTF_8),
				new String(Files.readAllBytes(stderr.toPath()), StandardCharsets.UTF_8));
	}
}
