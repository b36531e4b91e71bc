package org.janelia.saalfeldlab.moco.registration;

public class CommandResult {

	private final int exitCode;
	private final String stdout;
	private final String stderr;

	public CommandResult(final int exitCode, final String stdout, final String stderr) {

		this.exitCode = exitCode;
		this.stdout = stdout;
		this.stderr = stderr;
	}

	public int getExitCode() {

		return exitCode;
	}

	public String getStdout() {

		return stdout;
	}

	public String getStderr() {

		return stderr;
	}
}
