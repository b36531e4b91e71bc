package org.janelia.saalfeldlab.moco.registration;

/**
 * The registration engine exited with a non-zero code.
 */
public class EngineFailureException extends RegistrationEngineException {

	private static final long serialVersionUID = -1768425620290950391L;

	private final int exitCode;
	private final String stderr;

	public EngineFailureException(final int exitCode, final String stderr) {

		super("Registration engine exited with code " + exitCode + (stderr.isEmpty() ? "" : ": " + stderr.trim()));
		this.exitCode = exitCode;
		this.stderr = stderr;
	}

	public int getExitCode() {

		return exitCode;
	}

	public String getStderr() {

		return stderr;
	}
}
