package org.janelia.saalfeldlab.moco;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.janelia.saalfeldlab.moco.schedule.RegistrationLedger;
import org.janelia.saalfeldlab.moco.schedule.RegistrationOutcome;
import org.janelia.saalfeldlab.moco.schedule.RegistrationState;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Counts of a run's frame outcomes.  Serialized with gson.
 */
public class RunSummary {

	public static class FrameFailure {

		public int index;
		public String reason;

		public FrameFailure(final int index, final String reason) {

			this.index = index;
			this.reason = reason;
		}
	}

	public int frames;
	public int referenceIndex;
	public int startIndex;
	public int succeeded;
	public int failed;
	public int skipped;
	public int engineInvocations;
	public boolean complete;
	public List<FrameFailure> failures = new ArrayList<>();

	public static RunSummary create(
			final RegistrationLedger ledger,
			final int referenceIndex,
			final int startIndex,
			final int engineInvocations,
			final boolean complete) {

		final RunSummary summary = new RunSummary();
		summary.frames = ledger.size();
		summary.referenceIndex = referenceIndex;
		summary.startIndex = startIndex;
		summary.succeeded = ledger.count(RegistrationState.SUCCEEDED);
		summary.failed = ledger.count(RegistrationState.FAILED);
		summary.skipped = ledger.count(RegistrationState.SKIPPED);
		summary.engineInvocations = engineInvocations;
		summary.complete = complete;
		for (final int i : ledger.indices(RegistrationState.FAILED)) {
			final RegistrationOutcome outcome = ledger.getOutcome(i);
			summary.failures.add(new FrameFailure(i, outcome.getReason()));
		}
		return summary;
	}

	public void write(final Path path) throws IOException {

		final Gson gson = new GsonBuilder().setPrettyPrinting().create();
		Files.createDirectories(path.toAbsolutePath().getParent());
		Files.write(path, gson.toJson(this).getBytes(StandardCharsets.UTF_8));
	}

	@Override
	public String toString() {

		final StringBuilder builder = new StringBuilder();
		builder.append(frames).append(" frames, reference ").append(referenceIndex).append(", start ").append(startIndex).append('\n');
		builder.append(succeeded).append(" succeeded, ").append(failed).append(" failed, ").append(skipped).append(" skipped");
		for (final FrameFailure failure : failures)
			builder.append("\n  frame ").append(failure.index).append(" failed: ").append(failure.reason);
		return builder.toString();
	}
}
