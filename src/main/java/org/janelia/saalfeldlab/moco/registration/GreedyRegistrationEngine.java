/**
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.saalfeldlab.moco.registration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.saalfeldlab.moco.io.MetaImage;
import org.janelia.saalfeldlab.moco.transform.Affine3D;
import org.janelia.saalfeldlab.moco.transform.DisplacementField;
import org.janelia.saalfeldlab.moco.transform.FrameTransform;
import org.janelia.saalfeldlab.moco.util.Util;
import org.janelia.saalfeldlab.moco.volume.Frame;

/**
 * Registers frame pairs with the external
 * <a href="https://github.com/pyushkevich/greedy">greedy</a> binary.
 *
 * Every job runs in its own temporary directory that is removed when the
 * job ends, successfully or not.  Rigid and affine jobs run one affine
 * pass, deformable jobs run a deformable pass initialized with the result
 * of a 12 degrees of freedom affine pass.
 */
public class GreedyRegistrationEngine implements RegistrationEngine {

	public static final String DEFAULT_EXECUTABLE = "greedy";
	public static final String DEFAULT_METRIC = "NCC 2x2x2";

	static final String FIXED_FILE = "fixed.mhd";
	static final String MOVING_FILE = "moving.mhd";
	static final String AFFINE_FILE = "affine.mat";
	static final String WARP_FILE = "warp.mhd";
	static final String INVERSE_WARP_FILE = "inverse_warp.mhd";

	private final String executable;
	private final List<String> metric;
	private final int threads;
	private final Path temporaryRoot;
	private final CommandRunner runner;

	/**
	 * @param executable the greedy binary
	 * @param metric cost function and its parameters, e.g. "NCC 2x2x2"
	 * @param threads threads per job, 0 leaves the choice to greedy
	 * @param temporaryRoot parent of job directories, null for the system default
	 * @param runner
	 */
	public GreedyRegistrationEngine(
			final String executable,
			final String metric,
			final int threads,
			final Path temporaryRoot,
			final CommandRunner runner) {

		this.executable = executable;
		this.metric = Arrays.asList(metric.trim().split("\\s+"));
		this.threads = threads;
		this.temporaryRoot = temporaryRoot;
		this.runner = runner;
	}

	public GreedyRegistrationEngine() {

		this(DEFAULT_EXECUTABLE, DEFAULT_METRIC, 0, null, new ProcessCommandRunner());
	}

	@Override
	public FrameTransform register(
			final Frame moving,
			final Frame fixed,
			final RegistrationMode mode,
			final IterationSchedule schedule) throws RegistrationEngineException, IOException, InterruptedException {

		final Path work = temporaryRoot == null ?
				Files.createTempDirectory("greedy-") :
				Files.createTempDirectory(Files.createDirectories(temporaryRoot), "greedy-");
		try {
			final Path fixedPath = work.resolve(FIXED_FILE);
			final Path movingPath = work.resolve(MOVING_FILE);
			MetaImage.write(fixedPath, MetaImage.create(fixed.getVoxels(), fixed.getGeometry()));
			MetaImage.write(movingPath, MetaImage.create(moving.getVoxels(), moving.getGeometry()));

			final Path affinePath = work.resolve(AFFINE_FILE);
			execute(affineCommand(fixedPath, movingPath, mode, schedule, affinePath), work);
			final Affine3D affine = readAffine(affinePath);

			if (mode != RegistrationMode.DEFORMABLE)
				return FrameTransform.affine(moving.getIndex(), fixed.getIndex(), mode, affine, schedule);

			final Path warpPath = work.resolve(WARP_FILE);
			final Path inverseWarpPath = work.resolve(INVERSE_WARP_FILE);
			execute(deformableCommand(fixedPath, movingPath, schedule, affinePath, warpPath, inverseWarpPath), work);

			return new FrameTransform(
					moving.getIndex(),
					fixed.getIndex(),
					mode,
					affine,
					readField(warpPath),
					readField(inverseWarpPath),
					schedule);
		} finally {
			Util.deleteRecursively(work);
		}
	}

	public List<String> affineCommand(
			final Path fixed,
			final Path moving,
			final RegistrationMode mode,
			final IterationSchedule schedule,
			final Path affine) {

		final List<String> command = new ArrayList<>(Arrays.asList(
				executable,
				"-d", "3",
				"-a",
				"-i", fixed.toString(), moving.toString(),
				"-ia-image-centers",
				"-dof", Integer.toString(mode == RegistrationMode.RIGID ? 6 : 12),
				"-o", affine.toString(),
				"-n", schedule.toString(),
				"-m"));
		command.addAll(metric);
		addThreads(command);
		return command;
	}

	public List<String> deformableCommand(
			final Path fixed,
			final Path moving,
			final IterationSchedule schedule,
			final Path affine,
			final Path warp,
			final Path inverseWarp) {

		final List<String> command = new ArrayList<>(Arrays.asList(executable, "-d", "3", "-m"));
		command.addAll(metric);
		command.addAll(Arrays.asList(
				"-i", fixed.toString(), moving.toString(),
				"-it", affine.toString(),
				"-o", warp.toString(),
				"-oinv", inverseWarp.toString(),
				"-sv",
				"-n", schedule.toString()));
		addThreads(command);
		return command;
	}

	private void addThreads(final List<String> command) {

		if (threads > 0) {
			command.add("-threads");
			command.add(Integer.toString(threads));
		}
	}

	private void execute(final List<String> command, final Path work)
			throws EngineFailureException, IOException, InterruptedException {

		System.out.println(String.join(" ", command));
		final CommandResult result = runner.run(command, work);
		if (result.getExitCode() != 0)
			throw new EngineFailureException(result.getExitCode(), result.getStderr());
	}

	private static Affine3D readAffine(final Path path) throws EngineOutputCorruptException {

		try {
			return GreedyMatrixFormat.read(path);
		} catch (final IOException e) {
			throw new EngineOutputCorruptException("Invalid affine output: " + e.getMessage(), e);
		}
	}

	private static DisplacementField readField(final Path path) throws EngineOutputCorruptException {

		if (!Files.isRegularFile(path))
			throw new EngineOutputCorruptException("Warp field " + path.getFileName() + " was not written");
		try {
			return DisplacementField.fromMetaImage(MetaImage.read(path));
		} catch (final IOException | IllegalArgumentException e) {
			throw new EngineOutputCorruptException("Invalid warp field " + path.getFileName() + ": " + e.getMessage(), e);
		}
	}
}
