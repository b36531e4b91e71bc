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
package org.janelia.saalfeldlab.moco.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import net.imglib2.util.Pair;
import net.imglib2.util.ValuePair;

public class Util {

	private Util() {}

	/**
	 * Submit all tasks and wait for them.
	 *
	 * @throws InterruptedException if interrupted while waiting, pending
	 *     tasks are cancelled
	 * @throws ExecutionException if a task failed, pending tasks are
	 *     cancelled
	 */
	public static void invokeAll(final List<Callable<Void>> tasks, final ExecutorService service)
			throws InterruptedException, ExecutionException {

		final List<Future<Void>> futures = new ArrayList<>();
		try {
			for (final Callable<Void> task : tasks)
				futures.add(service.submit(task));
			for (final Future<Void> future : futures)
				future.get();
		} finally {
			for (final Future<Void> future : futures)
				future.cancel(true);
		}
	}

	public static final ArrayList<Pair<Long, Long>> divideIntoPortions(final long imageSize) {

		return divideIntoPortions(imageSize, 64l * 64l * 64l);
	}

	public static final ArrayList<Pair<Long, Long>> divideIntoPortions(final long imageSize, final long defaultChunkLength) {

		final int numThreads = Runtime.getRuntime().availableProcessors();
		int numPortions;

		if (imageSize <= numThreads)
			numPortions = (int)imageSize;
		else
			numPortions = Math.max(numThreads, (int)(imageSize / defaultChunkLength));

		final ArrayList<Pair<Long, Long>> portions = new ArrayList<>();

		if (imageSize == 0)
			return portions;

		long threadChunkSize = imageSize / numPortions;

		while (threadChunkSize == 0) {
			--numPortions;
			threadChunkSize = imageSize / numPortions;
		}

		final long threadChunkMod = imageSize % numPortions;

		for (int portionID = 0; portionID < numPortions; ++portionID) {

			final long startPosition = portionID * threadChunkSize;

			// the last portion takes the remainder
			final long loopSize;
			if (portionID == numPortions - 1)
				loopSize = threadChunkSize + threadChunkMod;
			else
				loopSize = threadChunkSize;

			portions.add(new ValuePair<>(startPosition, loopSize));
		}

		return portions;
	}

	/**
	 * Delete a file or directory tree if it exists.
	 */
	public static void deleteRecursively(final Path path) throws IOException {

		if (!Files.exists(path))
			return;

		final List<Path> paths;
		try (final Stream<Path> walk = Files.walk(path)) {
			paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
		}
		for (final Path p : paths)
			Files.deleteIfExists(p);
	}

	/**
	 * @return a zero padded frame label, e.g. <code>frame-0007</code>
	 */
	public static String frameLabel(final int index) {

		return String.format("frame-%04d", index);
	}
}
