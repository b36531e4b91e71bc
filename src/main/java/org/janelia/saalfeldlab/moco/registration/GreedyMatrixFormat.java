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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.saalfeldlab.moco.transform.Affine3D;

/**
 * Plain text 4x4 matrices as read and written by greedy.  Greedy matrices
 * live in RAS physical space while volumes and transforms here use ITK's
 * LPS space, both map fixed into moving coordinates.
 */
public class GreedyMatrixFormat {

	private static final double[] RAS_LPS = new double[]{-1, -1, 1};

	private GreedyMatrixFormat() {}

	/**
	 * Conjugate with diag(-1, -1, 1).  The conversion is its own inverse.
	 *
	 * @param affine in RAS (LPS)
	 * @return the same transform in LPS (RAS)
	 */
	public static Affine3D flipRasLps(final Affine3D affine) {

		final Affine3D flipped = new Affine3D();
		for (int r = 0; r < 3; ++r) {
			for (int c = 0; c < 3; ++c)
				flipped.set(RAS_LPS[r] * affine.get(r, c) * RAS_LPS[c], r, c);
			flipped.set(RAS_LPS[r] * affine.get(r, 3), r, 3);
		}
		return flipped;
	}

	/**
	 * Parse a greedy matrix.
	 *
	 * @param text 4x4 (or the upper 3x4) values, row by row
	 * @return the transform in LPS
	 */
	public static Affine3D parse(final String text) {

		final String[] tokens = text.trim().split("\\s+");
		if (tokens.length != 16 && tokens.length != 12)
			throw new IllegalArgumentException("Expected a 4x4 matrix but found " + tokens.length + " values");

		final Affine3D ras = new Affine3D();
		for (int r = 0; r < 3; ++r)
			for (int c = 0; c < 4; ++c) {
				final double value = Double.parseDouble(tokens[r * 4 + c]);
				if (!Double.isFinite(value))
					throw new IllegalArgumentException("Matrix entry (" + r + ", " + c + ") is " + value);
				ras.set(value, r, c);
			}

		return flipRasLps(ras);
	}

	public static Affine3D read(final Path path) throws IOException {

		if (!Files.isRegularFile(path))
			throw new IOException("Matrix file " + path + " does not exist");

		try {
			return parse(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
		} catch (final IllegalArgumentException e) {
			throw new IOException("Cannot parse matrix file " + path, e);
		}
	}

	/**
	 * @param lps transform in LPS
	 * @return greedy's text representation in RAS
	 */
	public static String format(final Affine3D lps) {

		final Affine3D ras = flipRasLps(lps);
		final StringBuilder builder = new StringBuilder();
		for (int r = 0; r < 3; ++r) {
			for (int c = 0; c < 4; ++c) {
				if (c > 0)
					builder.append(' ');
				builder.append(ras.get(r, c));
			}
			builder.append('\n');
		}
		builder.append("0 0 0 1\n");
		return builder.toString();
	}

	public static void write(final Path path, final Affine3D lps) throws IOException {

		Files.write(path, format(lps).getBytes(StandardCharsets.UTF_8));
	}
}
