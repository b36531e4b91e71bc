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
package org.janelia.saalfeldlab.moco.similarity;

/**
 * Similarity of an ordered pair of frames.
 */
public class SimilarityScore {

	private final int firstIndex;
	private final int secondIndex;
	private final double value;

	public SimilarityScore(final int firstIndex, final int secondIndex, final double value) {

		this.firstIndex = firstIndex;
		this.secondIndex = secondIndex;
		this.value = value;
	}

	public int getFirstIndex() {

		return firstIndex;
	}

	public int getSecondIndex() {

		return secondIndex;
	}

	public double getValue() {

		return value;
	}

	@Override
	public String toString() {

		return String.format("(%d, %d): %.4f", firstIndex, secondIndex, value);
	}
}
