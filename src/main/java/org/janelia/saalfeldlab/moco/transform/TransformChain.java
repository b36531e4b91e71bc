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
package org.janelia.saalfeldlab.moco.transform;

import java.util.Arrays;

/**
 * Links every registered frame to the frame it was registered to and
 * composes the transform from the reference into any frame by walking the
 * links.  Frames are addressed by index into fixed size arrays, a frame
 * without a link is either the reference or passes through unchanged.
 *
 * For a path i &#x2192; j &#x2192; ... &#x2192; reference, the transform
 * from reference into frame i coordinates is
 * T(i&#x2192;j) &#x2218; T(j&#x2192;reference).
 */
public class TransformChain {

	private static final int UNLINKED = -1;

	private final int referenceIndex;
	private final int[] fixedIndices;
	private final FrameTransform[] links;

	public TransformChain(final int numFrames, final int referenceIndex) {

		if (referenceIndex < 0 || referenceIndex >= numFrames)
			throw new IllegalArgumentException("Reference " + referenceIndex + " is not one of " + numFrames + " frames");

		this.referenceIndex = referenceIndex;
		fixedIndices = new int[numFrames];
		Arrays.fill(fixedIndices, UNLINKED);
		links = new FrameTransform[numFrames];
	}

	public int getReferenceIndex() {

		return referenceIndex;
	}

	public int size() {

		return links.length;
	}

	/**
	 * Link the moving frame of a transform to its fixed frame.
	 */
	public void link(final FrameTransform transform) {

		final int moving = transform.getMovingIndex();
		if (moving == referenceIndex)
			throw new IllegalArgumentException("The reference frame " + referenceIndex + " cannot be linked");
		if (transform.getFixedIndex() < 0 || transform.getFixedIndex() >= links.length)
			throw new IllegalArgumentException("Fixed frame " + transform.getFixedIndex() + " does not exist");

		fixedIndices[moving] = transform.getFixedIndex();
		links[moving] = transform;
	}

	public boolean isLinked(final int index) {

		return links[index] != null;
	}

	public FrameTransform getLink(final int index) {

		return links[index];
	}

	/**
	 * @return the frames from <code>index</code> up to and including the
	 *     reference
	 * @throws IllegalStateException if the links do not lead to the reference
	 */
	public int[] path(final int index) {

		final int[] path = new int[links.length + 1];
		int length = 0;
		int i = index;
		path[length++] = i;
		while (i != referenceIndex) {
			if (length > links.length)
				throw new IllegalStateException("Frame " + index + " is part of a cycle");
			final int next = fixedIndices[i];
			if (next == UNLINKED)
				throw new IllegalStateException(
						"Frame " + index + " does not lead to reference " + referenceIndex + ", frame " + i + " is not linked");
			path[length++] = next;
			i = next;
		}
		return Arrays.copyOf(path, length);
	}

	/**
	 * @return true if all links from <code>index</code> to the reference
	 *     are affine
	 */
	public boolean isAffine(final int index) {

		final int[] path = path(index);
		for (int k = 0; k < path.length - 1; ++k)
			if (links[path[k]].isDeformable())
				return false;
		return true;
	}

	/**
	 * @return the collapsed transform from reference into frame
	 *     <code>index</code> physical coordinates
	 * @throws IllegalStateException if a link on the path is deformable
	 */
	public Affine3D affine(final int index) {

		final int[] path = path(index);
		final Affine3D affine = new Affine3D();
		for (int k = path.length - 2; k >= 0; --k) {
			final FrameTransform link = links[path[k]];
			if (link.isDeformable())
				throw new IllegalStateException("Link " + link + " is not affine");
			affine.preConcatenate(link.getAffine());
		}
		return affine;
	}

	/**
	 * @return the transform from reference into frame <code>index</code>
	 *     physical coordinates
	 */
	public SpatialTransform forward(final int index) {

		if (isAffine(index))
			return affine(index);

		final int[] path = path(index);
		final TransformSequence sequence = new TransformSequence();
		for (int k = path.length - 2; k >= 0; --k)
			sequence.add(links[path[k]].forward());
		return sequence;
	}
}
