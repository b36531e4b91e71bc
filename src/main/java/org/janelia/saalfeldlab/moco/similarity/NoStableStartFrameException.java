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

import java.util.Arrays;

import org.janelia.saalfeldlab.moco.MotionCorrectionException;

/**
 * No frame index satisfies the start frame criterion.  Pass an explicit
 * start frame to proceed.
 */
public class NoStableStartFrameException extends MotionCorrectionException {

	private static final long serialVersionUID = -4410783923408722014L;

	private final double[] scores;

	public NoStableStartFrameException(final String criterion, final double[] scores) {

		super("No stable start frame found, no index satisfies " + criterion + " for scores " + Arrays.toString(scores));
		this.scores = scores.clone();
	}

	public double[] getScores() {

		return scores.clone();
	}
}
