package org.janelia.saalfeldlab.moco.compose;

import java.util.ArrayList;
import java.util.List;

/**
 * Records which corrected 4D volume time point holds which frame, and why
 * frames are missing.  Serialized with gson.
 */
public class VolumeManifest {

	public static class Entry {

		public int index;
		public String state;
		public String source;
		public String output;
		public Integer timePoint;
		public String reason;
	}

	public int referenceIndex;
	public String mode;
	public String volume;
	public List<Entry> frames = new ArrayList<>();
}
