package org.janelia.saalfeldlab.moco.volume;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.janelia.saalfeldlab.moco.io.MetaImage;

/**
 * Loads a {@link VolumeSet} from ITK MetaImage files.  Accepts a directory
 * of 3D volumes, ordered by natural file name order, or a single 4D volume
 * that is split into 3D frames first.
 */
public class MetaImageVolumeSetLoader implements VolumeSetLoader {

	public static final String SPLIT_PREFIX = "vol_";

	private final Path splitDirectory;

	/**
	 * @param splitDirectory where 3D frames of a 4D input are written
	 */
	public MetaImageVolumeSetLoader(final Path splitDirectory) {

		this.splitDirectory = splitDirectory;
	}

	@Override
	public VolumeSet load(final Path input) throws IOException, DimensionMismatchException {

		if (Files.isDirectory(input)) {
			final List<Path> files = listVolumes(input);
			if (files.isEmpty())
				throw new IOException("No MetaImage volumes found in " + input);

			if (files.size() == 1)
				return loadSingle(files.get(0));

			final List<Frame> frames = new ArrayList<>();
			for (final Path file : files) {
				final MetaImage image = MetaImage.read(file);
				if (image.numDimensions() != 3 || image.getNumChannels() != 1)
					throw new IOException(
							file + " is not a scalar 3D volume, a directory input must contain 3D volumes only");
				frames.add(new Frame(frames.size(), image.toImg(), image.getGeometry(), file));
			}
			System.out.println("Found " + frames.size() + " 3D volumes in " + input);
			return new VolumeSet(frames);
		}

		if (!Files.exists(input))
			throw new IOException(input + " does not exist");
		if (!MetaImage.isMetaImage(input))
			throw new IOException(input + " is not a MetaImage (.mhd or .mha), convert it first");

		return loadSingle(input);
	}

	private VolumeSet loadSingle(final Path file) throws IOException, DimensionMismatchException {

		final MetaImage.Header header = MetaImage.readHeader(file);
		if (header.getNumChannels() != 1)
			throw new IOException(file + " is a vector image, expected scalar volumes");
		if (header.numDimensions() == 3)
			throw new IOException(file + " is a single 3D volume, motion correction needs a dynamic series");
		if (header.numDimensions() != 4)
			throw new IOException(file + " has " + header.numDimensions() + " dimensions, expected 4");

		System.out.println("Splitting 4D volume " + file + " into 3D frames in " + splitDirectory);
		return split(file, splitDirectory);
	}

	/**
	 * Split a 4D image along its last axis and write the frames as
	 * <code>vol_NNNN.mhd</code>.  Time points are read one at a time.
	 */
	public static VolumeSet split(final Path file, final Path splitDirectory) throws IOException, DimensionMismatchException {

		Files.createDirectories(splitDirectory);

		final List<Frame> frames = new ArrayList<>();
		MetaImage.readTimePoints(file, (t, timePoint) -> {
			final Path frameFile = splitDirectory.resolve(String.format("%s%04d%s", SPLIT_PREFIX, t, MetaImage.HEADER_EXTENSION));
			MetaImage.write(frameFile, timePoint);
			frames.add(new Frame(t, timePoint.toImg(), timePoint.getGeometry(), frameFile));
		});
		return new VolumeSet(frames);
	}

	/**
	 * List the MetaImage headers of a directory in natural order.
	 * Directories mixing .mhd and .mha are rejected.
	 */
	public static List<Path> listVolumes(final Path directory) throws IOException {

		final List<Path> files;
		try (final Stream<Path> stream = Files.list(directory)) {
			files = stream
					.filter(Files::isRegularFile)
					.filter(MetaImage::isMetaImage)
					.sorted(Comparator.comparing(p -> p.getFileName().toString(), MetaImageVolumeSetLoader::compareNatural))
					.collect(Collectors.toList());
		}

		final Set<String> extensions = new HashSet<>();
		for (final Path file : files) {
			final String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
			extensions.add(name.substring(name.lastIndexOf('.')));
		}
		if (extensions.size() > 1)
			throw new IOException("Multiple file formats " + extensions + " found in " + directory + ", use one");

		return files;
	}

	/**
	 * Compare file names such that embedded numbers sort by value,
	 * i.e. <code>frame2</code> before <code>frame10</code>.
	 */
	public static int compareNatural(final String a, final String b) {

		int i = 0, j = 0;
		while (i < a.length() && j < b.length()) {
			final char ca = a.charAt(i);
			final char cb = b.charAt(j);
			if (Character.isDigit(ca) && Character.isDigit(cb)) {
				int ei = i, ej = j;
				while (ei < a.length() && Character.isDigit(a.charAt(ei)))
					++ei;
				while (ej < b.length() && Character.isDigit(b.charAt(ej)))
					++ej;
				final String na = a.substring(i, ei).replaceFirst("^0+(?=.)", "");
				final String nb = b.substring(j, ej).replaceFirst("^0+(?=.)", "");
				if (na.length() != nb.length())
					return na.length() - nb.length();
				final int c = na.compareTo(nb);
				if (c != 0)
					return c;
				i = ei;
				j = ej;
			} else {
				if (ca != cb)
					return Character.compare(ca, cb);
				++i;
				++j;
			}
		}
		return (a.length() - i) - (b.length() - j);
	}
}
