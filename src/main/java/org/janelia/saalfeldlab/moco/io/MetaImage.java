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
package org.janelia.saalfeldlab.moco.io;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;

import org.janelia.saalfeldlab.moco.volume.VoxelGeometry;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * An ITK MetaImage (.mhd with detached data or .mha with inline data),
 * scalar or with interleaved vector components, held as 32-bit floats.
 *
 * The TransformMatrix is kept in file order, i.e. the first
 * <em>n</em> values are the physical direction of the first voxel axis.
 *
 * Data are streamed in chunks.  A single image is limited to what one
 * float array holds, larger 4D series are read with
 * {@link #readTimePoints(Path, TimePointConsumer)} and written with
 * {@link #writeTimeSeries(Path, List, VoxelGeometry)}.
 */
public class MetaImage {

	public static final String HEADER_EXTENSION = ".mhd";
	public static final String LOCAL_EXTENSION = ".mha";

	private static final int CHUNK_ELEMENTS = 1 << 16;
	private static final int MAX_HEADER_BYTES = 1 << 16;

	private final long[] dimensions;
	private final int numChannels;
	private final double[] spacing;
	private final double[] offset;
	private final double[] transformMatrix;
	private final float[] data;

	@FunctionalInterface
	public static interface TimePointConsumer {

		public void accept(final int t, final MetaImage timePoint) throws IOException;
	}

	@FunctionalInterface
	private static interface DataWriter {

		public void write(final OutputStream out) throws IOException;
	}

	/**
	 * Parsed header of a MetaImage file, enough to locate and decode its
	 * data without loading them.
	 */
	public static class Header {

		private final Path path;
		private final long[] dimensions;
		private final int numChannels;
		private final double[] spacing;
		private final double[] offset;
		private final double[] transformMatrix;
		private final String elementType;
		private final int elementSize;
		private final boolean msb;
		private final boolean compressed;
		private final String dataFile;
		private final long dataOffset;
		private final long headerSize;

		private Header(
				final Path path,
				final Map<String, String> header,
				final long dataOffset) throws IOException {

			this.path = path;
			this.dataOffset = dataOffset;

			final int n = parseInt(header, "NDims", path);
			if (n < 1)
				throw new IOException(path + ": NDims must be positive, is " + n);
			dimensions = parseLongs(required(header, "DimSize", path), n, path);
			for (final long d : dimensions)
				if (d < 1)
					throw new IOException(path + ": DimSize must be positive " + Arrays.toString(dimensions));
			numChannels = header.containsKey("ElementNumberOfChannels") ?
					parseInt(header, "ElementNumberOfChannels", path) : 1;
			if (numChannels < 1)
				throw new IOException(path + ": ElementNumberOfChannels must be positive, is " + numChannels);
			spacing = parseDoubles(header, n, 1, path, "ElementSpacing", "ElementSize");
			offset = parseDoubles(header, n, 0, path, "Offset", "Position", "Origin");

			final String matrix = firstPresent(header, "TransformMatrix", "Rotation", "Orientation");
			if (matrix == null) {
				transformMatrix = new double[n * n];
				for (int d = 0; d < n; ++d)
					transformMatrix[d * n + d] = 1;
			} else
				transformMatrix = parseDoubleArray(matrix, n * n, path);

			elementType = required(header, "ElementType", path).toUpperCase(Locale.ROOT);
			elementSize = elementSize(elementType, path);
			msb = Boolean.parseBoolean(
					header.getOrDefault("BinaryDataByteOrderMSB", header.getOrDefault("ElementByteOrderMSB", "False")));
			compressed = Boolean.parseBoolean(header.getOrDefault("CompressedData", "False"));
			dataFile = header.get("ElementDataFile");
			headerSize = header.containsKey("HeaderSize") ? parseInt(header, "HeaderSize", path) : 0;
		}

		public Path getPath() {

			return path;
		}

		public int numDimensions() {

			return dimensions.length;
		}

		public long[] getDimensions() {

			return dimensions.clone();
		}

		public int getNumChannels() {

			return numChannels;
		}

		/**
		 * @return the number of stored values, components included
		 */
		public long numElements() {

			return Intervals.numElements(dimensions) * numChannels;
		}

		public VoxelGeometry getGeometry() {

			return geometry(dimensions.length, spacing, offset, transformMatrix);
		}

		private boolean isLocal() {

			return dataFile.equalsIgnoreCase("LOCAL");
		}
	}

	public MetaImage(
			final long[] dimensions,
			final int numChannels,
			final double[] spacing,
			final double[] offset,
			final double[] transformMatrix,
			final float[] data) {

		final int n = dimensions.length;
		if (spacing.length != n || offset.length != n || transformMatrix.length != n * n)
			throw new IllegalArgumentException("Header arrays do not match " + n + " dimensions");
		if (numChannels < 1)
			throw new IllegalArgumentException("Number of channels must be positive: " + numChannels);
		if (data.length != Intervals.numElements(dimensions) * numChannels)
			throw new IllegalArgumentException(
					"Expected " + Intervals.numElements(dimensions) * numChannels + " elements, got " + data.length);

		this.dimensions = dimensions.clone();
		this.numChannels = numChannels;
		this.spacing = spacing.clone();
		this.offset = offset.clone();
		this.transformMatrix = transformMatrix.clone();
		this.data = data;
	}

	/**
	 * Create a scalar image.  Dimensions beyond the third (e.g. time) get
	 * unit spacing, zero offset and identity direction.
	 *
	 * @throws IllegalArgumentException if the image has more elements than
	 *     an array holds
	 */
	public static MetaImage create(
			final RandomAccessibleInterval<? extends RealType<?>> img,
			final VoxelGeometry geometry) {

		final int n = img.numDimensions();
		final float[] data = new float[arraySize(Intervals.numElements(img))];
		int i = 0;
		for (final RealType<?> t : Views.flatIterable(img))
			data[i++] = t.getRealFloat();

		return new MetaImage(
				img.dimensionsAsLongArray(),
				1,
				expand(geometry.getSpacing(), n, 1),
				expand(geometry.getOrigin(), n, 0),
				expandDirection(geometry.getDirection(), n),
				data);
	}

	/**
	 * Create a vector image from a field whose last dimension enumerates
	 * the vector components.
	 */
	public static MetaImage createVectorField(
			final RandomAccessibleInterval<? extends RealType<?>> field,
			final VoxelGeometry geometry) {

		final int n = field.numDimensions() - 1;
		final int numChannels = (int)field.dimension(n);
		final float[] data = new float[arraySize(Intervals.numElements(field))];
		int i = 0;
		for (final RealType<?> t : Views.flatIterable(Views.moveAxis(field, n, 0)))
			data[i++] = t.getRealFloat();

		return new MetaImage(
				Arrays.copyOf(field.dimensionsAsLongArray(), n),
				numChannels,
				expand(geometry.getSpacing(), n, 1),
				expand(geometry.getOrigin(), n, 0),
				expandDirection(geometry.getDirection(), n),
				data);
	}

	private static int arraySize(final long numElements) {

		if (numElements > Integer.MAX_VALUE)
			throw new IllegalArgumentException(
					numElements + " elements do not fit into one image, write large series by time point");
		return (int)numElements;
	}

	private static double[] expand(final double[] values, final int n, final double fill) {

		final double[] expanded = new double[n];
		Arrays.fill(expanded, fill);
		System.arraycopy(values, 0, expanded, 0, Math.min(n, values.length));
		return expanded;
	}

	private static double[] expandDirection(final double[] direction, final int n) {

		final double[] matrix = new double[n * n];
		for (int axis = 0; axis < n; ++axis)
			for (int r = 0; r < n; ++r)
				if (axis < 3 && r < 3)
					matrix[axis * n + r] = direction[r * 3 + axis];
				else
					matrix[axis * n + r] = axis == r ? 1 : 0;
		return matrix;
	}

	private static VoxelGeometry geometry(
			final int n,
			final double[] spacing,
			final double[] offset,
			final double[] transformMatrix) {

		final double[] direction = new double[9];
		for (int axis = 0; axis < 3; ++axis)
			for (int r = 0; r < 3; ++r)
				direction[r * 3 + axis] = axis < n && r < n ? transformMatrix[axis * n + r] : (axis == r ? 1 : 0);

		return new VoxelGeometry(
				expand(spacing, 3, 1),
				expand(offset, 3, 0),
				direction);
	}

	public int numDimensions() {

		return dimensions.length;
	}

	public long[] getDimensions() {

		return dimensions.clone();
	}

	public int getNumChannels() {

		return numChannels;
	}

	/**
	 * The backing array, not a copy.
	 */
	public float[] getData() {

		return data;
	}

	/**
	 * @return the geometry of the first three axes
	 */
	public VoxelGeometry getGeometry() {

		return geometry(dimensions.length, spacing, offset, transformMatrix);
	}

	/**
	 * Wrap the data as an image.  Vector images have the components as
	 * their first dimension.
	 */
	public ArrayImg<FloatType, FloatArray> toImg() {

		if (numChannels == 1)
			return ArrayImgs.floats(data, dimensions);

		final long[] vectorDimensions = new long[dimensions.length + 1];
		vectorDimensions[0] = numChannels;
		System.arraycopy(dimensions, 0, vectorDimensions, 1, dimensions.length);
		return ArrayImgs.floats(data, vectorDimensions);
	}

	/**
	 * Read the header lines up to and including ElementDataFile.
	 */
	public static Header readHeader(final Path path) throws IOException {

		final Map<String, String> header = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		final ByteArrayOutputStream line = new ByteArrayOutputStream();
		long position = 0;
		boolean complete = false;

		try (final InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
			while (!complete && position < MAX_HEADER_BYTES) {
				final int b = in.read();
				if (b < 0)
					break;
				++position;
				if (b == '\n') {
					complete = parseLine(line, header);
					line.reset();
				} else
					line.write(b);
			}
			if (!complete)
				complete = parseLine(line, header);
		}

		if (!complete)
			throw new IOException(path + " is not a MetaImage header, ElementDataFile is missing");

		return new Header(path, header, position);
	}

	private static boolean parseLine(final ByteArrayOutputStream line, final Map<String, String> header) {

		final String text = new String(line.toByteArray(), StandardCharsets.ISO_8859_1).trim();
		final int separator = text.indexOf('=');
		if (separator < 0)
			return false;

		final String key = text.substring(0, separator).trim();
		header.put(key, text.substring(separator + 1).trim());
		return key.equalsIgnoreCase("ElementDataFile");
	}

	public static MetaImage read(final Path path) throws IOException {

		final Header header = readHeader(path);
		final long numElements = header.numElements();
		if (numElements > Integer.MAX_VALUE)
			throw new IOException(
					path + " holds " + numElements + " elements, too many for one image, read it by time point");

		final float[] data = new float[(int)numElements];
		try (final InputStream in = openData(header)) {
			readElements(in, header, data);
		}

		return new MetaImage(header.dimensions, header.numChannels, header.spacing, header.offset, header.transformMatrix, data);
	}

	/**
	 * Read a 4D image one time point after the other.  Only one time point
	 * is held in memory by this method.
	 */
	public static void readTimePoints(final Path path, final TimePointConsumer consumer) throws IOException {

		final Header header = readHeader(path);
		if (header.numDimensions() != 4)
			throw new IOException(path + " has " + header.numDimensions() + " dimensions, expected 4");

		final long[] frameDimensions = Arrays.copyOf(header.dimensions, 3);
		final long frameElements = Intervals.numElements(frameDimensions) * header.numChannels;
		if (frameElements > Integer.MAX_VALUE)
			throw new IOException(path + ": a time point of " + frameElements + " elements is too large");

		final double[] frameMatrix = new double[9];
		for (int axis = 0; axis < 3; ++axis)
			for (int r = 0; r < 3; ++r)
				frameMatrix[axis * 3 + r] = header.transformMatrix[axis * 4 + r];

		try (final InputStream in = openData(header)) {
			for (int t = 0; t < header.dimensions[3]; ++t) {
				final float[] data = new float[(int)frameElements];
				readElements(in, header, data);
				consumer.accept(
						t,
						new MetaImage(
								frameDimensions,
								header.numChannels,
								Arrays.copyOf(header.spacing, 3),
								Arrays.copyOf(header.offset, 3),
								frameMatrix,
								data));
			}
		}
	}

	/**
	 * @return a stream at the first data element, decompressed if needed
	 */
	private static InputStream openData(final Header header) throws IOException {

		final Path path = header.path;
		final Path dataPath;
		final long start;
		if (header.isLocal()) {
			dataPath = path;
			start = header.dataOffset;
		} else if (header.dataFile.toUpperCase(Locale.ROOT).startsWith("LIST") || header.dataFile.contains("%")) {
			throw new IOException(path + ": multi-file MetaImage data (" + header.dataFile + ") is not supported");
		} else {
			dataPath = path.resolveSibling(header.dataFile);
			start = 0;
			if (!Files.isRegularFile(dataPath))
				throw new IOException(path + ": data file " + dataPath + " does not exist");
		}

		final long skip;
		if (header.headerSize >= 0)
			skip = header.headerSize;
		else {
			if (header.compressed)
				throw new IOException(path + ": HeaderSize -1 is only supported for uncompressed data");
			final long available = Files.size(dataPath) - start;
			final long expectedBytes = header.numElements() * header.elementSize;
			if (available < expectedBytes)
				throw new IOException(
						path + ": expected " + expectedBytes + " bytes of " + header.elementType + " data, found " + available);
			skip = available - expectedBytes;
		}

		final InputStream file = Files.newInputStream(dataPath);
		try {
			skipFully(file, start + skip, path);
			return new BufferedInputStream(header.compressed ? new InflaterInputStream(file) : file);
		} catch (final IOException e) {
			file.close();
			throw e;
		}
	}

	private static void skipFully(final InputStream in, final long n, final Path path) throws IOException {

		long remaining = n;
		while (remaining > 0) {
			final long skipped = in.skip(remaining);
			if (skipped > 0)
				remaining -= skipped;
			else if (in.read() < 0)
				throw new IOException(path + ": data end before the first element");
			else
				--remaining;
		}
	}

	private static void readElements(final InputStream in, final Header header, final float[] data) throws IOException {

		final byte[] bytes = new byte[CHUNK_ELEMENTS * header.elementSize];
		final ByteBuffer buffer = ByteBuffer.wrap(bytes).order(header.msb ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN);

		for (int i = 0; i < data.length;) {
			final int n = Math.min(CHUNK_ELEMENTS, data.length - i);
			final int length = n * header.elementSize;
			int read = 0;
			while (read < length) {
				final int r = in.read(bytes, read, length - read);
				if (r < 0)
					throw new IOException(
							header.path + ": data end after " + ((long)i * header.elementSize + read) + " bytes, expected " +
									header.numElements() * header.elementSize + " bytes of " + header.elementType);
				read += r;
			}
			buffer.clear();
			decode(buffer, header.elementType, data, i, n);
			i += n;
		}
	}

	public static void write(final Path path, final MetaImage image) throws IOException {

		write(path, image, false);
	}

	/**
	 * Write as MET_FLOAT little endian.  The data goes inline for .mha and
	 * into a sibling .raw (.zraw when compressed) file otherwise.
	 */
	public static void write(final Path path, final MetaImage image, final boolean compress) throws IOException {

		write(
				path,
				image.dimensions,
				image.numChannels,
				image.spacing,
				image.offset,
				image.transformMatrix,
				compress,
				out -> writeFloats(out, image.data));
	}

	/**
	 * Write 3D time points as one uncompressed 4D image without copying
	 * them into a single array.
	 */
	public static void writeTimeSeries(
			final Path path,
			final List<? extends RandomAccessibleInterval<? extends RealType<?>>> timePoints,
			final VoxelGeometry geometry) throws IOException {

		if (timePoints.isEmpty())
			throw new IllegalArgumentException("No time points to write to " + path);

		final long[] frameDimensions = timePoints.get(0).dimensionsAsLongArray();
		if (frameDimensions.length != 3)
			throw new IllegalArgumentException("Time points must be 3D, not " + frameDimensions.length + "D");
		for (final RandomAccessibleInterval<? extends RealType<?>> timePoint : timePoints)
			if (!Arrays.equals(frameDimensions, timePoint.dimensionsAsLongArray()))
				throw new IllegalArgumentException(
						"Time points differ in size: " + Arrays.toString(frameDimensions) + " and " +
								Arrays.toString(timePoint.dimensionsAsLongArray()));

		write(
				path,
				new long[]{frameDimensions[0], frameDimensions[1], frameDimensions[2], timePoints.size()},
				1,
				expand(geometry.getSpacing(), 4, 1),
				expand(geometry.getOrigin(), 4, 0),
				expandDirection(geometry.getDirection(), 4),
				false,
				out -> {
					for (final RandomAccessibleInterval<? extends RealType<?>> timePoint : timePoints)
						writeValues(out, Views.flatIterable(timePoint));
				});
	}

	private static void write(
			final Path path,
			final long[] dimensions,
			final int numChannels,
			final double[] spacing,
			final double[] offset,
			final double[] transformMatrix,
			final boolean compress,
			final DataWriter dataWriter) throws IOException {

		final Path parent = path.toAbsolutePath().getParent();
		Files.createDirectories(parent);

		final String fileName = path.getFileName().toString();
		final boolean local = fileName.toLowerCase(Locale.ROOT).endsWith(LOCAL_EXTENSION);
		final String baseName = fileName.contains(".") ? fileName.substring(0, fileName.lastIndexOf('.')) : fileName;
		final String dataFile = local ? "LOCAL" : baseName + (compress ? ".zraw" : ".raw");

		if (!compress) {
			final byte[] header = header(dimensions, numChannels, spacing, offset, transformMatrix, -1, dataFile);
			if (local) {
				try (final OutputStream out = new BufferedOutputStream(Files.newOutputStream(path))) {
					out.write(header);
					dataWriter.write(out);
				}
			} else {
				try (final OutputStream out = new BufferedOutputStream(Files.newOutputStream(path.resolveSibling(dataFile)))) {
					dataWriter.write(out);
				}
				Files.write(path, header);
			}
			return;
		}

		/* the header records the compressed size, so compress first */
		final Path compressed = local ?
				Files.createTempFile(parent, "." + baseName, ".zraw.tmp") :
				path.resolveSibling(dataFile);
		try {
			try (final OutputStream out = new DeflaterOutputStream(new BufferedOutputStream(Files.newOutputStream(compressed)))) {
				dataWriter.write(out);
			}
			final byte[] header = header(dimensions, numChannels, spacing, offset, transformMatrix, Files.size(compressed), dataFile);
			if (local) {
				try (final OutputStream out = Files.newOutputStream(path)) {
					out.write(header);
					Files.copy(compressed, out);
				}
			} else
				Files.write(path, header);
		} finally {
			if (local)
				Files.deleteIfExists(compressed);
		}
	}

	/**
	 * @param compressedSize negative for uncompressed data
	 */
	private static byte[] header(
			final long[] dimensions,
			final int numChannels,
			final double[] spacing,
			final double[] offset,
			final double[] transformMatrix,
			final long compressedSize,
			final String dataFile) {

		final boolean compress = compressedSize >= 0;
		final StringBuilder header = new StringBuilder();
		header.append("ObjectType = Image\n");
		header.append("NDims = ").append(dimensions.length).append('\n');
		header.append("BinaryData = True\n");
		header.append("BinaryDataByteOrderMSB = False\n");
		header.append("CompressedData = ").append(compress ? "True" : "False").append('\n');
		if (compress)
			header.append("CompressedDataSize = ").append(compressedSize).append('\n');
		header.append("TransformMatrix = ").append(join(transformMatrix)).append('\n');
		header.append("Offset = ").append(join(offset)).append('\n');
		header.append("ElementSpacing = ").append(join(spacing)).append('\n');
		header.append("DimSize = ").append(join(dimensions)).append('\n');
		if (numChannels > 1)
			header.append("ElementNumberOfChannels = ").append(numChannels).append('\n');
		header.append("ElementType = MET_FLOAT\n");
		header.append("ElementDataFile = ").append(dataFile).append('\n');

		return header.toString().getBytes(StandardCharsets.ISO_8859_1);
	}

	private static void writeFloats(final OutputStream out, final float[] data) throws IOException {

		final ByteBuffer buffer = ByteBuffer.allocate(CHUNK_ELEMENTS * 4).order(ByteOrder.LITTLE_ENDIAN);
		for (int i = 0; i < data.length;) {
			final int n = Math.min(CHUNK_ELEMENTS, data.length - i);
			buffer.clear();
			buffer.asFloatBuffer().put(data, i, n);
			out.write(buffer.array(), 0, n * 4);
			i += n;
		}
	}

	private static void writeValues(final OutputStream out, final Iterable<? extends RealType<?>> values) throws IOException {

		final ByteBuffer buffer = ByteBuffer.allocate(CHUNK_ELEMENTS * 4).order(ByteOrder.LITTLE_ENDIAN);
		for (final RealType<?> t : values) {
			if (!buffer.hasRemaining()) {
				out.write(buffer.array(), 0, buffer.position());
				buffer.clear();
			}
			buffer.putFloat(t.getRealFloat());
		}
		out.write(buffer.array(), 0, buffer.position());
	}

	/**
	 * @return true if the file name has a MetaImage header extension
	 */
	public static boolean isMetaImage(final Path path) {

		final String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
		return name.endsWith(HEADER_EXTENSION) || name.endsWith(LOCAL_EXTENSION);
	}

	private static void decode(
			final ByteBuffer buffer,
			final String elementType,
			final float[] data,
			final int offset,
			final int n) {

		final int end = offset + n;
		switch (elementType) {
		case "MET_UCHAR":
			for (int i = offset; i < end; ++i)
				data[i] = buffer.get() & 0xff;
			break;
		case "MET_CHAR":
			for (int i = offset; i < end; ++i)
				data[i] = buffer.get();
			break;
		case "MET_USHORT":
			for (int i = offset; i < end; ++i)
				data[i] = buffer.getShort() & 0xffff;
			break;
		case "MET_SHORT":
			for (int i = offset; i < end; ++i)
				data[i] = buffer.getShort();
			break;
		case "MET_UINT":
			for (int i = offset; i < end; ++i)
				data[i] = buffer.getInt() & 0xffffffffL;
			break;
		case "MET_INT":
			for (int i = offset; i < end; ++i)
				data[i] = buffer.getInt();
			break;
		case "MET_FLOAT":
			buffer.asFloatBuffer().get(data, offset, n);
			break;
		default:
			for (int i = offset; i < end; ++i)
				data[i] = (float)buffer.getDouble();
		}
	}

	private static int elementSize(final String elementType, final Path path) throws IOException {

		switch (elementType) {
		case "MET_UCHAR":
		case "MET_CHAR":
			return 1;
		case "MET_USHORT":
		case "MET_SHORT":
			return 2;
		case "MET_UINT":
		case "MET_INT":
		case "MET_FLOAT":
			return 4;
		case "MET_DOUBLE":
			return 8;
		default:
			throw new IOException(path + ": unsupported element type " + elementType);
		}
	}

	private static String required(final Map<String, String> header, final String key, final Path path) throws IOException {

		final String value = header.get(key);
		if (value == null)
			throw new IOException(path + ": MetaImage header misses " + key);
		return value;
	}

	private static String firstPresent(final Map<String, String> header, final String... keys) {

		for (final String key : keys)
			if (header.containsKey(key))
				return header.get(key);
		return null;
	}

	private static int parseInt(final Map<String, String> header, final String key, final Path path) throws IOException {

		try {
			return Integer.parseInt(required(header, key, path));
		} catch (final NumberFormatException e) {
			throw new IOException(path + ": cannot parse " + key, e);
		}
	}

	private static long[] parseLongs(final String value, final int n, final Path path) throws IOException {

		final String[] tokens = value.trim().split("\\s+");
		if (tokens.length < n)
			throw new IOException(path + ": expected " + n + " values in '" + value + "'");
		final long[] values = new long[n];
		try {
			for (int i = 0; i < n; ++i)
				values[i] = Long.parseLong(tokens[i]);
		} catch (final NumberFormatException e) {
			throw new IOException(path + ": cannot parse '" + value + "'", e);
		}
		return values;
	}

	private static double[] parseDoubles(
			final Map<String, String> header,
			final int n,
			final double fill,
			final Path path,
			final String... keys) throws IOException {

		final String value = firstPresent(header, keys);
		if (value == null) {
			final double[] values = new double[n];
			Arrays.fill(values, fill);
			return values;
		}
		return parseDoubleArray(value, n, path);
	}

	private static double[] parseDoubleArray(final String value, final int n, final Path path) throws IOException {

		final String[] tokens = value.trim().split("\\s+");
		if (tokens.length < n)
			throw new IOException(path + ": expected " + n + " values in '" + value + "'");
		final double[] values = new double[n];
		try {
			for (int i = 0; i < n; ++i)
				values[i] = Double.parseDouble(tokens[i]);
		} catch (final NumberFormatException e) {
			throw new IOException(path + ": cannot parse '" + value + "'", e);
		}
		return values;
	}

	private static String join(final double[] values) {

		final StringBuilder builder = new StringBuilder();
		for (int i = 0; i < values.length; ++i) {
			if (i > 0)
				builder.append(' ');
			builder.append(values[i]);
		}
		return builder.toString();
	}

	private static String join(final long[] values) {

		final StringBuilder builder = new StringBuilder();
		for (int i = 0; i < values.length; ++i) {
			if (i > 0)
				builder.append(' ');
			builder.append(values[i]);
		}
		return builder.toString();
	}
}
