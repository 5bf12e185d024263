/*-
 * #%L
 * This file is part of ExrView.
 * %%
 * Copyright (C) 2024 ExrView developers
 * %%
 * ExrView is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * ExrView is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ExrView.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */


package exrview.lib.images.io;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import exrview.lib.images.Image;
import exrview.lib.images.ImageWindow;

/**
 * Writes single-part OpenEXR scanline images, with 32-bit float channels.
 * <p>
 * Values are written as given, so color channels are expected to be premultiplied by alpha, as OpenEXR requires.
 */
public class ExrImageSaver implements ImageSaver {

	private static final Logger logger = LoggerFactory.getLogger(ExrImageSaver.class);

	private static final String[] INTERLEAVED_NAMES = {"R", "G", "B", "A"};

	private final ExrCompression compression;

	/**
	 * Create a saver using ZIP compression.
	 */
	public ExrImageSaver() {
		this(ExrCompression.ZIP);
	}

	ExrImageSaver(ExrCompression compression) {
		this.compression = compression;
	}

	@Override
	public String getName() {
		return "OpenEXR";
	}

	@Override
	public boolean hasPremultipliedAlpha() {
		return true;
	}

	@Override
	public boolean canSaveFile(String extension) {
		if (extension.startsWith("."))
			extension = extension.substring(1);
		return "exr".equalsIgnoreCase(extension);
	}

	/**
	 * {@inheritDoc}
	 * <p>
	 * Channels are named R, G, B and A in turn; a single channel is named Y.
	 */
	@Override
	public void save(OutputStream stream, Path path, float[] data, int width, int height, int nChannels) throws IOException {
		if (nChannels < 1 || nChannels > INTERLEAVED_NAMES.length)
			throw new IllegalArgumentException("Can only save 1 to " + INTERLEAVED_NAMES.length + " channels, not " + nChannels);
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Image has zero pixels: " + width + "x" + height);
		int nPixels = width * height;
		if (data.length != nPixels * nChannels)
			throw new IllegalArgumentException(String.format("Expected %d values for %dx%d pixels with %d channels, but got %d",
					nPixels * nChannels, width, height, nChannels, data.length));

		Map<String, float[]> planes = new TreeMap<>();
		for (int c = 0; c < nChannels; c++) {
			float[] plane = new float[nPixels];
			for (int i = 0; i < nPixels; i++)
				plane[i] = data[i * nChannels + c];
			planes.put(nChannels == 1 ? "Y" : INTERLEAVED_NAMES[c], plane);
		}
		var window = ImageWindow.ofSize(width, height);
		logger.debug("Saving {}x{} image with {} channels to {}", width, height, nChannels, path);
		write(stream, planes, window, window);
	}

	@Override
	public void save(OutputStream stream, Image image, List<String> channelNames) throws IOException {
		if (channelNames.isEmpty())
			throw new IllegalArgumentException("No channels to save for " + image.getName());
		Map<String, float[]> planes = new TreeMap<>();
		for (String name : channelNames) {
			var channel = image.getChannel(name);
			if (channel == null)
				throw new IllegalArgumentException("Channel " + name + " does not exist in " + image.getName());
			planes.put(name, channel.getData());
		}
		logger.debug("Saving channels {} of {}", planes.keySet(), image.getName());
		write(stream, planes, image.getDataWindow(), image.getDisplayWindow());
	}

	private void write(OutputStream stream, Map<String, float[]> planes, ImageWindow dataWindow, ImageWindow displayWindow) throws IOException {
		List<byte[]> chunks = createChunks(planes, dataWindow);

		var header = new ByteArrayOutputStream();
		writeInt(header, ExrHeader.MAGIC);
		writeInt(header, 2);
		var chlist = new ByteArrayOutputStream();
		for (String name : planes.keySet()) {
			writeString(chlist, name);
			writeInt(chlist, ExrHeader.PIXEL_TYPE_FLOAT);
			// pLinear and reserved bytes
			writeInt(chlist, 0);
			writeInt(chlist, 1);
			writeInt(chlist, 1);
		}
		chlist.write(0);
		writeAttribute(header, "channels", "chlist", chlist.toByteArray());
		writeAttribute(header, "compression", "compression", new byte[] {(byte)compression.getCode()});
		writeAttribute(header, "dataWindow", "box2i", box(dataWindow));
		writeAttribute(header, "displayWindow", "box2i", box(displayWindow));
		writeAttribute(header, "lineOrder", "lineOrder", new byte[] {0});
		writeAttribute(header, "pixelAspectRatio", "float", floats(1f));
		writeAttribute(header, "screenWindowCenter", "v2f", floats(0f, 0f));
		writeAttribute(header, "screenWindowWidth", "float", floats(1f));
		header.write(0);

		long offset = header.size() + 8L * chunks.size();
		var table = ByteBuffer.allocate(8 * chunks.size()).order(ByteOrder.LITTLE_ENDIAN);
		for (byte[] chunk : chunks) {
			table.putLong(offset);
			offset += chunk.length;
		}
		header.writeTo(stream);
		stream.write(table.array());
		for (byte[] chunk : chunks)
			stream.write(chunk);
		stream.flush();
	}

	private List<byte[]> createChunks(Map<String, float[]> planes, ImageWindow dataWindow) {
		int width = dataWindow.getWidth();
		int height = dataWindow.getHeight();
		int linesPerChunk = compression.getLinesPerChunk();
		List<byte[]> chunks = new ArrayList<>();
		for (int row = 0; row < height; row += linesPerChunk) {
			int nLines = Math.min(linesPerChunk, height - row);
			var raw = ByteBuffer.allocate(nLines * planes.size() * width * 4).order(ByteOrder.LITTLE_ENDIAN);
			for (int line = row; line < row + nLines; line++) {
				for (float[] plane : planes.values()) {
					for (int x = 0; x < width; x++)
						raw.putFloat(plane[line * width + x]);
				}
			}
			byte[] data = compression.compress(raw.array());
			var chunk = ByteBuffer.allocate(8 + data.length).order(ByteOrder.LITTLE_ENDIAN);
			chunk.putInt(dataWindow.getMinY() + row);
			chunk.putInt(data.length);
			chunk.put(data);
			chunks.add(chunk.array());
		}
		return chunks;
	}

	private static byte[] box(ImageWindow window) {
		// Maxima are inclusive in the file
		return ints(window.getMinX(), window.getMinY(), window.getMaxX() - 1, window.getMaxY() - 1);
	}

	static void writeAttribute(ByteArrayOutputStream out, String attributeName, String type, byte[] value) {
		writeString(out, attributeName);
		writeString(out, type);
		writeInt(out, value.length);
		out.writeBytes(value);
	}

	static void writeString(ByteArrayOutputStream out, String s) {
		out.writeBytes(s.getBytes(StandardCharsets.UTF_8));
		out.write(0);
	}

	static void writeInt(ByteArrayOutputStream out, int value) {
		out.writeBytes(ints(value));
	}

	static byte[] ints(int... values) {
		var buffer = ByteBuffer.allocate(4 * values.length).order(ByteOrder.LITTLE_ENDIAN);
		for (int v : values)
			buffer.putInt(v);
		return buffer.array();
	}

	static byte[] floats(float... values) {
		var buffer = ByteBuffer.allocate(4 * values.length).order(ByteOrder.LITTLE_ENDIAN);
		for (float v : values)
			buffer.putFloat(v);
		return buffer.array();
	}

}
