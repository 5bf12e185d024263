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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import exrview.lib.common.Task;
import exrview.lib.common.ThreadPool;
import exrview.lib.images.Channel;
import exrview.lib.images.ChannelSelector;
import exrview.lib.images.ImageData;
import exrview.lib.images.ImageLoadException;
import exrview.lib.images.ImageLoadException.ErrorType;
import exrview.lib.images.ImageWindow;
import exrview.lib.images.io.ExrHeader.ExrChannel;

/**
 * Loader for OpenEXR scanline images.
 * <p>
 * Single-part and multi-part files are supported, with uncompressed, RLE, ZIPS or ZIP compressed chunks
 * and channels of type HALF, FLOAT or UINT. Tiled and deep images, and other compressions, are not supported.
 * <p>
 * Only one part is read: the first that contains a channel accepted by the selector. Its chunks are
 * decoded in parallel, and subsampled channels are expanded to full resolution by repeating samples.
 * Color values in EXR files are premultiplied by alpha, so the result is marked as premultiplied.
 */
public class ExrImageLoader implements ImageLoader {

	private static final Logger logger = LoggerFactory.getLogger(ExrImageLoader.class);

	private static final byte[] MAGIC = {0x76, 0x2f, 0x31, 0x01};

	@Override
	public String getName() {
		return "OpenEXR";
	}

	@Override
	public boolean canLoadFile(InputStream stream) throws IOException {
		return Arrays.equals(stream.readNBytes(MAGIC.length), MAGIC);
	}

	@Override
	public Task<List<ImageData>> load(InputStream stream, Path path, ChannelSelector selector, ThreadPool pool, int priority) throws IOException {
		byte[] bytes = stream.readAllBytes();
		var buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
		if (bytes.length < 8 || buffer.getInt() != ExrHeader.MAGIC)
			throw new ImageLoadException(ErrorType.DECODE_ERROR, "Not an OpenEXR file.");
		boolean multipart = (buffer.getInt(4) & ExrHeader.FLAG_MULTIPART) != 0;

		var headers = ExrHeader.readHeaders(buffer);
		long[][] offsets = readOffsetTables(buffer, headers, multipart);

		int partIndex = choosePart(headers, selector);
		var header = headers.get(partIndex);
		logger.debug("Reading part {} of {} from {}: {}", partIndex + 1, headers.size(), path, header);

		var compression = ExrCompression.fromCode(header.getCompressionCode());
		int[] dw = header.getDataWindow();
		int[] dispW = header.getDisplayWindow();
		var dataWindow = ImageWindow.of(dw[0], dw[1], dw[2] + 1, dw[3] + 1);
		var displayWindow = ImageWindow.of(dispW[0], dispW[1], dispW[2] + 1, dispW[3] + 1);
		if (!dataWindow.isValid())
			throw new ImageLoadException(ErrorType.INVALID_WINDOW, String.format(
					"EXR image has invalid data window: [%d,%d] - [%d,%d]", dw[0], dw[1], dw[2] + 1, dw[3] + 1));
		if (!displayWindow.isValid())
			throw new ImageLoadException(ErrorType.INVALID_WINDOW, String.format(
					"EXR image has invalid display window: [%d,%d] - [%d,%d]", dispW[0], dispW[1], dispW[2] + 1, dispW[3] + 1));
		if ((long)dataWindow.getWidth() * dataWindow.getHeight() > Integer.MAX_VALUE - 8)
			throw new ImageLoadException(ErrorType.DECODE_ERROR, "EXR image is too large: " + dataWindow);

		var layout = new PartLayout(header, dw, compression, multipart ? partIndex : -1);
		var rawChannels = selectChannels(layout, selector);

		int width = dataWindow.getWidth();
		int height = dataWindow.getHeight();
		List<Channel> channels = new ArrayList<>();
		for (var raw : rawChannels) {
			if (raw.isSubsampled())
				channels.add(new Channel(raw.info.name, width, height));
			else
				channels.add(new Channel(raw.info.name, width, height, raw.values));
		}

		long[] partOffsets = offsets[partIndex];
		return pool.parallelFor(0, partOffsets.length, i -> decodeChunk(bytes, partOffsets[i], layout), priority)
				.thenCompose(v -> {
					List<Task<Void>> tasks = new ArrayList<>();
					for (int i = 0; i < rawChannels.size(); i++) {
						if (rawChannels.get(i).isSubsampled())
							tasks.add(rawChannels.get(i).upsampleTo(channels.get(i), layout, pool, priority));
					}
					return Task.allOf(tasks);
				})
				.handle((v, t) -> {
					if (t == null) {
						var data = new ImageData();
						for (var c : channels)
							data.addChannel(c);
						data.setDataWindow(dataWindow);
						data.setDisplayWindow(displayWindow);
						data.setHasPremultipliedAlpha(true);
						if (multipart)
							data.setPartName(header.getName());
						return List.of(data);
					}
					if (t instanceof UncheckedIOException)
						throw ((UncheckedIOException)t).getCause();
					if (t instanceof Exception)
						throw (Exception)t;
					throw (Error)t;
				});
	}

	private static long[][] readOffsetTables(ByteBuffer buffer, List<ExrHeader> headers, boolean multipart) throws ImageLoadException {
		long[][] offsets = new long[headers.size()][];
		try {
			for (int p = 0; p < headers.size(); p++) {
				var header = headers.get(p);
				int nChunks = header.getChunkCount();
				if (nChunks < 0) {
					if (multipart)
						throw new ImageLoadException(ErrorType.DECODE_ERROR, "EXR part " + p + " does not declare its chunk count.");
					int[] dw = header.getDataWindow();
					int linesPerChunk = ExrCompression.fromCode(header.getCompressionCode()).getLinesPerChunk();
					nChunks = (int)(((long)dw[3] - dw[1] + linesPerChunk) / linesPerChunk);
				}
				if (nChunks < 0 || (long)nChunks * 8 > buffer.remaining())
					throw new ImageLoadException(ErrorType.DECODE_ERROR, "Invalid EXR chunk count: " + nChunks);
				offsets[p] = new long[nChunks];
				for (int i = 0; i < nChunks; i++)
					offsets[p][i] = buffer.getLong();
			}
		} catch (BufferUnderflowException e) {
			throw new ImageLoadException(ErrorType.DECODE_ERROR, "Unexpected end of EXR offset table.", e);
		}
		return offsets;
	}

	private static int choosePart(List<ExrHeader> headers, ChannelSelector selector) {
		for (int i = 0; i < headers.size(); i++) {
			for (var c : headers.get(i).getChannels()) {
				if (selector.matches(c.name))
					return i;
			}
		}
		return 0;
	}

	private static List<RawChannel> selectChannels(PartLayout layout, ChannelSelector selector) throws ImageLoadException {
		List<RawChannel> matches = new ArrayList<>();
		var headerChannels = layout.header.getChannels();
		for (int i = 0; i < headerChannels.size(); i++) {
			var info = headerChannels.get(i);
			int rank = selector.matchRank(info.name);
			if (rank < 0)
				continue;
			var raw = new RawChannel(info, rank, layout);
			layout.rawChannels[i] = raw;
			matches.add(raw);
		}
		if (matches.isEmpty())
			throw new ImageLoadException(ErrorType.NO_MATCHING_CHANNELS, "No channels match '" + selector + "'.");
		if (!selector.isEmpty())
			matches.sort(Comparator.comparingInt(r -> r.rank));
		return matches;
	}

	private static void decodeChunk(byte[] bytes, long offset, PartLayout layout) {
		try {
			if (offset <= 0 || offset > bytes.length - 8)
				throw new ImageLoadException(ErrorType.DECODE_ERROR, "Invalid chunk offset " + offset + " (file may be incomplete)");
			var chunk = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
			chunk.position((int)offset);
			if (layout.partNumber >= 0) {
				int part = chunk.getInt();
				if (part != layout.partNumber)
					throw new ImageLoadException(ErrorType.DECODE_ERROR, "Chunk belongs to part " + part + ", expected part " + layout.partNumber);
			}
			int y = chunk.getInt();
			int size = chunk.getInt();
			if (y < layout.minY || y > layout.maxY)
				throw new ImageLoadException(ErrorType.DECODE_ERROR, "Chunk line " + y + " is outside the data window");
			if (size < 0 || size > chunk.remaining())
				throw new ImageLoadException(ErrorType.DECODE_ERROR, "Invalid chunk size " + size);

			int lastLine = (int)Math.min((long)y + layout.compression.getLinesPerChunk() - 1, layout.maxY);
			var channels = layout.header.getChannels();
			int expectedSize = 0;
			for (int line = y; line <= lastLine; line++) {
				for (int c = 0; c < channels.size(); c++) {
					if (Math.floorMod(line, channels.get(c).ySampling) == 0)
						expectedSize += layout.sampledWidths[c] * channels.get(c).bytesPerSample();
				}
			}

			byte[] raw = layout.compression.decompress(bytes, chunk.position(), size, expectedSize);
			var pixels = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
			for (int line = y; line <= lastLine; line++) {
				for (int c = 0; c < channels.size(); c++) {
					var info = channels.get(c);
					if (Math.floorMod(line, info.ySampling) != 0)
						continue;
					int sampledWidth = layout.sampledWidths[c];
					var target = layout.rawChannels[c];
					if (target == null) {
						pixels.position(pixels.position() + sampledWidth * info.bytesPerSample());
						continue;
					}
					int base = (Math.floorDiv(line, info.ySampling) - target.firstSampleY) * sampledWidth;
					for (int x = 0; x < sampledWidth; x++)
						target.values[base + x] = readSample(pixels, info.pixelType);
				}
			}
		} catch (ImageLoadException e) {
			throw new UncheckedIOException(e);
		} catch (BufferUnderflowException | IndexOutOfBoundsException | IllegalArgumentException e) {
			throw new UncheckedIOException(new ImageLoadException(ErrorType.DECODE_ERROR, "Corrupt EXR chunk at offset " + offset, e));
		}
	}

	private static float readSample(ByteBuffer pixels, int pixelType) {
		switch (pixelType) {
		case ExrHeader.PIXEL_TYPE_HALF:
			return halfToFloat(pixels.getShort());
		case ExrHeader.PIXEL_TYPE_FLOAT:
			return pixels.getFloat();
		case ExrHeader.PIXEL_TYPE_UINT:
			return (float)(pixels.getInt() & 0xffffffffL);
		default:
			throw new IllegalArgumentException("Invalid pixel type " + pixelType);
		}
	}

	/**
	 * Convert a 16-bit IEEE 754 half-precision value to a float.
	 * @param value the half-precision bits
	 * @return
	 */
	static float halfToFloat(short value) {
		int mantissa = value & 0x03ff;
		int exponent = value & 0x7c00;

		if (exponent == 0x7c00) {
			// NaN or infinity
			exponent = 0x3fc00;
		} else if (exponent != 0) {
			exponent += 0x1c000;
		} else if (mantissa != 0) {
			// subnormal: normalize
			exponent = 0x1c400;
			do {
				mantissa <<= 1;
				exponent -= 0x400;
			} while ((mantissa & 0x400) == 0);
			mantissa &= 0x3ff;
		}
		return Float.intBitsToFloat((value & 0x8000) << 16 | (exponent | mantissa) << 13);
	}

	private static int ceilDiv(int a, int b) {
		return -Math.floorDiv(-a, b);
	}


	/**
	 * Geometry of the part being decoded, shared by all chunks.
	 */
	private static class PartLayout {

		private final ExrHeader header;
		private final ExrCompression compression;
		private final int partNumber;
		private final int minX;
		private final int minY;
		private final int maxX;
		private final int maxY;
		private final int[] sampledWidths;
		private final RawChannel[] rawChannels;

		PartLayout(ExrHeader header, int[] dataWindow, ExrCompression compression, int partNumber) throws ImageLoadException {
			this.header = header;
			this.compression = compression;
			this.partNumber = partNumber;
			this.minX = dataWindow[0];
			this.minY = dataWindow[1];
			this.maxX = dataWindow[2];
			this.maxY = dataWindow[3];
			var channels = header.getChannels();
			this.sampledWidths = new int[channels.size()];
			for (int c = 0; c < channels.size(); c++) {
				int xSampling = channels.get(c).xSampling;
				sampledWidths[c] = Math.floorDiv(maxX, xSampling) - ceilDiv(minX, xSampling) + 1;
				if (sampledWidths[c] <= 0)
					throw new ImageLoadException(ErrorType.DECODE_ERROR, "Channel " + channels.get(c).name + " has no samples in the data window");
			}
			this.rawChannels = new RawChannel[channels.size()];
		}

	}

	/**
	 * Decoded samples of one channel, before upsampling.
	 */
	private static class RawChannel {

		private final ExrChannel info;
		private final int rank;
		private final int firstSampleX;
		private final int firstSampleY;
		private final int sampledWidth;
		private final int sampledHeight;
		private final float[] values;

		RawChannel(ExrChannel info, int rank, PartLayout layout) throws ImageLoadException {
			this.info = info;
			this.rank = rank;
			this.firstSampleX = ceilDiv(layout.minX, info.xSampling);
			this.firstSampleY = ceilDiv(layout.minY, info.ySampling);
			this.sampledWidth = Math.floorDiv(layout.maxX, info.xSampling) - firstSampleX + 1;
			this.sampledHeight = Math.floorDiv(layout.maxY, info.ySampling) - firstSampleY + 1;
			if (sampledWidth <= 0 || sampledHeight <= 0)
				throw new ImageLoadException(ErrorType.DECODE_ERROR, "Channel " + info.name + " has no samples in the data window");
			this.values = new float[sampledWidth * sampledHeight];
		}

		boolean isSubsampled() {
			return info.xSampling != 1 || info.ySampling != 1;
		}

		/**
		 * Fill a full-resolution channel by repeating the nearest preceding sample.
		 */
		Task<Void> upsampleTo(Channel channel, PartLayout layout, ThreadPool pool, int priority) {
			int width = channel.getWidth();
			float[] data = channel.getData();
			return pool.parallelFor(0, channel.getHeight(), y -> {
				int sy = Math.min(Math.max(Math.floorDiv(layout.minY + y, info.ySampling) - firstSampleY, 0), sampledHeight - 1);
				for (int x = 0; x < width; x++) {
					int sx = Math.min(Math.max(Math.floorDiv(layout.minX + x, info.xSampling) - firstSampleX, 0), sampledWidth - 1);
					data[x + y * width] = values[sx + sy * sampledWidth];
				}
			}, priority);
		}

	}

}
