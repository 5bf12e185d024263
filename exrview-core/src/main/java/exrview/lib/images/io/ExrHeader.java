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

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exrview.lib.images.ImageLoadException;
import exrview.lib.images.ImageLoadException.ErrorType;

/**
 * The header of one part of an OpenEXR file.
 * <p>
 * Only the attributes needed to decode scanline images are interpreted; all others are skipped.
 * Windows are stored exactly as in the file, i.e. with inclusive upper bounds.
 */
final class ExrHeader {

	static final int MAGIC = 20000630;

	static final int FLAG_TILED = 0x200;
	static final int FLAG_LONG_NAMES = 0x400;
	static final int FLAG_DEEP = 0x800;
	static final int FLAG_MULTIPART = 0x1000;

	static final int PIXEL_TYPE_UINT = 0;
	static final int PIXEL_TYPE_HALF = 1;
	static final int PIXEL_TYPE_FLOAT = 2;

	private static final int MAX_NAME_LENGTH = 255;

	/**
	 * A single entry of the channel list.
	 */
	static final class ExrChannel {

		final String name;
		final int pixelType;
		final int xSampling;
		final int ySampling;

		ExrChannel(String name, int pixelType, int xSampling, int ySampling) {
			this.name = name;
			this.pixelType = pixelType;
			this.xSampling = xSampling;
			this.ySampling = ySampling;
		}

		int bytesPerSample() {
			return pixelType == PIXEL_TYPE_HALF ? 2 : 4;
		}

		@Override
		public String toString() {
			return name + " (type=" + pixelType + ", sampling=" + xSampling + "x" + ySampling + ")";
		}

	}

	private List<ExrChannel> channels;
	private int compressionCode = -1;
	private int[] dataWindow;
	private int[] displayWindow;
	private String name = "";
	private String type;
	private int chunkCount = -1;
	private boolean hasTiles;

	private ExrHeader() {}

	/**
	 * Read all part headers, leaving the buffer positioned at the start of the offset tables.
	 * @param buffer little-endian buffer positioned just after the magic number
	 * @return the headers, one per part
	 * @throws ImageLoadException if the file is malformed or uses unsupported features
	 */
	static List<ExrHeader> readHeaders(ByteBuffer buffer) throws ImageLoadException {
		try {
			int version = buffer.getInt();
			if ((version & 0xff) != 2)
				throw new ImageLoadException(ErrorType.DECODE_ERROR, "Unsupported EXR version " + (version & 0xff));
			if ((version & FLAG_DEEP) != 0)
				throw new ImageLoadException(ErrorType.DECODE_ERROR, "Deep EXR images are not supported.");

			List<ExrHeader> headers = new ArrayList<>();
			if ((version & FLAG_MULTIPART) != 0) {
				while (buffer.get(buffer.position()) != 0)
					headers.add(readHeader(buffer, true));
				buffer.get();
			} else {
				if ((version & FLAG_TILED) != 0)
					throw new ImageLoadException(ErrorType.DECODE_ERROR, "Tiled EXR images are not supported.");
				headers.add(readHeader(buffer, false));
			}
			if (headers.isEmpty())
				throw new ImageLoadException(ErrorType.DECODE_ERROR, "EXR image does not contain any parts.");
			return headers;
		} catch (BufferUnderflowException | IndexOutOfBoundsException e) {
			throw new ImageLoadException(ErrorType.DECODE_ERROR, "Unexpected end of EXR header.", e);
		}
	}

	private static ExrHeader readHeader(ByteBuffer buffer, boolean multipart) throws ImageLoadException {
		var header = new ExrHeader();
		while (true) {
			String attributeName = readString(buffer);
			if (attributeName.isEmpty())
				break;
			String attributeType = readString(buffer);
			int size = buffer.getInt();
			if (size < 0 || size > buffer.remaining())
				throw new ImageLoadException(ErrorType.DECODE_ERROR, "Invalid size " + size + " of attribute " + attributeName);
			var value = buffer.slice(buffer.position(), size).order(buffer.order());
			buffer.position(buffer.position() + size);

			switch (attributeName) {
			case "channels":
				header.channels = readChannelList(value);
				break;
			case "compression":
				header.compressionCode = value.get() & 0xff;
				break;
			case "dataWindow":
				header.dataWindow = readBox2i(value);
				break;
			case "displayWindow":
				header.displayWindow = readBox2i(value);
				break;
			case "name":
				header.name = new String(readBytes(value, size), StandardCharsets.UTF_8);
				break;
			case "type":
				header.type = new String(readBytes(value, size), StandardCharsets.UTF_8);
				break;
			case "chunkCount":
				header.chunkCount = value.getInt();
				break;
			case "tiles":
				header.hasTiles = true;
				break;
			default:
				break;
			}
		}
		header.validate(multipart);
		return header;
	}

	private void validate(boolean multipart) throws ImageLoadException {
		if (channels == null)
			throw new ImageLoadException(ErrorType.DECODE_ERROR, "EXR header is missing the channel list.");
		if (dataWindow == null || displayWindow == null)
			throw new ImageLoadException(ErrorType.DECODE_ERROR, "EXR header is missing the data or display window.");
		if (compressionCode < 0)
			throw new ImageLoadException(ErrorType.DECODE_ERROR, "EXR header is missing the compression attribute.");
		if (multipart && type != null && !"scanlineimage".equals(type))
			throw new ImageLoadException(ErrorType.DECODE_ERROR, "EXR parts of type '" + type + "' are not supported.");
		if (hasTiles && (type == null || !"scanlineimage".equals(type)))
			throw new ImageLoadException(ErrorType.DECODE_ERROR, "Tiled EXR images are not supported.");
	}

	private static List<ExrChannel> readChannelList(ByteBuffer value) throws ImageLoadException {
		List<ExrChannel> list = new ArrayList<>();
		while (true) {
			String channelName = readString(value);
			if (channelName.isEmpty())
				break;
			int pixelType = value.getInt();
			// pLinear and three reserved bytes
			value.position(value.position() + 4);
			int xSampling = value.getInt();
			int ySampling = value.getInt();
			if (pixelType < PIXEL_TYPE_UINT || pixelType > PIXEL_TYPE_FLOAT)
				throw new ImageLoadException(ErrorType.DECODE_ERROR, "Invalid pixel type " + pixelType + " of channel " + channelName);
			if (xSampling < 1 || ySampling < 1)
				throw new ImageLoadException(ErrorType.DECODE_ERROR, "Invalid sampling of channel " + channelName);
			list.add(new ExrChannel(channelName, pixelType, xSampling, ySampling));
		}
		return Collections.unmodifiableList(list);
	}

	private static int[] readBox2i(ByteBuffer value) {
		return new int[] {value.getInt(), value.getInt(), value.getInt(), value.getInt()};
	}

	private static byte[] readBytes(ByteBuffer buffer, int n) {
		byte[] bytes = new byte[n];
		buffer.get(bytes);
		return bytes;
	}

	private static String readString(ByteBuffer buffer) throws ImageLoadException {
		int start = buffer.position();
		int end = start;
		while (buffer.get(end) != 0) {
			end++;
			if (end - start > MAX_NAME_LENGTH)
				throw new ImageLoadException(ErrorType.DECODE_ERROR, "EXR attribute or channel name is too long.");
		}
		byte[] bytes = readBytes(buffer, end - start);
		buffer.get();
		return new String(bytes, StandardCharsets.UTF_8);
	}

	List<ExrChannel> getChannels() {
		return channels;
	}

	int getCompressionCode() {
		return compressionCode;
	}

	/**
	 * Data window as {minX, minY, maxX, maxY}, with inclusive maxima.
	 */
	int[] getDataWindow() {
		return dataWindow.clone();
	}

	int[] getDisplayWindow() {
		return displayWindow.clone();
	}

	String getName() {
		return name;
	}

	/**
	 * Get the number of chunks declared in the header.
	 * @return the count, or -1 if the header does not declare it
	 */
	int getChunkCount() {
		return chunkCount;
	}

	@Override
	public String toString() {
		return "ExrHeader[name=" + name + ", channels=" + channels + ", compression=" + compressionCode + "]";
	}

}
