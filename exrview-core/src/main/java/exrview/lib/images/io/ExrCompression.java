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
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

import exrview.lib.images.ImageLoadException;
import exrview.lib.images.ImageLoadException.ErrorType;

/**
 * Compression methods of OpenEXR scanline chunks that can be read and written.
 */
enum ExrCompression {

	NONE(0, 1),
	RLE(1, 1),
	ZIPS(2, 1),
	ZIP(3, 16);

	private static final String[] ALL_NAMES = {
			"NONE", "RLE", "ZIPS", "ZIP", "PIZ", "PXR24", "B44", "B44A", "DWAA", "DWAB"
	};

	private final int code;
	private final int linesPerChunk;

	ExrCompression(int code, int linesPerChunk) {
		this.code = code;
		this.linesPerChunk = linesPerChunk;
	}

	/**
	 * Get the code stored in a file header.
	 * @return
	 */
	int getCode() {
		return code;
	}

	/**
	 * Get the number of scanlines stored in each chunk.
	 * @return
	 */
	int getLinesPerChunk() {
		return linesPerChunk;
	}

	/**
	 * Get the compression for the code stored in a file header.
	 * @param code
	 * @return
	 * @throws ImageLoadException if the compression is unknown or not supported
	 */
	static ExrCompression fromCode(int code) throws ImageLoadException {
		for (var c : values()) {
			if (c.code == code)
				return c;
		}
		String name = code >= 0 && code < ALL_NAMES.length ? ALL_NAMES[code] : "code " + code;
		throw new ImageLoadException(ErrorType.DECODE_ERROR, "EXR compression " + name + " is not supported.");
	}

	/**
	 * Decompress the data of one chunk.
	 * <p>
	 * A chunk whose stored size equals its uncompressed size is stored without compression,
	 * whatever the compression of the part.
	 *
	 * @param data buffer holding the compressed data
	 * @param offset start of the data in the buffer
	 * @param length number of compressed bytes
	 * @param expectedSize number of bytes after decompression
	 * @return the uncompressed bytes
	 * @throws ImageLoadException if the data cannot be decompressed to the expected size
	 */
	byte[] decompress(byte[] data, int offset, int length, int expectedSize) throws ImageLoadException {
		if (this == NONE || length == expectedSize) {
			if (length != expectedSize)
				throw new ImageLoadException(ErrorType.DECODE_ERROR,
						String.format("Uncompressed chunk has %d bytes, but %d were expected", length, expectedSize));
			byte[] out = new byte[expectedSize];
			System.arraycopy(data, offset, out, 0, length);
			return out;
		}
		byte[] predicted = this == RLE ? decodeRunLength(data, offset, length, expectedSize) : inflate(data, offset, length, expectedSize);
		return interleave(predict(predicted));
	}

	/**
	 * Compress the data of one chunk.
	 * <p>
	 * If compression does not make the data smaller, the raw bytes are returned, and should be stored as they are.
	 *
	 * @param raw the uncompressed bytes
	 * @return the bytes to store
	 */
	byte[] compress(byte[] raw) {
		if (this == NONE)
			return raw;
		byte[] prepared = unpredict(split(raw));
		byte[] compressed = this == RLE ? encodeRunLength(prepared) : deflate(prepared);
		return compressed.length < raw.length ? compressed : raw;
	}

	private static byte[] deflate(byte[] bytes) {
		var deflater = new Deflater();
		try {
			deflater.setInput(bytes);
			deflater.finish();
			var out = new ByteArrayOutputStream();
			byte[] buffer = new byte[8192];
			while (!deflater.finished()) {
				int n = deflater.deflate(buffer);
				out.write(buffer, 0, n);
			}
			return out.toByteArray();
		} finally {
			deflater.end();
		}
	}

	private static byte[] encodeRunLength(byte[] in) {
		var out = new ByteArrayOutputStream();
		int i = 0;
		while (i < in.length) {
			int runEnd = i + 1;
			while (runEnd < in.length && in[runEnd] == in[i] && runEnd - i < 128)
				runEnd++;
			int runLength = runEnd - i;
			if (runLength >= 3) {
				out.write(runLength - 1);
				out.write(in[i]);
				i = runEnd;
			} else {
				// Literal bytes continue until the next run of at least 3
				int literalEnd = i;
				while (literalEnd < in.length && literalEnd - i < 127) {
					if (literalEnd + 2 < in.length && in[literalEnd] == in[literalEnd + 1] && in[literalEnd] == in[literalEnd + 2])
						break;
					literalEnd++;
				}
				out.write(-(literalEnd - i));
				out.write(in, i, literalEnd - i);
				i = literalEnd;
			}
		}
		return out.toByteArray();
	}

	private static byte[] inflate(byte[] data, int offset, int length, int expectedSize) throws ImageLoadException {
		byte[] out = new byte[expectedSize];
		var inflater = new Inflater();
		try {
			inflater.setInput(data, offset, length);
			int n = 0;
			while (n < expectedSize && !inflater.finished()) {
				int count = inflater.inflate(out, n, expectedSize - n);
				if (count == 0 && (inflater.needsInput() || inflater.needsDictionary()))
					break;
				n += count;
			}
			if (n != expectedSize)
				throw new ImageLoadException(ErrorType.DECODE_ERROR,
						String.format("ZIP chunk decompressed to %d bytes, but %d were expected", n, expectedSize));
			return out;
		} catch (DataFormatException e) {
			throw new ImageLoadException(ErrorType.DECODE_ERROR, "Broken compressed data in ZIP chunk: " + e.getMessage(), e);
		} finally {
			inflater.end();
		}
	}

	private static byte[] decodeRunLength(byte[] data, int offset, int length, int expectedSize) throws ImageLoadException {
		byte[] out = new byte[expectedSize];
		int in = offset;
		int end = offset + length;
		int n = 0;
		while (in < end) {
			int count = data[in++];
			if (count < 0) {
				count = -count;
				if (n + count > expectedSize || in + count > end)
					throw new ImageLoadException(ErrorType.DECODE_ERROR, "Corrupt RLE chunk");
				System.arraycopy(data, in, out, n, count);
				in += count;
				n += count;
			} else {
				count++;
				if (n + count > expectedSize || in >= end)
					throw new ImageLoadException(ErrorType.DECODE_ERROR, "Corrupt RLE chunk");
				byte value = data[in++];
				for (int i = 0; i < count; i++)
					out[n++] = value;
			}
		}
		if (n != expectedSize)
			throw new ImageLoadException(ErrorType.DECODE_ERROR,
					String.format("RLE chunk decompressed to %d bytes, but %d were expected", n, expectedSize));
		return out;
	}

	/**
	 * Undo the delta predictor applied before compression.
	 */
	static byte[] predict(byte[] bytes) {
		for (int i = 1; i < bytes.length; i++)
			bytes[i] = (byte)(bytes[i - 1] + bytes[i] - 128);
		return bytes;
	}

	/**
	 * Undo the split of bytes into two halves, so that the first half holds the even bytes.
	 */
	static byte[] interleave(byte[] bytes) {
		byte[] out = new byte[bytes.length];
		int t1 = 0;
		int t2 = (bytes.length + 1) / 2;
		int s = 0;
		while (s < out.length) {
			out[s++] = bytes[t1++];
			if (s < out.length)
				out[s++] = bytes[t2++];
		}
		return out;
	}

	/**
	 * Apply the delta predictor; the inverse of {@link #predict(byte[])}.
	 */
	static byte[] unpredict(byte[] bytes) {
		for (int i = bytes.length - 1; i > 0; i--)
			bytes[i] = (byte)(bytes[i] - bytes[i - 1] + 128);
		return bytes;
	}

	/**
	 * Move the even bytes into the first half and the odd bytes into the second; the inverse of {@link #interleave(byte[])}.
	 */
	static byte[] split(byte[] bytes) {
		byte[] out = new byte[bytes.length];
		int t1 = 0;
		int t2 = (bytes.length + 1) / 2;
		for (int i = 0; i < bytes.length; i++) {
			if (i % 2 == 0)
				out[t1++] = bytes[i];
			else
				out[t2++] = bytes[i];
		}
		return out;
	}

}
