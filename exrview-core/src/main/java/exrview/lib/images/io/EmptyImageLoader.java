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
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

import exrview.lib.common.Task;
import exrview.lib.common.ThreadPool;
import exrview.lib.images.Channel;
import exrview.lib.images.ChannelSelector;
import exrview.lib.images.ImageData;
import exrview.lib.images.ImageLoadException;
import exrview.lib.images.ImageLoadException.ErrorType;
import exrview.lib.images.ImageWindow;

/**
 * Loader for placeholder images, whose channels are all zero.
 * <p>
 * The format is plain text: {@code empty <width> <height> <nChannels>}, followed by each channel name
 * written as {@code <byteLength> <name>}, where the name is exactly {@code byteLength} bytes of UTF-8
 * following a single separator. This allows channel names to contain whitespace.
 * Such images are typically created by an external process, which later fills in the pixels with
 * {@link exrview.lib.images.Image#updateChannel(String, int, int, int, int, float[])}.
 */
public class EmptyImageLoader implements ImageLoader {

	private static final byte[] MAGIC = "empty".getBytes(StandardCharsets.US_ASCII);

	private static final int MAX_TOKEN_LENGTH = 32;

	@Override
	public String getName() {
		return "Empty";
	}

	@Override
	public boolean canLoadFile(InputStream stream) throws IOException {
		byte[] bytes = stream.readNBytes(MAGIC.length);
		return Arrays.equals(bytes, MAGIC);
	}

	@Override
	public Task<List<ImageData>> load(InputStream stream, Path path, ChannelSelector selector, ThreadPool pool, int priority) throws IOException {
		String magic = readToken(stream);
		if (!"empty".equals(magic))
			throw new ImageLoadException(ErrorType.DECODE_ERROR, "Invalid magic empty string " + magic);

		int width = readInt(stream, "width");
		int height = readInt(stream, "height");
		int nChannels = readInt(stream, "number of channels");
		if (width <= 0 || height <= 0)
			throw new ImageLoadException(ErrorType.DECODE_ERROR, "Image has zero pixels.");
		if (nChannels < 0)
			throw new ImageLoadException(ErrorType.DECODE_ERROR, "Invalid number of channels: " + nChannels);

		var data = new ImageData();
		// all zero, so already premultiplied
		data.setHasPremultipliedAlpha(true);
		var layerNames = new TreeSet<String>();
		for (int i = 0; i < nChannels; i++) {
			int length = readInt(stream, "channel name length");
			if (length < 0)
				throw new ImageLoadException(ErrorType.DECODE_ERROR, "Invalid channel name length: " + length);
			byte[] nameBytes = stream.readNBytes(length);
			if (nameBytes.length != length)
				throw new ImageLoadException(ErrorType.STREAM_ERROR, "Unexpected end of file while reading channel " + i);
			String channelName = new String(nameBytes, StandardCharsets.UTF_8);
			data.addChannel(new Channel(channelName, width, height));
			layerNames.add(Channel.head(channelName));
		}
		for (String layer : layerNames)
			data.addLayer(layer);

		if (nChannels > 0) {
			var window = ImageWindow.ofSize(width, height);
			data.setDataWindow(window);
			data.setDisplayWindow(window);
		}
		return Task.completed(List.of(data));
	}

	/**
	 * Read a whitespace-delimited token, consuming the single whitespace character that ends it.
	 */
	private static String readToken(InputStream stream) throws IOException {
		int b = stream.read();
		while (b >= 0 && Character.isWhitespace(b))
			b = stream.read();
		var sb = new StringBuilder();
		while (b >= 0 && !Character.isWhitespace(b)) {
			if (sb.length() >= MAX_TOKEN_LENGTH)
				throw new ImageLoadException(ErrorType.DECODE_ERROR, "Header token is too long: " + sb + "...");
			sb.append((char)b);
			b = stream.read();
		}
		if (sb.length() == 0)
			throw new ImageLoadException(ErrorType.STREAM_ERROR, "Unexpected end of file");
		return sb.toString();
	}

	private static int readInt(InputStream stream, String description) throws IOException {
		String token = readToken(stream);
		try {
			return Integer.parseInt(token);
		} catch (NumberFormatException e) {
			throw new ImageLoadException(ErrorType.DECODE_ERROR, "Invalid " + description + ": " + token, e);
		}
	}

}
