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

package exrview.lib.images;

import java.util.Arrays;
import java.util.Objects;

import exrview.lib.common.Task;
import exrview.lib.common.ThreadPool;

/**
 * A single named plane of float values, stored row by row.
 * <p>
 * Channel names are dot-delimited: the part before the last dot is the layer (the 'head'),
 * and the part after it is the 'tail', e.g. {@code diffuse.R}.
 */
public class Channel {

	private final String name;
	private final int width;
	private final int height;
	private final float[] data;

	/**
	 * Create a zero-filled channel.
	 * @param name
	 * @param width
	 * @param height
	 */
	public Channel(String name, int width, int height) {
		this(name, width, height, new float[checkedCount(width, height)]);
	}

	/**
	 * Create a channel wrapping existing row-major data.
	 * The array is used directly, not copied.
	 * @param name
	 * @param width
	 * @param height
	 * @param data
	 */
	public Channel(String name, int width, int height, float[] data) {
		this.name = Objects.requireNonNull(name);
		if (data.length != checkedCount(width, height))
			throw new IllegalArgumentException(
					String.format("Channel %s needs %d values for %d x %d pixels, but %d were given", name, (long)width*height, width, height, data.length));
		this.width = width;
		this.height = height;
		this.data = data;
	}

	private static int checkedCount(int width, int height) {
		if (width < 0 || height < 0)
			throw new IllegalArgumentException("Channel size must not be negative (" + width + " x " + height + ")");
		long n = (long)width * height;
		if (n > Integer.MAX_VALUE - 8)
			throw new IllegalArgumentException("Channel is too large (" + width + " x " + height + ")");
		return (int)n;
	}

	public String getName() {
		return name;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	/**
	 * Get the number of values, i.e. width * height.
	 * @return
	 */
	public int getCount() {
		return data.length;
	}

	/**
	 * Get the size of the channel as a window with its origin at 0.
	 * @return
	 */
	public ImageWindow getSize() {
		return ImageWindow.ofSize(width, height);
	}

	/**
	 * Direct access to the underlying row-major data.
	 * @return
	 */
	public float[] getData() {
		return data;
	}

	/**
	 * Get the value at a linear index, or 0 if the index is out of range.
	 * @param index
	 * @return
	 */
	public float eval(int index) {
		if (index < 0 || index >= data.length)
			return 0;
		return data[index];
	}

	/**
	 * Get the value at a pixel, or 0 if the pixel is outside the channel.
	 * @param x
	 * @param y
	 * @return
	 */
	public float eval(int x, int y) {
		if (x < 0 || x >= width || y < 0 || y >= height)
			return 0;
		return data[x + y * width];
	}

	/**
	 * Get the value at a linear index, without bounds checks beyond those of the array.
	 * @param index
	 * @return
	 */
	public float at(int index) {
		return data[index];
	}

	/**
	 * Get the value at a pixel, without bounds checks beyond those of the array.
	 * @param x
	 * @param y
	 * @return
	 */
	public float at(int x, int y) {
		return data[x + y * width];
	}

	/**
	 * Set the value at a linear index.
	 * @param index
	 * @param value
	 */
	public void set(int index, float value) {
		data[index] = value;
	}

	/**
	 * Set the value at a pixel.
	 * @param x
	 * @param y
	 * @param value
	 */
	public void set(int x, int y, float value) {
		data[x + y * width] = value;
	}

	/**
	 * Set all values to 0.
	 */
	public void setZero() {
		Arrays.fill(data, 0f);
	}

	/**
	 * Multiply every value in place by the corresponding value of another channel.
	 * <p>
	 * The other channel must have the same number of values.
	 *
	 * @param other
	 * @param pool
	 * @param priority
	 * @return a task that completes once every value has been updated
	 */
	public Task<Void> multiplyWith(Channel other, ThreadPool pool, int priority) {
		float[] otherData = other.data;
		return pool.parallelFor(0, other.getCount(), i -> data[i] *= otherData[i], priority);
	}

	/**
	 * Divide every value in place by the corresponding value of another channel.
	 * <p>
	 * Wherever the divisor is exactly 0 the result is set to 0, rather than infinity or NaN.
	 * The other channel must have the same number of values.
	 *
	 * @param other
	 * @param pool
	 * @param priority
	 * @return a task that completes once every value has been updated
	 */
	public Task<Void> divideBy(Channel other, ThreadPool pool, int priority) {
		float[] otherData = other.data;
		return pool.parallelFor(0, other.getCount(), i -> {
			float divisor = otherData[i];
			if (divisor != 0)
				data[i] /= divisor;
			else
				data[i] = 0;
		}, priority);
	}

	/**
	 * Overwrite a rectangular region with new row-major values.
	 * <p>
	 * Coordinates are not checked against the channel bounds.
	 *
	 * @param x
	 * @param y
	 * @param tileWidth
	 * @param tileHeight
	 * @param newData at least {@code tileWidth * tileHeight} values
	 */
	public void updateTile(int x, int y, int tileWidth, int tileHeight, float[] newData) {
		for (int posY = 0; posY < tileHeight; posY++)
			System.arraycopy(newData, posY * tileWidth, data, x + (y + posY) * width, tileWidth);
	}

	/**
	 * Split a full channel name into its head (layer) and tail.
	 * @param fullChannel
	 * @return a two-element array {head, tail}; the head is empty if there is no dot
	 */
	public static String[] split(String fullChannel) {
		int dotPosition = fullChannel.lastIndexOf('.');
		if (dotPosition < 0)
			return new String[] {"", fullChannel};
		return new String[] {fullChannel.substring(0, dotPosition), fullChannel.substring(dotPosition + 1)};
	}

	/**
	 * Get the part of the name after the last dot.
	 * @param fullChannel
	 * @return
	 */
	public static String tail(String fullChannel) {
		return split(fullChannel)[1];
	}

	/**
	 * Get the part of the name before the last dot, i.e. the layer name.
	 * @param fullChannel
	 * @return the layer, or an empty string for channels in the root layer
	 */
	public static String head(String fullChannel) {
		return split(fullChannel)[0];
	}

	/**
	 * Returns true if the channel belongs to the root layer.
	 * @param fullChannel
	 * @return
	 */
	public static boolean isTopmost(String fullChannel) {
		return fullChannel.indexOf('.') < 0;
	}

	@Override
	public String toString() {
		return "Channel: " + name + " (" + width + " x " + height + ")";
	}

}
