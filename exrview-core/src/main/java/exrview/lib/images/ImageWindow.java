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

/**
 * Integer rectangle used for the data and display windows of an image.
 * <p>
 * The minimum corner is inclusive and the maximum corner is exclusive, so that the size is
 * simply {@code max - min}.
 */
public final class ImageWindow {

	/**
	 * An empty (invalid) window.
	 */
	public static final ImageWindow EMPTY = new ImageWindow(0, 0, 0, 0);

	private final int minX;
	private final int minY;
	private final int maxX;
	private final int maxY;

	private ImageWindow(int minX, int minY, int maxX, int maxY) {
		this.minX = minX;
		this.minY = minY;
		this.maxX = maxX;
		this.maxY = maxY;
	}

	/**
	 * Create a window from its corners.
	 * @param minX inclusive minimum x
	 * @param minY inclusive minimum y
	 * @param maxX exclusive maximum x
	 * @param maxY exclusive maximum y
	 * @return
	 */
	public static ImageWindow of(int minX, int minY, int maxX, int maxY) {
		return new ImageWindow(minX, minY, maxX, maxY);
	}

	/**
	 * Create a window with its minimum corner at the origin.
	 * @param width
	 * @param height
	 * @return
	 */
	public static ImageWindow ofSize(int width, int height) {
		if (width < 0)
			throw new IllegalArgumentException("Width must be >= 0! Requested width = " + width);
		if (height < 0)
			throw new IllegalArgumentException("Height must be >= 0! Requested height = " + height);
		return new ImageWindow(0, 0, width, height);
	}

	/**
	 * Returns true if the window has a positive extent along both axes.
	 * @return
	 */
	public boolean isValid() {
		return maxX > minX && maxY > minY;
	}

	public int getMinX() {
		return minX;
	}

	public int getMinY() {
		return minY;
	}

	public int getMaxX() {
		return maxX;
	}

	public int getMaxY() {
		return maxY;
	}

	/**
	 * Get the width, i.e. {@code maxX - minX}.
	 * @return
	 */
	public int getWidth() {
		return maxX - minX;
	}

	/**
	 * Get the height, i.e. {@code maxY - minY}.
	 * @return
	 */
	public int getHeight() {
		return maxY - minY;
	}

	/**
	 * Returns true if this window has the same width and height as another, regardless of position.
	 * @param other
	 * @return
	 */
	public boolean sameSize(ImageWindow other) {
		return getWidth() == other.getWidth() && getHeight() == other.getHeight();
	}

	@Override
	public String toString() {
		return "(" + minX + ", " + minY + ")(" + maxX + ", " + maxY + ")";
	}

	@Override
	public int hashCode() {
		int result = 31 + minX;
		result = 31 * result + minY;
		result = 31 * result + maxX;
		return 31 * result + maxY;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ImageWindow))
			return false;
		ImageWindow other = (ImageWindow)obj;
		return minX == other.minX && minY == other.minY && maxX == other.maxX && maxY == other.maxY;
	}

}
