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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import exrview.lib.common.ThreadPool;
import exrview.lib.images.ImageLoadException.ErrorType;

@SuppressWarnings("javadoc")
public class TestImageData {

	private static ThreadPool pool;

	@BeforeAll
	public static void createPool() {
		pool = new ThreadPool(2);
	}

	@AfterAll
	public static void shutdownPool() {
		pool.shutdown();
	}

	static Channel filled(String name, int width, int height, float value) {
		float[] values = new float[width * height];
		Arrays.fill(values, value);
		return new Channel(name, width, height, values);
	}

	static ImageData createData(int width, int height, String... channelNames) {
		var data = new ImageData();
		for (String name : channelNames)
			data.addChannel(filled(name, width, height, name.endsWith("A") ? 0.5f : 1f));
		return data;
	}

	private static List<String> channelNames(ImageData data) {
		return data.getChannels().stream().map(Channel::getName).collect(Collectors.toList());
	}

	private static ErrorType errorType(ImageData data, ChannelSelector selector) {
		var e = assertThrows(ImageLoadException.class, () -> data.ensureValid(selector, pool, 0).await());
		return e.getType();
	}

	@Test
	public void test_ensureValidRGBA() throws Exception {
		var data = createData(4, 4, "R", "G", "B", "A");
		assertFalse(data.hasPremultipliedAlpha());
		data.ensureValid(ChannelSelector.NONE, pool, 0).await();

		assertTrue(data.hasPremultipliedAlpha());
		assertEquals(List.of(""), data.getLayers());
		assertEquals(List.of("R", "G", "B", "A"), channelNames(data));
		assertEquals(ImageWindow.ofSize(4, 4), data.getDataWindow());
		assertEquals(ImageWindow.ofSize(4, 4), data.getDisplayWindow());
		for (String name : List.of("R", "G", "B")) {
			for (float v : data.getChannel(name).getData())
				assertEquals(0.5f, v);
		}
		for (float v : data.getChannel("A").getData())
			assertEquals(0.5f, v);
	}

	@Test
	public void test_ensureValidKeepsWindows() throws Exception {
		var data = createData(4, 2, "Y");
		data.setDataWindow(ImageWindow.of(10, 20, 14, 22));
		data.setDisplayWindow(ImageWindow.of(0, 0, 100, 50));
		data.ensureValid(ChannelSelector.NONE, pool, 0).await();
		assertEquals(ImageWindow.of(10, 20, 14, 22), data.getDataWindow());
		assertEquals(ImageWindow.of(0, 0, 100, 50), data.getDisplayWindow());
		assertEquals(4, data.getWidth());
		assertEquals(2, data.getHeight());
	}

	@Test
	public void test_alphaRoundTrip() throws Exception {
		var data = new ImageData();
		data.addChannel(new Channel("R", 3, 1, new float[] {2f, 4f, 8f}));
		data.addChannel(new Channel("A", 3, 1, new float[] {0.25f, 0f, 1f}));
		data.addLayer("");

		data.multiplyAlpha(pool, 0).await();
		assertTrue(data.hasPremultipliedAlpha());
		assertEquals(0.5f, data.getChannel("R").at(0));
		assertEquals(0f, data.getChannel("R").at(1));

		data.unmultiplyAlpha(pool, 0).await();
		assertFalse(data.hasPremultipliedAlpha());
		assertEquals(2f, data.getChannel("R").at(0));
		// Information where alpha is zero is lost
		assertEquals(0f, data.getChannel("R").at(1));
		assertEquals(8f, data.getChannel("R").at(2));
		// Alpha itself is never changed
		assertEquals(0.25f, data.getChannel("A").at(0));
	}

	@Test
	public void test_doubleAlphaOperations() throws Exception {
		var data = createData(2, 2, "R", "A");
		data.ensureValid(ChannelSelector.NONE, pool, 0).await();

		var e = assertThrows(ImageLoadException.class, () -> data.multiplyAlpha(pool, 0).await());
		assertEquals(ErrorType.DOUBLE_MULTIPLY, e.getType());

		data.unmultiplyAlpha(pool, 0).await();
		e = assertThrows(ImageLoadException.class, () -> data.unmultiplyAlpha(pool, 0).await());
		assertEquals(ErrorType.DOUBLE_DIVIDE, e.getType());
	}

	@Test
	public void test_invalidData() {
		assertEquals(ErrorType.EMPTY_IMAGE, errorType(new ImageData(), ChannelSelector.NONE));

		var mismatch = new ImageData();
		mismatch.addChannel(new Channel("R", 4, 4));
		mismatch.addChannel(new Channel("G", 3, 4));
		assertEquals(ErrorType.SIZE_MISMATCH, errorType(mismatch, ChannelSelector.NONE));

		var wrongWindow = createData(4, 4, "R");
		wrongWindow.setDataWindow(ImageWindow.ofSize(5, 4));
		assertEquals(ErrorType.SIZE_MISMATCH, errorType(wrongWindow, ChannelSelector.NONE));

		assertEquals(ErrorType.NO_MATCHING_CHANNELS, errorType(createData(2, 2, "R", "G"), ChannelSelector.fuzzy("Z")));
	}

	@Test
	public void test_offsetDataWindow() throws Exception {
		var window = ImageWindow.of(-3, 10, 1, 14);
		assertTrue(window.sameSize(ImageWindow.ofSize(4, 4)));
		assertFalse(window.sameSize(ImageWindow.ofSize(4, 5)));

		var data = createData(4, 4, "Y");
		data.setDataWindow(window);
		data.ensureValid(ChannelSelector.NONE, pool, 0).await();
		assertEquals(window, data.getDataWindow());
	}

	@Test
	public void test_selectorFiltersAndOrders() throws Exception {
		var data = createData(2, 2, "R", "G", "B", "A");
		data.ensureValid(ChannelSelector.fuzzy("B,R"), pool, 0).await();
		assertEquals(List.of("B", "R"), channelNames(data));
		// Alpha was not selected, so nothing was multiplied
		assertEquals(1f, data.getChannel("R").at(0));
		assertTrue(data.hasPremultipliedAlpha());
	}

	@Test
	public void test_layers() throws Exception {
		var data = createData(2, 2, "z.R", "a.G", "B", "a.b.R", "z.A");
		data.ensureValid(ChannelSelector.NONE, pool, 0).await();
		assertEquals(List.of("", "a", "a.b", "z"), data.getLayers());
		assertEquals(List.of("a.G"), data.channelsInLayer("a"));
		assertEquals(List.of("a.b.R"), data.channelsInLayer("a.b"));
		assertEquals(List.of("B"), data.channelsInLayer(""));
		assertEquals(List.of("z.R", "z.A"), data.channelsInLayer("z"));
		// Only channels in the same layer as alpha are premultiplied
		assertEquals(0.5f, data.getChannel("z.R").at(0));
		assertEquals(1f, data.getChannel("a.G").at(0));
		assertNull(data.getChannel("missing"));
	}

	@Test
	public void test_selectorDropsEmptyLayers() throws Exception {
		var data = createData(2, 2, "Y", "diffuse.R", "diffuse.G");
		data.addLayer("");
		data.addLayer("diffuse");
		data.ensureValid(ChannelSelector.fuzzy("diffuse"), pool, 0).await();
		assertEquals(List.of("diffuse"), data.getLayers());
		assertEquals(List.of("diffuse.R", "diffuse.G"), channelNames(data));
	}

}
