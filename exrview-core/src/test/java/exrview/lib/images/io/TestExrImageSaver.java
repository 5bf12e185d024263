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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import exrview.lib.common.ThreadPool;
import exrview.lib.images.Channel;
import exrview.lib.images.ChannelSelector;
import exrview.lib.images.ImageData;
import exrview.lib.images.ImageWindow;

@SuppressWarnings("javadoc")
public class TestExrImageSaver {

	private static ThreadPool pool;

	@TempDir
	Path dir;

	private final ExrImageLoader loader = new ExrImageLoader();

	@BeforeAll
	public static void createPool() {
		pool = new ThreadPool(2);
	}

	@AfterAll
	public static void shutdownPool() {
		pool.shutdown();
	}

	private ImageData reload(byte[] bytes) throws Exception {
		var list = loader.load(new ByteArrayInputStream(bytes), Path.of("saved.exr"), ChannelSelector.NONE, pool, 0).await();
		assertEquals(1, list.size());
		return list.get(0);
	}

	private static List<String> names(ImageData data) {
		return data.getChannels().stream().map(Channel::getName).collect(Collectors.toList());
	}

	private static float[] channel(ImageData data, String name) {
		return data.getChannel(name).getData();
	}

	@Test
	public void test_canSaveFile() {
		var saver = new ExrImageSaver();
		assertEquals("OpenEXR", saver.getName());
		assertTrue(saver.hasPremultipliedAlpha());
		assertTrue(saver.canSaveFile("exr"));
		assertTrue(saver.canSaveFile(".EXR"));
		assertFalse(saver.canSaveFile("png"));
		assertTrue(saver.canSaveFile(Path.of("renders", "frame.0001.Exr")));
		assertFalse(saver.canSaveFile(Path.of("renders", "exr")));

		var savers = ImageSaver.getSavers();
		assertEquals(1, savers.size());
		assertTrue(savers.get(0) instanceof ExrImageSaver);
	}

	@ParameterizedTest
	@EnumSource(ExrCompression.class)
	public void test_saveInterleaved(ExrCompression compression) throws Exception {
		int width = 5;
		int height = 19;
		int nChannels = 4;
		float[] values = new float[width * height * nChannels];
		for (int i = 0; i < values.length; i++)
			values[i] = (i % nChannels == 3) ? 1f : (i / nChannels) * 0.1f + (i % nChannels);

		var out = new ByteArrayOutputStream();
		new ExrImageSaver(compression).save(out, Path.of("rgba.exr"), values, width, height, nChannels);
		var data = reload(out.toByteArray());

		assertEquals(List.of("A", "B", "G", "R"), names(data));
		assertEquals(ImageWindow.ofSize(width, height), data.getDataWindow());
		assertEquals(ImageWindow.ofSize(width, height), data.getDisplayWindow());
		assertTrue(data.hasPremultipliedAlpha());
		String[] order = {"R", "G", "B", "A"};
		for (int c = 0; c < nChannels; c++) {
			float[] channel = channel(data, order[c]);
			for (int i = 0; i < width * height; i++)
				assertEquals(values[i * nChannels + c], channel[i], order[c] + " at " + i);
		}
	}

	@Test
	public void test_saveSingleChannel() throws Exception {
		float[] values = {0f, -1.5f, Float.MAX_VALUE, 1e-20f, 7f, 0.125f};
		var out = new ByteArrayOutputStream();
		new ExrImageSaver().save(out, Path.of("depth.exr"), values, 3, 2, 1);
		var data = reload(out.toByteArray());
		assertEquals(List.of("Y"), names(data));
		assertArrayEquals(values, channel(data, "Y"));
	}

	@Test
	public void test_compressesUniformImage() throws Exception {
		float[] values = new float[64 * 64];
		var out = new ByteArrayOutputStream();
		new ExrImageSaver().save(out, Path.of("black.exr"), values, 64, 64, 1);
		assertTrue(out.size() < values.length * 4 / 10, "Saved " + out.size() + " bytes");
		assertArrayEquals(values, channel(reload(out.toByteArray()), "Y"));
	}

	@Test
	public void test_saveLoadedImage() throws Exception {
		int width = 4;
		int height = 3;
		float[] red = new float[width * height];
		float[] green = new float[width * height];
		float[] normal = new float[width * height];
		for (int i = 0; i < red.length; i++) {
			red[i] = i * 0.5f;
			green[i] = 1f - i;
			normal[i] = i * 0.25f;
		}
		var path = dir.resolve("layers.exr");
		Files.write(path, new ExrTestWriter(ExrCompression.ZIP, width, height)
				.dataWindow(-2, 5, 1, 7)
				.displayWindow(0, 0, 9, 9)
				.channel("diffuse.R", ExrHeader.PIXEL_TYPE_FLOAT, red)
				.channel("diffuse.G", ExrHeader.PIXEL_TYPE_FLOAT, green)
				.channel("normal.X", ExrHeader.PIXEL_TYPE_FLOAT, normal)
				.toBytes());
		var images = new ImageLoaderProvider().tryLoadImage(pool, path, ChannelSelector.NONE).await();
		assertEquals(1, images.size());
		var image = images.get(0);

		var out = new ByteArrayOutputStream();
		new ExrImageSaver().save(out, image, List.of("normal.X", "diffuse.R"));
		var data = reload(out.toByteArray());

		assertEquals(List.of("diffuse.R", "normal.X"), names(data));
		assertEquals(ImageWindow.of(-2, 5, 2, 8), data.getDataWindow());
		assertEquals(ImageWindow.of(0, 0, 10, 10), data.getDisplayWindow());
		assertArrayEquals(red, channel(data, "diffuse.R"));
		assertArrayEquals(normal, channel(data, "normal.X"));
	}

	@Test
	public void test_invalidInput() throws Exception {
		var saver = new ExrImageSaver();
		OutputStream out = new ByteArrayOutputStream();
		var path = Path.of("invalid.exr");
		assertThrows(IllegalArgumentException.class, () -> saver.save(out, path, new float[20], 2, 2, 5));
		assertThrows(IllegalArgumentException.class, () -> saver.save(out, path, new float[7], 2, 2, 2));
		assertThrows(IllegalArgumentException.class, () -> saver.save(out, path, new float[0], 0, 2, 1));

		var file = dir.resolve("single.exr");
		Files.write(file, new ExrTestWriter(ExrCompression.NONE, 1, 1)
				.channel("Y", ExrHeader.PIXEL_TYPE_FLOAT, new float[1])
				.toBytes());
		var image = new ImageLoaderProvider().tryLoadImage(pool, file, ChannelSelector.NONE).await().get(0);
		assertThrows(IllegalArgumentException.class, () -> saver.save(out, image, List.of()));
		assertThrows(IllegalArgumentException.class, () -> saver.save(out, image, List.of("Z")));
	}

}
