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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import exrview.lib.common.ThreadPool;
import exrview.lib.images.ChannelSelector;
import exrview.lib.images.Image;

@SuppressWarnings("javadoc")
public class TestImageLoaderProvider {

	private static ThreadPool pool;

	@TempDir
	Path dir;

	private final ImageLoaderProvider provider = new ImageLoaderProvider();

	@BeforeAll
	public static void createPool() {
		pool = new ThreadPool(2);
	}

	@AfterAll
	public static void shutdownPool() {
		pool.shutdown();
	}

	private List<Image> load(Path path, ChannelSelector selector) throws Exception {
		return provider.tryLoadImage(pool, 0, path, selector).await();
	}

	@Test
	public void test_installedLoaders() {
		var names = provider.getLoaders().stream().map(ImageLoader::getName).collect(Collectors.toList());
		assertEquals(List.of("Empty", "OpenEXR"), names);
		assertThrows(IllegalArgumentException.class, () -> new ImageLoaderProvider(Collections.emptyList()));
	}

	@Test
	public void test_loadEmpty() throws Exception {
		var path = dir.resolve("placeholder.empty");
		Files.writeString(path, "empty 8 4 4 1 R 1 G 1 B 1 A", StandardCharsets.UTF_8);
		var images = load(path, ChannelSelector.NONE);
		assertEquals(1, images.size());
		var image = images.get(0);
		assertEquals(path.toString(), image.getName());
		assertEquals(8, image.getWidth());
		assertEquals(4, image.getHeight());
		assertEquals(List.of("R", "G", "B", "A"), image.getChannelNames());
		assertEquals("R,G,B,A", image.getChannelGroups().get(0).getName());
	}

	@Test
	public void test_loadExrWithSelector() throws Exception {
		var path = dir.resolve("render.exr");
		byte[] bytes = new ExrTestWriter(ExrCompression.ZIP, 4, 4)
				.channel("R", ExrHeader.PIXEL_TYPE_HALF, new float[16])
				.channel("G", ExrHeader.PIXEL_TYPE_HALF, new float[16])
				.channel("B", ExrHeader.PIXEL_TYPE_HALF, new float[16])
				.toBytes();
		Files.write(path, bytes);

		var images = load(path, ChannelSelector.fuzzy("R"));
		assertEquals(1, images.size());
		assertEquals(path + ":R", images.get(0).getName());
		assertEquals(List.of("R"), images.get(0).getChannelNames());

		assertTrue(load(path, ChannelSelector.fuzzy("X")).isEmpty());
	}

	@Test
	public void test_loadMultipartNamesImageByPart() throws Exception {
		var path = dir.resolve("passes.exr");
		var beauty = new ExrTestWriter(ExrCompression.NONE, 2, 2)
				.name("beauty")
				.channel("Y", ExrHeader.PIXEL_TYPE_FLOAT, new float[4]);
		var depth = new ExrTestWriter(ExrCompression.NONE, 2, 2)
				.name("depth")
				.channel("Z", ExrHeader.PIXEL_TYPE_FLOAT, new float[4]);
		Files.write(path, ExrTestWriter.toBytes(List.of(beauty, depth)));

		var images = load(path, ChannelSelector.NONE);
		assertEquals(1, images.size());
		assertEquals(path + ":beauty", images.get(0).getName());
		assertEquals("beauty", images.get(0).getChannelSelector());

		images = load(path, ChannelSelector.fuzzy("Z"));
		assertEquals(path + ":depth,Z", images.get(0).getName());
	}

	@Test
	public void test_loadInForeground() throws Exception {
		var path = dir.resolve("foreground.empty");
		Files.writeString(path, "empty 2 3 1 1 Y", StandardCharsets.UTF_8);
		var images = provider.tryLoadImage(pool, path, ChannelSelector.NONE).await();
		assertEquals(1, images.size());
		assertEquals(List.of("Y"), images.get(0).getChannelNames());
		assertEquals(3, images.get(0).getHeight());
	}

	@Test
	public void test_unloadable() throws Exception {
		var garbage = dir.resolve("garbage.bin");
		Files.writeString(garbage, "this is not an image", StandardCharsets.UTF_8);
		assertTrue(load(garbage, ChannelSelector.NONE).isEmpty());

		var noChannels = dir.resolve("nothing.empty");
		Files.writeString(noChannels, "empty 2 2 0", StandardCharsets.UTF_8);
		assertTrue(load(noChannels, ChannelSelector.NONE).isEmpty());

		assertTrue(load(dir.resolve("missing.exr"), ChannelSelector.NONE).isEmpty());
	}

}
