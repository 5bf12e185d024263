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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import exrview.lib.common.ThreadPool;

@SuppressWarnings("javadoc")
public class TestImage {

	private static ThreadPool pool;

	@BeforeAll
	public static void createPool() {
		pool = new ThreadPool(2);
	}

	@AfterAll
	public static void shutdownPool() {
		pool.shutdown();
	}

	private static Image createImage(String path, String selector, String... channelNames) throws Exception {
		var data = TestImageData.createData(3, 2, channelNames);
		data.ensureValid(ChannelSelector.fuzzy(selector), pool, 0).await();
		return new Image(Path.of(path), data, selector);
	}

	private static List<String> groupNames(Image image) {
		return image.getChannelGroups().stream().map(ChannelGroup::getName).collect(Collectors.toList());
	}

	@Test
	public void test_groupRGBAZ() throws Exception {
		var image = createImage("image.exr", "", "R", "G", "B", "A", "Z");
		var groups = image.getChannelGroups();
		assertEquals(2, groups.size());
		assertEquals(List.of("R", "G", "B", "A"), groups.get(0).getChannels());
		assertEquals(List.of("Z", "Z", "Z", "A"), groups.get(1).getChannels());
		assertEquals(List.of("R,G,B,A", "Z,A"), groupNames(image));

		assertEquals(List.of("Z", "Z", "Z", "A"), image.channelsInGroup("Z,A"));
		assertTrue(image.channelsInGroup("missing").isEmpty());

		assertEquals(List.of("R", "G", "B", "A", "Z", "Z", "Z"), image.getSortedChannels(""));
	}

	@Test
	public void test_groupLayers() throws Exception {
		var image = createImage("image.exr", "",
				"diffuse.B", "diffuse.G", "diffuse.R", "depth.Z", "normal.X", "normal.Y", "normal.Z", "uv.u", "uv.v", "uv.w");
		assertEquals(List.of("depth", "diffuse", "normal", "uv"), image.getLayers());
		assertEquals(List.of("depth.Z", "diffuse.(R,G,B)", "normal.(X,Y,Z)", "uv.(u,v)", "uv.w"), groupNames(image));
		assertEquals(List.of("diffuse.R", "diffuse.G", "diffuse.B"), image.channelsInGroup("diffuse.(R,G,B)"));
		assertEquals(List.of("depth.Z", "depth.Z", "depth.Z"), image.channelsInGroup("depth.Z"));
		assertEquals(List.of("uv.u", "uv.v"), image.channelsInGroup("uv.(u,v)"));
		assertEquals(List.of("uv.w", "uv.w", "uv.w"), image.channelsInGroup("uv.w"));
	}

	@Test
	public void test_groupAlphaOnlyAndLeftovers() throws Exception {
		var alphaOnly = createImage("alpha.exr", "", "mask.A");
		assertEquals(List.of("mask.A"), groupNames(alphaOnly));
		assertEquals(List.of("mask.A", "mask.A", "mask.A"), alphaOnly.channelsInGroup("mask.A"));

		var leftovers = createImage("other.exr", "", "foo", "bar", "A");
		assertEquals(List.of("foo,A", "bar,A"), groupNames(leftovers));
		assertEquals(List.of("foo", "foo", "foo", "A"), leftovers.channelsInGroup("foo,A"));
		assertEquals(List.of("foo", "foo", "foo", "A", "bar", "bar", "bar"), leftovers.getSortedChannels(""));
	}

	@Test
	public void test_names() throws Exception {
		var image = createImage("some/dir/image.exr", "R,G", "R", "G", "B");
		assertEquals(Path.of("some/dir/image.exr") + ":R,G", image.getName());
		assertEquals("image.exr", image.getShortName());
		assertEquals("R,G", image.getChannelSelector());

		var plain = createImage("plain.exr", "", "Y");
		assertEquals(Path.of("plain.exr").toString(), plain.getName());
		assertTrue(plain.getId() > image.getId());
	}

	@Test
	public void test_updateChannel() throws Exception {
		var image = createImage("image.exr", "", "Y");
		image.updateChannel("Y", 1, 0, 2, 2, new float[] {5, 6, 7, 8});
		var channel = image.getChannel("Y");
		assertEquals(1f, channel.at(0, 0));
		assertEquals(5f, channel.at(1, 0));
		assertEquals(8f, channel.at(2, 1));

		// Unknown channels are ignored
		image.updateChannel("missing", 0, 0, 1, 1, new float[] {1});
		assertEquals(List.of("Y"), image.getChannelNames());
	}

	@Test
	public void test_toString() throws Exception {
		var image = createImage("image.exr", "", "R", "G", "B", "layer.Z");
		String expected = "Path: " + Path.of("image.exr") + "\n\n"
				+ "Resolution: (3, 2)\n"
				+ "\nChannels:\n"
				+ "<root>: R,G,B\n"
				+ "layer: Z";
		assertEquals(expected, image.toString());
	}

}
