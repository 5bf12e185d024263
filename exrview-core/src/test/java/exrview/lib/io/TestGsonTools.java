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


package exrview.lib.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import exrview.lib.images.Channel;
import exrview.lib.images.ChannelGroup;
import exrview.lib.images.Image;
import exrview.lib.images.ImageData;
import exrview.lib.images.ImageWindow;

@SuppressWarnings("javadoc")
public class TestGsonTools {

	@Test
	public void test_imageWindow() {
		var gson = GsonTools.getInstance();
		var window = ImageWindow.of(-2, 3, 10, 12);
		String json = gson.toJson(window);
		assertEquals("{\"minX\":-2,\"minY\":3,\"maxX\":10,\"maxY\":12}", json);
		assertEquals(window, gson.fromJson(json, ImageWindow.class));
		assertEquals(ImageWindow.of(0, 0, 4, 0), gson.fromJson("{\"maxX\":4,\"other\":[1,2]}", ImageWindow.class));
	}

	@Test
	public void test_channelGroup() {
		var gson = GsonTools.getInstance();
		var group = new ChannelGroup("normal.(X,Y)", List.of("normal.X", "normal.Y", "normal.A"));
		String json = gson.toJson(group);
		assertEquals(group, gson.fromJson(json, ChannelGroup.class));
		assertThrows(JsonParseException.class, () -> gson.fromJson("{\"channels\":[\"Y\"]}", ChannelGroup.class));
	}

	@Test
	public void test_imageSummary() {
		var data = new ImageData();
		data.addChannel(new Channel("Y", 3, 2));
		data.addChannel(new Channel("depth.Z", 3, 2));
		data.addLayer("");
		data.addLayer("depth");
		data.setDataWindow(ImageWindow.ofSize(3, 2));
		data.setDisplayWindow(ImageWindow.ofSize(4, 4));
		var image = new Image(Path.of("dir", "pass.exr"), data, "");

		var gson = GsonTools.getInstance(true);
		var json = gson.fromJson(gson.toJson(image), JsonObject.class);
		assertEquals(image.getId(), json.get("id").getAsInt());
		assertEquals("pass.exr", json.get("shortName").getAsString());
		assertEquals(3, json.get("width").getAsInt());
		assertEquals(4, json.getAsJsonObject("displayWindow").get("maxY").getAsInt());
		assertEquals(2, json.getAsJsonArray("layers").size());
		assertEquals("depth.Z", json.getAsJsonArray("channels").get(1).getAsString());

		var groups = json.getAsJsonArray("groups");
		assertEquals(2, groups.size());
		assertEquals("Y", groups.get(0).getAsJsonObject().get("name").getAsString());
		assertEquals("depth.Z", groups.get(1).getAsJsonObject().get("name").getAsString());

		assertThrows(JsonParseException.class, () -> gson.fromJson("{}", Image.class));
	}

}
