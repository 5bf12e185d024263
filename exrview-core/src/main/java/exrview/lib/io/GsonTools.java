/*-
 * #%L
 * This file is part of ExrView.
 * %%
 * Copyright (C) 2018 - 2020 QuPath developers, The University of Edinburgh
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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import exrview.lib.images.ChannelGroup;
import exrview.lib.images.Image;
import exrview.lib.images.ImageWindow;

/**
 * Helper class providing Gson instances with type adapters registered to serialize
 * several key classes.
 * <p>
 * These include:
 * <ul>
 * <li>{@link ImageWindow}</li>
 * <li>{@link ChannelGroup}</li>
 * <li>{@link Image} (as a summary, without pixel values; write only)</li>
 * </ul>
 */
public class GsonTools {

	private static final GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.registerTypeAdapterFactory(new ExrViewTypeAdapterFactory());

	/**
	 * Get default Gson, capable of handling the types listed above.
	 * @return
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return builder.create();
	}

	/**
	 * Get default Gson, optionally with pretty printing enabled.
	 * @param pretty
	 * @return
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}


	static class ExrViewTypeAdapterFactory implements TypeAdapterFactory {

		@Override
		public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
			return getTypeAdaptor(type.getRawType());
		}

		@SuppressWarnings("unchecked")
		static <T> TypeAdapter<T> getTypeAdaptor(Class<? super T> cls) {
			if (ImageWindow.class.isAssignableFrom(cls))
				return (TypeAdapter<T>)ImageWindowTypeAdapter.INSTANCE;

			if (ChannelGroup.class.isAssignableFrom(cls))
				return (TypeAdapter<T>)ChannelGroupTypeAdapter.INSTANCE;

			if (Image.class.isAssignableFrom(cls))
				return (TypeAdapter<T>)ImageSummaryTypeAdapter.INSTANCE;

			return null;
		}

	}


	static class ImageWindowTypeAdapter extends TypeAdapter<ImageWindow> {

		static ImageWindowTypeAdapter INSTANCE = new ImageWindowTypeAdapter();

		@Override
		public void write(JsonWriter out, ImageWindow window) throws IOException {
			out.beginObject();
			out.name("minX");
			out.value(window.getMinX());
			out.name("minY");
			out.value(window.getMinY());
			out.name("maxX");
			out.value(window.getMaxX());
			out.name("maxY");
			out.value(window.getMaxY());
			out.endObject();
		}

		@Override
		public ImageWindow read(JsonReader in) throws IOException {
			in.beginObject();
			int minX = 0, minY = 0, maxX = 0, maxY = 0;
			while (in.hasNext()) {
				switch (in.nextName()) {
				case "minX":
					minX = in.nextInt();
					break;
				case "minY":
					minY = in.nextInt();
					break;
				case "maxX":
					maxX = in.nextInt();
					break;
				case "maxY":
					maxY = in.nextInt();
					break;
				default:
					in.skipValue();
				}
			}
			in.endObject();
			return ImageWindow.of(minX, minY, maxX, maxY);
		}

	}


	static class ChannelGroupTypeAdapter extends TypeAdapter<ChannelGroup> {

		static ChannelGroupTypeAdapter INSTANCE = new ChannelGroupTypeAdapter();

		@Override
		public void write(JsonWriter out, ChannelGroup group) throws IOException {
			out.beginObject();
			out.name("name");
			out.value(group.getName());
			out.name("channels");
			writeStrings(out, group.getChannels());
			out.endObject();
		}

		@Override
		public ChannelGroup read(JsonReader in) throws IOException {
			in.beginObject();
			String name = null;
			List<String> channels = new ArrayList<>();
			while (in.hasNext()) {
				switch (in.nextName()) {
				case "name":
					name = in.nextString();
					break;
				case "channels":
					in.beginArray();
					while (in.hasNext())
						channels.add(in.nextString());
					in.endArray();
					break;
				default:
					in.skipValue();
				}
			}
			in.endObject();
			if (name == null)
				throw new JsonParseException("Channel group has no name");
			return new ChannelGroup(name, channels);
		}

	}


	/**
	 * Writes the metadata of an image; pixel values are not included.
	 */
	static class ImageSummaryTypeAdapter extends TypeAdapter<Image> {

		static ImageSummaryTypeAdapter INSTANCE = new ImageSummaryTypeAdapter();

		@Override
		public void write(JsonWriter out, Image image) throws IOException {
			out.beginObject();
			out.name("id");
			out.value(image.getId());
			out.name("name");
			out.value(image.getName());
			out.name("shortName");
			out.value(image.getShortName());
			out.name("width");
			out.value(image.getWidth());
			out.name("height");
			out.value(image.getHeight());
			out.name("dataWindow");
			ImageWindowTypeAdapter.INSTANCE.write(out, image.getDataWindow());
			out.name("displayWindow");
			ImageWindowTypeAdapter.INSTANCE.write(out, image.getDisplayWindow());
			out.name("layers");
			writeStrings(out, image.getLayers());
			out.name("channels");
			writeStrings(out, image.getChannelNames());
			out.name("groups");
			out.beginArray();
			for (var group : image.getChannelGroups())
				ChannelGroupTypeAdapter.INSTANCE.write(out, group);
			out.endArray();
			out.endObject();
		}

		@Override
		public Image read(JsonReader in) throws IOException {
			throw new JsonParseException("Images cannot be read from JSON");
		}

	}

	private static void writeStrings(JsonWriter out, List<String> values) throws IOException {
		out.beginArray();
		for (String value : values)
			out.value(value);
		out.endArray();
	}

}
