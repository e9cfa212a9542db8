/*-
 * #%L
 * This file is part of TEM Nanocrystals.
 * %%
 * Copyright (C) 2024 TEM Nanocrystals developers
 * %%
 * TEM Nanocrystals is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * TEM Nanocrystals is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with TEM Nanocrystals.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package temnano.lib.io;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import temnano.lib.regions.ImageRegion;

/**
 * Access to the shared Gson configuration used for storing pipeline parameters.
 * <p>
 * An {@link ImageRegion} is written as a plain object with its bounds.
 * NaN and infinite values are permitted.
 */
public class GsonTools {

	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);

	private static final GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeAdapter(ImageRegion.class, ImageRegionTypeAdapter.INSTANCE);

	/**
	 * Get default Gson, capable of serializing/deserializing some key types.
	 * @return
	 *
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return builder.create();
	}

	/**
	 * Get default Gson, optionally with pretty printing enabled.
	 *
	 * @param pretty if true, write using pretty-printing (i.e. more whitespace for formatting)
	 * @return
	 *
	 * @see #getInstance()
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}


	/**
	 * TypeAdapter for ImageRegion objects, written as {@code {"x":..,"y":..,"width":..,"height":..}}.
	 */
	static class ImageRegionTypeAdapter extends TypeAdapter<ImageRegion> {

		static final ImageRegionTypeAdapter INSTANCE = new ImageRegionTypeAdapter();

		@Override
		public void write(JsonWriter out, ImageRegion value) throws IOException {
			if (value == null) {
				out.nullValue();
				return;
			}
			out.beginObject();
			out.name("x").value(value.getX());
			out.name("y").value(value.getY());
			out.name("width").value(value.getWidth());
			out.name("height").value(value.getHeight());
			out.endObject();
		}

		@Override
		public ImageRegion read(JsonReader in) throws IOException {
			if (in.peek() == JsonToken.NULL) {
				in.nextNull();
				return null;
			}
			int x = 0, y = 0, width = 0, height = 0;
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				switch (name) {
				case "x":
					x = in.nextInt();
					break;
				case "y":
					y = in.nextInt();
					break;
				case "width":
					width = in.nextInt();
					break;
				case "height":
					height = in.nextInt();
					break;
				default:
					logger.debug("Skipping unknown ImageRegion property '{}'", name);
					in.skipValue();
				}
			}
			in.endObject();
			try {
				return ImageRegion.createInstance(x, y, width, height);
			} catch (IllegalArgumentException e) {
				throw new JsonParseException("Invalid region: " + e.getMessage(), e);
			}
		}

	}

}
