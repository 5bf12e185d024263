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


package exrview;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonParser;

import picocli.CommandLine;

@SuppressWarnings("javadoc")
public class TestExrView {

	@TempDir
	Path dir;

	private Path rgb;
	private Path layered;
	private StringWriter output;

	@BeforeEach
	public void setUp() throws Exception {
		rgb = dir.resolve("rgb.empty");
		Files.writeString(rgb, "empty 2 3 3 1 R 1 G 1 B", StandardCharsets.UTF_8);
		layered = dir.resolve("layered.empty");
		Files.writeString(layered, "empty 4 4 3 1 Y 9 diffuse.R 9 diffuse.G", StandardCharsets.UTF_8);
		output = new StringWriter();
	}

	private int run(String... args) {
		CommandLine cmd = ExrView.createCommandLine();
		cmd.setOut(new PrintWriter(output));
		cmd.setErr(new PrintWriter(new StringWriter()));
		return cmd.execute(args);
	}

	@Test
	public void test_describeImages() {
		int exitCode = run("-l", "warn", "-t", "2", rgb.toString(), layered.toString());
		assertEquals(0, exitCode);
		String text = output.toString();
		assertTrue(text.contains("Path: " + rgb));
		assertTrue(text.contains("Resolution: (2, 3)"));
		assertTrue(text.contains("<root>: R,G,B"));
		assertTrue(text.contains("diffuse: R,G"));
		// Images are described in the order requested
		assertTrue(text.indexOf(rgb.toString()) < text.indexOf(layered.toString()));
	}

	@Test
	public void test_channelSelector() {
		int exitCode = run("-l", "warn", "-c", "diffuse", layered.toString());
		assertEquals(0, exitCode);
		String text = output.toString();
		assertTrue(text.contains("Path: " + layered + ":diffuse"));
		assertTrue(text.contains("diffuse: R,G"));
		assertTrue(!text.contains("<root>"));
	}

	@Test
	public void test_json() {
		int exitCode = run("-l", "warn", "--json", rgb.toString(), layered.toString());
		assertEquals(0, exitCode);
		var array = JsonParser.parseString(output.toString()).getAsJsonArray();
		assertEquals(2, array.size());
		var first = array.get(0).getAsJsonObject();
		assertEquals("rgb.empty", first.get("shortName").getAsString());
		assertEquals(2, first.get("width").getAsInt());
		assertEquals("R,G,B", first.getAsJsonArray("groups").get(0).getAsJsonObject().get("name").getAsString());
	}

	@Test
	public void test_missingFile() {
		int exitCode = run("-l", "off", rgb.toString(), dir.resolve("missing.exr").toString());
		assertEquals(1, exitCode);
		assertTrue(output.toString().contains("Path: " + rgb));
	}

	@Test
	public void test_invalidArguments() {
		assertNotEquals(0, run("-l", "off", "-t", "0", rgb.toString()));
		assertNotEquals(0, run());
		assertEquals(0, run("--help"));
	}

}
