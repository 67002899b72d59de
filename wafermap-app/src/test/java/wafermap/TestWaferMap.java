/*-
 * #%L
 * This file is part of WaferMap.
 * %%
 * Copyright (C) 2024 WaferMap developers
 * %%
 * WaferMap is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * WaferMap is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with WaferMap.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package wafermap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;
import wafermap.lib.analysis.interpolation.RadialBasisFunction;
import wafermap.lib.geom.ImmutableDimension;
import wafermap.lib.io.SampleIO;

@SuppressWarnings("javadoc")
public class TestWaferMap {
	
	@TempDir
	Path dir;
	
	private Path samplesFile;
	
	@BeforeEach
	public void writeSamples() throws Exception {
		samplesFile = dir.resolve("lot1.csv");
		Files.writeString(samplesFile, String.join("\n", 
				"x,y,value",
				"-50,0,1.0",
				"50,0,2.0",
				"0,-50,3.0",
				"0,50,4.0",
				""));
	}
	
	@Test
	public void test_defaultOutput() throws Exception {
		int exitCode = WaferMap.run("-d", dir.toString(), samplesFile.toString());
		assertEquals(0, exitCode);
		var output = dir.resolve("lot1.png");
		assertTrue(Files.isRegularFile(output));
		var img = ImageIO.read(output.toFile());
		assertEquals(640, img.getWidth());
		assertEquals(480, img.getHeight());
	}
	
	@Test
	public void test_options() throws Exception {
		var exported = dir.resolve("extended.tsv");
		int exitCode = WaferMap.run(
				"-o", "map.jpg",
				"--directory", dir.resolve("out").toString(),
				"--wafer-size", "200",
				"-r", "40x30",
				"--vmin", "0", "--vmax", "5",
				"-c", "jet",
				"-k", "cubic",
				"--export-extended", exported.toString(),
				"--log", "warn",
				samplesFile.toString());
		assertEquals(0, exitCode);
		assertTrue(Files.isRegularFile(dir.resolve("out").resolve("map.jpg")));
		
		var extended = SampleIO.readSamples(exported);
		assertEquals(8, extended.size());
		assertEquals(100, extended.get(4).getY());
		assertEquals(4.0, extended.get(4).getValue());
	}
	
	@Test
	public void test_config() throws Exception {
		var config = dir.resolve("config.json");
		Files.writeString(config, "{\"waferSize\": 250, \"function\": \"LINEAR\", \"imageWidth\": 300, \"imageHeight\": 200}");
		var app = new WaferMap();
		new CommandLine(app).parseArgs("--config", config.toString(), "-s", "280", samplesFile.toString());
		var params = app.buildParameters();
		assertEquals(280, params.getWaferSize());
		assertEquals(RadialBasisFunction.LINEAR, params.getFunction());
		assertEquals(ImmutableDimension.getInstance(300, 200), params.getImageSize());
		assertEquals("lot1.png", app.getOutputName());
	}
	
	@Test
	public void test_failures() throws Exception {
		assertEquals(1, WaferMap.run("-d", dir.toString(), dir.resolve("missing.csv").toString()));
		assertEquals(1, WaferMap.run("-d", dir.toString(), "-k", "spline", samplesFile.toString()));
		assertEquals(1, WaferMap.run("-d", dir.toString(), "--vmin", "9", samplesFile.toString()));
		assertEquals(1, WaferMap.run("-d", dir.toString(), "--vmin", "3", "--vmax", "2", samplesFile.toString()));
		assertEquals(1, WaferMap.run("-d", dir.toString(), "-r", "0x0", samplesFile.toString()));
		
		var empty = dir.resolve("empty.csv");
		Files.writeString(empty, "x,y,value\n");
		assertEquals(1, WaferMap.run("-d", dir.toString(), empty.toString()));
		assertFalse(Files.exists(dir.resolve("empty.png")));
	}
	
	@Test
	public void test_help() {
		assertEquals(0, WaferMap.run("--help"));
		assertEquals(0, WaferMap.run("-V"));
		assertNotEquals(0, WaferMap.run("--no-such-option", samplesFile.toString()));
	}

}
