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

package wafermap.lib;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import wafermap.lib.analysis.interpolation.RadialBasisFunction;
import wafermap.lib.color.ColorMaps;
import wafermap.lib.exceptions.InvalidInputException;
import wafermap.lib.geom.ImmutableDimension;

@SuppressWarnings("javadoc")
public class TestWaferMapParameters {
	
	@Test
	public void test_defaults() {
		var params = WaferMapParameters.getDefault();
		assertEquals(300, params.getWaferSize());
		assertEquals(150, params.getGeometry().getRadius());
		assertEquals(ImmutableDimension.getInstance(100, 100), params.getResolution());
		assertEquals(RadialBasisFunction.THIN_PLATE, params.getFunction());
		assertEquals(0, params.getSmooth());
		assertNull(params.getVmin());
		assertNull(params.getVmax());
		assertEquals(ColorMaps.DEFAULT_COLORMAP_NAME, params.getColorMapName());
		assertEquals(ImmutableDimension.getInstance(640, 480), params.getImageSize());
		assertEquals(Path.of("wafer.png"), params.resolveOutput("wafer.png"));
	}
	
	@Test
	public void test_builder() {
		var params = WaferMapParameters.builder()
				.waferSize(200)
				.resolution(50, 40)
				.vmin(-1.0)
				.vmax(1.0)
				.imageSize(800, 600)
				.outputDirectory("out")
				.build();
		assertEquals(100, params.getGeometry().getRadius());
		assertEquals(ImmutableDimension.getInstance(50, 40), params.getResolution());
		assertEquals(-1.0, params.getVmin());
		assertEquals(ImmutableDimension.getInstance(800, 600), params.getImageSize());
		assertEquals(Path.of("out", "wafer.png"), params.resolveOutput("wafer.png"));
		
		// Builders copy, so the original is unchanged
		var params2 = params.toBuilder().waferSize(400).build();
		assertEquals(400, params2.getWaferSize());
		assertEquals(200, params.getWaferSize());
		assertEquals(-1.0, params2.getVmin());
	}
	
	@Test
	public void test_invalid() {
		assertThrows(InvalidInputException.class, () -> WaferMapParameters.builder().waferSize(-1).build());
		assertThrows(InvalidInputException.class, () -> WaferMapParameters.builder().resolution(0, 10).build());
		assertThrows(InvalidInputException.class, () -> WaferMapParameters.builder().smooth(Double.NaN).build());
		assertThrows(InvalidInputException.class, () -> WaferMapParameters.builder().colorMap(" ").build());
		assertThrows(InvalidInputException.class, () -> WaferMapParameters.builder().imageSize(0, 0).build());
	}
	
	@Test
	public void test_invertedDisplayRange() {
		var params = WaferMapParameters.builder().vmin(5.0).vmax(1.0).build();
		assertEquals(5.0, params.getVmin());
		assertEquals(1.0, params.getVmax());
	}
	
	@Test
	public void test_json() {
		var params = WaferMapParameters.builder()
				.waferSize(200)
				.function(RadialBasisFunction.GAUSSIAN)
				.vmax(7.5)
				.colorMap("Jet")
				.build();
		var params2 = WaferMapParameters.fromJson(params.toJson());
		assertEquals(200, params2.getWaferSize());
		assertEquals(RadialBasisFunction.GAUSSIAN, params2.getFunction());
		assertNull(params2.getVmin());
		assertEquals(7.5, params2.getVmax());
		assertEquals("Jet", params2.getColorMapName());
	}
	
	@Test
	public void test_partialJson() {
		var params = WaferMapParameters.fromJson("{\"waferSize\": 450, \"gridWidth\": 30}");
		assertEquals(450, params.getWaferSize());
		assertEquals(ImmutableDimension.getInstance(30, 100), params.getResolution());
		assertEquals(RadialBasisFunction.THIN_PLATE, params.getFunction());
		assertEquals(ColorMaps.DEFAULT_COLORMAP_NAME, params.getColorMapName());
		
		assertEquals(300, WaferMapParameters.fromJson("").getWaferSize());
		assertThrows(InvalidInputException.class, () -> WaferMapParameters.fromJson("{\"waferSize\": -5}"));
		assertThrows(InvalidInputException.class, () -> WaferMapParameters.fromJson("{\"waferSize\": [1, 2]}"));
	}
	
	@Test
	public void test_read(@TempDir Path dir) throws Exception {
		var path = dir.resolve("params.json");
		Files.writeString(path, "{\"function\": \"CUBIC\", \"smooth\": 0.5, \"outputDirectory\": \"maps\"}");
		var params = WaferMapParameters.read(path);
		assertEquals(RadialBasisFunction.CUBIC, params.getFunction());
		assertEquals(0.5, params.getSmooth());
		assertEquals(Path.of("maps", "a.png"), params.resolveOutput("a.png"));
	}

}
