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

package wafermap.lib.color;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import wafermap.lib.common.ColorTools;

@SuppressWarnings("javadoc")
public class TestColorMaps {
	
	@Test
	public void test_builtIn() {
		var maps = ColorMaps.getColorMaps();
		assertTrue(maps.containsKey(ColorMaps.DEFAULT_COLORMAP_NAME));
		assertTrue(maps.containsKey("Rainbow"));
		assertTrue(maps.containsKey("Jet"));
		assertTrue(maps.containsKey("Gray"));
		assertTrue(maps.containsKey("Viridis"));
		assertSame(ColorMaps.getDefaultColorMap(), ColorMaps.getColorMap(ColorMaps.DEFAULT_COLORMAP_NAME));
		assertThrows(UnsupportedOperationException.class, () -> maps.remove("Jet"));
	}
	
	@Test
	public void test_lookup() {
		assertSame(ColorMaps.getColorMap("Viridis"), ColorMaps.getColorMap("viridis"));
		assertThrows(IllegalArgumentException.class, () -> ColorMaps.getColorMap("Not a colormap"));
	}
	
	@Test
	public void test_rainbow() {
		var rainbow = ColorMaps.getColorMap("Rainbow");
		var reversed = ColorMaps.getDefaultColorMap();
		int low = rainbow.getColor(0, 0, 1);
		int high = rainbow.getColor(1, 0, 1);
		assertEquals(ColorTools.packRGB(255, 0, 41), low);
		assertEquals(ColorTools.packRGB(255, 0, 191), high);
		assertEquals(high, reversed.getColor(0, 0, 1));
		assertEquals(low, reversed.getColor(1, 0, 1));
		// Values outside the range are clipped
		assertEquals(low, rainbow.getColor(-10, 0, 1));
		assertEquals(high, rainbow.getColor(10, 0, 1));
		// Green around the middle of the rainbow
		int mid = rainbow.getColor(0.4, 0, 1);
		assertTrue(ColorTools.green(mid) > 250);
		assertTrue(ColorTools.red(mid) < 5);
	}
	
	@Test
	public void test_singleColor() {
		var gray = ColorMaps.getColorMap("Gray");
		assertEquals(ColorTools.BLACK, gray.getColor(0, 0, 10));
		assertEquals(ColorTools.WHITE, gray.getColor(10, 0, 10));
		assertEquals(ColorTools.WHITE, gray.getColor(3, 3, 3));
	}
	
	@Test
	public void test_getColors() {
		var gray = ColorMaps.getColorMap("Gray");
		int[] colors = ColorMaps.getColors(gray, 3, false);
		assertEquals(ColorTools.BLACK, colors[0]);
		assertEquals(ColorTools.WHITE, colors[2]);
		int[] inverted = ColorMaps.getColors(gray, 3, true);
		assertEquals(ColorTools.WHITE, inverted[0]);
	}
	
	@Test
	public void test_wrappers() {
		var gray = ColorMaps.getColorMap("Gray");
		var gamma = ColorMaps.gammaColorMap(gray, 2);
		assertEquals(ColorTools.BLACK, gamma.getColor(0, 0, 1));
		assertEquals(ColorTools.WHITE, gamma.getColor(1, 0, 1));
		assertTrue(ColorTools.red(gamma.getColor(0.5, 0, 1)) < ColorTools.red(gray.getColor(0.5, 0, 1)));
		
		var reversed = ColorMaps.reversedColorMap(gray, "Gray (reversed)");
		assertEquals("Gray (reversed)", reversed.getName());
		assertEquals(ColorTools.WHITE, reversed.getColor(0, 0, 1));
	}
	
	@Test
	public void test_create() {
		var map = ColorMaps.createColorMap("Two", new int[] {0, 255}, new int[] {0, 0}, new int[] {255, 0});
		assertEquals(ColorTools.packRGB(0, 0, 255), map.getColor(0, 0, 1));
		assertEquals(ColorTools.packRGB(255, 0, 0), map.getColor(1, 0, 1));
		assertNotEquals(map.getColor(0, 0, 1), map.getColor(0.5, 0, 1));
		assertThrows(IllegalArgumentException.class, () -> ColorMaps.createColorMap("One", new int[] {0}, new int[] {0}, new int[] {0}));
		assertThrows(IllegalArgumentException.class, () -> ColorMaps.createColorMap("Bad", new double[] {0, 2}, new double[] {0, 0}, new double[] {0, 0}));
	}
	
	@Test
	public void test_install(@TempDir Path dir) throws Exception {
		var path = dir.resolve("Custom test map.tsv");
		Files.writeString(path, "0 0 0\n0.5 0.5 0.5\n\n1 1 1\n");
		assertTrue(ColorMaps.installColorMaps(path));
		var map = ColorMaps.getColorMap("Custom test map");
		assertEquals(ColorTools.BLACK, map.getColor(0, 0, 1));
		assertEquals(ColorTools.WHITE, map.getColor(1, 0, 1));
		
		assertThrows(Exception.class, () -> ColorMaps.installColorMaps(dir.resolve("missing.tsv")));
		
		var gamma = ColorMaps.gammaColorMap(ColorMaps.getColorMap("Gray"), 0.5);
		assertTrue(ColorMaps.installColorMaps(gamma));
		assertSame(gamma, ColorMaps.getColorMap(gamma.getName()));
	}

}
