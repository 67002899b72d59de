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

package wafermap.lib.regions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import wafermap.lib.analysis.boundary.ReferencePoint;
import wafermap.lib.exceptions.InvalidInputException;

@SuppressWarnings("javadoc")
public class TestWaferGeometry {
	
	@Test
	public void test_geometry() {
		var geometry = WaferGeometry.fromSize(300);
		assertEquals(300, geometry.getSize());
		assertEquals(150, geometry.getRadius());
		assertEquals(geometry, WaferGeometry.getDefault());
		assertEquals(150, geometry.getClipRegion().getRadius());
		
		assertThrows(InvalidInputException.class, () -> WaferGeometry.fromSize(0));
		assertThrows(InvalidInputException.class, () -> WaferGeometry.fromSize(Double.POSITIVE_INFINITY));
	}
	
	@Test
	public void test_clipRegion() {
		var clip = ClipRegion.createCircle(150);
		assertEquals(0, clip.getCenterX());
		assertEquals(0, clip.getCenterY());
		assertTrue(clip.contains(0, 0));
		assertTrue(clip.contains(150, 0));
		assertTrue(clip.contains(0, -150));
		assertFalse(clip.contains(110, 110));
		assertFalse(clip.contains(150.001, 0));
		for (var ref : ReferencePoint.values()) {
			var p = ref.getLocation(150);
			assertTrue(clip.contains(p.getX(), p.getY()));
		}
		assertThrows(InvalidInputException.class, () -> ClipRegion.createCircle(0));
	}

}
