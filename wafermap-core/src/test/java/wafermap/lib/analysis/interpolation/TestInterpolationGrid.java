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

package wafermap.lib.analysis.interpolation;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import wafermap.lib.exceptions.InvalidInputException;
import wafermap.lib.geom.ImmutableDimension;

@SuppressWarnings("javadoc")
public class TestInterpolationGrid {
	
	@Test
	public void test_linspace() {
		assertArrayEquals(new double[] {0, 0.25, 0.5, 0.75, 1}, InterpolationGrid.linspace(0, 1, 5), 1e-15);
		assertArrayEquals(new double[] {-3}, InterpolationGrid.linspace(-3, 7, 1));
		assertArrayEquals(new double[] {2, 2, 2}, InterpolationGrid.linspace(2, 2, 3));
		double[] values = InterpolationGrid.linspace(-150, 150, 100);
		assertEquals(100, values.length);
		assertEquals(-150, values[0]);
		assertEquals(150, values[99]);
	}
	
	@Test
	public void test_grid() {
		var grid = InterpolationGrid.create(-10, 10, 0, 5, ImmutableDimension.getInstance(21, 6));
		assertEquals(21, grid.getWidth());
		assertEquals(6, grid.getHeight());
		assertEquals(ImmutableDimension.getInstance(21, 6), grid.getResolution());
		assertEquals(-10, grid.getX(0));
		assertEquals(0, grid.getX(10), 1e-12);
		assertEquals(10, grid.getX(20));
		assertEquals(3, grid.getY(3), 1e-12);
		
		// Returned arrays are copies
		double[] xs = grid.getXs();
		xs[0] = 100;
		assertEquals(-10, grid.getX(0));
	}
	
	@Test
	public void test_invalid() {
		assertThrows(InvalidInputException.class, () -> InterpolationGrid.create(0, 1, 0, 1, ImmutableDimension.getInstance(0, 1)));
		assertThrows(InvalidInputException.class, () -> InterpolationGrid.create(1, 0, 0, 1, ImmutableDimension.getInstance(2, 2)));
		assertThrows(InvalidInputException.class, () -> InterpolationGrid.create(0, Double.NaN, 0, 1, ImmutableDimension.getInstance(2, 2)));
	}

}
