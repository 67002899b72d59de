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
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import wafermap.lib.analysis.boundary.BoundaryExtender;
import wafermap.lib.analysis.boundary.ExtendedSampleSet;
import wafermap.lib.exceptions.InterpolationException;
import wafermap.lib.exceptions.InvalidInputException;
import wafermap.lib.geom.ImmutableDimension;
import wafermap.lib.measurements.SampleList;

@SuppressWarnings("javadoc")
public class TestFieldInterpolator {
	
	private static ExtendedSampleSet createExtended() {
		var samples = SampleList.create(
				new double[] {-50, 50, 0, 0},
				new double[] {0, 0, -50, 50},
				new double[] {1.0, 2.0, 3.0, 4.0});
		return BoundaryExtender.extend(samples, 150);
	}
	
	@Test
	public void test_gridDimensionAndExtent() {
		var extended = createExtended();
		var result = FieldInterpolator.interpolate(extended);
		var grid = result.getGrid();
		var field = result.getField();
		assertEquals(100, grid.getWidth());
		assertEquals(100, grid.getHeight());
		assertEquals(100, field.getWidth());
		assertEquals(100, field.getHeight());
		assertEquals(-150, grid.getMinX());
		assertEquals(150, grid.getMaxX());
		assertEquals(-150, grid.getMinY());
		assertEquals(150, grid.getMaxY());
		assertEquals(-150, grid.getX(0));
		assertEquals(150, grid.getX(99));
		assertEquals(-150, grid.getY(0));
		assertEquals(150, grid.getY(99));
		assertTrue(field.isFinite());
		
		var result2 = FieldInterpolator.interpolate(extended, ImmutableDimension.getInstance(40, 25));
		assertEquals(40, result2.getField().getWidth());
		assertEquals(25, result2.getField().getHeight());
		assertEquals(25, result2.getField().toArray().length);
		assertEquals(40, result2.getField().toArray()[0].length);
	}
	
	@Test
	public void test_independentExtents() {
		// Samples extend beyond the boundary in x only
		var samples = SampleList.create(
				new double[] {-200, 200, 0, 10},
				new double[] {0, 0, -20, 30},
				new double[] {1.0, 2.0, 3.0, 4.0});
		var result = FieldInterpolator.interpolate(BoundaryExtender.extend(samples, 100), ImmutableDimension.getInstance(20, 20));
		assertEquals(-200, result.getGrid().getMinX());
		assertEquals(200, result.getGrid().getMaxX());
		assertEquals(-100, result.getGrid().getMinY());
		assertEquals(100, result.getGrid().getMaxY());
	}
	
	@Test
	public void test_determinism() {
		var extended = createExtended();
		var field1 = FieldInterpolator.interpolate(extended).getField();
		var field2 = FieldInterpolator.interpolate(createExtended()).getField();
		assertEquals(field1, field2);
		for (int r = 0; r < field1.getHeight(); r++)
			assertArrayEquals(field1.getRow(r), field2.getRow(r));
	}
	
	@Test
	public void test_exactness() {
		var extended = createExtended();
		var result = FieldInterpolator.interpolate(extended);
		var interpolator = result.getInterpolator();
		assertEquals(RadialBasisFunction.THIN_PLATE, interpolator.getFunction());
		assertEquals(extended.size(), interpolator.nNodes());
		for (var s : extended.getSamples())
			assertEquals(s.getValue(), interpolator.evaluate(s.getX(), s.getY()), 1e-8);
		
		// Field values at grid points come from the same interpolant
		var grid = result.getGrid();
		assertEquals(interpolator.evaluate(grid.getX(17), grid.getY(63)), result.getField().getValue(17, 63));
	}
	
	@Test
	public void test_otherKernels() {
		var extended = createExtended();
		for (var function : new RadialBasisFunction[] {RadialBasisFunction.MULTIQUADRIC, RadialBasisFunction.LINEAR, RadialBasisFunction.CUBIC}) {
			var result = FieldInterpolator.interpolate(extended, ImmutableDimension.getInstance(10, 10), function, 0);
			assertTrue(result.getField().isFinite());
			assertEquals(function, result.getInterpolator().getFunction());
		}
	}
	
	@Test
	public void test_coincidentWithBoundary() {
		// A sample exactly on a reference point duplicates a node
		var samples = SampleList.create(
				new double[] {0, 50, -50},
				new double[] {150, 0, 0},
				new double[] {1.0, 2.0, 3.0});
		var extended = BoundaryExtender.extend(samples, 150);
		assertEquals(7, extended.size());
		assertThrows(InterpolationException.class, () -> FieldInterpolator.interpolate(extended));
	}
	
	@Test
	public void test_collinear() {
		assertThrows(InterpolationException.class, () -> FieldInterpolator.checkNotCollinear(
				new double[] {0, 1, 2, 3}, new double[] {0, 2, 4, 6}));
		assertThrows(InterpolationException.class, () -> FieldInterpolator.checkNotCollinear(
				new double[] {5, 5, 5}, new double[] {1, 1, 1}));
		assertThrows(InterpolationException.class, () -> FieldInterpolator.checkNotCollinear(
				new double[] {-150, 0, 150}, new double[] {0, 0, 0}));
		assertDoesNotThrow(() -> FieldInterpolator.checkNotCollinear(
				new double[] {0, 1, 0}, new double[] {0, 0, 1}));
	}
	
	@Test
	public void test_invalidResolution() {
		var extended = createExtended();
		assertThrows(InvalidInputException.class, () -> FieldInterpolator.interpolate(extended, ImmutableDimension.getInstance(0, 10)));
		assertThrows(InvalidInputException.class, () -> FieldInterpolator.interpolate(extended, null));
	}

}
