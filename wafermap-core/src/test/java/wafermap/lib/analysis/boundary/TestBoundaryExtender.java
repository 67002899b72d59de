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

package wafermap.lib.analysis.boundary;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import wafermap.lib.exceptions.InvalidInputException;
import wafermap.lib.measurements.Sample;
import wafermap.lib.measurements.SampleList;

@SuppressWarnings("javadoc")
public class TestBoundaryExtender {
	
	private static SampleList createCross() {
		return SampleList.create(
				new double[] {-50, 50, 0, 0},
				new double[] {0, 0, -50, 50},
				new double[] {1.0, 2.0, 3.0, 4.0});
	}
	
	@Test
	public void test_shape() {
		var samples = createCross();
		var extended = BoundaryExtender.extend(samples, 150);
		assertEquals(samples.size() + 4, extended.size());
		assertEquals(samples.size(), extended.nOriginal());
		assertEquals(samples.getSamples(), extended.getOriginalSamples());
		assertEquals(4, extended.getBoundarySamples().size());
		
		var single = SampleList.create(new double[] {1}, new double[] {2}, new double[] {3});
		assertEquals(5, BoundaryExtender.extend(single, 10).size());
	}
	
	@Test
	public void test_referencePointOrder() {
		var extended = BoundaryExtender.extend(createCross(), 150);
		var boundary = extended.getBoundarySamples();
		assertEquals(Sample.create(0, 150, 4.0), boundary.get(0));
		assertEquals(Sample.create(0, -150, 3.0), boundary.get(1));
		assertEquals(Sample.create(150, 0, 2.0), boundary.get(2));
		assertEquals(Sample.create(-150, 0, 1.0), boundary.get(3));
		assertEquals(4.0, extended.getBoundarySample(ReferencePoint.TOP).getValue());
		assertEquals(1.0, extended.getBoundarySample(ReferencePoint.LEFT).getValue());
	}
	
	@Test
	public void test_tiesAreAveraged() {
		// (0, R) is exactly equidistant from the first two samples
		var samples = SampleList.create(
				new double[] {-50, 50, 0},
				new double[] {50, 50, -50},
				new double[] {1.0, 3.0, 5.0});
		var extended = BoundaryExtender.extend(samples, 150);
		assertEquals(2.0, extended.getBoundarySample(ReferencePoint.TOP).getValue());
		assertEquals(5.0, extended.getBoundarySample(ReferencePoint.BOTTOM).getValue());
		assertEquals(3.0, extended.getBoundarySample(ReferencePoint.RIGHT).getValue());
		assertEquals(1.0, extended.getBoundarySample(ReferencePoint.LEFT).getValue());
	}
	
	@Test
	public void test_mirrorSymmetry() {
		// Layout and values mirror-symmetric about both axes
		var samples = SampleList.create(
				new double[] {-40, 40, -40, 40, 60, -60, 0, 0},
				new double[] {-40, -40, 40, 40, 0, 0, 60, -60},
				new double[] {5.0, 5.0, 5.0, 5.0, 2.0, 2.0, 7.0, 7.0});
		var extended = BoundaryExtender.extend(samples, 150);
		double top = extended.getBoundarySample(ReferencePoint.TOP).getValue();
		double bottom = extended.getBoundarySample(ReferencePoint.BOTTOM).getValue();
		double left = extended.getBoundarySample(ReferencePoint.LEFT).getValue();
		double right = extended.getBoundarySample(ReferencePoint.RIGHT).getValue();
		assertEquals(top, bottom);
		assertEquals(left, right);
		assertEquals(7.0, top);
		assertEquals(2.0, left);
	}
	
	@Test
	public void test_equidistantSamples() {
		// Four samples equidistant from every reference point
		var samples = SampleList.create(
				new double[] {-20, 20, -20, 20},
				new double[] {-20, -20, 20, 20},
				new double[] {1.0, 2.0, 3.0, 4.0});
		var extended = BoundaryExtender.extend(samples, 100);
		assertEquals(3.5, extended.getBoundarySample(ReferencePoint.TOP).getValue());
		assertEquals(1.5, extended.getBoundarySample(ReferencePoint.BOTTOM).getValue());
		assertEquals(3.0, extended.getBoundarySample(ReferencePoint.RIGHT).getValue());
		assertEquals(2.0, extended.getBoundarySample(ReferencePoint.LEFT).getValue());
		
		// Identical values everywhere give identical boundary values
		var constant = SampleList.create(
				new double[] {-30, 10, 40, 5},
				new double[] {12, -70, 3, 60},
				new double[] {2.5, 2.5, 2.5, 2.5});
		for (var s : BoundaryExtender.extend(constant, 100).getBoundarySamples())
			assertEquals(2.5, s.getValue());
	}
	
	@Test
	public void test_rangeContainment() {
		var samples = SampleList.create(
				new double[] {-73.5, 12.25, 88.0, -5.5, 40.0, -60.0},
				new double[] {10.0, -99.0, 14.0, 61.0, 42.0, -33.0},
				new double[] {-4.2, 17.0, 3.3, 0.0, 9.9, -1.5});
		var extended = BoundaryExtender.extend(samples, 150);
		for (var s : extended.getBoundarySamples()) {
			assertTrue(s.getValue() >= samples.getMinValue());
			assertTrue(s.getValue() <= samples.getMaxValue());
		}
	}
	
	@Test
	public void test_noDistanceCutoff() {
		// All samples are further from the reference points than the radius
		var samples = SampleList.create(
				new double[] {-500, 500},
				new double[] {0, 0},
				new double[] {1.0, 2.0});
		var extended = BoundaryExtender.extend(samples, 10);
		assertEquals(1.5, extended.getBoundarySample(ReferencePoint.TOP).getValue());
		assertEquals(2.0, extended.getBoundarySample(ReferencePoint.RIGHT).getValue());
		assertEquals(1.0, extended.getBoundarySample(ReferencePoint.LEFT).getValue());
	}
	
	@Test
	public void test_findNearest() {
		var samples = SampleList.create(
				new double[] {0, 3, -3, 1},
				new double[] {0, 4, 4, 1},
				new double[] {0, 0, 0, 0});
		assertEquals(List.of(0), BoundaryExtender.findNearest(samples, 0, 0));
		assertEquals(Arrays.asList(1, 2), BoundaryExtender.findNearest(samples, 0, 10));
		assertEquals(List.of(3), BoundaryExtender.findNearest(samples, 1, 1.2));
		assertTrue(BoundaryExtender.findNearest(SampleList.empty(), 0, 0).isEmpty());
	}
	
	@Test
	public void test_invalidInput() {
		assertThrows(InvalidInputException.class, () -> BoundaryExtender.extend(SampleList.empty(), 150));
		assertThrows(InvalidInputException.class, () -> BoundaryExtender.extend(null, 150));
		assertThrows(InvalidInputException.class, () -> BoundaryExtender.extend(createCross(), 0));
		assertThrows(InvalidInputException.class, () -> BoundaryExtender.extend(createCross(), -1));
		assertThrows(InvalidInputException.class, () -> BoundaryExtender.extend(createCross(), Double.NaN));
		var nan = SampleList.create(new double[] {Double.NaN}, new double[] {0}, new double[] {1});
		assertThrows(InvalidInputException.class, () -> BoundaryExtender.extend(nan, 150));
	}

}
