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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wafermap.lib.exceptions.InvalidInputException;
import wafermap.lib.measurements.Sample;
import wafermap.lib.measurements.SampleList;

/**
 * Static methods to synthesize samples on the wafer boundary, so that interpolation 
 * has defined values at the perimeter rather than extrapolating.
 * <p>
 * Each {@link ReferencePoint} receives the mean value of the sample(s) nearest to it. 
 * All samples at exactly the minimum distance are averaged, which keeps the boundary 
 * values symmetric whenever the sample layout and values are symmetric.
 * 
 * @author WaferMap developers
 */
public class BoundaryExtender {
	
	private static final Logger logger = LoggerFactory.getLogger(BoundaryExtender.class);
	
	// Suppressed default constructor for non-instantiability
	private BoundaryExtender() {
		throw new AssertionError();
	}
	
	/**
	 * Append one synthesized sample for each {@link ReferencePoint} on a circle of the given radius.
	 * 
	 * @param samples the measured samples; must not be empty
	 * @param radius radius of the boundary circle; must be finite and &gt; 0
	 * @return the extended samples, with {@code samples.size() + 4} entries
	 * @throws InvalidInputException if there are no samples or the radius is invalid
	 */
	public static ExtendedSampleSet extend(SampleList samples, double radius) throws InvalidInputException {
		if (samples == null || samples.isEmpty())
			throw new InvalidInputException("At least one sample is required to extend to the boundary");
		if (!Double.isFinite(radius) || radius <= 0)
			throw new InvalidInputException("Boundary radius must be finite and > 0, but was " + radius);
		
		List<Sample> extended = new ArrayList<>(samples.size() + ReferencePoint.values().length);
		extended.addAll(samples.getSamples());
		for (var ref : ReferencePoint.values()) {
			var p = ref.getLocation(radius);
			var nearest = findNearest(samples, p.getX(), p.getY());
			if (nearest.isEmpty())
				throw new InvalidInputException("No sample has a finite distance to the boundary point " + ref + " - check for NaN coordinates");
			double value = meanValue(samples, nearest);
			logger.debug("Boundary value at {} ({}, {}): {} (mean of {} sample(s))", 
					ref, p.getX(), p.getY(), value, nearest.size());
			extended.add(Sample.create(p.getX(), p.getY(), value));
		}
		return new ExtendedSampleSet(SampleList.create(extended), samples.size(), radius);
	}
	
	/**
	 * Find the indices of all samples at the minimum Euclidean distance from (x, y).
	 * <p>
	 * Ties are resolved by exact equality: a sample at a strictly smaller distance replaces 
	 * the current set, a sample at exactly the current minimum is appended to it. 
	 * Indices are returned in input order.
	 * 
	 * @param samples
	 * @param x
	 * @param y
	 * @return the indices of the nearest samples; empty only if {@code samples} is empty
	 */
	public static List<Integer> findNearest(SampleList samples, double x, double y) {
		List<Integer> indices = new ArrayList<>();
		double minDistance = Double.POSITIVE_INFINITY;
		for (int i = 0; i < samples.size(); i++) {
			double d = samples.get(i).distance(x, y);
			if (d < minDistance) {
				indices.clear();
				indices.add(i);
				minDistance = d;
			} else if (d == minDistance) {
				indices.add(i);
			}
		}
		return indices;
	}
	
	private static double meanValue(SampleList samples, List<Integer> indices) {
		double sum = 0;
		for (int ind : indices)
			sum += samples.get(ind).getValue();
		return sum / indices.size();
	}

}
