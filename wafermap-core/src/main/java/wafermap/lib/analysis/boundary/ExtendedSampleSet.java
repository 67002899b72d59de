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

import java.util.List;

import wafermap.lib.measurements.Sample;
import wafermap.lib.measurements.SampleList;

/**
 * Original samples followed by the samples synthesized on the wafer boundary.
 * 
 * @author WaferMap developers
 * @see BoundaryExtender
 */
public class ExtendedSampleSet {
	
	private final SampleList samples;
	private final int nOriginal;
	private final double radius;
	
	ExtendedSampleSet(SampleList samples, int nOriginal, double radius) {
		this.samples = samples;
		this.nOriginal = nOriginal;
		this.radius = radius;
	}
	
	/**
	 * All samples, originals first.
	 * @return
	 */
	public SampleList getSamples() {
		return samples;
	}
	
	/**
	 * Total number of samples (original and synthesized).
	 * @return
	 */
	public int size() {
		return samples.size();
	}
	
	/**
	 * Number of samples that were supplied, rather than synthesized.
	 * @return
	 */
	public int nOriginal() {
		return nOriginal;
	}
	
	/**
	 * Radius of the circle on which the boundary samples were synthesized.
	 * @return
	 */
	public double getRadius() {
		return radius;
	}
	
	/**
	 * The samples that were supplied, in input order.
	 * @return
	 */
	public List<Sample> getOriginalSamples() {
		return samples.getSamples().subList(0, nOriginal);
	}
	
	/**
	 * The synthesized samples, in {@link ReferencePoint} order.
	 * @return
	 */
	public List<Sample> getBoundarySamples() {
		return samples.getSamples().subList(nOriginal, samples.size());
	}
	
	/**
	 * Get the synthesized sample for a specific reference point.
	 * @param point
	 * @return
	 */
	public Sample getBoundarySample(ReferencePoint point) {
		return samples.get(nOriginal + point.ordinal());
	}
	
	@Override
	public String toString() {
		return "ExtendedSampleSet (n=" + nOriginal + "+" + (samples.size() - nOriginal) + ", radius=" + radius + ")";
	}

}
