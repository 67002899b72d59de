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

package wafermap.lib.measurements;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import wafermap.lib.exceptions.InvalidInputException;

/**
 * An ordered, immutable sequence of {@link Sample} objects.
 * <p>
 * Input order is retained, since it is significant when resolving ties between equally-distant samples.
 * 
 * @author WaferMap developers
 */
public class SampleList implements Iterable<Sample> {
	
	private final List<Sample> samples;
	
	private SampleList(List<Sample> samples) {
		this.samples = Collections.unmodifiableList(samples);
	}
	
	/**
	 * Create a sample list from a collection of samples.
	 * @param samples
	 * @return
	 */
	public static SampleList create(Collection<Sample> samples) {
		Objects.requireNonNull(samples, "Samples must not be null");
		List<Sample> list = new ArrayList<>(samples.size());
		for (var s : samples)
			list.add(Objects.requireNonNull(s, "Samples must not contain null"));
		return new SampleList(list);
	}
	
	/**
	 * Create a sample list from three parallel arrays.
	 * @param x x coordinates
	 * @param y y coordinates
	 * @param values measured values
	 * @return
	 * @throws InvalidInputException if any array is null, or the arrays have different lengths
	 */
	public static SampleList create(double[] x, double[] y, double[] values) throws InvalidInputException {
		if (x == null || y == null || values == null)
			throw new InvalidInputException("x, y and value arrays must not be null");
		if (x.length != y.length || x.length != values.length)
			throw new InvalidInputException(
					String.format("x, y and value arrays must have the same length, but lengths are %d, %d and %d",
							x.length, y.length, values.length));
		List<Sample> list = new ArrayList<>(x.length);
		for (int i = 0; i < x.length; i++)
			list.add(Sample.create(x[i], y[i], values[i]));
		return new SampleList(list);
	}
	
	/**
	 * Create an empty sample list.
	 * @return
	 */
	public static SampleList empty() {
		return new SampleList(new ArrayList<>());
	}
	
	/**
	 * Number of samples.
	 * @return
	 */
	public int size() {
		return samples.size();
	}
	
	/**
	 * Returns true if the list contains no samples.
	 * @return
	 */
	public boolean isEmpty() {
		return samples.isEmpty();
	}
	
	/**
	 * Get the sample at the specified index.
	 * @param index
	 * @return
	 */
	public Sample get(int index) {
		return samples.get(index);
	}
	
	/**
	 * Get an unmodifiable view of the samples.
	 * @return
	 */
	public List<Sample> getSamples() {
		return samples;
	}
	
	/**
	 * Get a new array containing the x coordinates, in order.
	 * @return
	 */
	public double[] getXs() {
		return samples.stream().mapToDouble(Sample::getX).toArray();
	}
	
	/**
	 * Get a new array containing the y coordinates, in order.
	 * @return
	 */
	public double[] getYs() {
		return samples.stream().mapToDouble(Sample::getY).toArray();
	}
	
	/**
	 * Get a new array containing the values, in order.
	 * @return
	 */
	public double[] getValues() {
		return samples.stream().mapToDouble(Sample::getValue).toArray();
	}
	
	/**
	 * Minimum value, or NaN if the list is empty.
	 * @return
	 */
	public double getMinValue() {
		return samples.stream().mapToDouble(Sample::getValue).min().orElse(Double.NaN);
	}
	
	/**
	 * Maximum value, or NaN if the list is empty.
	 * @return
	 */
	public double getMaxValue() {
		return samples.stream().mapToDouble(Sample::getValue).max().orElse(Double.NaN);
	}

	@Override
	public Iterator<Sample> iterator() {
		return samples.iterator();
	}

	@Override
	public int hashCode() {
		return samples.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof SampleList))
			return false;
		return samples.equals(((SampleList)obj).samples);
	}
	
	@Override
	public String toString() {
		return "SampleList (n=" + samples.size() + ")";
	}

}
