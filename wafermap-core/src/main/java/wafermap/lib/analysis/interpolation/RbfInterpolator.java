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

import java.util.Objects;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wafermap.lib.common.GeneralTools;
import wafermap.lib.exceptions.InterpolationException;
import wafermap.lib.exceptions.InvalidInputException;

/**
 * Radial basis function interpolant for scattered 2D data.
 * <p>
 * The interpolant is {@code f(p) = sum_j w_j phi(|p - p_j|)}, where the weights {@code w} solve 
 * {@code (A - smooth * I) w = v} with {@code A[i][j] = phi(|p_i - p_j|)}. 
 * With {@code smooth = 0} the interpolant passes exactly through every node.
 * <p>
 * Instances are immutable once fitted.
 * 
 * @author WaferMap developers
 */
public class RbfInterpolator {
	
	private static final Logger logger = LoggerFactory.getLogger(RbfInterpolator.class);
	
	/**
	 * Maximum relative residual accepted after solving; larger residuals indicate an ill-conditioned system.
	 */
	private static final double MAX_RELATIVE_RESIDUAL = 1e-6;
	
	private final RadialBasisFunction function;
	private final double epsilon;
	private final double smooth;
	private final double[] xs;
	private final double[] ys;
	private final double[] weights;
	
	private RbfInterpolator(RadialBasisFunction function, double epsilon, double smooth, double[] xs, double[] ys, double[] weights) {
		this.function = function;
		this.epsilon = epsilon;
		this.smooth = smooth;
		this.xs = xs;
		this.ys = ys;
		this.weights = weights;
	}
	
	/**
	 * Fit an exact interpolant with the default shape parameter.
	 * @param xs node x coordinates
	 * @param ys node y coordinates
	 * @param values node values
	 * @param function basis function
	 * @return
	 * @throws InterpolationException if the system cannot be solved
	 * @see #fit(double[], double[], double[], RadialBasisFunction, double, double)
	 */
	public static RbfInterpolator fit(double[] xs, double[] ys, double[] values, RadialBasisFunction function) throws InterpolationException {
		return fit(xs, ys, values, function, Double.NaN, 0);
	}
	
	/**
	 * Fit an interpolant.
	 * 
	 * @param xs node x coordinates
	 * @param ys node y coordinates
	 * @param values node values
	 * @param function basis function
	 * @param epsilon shape parameter; if NaN, the average node spacing is used (see {@link #estimateEpsilon(double[], double[])})
	 * @param smooth smoothing; 0 for exact interpolation
	 * @return
	 * @throws InvalidInputException if the arrays are empty or have different lengths, or epsilon/smooth are invalid
	 * @throws InterpolationException if nodes coincide, or the linear system is singular or ill-conditioned
	 */
	public static RbfInterpolator fit(double[] xs, double[] ys, double[] values, RadialBasisFunction function, double epsilon, double smooth)
			throws InvalidInputException, InterpolationException {
		Objects.requireNonNull(function, "Radial basis function must not be null");
		if (xs == null || ys == null || values == null)
			throw new InvalidInputException("Node coordinates and values must not be null");
		int n = xs.length;
		if (n == 0)
			throw new InvalidInputException("At least one node is required for interpolation");
		if (ys.length != n || values.length != n)
			throw new InvalidInputException(
					String.format("Node arrays must have the same length, but lengths are %d, %d and %d", n, ys.length, values.length));
		if (!Double.isFinite(smooth))
			throw new InvalidInputException("Smoothing must be finite, but was " + smooth);
		
		checkDistinct(xs, ys);
		
		if (Double.isNaN(epsilon))
			epsilon = estimateEpsilon(xs, ys);
		else if (!(epsilon > 0) || Double.isInfinite(epsilon))
			throw new InvalidInputException("Epsilon must be finite and > 0, but was " + epsilon);
		
		RealMatrix matrix = MatrixUtils.createRealMatrix(n, n);
		double maxAbs = 0;
		for (int i = 0; i < n; i++) {
			for (int j = i; j < n; j++) {
				double v = function.evaluate(distance(xs[i], ys[i], xs[j], ys[j]), epsilon);
				matrix.setEntry(i, j, v);
				matrix.setEntry(j, i, v);
				maxAbs = Math.max(maxAbs, Math.abs(v));
			}
			matrix.addToEntry(i, i, -smooth);
		}
		
		RealVector rhs = MatrixUtils.createRealVector(values.clone());
		RealVector w;
		try {
			double threshold = Math.max(maxAbs * 1e-12, Double.MIN_NORMAL);
			DecompositionSolver solver = new LUDecomposition(matrix, threshold).getSolver();
			w = solver.solve(rhs);
		} catch (SingularMatrixException e) {
			throw new InterpolationException(
					String.format("Unable to fit %s interpolant to %d points - the system is singular", function, n), e);
		}
		
		double[] weights = w.toArray();
		if (GeneralTools.numNonFinite(weights) > 0)
			throw new InterpolationException(
					String.format("Unable to fit %s interpolant to %d points - weights are not finite", function, n));
		
		// Check the fit really reproduces the input
		double residual = matrix.operate(w).subtract(rhs).getLInfNorm();
		double scale = Math.max(rhs.getLInfNorm(), 1.0);
		if (!(residual <= MAX_RELATIVE_RESIDUAL * scale))
			throw new InterpolationException(
					String.format("Unable to fit %s interpolant to %d points - system is ill-conditioned (residual %.3g)", function, n, residual));
		
		logger.debug("Fitted {} interpolant to {} points (epsilon={}, smooth={}, residual={})", function, n, epsilon, smooth, residual);
		return new RbfInterpolator(function, epsilon, smooth, xs.clone(), ys.clone(), weights);
	}
	
	/**
	 * Estimate a default shape parameter as the average spacing between nodes, 
	 * based on the bounding box of the nodes.
	 * Axes with zero extent are ignored; if all extents are zero, 1 is returned.
	 * @param xs
	 * @param ys
	 * @return
	 */
	public static double estimateEpsilon(double[] xs, double[] ys) {
		double product = 1;
		int nEdges = 0;
		for (double[] arr : new double[][] {xs, ys}) {
			double min = Double.POSITIVE_INFINITY;
			double max = Double.NEGATIVE_INFINITY;
			for (double v : arr) {
				min = Math.min(min, v);
				max = Math.max(max, v);
			}
			double edge = max - min;
			if (edge > 0) {
				product *= edge;
				nEdges++;
			}
		}
		if (nEdges == 0)
			return 1.0;
		return Math.pow(product / xs.length, 1.0 / nEdges);
	}
	
	private static void checkDistinct(double[] xs, double[] ys) throws InterpolationException {
		for (int i = 0; i < xs.length; i++) {
			if (!Double.isFinite(xs[i]) || !Double.isFinite(ys[i]))
				throw new InterpolationException(String.format("Node %d has non-finite coordinates (%s, %s)", i, xs[i], ys[i]));
			for (int j = i + 1; j < xs.length; j++) {
				if (xs[i] == xs[j] && ys[i] == ys[j])
					throw new InterpolationException(
							String.format("Nodes %d and %d are coincident at (%s, %s) - the interpolation system would be singular", i, j, xs[i], ys[i]));
			}
		}
	}
	
	private static double distance(double x1, double y1, double x2, double y2) {
		double dx = x1 - x2;
		double dy = y1 - y2;
		return Math.sqrt(dx*dx + dy*dy);
	}
	
	/**
	 * Evaluate the interpolant at a single location.
	 * @param x
	 * @param y
	 * @return
	 */
	public double evaluate(double x, double y) {
		double sum = 0;
		for (int j = 0; j < weights.length; j++)
			sum += weights[j] * function.evaluate(distance(x, y, xs[j], ys[j]), epsilon);
		return sum;
	}
	
	/**
	 * Evaluate the interpolant at multiple locations.
	 * @param x
	 * @param y
	 * @return a new array of interpolated values
	 * @throws IllegalArgumentException if the arrays have different lengths
	 */
	public double[] evaluate(double[] x, double[] y) throws IllegalArgumentException {
		if (x.length != y.length)
			throw new IllegalArgumentException("x and y arrays must have the same length");
		double[] result = new double[x.length];
		for (int i = 0; i < x.length; i++)
			result[i] = evaluate(x[i], y[i]);
		return result;
	}
	
	/**
	 * Basis function used by this interpolant.
	 * @return
	 */
	public RadialBasisFunction getFunction() {
		return function;
	}
	
	/**
	 * Shape parameter used by this interpolant.
	 * @return
	 */
	public double getEpsilon() {
		return epsilon;
	}
	
	/**
	 * Smoothing used by this interpolant.
	 * @return
	 */
	public double getSmooth() {
		return smooth;
	}
	
	/**
	 * Number of nodes.
	 * @return
	 */
	public int nNodes() {
		return weights.length;
	}
	
	/**
	 * Get a copy of the fitted weights.
	 * @return
	 */
	public double[] getWeights() {
		return weights.clone();
	}

}
