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

import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.DoubleStream;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wafermap.lib.common.ColorTools;

/**
 * Helper class to manage colormaps, which are rather like lookup tables but easily support interpolation.
 * <p>
 * Colormaps are looked up by name. A small set is built in; further maps are read from 
 * {@code .tsv} files in the {@code /colormaps} resource directory, or installed at runtime.
 * 
 * @author WaferMap developers
 */
public class ColorMaps {
	
	private static final Logger logger = LoggerFactory.getLogger(ColorMaps.class);
	
	/**
	 * Name of the default colormap: a reversed rainbow, running from magenta (low) through blue, green and yellow to red (high).
	 */
	public static final String DEFAULT_COLORMAP_NAME = "Rainbow (reversed)";
	
	private static final ColorMap RAINBOW = createSegmentedColorMap("Rainbow",
			new double[] {0.000, 0.030, 0.215, 0.400, 0.586, 0.770, 0.954, 1.000},
			new double[][] {
				{1.00, 0.00, 0.16},
				{1.00, 0.00, 0.00},
				{1.00, 1.00, 0.00},
				{0.00, 1.00, 0.00},
				{0.00, 1.00, 1.00},
				{0.00, 0.00, 1.00},
				{1.00, 0.00, 1.00},
				{1.00, 0.00, 0.75}
			});
	
	private static final ColorMap LEGACY_COLOR_MAP = new PseudoColorMap();
	
	private static final List<ColorMap> BUILT_IN_COLOR_MAPS = Arrays.asList(
			reversedColorMap(RAINBOW, DEFAULT_COLORMAP_NAME),
			RAINBOW,
			LEGACY_COLOR_MAP,
			createColorMap("Gray", 255, 255, 255),
			createColorMap("Red", 255, 0, 0),
			createColorMap("Green", 0, 255, 0),
			createColorMap("Blue", 0, 0, 255)
			);
	
	private static final Map<String, ColorMap> maps = Collections.synchronizedMap(new LinkedHashMap<>(loadDefaultColorMaps()));
	private static final Map<String, ColorMap> mapsUnmodifiable = Collections.unmodifiableMap(maps);
	
		
	/**
	 * Colormap, which acts as an interpolating lookup table with an arbitrary range.
	 */
	public interface ColorMap {
		
		/**
		 * Get the name of the colormap.
		 * @return
		 */
		public String getName();

		/**
		 * Get a packed RGB representation of the (interpolated) color at the specified value.
		 * Values outside the display range are clamped to the first or last color.
		 * @param value value that should be colorized
		 * @param minValue minimum display value, corresponding to the first color in the lookup table of this map
		 * @param maxValue maximum display value, corresponding to the last color in the lookup table of this map
		 * @return
		 */
		public int getColor(double value, double minValue, double maxValue);

	}
	
	private static Map<String, ColorMap> loadDefaultColorMaps() {
	    Map<String, ColorMap> maps = new LinkedHashMap<>();
	    for (var cm : BUILT_IN_COLOR_MAPS)
	    	maps.put(cm.getName(), cm);
		try {
			URL url = ColorMaps.class.getResource("/colormaps");
			if (url == null) {
				logger.debug("No colormap resources found");
				return maps;
			}
			URI uri = url.toURI();
			Path pathColorMaps;
		    if (uri.getScheme().equals("jar")) {
		        FileSystem fileSystem = FileSystems.newFileSystem(uri, Map.of());
		        pathColorMaps = fileSystem.getPath("/colormaps");
		    } else {
		    	pathColorMaps = Paths.get(uri);
		    }
		    for (var cm : loadColorMapsFromDirectory(pathColorMaps))
		    	maps.put(cm.getName(), cm);
		} catch (Exception e) {
			logger.error("Error loading default colormaps: " + e.getLocalizedMessage(), e);
		}
	    return maps;
	}
	
	/**
	 * Install colormaps from the specified paths.
	 * 
	 * @param paths .tsv files containing colormaps, or directories that contain such .tsv files.
	 * @return true if changes were made, false otherwise
	 * @throws IOException if a path could not be read
	 */
	public static boolean installColorMaps(Path... paths) throws IOException {
		boolean changes = false;
		for (var p : paths) {
	        if (Files.isDirectory(p)) {
	        	for (var cm : loadColorMapsFromDirectory(p)) {
	        		maps.put(cm.getName(), cm);		   
	        		changes = true;
	        	}
	        } else if (Files.isRegularFile(p)) {
	        	var cm = loadColorMap(p);
	        	maps.put(cm.getName(), cm);
	        	changes = true;
	        } else {
	        	throw new IOException("Colormap path does not exist: " + p);
	        }
		}
		return changes;
	}
	
	/**
	 * Install colormaps.
	 * 
	 * @param colorMaps one or more colormaps.
	 * @return true if changes were made, false otherwise
	 */
	public static boolean installColorMaps(ColorMap... colorMaps) {
		boolean changes = false;
		for (var cm : colorMaps) {
			maps.put(cm.getName(), cm);
			changes = true;
		}
		return changes;
	}
	
	/**
	 * Get an array of packed RGB values for a specific colormap.
	 * @param map the colormap providing colors
	 * @param nValues the number of colors to extract
	 * @param doInvert if true, reverse the order of the colors
	 * @return an int array of length nValues
	 */
	public static int[] getColors(ColorMap map, int nValues, boolean doInvert) {
		int[] vals = new int[nValues];
		double max = nValues - 1;
		for (int i = 0; i < nValues; i++) {
			double value = doInvert ? max - i : i;
			vals[i] = map.getColor(value, 0, max);
		}
		return vals;
	}
	
	/**
	 * Get the default colormap.
	 * @return
	 * @see #DEFAULT_COLORMAP_NAME
	 */
	public static ColorMap getDefaultColorMap() {
		return maps.get(DEFAULT_COLORMAP_NAME);
	}
	
	/**
	 * Get a colormap by name.
	 * @param name
	 * @return the colormap
	 * @throws IllegalArgumentException if no colormap with the name is available
	 */
	public static ColorMap getColorMap(String name) throws IllegalArgumentException {
		Objects.requireNonNull(name, "Colormap name must not be null");
		var map = maps.get(name);
		if (map == null) {
			// Try ignoring case before failing
			synchronized (maps) {
				map = maps.values().stream()
					.filter(m -> m.getName().equalsIgnoreCase(name))
					.findFirst()
					.orElseThrow(() -> new IllegalArgumentException("Unknown colormap '" + name + "' - available colormaps are " + maps.keySet()));
			}
		}
		return map;
	}
	
	/**
	 * Get an unmodifiable map representing all the currently-available colormaps.
	 * 
	 * @return the available colormaps
	 */
	public static Map<String, ColorMap> getColorMaps() {
		return mapsUnmodifiable;
	}
	
	private static List<ColorMap> loadColorMapsFromDirectory(Path path) throws IOException {
		List<ColorMap> list = new ArrayList<>();
		List<Path> files;
		try (Stream<Path> stream = Files.list(path)) {
			files = stream.filter(p -> p.getFileName().toString().endsWith(".tsv"))
				.sorted(Comparator.comparing(p -> p.getFileName().toString()))
				.collect(Collectors.toList());
		}
		for (var temp : files) {
			try {
				list.add(loadColorMap(temp));
			} catch (Exception e) {
				logger.error("Error loading colormap from {}", temp, e);
			}
		}
	    return list;
	}
	
	private static ColorMap loadColorMap(Path path) throws IOException {
		// Parse a name
		String name = path.getFileName().toString();
    	if (name.endsWith(".tsv"))
    		name = name.substring(0, name.length()-4);
    	
		// Read non-blank lines
		List<String> lines = Files.readAllLines(path).stream().filter(s -> !s.isBlank()).collect(Collectors.toList());
		
        // Parse values
		int n = lines.size();
    	double[] r = new double[n];
    	double[] g = new double[n];
    	double[] b = new double[n];
    	int i = 0;
    	for (String line : lines) {
    		String[] split = line.trim().split("\\s+");
    		if (split.length < 3) {
    			logger.warn("Invalid line (must contain 3 doubles): {}", line);
    			continue;
    		}
    		r[i] = Double.parseDouble(split[0]);
    		g[i] = Double.parseDouble(split[1]);
    		b[i] = Double.parseDouble(split[2]);
    		i++;
    	}
    	if (i < n) {
    		r = Arrays.copyOf(r, i);
    		g = Arrays.copyOf(g, i);
    		b = Arrays.copyOf(b, i);
    	}
    	if (i < 2)
    		throw new IOException("Colormap " + path + " must contain at least 2 colors");
    	logger.debug("Loaded colormap {} ({} colors)", name, i);
    	return createColorMap(name, r, g, b);
	}
	
	/**
	 * Create a colormap using floating point values for red, green and blue.
	 * These should be in the range 0-1.
	 * @param name
	 * @param r
	 * @param g
	 * @param b
	 * @return
	 */
	public static ColorMap createColorMap(String name, double[] r, double[] g, double[] b) {
		int[] ri = convertToInt(r);
		int[] gi = convertToInt(g);
		int[] bi = convertToInt(b);
		return createColorMap(name, ri, gi, bi);
	}
	
	private static int[] convertToInt(double[] arr) {
		return DoubleStream.of(arr).mapToInt(d -> convertToInt(d)).toArray();
	}
	
	private static int convertToInt(double d) {
		if (!Double.isFinite(d) || d > 1 || d < 0)
			throw new IllegalArgumentException("Color value must be between 0 and 1, but actual value is " + d);
		return (int)Math.round(d * 255.0);
	}

	/**
	 * Create a colormap using integer values for red, green and blue.
	 * These should be in the range 0-255, and there must be at least two colors.
	 * @param name
	 * @param r
	 * @param g
	 * @param b
	 * @return
	 */
	public static ColorMap createColorMap(String name, int[] r, int[] g, int[] b) {
		if (r.length < 2 || r.length != g.length || r.length != b.length)
			throw new IllegalArgumentException("Colormap requires at least 2 colors, with equal numbers of red, green and blue values");
		return new DefaultColorMap(name, r, g, b);
	}
	
	/**
	 * Create a colormap by linearly interpolating between colors at anchor positions.
	 * 
	 * @param name
	 * @param positions increasing anchor positions from 0 to 1
	 * @param rgb red, green and blue values (0-1) at each anchor
	 * @return
	 */
	public static ColorMap createSegmentedColorMap(String name, double[] positions, double[][] rgb) {
		if (positions.length < 2 || positions.length != rgb.length || positions[0] != 0 || positions[positions.length-1] != 1)
			throw new IllegalArgumentException("Anchor positions must run from 0 to 1, with one color per anchor");
		int n = 256;
		double[] r = new double[n];
		double[] g = new double[n];
		double[] b = new double[n];
		int seg = 0;
		for (int i = 0; i < n; i++) {
			double x = i / (n - 1.0);
			while (seg < positions.length - 2 && x > positions[seg+1])
				seg++;
			double t = (x - positions[seg]) / (positions[seg+1] - positions[seg]);
			t = Math.max(0, Math.min(1, t));
			r[i] = rgb[seg][0] + (rgb[seg+1][0] - rgb[seg][0]) * t;
			g[i] = rgb[seg][1] + (rgb[seg+1][1] - rgb[seg][1]) * t;
			b[i] = rgb[seg][2] + (rgb[seg+1][2] - rgb[seg][2]) * t;
		}
		return createColorMap(name, r, g, b);
	}
	
	/**
	 * Create a colormap using int values for red, green and blue corresponding to the maximum value; 
	 * the minimum color will be black.
	 * These should be in the range 0-255.
	 * @param name
	 * @param r
	 * @param g
	 * @param b
	 * @return
	 */
	public static ColorMap createColorMap(String name, int r, int g, int b) {
		return new SingleColorMap(name, 0, r, 0, g, 0, b);
	}
	
	/**
	 * Reverse a colormap, so that the minimum value gets the color previously used for the maximum.
	 * @param map base colormap
	 * @param name name of the reversed map
	 * @return
	 */
	public static ColorMap reversedColorMap(ColorMap map, String name) {
		return new ReversedColorMap(map, name);
	}
	
	/**
	 * Apply gamma to a colormap.
	 * The resulting colormap normalizes the input value according to the specified min and max, 
	 * then applies {@code value = Math.pow(value, gamma)} before passing this to the 
	 * wrapped {@link ColorMap}.
	 * 
	 * @param map base colormap
	 * @param gamma gamma value
	 * @return transformed colormap
	 */
	public static ColorMap gammaColorMap(ColorMap map, double gamma) {
		return new GammaColorMap(map, gamma);
	}

	private static class DefaultColorMap implements ColorMap {
		
		private final String name;
		private final int nColors = 256;
		private final int[] colors = new int[nColors];
		
		DefaultColorMap(String name, int[] r, int[] g, int[] b) {
			this.name = name;
			double scale = (double)(r.length - 1) / (nColors - 1);
			for (int i = 0; i < nColors; i++) {
				int ind = Math.min((int)(i * scale), r.length - 2);
				double residual = (i * scale) - ind;
				colors[i] = ColorTools.packClippedRGB(
						(int)Math.round(r[ind] + (r[ind+1] - r[ind]) * residual),
						(int)Math.round(g[ind] + (g[ind+1] - g[ind]) * residual),
						(int)Math.round(b[ind] + (b[ind+1] - b[ind]) * residual));
			}
		}
		
		@Override
		public String getName() {
			return name;
		}
		
		@Override
		public String toString() {
			return getName();
		}

		@Override
		public int getColor(double value, double minValue, double maxValue) {
			int ind = 0;
			if (maxValue > minValue) {
				ind = (int)Math.round((value - minValue) / (maxValue - minValue) * (nColors - 1));
				ind = ind >= nColors ? nColors - 1 : ind;
				ind = ind < 0 ? 0 : ind;
			} else if (minValue > maxValue) {
				ind = (int)Math.round((value - maxValue) / (minValue - maxValue) * (nColors - 1));
				ind = ind >= nColors ? nColors - 1 : ind;
				ind = ind < 0 ? 0 : ind;
				ind = nColors - 1 - ind;
			}
			return colors[ind];
		}

	}

	/**
	 * The classic 'jet'-like pseudocolor map.
	 */
	private static class PseudoColorMap implements ColorMap {

		private static final int[] r = {0, 0,   0,   0,   255, 255};
		private static final int[] g = {0, 0,   255, 255, 255, 0};
		private static final int[] b = {0, 255, 255, 0,   0,   0};
		private static final ColorMap map = new DefaultColorMap("Jet", r, g, b);
		
		@Override
		public String toString() {
			return getName();
		}

		@Override
		public String getName() {
			return "Jet";
		}

		@Override
		public int getColor(double value, double minValue, double maxValue) {
			return map.getColor(value, minValue, maxValue);
		}

	}
	
	
	private static class ReversedColorMap implements ColorMap {
		
		private final ColorMap map;
		private final String name;
		
		ReversedColorMap(ColorMap map, String name) {
			this.map = map;
			this.name = name;
		}

		@Override
		public String getName() {
			return name;
		}
		
		@Override
		public String toString() {
			return getName();
		}

		@Override
		public int getColor(double value, double minValue, double maxValue) {
			return map.getColor(value, maxValue, minValue);
		}
		
	}
	
	
	private static class GammaColorMap implements ColorMap {
		
		private final ColorMap map;
		private final double gamma;
		
		public GammaColorMap(ColorMap map, double gamma) {
			this.map = map;
			this.gamma = gamma;
		}

		@Override
		public String getName() {
			return String.format("%s (gamma=%s)", map.getName(), gamma);
		}

		@Override
		public int getColor(double value, double minValue, double maxValue) {
			if (gamma == 1)
				return map.getColor(value, minValue, maxValue);
			double val = 0;
			if (gamma == 0)
				 val = 1;
			else if (maxValue != minValue)
				val = (value - minValue) / (maxValue - minValue);
			val = Math.pow(Math.max(0, Math.min(1, val)), gamma);
			return map.getColor(val, 0, 1);
		}
		
	}
	
	
	private static class SingleColorMap implements ColorMap {
		
		private final String name;
		
		private final int minRed, maxRed;
		private final int minGreen, maxGreen;
		private final int minBlue, maxBlue;
		
		SingleColorMap(String name, int minRed, int maxRed, int minGreen, int maxGreen, int minBlue, int maxBlue) {
			this.name = name;
			this.minRed = minRed;
			this.maxRed = maxRed;
			this.minGreen = minGreen;
			this.maxGreen = maxGreen;
			this.minBlue = minBlue;
			this.maxBlue = maxBlue;
		}
		
		@Override
		public String getName() {
			return name;
		}
		
		@Override
		public String toString() {
			return getName();
		}

		@Override
		public int getColor(double value, double minValue, double maxValue) {
			if (minValue == maxValue)
				return ColorTools.packRGB(maxRed, maxGreen, maxBlue);
			
			double val = (value - minValue) / (maxValue - minValue);
			if (val >= 1)
				return ColorTools.packRGB(maxRed, maxGreen, maxBlue);
			if (val <= 0)
				return ColorTools.packRGB(minRed, minGreen, minBlue);
			
			int r = (int)Math.round(linearInterp1D(minRed, maxRed, val));
			int g = (int)Math.round(linearInterp1D(minGreen, maxGreen, val));
			int b = (int)Math.round(linearInterp1D(minBlue, maxBlue, val));
			
			return ColorTools.packRGB(r, g, b);
		}

		
		private static double linearInterp1D(double fx0, double fx1, double x) {
			assert x >= 0 && x <= 1;
			return fx0 * (1 - x) + x * fx1;
		}

	}

}
