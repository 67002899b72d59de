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

package wafermap.lib.render;

import java.nio.file.Path;
import java.util.Objects;

import wafermap.lib.analysis.interpolation.Field;
import wafermap.lib.analysis.interpolation.InterpolatedField;
import wafermap.lib.analysis.interpolation.InterpolationGrid;
import wafermap.lib.color.ColorMaps;
import wafermap.lib.exceptions.RenderException;
import wafermap.lib.measurements.SampleList;
import wafermap.lib.regions.ClipRegion;

/**
 * Everything a {@link WaferMapRenderer} needs to draw one wafer map.
 * 
 * @author WaferMap developers
 */
public class RenderRequest {
	
	private final InterpolationGrid grid;
	private final Field field;
	private final SampleList samples;
	private final ClipRegion clip;
	private final DisplayRange displayRange;
	private final String colorMapName;
	private final Path output;
	
	private RenderRequest(Builder builder) {
		this.grid = builder.grid;
		this.field = builder.field;
		this.samples = builder.samples;
		this.clip = builder.clip;
		this.displayRange = builder.displayRange;
		this.colorMapName = builder.colorMapName;
		this.output = builder.output;
	}
	
	/**
	 * Grid the field was evaluated on; its bounds give the extent of the image.
	 * @return
	 */
	public InterpolationGrid getGrid() {
		return grid;
	}
	
	/**
	 * Field values to display.
	 * @return
	 */
	public Field getField() {
		return field;
	}
	
	/**
	 * Original (not extended) samples, for markers and labels.
	 * @return
	 */
	public SampleList getSamples() {
		return samples;
	}
	
	/**
	 * Circle restricting the visible part of the field.
	 * @return
	 */
	public ClipRegion getClipRegion() {
		return clip;
	}
	
	/**
	 * Range of values mapped to the colormap.
	 * @return
	 */
	public DisplayRange getDisplayRange() {
		return displayRange;
	}
	
	/**
	 * Name of the colormap to use.
	 * @return
	 * @see ColorMaps#getColorMap(String)
	 */
	public String getColorMapName() {
		return colorMapName;
	}
	
	/**
	 * Destination file.
	 * @return
	 */
	public Path getOutput() {
		return output;
	}
	
	/**
	 * Create a new builder.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}
	
	/**
	 * Builder for {@link RenderRequest}.
	 */
	public static class Builder {
		
		private InterpolationGrid grid;
		private Field field;
		private SampleList samples;
		private ClipRegion clip;
		private Double vmin;
		private Double vmax;
		private DisplayRange displayRange;
		private String colorMapName = ColorMaps.DEFAULT_COLORMAP_NAME;
		private Path output;
		
		private Builder() {}
		
		/**
		 * Set the grid and field from an interpolation result.
		 * @param result
		 * @return this builder
		 */
		public Builder field(InterpolatedField result) {
			this.grid = result.getGrid();
			this.field = result.getField();
			return this;
		}
		
		/**
		 * Set the original samples to overlay.
		 * @param samples
		 * @return this builder
		 */
		public Builder samples(SampleList samples) {
			this.samples = samples;
			return this;
		}
		
		/**
		 * Set the clip region.
		 * @param clip
		 * @return this builder
		 */
		public Builder clip(ClipRegion clip) {
			this.clip = clip;
			return this;
		}
		
		/**
		 * Override the minimum display value.
		 * @param vmin minimum, or null to use the default
		 * @return this builder
		 */
		public Builder vmin(Double vmin) {
			this.vmin = vmin;
			return this;
		}
		
		/**
		 * Override the maximum display value.
		 * @param vmax maximum, or null to use the default
		 * @return this builder
		 */
		public Builder vmax(Double vmax) {
			this.vmax = vmax;
			return this;
		}
		
		/**
		 * Set the colormap name.
		 * @param name
		 * @return this builder
		 */
		public Builder colorMap(String name) {
			this.colorMapName = name;
			return this;
		}
		
		/**
		 * Set the output file.
		 * @param output
		 * @return this builder
		 */
		public Builder output(Path output) {
			this.output = output;
			return this;
		}
		
		/**
		 * Build the request.
		 * <p>
		 * Any display limit that has not been set explicitly defaults to the minimum or maximum 
		 * of the given default values (normally those of the extended samples).
		 * 
		 * @param defaultMin default minimum display value
		 * @param defaultMax default maximum display value
		 * @return
		 * @throws RenderException if the resulting display range is invalid
		 */
		public RenderRequest build(double defaultMin, double defaultMax) throws RenderException {
			Objects.requireNonNull(grid, "Grid must be set");
			Objects.requireNonNull(field, "Field must be set");
			Objects.requireNonNull(samples, "Samples must be set");
			Objects.requireNonNull(clip, "Clip region must be set");
			Objects.requireNonNull(colorMapName, "Colormap name must be set");
			Objects.requireNonNull(output, "Output must be set");
			displayRange = DisplayRange.create(
					vmin == null ? defaultMin : vmin,
					vmax == null ? defaultMax : vmax);
			return new RenderRequest(this);
		}
		
	}

}
