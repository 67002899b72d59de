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

package wafermap.lib.awt.render;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wafermap.lib.analysis.interpolation.Field;
import wafermap.lib.analysis.interpolation.InterpolationGrid;
import wafermap.lib.color.ColorMaps;
import wafermap.lib.color.ColorMaps.ColorMap;
import wafermap.lib.common.ColorTools;
import wafermap.lib.common.GeneralTools;
import wafermap.lib.exceptions.RenderException;
import wafermap.lib.geom.ImmutableDimension;
import wafermap.lib.images.writers.ImageWriterTools;
import wafermap.lib.measurements.Sample;
import wafermap.lib.regions.ClipRegion;
import wafermap.lib.render.DisplayRange;
import wafermap.lib.render.RenderRequest;
import wafermap.lib.render.WaferMapRenderer;

/**
 * {@link WaferMapRenderer} that draws with Java2D into a {@link BufferedImage} and writes it 
 * with an {@link wafermap.lib.images.writers.ImageWriter}.
 * <p>
 * The plot area is square with equal aspect, spanning the grid bounds with y increasing upwards. 
 * Pixels inside the clip circle are colored from the nearest grid cell; the sample markers and labels, 
 * circle outline and a colorbar are drawn on top.
 * 
 * @author WaferMap developers
 */
public class BufferedImageRenderer implements WaferMapRenderer {
	
	private static final Logger logger = LoggerFactory.getLogger(BufferedImageRenderer.class);
	
	/**
	 * Default image size.
	 */
	public static final ImmutableDimension DEFAULT_SIZE = ImmutableDimension.getInstance(640, 480);
	
	/**
	 * Extension appended to output paths that have none.
	 */
	public static final String DEFAULT_EXTENSION = ".png";
	
	/**
	 * Diameter of sample markers, in pixels.
	 */
	public static final double MARKER_SIZE = 5;
	
	/**
	 * Vertical offset of sample labels above their markers, in data units.
	 */
	public static final double LABEL_OFFSET = 7;
	
	private static final int MARGIN = 30;
	private static final int COLORBAR_GAP = 20;
	private static final int COLORBAR_WIDTH = 16;
	private static final int COLORBAR_LABEL_SPACE = 50;
	private static final int N_TICKS = 6;
	
	private final ImmutableDimension size;
	private final Color background = Color.WHITE;
	private final Color foreground = Color.BLACK;
	private final Font font = new Font(Font.SANS_SERIF, Font.PLAIN, 10);
	
	/**
	 * Create a renderer producing images of {@link #DEFAULT_SIZE}.
	 */
	public BufferedImageRenderer() {
		this(DEFAULT_SIZE);
	}
	
	/**
	 * Create a renderer producing images of a specified size.
	 * @param size image width and height in pixels
	 */
	public BufferedImageRenderer(ImmutableDimension size) {
		Objects.requireNonNull(size, "Image size must not be null");
		if (size.getWidth() < 1 || size.getHeight() < 1)
			throw new IllegalArgumentException("Image size must be at least 1x1, but was " + size);
		this.size = size;
	}
	
	/**
	 * Get the size of images created by this renderer.
	 * @return
	 */
	public ImmutableDimension getSize() {
		return size;
	}

	@Override
	public void render(RenderRequest request) throws RenderException {
		var img = createImage(request);
		var path = resolveOutputPath(request.getOutput());
		try {
			var parent = path.toAbsolutePath().getParent();
			if (parent != null && !Files.isDirectory(parent))
				Files.createDirectories(parent);
			ImageWriterTools.writeImage(img, path.toString());
		} catch (IOException e) {
			throw new RenderException("Unable to write wafer map to " + path, e);
		}
		logger.debug("Rendered {}x{} wafer map to {}", img.getWidth(), img.getHeight(), path);
	}
	
	/**
	 * Append {@link #DEFAULT_EXTENSION} if the path has no file extension.
	 * @param path
	 * @return
	 */
	static Path resolveOutputPath(Path path) {
		var name = path.getFileName() == null ? null : path.getFileName().toString();
		if (name == null || GeneralTools.getExtension(name).isPresent())
			return path;
		return path.resolveSibling(name + DEFAULT_EXTENSION);
	}
	
	/**
	 * Draw the wafer map into a new image without writing it.
	 * @param request
	 * @return an RGB image of {@link #getSize()}
	 * @throws RenderException if the colormap is unknown
	 */
	public BufferedImage createImage(RenderRequest request) throws RenderException {
		Objects.requireNonNull(request, "Render request must not be null");
		ColorMap colorMap;
		try {
			colorMap = ColorMaps.getColorMap(request.getColorMapName());
		} catch (IllegalArgumentException e) {
			throw new RenderException(e.getLocalizedMessage(), e);
		}
		
		int width = size.getWidth();
		int height = size.getHeight();
		var img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
		var g2d = img.createGraphics();
		try {
			g2d.setColor(background);
			g2d.fillRect(0, 0, width, height);
			
			var transform = PlotTransform.create(request.getGrid(), width, height, MARGIN, 
					COLORBAR_GAP + COLORBAR_WIDTH + COLORBAR_LABEL_SPACE);
			
			paintField(img, transform, request.getGrid(), request.getField(), 
					request.getClipRegion(), request.getDisplayRange(), colorMap);
			
			g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
			g2d.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
			g2d.setFont(font);
			
			drawOutline(g2d, transform, request.getClipRegion());
			drawSamples(g2d, transform, request);
			drawColorbar(g2d, transform, request.getDisplayRange(), colorMap);
		} finally {
			g2d.dispose();
		}
		return img;
	}
	
	private static void paintField(BufferedImage img, PlotTransform transform, InterpolationGrid grid, Field field, 
			ClipRegion clip, DisplayRange range, ColorMap colorMap) {
		var bounds = transform.getPlotBounds();
		int x0 = (int)Math.max(0, Math.floor(bounds.getMinX()));
		int y0 = (int)Math.max(0, Math.floor(bounds.getMinY()));
		int x1 = (int)Math.min(img.getWidth(), Math.ceil(bounds.getMaxX()));
		int y1 = (int)Math.min(img.getHeight(), Math.ceil(bounds.getMaxY()));
		double min = range.getMin();
		double max = range.getMax();
		for (int py = y0; py < y1; py++) {
			double y = transform.toDataY(py + 0.5);
			int row = nearestIndex(y, grid.getMinY(), grid.getMaxY(), grid.getHeight());
			for (int px = x0; px < x1; px++) {
				double x = transform.toDataX(px + 0.5);
				if (!clip.contains(x, y))
					continue;
				int col = nearestIndex(x, grid.getMinX(), grid.getMaxX(), grid.getWidth());
				if (row < 0 || col < 0)
					continue;
				img.setRGB(px, py, colorMap.getColor(field.getValue(col, row), min, max));
			}
		}
	}
	
	/**
	 * Index of the grid point nearest to a coordinate, or -1 if the coordinate lies outside the grid.
	 */
	static int nearestIndex(double value, double min, double max, int n) {
		if (value < min || value > max)
			return -1;
		if (n == 1 || max == min)
			return 0;
		int ind = (int)Math.round((value - min) / (max - min) * (n - 1));
		return GeneralTools.clipValue(ind, 0, n - 1);
	}
	
	private void drawOutline(Graphics2D g2d, PlotTransform transform, ClipRegion clip) {
		var center = transform.toPixel(clip.getCenterX(), clip.getCenterY());
		double r = clip.getRadius() * transform.getScale();
		g2d.setColor(foreground);
		g2d.setStroke(new BasicStroke(1f));
		g2d.draw(new Ellipse2D.Double(center.getX() - r, center.getY() - r, r * 2, r * 2));
	}
	
	private void drawSamples(Graphics2D g2d, PlotTransform transform, RenderRequest request) {
		FontMetrics metrics = g2d.getFontMetrics();
		g2d.setColor(foreground);
		for (Sample sample : request.getSamples()) {
			var p = transform.toPixel(sample.getX(), sample.getY());
			double r = MARKER_SIZE / 2.0;
			g2d.fill(new Ellipse2D.Double(p.getX() - r, p.getY() - r, MARKER_SIZE, MARKER_SIZE));
			
			String label = GeneralTools.formatFixed(sample.getValue(), 2);
			var anchor = transform.toPixel(sample.getX(), sample.getY() + LABEL_OFFSET);
			float x = (float)(anchor.getX() - metrics.stringWidth(label) / 2.0);
			float y = (float)(anchor.getY() - metrics.getDescent());
			g2d.drawString(label, x, y);
		}
	}
	
	private void drawColorbar(Graphics2D g2d, PlotTransform transform, DisplayRange range, ColorMap colorMap) {
		var bounds = transform.getPlotBounds();
		int x = (int)Math.round(bounds.getMaxX()) + COLORBAR_GAP;
		int top = (int)Math.round(bounds.getMinY());
		int barHeight = Math.max(1, (int)Math.round(bounds.getHeight()));
		double min = range.getMin();
		double max = range.getMax();
		
		for (int i = 0; i < barHeight; i++) {
			double value = barHeight == 1 ? min : max - (max - min) * i / (barHeight - 1);
			int rgb = colorMap.getColor(value, min, max);
			g2d.setColor(new Color(ColorTools.red(rgb), ColorTools.green(rgb), ColorTools.blue(rgb)));
			g2d.fillRect(x, top + i, COLORBAR_WIDTH, 1);
		}
		g2d.setColor(foreground);
		g2d.drawRect(x, top, COLORBAR_WIDTH, barHeight);
		
		FontMetrics metrics = g2d.getFontMetrics();
		int nTicks = max > min ? N_TICKS : 1;
		for (int i = 0; i < nTicks; i++) {
			double value = nTicks == 1 ? min : min + (max - min) * i / (nTicks - 1);
			int y = nTicks == 1 ? top + barHeight : top + barHeight - (int)Math.round((double)barHeight * i / (nTicks - 1));
			g2d.drawLine(x + COLORBAR_WIDTH, y, x + COLORBAR_WIDTH + 3, y);
			String label = GeneralTools.formatFixed(value, 2);
			g2d.drawString(label, x + COLORBAR_WIDTH + 5, y + (metrics.getAscent() - metrics.getDescent()) / 2);
		}
	}
	
	
	/**
	 * Mapping between data coordinates and pixel coordinates, with equal aspect and y increasing upwards.
	 */
	static class PlotTransform {
		
		private final double minX;
		private final double maxY;
		private final double scale;
		private final double offsetX;
		private final double offsetY;
		private final Rectangle2D plotBounds;
		
		private PlotTransform(double minX, double maxY, double scale, double offsetX, double offsetY, Rectangle2D plotBounds) {
			this.minX = minX;
			this.maxY = maxY;
			this.scale = scale;
			this.offsetX = offsetX;
			this.offsetY = offsetY;
			this.plotBounds = plotBounds;
		}
		
		static PlotTransform create(InterpolationGrid grid, int width, int height, int margin, int rightSpace) {
			double side = Math.max(1, Math.min(height - 2.0 * margin, width - 2.0 * margin - rightSpace));
			double dataWidth = grid.getMaxX() - grid.getMinX();
			double dataHeight = grid.getMaxY() - grid.getMinY();
			double extent = Math.max(dataWidth, dataHeight);
			double scale = extent > 0 ? side / extent : 1;
			// Center the data within the square plot area
			double offsetX = margin + (side - dataWidth * scale) / 2.0;
			double offsetY = margin + (side - dataHeight * scale) / 2.0;
			var bounds = new Rectangle2D.Double(offsetX, offsetY, dataWidth * scale, dataHeight * scale);
			return new PlotTransform(grid.getMinX(), grid.getMaxY(), scale, offsetX, offsetY, bounds);
		}
		
		double getScale() {
			return scale;
		}
		
		Rectangle2D getPlotBounds() {
			return plotBounds;
		}
		
		Point2D toPixel(double x, double y) {
			return new Point2D.Double(offsetX + (x - minX) * scale, offsetY + (maxY - y) * scale);
		}
		
		double toDataX(double px) {
			return minX + (px - offsetX) / scale;
		}
		
		double toDataY(double py) {
			return maxY - (py - offsetY) / scale;
		}
		
	}

}
