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

package wafermap;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import wafermap.lib.WaferMapParameters;
import wafermap.lib.WaferMaps;
import wafermap.lib.analysis.interpolation.RadialBasisFunction;
import wafermap.lib.awt.render.BufferedImageRenderer;
import wafermap.lib.common.GeneralTools;
import wafermap.lib.geom.ImmutableDimension;
import wafermap.lib.io.SampleIO;
import wafermap.logging.LogManager;

/**
 * Command line launcher: reads samples from a delimited text file and writes a wafer map image.
 * 
 * @author WaferMap developers
 *
 */
@Command(name = "wafermap", 
	description = {"Render a contour map of values measured at points on a circular wafer."},
	footer = {"", "Copyright(c) WaferMap developers (2024)"},
	mixinStandardHelpOptions = true, versionProvider = WaferMap.VersionProvider.class)
public class WaferMap implements Callable<Integer> {
	
	private static final Logger logger = LoggerFactory.getLogger(WaferMap.class);
	
	@Parameters(index = "0", paramLabel = "samples", 
			description = {"Delimited text file with a header row containing x, y and value columns."})
	private Path samplesFile;
	
	@Option(names = {"-o", "--output"}, paramLabel = "name", 
			description = {"Output image file name (default = samples file name with .png extension).", 
					"Supported extensions: png, jpg, jpeg. If there is no extension, .png is appended."})
	private String output;
	
	@Option(names = {"-d", "--directory"}, paramLabel = "dir", description = "Directory for the output image.")
	private String directory;
	
	@Option(names = {"-s", "--wafer-size"}, paramLabel = "size", description = "Wafer size (diameter, default = 300).")
	private Double waferSize;
	
	@Option(names = {"-r", "--resolution"}, paramLabel = "WxH", description = "Interpolation grid resolution (default = 100x100).")
	private String resolution;
	
	@Option(names = {"--vmin"}, description = "Minimum display value (default = minimum value including boundary points).")
	private Double vmin;
	
	@Option(names = {"--vmax"}, description = "Maximum display value (default = maximum value including boundary points).")
	private Double vmax;
	
	@Option(names = {"-c", "--colormap"}, paramLabel = "name", description = "Colormap name (default = Rainbow (reversed)).")
	private String colorMap;
	
	@Option(names = {"-k", "--kernel"}, paramLabel = "kernel", 
			description = {"Radial basis function (default = thin-plate).", 
					"Options: multiquadric, inverse-multiquadric, gaussian, linear, cubic, quintic, thin-plate"})
	private String kernel;
	
	@Option(names = {"--smooth"}, description = "Smoothing applied to the interpolation (default = 0, exact interpolation).")
	private Double smooth;
	
	@Option(names = {"--config"}, paramLabel = "json", description = "JSON file containing parameters; command line options take precedence.")
	private Path config;
	
	@Option(names = {"--export-extended"}, paramLabel = "file", 
			description = "Write the samples, including synthesized boundary points, to a tab-delimited file.")
	private Path exportExtended;
	
	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"} )
	private LogManager.LogLevel logLevel = LogManager.LogLevel.INFO;
	
	
	/**
	 * Main method to launch WaferMap from the command line.
	 * @param args
	 */
	public static void main(String[] args) {
		System.exit(run(args));
	}
	
	/**
	 * Parse the arguments and run, returning the exit code rather than exiting.
	 * @param args
	 * @return 0 on success, non-zero on failure
	 */
	public static int run(String... args) {
		CommandLine cmd = new CommandLine(new WaferMap());
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		cmd.setExitCodeExceptionMapper(t -> 1);
		return cmd.execute(args);
	}
	
	@Override
	public Integer call() {
		if (logLevel != null)
			LogManager.setRootLogLevel(logLevel);
		try {
			var params = buildParameters();
			logger.debug("Parameters: {}", params);
			
			var samples = SampleIO.readSamples(samplesFile);
			var outputPath = params.resolveOutput(getOutputName());
			var renderer = new BufferedImageRenderer(params.getImageSize());
			var result = WaferMaps.drawMapContour(samples, params, renderer, outputPath);
			
			if (exportExtended != null) {
				SampleIO.writeSamples(exportExtended, result.getSamples().getSamples());
				logger.info("Extended samples written to {}", exportExtended);
			}
			return 0;
		} catch (Exception e) {
			logger.error(e.getLocalizedMessage(), e);
			return 1;
		}
	}
	
	WaferMapParameters buildParameters() throws IOException {
		var params = config == null ? WaferMapParameters.getDefault() : WaferMapParameters.read(config);
		var builder = params.toBuilder();
		if (waferSize != null)
			builder.waferSize(waferSize);
		if (resolution != null) {
			var dim = ImmutableDimension.parse(resolution);
			builder.resolution(dim.getWidth(), dim.getHeight());
		}
		if (vmin != null)
			builder.vmin(vmin);
		if (vmax != null)
			builder.vmax(vmax);
		if (colorMap != null)
			builder.colorMap(colorMap);
		if (kernel != null)
			builder.function(RadialBasisFunction.fromString(kernel));
		if (smooth != null)
			builder.smooth(smooth);
		if (directory != null)
			builder.outputDirectory(directory);
		return builder.build();
	}
	
	String getOutputName() {
		if (output != null && !output.isBlank())
			return output;
		var name = samplesFile.getFileName().toString();
		return GeneralTools.getNameWithoutExtension(name) + BufferedImageRenderer.DEFAULT_EXTENSION;
	}
	
	
	static class VersionProvider implements IVersionProvider {

		@Override
		public String[] getVersion() throws Exception {
			var version = WaferMap.class.getPackage().getImplementationVersion();
			if (version == null)
				return new String[] {"Unknown WaferMap version!"};
			if (!version.startsWith("v"))
				version = "v" + version;
			return new String[] {"WaferMap " + version};
		}
		
	}

}
