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

package wafermap.lib.io;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wafermap.lib.measurements.Sample;
import wafermap.lib.measurements.SampleList;

/**
 * Helper class for reading/writing samples as delimited text.
 * <p>
 * The first non-comment line is a header naming the columns; {@code x}, {@code y} and {@code value} 
 * (or {@code v}) are required, in any order, and other columns are ignored. 
 * Columns are separated by tabs or commas. Blank lines and lines starting with {@code #} are skipped.
 * 
 * @author WaferMap developers
 */
public class SampleIO {
	
	private static final Logger logger = LoggerFactory.getLogger(SampleIO.class);
	
	// Suppressed default constructor for non-instantiability
	private SampleIO() {
		throw new AssertionError();
	}
	
	/**
	 * Read samples from a file.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read, or does not contain valid samples
	 */
	public static SampleList readSamples(Path path) throws IOException {
		try (InputStream stream = Files.newInputStream(path)) {
			var samples = readSamples(stream);
			logger.info("Read {} samples from {}", samples.size(), path);
			return samples;
		}
	}
	
	/**
	 * Read samples from a stream. The stream is not closed.
	 * @param stream
	 * @return
	 * @throws IOException if the stream cannot be read, or does not contain valid samples
	 */
	public static SampleList readSamples(InputStream stream) throws IOException {
		var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
		List<Sample> samples = new ArrayList<>();
		int indX = -1, indY = -1, indV = -1;
		boolean hasHeader = false;
		String line;
		int lineNumber = 0;
		while ((line = reader.readLine()) != null) {
			lineNumber++;
			String trimmed = line.strip();
			if (trimmed.isEmpty() || trimmed.startsWith("#"))
				continue;
			String[] cols = splitLine(trimmed);
			if (!hasHeader) {
				List<String> names = Arrays.asList(cols).stream().map(c -> c.toLowerCase(Locale.ROOT)).collect(Collectors.toList());
				indX = names.indexOf("x");
				indY = names.indexOf("y");
				indV = names.indexOf("value");
				if (indV < 0)
					indV = names.indexOf("v");
				if (indX < 0 || indY < 0 || indV < 0)
					throw new IOException("Header must contain 'x', 'y' and 'value' columns, but found " + names);
				hasHeader = true;
				continue;
			}
			int maxInd = Math.max(indX, Math.max(indY, indV));
			if (cols.length <= maxInd)
				throw new IOException(String.format("Line %d has %d columns, but at least %d are needed", lineNumber, cols.length, maxInd + 1));
			try {
				samples.add(Sample.create(
						Double.parseDouble(cols[indX]),
						Double.parseDouble(cols[indY]),
						Double.parseDouble(cols[indV])));
			} catch (NumberFormatException e) {
				throw new IOException(String.format("Unable to parse number on line %d: %s", lineNumber, line), e);
			}
		}
		if (!hasHeader)
			throw new IOException("No header found - expected columns 'x', 'y' and 'value'");
		return SampleList.create(samples);
	}
	
	private static String[] splitLine(String line) {
		String delimiter = line.contains("\t") ? "\t" : ",";
		String[] split = line.split(delimiter, -1);
		for (int i = 0; i < split.length; i++)
			split[i] = split[i].strip();
		return split;
	}
	
	/**
	 * Write samples to a file as tab-separated values.
	 * @param path
	 * @param samples
	 * @throws IOException
	 */
	public static void writeSamples(Path path, Iterable<Sample> samples) throws IOException {
		try (OutputStream stream = Files.newOutputStream(path)) {
			writeSamples(stream, samples);
		}
		logger.info("Samples written to {}", path);
	}
	
	/**
	 * Write samples to a stream as tab-separated values. The stream is flushed, but not closed.
	 * @param stream
	 * @param samples
	 * @throws IOException
	 */
	public static void writeSamples(OutputStream stream, Iterable<Sample> samples) throws IOException {
		Writer writer = new BufferedWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8));
		writer.write("x\ty\tvalue");
		writer.write(System.lineSeparator());
		for (var s : samples) {
			writer.write(Double.toString(s.getX()));
			writer.write("\t");
			writer.write(Double.toString(s.getY()));
			writer.write("\t");
			writer.write(Double.toString(s.getValue()));
			writer.write(System.lineSeparator());
		}
		writer.flush();
	}

}
