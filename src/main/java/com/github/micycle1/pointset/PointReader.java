package com.github.micycle1.pointset;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads whitespace-separated {@code x y} coordinate pairs.
 * <p>
 * Reading stops at the first token that is not a finite number; everything from there
 * on is ignored. An {@code x} without a following {@code y} is dropped.
 *
 * @author Michael Carleton
 */
public final class PointReader {

	private static final Logger log = LoggerFactory.getLogger(PointReader.class);

	private PointReader() {
	}

	public static List<Point> read(Path path) throws IOException {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			List<Point> points = read(reader);
			log.debug("Read {} points from {}", points.size(), path);
			return points;
		}
	}

	/**
	 * Reads points until the end of the stream or the first token that is not a
	 * finite number. The reader is not closed.
	 */
	public static List<Point> read(Reader reader) throws IOException {
		List<Point> points = new ArrayList<>();
		Scanner scanner = new Scanner(reader).useLocale(Locale.ROOT);
		String rejected = null;
		double x = 0;
		boolean haveX = false;
		while (scanner.hasNext()) {
			if (!scanner.hasNextDouble()) {
				rejected = scanner.next();
				break;
			}
			double value = scanner.nextDouble();
			if (!Double.isFinite(value)) {
				rejected = Double.toString(value);
				break;
			}
			if (haveX) {
				points.add(new Point(x, value));
			} else {
				x = value;
			}
			haveX = !haveX;
		}
		IOException failure = scanner.ioException();
		if (failure != null) {
			throw failure;
		}
		if (rejected != null) {
			log.warn("Stopped reading points at unparsable token '{}' after {} points", rejected, points.size());
		}
		return points;
	}
}
