package examples;

import java.awt.image.BufferedImage;
import java.awt.image.RenderedImage;
import java.io.File;
import java.io.IOException;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.imageio.ImageIO;

import org.digitalmodular.bicubicresizer.ProgressEvent;
import org.digitalmodular.bicubicresizer.ProgressListener;
import org.digitalmodular.bicubicresizer.resize.BicubicResampler;
import org.digitalmodular.bicubicresizer.util.SizeInt;
import static java.util.logging.Level.FINE;

/**
 * Usage: {@code ResizeImageMain <input> <output> <width> <height>}
 * <p>
 * The output format follows the extension of the output file, for example {@code .png} or {@code .jpg}.
 *
 * @author Mark Jeronimus
 */
// Created 2026-10-12
// Changed 2026-10-19 Output format from the file extension
public class ResizeImageMain {
	public static void main(String... args) throws IOException, InterruptedException {
		if (args.length != 4) {
			System.err.println("Usage: ResizeImageMain <input> <output> <width> <height>");
			System.exit(1);
		}

		setLoggerLevel(FINE);

		BufferedImage image = load(args[0]);

		BufferedImage resized = resize(image, new SizeInt(Integer.parseInt(args[2]), Integer.parseInt(args[3])));

		save(resized, args[1]);
	}

	private static void setLoggerLevel(Level level) {
		System.setProperty("java.util.logging.SimpleFormatter.format",
		                   "[%1$tY%1$tm%1$tdT%1$tH%1$tM%1$tS.%1$tL %4$s] %2$s: %5$s%6$s%n");

		Logger.getGlobal().setLevel(level);
		Logger.getGlobal().getParent().removeHandler(Logger.getGlobal().getParent().getHandlers()[0]);
		Logger.getGlobal().getParent().addHandler(new ConsoleHandler());
		Logger.getGlobal().getParent().getHandlers()[0].setLevel(Level.ALL);
	}

	private static BufferedImage load(String filename) throws IOException {
		File file = new File(filename);

		Logger.getGlobal().info("Loading: " + file.getCanonicalPath());

		BufferedImage image = ImageIO.read(file);
		if (image == null)
			throw new IOException("Unsupported image format: " + file);

		return image;
	}

	private static BufferedImage resize(BufferedImage image, SizeInt newSize) throws InterruptedException {
		BicubicResampler resampler = new BicubicResampler();
		resampler.setOutputSize(newSize);
		resampler.addProgressListener(new ProgressListener() {
			@Override
			public void progressUpdated(ProgressEvent e) {
				if (!e.isIndeterminate())
					Logger.getGlobal().finer("Progress: " + e.getProgress() + '/' + e.getTotal());
			}

			@Override
			public void progressCompleted(ProgressEvent e) {
				Logger.getGlobal().fine("Completed " + e.getTotal() + " pixels");
			}
		});

		Logger.getGlobal().info("Resizing " + new SizeInt(image) + " to " + newSize);

		return resampler.resize(image);
	}

	static void save(RenderedImage resized, String filename) throws IOException {
		File   file       = new File(filename);
		String formatName = formatName(filename);

		Logger.getGlobal().info("Writing: " + file.getCanonicalPath());

		if (!ImageIO.write(resized, formatName, file))
			throw new IOException("No " + formatName + " writer for this image: " + file);
	}

	static String formatName(String filename) throws IOException {
		String name = new File(filename).getName();
		int    dot  = name.lastIndexOf('.');
		if (dot < 0 || dot == name.length() - 1)
			throw new IOException("Output file has no extension: " + filename);

		return name.substring(dot + 1).toLowerCase(Locale.ROOT);
	}
}
