/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.pilealign.panorama;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import javax.imageio.ImageIO;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.pilealign.image.ImageRaster;
import ai.kognition.pilealign.image.Utils;
import ai.kognition.pilealign.image.geometry.transform.ProjectiveTransform;
import ai.kognition.pilealign.util.CommandLineParser;

/**
 * Aligns two image files from the command line and prints the homography mapping the first onto the second.
 */
public class Main {
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_ALIGNED = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_NO_CONSENSUS = 2;

    private final PrintStream out;

    private File image1File = null;
    private File image2File = null;
    private File outFile = null;
    private AlignerConfig config = null;
    private PanoramaAligner aligner = null;

    public Main(final PrintStream out) {
        this.out = out;
    }

    public static void main(final String[] args) {
        System.exit(new Main(System.out).run(args));
    }

    public int run(final String[] args) {
        if(!commandLine(args))
            return EXIT_ERROR;

        final ImageRaster image1;
        final ImageRaster image2;
        try {
            image1 = read(image1File);
            image2 = read(image2File);
        } catch(final IOException ioe) {
            LOGGER.error("Failed to read the images", ioe);
            out.println(ioe.getMessage());
            return EXIT_ERROR;
        }

        LOGGER.info("Aligning {} onto {} using {}", image1File.getName(), image2File.getName(), config);
        final Alignment alignment = aligner.align(image1, image2);

        final String report = report(alignment);
        out.print(report);

        if(outFile != null) {
            try {
                FileUtils.writeStringToFile(outFile, report, StandardCharsets.UTF_8);
            } catch(final IOException ioe) {
                LOGGER.error("Failed to write the result to {}", outFile, ioe);
                return EXIT_ERROR;
            }
        }

        return alignment.isAligned() ? EXIT_ALIGNED : EXIT_NO_CONSENSUS;
    }

    static String report(final Alignment alignment) {
        final StringBuilder sb = new StringBuilder();
        sb.append("corners=").append(alignment.corners1.size()).append(",").append(alignment.corners2.size()).append(System.lineSeparator());
        sb.append("correspondences=").append(alignment.correspondences.size()).append(System.lineSeparator());
        sb.append("trials=").append(alignment.estimate.trials).append(System.lineSeparator());
        if(alignment.isAligned()) {
            sb.append("inliers=").append(alignment.estimate.inliers.length).append(System.lineSeparator());
            final ProjectiveTransform transform = alignment.transform();
            final double[][] m = transform.toArray();
            for(int r = 0; r < m.length; r++)
                sb.append(String.format(Locale.ROOT, "h%d=%.6f %.6f %.6f", r, m[r][0], m[r][1], m[r][2])).append(System.lineSeparator());
        } else
            sb.append("inliers=none").append(System.lineSeparator());
        return sb.toString();
    }

    private static ImageRaster read(final File file) throws IOException {
        final BufferedImage img = ImageIO.read(file);
        if(img == null)
            throw new IOException("\"" + file + "\" isn't an image format that can be read (" + FilenameUtils.getExtension(file.getName()) + ")");
        LOGGER.debug("Read {} ({}x{})", file, img.getWidth(), img.getHeight());
        return Utils.img2Raster(img);
    }

    private void usage() {
        out.println("usage: java [javaargs] " + Main.class.getName() + " -i1 image1 -i2 image2 [-config aligner.properties] [-seed n] [-out result.txt]");
    }

    private boolean commandLine(final String[] args) {
        final CommandLineParser cl = new CommandLineParser(args);
        // see if we are asking for help
        if(cl.getProperty("help") != null ||
            cl.getProperty("-help") != null) {
            usage();
            return false;
        }

        final String i1 = cl.getProperty("i1");
        final String i2 = cl.getProperty("i2");
        if(i1 == null || i2 == null) {
            usage();
            return false;
        }

        image1File = new File(i1);
        image2File = new File(i2);
        for(final File f: new File[] {image1File,image2File}) {
            if(!f.isFile()) {
                out.println("\"" + f + "\" is not a file.");
                usage();
                return false;
            }
        }

        final String tmps = cl.getProperty("out");
        if(tmps != null)
            outFile = new File(tmps);

        try {
            final String configFile = cl.getProperty("config");
            config = configFile == null ? AlignerConfig.defaults() : AlignerConfig.load(configFile);
            if(cl.hasOption("seed"))
                config = config.withSeed(cl.getLong("seed", config.ransacSeed));
            // the detector, matcher and estimator reject out of range values
            aligner = new PanoramaAligner(config);
        } catch(final IOException | IllegalArgumentException e) {
            LOGGER.error("Bad configuration", e);
            out.println(e.getMessage());
            usage();
            return false;
        }

        return true;
    }
}
