package com.lucidchart.imgdiff.cli;

import com.lucidchart.imgdiff.ImageDiff;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line front end: loads two images, aligns and compares them, and saves the diff image.
 *
 * Exit status is 0 on success and 1 on any failure.
 * With --exit-on-diff the exit status is 1 when differences are found, and no image is written in that case.
 */
public class ImageDiffTool {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ImageDiffParameters parameters;

    public ImageDiffTool(ImageDiffParameters parameters) {
        this.parameters = parameters;
    }

    public static void main(String[] args) {
        ImageDiffParameters parameters = new ImageDiffParameters();
        if (!parameters.parse(args)) System.exit(EXIT_FAILURE);
        System.exit(new ImageDiffTool(parameters).run());
    }

    /**
     * Wraps a run with consistent log statements.
     * Absence of the standard exit log message indicates that the tool was terminated abnormally.
     *
     * @return the process exit status.
     */
    public int run() {
        LOG.info("run: entry, parameters={}", parameters);
        long startTime = System.currentTimeMillis();

        try {
            int status = compare();
            LOG.info("run: exit, processing completed in {}ms", System.currentTimeMillis() - startTime);
            return status;
        } catch (Throwable t) {
            LOG.error("run: caught exception", t);
            LOG.info("run: exit, processing failed after {}ms", System.currentTimeMillis() - startTime);
            return EXIT_FAILURE;
        }
    }

    int compare() {
        LOG.info("compare: loading images");
        BufferedImage first = ImageDiff.getImage(Paths.get(parameters.input1));
        BufferedImage second = ImageDiff.getImage(Paths.get(parameters.input2));

        LOG.info("compare: first {} ({}x{}), second {} ({}x{})",
                 parameters.input1, first.getWidth(), first.getHeight(),
                 parameters.input2, second.getWidth(), second.getHeight());

        ImageDiff diff = ImageDiff.apply(first, second, parameters.toWith());

        if (parameters.exitOnDiff && diff.hasDifferences()) {
            LOG.info("compare: differences detected, exiting with status code {}", diff.getStatus().exitCode);
            return diff.getStatus().exitCode;
        }
        if (parameters.output == null) {
            LOG.info("compare: no differences detected");
            return EXIT_OK;
        }

        Path output = Paths.get(parameters.output);
        ImageDiff.saveImage(diff.getDiffImage(), output);
        LOG.info("compare: diff image saved to {}", output);
        return EXIT_OK;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ImageDiffTool.class);
}
