package com.lucidchart.imgdiff.cli;

import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

public class ImageDiffToolTest {

    private Path workDir;
    private Path black;
    private Path white;
    private Path shifted;

    @BeforeClass
    public void createImages() throws IOException {
        workDir = Files.createTempDirectory("imgdiff-tool-test");
        black = write(solid(Color.BLACK), "black.png");
        white = write(solid(Color.WHITE), "white.png");
        shifted = write(withSquare(12, 12), "shifted.png");
        write(withSquare(10, 10), "square.png");
    }

    @AfterClass
    public void deleteImages() throws IOException {
        try (Stream<Path> paths = Files.walk(workDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        }
    }

    private static BufferedImage solid(Color color) {
        BufferedImage image = new BufferedImage(60, 60, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        g.setColor(color);
        g.fillRect(0, 0, 60, 60);
        g.dispose();
        return image;
    }

    private static BufferedImage withSquare(int x, int y) {
        BufferedImage image = solid(Color.BLACK);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(x, y, 20, 20);
        g.dispose();
        return image;
    }

    private Path write(BufferedImage image, String name) throws IOException {
        Path path = workDir.resolve(name);
        ImageIO.write(image, "png", path.toFile());
        return path;
    }

    private static int run(String... args) {
        ImageDiffParameters parameters = new ImageDiffParameters();
        Assert.assertTrue(parameters.parse(args));
        return new ImageDiffTool(parameters).run();
    }

    @Test
    public void testWritesDiffImage() throws IOException {
        Path output = workDir.resolve("diff.png");
        Assert.assertEquals(run("-i1", black.toString(), "-i2", white.toString(), "-o", output.toString()), ImageDiffTool.EXIT_OK);

        BufferedImage diff = ImageIO.read(output.toFile());
        Assert.assertEquals(diff.getWidth(), 60);
        Assert.assertEquals(diff.getRGB(0, 0), Color.RED.getRGB());
    }

    @Test
    public void testExitOnDiff() {
        Path output = workDir.resolve("unused.png");
        Assert.assertEquals(run("-i1", black.toString(), "-i2", white.toString(), "-o", output.toString(), "-e"), ImageDiffTool.EXIT_FAILURE);
        Assert.assertFalse(Files.exists(output), "No image is written when exiting on differences");
    }

    @Test
    public void testExitOnDiffStillWritesMatchingResult() throws IOException {
        Path output = workDir.resolve("match.png");
        Assert.assertEquals(run("-i1", white.toString(), "-i2", white.toString(), "-o", output.toString(), "-e"), ImageDiffTool.EXIT_OK);
        Assert.assertTrue(Files.exists(output), "The diff image is written when no differences are found");
        Assert.assertEquals(ImageIO.read(output.toFile()).getRGB(30, 30), Color.WHITE.getRGB());
    }

    @Test
    public void testExitOnDiffWithAlignedImages() {
        Path square = workDir.resolve("square.png");
        Assert.assertEquals(run("-i1", square.toString(), "-i2", shifted.toString(), "-e", "-p", "-s", "1"), ImageDiffTool.EXIT_OK);
    }

    @Test
    public void testMissingInput() {
        Assert.assertEquals(run("-i1", workDir.resolve("missing.png").toString(), "-i2", white.toString(), "-o",
                workDir.resolve("never.png").toString()), ImageDiffTool.EXIT_FAILURE);
    }

    @Test
    public void testUnsupportedOutput() {
        Assert.assertEquals(run("-i1", black.toString(), "-i2", white.toString(), "-o",
                workDir.resolve("diff.bmp").toString()), ImageDiffTool.EXIT_FAILURE);
    }
}
