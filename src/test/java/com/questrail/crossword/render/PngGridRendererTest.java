package com.questrail.crossword.render;

import com.questrail.crossword.api.Assignment;
import com.questrail.crossword.structure.TestPuzzles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PngGridRendererTest {

    private static final int BLACK = Color.BLACK.getRGB();
    private static final int WHITE = Color.WHITE.getRGB();

    private final GridImageStyle style = new GridImageStyle(10, 1, 8);
    private final LetterGrid grid = LetterGrid.of(TestPuzzles.frame(), Assignment.empty());

    @Test
    void imageHasOneSquarePerCell() {
        BufferedImage image = new PngGridRenderer(style).render(grid);

        assertEquals(50, image.getWidth());
        assertEquals(50, image.getHeight());
    }

    @Test
    void fillableCellsAreWhiteInsideABlackBorder() {
        BufferedImage image = new PngGridRenderer(style).render(grid);

        // Cell (0, 1) is fillable, cell (0, 0) is blocked.
        assertEquals(WHITE, image.getRGB(15, 5));
        assertEquals(BLACK, image.getRGB(10, 0));
        assertEquals(BLACK, image.getRGB(5, 5));
    }

    @Test
    void writesAReadablePng(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("out.png");

        new PngGridRenderer(style).write(grid, file);

        assertTrue(Files.size(file) > 0);
        BufferedImage read = ImageIO.read(file.toFile());
        assertEquals(50, read.getWidth());
        assertEquals(WHITE, read.getRGB(15, 5));
    }

    @Test
    void borderMustLeaveRoomForTheCell() {
        assertThrows(IllegalArgumentException.class, () -> new GridImageStyle(10, 5, 8));
        assertEquals(96, GridImageStyle.defaults().interiorSize());
    }
}
