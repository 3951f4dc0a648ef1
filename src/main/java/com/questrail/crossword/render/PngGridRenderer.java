package com.questrail.crossword.render;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Renders a {@link LetterGrid} to a PNG image: a black canvas with one white
 * square per fillable cell and each letter centered in its square.
 */
public final class PngGridRenderer
{
    private final GridImageStyle style;

    public PngGridRenderer() {
        this(GridImageStyle.defaults());
    }

    public PngGridRenderer(GridImageStyle style) {
        this.style = Objects.requireNonNull(style, "style");
    }

    public BufferedImage render(LetterGrid grid) {
        int cell = style.cellSize();
        int border = style.cellBorder();
        int interior = style.interiorSize();

        BufferedImage image = new BufferedImage(
                grid.width() * cell, grid.height() * cell, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());

            FontMetrics metrics = null;
            for (int row = 0; row < grid.height(); row++) {
                for (int column = 0; column < grid.width(); column++) {
                    if (!grid.structure().isFillable(row, column)) {
                        continue;
                    }
                    int x = column * cell + border;
                    int y = row * cell + border;
                    g.setColor(Color.WHITE);
                    g.fillRect(x, y, interior, interior);

                    Character letter = grid.letterAt(row, column);
                    if (letter == null) {
                        continue;
                    }
                    // Fonts are only touched when there is text to draw.
                    if (metrics == null) {
                        g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING,
                                RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
                        g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, style.fontSize()));
                        metrics = g.getFontMetrics();
                    }
                    String text = String.valueOf(letter);
                    int textX = x + (interior - metrics.stringWidth(text)) / 2;
                    int textY = y + (interior - metrics.getHeight()) / 2 + metrics.getAscent();
                    g.setColor(Color.BLACK);
                    g.drawString(text, textX, textY);
                }
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    /**
     * Renders and writes the image as PNG.
     *
     * @throws IOException if the file cannot be written
     */
    public void write(LetterGrid grid, Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        BufferedImage image = render(grid);
        if (!ImageIO.write(image, "png", file.toFile())) {
            throw new IOException("No PNG writer available");
        }
    }
}
