/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.thermalguard.heatmap;

import static com.amazon.thermalguard.CommonUtils.checkArgument;
import static com.amazon.thermalguard.CommonUtils.checkNotNull;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import javax.imageio.ImageIO;

import lombok.extern.slf4j.Slf4j;

import com.amazon.thermalguard.model.SensorReading;

/**
 * Renders the IDW temperature grid as a PNG and returns it Base64 encoded.
 * Every grid cell becomes a square of pixels colored by the color map; the
 * sensors are drawn on top as cyan dots with a black outline. The lowest z is
 * at the bottom of the field. The finished figure frames the field with a
 * title, the extent of both axes and a colorbar in degrees Celsius.
 */
@Slf4j
public class PngHeatmapRenderer implements IHeatmapRenderer {

    public static final int DEFAULT_CELL_SIZE = 5;

    public static final int MARKER_SIZE = 7;

    public static final String TITLE = "Thermal Map";

    public static final String UNIT = "°C";

    public static final int MARGIN_LEFT = 48;

    public static final int MARGIN_TOP = 30;

    public static final int MARGIN_BOTTOM = 40;

    public static final int COLORBAR_GAP = 12;

    public static final int COLORBAR_WIDTH = 16;

    /**
     * room right of the field for the colorbar and its labels
     */
    public static final int MARGIN_RIGHT = COLORBAR_GAP + COLORBAR_WIDTH + 48;

    private final IdwInterpolator interpolator;

    private final ColorMap colorMap;

    private final int cellSize;

    public PngHeatmapRenderer(IdwInterpolator interpolator, ColorMap colorMap, int cellSize) {
        this.interpolator = checkNotNull(interpolator, "interpolator must not be null");
        this.colorMap = checkNotNull(colorMap, "color map must not be null");
        checkArgument(cellSize > 0, "cell size should be positive");
        this.cellSize = cellSize;
    }

    public PngHeatmapRenderer() {
        this(new IdwInterpolator(), ColorMap.INFERNO, DEFAULT_CELL_SIZE);
    }

    @Override
    public Optional<String> render(List<SensorReading> sensors) {
        checkNotNull(sensors, "sensors must not be null");
        if (sensors.isEmpty()) {
            return Optional.empty();
        }
        HeatmapGrid grid = interpolator.grid(sensors);
        BufferedImage image = compose(grid, draw(grid, sensors));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            checkArgument(ImageIO.write(image, "png", out), "no PNG writer available");
        } catch (IOException e) {
            throw new UncheckedIOException("failed to encode heatmap", e);
        }
        log.debug("rendered {}x{} heatmap for {} sensors", image.getWidth(), image.getHeight(), sensors.size());
        return Optional.of(Base64.getEncoder().encodeToString(out.toByteArray()));
    }

    /**
     * @param grid    interpolated temperatures
     * @param sensors sensors to mark
     * @return the field, one cellSize square per grid cell
     */
    public BufferedImage draw(HeatmapGrid grid, List<SensorReading> sensors) {
        int width = grid.getColumns() * cellSize;
        int height = grid.getRows() * cellSize;
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        try {
            double min = grid.getMinValue();
            double max = grid.getMaxValue();
            for (int i = 0; i < grid.getRows(); i++) {
                int top = height - (i + 1) * cellSize;
                for (int j = 0; j < grid.getColumns(); j++) {
                    graphics.setColor(colorMap.getColor(grid.getValue(i, j), min, max));
                    graphics.fillRect(j * cellSize, top, cellSize, cellSize);
                }
            }

            graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            graphics.setStroke(new BasicStroke(1f));
            double xSpan = grid.getX(grid.getColumns() - 1) - grid.getX(0);
            double zSpan = grid.getZ(grid.getRows() - 1) - grid.getZ(0);
            for (SensorReading sensor : sensors) {
                int px = (int) Math.round((sensor.getX() - grid.getX(0)) / xSpan * (width - 1));
                int py = (int) Math.round((1 - (sensor.getZ() - grid.getZ(0)) / zSpan) * (height - 1));
                graphics.setColor(Color.CYAN);
                graphics.fillOval(px - MARKER_SIZE / 2, py - MARKER_SIZE / 2, MARKER_SIZE, MARKER_SIZE);
                graphics.setColor(Color.BLACK);
                graphics.drawOval(px - MARKER_SIZE / 2, py - MARKER_SIZE / 2, MARKER_SIZE, MARKER_SIZE);
            }
        } finally {
            graphics.dispose();
        }
        return image;
    }

    /**
     * Frames a drawn field: title above, axis extents and names along the left
     * and bottom edges, and a colorbar from the grid minimum (bottom) to maximum
     * (top) on the right.
     *
     * @param grid  the grid the field was drawn from
     * @param field the output of {@link #draw}
     * @return the figure
     */
    public BufferedImage compose(HeatmapGrid grid, BufferedImage field) {
        int fieldWidth = field.getWidth();
        int fieldHeight = field.getHeight();
        int width = MARGIN_LEFT + fieldWidth + MARGIN_RIGHT;
        int height = MARGIN_TOP + fieldHeight + MARGIN_BOTTOM;
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, width, height);
            graphics.drawImage(field, MARGIN_LEFT, MARGIN_TOP, null);
            graphics.setColor(Color.BLACK);
            graphics.drawRect(MARGIN_LEFT - 1, MARGIN_TOP - 1, fieldWidth + 1, fieldHeight + 1);
            drawColorBar(graphics, MARGIN_LEFT + fieldWidth + COLORBAR_GAP, MARGIN_TOP, fieldHeight,
                    grid.getMinValue(), grid.getMaxValue());

            graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            FontMetrics metrics = graphics.getFontMetrics();
            int ascent = metrics.getAscent();
            int bottom = MARGIN_TOP + fieldHeight;
            graphics.drawString(TITLE, MARGIN_LEFT + (fieldWidth - metrics.stringWidth(TITLE)) / 2, MARGIN_TOP - 10);

            String xLow = format(grid.getX(0));
            String xHigh = format(grid.getX(grid.getColumns() - 1));
            graphics.drawString(xLow, MARGIN_LEFT, bottom + ascent + 4);
            graphics.drawString(xHigh, MARGIN_LEFT + fieldWidth - metrics.stringWidth(xHigh), bottom + ascent + 4);
            graphics.drawString("X", MARGIN_LEFT + (fieldWidth - metrics.stringWidth("X")) / 2,
                    bottom + 2 * ascent + 8);

            String zLow = format(grid.getZ(0));
            String zHigh = format(grid.getZ(grid.getRows() - 1));
            graphics.drawString(zLow, MARGIN_LEFT - 4 - metrics.stringWidth(zLow), bottom);
            graphics.drawString(zHigh, MARGIN_LEFT - 4 - metrics.stringWidth(zHigh), MARGIN_TOP + ascent);
            graphics.drawString("Z", 4, MARGIN_TOP + (fieldHeight + ascent) / 2);
        } finally {
            graphics.dispose();
        }
        return image;
    }

    private void drawColorBar(Graphics2D graphics, int left, int top, int height, double min, double max) {
        for (int y = 0; y < height; y++) {
            double fraction = (height == 1) ? 0 : 1.0 - (double) y / (height - 1);
            graphics.setColor(colorMap.getColor(fraction));
            graphics.fillRect(left, top + y, COLORBAR_WIDTH, 1);
        }
        graphics.setColor(Color.BLACK);
        graphics.drawRect(left - 1, top - 1, COLORBAR_WIDTH + 1, height + 1);

        FontMetrics metrics = graphics.getFontMetrics();
        int labelLeft = left + COLORBAR_WIDTH + 4;
        int halfAscent = metrics.getAscent() / 2;
        graphics.drawString(format(max), labelLeft, top + halfAscent);
        graphics.drawString(format((min + max) / 2), labelLeft, top + height / 2 + halfAscent);
        graphics.drawString(format(min), labelLeft, top + height + halfAscent);
        graphics.drawString(UNIT, left, top - 4);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
