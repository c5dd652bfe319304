package assetguard.ui;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.geom.Line2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Collects freehand strokes and turns them into a PNG data URI for a borrow or return record.
 * <p>
 * A signature exists once any stroke has at least one drawn segment. Until then {@link #save()}
 * returns empty. Not thread-safe; drive it from one input thread.
 */
public class SignaturePad {

    public static final int DEFAULT_WIDTH = 300;
    public static final int DEFAULT_HEIGHT = 200;
    private static final String DATA_URI_PREFIX = "data:image/png;base64,";

    private final int width;
    private final int height;
    private final List<List<Point>> strokes = new ArrayList<>();
    private List<Point> currentStroke;
    private boolean hasSignature;
    private Runnable clearListener;

    /**
     * @param containerWidth width of the hosting container when the pad is shown; zero or less
     *                       means unknown and falls back to {@link #DEFAULT_WIDTH}
     */
    public SignaturePad(int containerWidth, int height) {
        if (height <= 0) {
            throw new IllegalArgumentException("Signature pad height must be positive: " + height);
        }
        this.width = containerWidth > 0 ? containerWidth : DEFAULT_WIDTH;
        this.height = height;
    }

    public SignaturePad(int containerWidth) {
        this(containerWidth, DEFAULT_HEIGHT);
    }

    public void setOnClear(Runnable clearListener) {
        this.clearListener = clearListener;
    }

    public void beginStroke(double x, double y) {
        currentStroke = new ArrayList<>();
        currentStroke.add(new Point(x, y));
        strokes.add(currentStroke);
    }

    public void extendStroke(double x, double y) {
        if (currentStroke == null) {
            return;
        }
        currentStroke.add(new Point(x, y));
        hasSignature = true;
    }

    public void endStroke() {
        currentStroke = null;
    }

    public void clear() {
        strokes.clear();
        currentStroke = null;
        hasSignature = false;
        if (clearListener != null) {
            clearListener.run();
        }
    }

    public boolean isDrawing() {
        return currentStroke != null;
    }

    public boolean canSave() {
        return hasSignature;
    }

    /**
     * @return a {@code data:image/png;base64,...} URI of the pad, or empty if nothing was drawn
     */
    public Optional<String> save() {
        if (!hasSignature) {
            return Optional.empty();
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(Color.BLACK);
            g.setStroke(new BasicStroke(2f, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
            for (List<Point> stroke : strokes) {
                for (int i = 1; i < stroke.size(); i++) {
                    Point from = stroke.get(i - 1);
                    Point to = stroke.get(i);
                    g.draw(new Line2D.Double(from.x(), from.y(), to.x(), to.y()));
                }
            }
        } finally {
            g.dispose();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not encode signature image", e);
        }
        return Optional.of(DATA_URI_PREFIX + Base64.getEncoder().encodeToString(out.toByteArray()));
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    private record Point(double x, double y) {
    }
}
