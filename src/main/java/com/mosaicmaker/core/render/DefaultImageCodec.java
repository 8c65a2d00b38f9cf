package com.mosaicmaker.core.render;

import org.apache.batik.transcoder.TranscoderException;
import org.apache.batik.transcoder.TranscoderInput;
import org.apache.batik.transcoder.TranscoderOutput;
import org.apache.batik.transcoder.image.ImageTranscoder;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * {@link ImageCodec} backed by ImageIO for raster formats, Batik for SVG input and PDFBox for PDF export.
 */
public final class DefaultImageCodec implements ImageCodec {

    @Override
    public BufferedImage decode(Path file) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            throw new IOException("Not a readable image file: " + file);
        }
        if (extensionOf(file).equals("svg")) {
            return renderSvg(file);
        }
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("Unsupported image format: " + file);
        }
        return image;
    }

    @Override
    public BufferedImage resizeToFill(BufferedImage source, int width, int height) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Target size must be at least 1x1, got " + width + "x" + height);
        }
        double scale = Math.max((double) width / source.getWidth(), (double) height / source.getHeight());
        int scaledWidth = Math.max(width, (int) Math.ceil(source.getWidth() * scale));
        int scaledHeight = Math.max(height, (int) Math.ceil(source.getHeight() * scale));

        BufferedImage scaled = downscaleStepwise(toArgb(source), scaledWidth, scaledHeight);

        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = out.createGraphics();
        try {
            setupHighQualityRendering(g);
            int dx = (width - scaledWidth) / 2;
            int dy = (height - scaledHeight) / 2;
            g.drawImage(scaled, dx, dy, scaledWidth, scaledHeight, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    @Override
    public void export(BufferedImage image, Path target) throws IOException {
        String extension = extensionOf(target);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        switch (extension) {
            case "png" -> {
                if (!ImageIO.write(image, "png", target.toFile())) {
                    throw new IOException("No PNG writer available for " + target);
                }
            }
            case "pdf" -> writePdf(image, target);
            default -> throw new IllegalArgumentException("Unsupported export format '" + extension
                + "' for " + target + " (use .png or .pdf)");
        }
    }

    static String extensionOf(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String s = name.toString();
        int dot = s.lastIndexOf('.');
        return dot < 0 ? "" : s.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static void writePdf(BufferedImage image, Path target) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(new PDRectangle(image.getWidth(), image.getHeight()));
            document.addPage(page);
            PDImageXObject pdImage = LosslessFactory.createFromImage(document, image);
            try (PDPageContentStream cs = new PDPageContentStream(document, page)) {
                cs.drawImage(pdImage, 0, 0, image.getWidth(), image.getHeight());
            }
            document.save(target.toFile());
        }
    }

    /**
     * Halves the image until it is within a factor of two of the target. A single bicubic pass
     * over a large reduction drops most source pixels.
     */
    private static BufferedImage downscaleStepwise(BufferedImage source, int targetWidth, int targetHeight) {
        BufferedImage current = source;
        int w = current.getWidth();
        int h = current.getHeight();
        while (w / 2 >= targetWidth && h / 2 >= targetHeight) {
            w /= 2;
            h /= 2;
            BufferedImage step = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
            Graphics2D g = step.createGraphics();
            try {
                setupHighQualityRendering(g);
                g.drawImage(current, 0, 0, w, h, null);
            } finally {
                g.dispose();
            }
            current = step;
        }
        return current;
    }

    private static BufferedImage toArgb(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_INT_ARGB) {
            return source;
        }
        BufferedImage copy = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return copy;
    }

    private static void setupHighQualityRendering(Graphics2D g2d) {
        g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
    }

    private static BufferedImage renderSvg(Path file) throws IOException {
        BufferedImageTranscoder transcoder = new BufferedImageTranscoder();
        transcoder.addTranscodingHint(ImageTranscoder.KEY_BACKGROUND_COLOR, new Color(0, 0, 0, 0));
        try {
            transcoder.transcode(new TranscoderInput(file.toUri().toString()), (TranscoderOutput) null);
        } catch (TranscoderException e) {
            throw new IOException("Failed to render SVG " + file, e);
        }
        return transcoder.getBufferedImage();
    }

    private static final class BufferedImageTranscoder extends ImageTranscoder {
        private BufferedImage image;

        @Override
        public BufferedImage createImage(int w, int h) {
            return new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        }

        @Override
        public void writeImage(BufferedImage img, TranscoderOutput out) {
            this.image = img;
        }

        BufferedImage getBufferedImage() throws IOException {
            if (image == null) {
                throw new IOException("No image produced during SVG transcoding");
            }
            return image;
        }
    }
}
