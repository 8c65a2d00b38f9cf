package com.mosaicmaker.core.render;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;

/**
 * PNG snapshot of an image, Base64 encoded, for callers that display results inline.
 */
public record ImagePreview(int width, int height, String base64Png) {

    public static ImagePreview of(BufferedImage image) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", buffer)) {
            throw new IOException("No PNG writer available");
        }
        return new ImagePreview(image.getWidth(), image.getHeight(),
            Base64.getEncoder().encodeToString(buffer.toByteArray()));
    }

    public byte[] pngBytes() {
        return Base64.getDecoder().decode(base64Png);
    }

    /**
     * @return {@code "WWWWWWWWWxHHHHHHHHH <base64>"} with both sizes zero-padded to nine digits
     */
    public String toWireString() {
        return "%09dx%09d %s".formatted(width, height, base64Png);
    }
}
