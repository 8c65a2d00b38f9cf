package com.mosaicmaker.session;

import com.mosaicmaker.config.MosaicConfig;
import com.mosaicmaker.core.assemble.MatchSettings;
import com.mosaicmaker.core.assemble.MosaicAssembler;
import com.mosaicmaker.core.assemble.MosaicCanvas;
import com.mosaicmaker.core.catalog.CatalogBuilder;
import com.mosaicmaker.core.fs.LibraryScanner;
import com.mosaicmaker.core.model.Catalog;
import com.mosaicmaker.core.render.DefaultImageCodec;
import com.mosaicmaker.core.render.ImageCodec;
import com.mosaicmaker.core.render.ImagePreview;
import com.mosaicmaker.core.render.PixelColorAverager;
import com.mosaicmaker.logging.AppLogger;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * State of one mosaic workflow: configuration, tile catalog, source image, intermediate image and
 * the last canvas.
 * <p>
 * Every operation that changes state holds the write lock for its whole duration, so a rebuild or
 * a matching pass always sees a consistent catalog and configuration. Reads share the read lock.
 */
public final class MosaicSession {
    private static final Logger LOGGER = AppLogger.get();
    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final CatalogBuilder catalogBuilder;
    private final ImageCodec codec;
    private final MosaicAssembler assembler;

    private MosaicConfig config;
    private Catalog catalog = Catalog.empty();
    private BufferedImage sourceImage;
    private BufferedImage intermediateImage;
    private MosaicCanvas canvas;

    public MosaicSession(MosaicConfig config, CatalogBuilder catalogBuilder, ImageCodec codec) {
        this.config = Objects.requireNonNull(config, "config");
        this.catalogBuilder = Objects.requireNonNull(catalogBuilder, "catalogBuilder");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.assembler = new MosaicAssembler();
    }

    /**
     * Session wired with the default codec, averager and scanner.
     */
    public static MosaicSession withDefaults(MosaicConfig config) {
        ImageCodec codec = new DefaultImageCodec();
        CatalogBuilder builder = new CatalogBuilder(new LibraryScanner(), new PixelColorAverager(codec), codec);
        return new MosaicSession(config, builder, codec);
    }

    /**
     * Loads the source image and derives the intermediate image from it.
     *
     * @return a preview of the full-size source image
     */
    public ImagePreview selectImage(Path imageFile) throws MosaicException {
        if (imageFile == null) {
            throw new MosaicException("No source image selected");
        }
        LOGGER.info("Selecting image " + imageFile);
        Lock w = lock.writeLock();
        w.lock();
        try {
            BufferedImage loaded;
            try {
                loaded = codec.decode(imageFile);
            } catch (IOException e) {
                throw new MosaicException("Failed to open input image " + imageFile + ": " + e.getMessage(), e);
            }
            sourceImage = loaded;
            config = config.toBuilder().inputPath(imageFile).build();
            intermediateImage = downsample(loaded);
            LOGGER.info("Selected image %s (%dx%d)".formatted(imageFile, loaded.getWidth(), loaded.getHeight()));
            return preview(sourceImage, "source image");
        } finally {
            w.unlock();
        }
    }

    /**
     * Re-derives the intermediate image using the current grid size.
     *
     * @return a preview of the intermediate image
     */
    public ImagePreview reloadImage() throws MosaicException {
        Lock w = lock.writeLock();
        w.lock();
        try {
            if (sourceImage == null) {
                throw new MosaicException("Input image does not exist; select an image first");
            }
            intermediateImage = downsample(sourceImage);
            LOGGER.info("Reloaded intermediate image at %dx%d"
                .formatted(intermediateImage.getWidth(), intermediateImage.getHeight()));
            return preview(intermediateImage, "intermediate image");
        } finally {
            w.unlock();
        }
    }

    /**
     * Remembers the library folder. The catalog is only rebuilt by {@link #reloadLibrary()}.
     */
    public void selectLibrary(Path libraryDir) {
        if (libraryDir == null) {
            return;
        }
        Lock w = lock.writeLock();
        w.lock();
        try {
            config = config.toBuilder().libraryPath(libraryDir).build();
            LOGGER.info("Selected library " + libraryDir);
        } finally {
            w.unlock();
        }
    }

    public Catalog reloadLibrary() throws MosaicException {
        return reloadLibrary(NEVER_CANCELLED);
    }

    /**
     * Replaces the catalog with one built from the configured library folder.
     * The previous catalog is kept when the rebuild fails or is cancelled.
     */
    public Catalog reloadLibrary(BooleanSupplier cancelled) throws MosaicException {
        Lock w = lock.writeLock();
        w.lock();
        try {
            Path libraryDir = config.getLibraryPath()
                .orElseThrow(() -> new MosaicException("No library folder selected"));
            try {
                catalog = catalogBuilder.build(libraryDir, config.getSubpixelSize(), cancelled);
            } catch (IOException e) {
                throw new MosaicException("Failed to read library " + libraryDir + ": " + e.getMessage(), e);
            }
            return catalog;
        } finally {
            w.unlock();
        }
    }

    public ImagePreview refresh() throws MosaicException {
        return refresh(NEVER_CANCELLED);
    }

    /**
     * Matches every intermediate pixel against the catalog and composes a new canvas.
     *
     * @return a preview of the new canvas
     */
    public ImagePreview refresh(BooleanSupplier cancelled) throws MosaicException {
        LOGGER.info("Refreshing output image...");
        Lock w = lock.writeLock();
        w.lock();
        try {
            if (intermediateImage == null) {
                throw new MosaicException("Intermediate image does not exist; select an image first");
            }
            if (!catalog.isEmpty() && catalog.thumbnailSize() != config.getSubpixelSize()) {
                throw new MosaicException("Library thumbnails are " + catalog.thumbnailSize()
                    + "px but subpixel size is " + config.getSubpixelSize() + "px; reload the library");
            }
            MatchSettings settings = new MatchSettings(
                config.getUniqueThreshold(),
                config.isPrioritizeUnique(),
                config.getSubpixelSize()
            );
            canvas = assembler.assemble(intermediateImage, catalog, settings, cancelled);
            LOGGER.info("Successfully refreshed output image (%dx%d)".formatted(canvas.width(), canvas.height()));
            return preview(canvas.image(), "output image");
        } finally {
            w.unlock();
        }
    }

    /**
     * Writes the last canvas to {@code target}; the extension picks PNG or PDF.
     */
    public void export(Path target) throws MosaicException {
        if (target == null) {
            throw new MosaicException("No export path chosen");
        }
        Lock r = lock.readLock();
        r.lock();
        try {
            if (canvas == null) {
                throw new MosaicException("Output image does not exist; refresh before exporting");
            }
            LOGGER.info("Exporting image to " + target);
            try {
                codec.export(canvas.image(), target);
            } catch (IOException | IllegalArgumentException e) {
                throw new MosaicException("Failed to save output image " + target + ": " + e.getMessage(), e);
            }
        } finally {
            r.unlock();
        }
    }

    public MosaicConfig getConfig() {
        Lock r = lock.readLock();
        r.lock();
        try {
            return config;
        } finally {
            r.unlock();
        }
    }

    /**
     * Replaces the configuration. Derived images and the catalog are left alone; call
     * {@link #reloadImage()} or {@link #reloadLibrary()} to apply new sizes.
     */
    public void setConfig(MosaicConfig newConfig) {
        Objects.requireNonNull(newConfig, "newConfig");
        Lock w = lock.writeLock();
        w.lock();
        try {
            LOGGER.info("Setting config. Old: " + config + " New: " + newConfig);
            if (!catalog.isEmpty() && catalog.thumbnailSize() != newConfig.getSubpixelSize()) {
                LOGGER.warning("Subpixel size changed to " + newConfig.getSubpixelSize()
                    + "px; the library must be reloaded before the next refresh");
            }
            config = newConfig;
        } finally {
            w.unlock();
        }
    }

    public Catalog getCatalog() {
        Lock r = lock.readLock();
        r.lock();
        try {
            return catalog;
        } finally {
            r.unlock();
        }
    }

    public Optional<MosaicCanvas> getCanvas() {
        Lock r = lock.readLock();
        r.lock();
        try {
            return Optional.ofNullable(canvas);
        } finally {
            r.unlock();
        }
    }

    public Optional<BufferedImage> getIntermediateImage() {
        Lock r = lock.readLock();
        r.lock();
        try {
            return Optional.ofNullable(intermediateImage);
        } finally {
            r.unlock();
        }
    }

    /**
     * Uses an already prepared grid-sized image as the intermediate image, bypassing the resize.
     */
    public void useIntermediateImage(BufferedImage image) {
        Objects.requireNonNull(image, "image");
        Lock w = lock.writeLock();
        w.lock();
        try {
            intermediateImage = image;
        } finally {
            w.unlock();
        }
    }

    private BufferedImage downsample(BufferedImage source) {
        return codec.resizeToFill(source, config.getIntermediateWidth(), config.getIntermediateHeight());
    }

    private static ImagePreview preview(BufferedImage image, String what) throws MosaicException {
        try {
            return ImagePreview.of(image);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not encode " + what + " preview", e);
            throw new MosaicException("Could not encode " + what + " preview: " + e.getMessage(), e);
        }
    }
}
