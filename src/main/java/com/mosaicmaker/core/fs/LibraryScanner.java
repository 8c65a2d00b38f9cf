package com.mosaicmaker.core.fs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the candidate tile images directly inside a library folder.
 * Results are sorted so catalogs built from the same folder get the same ids on every platform.
 */
public final class LibraryScanner {
    public static final Set<String> SUPPORTED_EXTENSIONS =
        Set.of("png", "jpg", "jpeg", "gif", "bmp", "wbmp", "svg");

    static final Comparator<Path> PATH_ORDER =
        Comparator.comparing((Path p) -> p.toAbsolutePath().toString(), String.CASE_INSENSITIVE_ORDER)
            .thenComparing(p -> p.toAbsolutePath().toString());

    public List<Path> scan(Path libraryDir) throws IOException {
        if (libraryDir == null) {
            throw new IOException("No library folder selected");
        }
        if (!Files.isDirectory(libraryDir)) {
            throw new IOException("Library folder does not exist or is not a directory: " + libraryDir);
        }
        if (!Files.isReadable(libraryDir)) {
            throw new IOException("Library folder is not readable: " + libraryDir);
        }
        try (Stream<Path> stream = Files.list(libraryDir)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(LibraryScanner::isCandidate)
                .sorted(PATH_ORDER)
                .collect(Collectors.toList());
        }
    }

    public static boolean isCandidate(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        String n = name.toString();
        if (n.startsWith(".") || n.equalsIgnoreCase("Thumbs.db")) {
            return false;
        }
        int dot = n.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        return SUPPORTED_EXTENSIONS.contains(n.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
