package com.repo.hotspot.core;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a path is a module (source file) or a package (directory)
 * from the extension of its last component. Never touches the filesystem.
 */
public class PathClassifier {

    private final Set<String> sourceExtensions;

    /**
     * @param sourceExtensions extensions with the leading dot, e.g. ".py"
     */
    public PathClassifier(Set<String> sourceExtensions) {
        this.sourceExtensions = sourceExtensions.stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public PathKind classify(Path path) {
        return isSourceFile(path) ? PathKind.MODULE : PathKind.PACKAGE;
    }

    public boolean isSourceFile(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String ext = extensionOf(fileName.toString());
        return !ext.isEmpty() && sourceExtensions.contains(ext);
    }

    public Set<String> sourceExtensions() {
        return sourceExtensions;
    }

    static String extensionOf(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
}
