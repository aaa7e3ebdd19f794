package com.repo.hotspot.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands a leaf path into the chain of paths that receive its contribution:
 * the leaf itself, every ancestor directory, and finally the root.
 * Relative paths end at the configured root sentinel ({@code .} by default),
 * absolute paths at the filesystem root.
 */
public class AncestorExpander {

    private final Path relativeRoot;

    public AncestorExpander(Path relativeRoot) {
        this.relativeRoot = relativeRoot;
    }

    public List<Path> expand(Path path) {
        Path current = normalize(path);
        List<Path> chain = new ArrayList<>();

        while (current != null) {
            chain.add(current);
            current = current.getParent();
        }

        // Relative chains stop one level short of the root sentinel
        Path last = chain.get(chain.size() - 1);
        if (!last.isAbsolute() && !last.equals(relativeRoot)) {
            chain.add(relativeRoot);
        }
        return chain;
    }

    /**
     * Collapses {@code ./} and {@code ..} segments; an empty result becomes the root sentinel.
     */
    public Path normalize(Path path) {
        Path normalized = path.normalize();
        if (normalized.toString().isEmpty() || normalized.equals(relativeRoot.normalize())) {
            return relativeRoot;
        }
        return normalized;
    }

    public Path relativeRoot() {
        return relativeRoot;
    }
}
