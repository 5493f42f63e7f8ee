package io.github.calltable.files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Recursively finds {@code .json} and {@code .jsonl} files under an input root.
 *
 * <p>Results are ordered by path components, so {@code a/x.json} sorts before
 * {@code a-b/x.json}. Subdirectories that cannot be read are logged and skipped.</p>
 */
public class FileDiscoverer {

    private static final Logger LOG = LoggerFactory.getLogger(FileDiscoverer.class);

    static final Comparator<Path> BY_COMPONENTS = (left, right) -> {
        Iterator<Path> l = left.iterator();
        Iterator<Path> r = right.iterator();
        while (l.hasNext() && r.hasNext()) {
            int cmp = l.next().toString().compareTo(r.next().toString());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Boolean.compare(l.hasNext(), r.hasNext());
    };

    /**
     * Lists the input files under {@code root}.
     *
     * @param root the directory to scan
     * @return matching regular files in deterministic order
     * @throws InputDirectoryNotFoundException if {@code root} is missing or not a directory
     * @throws IOException if the root itself cannot be walked
     */
    public List<Path> discover(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new InputDirectoryNotFoundException(root);
        }

        InputFileCollector collector = new InputFileCollector(root);
        Files.walkFileTree(root, collector);

        List<Path> found = collector.getFound();
        found.sort(BY_COMPONENTS);
        LOG.debug("Discovered {} input files under {}", found.size(), root);
        return found;
    }

    private static class InputFileCollector extends SimpleFileVisitor<Path> {
        private final Path root;
        private final List<Path> found = new ArrayList<>();

        InputFileCollector(Path root) {
            this.root = root;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            // follows symlinks, unlike attrs
            if (Files.isRegularFile(file) && InputFormat.forPath(file).isPresent()) {
                found.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (file.equals(root)) {
                throw exc;
            }
            LOG.warn("Skipping unreadable path {}: {}", file, exc.toString());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
            if (exc != null) {
                if (dir.equals(root)) {
                    throw exc;
                }
                LOG.warn("Listing of {} ended early: {}", dir, exc.toString());
            }
            return FileVisitResult.CONTINUE;
        }

        List<Path> getFound() {
            return found;
        }
    }
}
