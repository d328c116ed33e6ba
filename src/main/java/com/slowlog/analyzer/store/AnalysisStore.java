package com.slowlog.analyzer.store;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.slowlog.analyzer.config.AnalyzerConfig;
import com.slowlog.analyzer.model.AnalysisResult;

/**
 * Keeps analyses as {@code <name>.json} files in a data directory.
 */
public class AnalysisStore {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisStore.class);

    private static final String SUFFIX = ".json";

    private final Path dataDir;
    private final AnalysisResultCodec codec;

    public AnalysisStore(Path dataDir, AnalyzerConfig config) {
        this.dataDir = dataDir;
        this.codec = new AnalysisResultCodec(config);
    }

    /**
     * Writes the result under its name, replacing an earlier analysis of the same name.
     */
    public Path save(AnalysisResult result) throws IOException {
        Path target = pathFor(result.getName());
        Files.createDirectories(dataDir);
        Path tmp = Files.createTempFile(dataDir, result.getName(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                codec.write(result, out);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
        logger.info("Saved analysis '{}' ({} queries) to {}", result.getName(), result.getTotalQueries(), target);
        return target;
    }

    public AnalysisResult load(String name) throws IOException {
        Path file = pathFor(name);
        try (InputStream in = Files.newInputStream(file)) {
            AnalysisResult result = codec.read(in);
            logger.debug("Loaded analysis '{}' from {}", name, file);
            return result;
        } catch (NoSuchFileException e) {
            throw new AnalysisNotFoundException(name);
        }
    }

    public boolean exists(String name) {
        return Files.isRegularFile(pathFor(name));
    }

    public boolean delete(String name) throws IOException {
        boolean deleted = Files.deleteIfExists(pathFor(name));
        if (deleted) {
            logger.info("Deleted analysis '{}'", name);
        }
        return deleted;
    }

    /**
     * Names of the stored analyses, most recently written first.
     */
    public List<String> list() throws IOException {
        if (!Files.isDirectory(dataDir)) {
            return new ArrayList<>();
        }
        Map<String, FileTime> modified;
        try (Stream<Path> files = Files.list(dataDir)) {
            modified = files.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .filter(Files::isRegularFile)
                    .collect(Collectors.toMap(AnalysisStore::nameOf, AnalysisStore::lastModified));
        }
        return modified.entrySet().stream()
                .sorted(Map.Entry.<String, FileTime>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private Path pathFor(String name) {
        if (name == null || name.trim().isEmpty() || name.contains("/") || name.contains("\\")
                || name.startsWith(".")) {
            throw new IllegalArgumentException("Invalid analysis name: " + name);
        }
        return dataDir.resolve(name + SUFFIX);
    }

    private static String nameOf(Path file) {
        String fileName = file.getFileName().toString();
        return fileName.substring(0, fileName.length() - SUFFIX.length());
    }

    private static FileTime lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            logger.warn("Could not read modification time of {}: {}", file, e.getMessage());
            return FileTime.fromMillis(0);
        }
    }
}
