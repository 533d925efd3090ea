package com.dynop.routing.hybrid.cache;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link KeyValueStore} keeping one file per key inside a directory.
 *
 * <p>File names are the URL-encoded key with a {@code .entry} suffix. Writes go to a temporary file that
 * is then moved over the target, so readers never observe a partially written value.
 */
public final class DirectoryKeyValueStore implements KeyValueStore {

    private static final Logger LOGGER = Logger.getLogger(DirectoryKeyValueStore.class.getName());

    private static final String SUFFIX = ".entry";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;

    /**
     * @param directory storage directory, created if it does not exist
     * @throws CachePersistenceException if the directory cannot be created
     */
    public DirectoryKeyValueStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CachePersistenceException("Cannot create cache directory " + directory, null, e);
        }
        LOGGER.info(() -> "Route cache persisted under " + directory.toAbsolutePath());
    }

    @Override
    public Optional<byte[]> get(String key) {
        Path file = fileFor(key);
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CachePersistenceException("Failed to read " + file, key, e);
        }
    }

    @Override
    public void set(String key, byte[] value) {
        Path file = fileFor(key);
        Path temp = directory.resolve(file.getFileName() + TEMP_SUFFIX);
        try {
            Files.write(temp, value);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new CachePersistenceException("Failed to write " + file, key, e);
        }
    }

    @Override
    public void delete(String key) {
        Path file = fileFor(key);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new CachePersistenceException("Failed to delete " + file, key, e);
        }
    }

    @Override
    public List<String> keys(String prefix) {
        List<String> matches = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                String key = URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8);
                if (key.startsWith(prefix)) {
                    matches.add(key);
                }
            }
        } catch (IOException e) {
            throw new CachePersistenceException("Failed to list " + directory, null, e);
        }
        return matches;
    }

    public Path getDirectory() {
        return directory;
    }

    private Path fileFor(String key) {
        return directory.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + SUFFIX);
    }
}
