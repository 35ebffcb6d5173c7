package app.fsidrill.srs.review.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One JSON file per key inside a local directory. Writes go to a temp file and are moved into place.
 */
public class FileKeyValueStore implements KeyValueStore {

    private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z0-9_.-]+");

    private final Path directory;

    public FileKeyValueStore(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory is required");
        }
        this.directory = directory;
    }

    @Override
    public Optional<String> load(String key) {
        Path file = resolve(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + file, ex);
        }
    }

    @Override
    public boolean save(String key, String blob) {
        Path file = resolve(key);
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, key, ".tmp");
            Files.writeString(tmp, blob, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write " + file, ex);
        }
    }

    private Path resolve(String key) {
        if (key == null || !KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid storage key: " + key);
        }
        return directory.resolve(key + ".json");
    }
}
