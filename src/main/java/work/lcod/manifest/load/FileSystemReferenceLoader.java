package work.lcod.manifest.load;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import work.lcod.manifest.error.LoadException;
import work.lcod.manifest.error.MissingReferenceException;

/**
 * Reads local manifests. Relative locators are interpreted against the configured base directory.
 */
public final class FileSystemReferenceLoader implements ReferenceLoader {
    private final Path baseDirectory;
    private final Executor executor;

    public FileSystemReferenceLoader(Path baseDirectory) {
        this(baseDirectory, ForkJoinPool.commonPool());
    }

    public FileSystemReferenceLoader(Path baseDirectory, Executor executor) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory").toAbsolutePath().normalize();
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public Path baseDirectory() {
        return baseDirectory;
    }

    public Path pathOf(String locator) {
        Path path = Path.of(locator);
        return path.isAbsolute() ? path.normalize() : baseDirectory.resolve(path).normalize();
    }

    @Override
    public CompletableFuture<String> load(String locator) {
        return CompletableFuture.supplyAsync(() -> read(locator), executor);
    }

    private String read(String locator) {
        Path path = pathOf(locator);
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException ex) {
            throw new CompletionException(
                new MissingReferenceException(locator, "Manifest not found: " + locator + " (" + path + ")")
            );
        } catch (IOException ex) {
            throw new CompletionException(new LoadException(locator, "Failed to read manifest: " + path, ex));
        }
    }
}
