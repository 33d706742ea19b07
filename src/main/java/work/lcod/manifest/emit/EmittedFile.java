package work.lcod.manifest.emit;

import java.util.Objects;

/**
 * Output of an emitter: a suggested file name and its text content.
 */
public record EmittedFile(String filename, String content) {
    public EmittedFile {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(content, "content");
    }
}
