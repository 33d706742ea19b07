package work.lcod.manifest.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import work.lcod.manifest.error.ErrorKind;
import work.lcod.manifest.error.ResolutionException;
import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.parse.ManifestWriter;

/**
 * Outcome of a {@link ManifestEngine} call: a fully resolved manifest, or a single error naming the
 * failing reference and its kind. Never a partial manifest.
 */
public record ResolutionResult(
    Status status,
    String source,
    Manifest manifest,
    ErrorKind errorKind,
    String reference,
    String message,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public static ResolutionResult success(String source, Manifest manifest, Instant startedAt) {
        return new ResolutionResult(Status.SUCCESS, source, manifest, null, null, null, startedAt, Instant.now());
    }

    public static ResolutionResult failure(String source, ResolutionException error, Instant startedAt) {
        return new ResolutionResult(
            Status.FAILURE,
            source,
            null,
            error.kind(),
            error.reference(),
            error.getMessage(),
            startedAt,
            Instant.now()
        );
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("source", source);
        if (manifest != null) {
            serializable.put("manifest", ManifestWriter.toMap(manifest));
        }
        if (errorKind != null) {
            var error = new LinkedHashMap<String, Object>();
            error.put("kind", errorKind.code());
            error.put("reference", reference);
            error.put("message", message);
            serializable.put("error", error);
        }
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
