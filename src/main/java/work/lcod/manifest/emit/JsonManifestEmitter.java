package work.lcod.manifest.emit;

import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.parse.ManifestWriter;

public final class JsonManifestEmitter implements ManifestEmitter {
    @Override
    public String format() {
        return "json";
    }

    @Override
    public EmittedFile emit(Manifest resolved) {
        ManifestEmitter.requireResolved(resolved);
        return new EmittedFile(ManifestEmitter.baseName(resolved) + ".json", ManifestWriter.toJson(resolved));
    }
}
