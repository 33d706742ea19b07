package work.lcod.manifest.emit;

import work.lcod.manifest.model.Manifest;
import work.lcod.manifest.parse.ManifestWriter;

public final class YamlManifestEmitter implements ManifestEmitter {
    @Override
    public String format() {
        return "yaml";
    }

    @Override
    public EmittedFile emit(Manifest resolved) {
        ManifestEmitter.requireResolved(resolved);
        return new EmittedFile(ManifestEmitter.baseName(resolved) + ".yaml", ManifestWriter.toYaml(resolved));
    }
}
