package io.github.fiserro.synphot.table;

import io.github.fiserro.synphot.ReferenceDataException;
import java.nio.file.Path;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves reference names to files on disk.
 *
 * <p>Names of the form {@code prefix$relative/path} are resolved against the directory
 * registered for {@code prefix}. Other relative names are resolved against the root directory.
 */
@Slf4j
public class ReferenceFiles {

    private final Path rootDir;
    private final Map<String, Path> aliases;

    public ReferenceFiles(Path rootDir, Map<String, Path> aliases) {
        this.rootDir = rootDir;
        this.aliases = Map.copyOf(aliases);
    }

    public Path rootDir() {
        return rootDir;
    }

    /**
     * Resolves a reference name, ignoring any trailing {@code [key#]} parameter marker.
     *
     * @throws ReferenceDataException if the name uses an unknown directory prefix
     */
    public Path resolve(String name) {
        String bare = ReferenceName.parse(name.strip()).bareName();
        int dollar = bare.indexOf('$');
        if (dollar < 0) {
            return rootDir.resolve(bare);
        }

        String prefix = bare.substring(0, dollar);
        Path dir = aliases.get(prefix);
        if (dir == null) {
            throw new ReferenceDataException(
                "Unknown directory prefix '" + prefix + "$' in reference name " + name);
        }
        Path resolved = dir.resolve(bare.substring(dollar + 1));
        log.trace("Resolved {} -> {}", name, resolved);
        return resolved;
    }
}
