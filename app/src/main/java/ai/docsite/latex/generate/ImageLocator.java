package ai.docsite.latex.generate;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Answers whether an image referenced by a note exists. Generation performs no other I/O.
 */
@FunctionalInterface
public interface ImageLocator {

    /**
     * @param path    image path as it will appear in the output
     * @param baseDir directory relative paths are resolved against, when configured
     */
    boolean exists(String path, Optional<String> baseDir);

    static ImageLocator filesystem() {
        return (path, baseDir) -> {
            try {
                Path target = Path.of(path);
                if (baseDir.isPresent() && !target.isAbsolute()) {
                    target = Path.of(baseDir.get()).resolve(target);
                }
                return Files.exists(target);
            } catch (InvalidPathException ex) {
                return false;
            }
        };
    }
}
