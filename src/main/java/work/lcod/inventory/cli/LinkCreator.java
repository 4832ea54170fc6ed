package work.lcod.inventory.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates one symlink per environment pointing back at the launcher, so that invoking the link selects
 * the environment by name.
 */
final class LinkCreator {
    private static final Logger log = LoggerFactory.getLogger(LinkCreator.class);

    /**
     * @return number of links that could not be created
     */
    int create(List<String> environments, Path directory, Path launcher) {
        Path dir = directory.toAbsolutePath().normalize();
        Path relativeTarget = dir.relativize(launcher.toAbsolutePath().normalize());
        int errors = 0;
        for (String environment : environments) {
            Path link = dir.resolve(environment);
            try {
                Files.createSymbolicLink(link, relativeTarget);
                log.debug("Linked {} -> {}", link, relativeTarget);
            } catch (IOException | UnsupportedOperationException ex) {
                log.warn("This symlink might already exist. Leaving it unchanged. Error: {}", ex.toString());
                errors++;
            }
        }
        return errors;
    }
}
