package dev.automate.engine;

import java.net.URISyntaxException;
import java.nio.file.Path;

final class Fixtures {

    private Fixtures() {}

    static Path program(String name) {
        try {
            return Path.of(Fixtures.class.getResource("/programs/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
