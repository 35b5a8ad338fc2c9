package parsers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;

public interface ConfigService {
    ConfigTree load(Path path, Collection<String> overrides) throws IOException;

    ConfigTree parse(String data, Collection<String> overrides);

    default ConfigTree load(Path path) throws IOException {
        return load(path, Collections.emptySet());
    }
}
