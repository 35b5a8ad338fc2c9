package parsers;

import lombok.Getter;

/**
 * Fatal error raised while parsing a configuration source. The parse that raised it produced no result.
 */
@Getter
public abstract class ConfigParseException extends RuntimeException {
    private final String filename;
    private final int lineNumber;

    protected ConfigParseException(String message, String filename, int lineNumber) {
        super(message);
        this.filename = filename;
        this.lineNumber = lineNumber;
    }
}
