package parsers;

import lombok.Getter;

/**
 * A group header names a group that was already opened earlier in the same source.
 */
@Getter
public class DuplicateGroupException extends ConfigParseException {
    private final String group;

    public DuplicateGroupException(String group, String filename, int lineNumber) {
        super("Duplicate group '" + group + "' found at line " + lineNumber
                + " while parsing file at " + filename, filename, lineNumber);
        this.group = group;
    }
}
