package parsers;

/**
 * A setting line appears before the first group header.
 */
public class MissingGroupException extends ConfigParseException {

    public MissingGroupException(String filename, int lineNumber) {
        super("Unable to find a group at line " + lineNumber
                + " while parsing file at " + filename, filename, lineNumber);
    }
}
