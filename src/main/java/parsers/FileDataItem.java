package parsers;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One stored setting together with the line it came from.
 */
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@Data
public class FileDataItem {
    private String key;
    private Object value;
    private String group;
    /** Override name of the line that produced the value, {@code null} for an unconditional line. */
    private String override;
    private String filename;
    private int lineNumber;

    public boolean isOverridden() {
        return override != null;
    }
}
