package parsers;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for INI-like files with per-setting overrides:
 *
 * <pre>
 * [ftp]
 * path = /tmp/                  ; inline comment
 * path&lt;production&gt; = /srv/var/tmp/
 * </pre>
 *
 * <p>Lines are read once, front to back. The first line that is a duplicate group, a setting
 * outside any group, or matches no known shape aborts the parse with a {@link ConfigParseException}.
 * An override line is applied only when its name is among the enabled overrides of the call; an
 * applied override beats the unconditional value of the same setting regardless of line order.
 *
 * <p>Instances are stateless and may be shared between threads.
 */
@Slf4j
public class OverrideIni implements ConfigService {

    static final String STRING_SOURCE = "<string>";

    private static final Pattern GROUP_PATTERN = Pattern.compile("^\\[(.+)]$");
    private static final Pattern SETTING_PATTERN = Pattern.compile("^(.+)\\s?=\\s?(.+)$");
    private static final Pattern SETTING_OVERRIDE_PATTERN = Pattern.compile("^(.+)<(.+)>\\s?=\\s?(.+)$");
    private static final Pattern COMMENT_PATTERN = Pattern.compile(";+.*$");

    private final Charset charset;

    public OverrideIni() {
        this(StandardCharsets.UTF_8);
    }

    public OverrideIni(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset must not be null");
    }

    @Override
    public ConfigTree load(Path path, Collection<String> overrides) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        Set<String> enabled = toOverrideSet(overrides);
        log.info("Loading config from {} with overrides {}", path, enabled);

        try (BufferedReader reader = Files.newBufferedReader(path, charset)) {
            return parse(reader.lines().iterator(), path.toString(), enabled);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    @Override
    public ConfigTree parse(String data, Collection<String> overrides) {
        Objects.requireNonNull(data, "data must not be null");
        return parse(data.lines().iterator(), STRING_SOURCE, toOverrideSet(overrides));
    }

    /**
     * Parses {@code lines} in a single forward pass.
     *
     * @param source name reported in error messages
     */
    public ConfigTree parse(Iterator<String> lines, String source, Set<String> enabledOverrides) {
        Objects.requireNonNull(lines, "lines must not be null");
        ParseContext ctx = new ParseContext(source == null ? STRING_SOURCE : source, toOverrideSet(enabledOverrides));

        while (lines.hasNext()) {
            processRawLine(ctx, lines.next());
        }

        log.debug("Parsed {} lines of {} into {} groups", ctx.lineNumber, ctx.source, ctx.tree.size());
        return ctx.tree;
    }

    private static void processRawLine(ParseContext ctx, String rawLine) {
        ctx.lineNumber++;

        String line = trimComment(rawLine);
        if (line.isEmpty()) {
            return;
        }

        Optional<String> group = parseGroupName(line);
        if (group.isPresent()) {
            ctx.onGroupHeader(group.get());
            return;
        }

        Matcher setting = SETTING_PATTERN.matcher(line);
        if (setting.matches()) {
            ctx.onSetting(line, setting.group(1).trim(), setting.group(2).trim());
            return;
        }

        throw new InvalidLineException(ctx.source, ctx.lineNumber);
    }

    /**
     * Drops everything from the first {@code ;} on and trims the rest. A comment-only line becomes empty.
     */
    public static String trimComment(String line) {
        if (line == null) {
            return StringUtils.EMPTY;
        }
        return COMMENT_PATTERN.matcher(line).replaceFirst(StringUtils.EMPTY).trim();
    }

    /**
     * Name of the group declared by a {@code [name]} line. Empty brackets declare nothing.
     */
    public static Optional<String> parseGroupName(String line) {
        Matcher matcher = GROUP_PATTERN.matcher(StringUtils.defaultString(line));
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String name = matcher.group(1).trim();
        return name.isEmpty() ? Optional.empty() : Optional.of(name);
    }

    /**
     * Splits a {@code key = value} line. The key is taken as written, so for an override line it
     * still contains the {@code <override>} part.
     */
    public static Optional<Setting> parseSetting(String line) {
        Matcher matcher = SETTING_PATTERN.matcher(StringUtils.defaultString(line));
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Setting(matcher.group(1).trim(), null, ValueCoercer.coerce(matcher.group(2))));
    }

    /**
     * Splits a {@code key<override> = value} line into base key, override name and value.
     */
    public static Optional<Setting> parseOverrideSetting(String line) {
        Matcher matcher = SETTING_OVERRIDE_PATTERN.matcher(StringUtils.defaultString(line));
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new Setting(matcher.group(1).trim(), matcher.group(2).trim(),
                ValueCoercer.coerce(matcher.group(3))));
    }

    private static Set<String> toOverrideSet(Collection<String> overrides) {
        return overrides == null ? Set.of() : Set.copyOf(overrides);
    }

    @Data
    public static final class Setting {
        private final String key;
        private final String override;
        private final Object value;
    }

    private static final class ParseContext {
        final String source;
        final Set<String> enabledOverrides;
        final ConfigTree tree;
        ConfigGroup currentGroup;
        int lineNumber;

        ParseContext(String source, Set<String> enabledOverrides) {
            this.source = source;
            this.enabledOverrides = enabledOverrides;
            this.tree = new ConfigTree(source);
        }

        void onGroupHeader(String name) {
            if (tree.contains(name)) {
                throw new DuplicateGroupException(name, source, lineNumber);
            }
            currentGroup = tree.openGroup(name);
            log.debug("Opened group [{}] at line {} of {}", name, lineNumber, source);
        }

        void onSetting(String line, String key, String rawValue) {
            if (currentGroup == null) {
                throw new MissingGroupException(source, lineNumber);
            }

            Matcher override = SETTING_OVERRIDE_PATTERN.matcher(line);
            if (!override.matches()) {
                putUnconditional(key, rawValue);
                return;
            }

            String baseKey = override.group(1).trim();
            String overrideName = override.group(2).trim();
            if (!enabledOverrides.contains(overrideName)) {
                log.debug("Skipping {}<{}> at line {} of {}: override not enabled", baseKey, overrideName, lineNumber, source);
                return;
            }
            currentGroup.put(item(baseKey, overrideName, rawValue));
            log.debug("Applied {}<{}> at line {} of {}", baseKey, overrideName, lineNumber, source);
        }

        private void putUnconditional(String key, String rawValue) {
            Optional<FileDataItem> existing = currentGroup.item(key);
            if (existing.isPresent() && existing.get().isOverridden()) {
                log.debug("Keeping {}<{}> from line {} over line {} of {}", key, existing.get().getOverride(),
                        existing.get().getLineNumber(), lineNumber, source);
                return;
            }
            currentGroup.put(item(key, null, rawValue));
        }

        private FileDataItem item(String key, String override, String rawValue) {
            return FileDataItem.builder()
                    .key(key)
                    .value(ValueCoercer.coerce(rawValue))
                    .group(currentGroup.getName())
                    .override(override)
                    .filename(source)
                    .lineNumber(lineNumber)
                    .build();
        }
    }
}
