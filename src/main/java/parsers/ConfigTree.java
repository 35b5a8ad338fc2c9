package parsers;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed configuration: groups in file order, each holding its settings.
 *
 * <p>Missing groups and settings are reported as {@link Optional#empty()} at every level, so
 * {@code tree.getString("ftp", "path")} never fails just because {@code [ftp]} is absent.
 * Public views are read-only.
 */
public final class ConfigTree {

    /** Name of the source the tree was parsed from, as used in error messages. */
    @Getter
    private final String filename;
    private final LinkedHashMap<String, ConfigGroup> groups = new LinkedHashMap<>();

    ConfigTree(String filename) {
        this.filename = filename;
    }

    public Optional<ConfigGroup> group(String name) {
        return Optional.ofNullable(groups.get(name));
    }

    public Optional<Object> get(String group, String key) {
        return group(group).flatMap(g -> g.get(key));
    }

    public <T> Optional<T> get(String group, String key, Class<T> type) {
        return group(group).flatMap(g -> g.get(key, type));
    }

    public Optional<String> getString(String group, String key) {
        return group(group).flatMap(g -> g.getString(key));
    }

    public Optional<Integer> getInteger(String group, String key) {
        return group(group).flatMap(g -> g.getInteger(key));
    }

    public Optional<Long> getLong(String group, String key) {
        return group(group).flatMap(g -> g.getLong(key));
    }

    public Optional<Double> getDouble(String group, String key) {
        return group(group).flatMap(g -> g.getDouble(key));
    }

    public Optional<Boolean> getBoolean(String group, String key) {
        return group(group).flatMap(g -> g.getBoolean(key));
    }

    public Optional<List<Object>> getList(String group, String key) {
        return group(group).flatMap(g -> g.getList(key));
    }

    public boolean contains(String group) {
        return groups.containsKey(group);
    }

    public Set<String> groupNames() {
        return Collections.unmodifiableSet(groups.keySet());
    }

    public int size() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    public Map<String, Map<String, Object>> asMap() {
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        for (ConfigGroup group : groups.values()) {
            result.put(group.getName(), group.asMap());
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * One entry per setting keyed {@code group.setting}, in file order.
     */
    public Map<String, FileDataItem> flatten() {
        Map<String, FileDataItem> result = new LinkedHashMap<>();
        for (ConfigGroup group : groups.values()) {
            for (FileDataItem item : group.items()) {
                result.put(group.getName() + "." + item.getKey(), ConfigGroup.copyOf(item));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    ConfigGroup openGroup(String name) {
        ConfigGroup group = new ConfigGroup(name);
        groups.put(name, group);
        return group;
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
