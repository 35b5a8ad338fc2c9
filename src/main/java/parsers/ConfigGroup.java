package parsers;

import lombok.Getter;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Settings of one {@code [group]} in file order. Lookups of missing settings return
 * {@link Optional#empty()}.
 */
public final class ConfigGroup {

    @Getter
    private final String name;
    private final LinkedHashMap<String, FileDataItem> items = new LinkedHashMap<>();

    ConfigGroup(String name) {
        this.name = name;
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(items.get(key)).map(FileDataItem::getValue);
    }

    /**
     * Returns the value of {@code key} as {@code type}.
     *
     * @throws IllegalStateException if the setting holds a value of another type
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Optional<Object> value = get(key);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Object v = value.get();
        if (!type.isInstance(v)) {
            throw new IllegalStateException("Setting '" + key + "' in group '" + name + "' is "
                    + v.getClass().getSimpleName() + ", not " + type.getSimpleName());
        }
        return Optional.of(type.cast(v));
    }

    public Optional<String> getString(String key) {
        return get(key, String.class);
    }

    public Optional<Integer> getInteger(String key) {
        return get(key, Integer.class);
    }

    /**
     * Integer setting widened to {@code long}. Values too large for a long are rejected like any
     * other type mismatch.
     */
    public Optional<Long> getLong(String key) {
        Optional<Number> number = get(key, Number.class);
        if (number.isEmpty()) {
            return Optional.empty();
        }
        Number n = number.get();
        if (n instanceof Integer || n instanceof Long) {
            return Optional.of(n.longValue());
        }
        throw new IllegalStateException("Setting '" + key + "' in group '" + name + "' is "
                + (n instanceof BigInteger ? "out of long range" : n.getClass().getSimpleName()) + ", not Long");
    }

    public Optional<Double> getDouble(String key) {
        return get(key, Double.class);
    }

    public Optional<Boolean> getBoolean(String key) {
        return get(key, Boolean.class);
    }

    @SuppressWarnings("unchecked")
    public Optional<List<Object>> getList(String key) {
        return get(key, List.class).map(list -> (List<Object>) list);
    }

    /**
     * Copy of the stored setting; changing it does not affect the group.
     */
    public Optional<FileDataItem> item(String key) {
        return Optional.ofNullable(items.get(key)).map(ConfigGroup::copyOf);
    }

    public boolean contains(String key) {
        return items.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(items.keySet());
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public Map<String, Object> asMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, FileDataItem> entry : items.entrySet()) {
            result.put(entry.getKey(), entry.getValue().getValue());
        }
        return Collections.unmodifiableMap(result);
    }

    Iterable<FileDataItem> items() {
        return Collections.unmodifiableCollection(items.values());
    }

    static FileDataItem copyOf(FileDataItem item) {
        return item.toBuilder().build();
    }

    void put(FileDataItem item) {
        items.put(item.getKey(), item);
    }

    @Override
    public String toString() {
        return name + "=" + asMap();
    }
}
