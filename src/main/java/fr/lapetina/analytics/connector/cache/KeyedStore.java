package fr.lapetina.analytics.connector.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Map whose keys are compared by a serialized string form rather than by identity.
 *
 * Subclasses supply the {@link #serializeKey}/{@link #deserializeKey} pair. Keys handed out
 * by {@link #keys()}, {@link #entries()} and {@link #forEach} are rebuilt with
 * {@code deserializeKey}: they are equal in value to the inserted keys but are not the same
 * instances.
 *
 * Mutations notify change listeners with the affected key. Entries are kept in insertion
 * order and are never evicted implicitly. Thread-safe.
 *
 * @param <K> key type
 * @param <V> value type
 */
public abstract class KeyedStore<K, V> {

    private static final Logger log = LoggerFactory.getLogger(KeyedStore.class);

    private final Map<String, V> map = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<Consumer<K>> listeners = new CopyOnWriteArrayList<>();

    /** Serializes a key to its canonical string form. */
    protected abstract String serializeKey(K key);

    /** Rebuilds a key from its canonical string form. */
    protected abstract K deserializeKey(String serialized);

    public int size() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public V get(K key) {
        return map.get(serializeKey(key));
    }

    /**
     * Gets the value for a key.
     *
     * @throws NoSuchElementException if the key is absent
     */
    public V getOrThrow(K key) {
        V value = get(key);
        if (value == null) {
            throw new NoSuchElementException("Key not found: " + key);
        }
        return value;
    }

    public KeyedStore<K, V> set(K key, V value) {
        map.put(serializeKey(key), value);
        fireChange(key);
        return this;
    }

    public boolean has(K key) {
        return map.containsKey(serializeKey(key));
    }

    /**
     * Removes a key.
     *
     * @return true if an entry was removed
     */
    public boolean delete(K key) {
        String serialized = serializeKey(key);
        boolean deleted;
        synchronized (map) {
            deleted = map.containsKey(serialized);
            map.remove(serialized);
        }
        if (deleted) {
            fireChange(key);
        }
        return deleted;
    }

    /**
     * Removes a key and returns the value it held, or null if it was absent.
     */
    public V remove(K key) {
        String serialized = serializeKey(key);
        boolean deleted;
        V removed;
        synchronized (map) {
            deleted = map.containsKey(serialized);
            removed = map.remove(serialized);
        }
        if (deleted) {
            fireChange(key);
        }
        return removed;
    }

    /**
     * Returns the value for a key, creating it atomically with {@code factory} if absent.
     * Listeners are notified only when an entry was created.
     */
    public V computeIfAbsent(K key, Function<? super K, ? extends V> factory) {
        AtomicBoolean created = new AtomicBoolean(false);
        V value = map.computeIfAbsent(serializeKey(key), serialized -> {
            created.set(true);
            return factory.apply(key);
        });
        if (created.get()) {
            fireChange(key);
        }
        return value;
    }

    /**
     * Removes every entry, notifying listeners once per removed key.
     */
    public void clear() {
        drain();
    }

    /**
     * Removes every entry and returns the removed values in insertion order. The snapshot
     * and the removal are atomic with respect to {@link #computeIfAbsent}.
     */
    public List<V> drain() {
        Map<String, V> removed;
        synchronized (map) {
            removed = new LinkedHashMap<>(map);
            map.clear();
        }
        for (String serialized : removed.keySet()) {
            fireChange(deserializeKey(serialized));
        }
        return new ArrayList<>(removed.values());
    }

    /**
     * Snapshot of the keys, rebuilt from their serialized form.
     */
    public List<K> keys() {
        List<K> keys = new ArrayList<>();
        for (String serialized : snapshot().keySet()) {
            keys.add(deserializeKey(serialized));
        }
        return keys;
    }

    /**
     * Snapshot of the values in insertion order.
     */
    public List<V> values() {
        return new ArrayList<>(snapshot().values());
    }

    /**
     * Snapshot of the entries; keys are rebuilt from their serialized form.
     */
    public List<Map.Entry<K, V>> entries() {
        List<Map.Entry<K, V>> entries = new ArrayList<>();
        for (Map.Entry<String, V> entry : snapshot().entrySet()) {
            entries.add(Map.entry(deserializeKey(entry.getKey()), entry.getValue()));
        }
        return entries;
    }

    public void forEach(BiConsumer<? super K, ? super V> action) {
        for (Map.Entry<String, V> entry : snapshot().entrySet()) {
            action.accept(deserializeKey(entry.getKey()), entry.getValue());
        }
    }

    /**
     * Adds a listener called with the key of every set, delete and clear.
     */
    public void addChangeListener(Consumer<K> listener) {
        listeners.add(listener);
    }

    public void removeChangeListener(Consumer<K> listener) {
        listeners.remove(listener);
    }

    private Map<String, V> snapshot() {
        synchronized (map) {
            return new LinkedHashMap<>(map);
        }
    }

    private void fireChange(K key) {
        for (Consumer<K> listener : listeners) {
            try {
                listener.accept(key);
            } catch (Exception e) {
                log.error("Error notifying change listener: key={}", key, e);
            }
        }
    }
}
