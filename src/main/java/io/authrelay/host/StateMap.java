package io.authrelay.host;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import io.authrelay.util.Jsons;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class StateMap<K, V> {
    private final String namespace;
    private final KeyCodec<K> keys;
    private final JavaType type;

    private StateMap(String namespace, KeyCodec<K> keys, JavaType type) {
        this.namespace = namespace + "/";
        this.keys = keys;
        this.type = type;
    }

    public static <K, V> StateMap<K, V> of(String namespace, KeyCodec<K> keys, Class<V> type) {
        return new StateMap<>(namespace, keys, Jsons.wire().constructType(type));
    }

    public static <K, V> StateMap<K, V> of(String namespace, KeyCodec<K> keys, TypeReference<V> type) {
        return new StateMap<>(namespace, keys, Jsons.wire().constructType(type));
    }

    public Optional<V> mayLoad(Storage storage, K key) {
        String storedKey = storedKey(key);
        return storage.get(storedKey).map(raw -> StoredValues.read(raw, type, storedKey));
    }

    public V load(Storage storage, K key) throws ContractException {
        Optional<V> value = mayLoad(storage, key);
        if (value.isEmpty()) {
            throw new ContractException(type.getRawClass().getSimpleName() + " not found for key " + key);
        }
        return value.get();
    }

    public void save(Storage storage, K key, V value) {
        String storedKey = storedKey(key);
        storage.set(storedKey, StoredValues.write(value, storedKey));
    }

    public void remove(Storage storage, K key) {
        storage.remove(storedKey(key));
    }

    public boolean has(Storage storage, K key) {
        return storage.has(storedKey(key));
    }

    public List<Map.Entry<K, V>> range(Storage storage, K startAfter, int limit) {
        String after = startAfter == null ? null : storedKey(startAfter);
        List<Map.Entry<K, V>> out = new ArrayList<>();
        for (Map.Entry<String, String> entry : storage.scan(namespace).entrySet()) {
            if (out.size() >= limit) {
                break;
            }
            if (after != null && entry.getKey().compareTo(after) <= 0) {
                continue;
            }
            K key = keys.decode(entry.getKey().substring(namespace.length()));
            out.add(new AbstractMap.SimpleImmutableEntry<>(key, StoredValues.read(entry.getValue(), type, entry.getKey())));
        }
        return out;
    }

    public List<Map.Entry<K, V>> entries(Storage storage) {
        return range(storage, null, Integer.MAX_VALUE);
    }

    public List<V> values(Storage storage) {
        List<V> out = new ArrayList<>();
        for (Map.Entry<K, V> entry : entries(storage)) {
            out.add(entry.getValue());
        }
        return out;
    }

    private String storedKey(K key) {
        return namespace + keys.encode(key);
    }
}
