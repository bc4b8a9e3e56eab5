package io.authrelay.host;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import io.authrelay.util.Jsons;

import java.util.Optional;

public final class Item<T> {
    private final String key;
    private final JavaType type;

    private Item(String key, JavaType type) {
        this.key = key;
        this.type = type;
    }

    public static <T> Item<T> of(String key, Class<T> type) {
        return new Item<>(key, Jsons.wire().constructType(type));
    }

    public static <T> Item<T> of(String key, TypeReference<T> type) {
        return new Item<>(key, Jsons.wire().constructType(type));
    }

    public Optional<T> mayLoad(Storage storage) {
        return storage.get(key).map(raw -> StoredValues.read(raw, type, key));
    }

    public T load(Storage storage) throws ContractException {
        Optional<T> value = mayLoad(storage);
        if (value.isEmpty()) {
            throw new ContractException(type.getRawClass().getSimpleName() + " not found");
        }
        return value.get();
    }

    public void save(Storage storage, T value) {
        storage.set(key, StoredValues.write(value, key));
    }

    public void remove(Storage storage) {
        storage.remove(key);
    }

    public boolean exists(Storage storage) {
        return storage.has(key);
    }
}
