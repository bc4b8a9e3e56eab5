package io.authrelay.host;

import com.fasterxml.jackson.databind.JavaType;
import io.authrelay.util.Jsons;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class StateDeque<T> {
    private final String key;
    private final JavaType listType;

    private StateDeque(String key, JavaType listType) {
        this.key = key;
        this.listType = listType;
    }

    public static <T> StateDeque<T> of(String key, Class<T> elementType) {
        return new StateDeque<>(key, Jsons.wire().getTypeFactory().constructCollectionType(List.class, elementType));
    }

    public List<T> list(Storage storage) {
        return storage.get(key)
                .map(raw -> StoredValues.<List<T>>read(raw, listType, key))
                .map(ArrayList::new)
                .orElseGet(ArrayList::new);
    }

    public int len(Storage storage) {
        return list(storage).size();
    }

    public boolean isEmpty(Storage storage) {
        return list(storage).isEmpty();
    }

    public Optional<T> peekFront(Storage storage) {
        List<T> items = list(storage);
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(0));
    }

    public Optional<T> popFront(Storage storage) {
        List<T> items = list(storage);
        if (items.isEmpty()) {
            return Optional.empty();
        }
        T head = items.remove(0);
        write(storage, items);
        return Optional.of(head);
    }

    public void pushBack(Storage storage, T value) {
        List<T> items = list(storage);
        items.add(value);
        write(storage, items);
    }

    public void pushFront(Storage storage, T value) {
        insertAt(storage, 0, value);
    }

    public void insertAt(Storage storage, int position, T value) {
        List<T> items = list(storage);
        if (position < 0 || position > items.size()) {
            throw new IndexOutOfBoundsException("Position " + position + " outside queue of length " + items.size());
        }
        items.add(position, value);
        write(storage, items);
    }

    public Optional<T> removeAt(Storage storage, int position) {
        List<T> items = list(storage);
        if (position < 0 || position >= items.size()) {
            return Optional.empty();
        }
        T removed = items.remove(position);
        write(storage, items);
        return Optional.of(removed);
    }

    public void set(Storage storage, int position, T value) {
        List<T> items = list(storage);
        items.set(position, value);
        write(storage, items);
    }

    public List<T> slice(Storage storage, Integer from, Integer to) {
        List<T> items = list(storage);
        int start = from == null ? 0 : Math.max(0, Math.min(from, items.size()));
        int end = to == null ? items.size() : Math.max(start, Math.min(to, items.size()));
        return new ArrayList<>(items.subList(start, end));
    }

    private void write(Storage storage, List<T> items) {
        storage.set(key, StoredValues.write(items, key));
    }
}
