package io.authrelay.host;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

public final class ChainState {
    private final StateBackend backend;
    private final Deque<TreeMap<String, Optional<String>>> savepoints = new ArrayDeque<>();

    public ChainState(StateBackend backend) {
        this.backend = backend;
    }

    public void begin() {
        savepoints.push(new TreeMap<>());
    }

    public void commit() {
        TreeMap<String, Optional<String>> top = pop();
        if (savepoints.isEmpty()) {
            if (!top.isEmpty()) {
                backend.apply(top);
            }
        } else {
            savepoints.peek().putAll(top);
        }
    }

    public void rollback() {
        pop();
    }

    public Optional<String> get(String key) {
        for (TreeMap<String, Optional<String>> savepoint : savepoints) {
            Optional<String> value = savepoint.get(key);
            if (value != null) {
                return value;
            }
        }
        return backend.load(key);
    }

    public void put(String key, String value) {
        current().put(key, Optional.of(value));
    }

    public void remove(String key) {
        current().put(key, Optional.empty());
    }

    public SortedMap<String, String> scan(String prefix) {
        TreeMap<String, String> out = new TreeMap<>(backend.scan(prefix));
        Iterator<TreeMap<String, Optional<String>>> oldestFirst = savepoints.descendingIterator();
        while (oldestFirst.hasNext()) {
            for (Map.Entry<String, Optional<String>> entry : oldestFirst.next().tailMap(prefix, true).entrySet()) {
                if (!entry.getKey().startsWith(prefix)) {
                    break;
                }
                if (entry.getValue().isPresent()) {
                    out.put(entry.getKey(), entry.getValue().get());
                } else {
                    out.remove(entry.getKey());
                }
            }
        }
        return out;
    }

    private TreeMap<String, Optional<String>> current() {
        TreeMap<String, Optional<String>> top = savepoints.peek();
        if (top == null) {
            throw new IllegalStateException("State write outside of a transaction");
        }
        return top;
    }

    private TreeMap<String, Optional<String>> pop() {
        if (savepoints.isEmpty()) {
            throw new IllegalStateException("No open savepoint");
        }
        return savepoints.pop();
    }
}
