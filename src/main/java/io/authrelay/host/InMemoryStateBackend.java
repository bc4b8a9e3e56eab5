package io.authrelay.host;

import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

public final class InMemoryStateBackend implements StateBackend {
    private final TreeMap<String, String> entries = new TreeMap<>();

    @Override
    public synchronized Optional<String> load(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public synchronized SortedMap<String, String> scan(String prefix) {
        TreeMap<String, String> out = new TreeMap<>();
        for (Map.Entry<String, String> entry : entries.tailMap(prefix, true).entrySet()) {
            if (!entry.getKey().startsWith(prefix)) {
                break;
            }
            out.put(entry.getKey(), entry.getValue());
        }
        return out;
    }

    @Override
    public synchronized void apply(Map<String, Optional<String>> writes) {
        for (Map.Entry<String, Optional<String>> write : writes.entrySet()) {
            if (write.getValue().isPresent()) {
                entries.put(write.getKey(), write.getValue().get());
            } else {
                entries.remove(write.getKey());
            }
        }
    }

    public synchronized int size() {
        return entries.size();
    }
}
