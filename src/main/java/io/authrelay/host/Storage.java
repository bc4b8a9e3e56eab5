package io.authrelay.host;

import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

// keys are stored as <contract>/<key>
public final class Storage {
    private final ChainState state;
    private final String prefix;

    public Storage(ChainState state, String contractAddress) {
        this.state = state;
        this.prefix = contractAddress + "/";
    }

    public Optional<String> get(String key) {
        return state.get(prefix + key);
    }

    public void set(String key, String value) {
        state.put(prefix + key, value);
    }

    public void remove(String key) {
        state.remove(prefix + key);
    }

    public boolean has(String key) {
        return get(key).isPresent();
    }

    public SortedMap<String, String> scan(String keyPrefix) {
        TreeMap<String, String> out = new TreeMap<>();
        for (Map.Entry<String, String> entry : state.scan(prefix + keyPrefix).entrySet()) {
            out.put(entry.getKey().substring(prefix.length()), entry.getValue());
        }
        return out;
    }
}
