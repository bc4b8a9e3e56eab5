package io.authrelay.host;

import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

public interface StateBackend {
    Optional<String> load(String key);

    SortedMap<String, String> scan(String prefix);

    void apply(Map<String, Optional<String>> writes);
}
