package io.authrelay.host;

// lexicographic order of an encoded key matches the natural order of the key
public interface KeyCodec<K> {
    KeyCodec<String> STRING = new KeyCodec<>() {
        @Override
        public String encode(String key) {
            return key;
        }

        @Override
        public String decode(String raw) {
            return raw;
        }
    };

    KeyCodec<Long> U64 = new KeyCodec<>() {
        @Override
        public String encode(Long key) {
            if (key == null || key < 0) {
                throw new IllegalArgumentException("u64 key must be non-negative: " + key);
            }
            return String.format("%020d", key);
        }

        @Override
        public Long decode(String raw) {
            return Long.parseLong(raw);
        }
    };

    String encode(K key);

    K decode(String raw);
}
