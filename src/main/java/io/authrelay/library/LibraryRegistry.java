package io.authrelay.library;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

// registration order fixes the code ids handed out after a restart
public final class LibraryRegistry {
    private final Map<String, Library> libraries = new LinkedHashMap<>();

    public static LibraryRegistry builtIns() {
        LibraryRegistry registry = new LibraryRegistry();
        registry.register(new EchoLibrary());
        registry.register(new FailLibrary());
        registry.register(new LedgerLibrary());
        return registry;
    }

    public void register(Library library) {
        libraries.put(library.id(), library);
    }

    public Collection<Library> all() {
        return libraries.values();
    }
}
