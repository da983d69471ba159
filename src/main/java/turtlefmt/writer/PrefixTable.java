package turtlefmt.writer;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Prefix labels declared so far in the document. A later declaration of the same label replaces
 * the earlier one.
 */
public class PrefixTable {
    private final Map<String, String> namespaces = new HashMap<>();

    public void declare(String prefix, String namespace) {
        namespaces.put(prefix, namespace);
    }

    public Optional<String> lookup(String prefix) {
        return Optional.ofNullable(namespaces.get(prefix));
    }
}
