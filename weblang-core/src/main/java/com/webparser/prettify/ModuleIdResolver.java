package com.webparser.prettify;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Maps WEB module names to the numeric IDs used for cross-reference markup.
 */
@FunctionalInterface
public interface ModuleIdResolver {

    ModuleIdResolver NONE = name -> OptionalInt.empty();

    OptionalInt resolve(String moduleName);

    static ModuleIdResolver of(Map<String, Integer> ids) {
        Map<String, Integer> copy = Map.copyOf(ids);
        return name -> {
            Integer id = copy.get(name);
            return id != null ? OptionalInt.of(id) : OptionalInt.empty();
        };
    }
}
