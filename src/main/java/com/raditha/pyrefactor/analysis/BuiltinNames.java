package com.raditha.pyrefactor.analysis;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * The names the subject language provides without an import. Free variables
 * and instantiated types with these names are never reported.
 * <p>
 * The standard vocabulary is read from {@code python-builtins.txt} on the
 * classpath; {@link #with(Collection)} extends it with project specific names.
 */
public final class BuiltinNames {

    private static final String RESOURCE = "/python-builtins.txt";

    private static volatile BuiltinNames standard;

    private final Set<String> names;

    public BuiltinNames(Collection<String> names) {
        this.names = Collections.unmodifiableSet(new TreeSet<>(names));
    }

    public static BuiltinNames standard() {
        BuiltinNames result = standard;
        if (result == null) {
            synchronized (BuiltinNames.class) {
                result = standard;
                if (result == null) {
                    result = new BuiltinNames(load());
                    standard = result;
                }
            }
        }
        return result;
    }

    /**
     * A copy of this vocabulary with {@code extra} added.
     */
    public BuiltinNames with(Collection<String> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        Set<String> merged = new TreeSet<>(names);
        merged.addAll(extra);
        return new BuiltinNames(merged);
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public Set<String> names() {
        return names;
    }

    private static Set<String> load() {
        Set<String> result = new TreeSet<>();
        try (InputStream in = BuiltinNames.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                String name = line.strip();
                if (!name.isEmpty() && !name.startsWith("#")) {
                    result.add(name);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return result;
    }
}
