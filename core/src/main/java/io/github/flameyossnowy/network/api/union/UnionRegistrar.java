package io.github.flameyossnowy.network.api.union;

import io.github.flameyossnowy.network.api.RecordSet;
import io.github.flameyossnowy.network.api.exceptions.NetworkConfigurationException;
import io.github.flameyossnowy.network.api.meta.RelationKind;
import io.github.flameyossnowy.network.api.network.RelationBinding;
import io.github.flameyossnowy.network.api.utils.Identifiers;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds union accessors: an accessor that, on every call, evaluates a fixed list of
 * other accessors on the current node and wraps their results in a fresh {@link UnionView}.
 * <p>
 * Source names are resolved when the accessor is called, so a union may be declared
 * before its sources and may merge other unions.
 */
public final class UnionRegistrar {
    private UnionRegistrar() {
        throw new AssertionError("No instances");
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    public static <N> @NotNull RelationBinding<N> union(
        @NotNull String name,
        @NotNull List<String> sourceNames,
        @NotNull Function<String, RelationBinding<N>> resolver
    ) {
        if (!Identifiers.isIdentifier(name)) {
            throw new NetworkConfigurationException(name, "union name must be a valid identifier");
        }
        if (sourceNames.isEmpty()) {
            throw new NetworkConfigurationException(name, "a union needs at least one source");
        }
        for (String source : sourceNames) {
            if (source == null || source.isBlank()) {
                throw new NetworkConfigurationException(name, "union source names cannot be blank");
            }
        }

        List<String> sources = List.copyOf(sourceNames);
        return new RelationBinding<N>(
            name,
            RelationKind.UNION,
            "union(" + String.join(", ", sources) + ")",
            node -> {
                List<RecordSet> sets = new ArrayList<>(sources.size());
                for (String source : sources) {
                    RelationBinding<N> binding = resolver.apply(source);
                    if (binding == null) {
                        throw new IllegalStateException("Union '" + name + "' references undeclared relation '" + source + "'");
                    }
                    sets.add(binding.accessor().fetch(node));
                }
                return new UnionView(sets);
            },
            sources
        );
    }

    /**
     * Checks that every union source is declared and that no union reaches itself.
     *
     * @throws NetworkConfigurationException on the first offending union
     */
    public static <N> void validate(@NotNull Map<String, RelationBinding<N>> bindings) {
        for (RelationBinding<N> binding : bindings.values()) {
            if (!binding.isUnion()) continue;
            for (String source : binding.sources()) {
                if (!bindings.containsKey(source)) {
                    throw new NetworkConfigurationException(binding.name(), "unknown union source '" + source + "'");
                }
            }
        }

        Set<String> done = new HashSet<>();
        for (RelationBinding<N> binding : bindings.values()) {
            if (binding.isUnion()) {
                checkCycles(binding, bindings, new LinkedHashSet<>(), done);
            }
        }
    }

    private static <N> void checkCycles(
        RelationBinding<N> binding,
        Map<String, RelationBinding<N>> bindings,
        LinkedHashSet<String> path,
        Set<String> done
    ) {
        if (done.contains(binding.name())) return;
        if (!path.add(binding.name())) {
            throw new NetworkConfigurationException(binding.name(), "union cycle " + String.join(" -> ", path) + " -> " + binding.name());
        }
        for (String source : binding.sources()) {
            RelationBinding<N> next = bindings.get(source);
            if (next != null && next.isUnion()) {
                checkCycles(next, bindings, path, done);
            }
        }
        path.remove(binding.name());
        done.add(binding.name());
    }
}
