package io.github.cyfko.metricql.core.alias;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.metricql.core.api.Comparison;
import io.github.cyfko.metricql.core.exception.AliasDefinitionException;
import io.github.cyfko.metricql.core.exception.UnknownAliasException;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Immutable lookup tables mapping free-form text to canonical enumeration members.
 * <p>
 * Every member of every {@link AliasFamily} resolves from its canonical name, and every
 * {@link Comparison} also from its grammar symbol ({@code >=}, {@code ==}, ...). Additional
 * aliases come from a declarative JSON document, loaded once and never modified afterwards:
 * </p>
 * <pre>{@code
 * {
 *   "comparison": { "GE": [">=", "=>", "at least", "no less than"] },
 *   "sex":        { "MALE": ["m", "man"] },
 *   "kpi":        { "DTN": ["door to needle", "time to treatment"] }
 * }
 * }</pre>
 *
 * <h2>Resolution</h2>
 * <p>
 * Input text is trimmed and lowercased, then matched exactly against the precomputed
 * lowercase table of the requested family. There is no fuzzy matching.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Instances are deeply immutable and safe for unsynchronized concurrent reads. The bundled
 * {@link #defaults()} registry is created lazily on first use and cached for the lifetime of
 * the class loader.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AliasRegistry registry = AliasRegistry.defaults();
 * Comparison ge = registry.resolve(Comparison.class, "no less than");  // GE
 * Optional<SexType> sex = registry.tryResolve(SexType.class, "woman"); // FEMALE
 * String choices = registry.describe(AliasFamily.GROUP_BY);
 *
 * AliasRegistry custom = AliasRegistry.builder()
 *     .alias(Kpi.DTN, "needle time")
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class AliasRegistry {

    /** Classpath location of the bundled alias document. */
    public static final String DEFAULT_RESOURCE = "metricql/aliases.json";

    private static final Logger log = Logger.getLogger(AliasRegistry.class.getName());

    private final Map<AliasFamily, Map<String, Enum<?>>> lookup;
    private final Map<Enum<?>, SortedSet<String>> aliases;

    private AliasRegistry(Map<AliasFamily, Map<String, Enum<?>>> lookup, Map<Enum<?>, SortedSet<String>> aliases) {
        this.lookup = lookup;
        this.aliases = aliases;
    }

    /**
     * Returns the registry built from the bundled {@value #DEFAULT_RESOURCE} document.
     *
     * @return the shared default registry
     * @throws AliasDefinitionException if the bundled document is missing or invalid
     */
    public static AliasRegistry defaults() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Builds a registry from a JSON alias document.
     *
     * @param source the document; not closed by this method
     * @return a new registry
     * @throws AliasDefinitionException if the document cannot be read or names unknown families or members
     */
    public static AliasRegistry load(InputStream source) {
        Objects.requireNonNull(source, "Alias source cannot be null");

        JsonNode root;
        try {
            root = new ObjectMapper().readTree(source);
        } catch (IOException e) {
            throw new AliasDefinitionException("Unable to read alias document", e);
        }
        if (root == null || !root.isObject()) {
            throw new AliasDefinitionException("Alias document must be a JSON object keyed by family");
        }

        Builder builder = builder();
        Iterator<Map.Entry<String, JsonNode>> families = root.fields();
        while (families.hasNext()) {
            Map.Entry<String, JsonNode> familyEntry = families.next();
            AliasFamily family = AliasFamily.fromKey(familyEntry.getKey())
                    .orElseThrow(() -> new AliasDefinitionException("Unknown alias family '" + familyEntry.getKey() + "'"));

            Iterator<Map.Entry<String, JsonNode>> members = familyEntry.getValue().fields();
            while (members.hasNext()) {
                Map.Entry<String, JsonNode> memberEntry = members.next();
                Enum<?> member = memberOf(family, memberEntry.getKey());
                if (!memberEntry.getValue().isArray()) {
                    throw new AliasDefinitionException(String.format(
                            "Aliases of %s.%s must be a JSON array", family.key(), memberEntry.getKey()));
                }
                for (JsonNode alias : memberEntry.getValue()) {
                    builder.alias(member, alias.asText());
                }
            }
        }
        return builder.build();
    }

    /**
     * @return a builder seeded with the canonical name of every member
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves {@code text} to a member of the family whose canonical type is {@code type}.
     *
     * @param type the enum type of the family
     * @param text free-form text
     * @param <E>  the enum type
     * @return the matching member
     * @throws UnknownAliasException if nothing in the family matches
     */
    public <E extends Enum<E>> E resolve(Class<E> type, String text) {
        return tryResolve(type, text)
                .orElseThrow(() -> new UnknownAliasException(AliasFamily.of(type), text));
    }

    /**
     * Same as {@link #resolve(Class, String)} but reports failure as an empty result.
     *
     * @param type the enum type of the family
     * @param text free-form text, may be {@code null}
     * @param <E>  the enum type
     * @return the matching member, or empty
     */
    public <E extends Enum<E>> Optional<E> tryResolve(Class<E> type, String text) {
        if (text == null) return Optional.empty();
        Enum<?> member = lookup.get(AliasFamily.of(type)).get(normalize(text));
        return Optional.ofNullable(member).map(type::cast);
    }

    /**
     * Returns every spelling that resolves to {@code member}, canonical name included.
     *
     * @param member a family member
     * @return the lowercase aliases in natural order
     */
    public Set<String> aliasesOf(Enum<?> member) {
        return aliases.getOrDefault(member, Collections.emptySortedSet());
    }

    /**
     * Renders all members of a family with their aliases, e.g.
     * {@code MALE (aliases: MALE, m, man); FEMALE (aliases: FEMALE, f, woman)}.
     *
     * @param family the family to describe
     * @return a single-line description
     */
    public String describe(AliasFamily family) {
        return Arrays.stream(family.members())
                .map(member -> {
                    List<String> spellings = new ArrayList<>();
                    spellings.add(member.name());
                    aliasesOf(member).stream()
                            .filter(alias -> !alias.equals(normalize(member.name())))
                            .forEach(spellings::add);
                    return member.name() + " (aliases: " + String.join(", ", spellings) + ")";
                })
                .collect(Collectors.joining("; "));
    }

    /**
     * @param type the enum type of a family
     * @return see {@link #describe(AliasFamily)}
     */
    public String describe(Class<? extends Enum<?>> type) {
        return describe(AliasFamily.of(type));
    }

    static String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }

    private static Enum<?> memberOf(AliasFamily family, String name) {
        for (Enum<?> member : family.members()) {
            if (member.name().equals(name)) return member;
        }
        throw new AliasDefinitionException(String.format(
                "Family '%s' has no member '%s'", family.key(), name));
    }

    /**
     * Accumulates aliases before freezing them into an {@link AliasRegistry}.
     */
    public static final class Builder {
        private final Map<AliasFamily, Map<String, Enum<?>>> lookup = new EnumMap<>(AliasFamily.class);
        private final Map<Enum<?>, SortedSet<String>> aliases = new HashMap<>();

        private Builder() {
            for (AliasFamily family : AliasFamily.values()) {
                lookup.put(family, new HashMap<>());
                for (Enum<?> member : family.members()) {
                    register(family, member, member.name());
                }
            }
            // the filter grammar emits these symbols as COMPARISON tokens
            for (Comparison comparison : Comparison.values()) {
                register(AliasFamily.COMPARISON, comparison, comparison.getSymbol());
            }
        }

        /**
         * Adds spellings for a member.
         *
         * @param member      a member of one of the families
         * @param spellings   additional aliases, matched case-insensitively
         * @return this builder
         * @throws AliasDefinitionException if a spelling already resolves to another member of the family
         */
        public Builder alias(Enum<?> member, String... spellings) {
            Objects.requireNonNull(member, "member");
            AliasFamily family = AliasFamily.of(member.getDeclaringClass());
            for (String spelling : spellings) {
                if (spelling == null || spelling.isBlank()) {
                    throw new AliasDefinitionException("Blank alias for " + family.key() + "." + member.name());
                }
                register(family, member, spelling);
            }
            return this;
        }

        private void register(AliasFamily family, Enum<?> member, String spelling) {
            String key = normalize(spelling);
            Enum<?> previous = lookup.get(family).putIfAbsent(key, member);
            if (previous != null && previous != member) {
                throw new AliasDefinitionException(String.format(
                        "Alias '%s' of %s.%s already resolves to %s",
                        spelling, family.key(), member.name(), previous.name()));
            }
            aliases.computeIfAbsent(member, m -> new TreeSet<>()).add(key);
        }

        public AliasRegistry build() {
            Map<AliasFamily, Map<String, Enum<?>>> frozenLookup = new EnumMap<>(AliasFamily.class);
            lookup.forEach((family, table) -> frozenLookup.put(family, Map.copyOf(table)));

            Map<Enum<?>, SortedSet<String>> frozenAliases = new HashMap<>();
            aliases.forEach((member, set) -> frozenAliases.put(member, Collections.unmodifiableSortedSet(new TreeSet<>(set))));

            log.fine(() -> String.format("Alias registry built: %d spellings across %d families",
                    frozenLookup.values().stream().mapToInt(Map::size).sum(), frozenLookup.size()));

            return new AliasRegistry(Collections.unmodifiableMap(frozenLookup), Collections.unmodifiableMap(frozenAliases));
        }
    }

    private static final class DefaultHolder {
        static final AliasRegistry INSTANCE = loadDefault();

        private static AliasRegistry loadDefault() {
            try (InputStream in = AliasRegistry.class.getResourceAsStream("/" + DEFAULT_RESOURCE)) {
                if (in == null) {
                    throw new AliasDefinitionException("Bundled alias document not found: " + DEFAULT_RESOURCE);
                }
                return load(in);
            } catch (IOException e) {
                throw new AliasDefinitionException("Unable to close bundled alias document", e);
            }
        }
    }
}
