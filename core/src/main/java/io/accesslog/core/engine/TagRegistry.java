package io.accesslog.core.engine;

import io.accesslog.core.error.TagRegistrationException;
import io.accesslog.core.model.BuiltInDirective;
import io.accesslog.core.model.Direction;
import io.accesslog.core.parser.TemplateParser;
import io.accesslog.core.spi.RequestTagEvaluator;
import io.accesslog.core.spi.ResponseTagEvaluator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of the custom tag evaluators available to a template.
 *
 * <p>
 * Request tags ({@code %{NAME}xi}) and response tags ({@code %{NAME}xo}) live
 * in separate namespaces, so the same name may be registered once per
 * direction. Assembled with a {@link Builder} before serving; never mutated
 * afterwards.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class TagRegistry {

    private static final TagRegistry EMPTY = new TagRegistry(Map.of(), Map.of());

    private final Map<String, RequestTagEvaluator> requestTags;
    private final Map<String, ResponseTagEvaluator> responseTags;

    private TagRegistry(
            Map<String, RequestTagEvaluator> requestTags, Map<String, ResponseTagEvaluator> responseTags) {
        this.requestTags = Collections.unmodifiableMap(new LinkedHashMap<>(requestTags));
        this.responseTags = Collections.unmodifiableMap(new LinkedHashMap<>(responseTags));
    }

    /**
     * Creates an empty registry with no custom tags.
     *
     * @return an empty, immutable registry
     */
    public static TagRegistry empty() {
        return EMPTY;
    }

    /**
     * Returns a new {@link Builder} for constructing a registry incrementally.
     *
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a request tag evaluator.
     *
     * @param name the tag name, case-sensitive
     * @return the evaluator, or null if not registered
     */
    public RequestTagEvaluator requestTag(String name) {
        return requestTags.get(name);
    }

    /**
     * Looks up a response tag evaluator.
     *
     * @param name the tag name, case-sensitive
     * @return the evaluator, or null if not registered
     */
    public ResponseTagEvaluator responseTag(String name) {
        return responseTags.get(name);
    }

    /** Registered tag names for one direction, in registration order. */
    public Set<String> tagNames(Direction direction) {
        return direction == Direction.REQUEST ? requestTags.keySet() : responseTags.keySet();
    }

    /** Union of request and response tag names. */
    public Set<String> allTagNames() {
        Set<String> names = new LinkedHashSet<>(requestTags.keySet());
        names.addAll(responseTags.keySet());
        return Collections.unmodifiableSet(names);
    }

    /** Total number of registered evaluators across both directions. */
    public int size() {
        return requestTags.size() + responseTags.size();
    }

    @Override
    public String toString() {
        return "TagRegistry[request=" + requestTags.keySet() + ", response=" + responseTags.keySet() + "]";
    }

    /**
     * Builder for a {@link TagRegistry}. Registering a name a second time
     * replaces the earlier evaluator. {@link #build()} takes a snapshot, so a
     * builder may keep registering after a build without affecting registries
     * it already produced.
     */
    public static final class Builder {

        private final Map<String, RequestTagEvaluator> requestTags = new LinkedHashMap<>();
        private final Map<String, ResponseTagEvaluator> responseTags = new LinkedHashMap<>();

        Builder() {}

        /**
         * Registers an evaluator for {@code %{name}xi}.
         *
         * @param name      tag name, matching {@code [A-Za-z0-9_-]+}
         * @param evaluator evaluator invoked with the request view
         * @return this builder (fluent)
         * @throws TagRegistrationException if the name is invalid or reserved
         */
        public Builder registerRequestTag(String name, RequestTagEvaluator evaluator) {
            validate(name);
            Objects.requireNonNull(evaluator, "evaluator must not be null");
            requestTags.put(name, evaluator);
            return this;
        }

        /**
         * Registers an evaluator for {@code %{name}xo}.
         *
         * @param name      tag name, matching {@code [A-Za-z0-9_-]+}
         * @param evaluator evaluator invoked with the response view
         * @return this builder (fluent)
         * @throws TagRegistrationException if the name is invalid or reserved
         */
        public Builder registerResponseTag(String name, ResponseTagEvaluator evaluator) {
            validate(name);
            Objects.requireNonNull(evaluator, "evaluator must not be null");
            responseTags.put(name, evaluator);
            return this;
        }

        /**
         * Builds an immutable registry from the current registrations.
         *
         * @return a new TagRegistry
         */
        public TagRegistry build() {
            if (requestTags.isEmpty() && responseTags.isEmpty()) {
                return EMPTY;
            }
            return new TagRegistry(requestTags, responseTags);
        }

        private static void validate(String name) {
            if (!TemplateParser.isValidName(name)) {
                throw new TagRegistrationException(
                        "Tag name '" + name + "' is not a valid directive name ([A-Za-z0-9_-]+)", name);
            }
            if (BuiltInDirective.isReservedKey(name)) {
                throw new TagRegistrationException(
                        "Tag name '" + name + "' collides with the built-in directive %" + name, name);
            }
        }
    }
}
