package io.accesslog.core.parser;

import io.accesslog.core.error.TemplateSyntaxException;
import io.accesslog.core.model.AccessLogTemplate;
import io.accesslog.core.model.BuiltInDirective;
import io.accesslog.core.model.Direction;
import io.accesslog.core.model.DirectiveKind;
import io.accesslog.core.model.DirectiveSpec;
import io.accesslog.core.model.Segment;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a log format string into an {@link AccessLogTemplate}.
 *
 * <p>
 * Grammar:
 * <ul>
 * <li>{@code %%}: a literal percent sign
 * <li>{@code %X}: built-in directive, X one of {@code t a r M U Q V s b T D}
 * <li>{@code %{NAME}i} / {@code %{NAME}o}: request / response header
 * <li>{@code %{NAME}xi} / {@code %{NAME}xo}: custom request / response tag
 * <li>{@code %{NAME}e}: environment variable
 * <li>{@code %{r}a}: peer (socket) address
 * <li>any directive may be followed immediately by {@code (text)}, a
 * sub-format appended verbatim after the resolved value
 * </ul>
 * Everything else is literal text. NAME is one or more of
 * {@code [A-Za-z0-9_-]}. A sub-format ends at the first {@code )} and is never
 * re-evaluated.
 *
 * <p>
 * Compilation is atomic: either the whole template compiles or a
 * {@link TemplateSyntaxException} is thrown. Thread-safe and stateless; all
 * methods are static.
 */
public final class TemplateParser {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateParser.class);

    /** Valid characters for header, tag and variable names. */
    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_\\-]+$");

    /** Only parameter accepted by {@code %{...}a}. */
    private static final String PEER_ADDRESS_PARAM = "r";

    private TemplateParser() {}

    /**
     * Returns {@code true} if {@code name} can appear between the braces of a
     * {@code %{NAME}} directive.
     */
    public static boolean isValidName(String name) {
        return name != null && NAME_PATTERN.matcher(name).matches();
    }

    /**
     * Compiles a format string.
     *
     * @param template the format string
     * @return the compiled template
     * @throws TemplateSyntaxException if the template is malformed
     */
    public static AccessLogTemplate compile(String template) {
        return compile(template, null);
    }

    /**
     * Compiles a format string and reports custom tags the caller does not
     * know about. An unknown tag still compiles and renders {@code -}; it is
     * only flagged with a WARN log entry.
     *
     * @param template        the format string
     * @param knownCustomTags names with a registered evaluator, or {@code null}
     *                        to skip the check
     * @return the compiled template
     * @throws TemplateSyntaxException if the template is malformed
     */
    public static AccessLogTemplate compile(String template, Set<String> knownCustomTags) {
        Objects.requireNonNull(template, "template must not be null");

        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int length = template.length();
        int i = 0;

        while (i < length) {
            char c = template.charAt(i);
            if (c != '%') {
                literal.append(c);
                i++;
                continue;
            }
            if (i + 1 >= length) {
                throw error("Dangling '%' at end of template", template, i);
            }
            char next = template.charAt(i + 1);
            if (next == '%') {
                literal.append('%');
                i += 2;
                continue;
            }

            int end;
            DirectiveKind kind;
            if (next == '{') {
                int close = template.indexOf('}', i + 2);
                if (close < 0) {
                    throw error("Unterminated '{'", template, i);
                }
                String name = template.substring(i + 2, close);
                if (!isValidName(name)) {
                    throw error("Invalid directive parameter '" + name + "'", template, i);
                }
                if (template.startsWith("xi", close + 1)) {
                    kind = new DirectiveKind.CustomTag(name, Direction.REQUEST);
                    end = close + 3;
                } else if (template.startsWith("xo", close + 1)) {
                    kind = new DirectiveKind.CustomTag(name, Direction.RESPONSE);
                    end = close + 3;
                } else if (close + 1 < length) {
                    kind = parameterized(name, template.charAt(close + 1), template, i);
                    end = close + 2;
                } else {
                    throw error("Missing selector after '%{" + name + "}'", template, i);
                }
            } else {
                BuiltInDirective directive = BuiltInDirective.forKey(next);
                if (directive == null) {
                    throw error("Unknown directive '%" + next + "'", template, i);
                }
                kind = new DirectiveKind.BuiltIn(directive);
                end = i + 2;
            }

            String subFormat = null;
            if (end < length && template.charAt(end) == '(') {
                int closeParen = template.indexOf(')', end + 1);
                if (closeParen < 0) {
                    throw error("Unterminated sub-format '('", template, end);
                }
                subFormat = template.substring(end + 1, closeParen);
                end = closeParen + 1;
            }

            flush(literal, segments);
            segments.add(new Segment.Directive(new DirectiveSpec(kind, subFormat)));
            i = end;
        }
        flush(literal, segments);

        AccessLogTemplate compiled = new AccessLogTemplate(template, segments);
        if (knownCustomTags != null) {
            warnUnknownTags(compiled, knownCustomTags);
        }
        return compiled;
    }

    /** Resolves the single-character selector of a {@code %{NAME}X} directive. */
    private static DirectiveKind parameterized(String name, char selector, String template, int start) {
        return switch (selector) {
            case 'i' -> new DirectiveKind.Header(name, Direction.REQUEST);
            case 'o' -> new DirectiveKind.Header(name, Direction.RESPONSE);
            case 'e' -> new DirectiveKind.Environment(name);
            case 'a' -> {
                if (!PEER_ADDRESS_PARAM.equals(name)) {
                    throw error("Unsupported parameter '" + name + "' for '%{...}a' (only 'r')", template, start);
                }
                yield new DirectiveKind.BuiltIn(BuiltInDirective.PEER_ADDRESS);
            }
            default -> throw error("Unknown selector '" + selector + "' after '%{" + name + "}'", template, start);
        };
    }

    private static void flush(StringBuilder literal, List<Segment> segments) {
        if (literal.length() > 0) {
            segments.add(new Segment.Literal(literal.toString()));
            literal.setLength(0);
        }
    }

    private static void warnUnknownTags(AccessLogTemplate compiled, Set<String> knownCustomTags) {
        for (Direction direction : Direction.values()) {
            for (String tag : compiled.customTags(direction)) {
                if (!knownCustomTags.contains(tag)) {
                    LOG.warn(
                            "Template references custom {} tag '{}' with no registered evaluator; it will render '-'",
                            direction.name().toLowerCase(),
                            tag);
                }
            }
        }
    }

    private static TemplateSyntaxException error(String message, String template, int charIndex) {
        int byteOffset = template.substring(0, charIndex).getBytes(StandardCharsets.UTF_8).length;
        return new TemplateSyntaxException(message, template, byteOffset);
    }
}
