package com.smelldetector.core.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Lookup of {@link SourceParser} implementations by language or file extension.
 *
 * <p>Parsers are discovered once via {@link ServiceLoader} and cached. Discovery order is the
 * order of the {@code META-INF/services} registrations on the classpath.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * Optional<SourceParser> parser = SourceParsers.forFile(Paths.get("app/models.py"));
 * SourceParser python = SourceParsers.forLanguage("python").orElseThrow();
 * }</pre>
 *
 * <p><b>Thread Safety:</b></p>
 * <p>The parser list is initialised lazily under the class lock and is read-only afterwards.</p>
 *
 * @see SourceParser
 * @since 1.0.0
 */
public final class SourceParsers {

    private static final Logger log = LoggerFactory.getLogger(SourceParsers.class);

    private static List<SourceParser> parsers;

    private SourceParsers() {
        // Utility class - no instantiation
    }

    /**
     * Returns every registered parser.
     *
     * @return discovered parsers in registration order
     */
    public static synchronized List<SourceParser> all() {
        if (parsers == null) {
            List<SourceParser> discovered = new ArrayList<>();
            ServiceLoader.load(SourceParser.class).forEach(discovered::add);
            log.debug("Discovered {} source parsers", discovered.size());
            parsers = List.copyOf(discovered);
        }
        return parsers;
    }

    /**
     * Finds the parser for a language identifier.
     *
     * @param language language identifier (case-insensitive)
     * @return matching parser, if any
     */
    public static Optional<SourceParser> forLanguage(String language) {
        String wanted = language.toLowerCase(Locale.ROOT);
        return all().stream()
            .filter(parser -> parser.getLanguage().equals(wanted))
            .findFirst();
    }

    /**
     * Finds the parser responsible for a file, based on its extension.
     *
     * @param file source file
     * @return matching parser, if any
     */
    public static Optional<SourceParser> forFile(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return all().stream()
            .filter(parser -> parser.getFileExtensions().contains(extension))
            .findFirst();
    }

    /**
     * Clears the discovery cache (useful for testing).
     */
    static synchronized void clearCache() {
        parsers = null;
        log.debug("Source parser cache cleared");
    }
}
