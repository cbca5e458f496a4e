package com.runeforge.rules.compiler;

import com.runeforge.rules.api.IRuleElementParser;
import com.runeforge.rules.api.element.RuleElementKind;
import com.runeforge.rules.api.model.RuleSource;
import com.runeforge.rules.infra.metrics.MetricsRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads rule sources from a JSON file, or from every {@code *.json} file of a directory in
 * file name order.
 */
public class RuleSourceLoader {
    private static final Logger logger = Logger.getLogger(RuleSourceLoader.class.getName());

    private final IRuleElementParser parser;
    private final Tracer tracer;
    private final MetricsRegistry metrics;

    public RuleSourceLoader(Tracer tracer) {
        this(new RuleElementParser(), tracer, MetricsRegistry.getInstance());
    }

    public RuleSourceLoader(IRuleElementParser parser, Tracer tracer, MetricsRegistry metrics) {
        this.parser = parser;
        this.tracer = tracer;
        this.metrics = metrics;
    }

    /**
     * @throws IOException        if a file cannot be read
     * @throws RuleParseException if a file is not valid rule content
     */
    public List<RuleSource> load(Path path) throws IOException {
        Span span = tracer.spanBuilder("load-rule-sources").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("path", path.toString());
            long startTime = System.nanoTime();

            List<RuleSource> sources = new ArrayList<>();
            for (Path file : files(path)) {
                sources.addAll(parser.parseSources(file));
            }

            int elementCount = sources.stream().mapToInt(source -> source.elements().size()).sum();
            long unrecognized = sources.stream()
                    .flatMap(source -> source.elements().stream())
                    .filter(element -> element.kind() == RuleElementKind.UNRECOGNIZED)
                    .count();
            span.setAttribute("sourceCount", sources.size());
            span.setAttribute("elementCount", elementCount);
            span.setAttribute("unrecognizedCount", unrecognized);
            metrics.counter("rule_sources_loaded").increment(sources.size());

            logger.info(String.format("Loaded %d rule sources (%d elements, %d unrecognized) from %s in %d ms",
                    sources.size(), elementCount, unrecognized, path,
                    (System.nanoTime() - startTime) / 1_000_000));
            return sources;
        } catch (IOException | RuleParseException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static List<Path> files(Path path) throws IOException {
        if (!Files.isDirectory(path)) {
            return List.of(path);
        }
        try (Stream<Path> listing = Files.list(path)) {
            return listing
                    .filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
