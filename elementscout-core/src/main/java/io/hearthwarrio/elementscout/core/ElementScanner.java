package io.hearthwarrio.elementscout.core;

import io.hearthwarrio.elementscout.core.dom.BoundingRect;
import io.hearthwarrio.elementscout.core.dom.DomDocument;
import io.hearthwarrio.elementscout.core.dom.DomElement;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs one extraction pass over a rendered document.
 * <p>
 * Pipeline: discovery, visibility filter, identifier resolution with the relevance gate, then XPath and
 * ancestor context for each survivor. The pass is synchronous and keeps no state between calls, so one
 * scanner may be reused for any number of documents.
 */
public class ElementScanner {

    private final ElementDiscovery discovery;
    private final VisibilityFilter visibilityFilter;
    private final IdentifierResolver identifierResolver;
    private final XPathSynthesizer xPathSynthesizer;
    private final AncestorContextExtractor ancestorContextExtractor;
    private final ElementRecordAssembler assembler;

    public ElementScanner() {
        this(
                new ElementDiscovery(),
                new VisibilityFilter(),
                new IdentifierResolver(),
                new XPathSynthesizer(),
                new AncestorContextExtractor(),
                new ElementRecordAssembler()
        );
    }

    public ElementScanner(
            ElementDiscovery discovery,
            VisibilityFilter visibilityFilter,
            IdentifierResolver identifierResolver,
            XPathSynthesizer xPathSynthesizer,
            AncestorContextExtractor ancestorContextExtractor,
            ElementRecordAssembler assembler
    ) {
        this.discovery = Objects.requireNonNull(discovery, "discovery must not be null");
        this.visibilityFilter = Objects.requireNonNull(visibilityFilter, "visibilityFilter must not be null");
        this.identifierResolver = Objects.requireNonNull(identifierResolver, "identifierResolver must not be null");
        this.xPathSynthesizer = Objects.requireNonNull(xPathSynthesizer, "xPathSynthesizer must not be null");
        this.ancestorContextExtractor = Objects.requireNonNull(ancestorContextExtractor, "ancestorContextExtractor must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
    }

    /**
     * Scans the document.
     * <p>
     * Host failures (for example a document that goes away mid-scan) are not caught.
     *
     * @param document rendered document
     * @return scanned elements in document order with timing
     */
    public ScanResult scan(DomDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        long started = System.nanoTime();

        List<DomElement> candidates = discovery.discover(document);
        List<ScannedElement> out = new ArrayList<>(candidates.size());

        for (DomElement element : candidates) {
            BoundingRect rect = element.boundingRect();
            if (!visibilityFilter.isVisible(element, rect)) {
                continue;
            }

            ElementText text = identifierResolver.resolve(document, element);
            if (!identifierResolver.isMeaningful(element, text)) {
                continue;
            }

            ElementRecord record = assembler.assemble(
                    element,
                    rect,
                    text,
                    ancestorContextExtractor.extract(element),
                    xPathSynthesizer.synthesize(element)
            );
            out.add(new ScannedElement(element, record));
        }

        return new ScanResult(out, Duration.ofNanos(System.nanoTime() - started));
    }

    /**
     * Convenience for callers that only need the records.
     */
    public List<ElementRecord> scanRecords(DomDocument document) {
        return scan(document).getRecords();
    }
}
