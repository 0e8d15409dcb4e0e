package bsp.indexer.extract;

/**
 * Turns the text of one file into facts. Implementations keep no per-call state in fields,
 * so a single instance is shared by all parse workers.
 */
public interface FactExtractor {

    ExtractedFacts extract(String content);
}
