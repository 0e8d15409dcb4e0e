package bsp.indexer.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import bsp.indexer.model.IncludeFact;
import bsp.indexer.model.IncludeKind;
import bsp.indexer.model.SymbolFact;
import bsp.indexer.model.SymbolKind;
import bsp.indexer.model.Values;

/**
 * C headers: #define macros and #include edges.
 */
public final class HeaderExtractor implements FactExtractor {

    private static final Pattern DEFINE = Pattern.compile("^#define\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*(.*)");

    static final Pattern INCLUDE = Pattern.compile("^#include\\s*[<\"]([^>\"]+)[>\"]");

    private final int valueLimit;

    public HeaderExtractor() {
        this(Values.SYMBOL_VALUE_LIMIT);
    }

    public HeaderExtractor(int valueLimit) {
        this.valueLimit = valueLimit;
    }

    @Override
    public ExtractedFacts extract(String content) {
        final List<SymbolFact> symbols = new ArrayList<>();
        final List<IncludeFact> includes = new ArrayList<>();

        final String[] lines = content.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            final int lineNum = i + 1;
            final String stripped = lines[i].trim();
            if (!stripped.startsWith("#")) {
                continue;
            }

            final Matcher def = DEFINE.matcher(stripped);
            if (def.find()) {
                symbols.add(new SymbolFact(
                        def.group(1),
                        Values.truncate(def.group(2), valueLimit),
                        SymbolKind.DEFINE,
                        lineNum));
                continue;
            }

            final Matcher inc = INCLUDE.matcher(stripped);
            if (inc.find()) {
                includes.add(new IncludeFact(inc.group(1), IncludeKind.PREPROCESSOR_INCLUDE, lineNum));
            }
        }

        return new ExtractedFacts(symbols, includes, List.of(), List.of());
    }
}
