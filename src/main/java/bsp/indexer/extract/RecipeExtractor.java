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
 * BitBake recipes, appends, include files and configuration files.
 * <p>
 * Per line, first match wins:
 * - variable assignment: NAME (=|?=|??=|+=|?+=|=+|.=|=.|:=) "value"
 * - require/include path
 * - inherit class1 class2 ... (one edge per class, as classes/&lt;name&gt;.bbclass)
 */
public final class RecipeExtractor implements FactExtractor {

    private static final Pattern VARIABLE = Pattern.compile(
            "^([A-Za-z_][A-Za-z0-9_-]*)\\s*(\\?\\?=|\\?\\+?=|\\+=|:=|\\.=|=\\+|=\\.|=)\\s*[\"']?([^\"']*)");

    private static final Pattern REQUIRE_OR_INCLUDE = Pattern.compile(
            "^(require|include)\\s+[\"']?([^\"'\\s]+)");

    private static final Pattern INHERIT = Pattern.compile("^inherit\\s+(.+)");

    private final int valueLimit;

    public RecipeExtractor() {
        this(Values.SYMBOL_VALUE_LIMIT);
    }

    public RecipeExtractor(int valueLimit) {
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
            if (stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }

            final Matcher var = VARIABLE.matcher(stripped);
            if (var.find()) {
                symbols.add(new SymbolFact(
                        var.group(1),
                        Values.truncate(var.group(3), valueLimit),
                        SymbolKind.VARIABLE,
                        lineNum));
                continue;
            }

            final Matcher req = REQUIRE_OR_INCLUDE.matcher(stripped);
            if (req.find()) {
                final IncludeKind kind = "require".equals(req.group(1)) ? IncludeKind.REQUIRE : IncludeKind.INCLUDE;
                includes.add(new IncludeFact(req.group(2), kind, lineNum));
                continue;
            }

            final Matcher inh = INHERIT.matcher(stripped);
            if (inh.find()) {
                for (String cls : inh.group(1).trim().split("\\s+")) {
                    if (!cls.isEmpty()) {
                        includes.add(new IncludeFact("classes/" + cls + ".bbclass", IncludeKind.INHERIT, lineNum));
                    }
                }
            }
        }

        return new ExtractedFacts(symbols, includes, List.of(), List.of());
    }
}
