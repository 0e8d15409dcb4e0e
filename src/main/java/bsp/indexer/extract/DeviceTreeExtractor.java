package bsp.indexer.extract;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import bsp.indexer.model.IncludeFact;
import bsp.indexer.model.IncludeKind;
import bsp.indexer.model.SymbolFact;
import bsp.indexer.model.SymbolKind;
import bsp.indexer.model.TreeNodeFact;
import bsp.indexer.model.TreePropertyFact;
import bsp.indexer.model.Values;

/**
 * Device-tree sources (.dts/.dtsi), scanned line by line with an explicit scope stack.
 * <pre>
 * #include &lt;file&gt;                 include edge
 * [label:] name[@address] &#123;      node open, optionally followed by an inline body
 * &#125; or &#125;;                      scope close, alone on the line apart from comments
 * name [= value];                  property of the innermost open node
 * </pre>
 * Node paths are computed from the open scopes ({@code /soc/i2c}). Override nodes
 * ({@code &label}) keep the literal reference as their path. A node's end line is
 * provisional until its close is seen; the close updates the most recently opened node
 * with the closed path.
 */
public final class DeviceTreeExtractor implements FactExtractor {

    private static final Logger log = LoggerFactory.getLogger(DeviceTreeExtractor.class);

    private static final Pattern NODE_OPEN = Pattern.compile(
            "^(?:(\\w+)\\s*:\\s*)?(\\S+?)(?:@([0-9a-fA-F]+))?\\s*\\{");

    private static final Pattern PROPERTY = Pattern.compile("^([\\w,#-]+)\\s*(?:=\\s*(.+?))?;$");

    private static final Pattern LABEL_REF = Pattern.compile("&(\\w+)");

    private final int symbolValueLimit;
    private final int propertyValueLimit;

    public DeviceTreeExtractor() {
        this(Values.SYMBOL_VALUE_LIMIT, Values.PROPERTY_VALUE_LIMIT);
    }

    public DeviceTreeExtractor(int symbolValueLimit, int propertyValueLimit) {
        this.symbolValueLimit = symbolValueLimit;
        this.propertyValueLimit = propertyValueLimit;
    }

    @Override
    public ExtractedFacts extract(String content) {
        final Scan scan = new Scan();

        final String[] lines = content.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            final int lineNum = i + 1;
            final String stripped = lines[i].trim();
            if (stripped.isEmpty()) {
                continue;
            }

            final Matcher inc = HeaderExtractor.INCLUDE.matcher(stripped);
            if (inc.find()) {
                scan.includes.add(new IncludeFact(inc.group(1), IncludeKind.PREPROCESSOR_INCLUDE, lineNum));
                continue;
            }

            final Matcher open = NODE_OPEN.matcher(stripped);
            if (open.find()) {
                scan.openNode(open.group(1), open.group(2), open.group(3), lineNum);
                scan.inlineBody(stripped.substring(open.end()), lineNum);
                continue;
            }

            final String code = stripComments(stripped);
            if ("};".equals(code) || "}".equals(code)) {
                scan.closeScope(lineNum);
                continue;
            }

            scan.property(stripped, lineNum);
        }

        return scan.toFacts();
    }

    /**
     * Removes block and line comments outside string literals. An unterminated block
     * comment drops the rest of the text.
     */
    static String stripComments(String text) {
        final StringBuilder sb = new StringBuilder(text.length());
        boolean inString = false;
        int i = 0;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (inString) {
                sb.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    sb.append(text.charAt(i + 1));
                    i += 2;
                    continue;
                }
                if (c == '"') {
                    inString = false;
                }
                i++;
                continue;
            }
            if (c == '/' && i + 1 < text.length()) {
                final char next = text.charAt(i + 1);
                if (next == '/') {
                    break;
                }
                if (next == '*') {
                    final int end = text.indexOf("*/", i + 2);
                    if (end < 0) {
                        break;
                    }
                    sb.append(' ');
                    i = end + 2;
                    continue;
                }
            }
            if (c == '"') {
                inString = true;
            }
            sb.append(c);
            i++;
        }
        return sb.toString().trim();
    }

    private static int firstOf(int... positions) {
        int first = -1;
        for (int p : positions) {
            if (p >= 0 && (first < 0 || p < first)) {
                first = p;
            }
        }
        return first;
    }

    // Skips an unparseable braced block starting at 'open', including a trailing ';'.
    private static String skipBlock(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                String rest = text.substring(i + 1).trim();
                if (rest.startsWith(";")) {
                    rest = rest.substring(1).trim();
                }
                return rest;
            }
        }
        return "";
    }

    static String childPath(String currentPath, String name) {
        if (name.startsWith("&")) {
            return name;
        }
        if ("/".equals(name)) {
            return "/";
        }
        if (currentPath == null) {
            return "/" + name;
        }
        return currentPath.endsWith("/") ? currentPath + name : currentPath + "/" + name;
    }

    /**
     * Scope state for one extract call.
     */
    private final class Scan {

        private final Deque<OpenScope> stack = new ArrayDeque<>();
        private String currentPath;

        private final List<NodeDraft> nodes = new ArrayList<>();
        private final List<TreePropertyFact> properties = new ArrayList<>();
        private final List<SymbolFact> symbols = new ArrayList<>();
        private final List<IncludeFact> includes = new ArrayList<>();

        void openNode(String label, String name, String address, int lineNum) {
            final String newPath = childPath(currentPath, name);

            stack.push(new OpenScope(currentPath, lineNum));
            nodes.add(new NodeDraft(newPath, name, label, address, currentPath, lineNum));
            currentPath = newPath;

            if (label != null) {
                symbols.add(new SymbolFact(
                        label,
                        Values.truncate(newPath, symbolValueLimit),
                        SymbolKind.LABEL,
                        lineNum));
            }
        }

        void closeScope(int lineNum) {
            if (stack.isEmpty()) {
                log.debug("Ignoring unmatched close at line {}", lineNum);
                return;
            }
            final OpenScope scope = stack.pop();
            for (int i = nodes.size() - 1; i >= 0; i--) {
                final NodeDraft node = nodes.get(i);
                if (node.path.equals(currentPath)) {
                    node.endLine = lineNum;
                    break;
                }
            }
            currentPath = scope.parentPath();
        }

        /**
         * Handles text after the opening brace, e.g. {@code foo { reg = <1>; };} on one line.
         * Nested nodes on the same line are opened and closed in order; text before a close
         * that is not a complete statement is dropped so the close still applies.
         */
        void inlineBody(String remainder, int lineNum) {
            String rest = stripComments(remainder);
            while (!rest.isEmpty()) {
                if (rest.startsWith("}")) {
                    closeScope(lineNum);
                    rest = rest.substring(1).trim();
                    if (rest.startsWith(";")) {
                        rest = rest.substring(1).trim();
                    }
                    continue;
                }
                final int semi = rest.indexOf(';');
                final int open = rest.indexOf('{');
                final int close = rest.indexOf('}');
                final int next = firstOf(semi, open, close);
                if (next < 0) {
                    // statement continues on the next line
                    return;
                }
                if (next == open) {
                    final Matcher m = NODE_OPEN.matcher(rest);
                    if (m.find() && m.end() == open + 1) {
                        openNode(m.group(1), m.group(2), m.group(3), lineNum);
                        rest = rest.substring(m.end()).trim();
                    } else {
                        rest = skipBlock(rest, open);
                    }
                    continue;
                }
                if (next == close) {
                    rest = rest.substring(close).trim();
                    continue;
                }
                property(rest.substring(0, semi + 1).trim(), lineNum);
                rest = rest.substring(semi + 1).trim();
            }
        }

        void property(String statement, int lineNum) {
            if (currentPath == null) {
                return;
            }
            final Matcher m = PROPERTY.matcher(statement);
            if (!m.matches()) {
                return;
            }
            final String value = m.group(2) != null ? m.group(2) : "";
            properties.add(new TreePropertyFact(
                    currentPath,
                    m.group(1),
                    Values.truncate(value, propertyValueLimit),
                    lineNum));

            final Matcher ref = LABEL_REF.matcher(value);
            while (ref.find()) {
                final String label = ref.group(1);
                symbols.add(new SymbolFact(
                        "&" + label,
                        Values.truncate(label, symbolValueLimit),
                        SymbolKind.LABEL_REFERENCE,
                        lineNum));
            }
        }

        ExtractedFacts toFacts() {
            final List<TreeNodeFact> out = new ArrayList<>(nodes.size());
            for (NodeDraft n : nodes) {
                out.add(new TreeNodeFact(n.path, n.name, n.label, n.address, n.parentPath, n.startLine, n.endLine));
            }
            return new ExtractedFacts(symbols, includes, out, properties);
        }
    }

    private record OpenScope(String parentPath, int lineAtEntry) {
    }

    private static final class NodeDraft {
        final String path;
        final String name;
        final String label;
        final String address;
        final String parentPath;
        final int startLine;
        int endLine;

        NodeDraft(String path, String name, String label, String address, String parentPath, int startLine) {
            this.path = path;
            this.name = name;
            this.label = label;
            this.address = address;
            this.parentPath = parentPath;
            this.startLine = startLine;
            this.endLine = startLine;
        }
    }
}
