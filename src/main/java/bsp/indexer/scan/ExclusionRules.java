package bsp.indexer.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * fnmatch-style directory exclusion. {@code *} matches any run of characters including
 * {@code /}, {@code ?} matches exactly one character.
 * <p>
 * Directories are tested as {@code "/" + relativePath + "/"}, so the pattern written for
 * {@code .git} prunes the {@code .git} directory itself and not only its children.
 */
public final class ExclusionRules {

    private final List<String> globs;
    private final List<Pattern> patterns;

    public ExclusionRules(List<String> globs) {
        this.globs = List.copyOf(Objects.requireNonNull(globs, "globs"));
        final List<Pattern> compiled = new ArrayList<>(this.globs.size());
        for (String glob : this.globs) {
            compiled.add(toRegex(glob));
        }
        this.patterns = List.copyOf(compiled);
    }

    public List<String> globs() {
        return globs;
    }

    /**
     * @param relativeDir directory path relative to the project root, '/' separated;
     *                    empty for the root itself
     */
    public boolean isExcludedDirectory(String relativeDir) {
        if (relativeDir == null || relativeDir.isEmpty()) {
            return false;
        }
        final String probe = "/" + relativeDir + "/";
        for (Pattern p : patterns) {
            if (p.matcher(probe).matches()) {
                return true;
            }
        }
        return false;
    }

    static Pattern toRegex(String glob) {
        final StringBuilder sb = new StringBuilder(glob.length() + 8);
        for (int i = 0; i < glob.length(); i++) {
            final char c = glob.charAt(i);
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                default -> sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(sb.toString(), Pattern.DOTALL);
    }
}
