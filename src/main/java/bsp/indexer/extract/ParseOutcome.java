package bsp.indexer.extract;

import java.util.Objects;

import bsp.indexer.model.FileFacts;
import bsp.indexer.scan.SourceFile;

/**
 * Result of parsing one file: either its facts or the reason it was skipped.
 */
public record ParseOutcome(
        SourceFile source,
        FileFacts facts,      // null when skipped
        String skipReason     // null when parsed
) {
    public ParseOutcome {
        Objects.requireNonNull(source, "source");
        if ((facts == null) == (skipReason == null)) {
            throw new IllegalArgumentException("exactly one of facts and skipReason must be set");
        }
    }

    public static ParseOutcome parsed(SourceFile source, FileFacts facts) {
        return new ParseOutcome(source, Objects.requireNonNull(facts, "facts"), null);
    }

    public static ParseOutcome skipped(SourceFile source, String reason) {
        return new ParseOutcome(source, null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isParsed() {
        return facts != null;
    }
}
