package eu.virtualparadox.ragqa.rag.context;

import eu.virtualparadox.ragqa.application.config.ApplicationConfig;
import eu.virtualparadox.ragqa.exception.EmptyContextException;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievedMatch;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Joins retrieved chunks into the context block of the prompt.
 * <p>
 * Each match becomes
 * <pre>
 *     --- [Document: filename] ---
 *     chunk text
 * </pre>
 * and entries are separated by a blank line, in the order given (best match first).
 * The context is limited to {@code maxChunks} entries and {@code maxChars} characters. When a limit
 * is hit the remaining, lower-ranked matches are dropped; a chunk's text is never cut. The best
 * match is always kept.
 */
@Component
public class ContextAssembler {

    static final String DELIMITER = "\n\n";

    private static final String HEADER_PREFIX = "--- [Document: ";
    private static final String HEADER_SUFFIX = "] ---\n";

    /** Longest file name the header has to make room for. */
    public static final int MAX_FILENAME_LENGTH = 255;

    /** Characters an entry adds on top of its chunk text, at most. */
    public static final int MAX_HEADER_LENGTH = HEADER_PREFIX.length() + MAX_FILENAME_LENGTH + HEADER_SUFFIX.length();

    private final int maxChars;
    private final int maxChunks;

    @Autowired
    public ContextAssembler(final ApplicationConfig config) {
        this(config.getContext().getMaxChars(), config.getContext().getMaxChunks());
    }

    public ContextAssembler(final int maxChars, final int maxChunks) {
        if (maxChars <= 0 || maxChunks <= 0) {
            throw new IllegalArgumentException("maxChars and maxChunks must be positive");
        }
        this.maxChars = maxChars;
        this.maxChunks = maxChunks;
    }

    /**
     * @param matches retrieved matches, best first
     * @return the context text and the matches it contains
     * @throws EmptyContextException if {@code matches} is empty
     */
    public AssembledContext assemble(final List<RetrievedMatch> matches) {
        if (matches == null || matches.isEmpty()) {
            throw new EmptyContextException("No retrieved chunk passed the score threshold");
        }

        final StringBuilder sb = new StringBuilder();
        final List<RetrievedMatch> used = new ArrayList<>();
        for (final RetrievedMatch match : matches) {
            if (used.size() == maxChunks) {
                break;
            }
            final String entry = format(match);
            final int projected = sb.length() + (used.isEmpty() ? 0 : DELIMITER.length()) + entry.length();
            if (!used.isEmpty() && projected > maxChars) {
                break;
            }
            if (!used.isEmpty()) {
                sb.append(DELIMITER);
            }
            sb.append(entry);
            used.add(match);
        }
        return new AssembledContext(sb.toString(), used);
    }

    private static String format(final RetrievedMatch match) {
        return HEADER_PREFIX + match.chunk().filename() + HEADER_SUFFIX + match.chunk().text();
    }
}
