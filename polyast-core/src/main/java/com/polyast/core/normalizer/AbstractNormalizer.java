package com.polyast.core.normalizer;

import com.polyast.core.ast.Location;
import com.polyast.core.ast.Token;
import com.polyast.core.lang.Language;
import com.polyast.core.lang.LineIndex;
import com.polyast.core.lang.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Abstract base class for normalizers providing token construction and logging.
 *
 * <p>This class reduces code duplication across normalizer implementations by providing:
 * <ul>
 *   <li>Logger initialization (one logger per normalizer class)</li>
 *   <li>Token helpers that fill in whichever of line/column or offset the collaborator
 *       does not report ({@link #token(String, int, int)}, {@link #tokenAt(String, int)})</li>
 *   <li>Escape-hatch logging ({@link #logFallback(String, Object)})</li>
 * </ul>
 *
 * @param <T> root type of the collaborator tree
 * @since 1.0.0
 */
public abstract class AbstractNormalizer<T> implements Normalizer<T> {

    /**
     * Logger instance for this normalizer.
     * Automatically initialized with the concrete normalizer class name.
     */
    protected final Logger log;

    protected final SourceFile sourceFile;

    private final Language language;
    private final Class<T> astType;
    private final LineIndex lineIndex;

    protected AbstractNormalizer(Language language, Class<T> astType, SourceFile sourceFile) {
        this.log = LoggerFactory.getLogger(getClass());
        this.language = Objects.requireNonNull(language, "language must not be null");
        this.astType = Objects.requireNonNull(astType, "astType must not be null");
        this.sourceFile = Objects.requireNonNull(sourceFile, "sourceFile must not be null");
        this.lineIndex = sourceFile.lineIndex();
    }

    @Override
    public Language language() {
        return language;
    }

    @Override
    public Class<T> astType() {
        return astType;
    }

    // ==================== Token Utilities ====================

    /**
     * Builds a location from a 1-based line and column.
     */
    protected Location location(int line, int column) {
        return new Location(sourceFile.path(), line, column, lineIndex.offsetOf(line, column));
    }

    /**
     * Builds a location from a 0-based character offset.
     */
    protected Location locationAt(int offset) {
        return new Location(sourceFile.path(), lineIndex.lineOf(offset), lineIndex.columnOf(offset), offset);
    }

    protected Token token(String text, int line, int column) {
        return Token.of(text, location(line, column));
    }

    protected Token tokenAt(String text, int offset) {
        return Token.of(text, locationAt(offset));
    }

    // ==================== Logging Utilities ====================

    /**
     * Records that a collaborator node had no dedicated generic form and went into an
     * {@code Other*} escape hatch.
     *
     * @param category generic category the node was translated to (e.g. "expr")
     * @param node collaborator node
     */
    protected void logFallback(String category, Object node) {
        if (log.isDebugEnabled()) {
            log.debug("{}: no generic {} form for {}, using escape hatch",
                sourceFile.path(), category, node.getClass().getSimpleName());
        }
    }
}
