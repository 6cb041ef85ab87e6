package com.ryuqq.canonical.core.spi;

/**
 * Default case folding SPI.
 *
 * <p>Maps text to a case-insensitive representation using the Unicode
 * default (full, locale-independent) case folding, e.g. {@code "straße"} →
 * {@code "strasse"}. This is distinct from lower-casing and must not depend on
 * the JVM default locale.</p>
 *
 * <p>The output of folding is not required to be normalized; the
 * {@link com.ryuqq.canonical.core.model.Canonicalizer} always normalizes again
 * after folding.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Deterministic and total, never returns null</li>
 *   <li>Locale-independent</li>
 *   <li>Thread-safe</li>
 * </ul>
 *
 * @author Canonical String Team
 * @since 1.0.0
 */
public interface CaseFolder {

    /**
     * Applies default case folding.
     *
     * @param text well-formed input text
     * @return the case-folded text
     */
    String fold(CharSequence text);
}
