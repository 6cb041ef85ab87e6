package com.ryuqq.canonical.core.spi;

/**
 * Canonical composition SPI (Unicode Normalization Form C).
 *
 * <p>This interface abstracts the canonical decomposition/composition engine
 * consumed by {@link com.ryuqq.canonical.core.model.Canonicalizer}. The engine
 * itself is out of scope for the core; adapters (e.g. canonical-adapter-icu)
 * provide concrete implementations.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>Deterministic: the same input always yields the same output</li>
 *   <li>Total: defined for every well-formed input, never returns null</li>
 *   <li>Consistent: {@code isNormalized(x) == normalize(x).contentEquals(x)}</li>
 *   <li>Idempotent: {@code normalize(normalize(x)).equals(normalize(x))}</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: methods may be called concurrently on independent inputs</li>
 *   <li>Stateless: no cross-call ordering requirement</li>
 * </ul>
 *
 * @author Canonical String Team
 * @since 1.0.0
 */
public interface Normalizer {

    /**
     * Transforms text into canonical composed form.
     *
     * @param text well-formed input text
     * @return the NFC form of {@code text}
     */
    String normalize(CharSequence text);

    /**
     * Tests whether text is already in canonical composed form.
     *
     * <p>Used as a cheap oracle to skip {@link #normalize(CharSequence)}.
     * Returning {@code false} for normalized input is allowed (the caller
     * then normalizes anyway); returning {@code true} for non-normalized
     * input is a contract violation.</p>
     *
     * @param text well-formed input text
     * @return true if {@code normalize(text)} would return {@code text} unchanged
     */
    boolean isNormalized(CharSequence text);
}
