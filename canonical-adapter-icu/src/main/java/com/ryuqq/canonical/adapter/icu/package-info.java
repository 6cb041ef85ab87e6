/**
 * ICU4J adapter for the text transform SPIs.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.canonical.adapter.icu.IcuNormalizer} - NFC via {@code Normalizer2}</li>
 *   <li>{@link com.ryuqq.canonical.adapter.icu.IcuCaseFolder} - Default full case folding via {@code UCharacter.foldCase}</li>
 *   <li>{@link com.ryuqq.canonical.adapter.icu.CanonicalStrings} - Static factory over a shared ICU canonicalizer</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Canonical String Team
 */
package com.ryuqq.canonical.adapter.icu;
