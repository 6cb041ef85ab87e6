/**
 * Canonical string value type and its construction pipeline.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.canonical.core.model.CanonicalString} - NFC-normalized string, immutable</li>
 *   <li>{@link com.ryuqq.canonical.core.model.CanonicalForm} - Construction policy (separator rewrite x case folding)</li>
 * </ul>
 *
 * <h2>Construction</h2>
 * <ul>
 *   <li>{@link com.ryuqq.canonical.core.model.Canonicalizer} - The only way to create a CanonicalString</li>
 *   <li>{@link com.ryuqq.canonical.core.model.CanonicalizerConfig} - Fast path and separator settings</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Invariant by construction:</strong> the buffer is private and only the pipeline can create instances</li>
 *   <li><strong>Immutability:</strong> concatenation returns a new instance</li>
 *   <li><strong>Normalize once:</strong> equality, hashing and ordering never re-normalize</li>
 *   <li><strong>Pure Java:</strong> No external dependencies (Java 17 only)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Canonical String Team
 */
package com.ryuqq.canonical.core.model;
