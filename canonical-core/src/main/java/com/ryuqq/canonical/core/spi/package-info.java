/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the text transforms the core consumes as black boxes.
 * Adapter modules provide concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.canonical.core.spi.Normalizer} - NFC composition and the fast-path oracle</li>
 *   <li>{@link com.ryuqq.canonical.core.spi.CaseFolder} - Default (locale-independent) case folding</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., canonical-adapter-icu) are responsible for providing
 * concrete implementations of these SPIs. The {@code noop} sub-package holds
 * identity implementations for wiring a pipeline stage out.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on any Unicode library</li>
 *   <li><strong>Pluggability:</strong> Fake transforms for tests, ICU4J for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Canonical String Team
 */
package com.ryuqq.canonical.core.spi;
