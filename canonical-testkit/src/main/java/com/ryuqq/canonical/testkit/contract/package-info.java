/**
 * Reusable contract tests for SPI adapters and the canonical string type.
 *
 * <h2>Contract Tests</h2>
 * <ul>
 *   <li>{@link com.ryuqq.canonical.testkit.contract.AbstractNormalizerContractTest} - NFC normalizer contract</li>
 *   <li>{@link com.ryuqq.canonical.testkit.contract.AbstractCaseFolderContractTest} - Default case folding contract</li>
 *   <li>{@link com.ryuqq.canonical.testkit.contract.AbstractCanonicalStringContractTest} - CanonicalString behaviour over a real adapter pair</li>
 * </ul>
 *
 * <p>Adapter modules extend these classes in their own test sources and supply
 * implementations through the abstract factory methods.</p>
 *
 * @since 1.0.0
 * @author Canonical String Team
 */
package com.ryuqq.canonical.testkit.contract;
