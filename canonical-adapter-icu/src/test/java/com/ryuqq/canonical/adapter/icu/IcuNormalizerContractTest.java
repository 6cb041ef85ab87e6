package com.ryuqq.canonical.adapter.icu;

import com.ryuqq.canonical.core.spi.Normalizer;
import com.ryuqq.canonical.testkit.contract.AbstractNormalizerContractTest;

/**
 * IcuNormalizer Normalizer 계약 테스트.
 *
 * @author Canonical String Team
 * @since 1.0.0
 */
class IcuNormalizerContractTest extends AbstractNormalizerContractTest {

    @Override
    protected Normalizer createNormalizer() {
        return new IcuNormalizer();
    }
}
