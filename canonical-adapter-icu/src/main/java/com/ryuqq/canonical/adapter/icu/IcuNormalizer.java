package com.ryuqq.canonical.adapter.icu;

import com.ibm.icu.text.Normalizer2;
import com.ryuqq.canonical.core.spi.Normalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ICU4J 기반 NFC Normalizer 구현.
 *
 * <p>{@link Normalizer2#getNFCInstance()}를 사용합니다. Normalizer2 인스턴스는
 * 불변이며 스레드 안전하므로 하나의 IcuNormalizer를 여러 스레드에서 공유할 수 있습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>normalize(): Normalizer2.normalize (정준 분해 후 합성)</li>
 *   <li>isNormalized(): Normalizer2.isNormalized (빠른 검사, 오탐 없음)</li>
 * </ul>
 *
 * @author Canonical String Team
 * @since 1.0.0
 */
public final class IcuNormalizer implements Normalizer {

    private static final Logger log = LoggerFactory.getLogger(IcuNormalizer.class);

    private final Normalizer2 nfc;

    /**
     * NFC 인스턴스로 생성.
     */
    public IcuNormalizer() {
        this(Normalizer2.getNFCInstance());
    }

    /**
     * 지정한 Normalizer2로 생성.
     *
     * <p>정준 합성(COMPOSE) 모드 인스턴스여야 합니다.</p>
     *
     * @param nfc NFC Normalizer2
     * @throws IllegalArgumentException nfc가 null인 경우
     */
    public IcuNormalizer(Normalizer2 nfc) {
        if (nfc == null) {
            throw new IllegalArgumentException("nfc cannot be null");
        }
        this.nfc = nfc;
        log.debug("IcuNormalizer created with {}", nfc.getClass().getSimpleName());
    }

    @Override
    public String normalize(CharSequence text) {
        return nfc.normalize(text);
    }

    @Override
    public boolean isNormalized(CharSequence text) {
        return nfc.isNormalized(text);
    }
}
