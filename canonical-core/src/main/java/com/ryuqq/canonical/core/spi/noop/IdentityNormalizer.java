package com.ryuqq.canonical.core.spi.noop;

import com.ryuqq.canonical.core.spi.Normalizer;

/**
 * Normalizer NoOp 구현.
 *
 * <p>입력을 변경하지 않고 그대로 반환합니다.
 * 정규화가 필요 없는 입력(예: ASCII 전용 식별자)만 다루거나, 테스트에서
 * 정규화 단계를 배제하고자 할 때 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>normalize(): 입력 문자열 그대로 반환</li>
 *   <li>isNormalized(): 항상 true 반환</li>
 * </ul>
 *
 * @author Canonical String Team
 * @since 1.0.0
 */
public final class IdentityNormalizer implements Normalizer {

    @Override
    public String normalize(CharSequence text) {
        return text.toString();
    }

    @Override
    public boolean isNormalized(CharSequence text) {
        return true;
    }
}
