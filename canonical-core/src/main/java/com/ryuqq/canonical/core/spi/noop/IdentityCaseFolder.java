package com.ryuqq.canonical.core.spi.noop;

import com.ryuqq.canonical.core.spi.CaseFolder;

/**
 * CaseFolder NoOp 구현.
 *
 * <p>입력을 변경하지 않고 그대로 반환합니다.
 * caseless 생성자를 사용하지 않는 Canonicalizer를 구성할 때 사용합니다.</p>
 *
 * <p><strong>주의:</strong> 이 구현으로 만든 caseless 문자열은 대소문자를
 * 구분합니다.</p>
 *
 * @author Canonical String Team
 * @since 1.0.0
 */
public final class IdentityCaseFolder implements CaseFolder {

    @Override
    public String fold(CharSequence text) {
        return text.toString();
    }
}
