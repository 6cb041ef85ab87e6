package com.ryuqq.canonical.adapter.icu;

import com.ibm.icu.lang.UCharacter;
import com.ryuqq.canonical.core.spi.CaseFolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ICU4J 기반 기본 케이스 폴딩 구현.
 *
 * <p>{@link UCharacter#foldCase(String, int)}를 {@link UCharacter#FOLD_CASE_DEFAULT}로
 * 호출합니다. 전체(full) 폴딩이므로 한 문자가 여러 문자로 늘어날 수 있고
 * (예: U+00DF → "ss"), 로캘과 무관합니다(터키어 dotless i 규칙 미적용).</p>
 *
 * @author Canonical String Team
 * @since 1.0.0
 */
public final class IcuCaseFolder implements CaseFolder {

    private static final Logger log = LoggerFactory.getLogger(IcuCaseFolder.class);

    /**
     * 생성자.
     */
    public IcuCaseFolder() {
        log.debug("IcuCaseFolder created (options: FOLD_CASE_DEFAULT)");
    }

    @Override
    public String fold(CharSequence text) {
        return UCharacter.foldCase(text.toString(), UCharacter.FOLD_CASE_DEFAULT);
    }
}
