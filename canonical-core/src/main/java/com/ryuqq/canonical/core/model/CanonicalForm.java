package com.ryuqq.canonical.core.model;

/**
 * CanonicalString 생성 정책.
 *
 * <p>네 가지 생성 방식은 하나의 파이프라인에 대한 정책 조합입니다
 * (구분자 치환 여부 × 케이스 폴딩 여부).</p>
 *
 * <p><strong>파이프라인:</strong></p>
 * <pre>
 * TEXT          : [fast path] → NFC
 * CASELESS_TEXT : NFC → fold → NFC
 * PATH          : '\' → '/' → [fast path, 치환 없을 때만] → NFC
 * CASELESS_PATH : '\' → '/' → NFC → fold → NFC
 * </pre>
 *
 * @author Canonical String Team
 * @since 1.0.0
 */
public enum CanonicalForm {

    /**
     * 일반 텍스트 (대소문자 구분).
     */
    TEXT(false, false),

    /**
     * 대소문자 무시 텍스트.
     */
    CASELESS_TEXT(false, true),

    /**
     * 경로 문자열 (대소문자 구분, '\' → '/').
     */
    PATH(true, false),

    /**
     * 대소문자 무시 경로 문자열.
     */
    CASELESS_PATH(true, true);

    private final boolean rewritesSeparators;
    private final boolean foldsCase;

    CanonicalForm(boolean rewritesSeparators, boolean foldsCase) {
        this.rewritesSeparators = rewritesSeparators;
        this.foldsCase = foldsCase;
    }

    /**
     * 경로 구분자 치환 여부.
     *
     * @return PATH, CASELESS_PATH이면 true
     */
    public boolean rewritesSeparators() {
        return rewritesSeparators;
    }

    /**
     * 케이스 폴딩 여부.
     *
     * @return CASELESS_TEXT, CASELESS_PATH이면 true
     */
    public boolean foldsCase() {
        return foldsCase;
    }
}
