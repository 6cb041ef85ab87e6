package com.ryuqq.canonical.core.model;

import com.ryuqq.canonical.core.spi.CaseFolder;
import com.ryuqq.canonical.core.spi.Normalizer;

/**
 * CanonicalString 생성 파이프라인.
 *
 * <p>원시 텍스트를 정규형(NFC)으로 변환하여 {@link CanonicalString}을 만드는
 * 유일한 진입점입니다. 생성과 연결(concat) 모두 동일한 파이프라인을 거칩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 입력 검증 (null, 짝 없는 서로게이트)
 * 2. PATH 계열: separator → canonicalSeparator 치환
 * 3. CASELESS 계열: normalize → fold → normalize (fast path 없음)
 *    그 외: isNormalized이면 그대로 사용, 아니면 normalize
 *           (치환이 일어났거나 fast path가 꺼져 있으면 항상 normalize)
 * 4. CanonicalString 생성
 * </pre>
 *
 * <p><strong>폴딩 순서:</strong> 폴딩 결과가 다시 비정규형일 수 있으므로
 * fold 뒤의 normalize는 생략할 수 없습니다. fold 앞의 normalize는 폴딩 테이블이
 * 합성형 문자 기준으로 정의되어 있기 때문에 필요합니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 불변 객체입니다. Normalizer/CaseFolder 구현이
 * 스레드 안전하면 여러 스레드에서 공유할 수 있습니다.</p>
 *
 * @author Canonical String Team
 * @since 1.0.0
 */
public final class Canonicalizer {

    private final Normalizer normalizer;
    private final CaseFolder caseFolder;
    private final CanonicalizerConfig config;

    /**
     * 기본 설정으로 생성.
     *
     * @param normalizer NFC 정규화기
     * @param caseFolder 케이스 폴딩기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Canonicalizer(Normalizer normalizer, CaseFolder caseFolder) {
        this(normalizer, caseFolder, new CanonicalizerConfig());
    }

    /**
     * 생성자.
     *
     * @param normalizer NFC 정규화기
     * @param caseFolder 케이스 폴딩기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public Canonicalizer(Normalizer normalizer, CaseFolder caseFolder, CanonicalizerConfig config) {
        if (normalizer == null) {
            throw new IllegalArgumentException("normalizer cannot be null");
        }
        if (caseFolder == null) {
            throw new IllegalArgumentException("caseFolder cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.normalizer = normalizer;
        this.caseFolder = caseFolder;
        this.config = config;
    }

    /**
     * 정규화된 문자열 생성 (대소문자 구분).
     *
     * @param text 원시 텍스트
     * @return CanonicalString
     * @throws IllegalArgumentException text가 null이거나 잘못된 UTF-16인 경우
     */
    public CanonicalString fromText(CharSequence text) {
        return create(text, CanonicalForm.TEXT);
    }

    /**
     * 정규화된 caseless 문자열 생성.
     *
     * @param text 원시 텍스트
     * @return CanonicalString
     * @throws IllegalArgumentException text가 null이거나 잘못된 UTF-16인 경우
     */
    public CanonicalString fromCaselessText(CharSequence text) {
        return create(text, CanonicalForm.CASELESS_TEXT);
    }

    /**
     * 정규화된 경로 문자열 생성. '\'를 '/'로 바꿉니다.
     *
     * @param text 원시 경로
     * @return CanonicalString
     * @throws IllegalArgumentException text가 null이거나 잘못된 UTF-16인 경우
     */
    public CanonicalString fromPath(CharSequence text) {
        return create(text, CanonicalForm.PATH);
    }

    /**
     * 정규화된 caseless 경로 문자열 생성. '\'를 '/'로 바꿉니다.
     *
     * @param text 원시 경로
     * @return CanonicalString
     * @throws IllegalArgumentException text가 null이거나 잘못된 UTF-16인 경우
     */
    public CanonicalString fromCaselessPath(CharSequence text) {
        return create(text, CanonicalForm.CASELESS_PATH);
    }

    /**
     * 지정한 정책으로 CanonicalString 생성.
     *
     * @param text 원시 텍스트
     * @param form 생성 정책
     * @return CanonicalString
     * @throws IllegalArgumentException text 또는 form이 null이거나 text가 잘못된 UTF-16인 경우
     * @throws IllegalStateException Normalizer/CaseFolder가 null을 반환한 경우
     */
    public CanonicalString create(CharSequence text, CanonicalForm form) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (form == null) {
            throw new IllegalArgumentException("form cannot be null");
        }
        String input = text.toString();
        requireWellFormed(input);
        return new CanonicalString(canonicalize(input, form), form, this);
    }

    /**
     * 정규화된 문자열 뒤에 원시 텍스트를 이어 붙입니다.
     *
     * <p>두 부분을 각각 정규화하지 않고, 이어 붙인 전체 시퀀스에 대해
     * {@code base}의 정책으로 파이프라인을 다시 실행합니다.
     * 경계에서 기저 문자와 결합 문자가 합성될 수 있기 때문입니다.</p>
     *
     * @param base 앞부분 (변경되지 않음)
     * @param other 뒷부분 원시 텍스트 (정규형이 아니어도 됨)
     * @return 새 CanonicalString
     * @throws IllegalArgumentException 인자가 null이거나 other가 잘못된 UTF-16인 경우
     */
    public CanonicalString concat(CanonicalString base, CharSequence other) {
        if (base == null) {
            throw new IllegalArgumentException("base cannot be null");
        }
        if (other == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        String tail = other.toString();
        if (tail.isEmpty()) {
            return base;
        }
        // 앞부분은 이미 검증됨. 경계의 서로게이트 쌍은 양쪽이 각각 온전하므로 깨지지 않음
        requireWellFormed(tail);
        CanonicalForm form = base.form();
        return new CanonicalString(canonicalize(base.asText() + tail, form), form, this);
    }

    /**
     * 설정 조회.
     *
     * @return 설정
     */
    public CanonicalizerConfig getConfig() {
        return config;
    }

    private String canonicalize(String input, CanonicalForm form) {
        boolean rewritten = false;
        if (form.rewritesSeparators() && input.indexOf(config.separator()) >= 0) {
            input = input.replace(config.separator(), config.canonicalSeparator());
            rewritten = true;
        }

        if (form.foldsCase()) {
            return normalize(fold(normalize(input)));
        }
        // 구분자 치환이 일어난 입력은 fast path 대상이 아님
        if (config.fastPathEnabled() && !rewritten && normalizer.isNormalized(input)) {
            return input;
        }
        return normalize(input);
    }

    private String normalize(String text) {
        String result = normalizer.normalize(text);
        if (result == null) {
            throw new IllegalStateException(
                "Normalizer returned null: " + normalizer.getClass().getName()
            );
        }
        return result;
    }

    private String fold(String text) {
        String result = caseFolder.fold(text);
        if (result == null) {
            throw new IllegalStateException(
                "CaseFolder returned null: " + caseFolder.getClass().getName()
            );
        }
        return result;
    }

    private static void requireWellFormed(String text) {
        int length = text.length();
        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 < length && Character.isLowSurrogate(text.charAt(i + 1))) {
                    i++;
                    continue;
                }
                throw new IllegalArgumentException(
                    "text contains an unpaired high surrogate at index " + i
                );
            }
            if (Character.isLowSurrogate(c)) {
                throw new IllegalArgumentException(
                    "text contains an unpaired low surrogate at index " + i
                );
            }
        }
    }
}
