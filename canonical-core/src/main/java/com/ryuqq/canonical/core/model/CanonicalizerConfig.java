package com.ryuqq.canonical.core.model;

/**
 * Canonicalizer 설정 (불변 record).
 *
 * <p>이 record는 Canonicalizer의 동작을 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>fastPathEnabled: isNormalized 검사로 정규화를 생략할지 여부 (기본 true)</li>
 *   <li>separator: 경로에서 치환할 구분자 (기본 '\')</li>
 *   <li>canonicalSeparator: 치환 결과 구분자 (기본 '/')</li>
 * </ul>
 *
 * <p>fast path는 최적화일 뿐이며, 켜고 끄는 것과 관계없이 결과는 동일해야 합니다.
 * 테스트에서 두 분기를 모두 검증할 때 fastPathEnabled=false를 사용합니다.</p>
 *
 * @author Canonical String Team
 * @since 1.0.0
 * @param fastPathEnabled fast path 사용 여부
 * @param separator 치환 대상 구분자 (서로게이트 불가)
 * @param canonicalSeparator 치환 결과 구분자 (서로게이트 불가, separator와 달라야 함)
 */
public record CanonicalizerConfig(boolean fastPathEnabled, char separator, char canonicalSeparator) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: fastPathEnabled=true, separator='\', canonicalSeparator='/'</p>
     */
    public CanonicalizerConfig() {
        this(true, '\\', '/');
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CanonicalizerConfig {
        if (Character.isSurrogate(separator)) {
            throw new IllegalArgumentException(
                "separator must not be a surrogate (current: U+" + hex(separator) + ")"
            );
        }
        if (Character.isSurrogate(canonicalSeparator)) {
            throw new IllegalArgumentException(
                "canonicalSeparator must not be a surrogate (current: U+" + hex(canonicalSeparator) + ")"
            );
        }
        if (separator == canonicalSeparator) {
            throw new IllegalArgumentException(
                "separator and canonicalSeparator must differ (current: U+" + hex(separator) + ")"
            );
        }
    }

    /**
     * fastPathEnabled만 변경한 새 인스턴스 생성.
     *
     * @param fastPathEnabled 새로운 fast path 사용 여부
     * @return 새 CanonicalizerConfig 인스턴스
     */
    public CanonicalizerConfig withFastPathEnabled(boolean fastPathEnabled) {
        return new CanonicalizerConfig(fastPathEnabled, this.separator, this.canonicalSeparator);
    }

    /**
     * 구분자 쌍만 변경한 새 인스턴스 생성.
     *
     * @param separator 새로운 치환 대상 구분자
     * @param canonicalSeparator 새로운 치환 결과 구분자
     * @return 새 CanonicalizerConfig 인스턴스
     */
    public CanonicalizerConfig withSeparators(char separator, char canonicalSeparator) {
        return new CanonicalizerConfig(this.fastPathEnabled, separator, canonicalSeparator);
    }

    private static String hex(char c) {
        return String.format("%04X", (int) c);
    }
}
