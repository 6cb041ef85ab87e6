package com.ryuqq.canonical.core.model;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;

/**
 * NFC로 정규화된 유니코드 문자열.
 *
 * <p>내부 버퍼는 항상 정규형(NFC)을 유지합니다. 바이트 구성이 달라도 의미가 같은
 * 두 문자열(예: U+00C7과 U+0043 U+0327)은 같은 버퍼를 가지므로,
 * 비교 시점에 다시 정규화할 필요 없이 equals/hashCode/compareTo가 정준 동치를
 * 따릅니다. 정규화 비용은 생성 시점에 한 번만 지불합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>버퍼는 항상 NFC (Normalizer를 다시 적용해도 변하지 않음)</li>
 *   <li>버퍼는 항상 올바른 UTF-16 (짝 없는 서로게이트 없음)</li>
 *   <li>caseless 정책: 버퍼 = NFC(fold(NFC(원본)))</li>
 * </ul>
 *
 * <p><strong>생성:</strong> {@link Canonicalizer}를 통해서만 생성됩니다.
 * 생성 후 값 변경 불가이며, {@link #concat(CharSequence)}은 새 인스턴스를 반환합니다.</p>
 *
 * <p><strong>정렬:</strong> 정규형 버퍼의 코드 포인트 순서(UTF-8 바이트 순서와 동일)를
 * 사용합니다. 언어학적으로 올바른 유니코드 정렬이 아니며, 로캘별 정렬이 필요한
 * 호출자는 별도의 Collator를 사용해야 합니다.</p>
 *
 * <p><strong>동등성:</strong> 버퍼만 비교합니다. 생성 정책({@link #form()})은
 * equals/hashCode/compareTo에 포함되지 않습니다.</p>
 *
 * @author Canonical String Team
 * @since 1.0.0
 */
public final class CanonicalString implements CharSequence, Comparable<CanonicalString> {

    /**
     * 코드 포인트 순서 비교기. {@link #compareTo(CanonicalString)}와 동일합니다.
     */
    public static final Comparator<CanonicalString> CODE_POINT_ORDER = CanonicalString::compareTo;

    private final String value;
    private final CanonicalForm form;
    private final Canonicalizer canonicalizer;

    CanonicalString(String value, CanonicalForm form, Canonicalizer canonicalizer) {
        this.value = value;
        this.form = form;
        this.canonicalizer = canonicalizer;
    }

    /**
     * 정규형 텍스트 조회.
     *
     * <p>반환값은 이미 NFC입니다. caseless 정책으로 생성한 경우에만 케이스 폴딩되어
     * 있습니다.</p>
     *
     * @return 정규형 텍스트
     */
    public String asText() {
        return value;
    }

    /**
     * 정규형 텍스트의 UTF-8 바이트 조회.
     *
     * <p>매 호출마다 새 배열을 반환합니다. 내용 주소 지정이나 해시 계산 시
     * 원본 바이트가 아닌 이 바이트를 사용해야 합니다.</p>
     *
     * @return UTF-8 바이트 (복사본)
     */
    public byte[] getBytes() {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 정규형 텍스트의 UTF-8 바이트를 읽기 전용 버퍼로 조회.
     *
     * @return 읽기 전용 ByteBuffer
     */
    public ByteBuffer asByteBuffer() {
        return ByteBuffer.wrap(getBytes()).asReadOnlyBuffer();
    }

    /**
     * 생성 정책 조회.
     *
     * @return 이 인스턴스를 만든 정책
     */
    public CanonicalForm form() {
        return form;
    }

    /**
     * 원시 텍스트를 뒤에 이어 붙인 새 인스턴스 생성.
     *
     * <p>이어 붙인 전체 시퀀스를 이 인스턴스의 정책으로 다시 정규화합니다.
     * 예: "a" 뒤에 U+0302(결합 곡절 악센트)를 붙이면 U+00E2 "â"</p>
     *
     * @param other 이어 붙일 텍스트 (정규형이 아니어도 됨)
     * @return 새 CanonicalString
     * @throws IllegalArgumentException other가 null이거나 잘못된 UTF-16인 경우
     */
    public CanonicalString concat(CharSequence other) {
        return canonicalizer.concat(this, other);
    }

    /**
     * 다른 CanonicalString을 뒤에 이어 붙인 새 인스턴스 생성.
     *
     * @param other 이어 붙일 CanonicalString
     * @return 새 CanonicalString (이 인스턴스의 정책을 따름)
     * @throws IllegalArgumentException other가 null인 경우
     */
    public CanonicalString concat(CanonicalString other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return canonicalizer.concat(this, other.value);
    }

    /**
     * 코드 포인트 개수 조회.
     *
     * @return 코드 포인트 개수
     */
    public int codePointCount() {
        return value.codePointCount(0, value.length());
    }

    @Override
    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public int length() {
        return value.length();
    }

    @Override
    public char charAt(int index) {
        return value.charAt(index);
    }

    /**
     * 부분 시퀀스 조회.
     *
     * <p>반환값은 일반 CharSequence이며 정규형이라는 보장이 없습니다.</p>
     */
    @Override
    public CharSequence subSequence(int start, int end) {
        return value.subSequence(start, end);
    }

    /**
     * 코드 포인트 순서로 비교.
     *
     * <p>{@link String#compareTo(String)}(UTF-16 코드 유닛 순서)와 달리
     * 보충 문자(U+10000 이상)가 U+E000~U+FFFF보다 뒤에 옵니다.</p>
     */
    @Override
    public int compareTo(CanonicalString other) {
        String a = this.value;
        String b = other.value;
        int i = 0;
        while (i < a.length() && i < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(i);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
        }
        return Integer.compare(a.length() - i, b.length() - i);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalString that = (CanonicalString) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    /**
     * 정규형 텍스트 그대로 반환합니다.
     */
    @Override
    public String toString() {
        return value;
    }
}
