package com.ryuqq.canonical.adapter.icu;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.util.VersionInfo;
import com.ryuqq.canonical.core.model.CanonicalString;
import com.ryuqq.canonical.core.model.Canonicalizer;
import com.ryuqq.canonical.core.model.CanonicalizerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ICU4J 기본 구성의 CanonicalString 정적 팩토리.
 *
 * <p>Canonicalizer를 직접 구성하지 않고 바로 CanonicalString을 만들 때 사용합니다.
 * 기본 Canonicalizer는 첫 사용 시점에 한 번만 초기화됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * CanonicalString key = CanonicalStrings.caseless(userInput);
 * CanonicalString path = CanonicalStrings.path("dir\\file.txt");   // "dir/file.txt"
 * </pre>
 *
 * @author Canonical String Team
 * @since 1.0.0
 */
public final class CanonicalStrings {

    private static final Logger log = LoggerFactory.getLogger(CanonicalStrings.class);

    private CanonicalStrings() {
    }

    /**
     * 기본 Canonicalizer 조회 (ICU4J NFC + 기본 케이스 폴딩, 기본 설정).
     *
     * @return 공유 Canonicalizer
     */
    public static Canonicalizer defaultCanonicalizer() {
        return Holder.INSTANCE;
    }

    /**
     * ICU4J 구성의 새 Canonicalizer 생성.
     *
     * @param config 설정
     * @return 새 Canonicalizer
     * @throws IllegalArgumentException config가 null인 경우
     */
    public static Canonicalizer newCanonicalizer(CanonicalizerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        log.info("Initializing ICU canonicalizer (ICU {}, Unicode {}, fastPath={})",
            VersionInfo.ICU_VERSION, UCharacter.getUnicodeVersion(), config.fastPathEnabled());
        return new Canonicalizer(new IcuNormalizer(), new IcuCaseFolder(), config);
    }

    /**
     * 정규화된 문자열 생성.
     *
     * @param text 원시 텍스트
     * @return CanonicalString
     */
    public static CanonicalString of(CharSequence text) {
        return defaultCanonicalizer().fromText(text);
    }

    /**
     * 정규화된 caseless 문자열 생성.
     *
     * @param text 원시 텍스트
     * @return CanonicalString
     */
    public static CanonicalString caseless(CharSequence text) {
        return defaultCanonicalizer().fromCaselessText(text);
    }

    /**
     * 정규화된 경로 문자열 생성.
     *
     * @param text 원시 경로
     * @return CanonicalString
     */
    public static CanonicalString path(CharSequence text) {
        return defaultCanonicalizer().fromPath(text);
    }

    /**
     * 정규화된 caseless 경로 문자열 생성.
     *
     * @param text 원시 경로
     * @return CanonicalString
     */
    public static CanonicalString caselessPath(CharSequence text) {
        return defaultCanonicalizer().fromCaselessPath(text);
    }

    private static final class Holder {
        private static final Canonicalizer INSTANCE = newCanonicalizer(new CanonicalizerConfig());
    }
}
