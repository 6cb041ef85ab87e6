package com.ryuqq.canonical.adapter.icu;

import com.ryuqq.canonical.core.model.CanonicalForm;
import com.ryuqq.canonical.core.model.CanonicalString;
import com.ryuqq.canonical.core.model.Canonicalizer;
import com.ryuqq.canonical.core.model.CanonicalizerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CanonicalStrings 정적 팩토리 테스트.
 *
 * @author Canonical String Team
 * @since 1.0.0
 */
@DisplayName("CanonicalStrings 테스트")
class CanonicalStringsTest {

    @Test
    @DisplayName("네 가지 팩토리 메서드는 각 정책으로 생성한다")
    void 팩토리_메서드_정책() {
        // when
        CanonicalString text = CanonicalStrings.of("C\u0327");
        CanonicalString caseless = CanonicalStrings.caseless("Stra\u00DFe");
        CanonicalString path = CanonicalStrings.path("a\\b");
        CanonicalString caselessPath = CanonicalStrings.caselessPath("A\\B");

        // then
        assertThat(text.asText()).isEqualTo("\u00C7");
        assertThat(text.form()).isEqualTo(CanonicalForm.TEXT);
        assertThat(caseless.asText()).isEqualTo("strasse");
        assertThat(caseless.form()).isEqualTo(CanonicalForm.CASELESS_TEXT);
        assertThat(path.asText()).isEqualTo("a/b");
        assertThat(path.form()).isEqualTo(CanonicalForm.PATH);
        assertThat(caselessPath.asText()).isEqualTo("a/b");
        assertThat(caselessPath.form()).isEqualTo(CanonicalForm.CASELESS_PATH);
    }

    @Test
    @DisplayName("기본 Canonicalizer는 한 번만 생성되어 공유된다")
    void 기본_Canonicalizer_공유() {
        Canonicalizer first = CanonicalStrings.defaultCanonicalizer();
        Canonicalizer second = CanonicalStrings.defaultCanonicalizer();

        assertThat(first).isSameAs(second);
        assertThat(first.getConfig()).isEqualTo(new CanonicalizerConfig());
    }

    @Test
    @DisplayName("newCanonicalizer() 는 주어진 설정을 사용하는 새 인스턴스를 만든다")
    void 새_Canonicalizer_생성() {
        // given
        CanonicalizerConfig config = new CanonicalizerConfig().withFastPathEnabled(false);

        // when
        Canonicalizer canonicalizer = CanonicalStrings.newCanonicalizer(config);

        // then
        assertThat(canonicalizer).isNotSameAs(CanonicalStrings.defaultCanonicalizer());
        assertThat(canonicalizer.getConfig()).isEqualTo(config);
        assertThat((Object) canonicalizer.fromText("\u212B")).isEqualTo(CanonicalStrings.of("\u212B"));
    }

    @Test
    @DisplayName("설정이 null이면 IllegalArgumentException이 발생한다")
    void null_설정_거부() {
        assertThatThrownBy(() -> CanonicalStrings.newCanonicalizer(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
    }

    @Test
    @DisplayName("HashSet 키로 사용하면 정준 동치 입력이 하나로 합쳐진다")
    void 해시_키_중복_제거() {
        Set<CanonicalString> keys = new HashSet<>();
        keys.add(CanonicalStrings.caseless("\u212Bngstr\u00F6m"));
        keys.add(CanonicalStrings.caseless("A\u030ANGSTRO\u0308M"));
        keys.add(CanonicalStrings.caseless("\u00E5ngstr\u00F6m"));

        assertThat(keys).hasSize(1);
    }

    @Test
    @DisplayName("여러 스레드에서 동시에 생성해도 같은 결과를 얻는다")
    void 동시_생성_일관성() throws Exception {
        // given
        List<String> inputs = List.of("C\u0327", "\u1100\u1161", "STRA\u00DFE", "dir\\FILE", "\u212B");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        Set<String> results = ConcurrentHashMap.newKeySet();
        List<Callable<Void>> tasks = new ArrayList<>();
        for (int t = 0; t < 32; t++) {
            tasks.add(() -> {
                StringBuilder sb = new StringBuilder();
                for (String input : inputs) {
                    sb.append(CanonicalStrings.caselessPath(input).asText()).append('|');
                }
                results.add(sb.toString());
                return null;
            });
        }

        // when
        try {
            for (Future<Void> future : pool.invokeAll(tasks, 30, TimeUnit.SECONDS)) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        // then
        assertThat(results).containsExactly("\u00E7|\uAC00|strasse|dir/file|\u00E5|");
    }
}
