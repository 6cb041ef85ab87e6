package com.ryuqq.canonical.testkit.contract;

import com.ryuqq.canonical.core.spi.CaseFolder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link CaseFolder} implementations.
 *
 * <p>Validates default (full, locale-independent) case folding.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>ASCII and Latin-1 folding</li>
 *   <li>Full folding expands characters (ß → ss, ﬃ → ffi)</li>
 *   <li>Context-free folding of Greek final sigma</li>
 *   <li>Result does not depend on the JVM default locale</li>
 * </ul>
 *
 * @author Canonical String Team
 * @since 1.0.0
 */
public abstract class AbstractCaseFolderContractTest {

    protected CaseFolder caseFolder;

    private Locale originalLocale;

    /**
     * Creates the implementation under test.
     *
     * @return a fresh case folder
     */
    protected abstract CaseFolder createCaseFolder();

    @BeforeEach
    void setUpCaseFolder() {
        originalLocale = Locale.getDefault();
        caseFolder = createCaseFolder();
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(originalLocale);
    }

    @Test
    void fold_AsciiText_LowerCases() {
        assertEquals("test case", caseFolder.fold("Test Case"));
        assertEquals("already folded", caseFolder.fold("already folded"));
        assertEquals("", caseFolder.fold(""));
    }

    @Test
    void fold_FullFolding_ExpandsCharacters() {
        assertEquals("strasse", caseFolder.fold("stra\u00DFe"));
        assertEquals("spiffiest", caseFolder.fold("spi\uFB03est"));
        assertEquals("test case", caseFolder.fold("Te\u017Ft Ca\u017Fe"));
    }

    @Test
    void fold_GreekSigma_FoldsWithoutContext() {
        // capital, medial and final sigma all fold to U+03C3
        assertEquals("\u03C3\u03B1\u03C3", caseFolder.fold("\u03A3\u0391\u03A3"));
        assertEquals("\u03C3\u03B1\u03C3", caseFolder.fold("\u03C3\u03B1\u03C2"));
    }

    @Test
    void fold_IsLocaleIndependent() {
        // Given
        Locale.setDefault(new Locale("tr", "TR"));

        // When
        String folded = caseFolder.fold("TITLE");

        // Then: default folding maps I to i, not to dotless i
        assertEquals("title", folded);
    }

    @Test
    void fold_AppliedTwice_IsStable() {
        for (String input : AbstractNormalizerContractTest.SAMPLE_INPUTS) {
            String once = caseFolder.fold(input);
            assertEquals(once, caseFolder.fold(once),
                "fold must be stable for: " + AbstractNormalizerContractTest.escape(input));
        }
    }

    @Test
    void fold_AcceptsAnyCharSequence() {
        assertEquals("abc", caseFolder.fold(new StringBuilder("ABC")));
    }
}
