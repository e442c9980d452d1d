package com.dpw.robotqase.parser;

import com.dpw.robotqase.exception.ReportParseException;
import com.dpw.robotqase.exception.ReportParseException.Kind;
import com.dpw.robotqase.exception.ReportParseException.Reason;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QaseIdResolverTest {

    private final QaseIdResolver resolver = new QaseIdResolver();

    private static Element test(String... tags) {
        StringBuilder xml = new StringBuilder("<test name=\"t\">");
        for (String tag : tags) {
            xml.append("<tag>").append(tag).append("</tag>");
        }
        xml.append("<status status=\"PASS\"/></test>");
        return Jsoup.parse(xml.toString(), "", Parser.xmlParser()).selectFirst("test");
    }

    @Test
    void resolvesIdAmongOtherTags() {
        assertThat(resolver.resolve(test("smoke", "Q-42", "regression"))).isEqualTo(42L);
    }

    @Test
    void firstMatchingTagWins() {
        assertThat(resolver.resolve(test("Q-7", "Q-8"))).isEqualTo(7L);
    }

    @Test
    void matchesIdEmbeddedInLongerText() {
        assertThat(resolver.resolve(test("covers Q-1234 partially"))).isEqualTo(1234L);
    }

    @Test
    void parsesIdsBeyondIntRange() {
        assertThat(resolver.resolve(test("Q-9876543210"))).isEqualTo(9876543210L);
    }

    @Test
    void failsWithoutTags() {
        assertThatThrownBy(() -> resolver.resolve(test()))
                .isInstanceOf(ReportParseException.class)
                .satisfies(e -> {
                    ReportParseException pe = (ReportParseException) e;
                    assertThat(pe.getReason()).isEqualTo(Reason.NO_TAGS_FOUND);
                    assertThat(pe.getKind()).isEqualTo(Kind.IDENTIFIER);
                });
    }

    @Test
    void failsWhenNoTagMatches() {
        assertThatThrownBy(() -> resolver.resolve(test("smoke")))
                .isInstanceOf(ReportParseException.class)
                .hasMessageContaining("smoke")
                .extracting("reason").isEqualTo(Reason.IDENTIFIER_NOT_FOUND);
    }

    @Test
    void ignoresLowercaseAndMissingDigits() {
        assertThatThrownBy(() -> resolver.resolve(test("q-12", "Q-", "Q12")))
                .extracting("reason").isEqualTo(Reason.IDENTIFIER_NOT_FOUND);
    }

    @Test
    void onlyLooksAtDirectTagChildren() {
        Element test = Jsoup.parse("<test><kw><tag>Q-5</tag></kw><tag>ui</tag></test>", "", Parser.xmlParser())
                .selectFirst("test");

        assertThatThrownBy(() -> resolver.resolve(test))
                .extracting("reason").isEqualTo(Reason.IDENTIFIER_NOT_FOUND);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Q-0", "Q-000"})
    void rejectsZeroId(String tag) {
        assertThatThrownBy(() -> resolver.resolve(test("smoke", tag)))
                .isInstanceOf(ReportParseException.class)
                .hasMessageContaining(tag)
                .extracting("reason", "offendingText")
                .containsExactly(Reason.IDENTIFIER_NOT_FOUND, tag);
    }

    @Test
    void rejectsIdThatOverflowsLong() {
        assertThatThrownBy(() -> resolver.resolve(test("Q-99999999999999999999")))
                .isInstanceOf(ReportParseException.class)
                .extracting("reason").isEqualTo(Reason.IDENTIFIER_NOT_FOUND);
    }
}
