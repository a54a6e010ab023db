package de.mirkosertic.ftsquery;

import org.apache.lucene.analysis.CharArraySet;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StandardStopWordsTest {

    @Test
    void shouldContainCommonEnglishStopWords() {
        final CharArraySet stopWords = StandardStopWords.get();

        assertThat(stopWords.contains("the")).isTrue();
        assertThat(stopWords.contains("and")).isTrue();
        assertThat(stopWords.contains("would")).isTrue();
        assertThat(stopWords.contains("a")).isTrue();
        assertThat(stopWords.contains("0")).isTrue();
    }

    @Test
    void shouldMatchIgnoringCase() {
        assertThat(StandardStopWords.get().contains("THE")).isTrue();
        assertThat(StandardStopWords.get().contains("The")).isTrue();
    }

    @Test
    void shouldNotContainOrdinaryWords() {
        assertThat(StandardStopWords.get().contains("abc")).isFalse();
        assertThat(StandardStopWords.get().contains("database")).isFalse();
    }

    @Test
    void shouldSkipCommentLines() {
        assertThat(StandardStopWords.get().size()).isGreaterThan(100);
        assertThat(StandardStopWords.get().contains("# SQL Server full-text system stoplist (English)")).isFalse();
    }

    @Test
    void shouldBeUnmodifiable() {
        assertThatThrownBy(() -> StandardStopWords.get().add("foo"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
