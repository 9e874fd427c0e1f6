package org.epubkit.chapter;

import org.epubkit.Epub;
import org.epubkit.exception.EpubError;
import org.epubkit.exception.EpubException;
import org.epubkit.model.Chapter;
import org.epubkit.model.NavPoint;
import org.epubkit.model.TableOfContents;
import org.epubkit.options.CancellationToken;
import org.epubkit.options.EpubOptions;
import org.epubkit.support.TestEpubs;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.epubkit.options.EpubOptions.withCancellation;
import static org.epubkit.options.EpubOptions.withChapterFilter;
import static org.epubkit.options.EpubOptions.withMaxContentLength;

class ChapterExtractorTest {

    @TempDir
    Path tempDir;

    @Nested
    class GetChaptersTests {

        @Test
        void twoHtmlChapters_withoutToc_getSyntheticTitles() throws IOException {
            try (Epub epub = Epub.open(TestEpubs.twoChapterBook(tempDir))) {
                List<Chapter> chapters = epub.getChapters();

                assertThat(chapters).extracting(Chapter::getTitle).containsExactly("Chapter 1", "Chapter 2");
                assertThat(chapters).extracting(Chapter::getOrder).containsExactly(1, 2);
                assertThat(chapters.get(0).getContent()).hasSize(50);
            }
        }

        @Test
        void maxContentLengthBelowChapterSize_skipsEverything() throws IOException {
            try (Epub epub = Epub.open(TestEpubs.twoChapterBook(tempDir))) {
                assertThat(epub.getChapters(withMaxContentLength(10))).isEmpty();
            }
        }

        @Test
        void maxContentLengthEqualToChapterSize_keepsChapter() throws IOException {
            try (Epub epub = Epub.open(TestEpubs.twoChapterBook(tempDir))) {
                assertThat(epub.getChapters(withMaxContentLength(50))).hasSize(2);
            }
        }

        @Test
        void skippedSpineEntries_leaveGapsInOrder() throws IOException {
            try (Epub epub = Epub.open(TestEpubs.standardBook(tempDir))) {
                List<Chapter> chapters = epub.getChapters();

                // spine: chapter1, style (css), missing, chapter2, chapter3
                assertThat(chapters).extracting(Chapter::getOrder).containsExactly(1, 4, 5);
                assertThat(chapters.get(1).getContent()).contains("Chapter Two");
            }
        }

        @Test
        void titlesComeFromTocPosition_notFromHref() throws IOException {
            try (Epub epub = Epub.open(TestEpubs.standardBook(tempDir))) {
                List<Chapter> chapters = epub.getChapters();

                // nav point 0 labels spine index 0; spine indexes 3 and 4 have no top-level nav point
                assertThat(chapters).extracting(Chapter::getTitle)
                        .containsExactly("The Beginning", "Chapter 4", "Chapter 5");
            }
        }

        @Test
        void chapterFilter_seesFullyBuiltChapter() throws IOException {
            try (Epub epub = Epub.open(TestEpubs.standardBook(tempDir))) {
                List<Chapter> chapters = epub.getChapters(
                        withChapterFilter(chapter -> chapter.getContent().contains("Three") && chapter.getOrder() == 5));

                assertThat(chapters).singleElement().extracting(Chapter::getTitle).isEqualTo("Chapter 5");
            }
        }

        @Test
        void repeatedCalls_returnEqualResults() throws IOException {
            try (Epub epub = Epub.open(TestEpubs.standardBook(tempDir))) {
                assertEquals(epub.getChapters(), epub.getChapters());
            }
        }

        @Test
        void cancelledBeforeCall_failsWithoutChapters() throws IOException {
            CancellationToken token = CancellationToken.create();
            token.cancel();

            try (Epub epub = Epub.open(TestEpubs.twoChapterBook(tempDir))) {
                EpubException e = assertThrows(EpubException.class, () -> epub.getChapters(withCancellation(token)));
                assertEquals(EpubError.CANCELLED, e.getError());
            }
        }

        @Test
        void cancelledMidWalk_abortsAtNextPoll() throws IOException {
            CancellationToken token = CancellationToken.create();
            AtomicInteger seen = new AtomicInteger();

            try (Epub epub = Epub.open(TestEpubs.bookWithChapters(tempDir, 7))) {
                EpubException e = assertThrows(EpubException.class, () -> epub.getChapters(
                        withCancellation(token),
                        withChapterFilter(chapter -> {
                            if (seen.incrementAndGet() == 2) {
                                token.cancel();
                            }
                            return true;
                        })));

                assertEquals(EpubError.CANCELLED, e.getError());
                // polled at index 5, so indexes 2..4 were still processed
                assertEquals(5, seen.get());
            }
        }

        @Test
        void cancelledAfterLastPoll_stillCompletes() throws IOException {
            CancellationToken token = CancellationToken.create();

            try (Epub epub = Epub.open(TestEpubs.bookWithChapters(tempDir, 5))) {
                List<Chapter> chapters = epub.getChapters(
                        withCancellation(token),
                        withChapterFilter(chapter -> {
                            token.cancel();
                            return true;
                        }));

                assertThat(chapters).hasSize(5);
            }
        }
    }

    @Nested
    class GetChapterContentTests {

        @Test
        void returnsRawMarkup() throws IOException {
            try (Epub epub = Epub.open(TestEpubs.standardBook(tempDir))) {
                String content = epub.getChapterContent(0);

                assertThat(content).startsWith("<?xml").contains("<h1>Chapter One</h1>");
            }
        }

        @Test
        void indexOutsideSpine_throwsOutOfRange() throws IOException {
            try (Epub epub = Epub.open(TestEpubs.standardBook(tempDir))) {
                for (int index : new int[]{-1, 5, 100}) {
                    EpubException e = assertThrows(EpubException.class, () -> epub.getChapterContent(index));
                    assertEquals(EpubError.OUT_OF_RANGE, e.getError());
                }
            }
        }

        @Test
        void nonHtmlSpineItem_throwsUnsupportedContent() throws IOException {
            try (Epub epub = Epub.open(TestEpubs.standardBook(tempDir))) {
                EpubException e = assertThrows(EpubException.class, () -> epub.getChapterContent(1));
                assertEquals(EpubError.UNSUPPORTED_CONTENT, e.getError());
                assertThat(e.getMessage()).contains("text/css");
            }
        }

        @Test
        void danglingSpineReference_throwsNotFound() throws IOException {
            try (Epub epub = Epub.open(TestEpubs.standardBook(tempDir))) {
                EpubException e = assertThrows(EpubException.class, () -> epub.getChapterContent(2));
                assertEquals(EpubError.NOT_FOUND, e.getError());
            }
        }

        @Test
        void oversizedChapter_throwsContentTooLarge() throws IOException {
            try (Epub epub = Epub.open(TestEpubs.twoChapterBook(tempDir))) {
                EpubException e = assertThrows(EpubException.class,
                        () -> epub.getChapterContent(0, withMaxContentLength(10)));
                assertEquals(EpubError.CONTENT_TOO_LARGE, e.getError());
            }
        }

        @Test
        void cancelledToken_throwsCancelled() throws IOException {
            CancellationToken token = CancellationToken.create();
            token.cancel();

            try (Epub epub = Epub.open(TestEpubs.twoChapterBook(tempDir))) {
                EpubException e = assertThrows(EpubException.class,
                        () -> epub.getChapterContent(0, withCancellation(token)));
                assertEquals(EpubError.CANCELLED, e.getError());
            }
        }

        @Test
        void chapterStream_matchesContent() throws IOException {
            try (Epub epub = Epub.open(TestEpubs.standardBook(tempDir));
                 InputStream in = epub.getChapterStream(3)) {
                assertEquals(epub.getChapterContent(3), new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
        }
    }

    @Test
    void titleFor_fallsBackWhenLabelMissingAtPosition() {
        TableOfContents toc = TableOfContents.builder()
                .navPoints(List.of(NavPoint.builder().label("Prologue").build()))
                .build();

        assertEquals("Prologue", ChapterExtractor.titleFor(Optional.of(toc), 0));
        assertEquals("Chapter 2", ChapterExtractor.titleFor(Optional.of(toc), 1));
        assertEquals("Chapter 1", ChapterExtractor.titleFor(Optional.empty(), 0));
    }

    @Test
    void defaultsAreUnlimited() {
        assertThat(EpubOptions.DEFAULTS.exceedsMaxContentLength(Long.MAX_VALUE)).isFalse();
    }
}
