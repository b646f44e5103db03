package com.newsdigest.backend.scraper.extract;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class HtmlTextTest {

    @Test
    void clean_shouldStripTagsDecodeEntitiesAndCollapseWhitespace() {
        assertThat(HtmlText.clean("<p>Giá vàng&nbsp;tăng</p>\n\n<p>mạnh &amp; nhanh</p>"))
                .isEqualTo("Giá vàng tăng mạnh & nhanh");
        assertThat(HtmlText.clean(null)).isEmpty();
    }

    @Test
    void firstImage_shouldReturnFirstImgSource() {
        assertThat(HtmlText.firstImage("<p>x</p><img src=\"https://img/a.jpg\"><img src=\"https://img/b.jpg\">"))
                .contains("https://img/a.jpg");
        assertThat(HtmlText.firstImage("<p>no image</p>")).isEmpty();
    }

    @Test
    void stripLeadingBreakSegment_shouldDropThumbnailBeforeFirstBreak() {
        String html = "<a href=\"/x\"><img src=\"https://img/t.jpg\"/></a></br>Thị trường hồi phục";

        assertThat(HtmlText.clean(HtmlText.stripLeadingBreakSegment(html))).isEqualTo("Thị trường hồi phục");
        assertThat(HtmlText.stripLeadingBreakSegment("plain text")).isEqualTo("plain text");
    }

    @Test
    void stripLeadingByline_shouldRemoveAgencyMarker() {
        assertThat(HtmlText.stripLeadingByline("(ĐTCK) - Cổ phiếu ngân hàng dẫn dắt"))
                .isEqualTo("Cổ phiếu ngân hàng dẫn dắt");
    }

    @Test
    void truncate_shouldAppendEllipsis_onlyWhenLonger() {
        assertThat(HtmlText.truncate("abcdef", 3)).isEqualTo("abc...");
        assertThat(HtmlText.truncate("abc", 3)).isEqualTo("abc");
    }

    @Test
    void truncate_shouldNotSplitSurrogatePair() {
        // "📈" is two chars; cutting at 3 would leave its high surrogate behind
        String truncated = HtmlText.truncate("ab📈cd", 3);

        assertThat(truncated).isEqualTo("ab...");
        assertThat(truncated.chars().noneMatch(c -> Character.isSurrogate((char) c))).isTrue();
    }

    @Test
    void stripCdataMarkers_shouldRemoveLeftoverTerminators() {
        assertThat(HtmlText.stripCdataMarkers("Tin tức]]>")).isEqualTo("Tin tức");
    }
}
