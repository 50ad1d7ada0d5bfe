package com.example.vidqueue.service;

import com.example.vidqueue.utils.model.VideoFormatInfo;
import com.example.vidqueue.utils.model.VideoInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class YtDlpInfoProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void approximatesMissingSizesFromBitrate() {
        VideoFormatInfo known = VideoFormatInfo.builder().format_id("18").filesize(1234L).tbr(500.0).build();
        VideoFormatInfo estimated = VideoFormatInfo.builder().format_id("137").tbr(800.0).build();
        VideoFormatInfo noBitrate = VideoFormatInfo.builder().format_id("sb0").build();
        VideoInfo info = VideoInfo.builder().duration(10.0).formats(List.of(known, estimated, noBitrate)).build();

        YtDlpInfoProvider.fillApproximateSizes(info);

        assertThat(known.getFilesize_approx()).isNull();
        assertThat(estimated.getFilesize_approx()).isEqualTo(1_000_000L);
        assertThat(noBitrate.getFilesize_approx()).isNull();
    }

    @Test
    void missingDurationLeavesSizesAlone() {
        VideoFormatInfo format = VideoFormatInfo.builder().format_id("137").tbr(800.0).build();

        YtDlpInfoProvider.fillApproximateSizes(VideoInfo.builder().formats(List.of(format)).build());

        assertThat(format.getFilesize_approx()).isNull();
    }

    @Test
    void resolvesFlatPlaylistEntryUrls() throws Exception {
        assertThat(YtDlpInfoProvider.resolveEntryUrl(objectMapper.readTree(
                "{\"url\":\"https://example.com/watch/1\"}"))).isEqualTo("https://example.com/watch/1");
        assertThat(YtDlpInfoProvider.resolveEntryUrl(objectMapper.readTree(
                "{\"url\":\"abc\",\"webpage_url\":\"https://example.com/page\"}"))).isEqualTo("https://example.com/page");
        assertThat(YtDlpInfoProvider.resolveEntryUrl(objectMapper.readTree(
                "{\"url\":\"abc\",\"ie_key\":\"Youtube\"}"))).isEqualTo("https://www.youtube.com/watch?v=abc");
        assertThat(YtDlpInfoProvider.resolveEntryUrl(objectMapper.readTree(
                "{\"url\":\"abc\",\"ie_key\":\"YoutubeMusic\"}"))).isEqualTo("https://music.youtube.com/watch?v=abc");
        assertThat(YtDlpInfoProvider.resolveEntryUrl(objectMapper.readTree(
                "{\"id\":\"only-id\"}"))).isEqualTo("only-id");
        assertThat(YtDlpInfoProvider.resolveEntryUrl(objectMapper.readTree("{}"))).isEmpty();
    }

    @Test
    void readsSnakeCaseVideoJson() throws Exception {
        VideoInfo info = new ObjectMapper()
                .configure(com.fasterxml.jackson.databind.DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .readValue("{\"id\":\"abc\",\"title\":\"Clip\",\"view_count\":42,\"extra\":true,"
                        + "\"formats\":[{\"format_id\":\"137\",\"vcodec\":\"avc1\",\"acodec\":\"none\",\"height\":1080}]}",
                        VideoInfo.class);

        assertThat(info.getView_count()).isEqualTo(42L);
        assertThat(info.getFormats()).extracting(VideoFormatInfo::getFormat_id).containsExactly("137");
        assertThat(info.getFormats().get(0).getHeight()).isEqualTo(1080);
    }
}
