package com.example.vidqueue.service;

import com.example.vidqueue.utils.model.DownloadRequest;
import com.example.vidqueue.utils.model.MediaType;
import com.example.vidqueue.utils.model.VideoFormatInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FormatSelectionServiceTest {

    private final FormatSelectionService service = new FormatSelectionService();

    private static final List<VideoFormatInfo> FORMATS = List.of(
            VideoFormatInfo.builder().format_id("140").ext("m4a").vcodec("none").acodec("mp4a").abr(128.0).build(),
            VideoFormatInfo.builder().format_id("251").ext("webm").vcodec("none").acodec("opus").abr(160.0).build(),
            VideoFormatInfo.builder().format_id("18").ext("mp4").vcodec("avc1").acodec("mp4a").height(360).tbr(500.0).build(),
            VideoFormatInfo.builder().format_id("136").ext("mp4").vcodec("avc1").acodec("none").height(720).tbr(1500.0).build(),
            VideoFormatInfo.builder().format_id("137").ext("mp4").vcodec("avc1").acodec("none").height(1080).tbr(4000.0).build()
    );

    private static DownloadRequest video(String format, String audioFormat) {
        return DownloadRequest.builder()
                .url("https://example.com/v").type(MediaType.VIDEO).format(format).audioFormat(audioFormat).build();
    }

    private static DownloadRequest audio(String format) {
        return DownloadRequest.builder().url("https://example.com/a").type(MediaType.AUDIO).format(format).build();
    }

    @Test
    void videoSelectorRules() {
        assertThat(service.resolveVideoFormatSelector(video("137", ""))).isEqualTo("137");
        assertThat(service.resolveVideoFormatSelector(video("137+140", null))).isEqualTo("137+140");
        assertThat(service.resolveVideoFormatSelector(video("best[height<=720]", null))).isEqualTo("best[height<=720]");
        assertThat(service.resolveVideoFormatSelector(video(null, null))).isEqualTo("bestvideo+bestaudio/best");
        assertThat(service.resolveVideoFormatSelector(video("best", "none"))).isEqualTo("bestvideo+none");
        assertThat(service.resolveVideoFormatSelector(video("", "251"))).isEqualTo("bestvideo+251");
        assertThat(service.resolveVideoFormatSelector(video("137", null))).isEqualTo("137+bestaudio/best");
        assertThat(service.resolveVideoFormatSelector(video("137", "none"))).isEqualTo("137+none");
        assertThat(service.resolveVideoFormatSelector(video("137", "251"))).isEqualTo("137+251");
    }

    @Test
    void audioTracksAreAppendedToVideo() {
        DownloadRequest request = video(null, null);
        request.setAudioFormatIds(List.of("140", "251"));
        assertThat(service.resolveVideoFormatSelector(request)).isEqualTo("bestvideo*+140+251");

        request.setFormat("137");
        assertThat(service.resolveVideoFormatSelector(request)).isEqualTo("137+140+251");
    }

    @Test
    void audioSelector() {
        assertThat(service.resolveAudioFormatSelector(audio(null))).isEqualTo("bestaudio");
        assertThat(service.resolveAudioFormatSelector(audio("251"))).isEqualTo("251");
    }

    @Test
    void presetPreferences() {
        assertThat(service.buildVideoFormatPreference("good")).isEqualTo(
                "bestvideo[height<=1080]+bestaudio[abr<=256]/bestvideo[height<=1080]+bestaudio"
                        + "/bestvideo+bestaudio[abr<=256]/bestvideo+bestaudio/best");
        assertThat(service.buildVideoFormatPreference("auto")).isEqualTo("bestvideo+bestaudio/best");
        assertThat(service.buildVideoFormatPreference("WORST")).isEqualTo("worstvideo+worstaudio/worst/best");
        assertThat(service.buildAudioFormatPreference("normal")).isEqualTo("bestaudio[abr<=192]/bestaudio/best");
        assertThat(service.buildAudioFormatPreference(null)).isEqualTo("bestaudio/best");
    }

    @Test
    void directSelectorMatchWins() {
        assertThat(service.resolveSelectedFormat(FORMATS, video("136+140", null), "good"))
                .extracting(VideoFormatInfo::getFormat_id).isEqualTo("136");
        assertThat(service.resolveSelectedFormat(FORMATS, video("999/18", null), "good"))
                .extracting(VideoFormatInfo::getFormat_id).isEqualTo("18");
    }

    @Test
    void videoPresetPicksHighestWithinLimit() {
        assertThat(service.resolveSelectedFormat(FORMATS, video(null, null), "auto").getFormat_id()).isEqualTo("137");
        assertThat(service.resolveSelectedFormat(FORMATS, video(null, null), "normal").getFormat_id()).isEqualTo("136");
        assertThat(service.resolveSelectedFormat(FORMATS, video(null, null), "bad").getFormat_id()).isEqualTo("18");
        assertThat(service.resolveSelectedFormat(FORMATS, video(null, null), "worst").getFormat_id()).isEqualTo("18");
    }

    @Test
    void audioPresetPicksByBitrate() {
        assertThat(service.resolveSelectedFormat(FORMATS, audio(null), null).getFormat_id()).isEqualTo("251");
        assertThat(service.resolveSelectedFormat(FORMATS, audio(null), "bad").getFormat_id()).isEqualTo("140");
        assertThat(service.resolveSelectedFormat(FORMATS, audio(null), "worst").getFormat_id()).isEqualTo("140");
    }

    @Test
    void noFormatsMeansNoSelection() {
        assertThat(service.resolveSelectedFormat(List.of(), video(null, null), "good")).isNull();
        assertThat(service.resolveSelectedFormat(null, audio(null), "good")).isNull();
    }

    @Test
    void idCandidatesPreferVideo() {
        assertThat(service.findFormatByIdCandidates(FORMATS, "140+137").getFormat_id()).isEqualTo("137");
        assertThat(service.findFormatByIdCandidates(FORMATS, "251").getFormat_id()).isEqualTo("251");
        assertThat(service.findFormatByIdCandidates(FORMATS, "999")).isNull();
        assertThat(service.findFormatByIdCandidates(FORMATS, " ")).isNull();
    }

    @Test
    void parsesSizes() {
        assertThat(FormatSelectionService.parseSizeToBytes("~ 12.5MiB")).isEqualTo(13_107_200L);
        assertThat(FormatSelectionService.parseSizeToBytes("1.5KB")).isEqualTo(1_500L);
        assertThat(FormatSelectionService.parseSizeToBytes("1,024KiB")).isEqualTo(1_048_576L);
        assertThat(FormatSelectionService.parseSizeToBytes("2GiB")).isEqualTo(2_147_483_648L);
        assertThat(FormatSelectionService.parseSizeToBytes("512B")).isEqualTo(512L);
        assertThat(FormatSelectionService.parseSizeToBytes("Unknown")).isNull();
        assertThat(FormatSelectionService.parseSizeToBytes("")).isNull();
        assertThat(FormatSelectionService.parseSizeToBytes(null)).isNull();
    }
}
