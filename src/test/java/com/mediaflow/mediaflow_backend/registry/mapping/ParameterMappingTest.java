package com.mediaflow.mediaflow_backend.registry.mapping;

import com.mediaflow.mediaflow_backend.model.plan.UnifiedOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterMappingTest {

    @Test
    void seedanceTurnsCameraMotionIntoCameraFixed() {
        MappedOptions fixed = new SeedanceMapping("bytedance/seedance-1-pro").toProviderOptions(
                UnifiedOptions.builder().prompt("waves").cameraMotion("fixed").aspectRatio("9:16").build());
        MappedOptions dynamic = new SeedanceMapping("bytedance/seedance-1-pro").toProviderOptions(
                UnifiedOptions.builder().prompt("waves").cameraMotion("dynamic").build());

        assertThat(fixed.options()).containsEntry("camera_fixed", true).containsEntry("aspect_ratio", "9:16");
        assertThat(dynamic.options()).containsEntry("camera_fixed", false);
        assertThat(fixed.coercions()).isEmpty();
    }

    @Test
    void seedanceStartImageWinsOverImage() {
        MappedOptions mapped = new SeedanceMapping("bytedance/seedance-1-pro").toProviderOptions(UnifiedOptions.builder()
                .prompt("waves")
                .image("https://cdn.example.com/a.png")
                .startImage("https://cdn.example.com/b.png")
                .build());

        assertThat(mapped.options()).containsEntry("image", "https://cdn.example.com/b.png");
        assertThat(mapped.coercions()).containsExactly("image was ignored because startImage is set");
    }

    @Test
    void nanoBananaNormalizesJpg() {
        MappedOptions mapped = new NanoBananaMapping("fal-ai/nano-banana").toProviderOptions(UnifiedOptions.builder()
                .prompt("a cat")
                .outputFormat("jpg")
                .image("https://cdn.example.com/cat.png")
                .build());

        assertThat(mapped.options())
                .containsEntry("output_format", "jpeg")
                .containsEntry("image_urls", List.of("https://cdn.example.com/cat.png"));
        assertThat(mapped.coercions()).containsExactly("outputFormat jpg was normalized to jpeg");
    }

    @Test
    void fabricDefaultsToItsHighestResolution() {
        MappedOptions mapped = new FabricMapping("veed/fabric-1.0").toProviderOptions(UnifiedOptions.builder()
                .image("https://cdn.example.com/face.png")
                .audio("https://cdn.example.com/voice.mp3")
                .build());

        assertThat(mapped.options()).containsEntry("resolution", "720p");
        assertThat(mapped.coercions()).isEmpty();
    }

    @Test
    void unsupportedFieldsAreNotedNotSilentlyDropped() {
        MappedOptions mapped = new MinimaxMapping("minimax/video-01").toProviderOptions(UnifiedOptions.builder()
                .prompt("city at night")
                .duration(10)
                .seed(42)
                .build());

        assertThat(mapped.options()).containsEntry("prompt_optimizer", true).doesNotContainKeys("duration", "seed");
        assertThat(mapped.coercions()).containsExactlyInAnyOrder(
                "duration is not supported by minimax/video-01 and was dropped",
                "seed is not supported by minimax/video-01 and was dropped");
    }

    @Test
    void singleInputMappingMovesTheInputUnderTheProviderName() {
        MappedOptions mapped = new VideoMattingMapping("arielreplicate/robust_video_matting").toProviderOptions(
                UnifiedOptions.builder().video("https://cdn.example.com/clip.mp4").build());

        assertThat(mapped.options()).containsEntry("input_video", "https://cdn.example.com/clip.mp4");
    }

    @Test
    void singleInputMappingOnlyAcceptsMediaFields() {
        assertThatThrownBy(() -> new SingleInputMapping("x/y", "prompt", "prompt"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lossyFieldsAreThoseThatDoNotRoundTrip() {
        assertThat(new NanoBananaMapping("fal-ai/nano-banana").lossyFields())
                .contains("duration", "seed")
                .doesNotContain("prompt", "aspectRatio", "image");
    }

    @Test
    void seedanceRoundTripsItsRoundTripFields() {
        SeedanceMapping mapping = new SeedanceMapping("bytedance/seedance-1-pro");
        UnifiedOptions original = UnifiedOptions.builder()
                .prompt("waves").duration(5).resolution("720p").aspectRatio("16:9").seed(7)
                .startImage("https://cdn.example.com/s.png").endImage("https://cdn.example.com/e.png")
                .cameraMotion("dynamic")
                .build();

        assertThat(mapping.fromProviderOptions(mapping.toProviderOptions(original).options())).isEqualTo(original);
    }
}
