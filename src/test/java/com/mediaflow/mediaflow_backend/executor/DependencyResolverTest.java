package com.mediaflow.mediaflow_backend.executor;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyResolverTest {

    private final DependencyResolver resolver = new DependencyResolver();

    @Test
    void tokensAreReplacedAtAnyDepth() {
        Map<String, Object> params = Map.of(
                "prompt", "a dancer",
                "image", "_imageJobDependency:job1",
                "unified", Map.of("audio", "_audioJobDependency:job2"),
                "frames", List.of("_imageJobDependency:job1", "https://cdn.example.com/static.png"));
        Map<String, Map<String, Object>> results = Map.of(
                "job1", Map.of("url", "https://cdn.example.com/job1.png"),
                "job2", Map.of("output", "https://cdn.example.com/job2.mp3"));

        Map<String, Object> resolved = resolver.resolve(params, results);

        assertThat(resolved)
                .containsEntry("prompt", "a dancer")
                .containsEntry("image", "https://cdn.example.com/job1.png")
                .containsEntry("unified", Map.of("audio", "https://cdn.example.com/job2.mp3"))
                .containsEntry("frames", List.of("https://cdn.example.com/job1.png", "https://cdn.example.com/static.png"));
    }

    @Test
    void urlKeysAreTriedInOrder() {
        assertThat(DependencyResolver.extractUrl(Map.of("url", "https://b", "image", "https://a"))).isEqualTo("https://a");
        assertThat(DependencyResolver.extractUrl("https://plain")).isEqualTo("https://plain");
        assertThat(DependencyResolver.extractUrl(Map.of("imageUrl", " "))).isNull();
        assertThat(DependencyResolver.extractUrl(42)).isNull();
    }

    @Test
    void missingDependencyResultFails() {
        assertThatThrownBy(() -> resolver.resolve(Map.of("image", "_imageJobDependency:job7"), Map.of()))
                .isInstanceOf(DependencyResolutionException.class)
                .hasMessage("Dependency job7 has no result");
    }

    @Test
    void resultWithoutUrlFails() {
        assertThatThrownBy(() -> resolver.resolve(Map.of("video", "_videoJobDependency:job3"),
                Map.of("job3", Map.of("status", "done"))))
                .isInstanceOf(DependencyResolutionException.class)
                .hasMessage("Could not extract video URL from result of job job3");
    }

    @Test
    void nonTokenStringsPassThrough() {
        Map<String, Object> params = Map.of("image", "_imageJobDependency:", "note", "_videoJobDependency job1");

        assertThat(resolver.resolve(params, Map.of())).isEqualTo(params);
    }
}
