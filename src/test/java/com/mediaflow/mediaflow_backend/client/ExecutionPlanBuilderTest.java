package com.mediaflow.mediaflow_backend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediaflow.mediaflow_backend.model.domain.JobType;
import com.mediaflow.mediaflow_backend.model.plan.ExecutionPlan;
import com.mediaflow.mediaflow_backend.model.plan.JobNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionPlanBuilderTest {

    private static final ModelRef SEEDANCE = ModelRef.replicate("bytedance/seedance-1-pro");
    private static final ModelRef NANO_BANANA = ModelRef.fal("fal-ai/nano-banana");
    private static final ModelRef BG_REMOVER = ModelRef.replicate("codeplugtech/background_remover");
    private static final ModelRef TTS = ModelRef.elevenLabs("elevenlabs/turbo-v2.5");

    @Test
    void nestedImageBecomesItsOwnJobAheadOfItsOwner() {
        Operation video = new Operation.GenerateVideo(SEEDANCE, "a fox")
                .withImage(new Operation.GenerateImage(NANO_BANANA, "a fox portrait"));

        ExecutionPlan plan = Pipeline.compose(video).toPlan();

        assertThat(plan.jobs()).extracting(JobNode::id).containsExactly("job1", "job2");
        JobNode image = plan.jobs().get(0);
        JobNode owner = plan.jobs().get(1);
        assertThat(image.type()).isEqualTo(JobType.GENERATE_IMAGE);
        assertThat(image.dependsOn()).isEmpty();
        assertThat(owner.type()).isEqualTo(JobType.GENERATE);
        assertThat(owner.params()).containsEntry("image", "_imageJobDependency:job1")
                .containsEntry("modelId", "bytedance/seedance-1-pro")
                .containsEntry("provider", "replicate");
        assertThat(owner.dependsOn()).containsExactly("job1");
        assertThat(owner.output()).isEqualTo("$job2");
    }

    @Test
    void nestingIsExtractedDepthFirst() {
        Operation cutout = new Operation.RemoveImageBackground(BG_REMOVER,
                new Operation.GenerateImage(NANO_BANANA, "a product shot"));
        Operation video = new Operation.GenerateVideo(SEEDANCE, "spin the product", cutout,
                new Operation.GenerateAudio(TTS, "Now in stock"), null);

        ExecutionPlan plan = Pipeline.compose(video).toPlan();

        assertThat(plan.jobs()).extracting(JobNode::type).containsExactly(
                JobType.GENERATE_IMAGE, JobType.REMOVE_IMAGE_BACKGROUND, JobType.GENERATE_AUDIO, JobType.GENERATE);
        assertThat(plan.jobs().get(1).params()).containsEntry("image", "_imageJobDependency:job1");
        assertThat(plan.jobs().get(1).dependsOn()).containsExactly("job1");
        JobNode owner = plan.jobs().get(3);
        assertThat(owner.params())
                .containsEntry("image", "_imageJobDependency:job2")
                .containsEntry("audio", "_audioJobDependency:job3");
        assertThat(owner.dependsOn()).containsExactly("job2", "job3");
    }

    @Test
    void everyDependencyPointsBackwards() {
        Pipeline pipeline = Pipeline.compose(
                        new Operation.GenerateVideo(SEEDANCE, "scene one").withImage(new Operation.GenerateImage(NANO_BANANA, "one")),
                        new Operation.GenerateVideo(SEEDANCE, "scene two").withImage(new Operation.GenerateImage(NANO_BANANA, "two")))
                .merge("fade", 0.5)
                .then(new Operation.AddSubtitles());

        List<JobNode> jobs = pipeline.toPlan().jobs();

        for (int i = 0; i < jobs.size(); i++) {
            List<String> earlier = jobs.subList(0, i).stream().map(JobNode::id).toList();
            assertThat(earlier).containsAll(jobs.get(i).dependsOn());
        }
        assertThat(jobs).extracting(JobNode::id).containsExactly("job1", "job2", "job3", "job4", "job5", "job6");
    }

    @Test
    void mergeDependsOnTheScenesButNotOnTheirNestedInputs() {
        Pipeline pipeline = Pipeline.compose(
                        new Operation.GenerateVideo(SEEDANCE, "scene one").withImage(new Operation.GenerateImage(NANO_BANANA, "one")),
                        new Operation.GenerateVideo(SEEDANCE, "scene two").withImage(new Operation.GenerateImage(NANO_BANANA, "two")))
                .merge();

        List<JobNode> jobs = pipeline.toPlan().jobs();

        assertThat(jobs.get(1).dependsOn()).containsExactly("job1");
        assertThat(jobs.get(3).dependsOn()).containsExactly("job3");
        JobNode merge = jobs.get(4);
        assertThat(merge.type()).isEqualTo(JobType.MERGE);
        assertThat(merge.dependsOn()).containsExactly("job2", "job4");
        assertThat(merge.params()).containsEntry("transition", "cut");
    }

    @Test
    void captionAfterMergeChainsOntoTheMerge() {
        Pipeline pipeline = Pipeline.compose(
                        new Operation.GenerateVideo(SEEDANCE, "one"),
                        new Operation.GenerateVideo(SEEDANCE, "two"))
                .merge("fade", 0.5)
                .then(new Operation.AddSubtitles());

        List<JobNode> jobs = pipeline.toPlan().jobs();

        assertThat(jobs.get(2).params()).containsEntry("transition", "fade").containsEntry("transitionDuration", 0.5);
        assertThat(jobs.get(3).type()).isEqualTo(JobType.ADD_SUBTITLES);
        assertThat(jobs.get(3).dependsOn()).containsExactly("job3");
    }

    @Test
    void singleGenerationIsCaptionedLinearly() {
        ExecutionPlan plan = Pipeline.compose(
                new Operation.GenerateVideo(SEEDANCE, "one"),
                new Operation.AddSubtitles(null, null, "https://cdn.example.com/words.json", null)).toPlan();

        assertThat(plan.jobs().get(1).dependsOn()).containsExactly("job1");
        assertThat(plan.jobs().get(1).params()).containsEntry("transcriptUrl", "https://cdn.example.com/words.json");
    }

    @Test
    void transcriptionSitsBetweenTheVideoAndItsCaptions() {
        ExecutionPlan plan = Pipeline.compose(
                new Operation.GenerateVideo(SEEDANCE, "a talk"),
                new Operation.Transcribe(),
                new Operation.AddSubtitles()).toPlan();

        assertThat(plan.jobs()).extracting(JobNode::type)
                .containsExactly(JobType.GENERATE, JobType.TRANSCRIBE, JobType.ADD_SUBTITLES);
        assertThat(plan.jobs().get(1).dependsOn()).containsExactly("job1");
        assertThat(plan.jobs().get(1).params()).isEmpty();
        assertThat(plan.jobs().get(2).dependsOn()).containsExactly("job2");
    }

    @Test
    void generatedBackgroundIsTokenizedByWhatItProduces() {
        ExecutionPlan plan = Pipeline.compose(
                new Operation.GenerateVideo(SEEDANCE, "presenter on green"),
                new Operation.ReplaceGreenScreen(new Operation.GenerateImage(NANO_BANANA, "a beach"))).toPlan();

        assertThat(plan.jobs()).extracting(JobNode::type)
                .containsExactly(JobType.GENERATE, JobType.GENERATE_IMAGE, JobType.REPLACE_GREEN_SCREEN);
        JobNode keyed = plan.jobs().get(2);
        assertThat(keyed.params()).containsEntry("background", "_imageJobDependency:job2").doesNotContainKey("video");
        assertThat(keyed.dependsOn()).containsExactly("job1", "job2");
    }

    @Test
    void subPipelinesAreInlinedInOrder() {
        Pipeline intro = Pipeline.compose(new Operation.GenerateVideo(SEEDANCE, "intro"));
        Pipeline outro = Pipeline.compose(new Operation.GenerateVideo(SEEDANCE, "outro"));

        ExecutionPlan plan = Pipeline.compose(intro, outro).merge().toPlan();

        assertThat(plan.jobs()).extracting(job -> job.params().get("prompt")).containsExactly("intro", "outro", null);
        assertThat(plan.jobs().get(2).dependsOn()).containsExactly("job1", "job2");
    }

    @Test
    void urlInputsStayPlainStrings() {
        ExecutionPlan plan = Pipeline.compose(new Operation.RemoveBackground(
                ModelRef.replicate("nateraw/video-background-remover"),
                MediaInput.url("https://cdn.example.com/clip.mp4"), Map.of())).toPlan();

        assertThat(plan.jobs()).hasSize(1);
        assertThat(plan.jobs().get(0).params()).containsEntry("video", "https://cdn.example.com/clip.mp4");
        assertThat(plan.jobs().get(0).dependsOn()).isEmpty();
    }

    @Test
    void baseExecutionIdIsCarriedOnThePlan() {
        ExecutionPlan plan = Pipeline.compose(new Operation.AddSubtitles()).toPlan("6f1c2a9e-6a0e-4a43-9a43-2f0f3e1a9c11");

        assertThat(plan.baseExecutionId()).isEqualTo("6f1c2a9e-6a0e-4a43-9a43-2f0f3e1a9c11");
    }

    @Test
    void serializesToTheWireFormat() throws Exception {
        ExecutionPlan plan = Pipeline.compose(new Operation.GenerateVideo(SEEDANCE, "a fox")
                .withImage(new Operation.GenerateImage(NANO_BANANA, "fox"))).toPlan();

        JsonNode json = new ObjectMapper().valueToTree(plan);

        assertThat(json.has("baseExecutionId")).isFalse();
        assertThat(json.path("jobs").get(0).path("type").asText()).isEqualTo("generateImage");
        assertThat(json.path("jobs").get(0).path("output").asText()).isEqualTo("$job1");
        assertThat(json.path("jobs").get(1).path("dependsOn").get(0).asText()).isEqualTo("job1");
        assertThat(json.path("jobs").get(1).path("params").path("image").asText()).isEqualTo("_imageJobDependency:job1");
    }
}
