package com.agentbench.backend.container;

import com.agentbench.core.error.BuildException;
import com.agentbench.core.model.ExecutionArtifact;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.BuildImageResultCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Builds test images with the Docker daemon and pushes them when a registry is configured.
 * <p>
 * The build context is a temporary directory holding {@code agent.py}, {@code requirements.txt}
 * and {@code Dockerfile}. Jobs without their own container descriptor get {@link #DEFAULT_DOCKERFILE}.
 */
public class DockerImageBuilder implements ImageBuilder {

    private static final Logger log = LoggerFactory.getLogger(DockerImageBuilder.class);

    static final String DEFAULT_DOCKERFILE = """
            FROM python:3.11-slim
            WORKDIR /app
            COPY requirements.txt .
            RUN pip install --no-cache-dir -r requirements.txt
            COPY agent.py .
            CMD ["python", "agent.py"]
            """;

    private static final long BUILD_TIMEOUT_MINUTES = 10;
    private static final long PUSH_TIMEOUT_MINUTES = 5;

    private final DockerClient dockerClient;
    private final String imageRegistry;
    private final String imagePrefix;

    public DockerImageBuilder(DockerClient dockerClient, String imageRegistry, String imagePrefix) {
        this.dockerClient = dockerClient;
        this.imageRegistry = imageRegistry;
        this.imagePrefix = imagePrefix != null ? imagePrefix : "agent-test";
    }

    @Override
    public BuiltImage build(String jobId, ExecutionArtifact artifact) {
        long start = System.currentTimeMillis();
        String repository = repository();
        String tag = jobId.toLowerCase(Locale.ROOT);
        String imageRef = repository + ":" + tag;

        Path context = null;
        try {
            context = writeContext(artifact);
            log.info("Building image {} for job {}", imageRef, jobId);
            dockerClient.buildImageCmd(context.toFile())
                    .withTags(Set.of(imageRef))
                    .withPull(true)
                    .exec(new BuildImageResultCallback())
                    .awaitImageId(BUILD_TIMEOUT_MINUTES, TimeUnit.MINUTES);

            if (imageRegistry != null && !imageRegistry.isBlank()) {
                boolean pushed = dockerClient.pushImageCmd(repository)
                        .withTag(tag)
                        .start()
                        .awaitCompletion(PUSH_TIMEOUT_MINUTES, TimeUnit.MINUTES);
                if (!pushed) {
                    throw new BuildException("Timed out pushing " + imageRef);
                }
                log.info("Pushed image {}", imageRef);
            }
            return new BuiltImage(imageRef, System.currentTimeMillis() - start);
        } catch (BuildException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BuildException("Interrupted while building " + imageRef, e);
        } catch (Exception e) {
            throw new BuildException("Image build failed for job " + jobId + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(context);
        }
    }

    private String repository() {
        if (imageRegistry == null || imageRegistry.isBlank()) {
            return imagePrefix;
        }
        return imageRegistry + "/" + imagePrefix;
    }

    private static Path writeContext(ExecutionArtifact artifact) throws IOException {
        Path dir = Files.createTempDirectory("agent-build-");
        Files.writeString(dir.resolve("agent.py"), orEmpty(artifact.agentCode()), StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("requirements.txt"), orEmpty(artifact.requirements()), StandardCharsets.UTF_8);
        String dockerfile = artifact.dockerfile() == null || artifact.dockerfile().isBlank()
                ? DEFAULT_DOCKERFILE : artifact.dockerfile();
        Files.writeString(dir.resolve("Dockerfile"), dockerfile, StandardCharsets.UTF_8);
        return dir;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            log.debug("Could not delete build context {}: {}", dir, e.getMessage());
        }
    }
}
