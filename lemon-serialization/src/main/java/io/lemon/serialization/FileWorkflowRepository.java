package io.lemon.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lemon.core.workflow.Workflow;
import io.lemon.core.workflow.WorkflowFilter;
import io.lemon.core.workflow.WorkflowRepository;
import io.lemon.core.workflow.WorkflowSummary;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Workflow repository backed by a directory of JSON documents.
///
/// Each workflow is stored as `<id>.json` in the format written by
/// {@link WorkflowSerializer}. Writes go to a temporary file in the same
/// directory which is then moved over the target, so readers never observe a
/// partially written document.
///
/// ### Contracts
/// - **Precondition**: workflow ids are usable as file names: letters, digits,
///   `.`, `_` and `-`, not starting with `.`
/// - **Postcondition**: `save` is idempotent and refreshes `updatedAt`
///
/// Documents that cannot be parsed are skipped by {@link #list} and the library
/// queries with a warning; {@link #get} reports them as
/// `IllegalArgumentException`.
///
/// @implNote Mutations are serialized on this instance. Concurrent processes
/// sharing one directory are not coordinated.
/// @see WorkflowSerializer
public class FileWorkflowRepository implements WorkflowRepository {

    private static final Logger logger = Logger.getLogger(FileWorkflowRepository.class.getName());

    private static final String EXTENSION = ".json";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_\\-][A-Za-z0-9._\\-]*");

    private final Path directory;
    private final ObjectMapper mapper = WorkflowSerializer.createMapper();

    /// Opens (and creates if missing) a repository directory.
    ///
    /// @param directory storage directory, not null
    /// @throws UncheckedIOException if the directory cannot be created
    public FileWorkflowRepository(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create repository directory: " + directory, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public synchronized String save(Workflow workflow) {
        Objects.requireNonNull(workflow, "workflow must not be null");

        Workflow stored = workflow.withMetadata(workflow.getMetadata().withUpdatedAt(Instant.now()));
        write(stored);
        logger.info("Saved workflow: " + stored.getId());
        return stored.getId();
    }

    @Override
    public Optional<Workflow> get(String workflowId) {
        Path file = fileFor(workflowId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    @Override
    public synchronized boolean delete(String workflowId) {
        try {
            return Files.deleteIfExists(fileFor(workflowId));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete workflow: " + workflowId, e);
        }
    }

    @Override
    public boolean exists(String workflowId) {
        return Files.exists(fileFor(workflowId));
    }

    @Override
    public List<WorkflowSummary> list(WorkflowFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        return filter.apply(loadAll());
    }

    @Override
    public synchronized boolean updateValidation(String workflowId, double score, int count) {
        Path file = fileFor(workflowId);
        if (!Files.exists(file)) {
            return false;
        }
        Workflow current = read(file);
        write(current.withMetadata(current.getMetadata().withValidation(score, count)));
        return true;
    }

    @Override
    public List<String> listDomains() {
        TreeSet<String> domains = new TreeSet<>();
        for (Workflow workflow : loadAll()) {
            if (workflow.getMetadata().domain() != null) {
                domains.add(workflow.getMetadata().domain());
            }
        }
        return List.copyOf(domains);
    }

    @Override
    public List<String> listTags() {
        TreeSet<String> tags = new TreeSet<>();
        for (Workflow workflow : loadAll()) {
            tags.addAll(workflow.getMetadata().tags());
        }
        return List.copyOf(tags);
    }

    private Path fileFor(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        if (!SAFE_ID.matcher(workflowId).matches()) {
            throw new IllegalArgumentException(
                    "Workflow id cannot be used as a file name: " + workflowId);
        }
        return directory.resolve(workflowId + EXTENSION);
    }

    private List<Workflow> loadAll() {
        List<Workflow> workflows = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : files) {
                try {
                    workflows.add(read(file));
                } catch (IllegalArgumentException | UncheckedIOException e) {
                    logger.warning("Skipping unreadable workflow file " + file + ": " + e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list repository directory: " + directory, e);
        }
        return workflows;
    }

    private Workflow read(Path file) {
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read workflow file: " + file, e);
        }
        try {
            return mapper.readValue(json, Workflow.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize workflow file " + file + ": " + e.getOriginalMessage(), e);
        }
    }

    private void write(Workflow workflow) {
        Path target = fileFor(workflow.getId());
        Path tmp = directory.resolve(workflow.getId() + EXTENSION + ".tmp");
        try {
            Files.writeString(tmp, mapper.writeValueAsString(workflow), StandardCharsets.UTF_8);
            Files.move(
                    tmp,
                    target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write workflow: " + workflow.getId(), e);
        }
    }
}
