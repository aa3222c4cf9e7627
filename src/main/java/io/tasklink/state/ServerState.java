package io.tasklink.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import io.tasklink.config.TaskLinkConfig;
import io.tasklink.persist.PersistenceException;
import io.tasklink.persist.PersistenceManager;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * State kept between runs: per-implant task queues and the most recently
 * seen implants. Callers hold the owning {@link PersistenceManager}'s lock,
 * exclusive for the mutators.
 */
public final class ServerState {
    private static final Comparator<Sighting> NEWEST_FIRST = Comparator
            .comparing(Sighting::when, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Sighting::id, Comparator.nullsLast(Comparator.reverseOrder()));

    @JsonProperty("TaskQ")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Map<String, List<String>> taskQ = new LinkedHashMap<>();

    @JsonProperty("LastSeen")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Sighting> lastSeen = new ArrayList<>();

    public static PersistenceManager<ServerState> open(
            TaskLinkConfig config,
            Consumer<PersistenceException> onError
    ) {
        return PersistenceManager.open(
                ServerState.class,
                ServerState::new,
                PersistenceManager.Options.of(config.stateFile())
                        .withFilePermissions(TaskLinkConfig.FILE_PERMISSIONS)
                        .withWriteDelay(config.stateWriteDelay())
                        .withOnError(onError)
        );
    }

    public static PersistenceManager<ServerState> inMemory() {
        return PersistenceManager.open(ServerState.class, ServerState::new, PersistenceManager.Options.inMemory());
    }

    /**
     * Appends a task to an implant's queue.
     *
     * @return the queue's new length
     */
    public int enqueue(String id, String task) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("ID missing");
        }
        if (task == null || task.isEmpty()) {
            throw new IllegalArgumentException("Empty task");
        }
        List<String> queue = taskQ.computeIfAbsent(id, ignored -> new ArrayList<>());
        queue.add(task);
        return queue.size();
    }

    /**
     * Removes and returns the oldest task queued for an implant. An emptied
     * queue is removed entirely.
     */
    public Optional<String> nextTask(String id) {
        List<String> queue = taskQ.get(id);
        if (queue == null || queue.isEmpty()) {
            taskQ.remove(id);
            return Optional.empty();
        }
        String task = queue.remove(0);
        if (queue.isEmpty()) {
            taskQ.remove(id);
        }
        return Optional.of(task);
    }

    public int queueLength(String id) {
        List<String> queue = taskQ.get(id);
        return queue == null ? 0 : queue.size();
    }

    public List<String> tasksFor(String id) {
        List<String> queue = taskQ.get(id);
        return queue == null ? List.of() : List.copyOf(queue);
    }

    public Map<String, List<String>> taskQueues() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        taskQ.forEach((id, queue) -> copy.put(id, List.copyOf(queue)));
        return copy;
    }

    public boolean saw(String id, String from) {
        return saw(id, from, Instant.now());
    }

    /**
     * Records a sighting, keeping at most {@link TaskLinkConfig#N_SEEN}
     * distinct implants, newest first.
     *
     * @return whether the implant was not already in the list
     */
    public boolean saw(String id, String from, Instant when) {
        boolean fresh = !lastSeen.removeIf(s -> Objects.equals(s.id(), id));
        lastSeen.add(new Sighting(id, from, when));
        lastSeen.sort(NEWEST_FIRST);
        while (lastSeen.size() > TaskLinkConfig.N_SEEN) {
            lastSeen.remove(lastSeen.size() - 1);
        }
        return fresh;
    }

    public List<Sighting> lastSeen() {
        return List.copyOf(lastSeen);
    }
}
