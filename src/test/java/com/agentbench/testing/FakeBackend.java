package com.agentbench.testing;

import com.agentbench.backend.BackendHandle;
import com.agentbench.backend.ExecutionBackend;
import com.agentbench.backend.JobDescriptor;
import com.agentbench.backend.LogPage;
import com.agentbench.backend.PollResult;
import com.agentbench.core.model.ProviderKind;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Scriptable backend. Submits go through {@code onSubmit}, polls walk through {@code polls}
 * (repeating the last one), logs are served from an in-memory list with offset cursors.
 */
public class FakeBackend implements ExecutionBackend {

    private final ProviderKind kind;
    private final List<PollResult> polls = new CopyOnWriteArrayList<>();
    private final List<String> logs = new CopyOnWriteArrayList<>();
    private final List<JobDescriptor> submitted = new CopyOnWriteArrayList<>();
    private final List<BackendHandle> cancelled = new CopyOnWriteArrayList<>();
    private final AtomicInteger pollCount = new AtomicInteger();
    private volatile Function<JobDescriptor, BackendHandle> onSubmit;
    private volatile Runnable onPoll = () -> {};

    public FakeBackend(ProviderKind kind) {
        this.kind = kind;
        this.onSubmit = d -> new BackendHandle(kind, "task-" + d.jobId(), "arn:task/" + d.jobId(),
                "/test/logs", "stream-" + d.jobId(), null, 0L);
    }

    public FakeBackend onSubmit(Function<JobDescriptor, BackendHandle> onSubmit) {
        this.onSubmit = onSubmit;
        return this;
    }

    public FakeBackend failSubmitsWith(RuntimeException failure) {
        return onSubmit(d -> {
            throw failure;
        });
    }

    public FakeBackend pollsReturn(PollResult... results) {
        polls.clear();
        polls.addAll(List.of(results));
        return this;
    }

    /** Runs before every poll, typically to move a {@link MutableClock}. */
    public FakeBackend onPoll(Runnable hook) {
        this.onPoll = hook;
        return this;
    }

    public FakeBackend emitLogs(String... lines) {
        logs.addAll(List.of(lines));
        return this;
    }

    @Override
    public ProviderKind kind() {
        return kind;
    }

    @Override
    public BackendHandle submit(JobDescriptor descriptor) {
        submitted.add(descriptor);
        return onSubmit.apply(descriptor);
    }

    @Override
    public PollResult poll(BackendHandle handle) {
        onPoll.run();
        int n = pollCount.getAndIncrement();
        if (polls.isEmpty()) {
            return PollResult.running(List.of());
        }
        return polls.get(Math.min(n, polls.size() - 1));
    }

    @Override
    public void cancel(BackendHandle handle) {
        cancelled.add(handle);
    }

    @Override
    public LogPage fetchLogs(BackendHandle handle, String cursor) {
        int offset = cursor == null ? 0 : Integer.parseInt(cursor);
        List<String> snapshot = new ArrayList<>(logs);
        if (offset >= snapshot.size()) {
            return LogPage.empty(cursor);
        }
        return new LogPage(snapshot.subList(offset, snapshot.size()), String.valueOf(snapshot.size()));
    }

    public List<JobDescriptor> submitted() {
        return submitted;
    }

    public int submitCount() {
        return submitted.size();
    }

    public List<BackendHandle> cancelled() {
        return cancelled;
    }

    public int pollCount() {
        return pollCount.get();
    }
}
