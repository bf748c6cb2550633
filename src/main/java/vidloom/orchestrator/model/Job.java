package vidloom.orchestrator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of a video generation job.
 * The generation parameters live in {@link GenerationSpec}, stored next to the job.
 */
public final class Job {
    private final String id;
    private final String ownerId;
    private final String name;
    private final JobStatus status;
    private final int progressPercentage;
    private final String currentStep;
    private final String errorMessage;
    private final boolean markedAsRead;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.ownerId = builder.ownerId;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.progressPercentage = builder.progressPercentage;
        this.currentStep = builder.currentStep;
        this.errorMessage = builder.errorMessage;
        this.markedAsRead = builder.markedAsRead;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String ownerId() {
        return ownerId;
    }

    public String name() {
        return name;
    }

    public JobStatus status() {
        return status;
    }

    public int progressPercentage() {
        return progressPercentage;
    }

    public String currentStep() {
        return currentStep;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public boolean markedAsRead() {
        return markedAsRead;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    /** Check if job is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Check if the job can still be cancelled */
    public boolean isCancellable() {
        return status.canTransitionTo(JobStatus.CANCELLED);
    }

    /**
     * Display name derived from the prompt: kept as is up to 50 characters,
     * otherwise cut to 47 characters followed by "...".
     */
    public static String nameFromPrompt(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return "Untitled";
        }
        String trimmed = prompt.strip();
        return trimmed.length() > 50 ? trimmed.substring(0, 47) + "..." : trimmed;
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .ownerId(ownerId)
                .name(name)
                .status(status)
                .progressPercentage(progressPercentage)
                .currentStep(currentStep)
                .errorMessage(errorMessage)
                .markedAsRead(markedAsRead)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String ownerId;
        private String name;
        private JobStatus status = JobStatus.PENDING;
        private int progressPercentage = 0;
        private String currentStep;
        private String errorMessage;
        private boolean markedAsRead = false;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder progressPercentage(int progressPercentage) {
            this.progressPercentage = progressPercentage;
            return this;
        }

        public Builder currentStep(String currentStep) {
            this.currentStep = currentStep;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder markedAsRead(boolean markedAsRead) {
            this.markedAsRead = markedAsRead;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', status=" + status + ", progress=" + progressPercentage + "}";
    }
}
