package ebulter.lms.lambda.model;

/**
 * Result of recomputing a learner's path progress, with the state it replaced.
 */
public class PathProgressChange {
    private final PathProgress progress;
    private final boolean wasCompleted;
    private final boolean created;

    public PathProgressChange(PathProgress progress, boolean wasCompleted, boolean created) {
        this.progress = progress;
        this.wasCompleted = wasCompleted;
        this.created = created;
    }

    public PathProgress getProgress() {
        return progress;
    }

    public boolean isCreated() {
        return created;
    }

    public boolean isJustCompleted() {
        return !wasCompleted && progress.isCompleted();
    }
}
