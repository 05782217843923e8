package github.sarthakdev143.production_planner.model.validation;

/**
 * A symbolic id used somewhere in a manifest that names no declared entity.
 *
 * @param kind        what kind of reference failed to resolve
 * @param ownerId     the scene, cue or job holding the reference
 * @param referenceId the unresolved id
 */
public record DanglingReference(
        Kind kind,
        String ownerId,
        String referenceId) {

    public enum Kind {
        SCENE_VISUAL_ASSET,
        SCENE_MUSIC_CUE,
        MUSIC_CUE_ASSET,
        JOB_RESULT_ASSET,
        JOB_DEPENDENCY,
        DUPLICATE_JOB_ID
    }

    public String describe() {
        return switch (kind) {
            case SCENE_VISUAL_ASSET -> "scene " + ownerId + " references unknown asset " + referenceId;
            case SCENE_MUSIC_CUE -> "scene " + ownerId + " references unknown music cue " + referenceId;
            case MUSIC_CUE_ASSET -> "music cue " + ownerId + " references unknown asset " + referenceId;
            case JOB_RESULT_ASSET -> "job " + ownerId + " produces undeclared asset " + referenceId;
            case JOB_DEPENDENCY -> "job " + ownerId + " depends on unknown job " + referenceId;
            case DUPLICATE_JOB_ID -> "job id " + referenceId + " is declared more than once";
        };
    }
}
