package mediagate.gpu.model;

/**
 * Kind of media a job produces.
 */
public enum JobKind {
    IMAGE,
    VIDEO,
    SPEECH
}
