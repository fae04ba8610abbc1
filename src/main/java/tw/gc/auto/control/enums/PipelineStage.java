package tw.gc.auto.control.enums;

/**
 * Membership stage of a candidate within one promotion pipeline.
 * PENDING → PROMOTED | REJECTED; both outcomes are final for that pipeline.
 */
public enum PipelineStage {
    PENDING,
    PROMOTED,
    REJECTED
}
