package express.mvp.mcpr.transport.routing;

/**
 * Logical families of operations that may be bound to different transports.
 *
 * <p>{@link #DEFAULT} is the fallback binding for any kind without an explicit one.
 */
public enum CapabilityKind {
    TOOL,
    RESOURCE,
    PROMPT,
    AUTH,
    DEFAULT
}
