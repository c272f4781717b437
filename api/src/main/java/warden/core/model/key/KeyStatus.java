package warden.core.model.key;

/**
 * Lifecycle status of signing and encryption keys.
 *
 * <pre>
 * PENDING → ACTIVE → DEPRECATED → RETIRED
 * </pre>
 *
 * <ul>
 *   <li>{@link #PENDING} - staged, not yet used</li>
 *   <li>{@link #ACTIVE} - issues new tokens and validates existing ones</li>
 *   <li>{@link #DEPRECATED} - validates existing tokens only</li>
 *   <li>{@link #RETIRED} - unusable; tokens depending on it no longer validate</li>
 * </ul>
 */
public enum KeyStatus {
    PENDING,
    ACTIVE,
    DEPRECATED,
    RETIRED
}
