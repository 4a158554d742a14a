/**
 * Interfaces for the text formats at either end of an editing session.
 * <p>
 * Implementations live in separate modules (e.g., Jackson).
 */
package works.quill.format;
