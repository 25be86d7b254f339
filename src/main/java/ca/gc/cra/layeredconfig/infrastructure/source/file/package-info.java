/**
 * <strong>Purpose:</strong> File-backed sources for INI, JSON, YAML, and XML property-list documents.
 * <p><strong>Recovery:</strong> A missing or unreadable file is logged at WARN and treated as an empty, writable
 * source; malformed content raises {@link java.lang.IllegalArgumentException}.</p>
 * <p><strong>Persistence:</strong> {@code write()} rewrites the whole document, with keys sorted for the structured
 * formats.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.layeredconfig.infrastructure.source.file;
