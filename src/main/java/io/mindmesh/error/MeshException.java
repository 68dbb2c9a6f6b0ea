package io.mindmesh.error;

/**
 * Root of the mesh error taxonomy. Every subclass reports a fixed {@link ErrorKind} so callers can
 * branch on the kind instead of the concrete type.
 */
public abstract class MeshException extends RuntimeException {
    protected MeshException(String message) {
        super(message);
    }

    protected MeshException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
