package io.mindmesh.error;

/**
 * A request envelope that decoded as JSON but lacks a required field. When the correlation id is
 * known the server answers with an error response instead of dropping the connection.
 */
public class MalformedRequestException extends MeshException {
    private final String requestId;

    public MalformedRequestException(String requestId, String message) {
        super(message);
        this.requestId = requestId;
    }

    public String requestId() {
        return requestId;
    }

    public boolean recoverable() {
        return requestId != null && !requestId.isBlank();
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.MALFORMED_REQUEST;
    }
}
