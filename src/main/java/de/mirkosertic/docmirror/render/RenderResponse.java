package de.mirkosertic.docmirror.render;

/**
 * HTTP-style outcome of a render call: 200 carries the artifact bytes, 429 signals
 * rate limiting, anything else is an error.
 */
public record RenderResponse(
        int status,
        byte[] body
) {

    public static final int OK = 200;
    public static final int TOO_MANY_REQUESTS = 429;

    public static RenderResponse ok(final byte[] body) {
        return new RenderResponse(OK, body);
    }

    public static RenderResponse status(final int status) {
        return new RenderResponse(status, new byte[0]);
    }

    public boolean isSuccess() {
        return status == OK;
    }
}
