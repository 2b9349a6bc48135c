package io.debugtoolbar.core.error;

/**
 * The wrapped application broke the response event contract: a second start event, a body chunk
 * before the start, or a chunk after the final one. Fatal for that response only.
 */
public final class ProtocolViolationException extends ToolbarException {

    private static final long serialVersionUID = 1L;

    public ProtocolViolationException(String message) {
        super(message, Stage.CAPTURE);
    }
}
