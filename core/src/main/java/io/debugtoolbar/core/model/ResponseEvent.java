package io.debugtoolbar.core.model;

/**
 * One message of a streamed HTTP response: either the start (status and headers) or a chunk of the
 * body. A well-formed response is exactly one {@link ResponseStart} followed by zero or more
 * {@link ResponseBody} chunks, the last of which has {@code moreBody == false}.
 */
public sealed interface ResponseEvent permits ResponseStart, ResponseBody {}
