package de.mirkosertic.gitwebdiff.api;

/**
 * Status code and JSON body of a handled request.
 */
record ApiResponse(int status, Object body) {

    static ApiResponse ok(final Object body) {
        return new ApiResponse(200, body);
    }

    static ApiResponse of(final int status, final Object body) {
        return new ApiResponse(status, body);
    }
}
