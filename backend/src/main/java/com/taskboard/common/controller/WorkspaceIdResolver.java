package com.taskboard.common.controller;

import com.taskboard.exception.MissingWorkspaceIdException;

/**
 * Picks the workspace id a request targets. Path variable wins over query parameter,
 * query parameter wins over request body.
 */
public final class WorkspaceIdResolver {

    private WorkspaceIdResolver() {
    }

    public static Long resolve(Long fromPath, Long fromQuery, Long fromBody) {
        if (fromPath != null) {
            return fromPath;
        }
        if (fromQuery != null) {
            return fromQuery;
        }
        if (fromBody != null) {
            return fromBody;
        }
        throw new MissingWorkspaceIdException();
    }

    public static Long resolve(Long fromQuery, Long fromBody) {
        return resolve(null, fromQuery, fromBody);
    }
}
