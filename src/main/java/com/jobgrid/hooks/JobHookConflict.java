package com.jobgrid.hooks;

import com.jobgrid.model.ObjectChangeAction;

/**
 * An existing job hook already covers the same job, content type and action.
 *
 * @param field   the action flag that conflicts, e.g. {@code type_create}
 * @param message human readable description of the conflict
 */
public record JobHookConflict(
        String field,
        String contentType,
        ObjectChangeAction action,
        String message) {

    static String fieldFor(ObjectChangeAction action) {
        return switch (action) {
            case CREATE -> "type_create";
            case UPDATE -> "type_update";
            case DELETE -> "type_delete";
        };
    }
}
