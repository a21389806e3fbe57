package com.jobgrid.hooks;

import com.jobgrid.model.ChangeContext;
import com.jobgrid.model.ObjectChangeAction;

import java.util.UUID;

/**
 * A committed change to a tracked object, published by the change logging layer.
 *
 * @param contentType   {@code app_label.model} of the changed object
 * @param action        what happened to the object
 * @param changeId      id of the object change record
 * @param user          user that made the change, or {@code null}
 * @param changeContext where the change originated
 */
public record ObjectChangeEvent(
        String contentType,
        ObjectChangeAction action,
        UUID changeId,
        String user,
        ChangeContext changeContext) {
}
