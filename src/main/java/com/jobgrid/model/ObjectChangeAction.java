package com.jobgrid.model;

public enum ObjectChangeAction {
    CREATE,
    UPDATE,
    DELETE
}
