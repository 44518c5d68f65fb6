package com.acme.finops.fieldpath.tree;

public enum WriteErrorCode {
    /** A non-map value sits where the path needs a map. */
    PATH_BLOCKED,
    /** A map-only root was given a non-map value. */
    ROOT_NOT_MAP
}
