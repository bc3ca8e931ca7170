package com.example.bloodlink.authz.abac.model;

/**
 * ABAC Actions - what the subject wants to do with the resource.
 */
public enum Action {
    /**
     * Insert a new record. Evaluated against the proposed record, since nothing is stored yet.
     */
    CREATE,

    /**
     * Return a stored record to the caller. List reads evaluate every record on its own.
     */
    READ,

    /**
     * Replace a stored record. Field guards run over the difference between stored and proposed values.
     */
    UPDATE,

    /**
     * Remove a stored record.
     */
    DELETE
}
