package com.uitgo.proximity.model;

/**
 * Overlay class of an entity, derived from its id on every query
 */
public enum EntityClass {
    /** Real, billable entity such as an actual driver */
    PRIMARY,
    /** Synthetic filler used to inflate the dataset for load testing */
    SECONDARY
}
