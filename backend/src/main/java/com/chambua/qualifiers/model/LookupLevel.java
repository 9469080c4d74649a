package com.chambua.qualifiers.model;

/** How a historical base rate was found: exact group rank, coarse bucket, or not at all. */
public enum LookupLevel { RANK, BUCKET, NONE }
