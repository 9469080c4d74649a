package com.chambua.qualifiers.model;

public enum RunType { PROBABILITY_UPDATE, HISTORICAL_IMPORT, LOOKUP_REBUILD }
