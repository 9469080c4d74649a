package com.chambua.qualifiers.model;

import com.chambua.qualifiers.util.TeamNameNormalizer;

final class TeamKeys {
    private TeamKeys() {}

    static String storeKey(String team, Confederation confederation, String group) {
        return TeamNameNormalizer.key(team) + "|" + confederation.name() + "|" + TeamNameNormalizer.key(group);
    }
}
