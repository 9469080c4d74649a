package com.chambua.qualifiers.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "qualifiers")
public class QualifierProperties {

    private Runs runs = new Runs();
    private Lookup lookup = new Lookup();
    private Standings standings = new Standings();
    private List<Host> hosts = new ArrayList<>();

    public static class Runs {
        // Report the previous successful run instead of recomputing identical input
        private boolean skipDuplicateInput = true;
        // RUNNING runs older than this are treated as abandoned and marked FAILED
        private long staleAfterMinutes = 120;

        public boolean isSkipDuplicateInput() { return skipDuplicateInput; }
        public void setSkipDuplicateInput(boolean skipDuplicateInput) { this.skipDuplicateInput = skipDuplicateInput; }
        public long getStaleAfterMinutes() { return staleAfterMinutes; }
        public void setStaleAfterMinutes(long staleAfterMinutes) { this.staleAfterMinutes = staleAfterMinutes; }
    }

    public static class Lookup {
        // Rank-level entries backed by fewer archived rows are left to the bucket level
        private int minRankSamples = 1;

        public int getMinRankSamples() { return minRankSamples; }
        public void setMinRankSamples(int minRankSamples) { this.minRankSamples = minRankSamples; }
    }

    public static class Standings {
        private String csvPath = "data/standings/current_standings.csv";

        public String getCsvPath() { return csvPath; }
        public void setCsvPath(String csvPath) { this.csvPath = csvPath; }
    }

    /** A tournament host, qualified automatically and listed in every probability run. */
    public static class Host {
        private String team;
        private String confederation;
        private String group = "Host";

        public Host() {}

        public Host(String team, String confederation) {
            this.team = team;
            this.confederation = confederation;
        }

        public String getTeam() { return team; }
        public void setTeam(String team) { this.team = team; }
        public String getConfederation() { return confederation; }
        public void setConfederation(String confederation) { this.confederation = confederation; }
        public String getGroup() { return group; }
        public void setGroup(String group) { this.group = group; }
    }

    public Runs getRuns() { return runs; }
    public void setRuns(Runs runs) { this.runs = runs; }
    public Lookup getLookup() { return lookup; }
    public void setLookup(Lookup lookup) { this.lookup = lookup; }
    public Standings getStandings() { return standings; }
    public void setStandings(Standings standings) { this.standings = standings; }
    public List<Host> getHosts() { return hosts; }
    public void setHosts(List<Host> hosts) { this.hosts = hosts; }
}
