package com.chambua.qualifiers.service;

import com.chambua.qualifiers.dto.StandingIngestItem;
import com.chambua.qualifiers.model.Confederation;
import com.chambua.qualifiers.model.LookupLevel;
import com.chambua.qualifiers.model.ProbabilityResult;
import com.chambua.qualifiers.model.QualificationStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHasherTest {

    private final ContentHasher hasher = new ContentHasher();

    private static StandingIngestItem item(String team, int points) {
        return new StandingIngestItem(team, "UEFA", "Group A", 1, points, 6, 4, "In Progress");
    }

    @Test
    void identicalInputGivesIdenticalHash() {
        List<StandingIngestItem> a = List.of(item("Spain", 13), item("Norway", 9));
        List<StandingIngestItem> b = List.of(item("Spain", 13), item("Norway", 9));
        assertThat(hasher.inputHash(a)).isEqualTo(hasher.inputHash(b)).hasSize(64);
    }

    @Test
    void rowOrderDoesNotMatter() {
        assertThat(hasher.inputHash(List.of(item("Spain", 13), item("Norway", 9))))
                .isEqualTo(hasher.inputHash(List.of(item("Norway", 9), item("Spain", 13))));
    }

    @Test
    void whitespaceAndLabelCaseAreIgnored() {
        StandingIngestItem spaced = new StandingIngestItem("  Spain ", "uefa", "Group  A", 1, 13, 6, 4, "in progress");
        assertThat(hasher.inputHash(List.of(spaced))).isEqualTo(hasher.inputHash(List.of(item("Spain", 13))));
    }

    @Test
    void recasedTeamNameChangesTheHash() {
        StandingIngestItem before = new StandingIngestItem("Cote D'Ivoire", "CAF", "Group F", 1, 13, 6, 4, "In Progress");
        StandingIngestItem after = new StandingIngestItem("Cote d'Ivoire", "CAF", "Group F", 1, 13, 6, 4, "In Progress");
        assertThat(hasher.inputHash(List.of(before))).isNotEqualTo(hasher.inputHash(List.of(after)));
    }

    @Test
    void unreadableNumberIsPartOfTheHash() {
        StandingIngestItem blank = new StandingIngestItem("Spain", "UEFA", "Group A", null, 13, 6, 4, "In Progress");
        StandingIngestItem garbled = new StandingIngestItem("Spain", "UEFA", "Group A", null, 13, 6, 4, "In Progress");
        garbled.markUnreadable("rank", "x");
        assertThat(hasher.inputHash(List.of(blank))).isNotEqualTo(hasher.inputHash(List.of(garbled)));
    }

    @Test
    void changedPointsChangeTheHash() {
        assertThat(hasher.inputHash(List.of(item("Spain", 13))))
                .isNotEqualTo(hasher.inputHash(List.of(item("Spain", 14))));
    }

    @Test
    void nullItemsAreHashedRatherThanRejected() {
        List<StandingIngestItem> withNull = new ArrayList<>(Arrays.asList(item("Spain", 13), null));
        assertThat(hasher.inputHash(withNull)).isNotEqualTo(hasher.inputHash(List.of(item("Spain", 13))));
    }

    @Test
    void outputHashTracksProbabilityAndStatus() {
        ProbabilityResult a = new ProbabilityResult("Spain", Confederation.UEFA, "Group A", 1, 13, 6, 4, 88.5,
                QualificationStatus.IN_PROGRESS, LookupLevel.RANK);
        ProbabilityResult b = new ProbabilityResult("Spain", Confederation.UEFA, "Group A", 1, 13, 6, 4, 88.51,
                QualificationStatus.IN_PROGRESS, LookupLevel.RANK);

        assertThat(hasher.outputHash(List.of(a))).isEqualTo(hasher.outputHash(List.of(a)));
        assertThat(hasher.outputHash(List.of(a))).isNotEqualTo(hasher.outputHash(List.of(b)));
    }
}
