package com.ideatrack.backend.service;

import com.ideatrack.backend.domain.RefinementType;
import com.ideatrack.backend.domain.UserAccuracyProfile;
import com.ideatrack.backend.support.IdeaTrackFixture;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ReputationServiceTest {

    private final IdeaTrackFixture f = new IdeaTrackFixture();

    @Test
    void profileCombinesAccuracyCalibrationAndEarliness() {
        String a = f.submit("alice", 0.8);
        String c = f.submit("alice", null);
        f.submit("alice", 0.3);
        f.validate(a, 1.0, 196);
        f.validate(c, 0.2, 30);

        UserAccuracyProfile p = f.reputation.getProfile("alice");

        assertThat(p.totalSubmissions()).isEqualTo(3);
        assertThat(p.totalValidations()).isEqualTo(2);
        assertThat(p.accuracyRate()).isEqualTo(0.5);
        assertThat(p.calibrationScore()).isCloseTo(0.8, within(1e-9));
        assertThat(p.meanDaysEarly()).isCloseTo(113.0, within(1e-9));
        assertThat(p.reputationScore()).isCloseTo(0.5328767, within(1e-6));
        assertThat(p.lastValidationAt()).isEqualTo(IdeaTrackFixture.T0.plusSeconds(196 * 86_400L));
    }

    @Test
    void uncertaintyIsNotPenalised() {
        String a = f.submit("alice", null);
        f.validate(a, 0.1, 0);

        UserAccuracyProfile p = f.reputation.getProfile("alice");

        assertThat(p.calibrationScore()).isEqualTo(1.0);
        assertThat(p.accuracyRate()).isZero();
    }

    @Test
    void ownerWithoutValidationsScoresZero() {
        f.submit("alice", 0.9);

        UserAccuracyProfile p = f.reputation.getProfile("alice");

        assertThat(p.totalSubmissions()).isEqualTo(1);
        assertThat(p.totalValidations()).isZero();
        assertThat(p.reputationScore()).isZero();
        assertThat(p.calibrationScore()).isZero();
    }

    @Test
    void unknownOwnerGetsEmptyProfile() {
        UserAccuracyProfile p = f.reputation.getProfile("nobody");

        assertThat(p.ownerId()).isEqualTo("nobody");
        assertThat(p.totalSubmissions()).isZero();
        assertThat(p.reputationScore()).isZero();
        assertThat(f.store.profiles).doesNotContainKey("nobody");
    }

    @Test
    void earlinessContributionIsCappedAtOneYear() {
        String a = f.submit("alice", 1.0);
        f.validate(a, 1.0, 3 * 365);

        UserAccuracyProfile p = f.reputation.getProfile("alice");

        assertThat(p.reputationScore()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void recomputeIsIdempotentAndMatchesDerivation() {
        String a = f.submit("alice", 0.6);
        f.validate(a, 0.9, 40);

        UserAccuracyProfile first = f.reputation.recompute("alice");
        UserAccuracyProfile second = f.reputation.recompute("alice");

        assertThat(second).isEqualTo(first);
        assertThat(f.store.profiles.get("alice")).isEqualTo(f.reputation.derive("alice"));
    }

    @Test
    void directAndInheritedTotalsStayPerOwner() {
        String a = f.submit("alice", null);
        String b = f.submit("bob", null);
        f.lineage.link(a, b, RefinementType.PIVOT, 0.5, null);
        f.validate(b, 1.0, 0);

        UserAccuracyProfile alice = f.reputation.getProfile("alice");
        UserAccuracyProfile bob = f.reputation.getProfile("bob");

        assertThat(alice.directScoreTotal()).isZero();
        assertThat(alice.inheritedCreditTotal()).isEqualTo(0.5);
        assertThat(alice.totalValidations()).isZero();
        assertThat(bob.directScoreTotal()).isEqualTo(1.0);
        assertThat(bob.inheritedCreditTotal()).isZero();
    }
}
