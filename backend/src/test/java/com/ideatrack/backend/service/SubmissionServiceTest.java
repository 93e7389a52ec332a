package com.ideatrack.backend.service;

import com.ideatrack.backend.domain.IdeaSubmission;
import com.ideatrack.backend.domain.SubmissionStatus;
import com.ideatrack.backend.error.SubmissionNotFoundException;
import com.ideatrack.backend.error.ValidationException;
import com.ideatrack.backend.support.IdeaTrackFixture;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubmissionServiceTest {

    private final IdeaTrackFixture f = new IdeaTrackFixture();

    @Test
    void identicalSubmissionsGetDistinctTrackingIds() {
        IdeaSubmission a = f.submissions.create("alice", "privacy-first analytics will be huge", 0.7, null);
        IdeaSubmission b = f.submissions.create("alice", "privacy-first analytics will be huge", 0.7, null);

        assertThat(a.id()).isNotEqualTo(b.id());
        assertThat(f.store.submissions).hasSize(2);
    }

    @Test
    void trackingIdUsesUnambiguousAlphabet() {
        String id = f.submit("alice", null);

        assertThat(id).matches("IDEA-[ABCDEFGHJKLMNPQRSTUVWXYZ23456789]{6}");
    }

    @Test
    void createdSubmissionIsStoredAsSubmitted() {
        IdeaSubmission s = f.submissions.create("alice", "text", null, "technical");

        IdeaSubmission loaded = f.submissions.get(s.id());
        assertThat(loaded.status()).isEqualTo(SubmissionStatus.SUBMITTED);
        assertThat(loaded.createdAt()).isEqualTo(IdeaTrackFixture.T0);
        assertThat(loaded.confidence()).isNull();
        assertThat(loaded.classification()).isEqualTo("technical");
    }

    @Test
    void rejectsConfidenceOutsideUnitInterval() {
        assertThatThrownBy(() -> f.submissions.create("alice", "text", 1.5, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> f.submissions.create("alice", "text", -0.01, null))
                .isInstanceOf(ValidationException.class);
        assertThat(f.store.submissions).isEmpty();
    }

    @Test
    void rejectsMissingOwnerOrText() {
        assertThatThrownBy(() -> f.submissions.create(" ", "text", null, null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> f.submissions.create("alice", "", null, null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void unknownTrackingIdIsNotFound() {
        assertThatThrownBy(() -> f.submissions.get("IDEA-ZZZZZZ"))
                .isInstanceOf(SubmissionNotFoundException.class)
                .hasMessageContaining("IDEA-ZZZZZZ");
    }

    @Test
    void creationIsRecordedInOwnerHistory() {
        String id = f.submit("alice", 0.5);

        assertThat(f.history.query("alice", "SUBMISSION", id, "CREATE", 10)).hasSize(1);
        assertThat(f.history.query("bob", null, null, null, 10)).isEmpty();
    }

    @Test
    void firstSubmissionPublishesTheNewProfile() {
        f.submit("alice", 0.5);
        assertThat(f.publisher.profiles).extracting("ownerId").containsExactly("alice");

        f.submit("alice", 0.9);
        assertThat(f.publisher.profiles).hasSize(1);
    }
}
