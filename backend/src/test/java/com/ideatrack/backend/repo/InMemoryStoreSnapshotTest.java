package com.ideatrack.backend.repo;

import com.ideatrack.backend.config.IdeaTrackProperties;
import com.ideatrack.backend.config.JacksonConfig;
import com.ideatrack.backend.domain.RefinementType;
import com.ideatrack.backend.domain.SubmissionStatus;
import com.ideatrack.backend.service.storage.StoreSnapshotFile;
import com.ideatrack.backend.support.IdeaTrackFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryStoreSnapshotTest {

    @TempDir
    Path dir;

    private IdeaTrackProperties props(Path file) {
        IdeaTrackProperties props = new IdeaTrackProperties();
        props.getStorage().setSnapshotPath(file.toString());
        return props;
    }

    private InMemoryStore open(IdeaTrackProperties props) {
        return new InMemoryStore(new StoreSnapshotFile(props, JacksonConfig.buildMapper()));
    }

    @Test
    void reloadedStoreRestoresCommittedState() {
        Path file = dir.resolve("state/store.json");
        IdeaTrackProperties props = props(file);
        InMemoryStore store = open(props);
        IdeaTrackFixture f = new IdeaTrackFixture(props, store);

        String a = f.submit("alice", 0.8);
        String b = f.submit("bob", 0.4);
        f.lineage.link(a, b, RefinementType.TECHNICAL_DEPTH, 0.3, "Which parts?");
        f.validate(b, 1.0, 60);

        assertThat(file).exists();
        assertThat(dir.resolve("state/store.json.tmp")).doesNotExist();

        InMemoryStore reloaded = open(props);

        assertThat(reloaded.submissions).isEqualTo(store.submissions);
        assertThat(reloaded.submissions.get(a).status()).isEqualTo(SubmissionStatus.SUPERSEDED);
        assertThat(reloaded.edgesByChild).isEqualTo(store.edgesByChild);
        assertThat(reloaded.childIds(a)).containsExactly(b);
        assertThat(reloaded.outcomes).isEqualTo(store.outcomes);
        assertThat(reloaded.ledgerBySource).isEqualTo(store.ledgerBySource);
        assertThat(reloaded.creditTotal(a)).isEqualTo(store.creditTotal(a));
        assertThat(reloaded.profiles).isEqualTo(store.profiles);
    }

    @Test
    void failedSnapshotCommitRollsBackTheWrite() throws Exception {
        Path file = dir.resolve("store.json");
        IdeaTrackProperties props = props(file);
        InMemoryStore store = open(props);
        IdeaTrackFixture f = new IdeaTrackFixture(props, store);
        String a = f.submit("alice", 0.5);
        int historyBefore = store.history.size();

        // the file can no longer be replaced
        Files.delete(file);
        Files.createDirectories(file.resolve("blocker"));

        assertThatThrownBy(() -> f.submit("alice", null)).isInstanceOf(UncheckedIOException.class);

        assertThat(store.submissions).containsOnlyKeys(a);
        assertThat(store.profiles.get("alice").totalSubmissions()).isEqualTo(1);
        assertThat(store.history).hasSize(historyBefore);
    }

    @Test
    void failedActionRollsBackEarlierMutations() {
        InMemoryStore store = new InMemoryStore();
        IdeaTrackFixture f = new IdeaTrackFixture(new IdeaTrackProperties(), store);
        String a = f.submit("alice", null);

        assertThatThrownBy(() -> store.write(() -> {
            store.submissions.remove(a);
            store.outcomes.clear();
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(store.submissions).containsOnlyKeys(a);
    }

    @Test
    void missingFileStartsEmpty() {
        InMemoryStore store = open(props(dir.resolve("absent.json")));

        assertThat(store.submissions).isEmpty();
    }

    @Test
    void corruptFileFailsStartup() throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> open(props(file))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void blankPathKeepsEverythingInMemory() {
        IdeaTrackProperties props = new IdeaTrackProperties();
        StoreSnapshotFile snapshotFile = new StoreSnapshotFile(props, JacksonConfig.buildMapper());
        IdeaTrackFixture f = new IdeaTrackFixture(props, new InMemoryStore(snapshotFile));

        f.submit("alice", null);

        assertThat(snapshotFile.isEnabled()).isFalse();
        assertThat(dir).isEmptyDirectory();
    }
}
