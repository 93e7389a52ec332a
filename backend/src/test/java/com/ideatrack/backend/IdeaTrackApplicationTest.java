package com.ideatrack.backend;

import com.ideatrack.backend.repo.InMemoryStore;
import com.ideatrack.backend.service.NotificationPublisher;
import com.ideatrack.backend.service.LoggingNotificationPublisher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class IdeaTrackApplicationTest {

    @Autowired
    InMemoryStore store;

    @Autowired
    NotificationPublisher publisher;

    @Test
    void contextLoadsWithMemoryOnlyStore() {
        assertThat(store.submissions).isEmpty();
        assertThat(publisher).isInstanceOf(LoggingNotificationPublisher.class);
    }
}
