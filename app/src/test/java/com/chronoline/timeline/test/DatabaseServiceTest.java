package com.chronoline.timeline.test;

import com.chronoline.timeline.core.db.DatabaseService;
import com.chronoline.timeline.core.service.ManagedService;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusTest
class DatabaseServiceTest {

    @Inject
    DatabaseService databaseService;

    @Test
    void startsInRunningState() {
        assertThat(databaseService.state()).isEqualTo(ManagedService.State.RUNNING);
    }

    @Test
    void pingReturnsTrue() {
        assertThat(databaseService.ping()).isTrue();
    }

    @Test
    void storeVersionNamesTheDriver() {
        assertThat(databaseService.storeVersion()).containsIgnoringCase("H2");
    }

    @Test
    void migrationsSeedCategories() {
        var count = databaseService.jdbi()
                .withHandle(h -> h.createQuery("SELECT COUNT(*) FROM categories WHERE parent_id IS NULL")
                        .mapTo(Integer.class).one());
        assertThat(count).isGreaterThanOrEqualTo(10);
    }
}
