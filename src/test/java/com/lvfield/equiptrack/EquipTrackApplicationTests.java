package com.lvfield.equiptrack;

import com.lvfield.equiptrack.config.MilestoneProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@DisplayName("EquipTrackApplication Tests")
class EquipTrackApplicationTests {

    @Autowired
    private MilestoneProperties milestoneProperties;

    @Autowired
    @Qualifier("milestoneExecutor")
    private Executor milestoneExecutor;

    @Test
    @DisplayName("Context loads with milestone settings bound from application.yml")
    void contextLoads() {
        assertNotNull(milestoneExecutor);
        assertEquals(Duration.ofMinutes(5), milestoneProperties.getCacheFreshnessWindow());
        assertEquals(4, milestoneProperties.getExecutorCoreSize());
    }
}
