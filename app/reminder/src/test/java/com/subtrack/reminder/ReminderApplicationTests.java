package com.subtrack.reminder;

import static org.assertj.core.api.Assertions.assertThat;

import com.subtrack.reminder.service.SchedulerRunService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ReminderApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private SchedulerRunService schedulerRunService;

  @Test
  void contextLoads() {
    assertThat(schedulerRunService).isNotNull();
  }
}
