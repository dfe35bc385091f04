package dev.reminderbot;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Terminates the process after closing the application context.
 * Separated to allow mocking in tests; {@code reminder.exit-on-failure=false} turns it into a no-op.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExitManager {

  private final ApplicationContext context;

  @Value("${reminder.exit-on-failure:true}")
  private boolean exitOnFailure;

  public void exit(int status) {
    if (!exitOnFailure) {
      log.warn("Exit with status {} suppressed by configuration", status);
      return;
    }
    System.exit(SpringApplication.exit(context, () -> status));
  }
}
