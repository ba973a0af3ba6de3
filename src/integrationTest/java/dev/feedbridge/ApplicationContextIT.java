package dev.feedbridge;

import static org.assertj.core.api.Assertions.assertThat;

import dev.feedbridge.bridge.BridgeLoop;
import dev.feedbridge.bridge.CycleReport;
import dev.feedbridge.bridge.Orchestrator;
import dev.feedbridge.session.AuthenticatorRegistry;
import dev.feedbridge.source.LoginType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class ApplicationContextIT extends BaseIntegrationTest {

  @Autowired private Orchestrator orchestrator;
  @Autowired private BridgeLoop bridgeLoop;
  @Autowired private AuthenticatorRegistry authenticators;

  @Test
  void contextStartsWithLoopDisabled() {
    assertThat(bridgeLoop.isAutoStartup()).isFalse();
    assertThat(bridgeLoop.isRunning()).isFalse();
  }

  @Test
  void registersAuthenticatorForEveryLoginType() {
    for (LoginType type : LoginType.values()) {
      assertThat(authenticators.forType(type).loginType()).isEqualTo(type);
    }
  }

  @Test
  void cycleWithoutSourcesDoesNothing() {
    assertThat(orchestrator.runCycle(() -> false)).isEqualTo(new CycleReport(0, 0, 0, 0, 0, false));
  }
}
