package signals.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;
import signals.ListenTo;
import signals.dispatch.SignalDispatcher;
import signals.registry.SignalRegistry;
import signals.spring.boot.sample.Ping;
import signals.spring.boot.sample.Score;
import signals.spring.boot.sample.Scoreboard;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SignalListenerRegistrarTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(DispatcherConfig.class);

  @Test
  void bindsSingletonBeansDeclaringListeners() {
    runner.withUserConfiguration(ScoreboardConfig.class).run(ctx -> {
      var dispatcher = ctx.getBean(SignalDispatcher.class);
      var scoreboard = ctx.getBean(Scoreboard.class);

      assertTrue(dispatcher.isBound(scoreboard));
      dispatcher.invoke(Score.class, "ada", 3);
      assertEquals(1, scoreboard.entries().size());
      assertEquals(1, ctx.getBean(SignalListenerRegistrar.class).boundBeans().size());
    });
  }

  @Test
  void skipsBeansWithoutListeners() {
    runner.run(ctx -> {
      var registrar = ctx.getBean(SignalListenerRegistrar.class);
      assertTrue(registrar.boundBeans().isEmpty());
    });
  }

  @Test
  void skipsPrototypeBeans() {
    runner.withUserConfiguration(PrototypeConfig.class).run(ctx -> {
      var registrar = ctx.getBean(SignalListenerRegistrar.class);
      assertTrue(registrar.boundBeans().isEmpty());
      assertFalse(ctx.getBean(SignalDispatcher.class).isBound(ctx.getBean(Scoreboard.class)));
    });
  }

  @Test
  void unbindsOnContextClose() {
    AtomicReference<SignalDispatcher> dispatcher = new AtomicReference<>();
    AtomicReference<Scoreboard> scoreboard = new AtomicReference<>();

    runner.withUserConfiguration(ScoreboardConfig.class).run(ctx -> {
      dispatcher.set(ctx.getBean(SignalDispatcher.class));
      scoreboard.set(ctx.getBean(Scoreboard.class));
      assertTrue(dispatcher.get().isBound(scoreboard.get()));
    });

    assertFalse(dispatcher.get().isBound(scoreboard.get()));
    assertEquals(0, dispatcher.get().getSignal(Score.class).listenerCount());
  }

  @Test
  void failsWhenListenerTargetsUnregisteredSignal() {
    runner.withUserConfiguration(UnregisteredListenerConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  @Test
  void failsWhenListenerSignatureMismatches() {
    runner.withUserConfiguration(MismatchedListenerConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
    });
  }

  // ── Test support ─────────────────────────────────────────────

  public static class Unregistered extends signals.Signal {
  }

  static class UnregisteredListener {
    @ListenTo(Unregistered.class)
    void onUnregistered() {
    }
  }

  static class MismatchedListener {
    @ListenTo(Ping.class)
    void onPing(String extra) {
    }
  }

  @Configuration
  static class DispatcherConfig {
    @Bean
    SignalDispatcher signalDispatcher() {
      SignalDispatcher dispatcher = SignalDispatcher.builder().build();
      dispatcher.registerSignalTypes(SignalRegistry.curated(Ping.class, Score.class));
      return dispatcher;
    }

    @Bean
    SignalListenerRegistrar signalListenerRegistrar(
        org.springframework.beans.factory.ListableBeanFactory beanFactory, SignalDispatcher dispatcher) {
      return new SignalListenerRegistrar(beanFactory, dispatcher);
    }
  }

  @Configuration
  static class ScoreboardConfig {
    @Bean
    Scoreboard scoreboard() {
      return new Scoreboard();
    }
  }

  @Configuration
  static class PrototypeConfig {
    @Bean
    @Scope("prototype")
    Scoreboard scoreboard() {
      return new Scoreboard();
    }
  }

  @Configuration
  static class UnregisteredListenerConfig {
    @Bean
    UnregisteredListener unregisteredListener() {
      return new UnregisteredListener();
    }
  }

  @Configuration
  static class MismatchedListenerConfig {
    @Bean
    MismatchedListener mismatchedListener() {
      return new MismatchedListener();
    }
  }
}
