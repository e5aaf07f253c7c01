package ca.gc.cra.envlayers.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ChainReloadTest {

  @Test
  void defaultFillingScenarioWithEmptyEnvironment() throws Exception {
    EnvironmentLookup env = EnvironmentLookup.empty();
    BaseConfig base = new BaseConfig("http://webapp", "8080", env, ReloadPolicy.defaultFilling());
    DatabaseConfig db = new DatabaseConfig(base, "http://mongodb", "27017", env, ReloadPolicy.defaultFilling());
    MotdConfig motd = new MotdConfig(db, "Hello, World!", env);

    motd.reload();

    assertEquals("http://localhost", base.address());
    assertEquals("8081", base.port());
    assertEquals("http://localhost", db.dbAddress());
    assertEquals("37017", db.dbPort());
    assertEquals("Have a Nice Day!", motd.message());
    for (ConfigurationLayer layer : motd.chain()) {
      assertEquals(LayerState.LOADED, layer.state());
    }
  }

  @Test
  void reloadVisitsEveryLayerOnceBaseFirst() throws Exception {
    RecordingEnvironment env = new RecordingEnvironment();
    MotdConfig motd = new MotdConfig(
        new DatabaseConfig(
            new BaseConfig("http://webapp", "8080", env, ReloadPolicy.defaultFilling()),
            "http://mongodb", "27017", env, ReloadPolicy.defaultFilling()),
        "Hello, World!", env);

    motd.reload();

    assertEquals(List.of("ADDRESS", "PORT", "DB_ADDRESS", "DB_PORT", "MOTD"), env.requested());
  }

  @Test
  void innerLayerCompletesBeforeOuterLayerReadsItsFields() throws Exception {
    List<String> observed = new ArrayList<>();
    BaseConfig[] holder = new BaseConfig[1];
    EnvironmentLookup env = variable -> {
      if (variable.equals("DB_ADDRESS")) {
        observed.add(holder[0].state() + ":" + holder[0].address());
      }
      return variable.equals("ADDRESS") ? Optional.of("http://svc") : Optional.empty();
    };
    holder[0] = new BaseConfig("http://webapp", "8080", env, ReloadPolicy.defaultFilling());
    DatabaseConfig db = new DatabaseConfig(holder[0], "http://mongodb", "27017", env,
        ReloadPolicy.defaultFilling());

    db.reload();

    assertEquals(List.of("LOADED:http://svc"), observed);
  }

  @Test
  void chainsOfAnyDepthReloadEachLayerExactlyOnce() throws Exception {
    for (int depth = 1; depth <= 5; depth++) {
      RecordingEnvironment env = new RecordingEnvironment();
      ConfigurationLayer layer = new BaseConfig("http://webapp", "8080", env, ReloadPolicy.defaultFilling());
      for (int i = 1; i < depth; i++) {
        layer = new MotdConfig(layer, "seed-" + i, env);
      }

      layer.reload();

      assertEquals(depth, layer.chain().size());
      assertEquals(depth - 1, env.requested().stream().filter("MOTD"::equals).count());
      assertEquals(1, env.requested().stream().filter("PORT"::equals).count());
    }
  }

  @Test
  void reloadIsIdempotentForUnchangedEnvironment() throws Exception {
    EnvironmentLookup env = EnvironmentLookup.of(Map.of("DB_PORT", "5432", "MOTD", "hi"));
    MotdConfig motd = new MotdConfig(
        new DatabaseConfig(
            new BaseConfig("http://webapp", "8080", env, ReloadPolicy.defaultFilling()),
            "http://mongodb", "27017", env, ReloadPolicy.defaultFilling()),
        "Hello, World!", env);

    motd.reload();
    ConfigSnapshot first = ConfigSnapshot.of(motd);
    motd.reload();

    assertEquals(first, ConfigSnapshot.of(motd));
  }

  @Test
  void outerAccessorsMatchInnerLayers() throws Exception {
    EnvironmentLookup env = EnvironmentLookup.of(Map.of("ADDRESS", "http://svc", "DB_ADDRESS", "http://db"));
    BaseConfig base = new BaseConfig("http://webapp", "8080", env, ReloadPolicy.defaultFilling());
    DatabaseConfig db = new DatabaseConfig(base, "http://mongodb", "27017", env, ReloadPolicy.defaultFilling());
    MotdConfig motd = new MotdConfig(db, "Hello, World!", env);

    assertEquals(base.address(), motd.address());
    motd.reload();

    assertEquals(base.address(), motd.address());
    assertEquals(base.port(), motd.port());
    assertEquals(Optional.of(db.dbAddress()), motd.field("DB_ADDRESS"));
    assertEquals(Optional.of(base.port()), motd.field("PORT"));
    assertEquals(Optional.of(motd.message()), motd.field("MOTD"));
    assertFalse(base.field("MOTD").isPresent());
    assertSame(db, motd.find(DatabaseConfig.class).orElseThrow());
    assertSame(base, motd.find(BaseConfig.class).orElseThrow());
    assertFalse(db.find(MotdConfig.class).isPresent());
  }

  @Test
  void chainListsOutermostFirst() {
    BaseConfig base = new BaseConfig("http://webapp", "8080");
    DatabaseConfig db = new DatabaseConfig(base, "http://mongodb", "27017");
    MotdConfig motd = new MotdConfig(db, "Hello, World!");

    List<ConfigurationLayer> chain = motd.chain();

    assertEquals(3, chain.size());
    assertSame(motd, chain.get(0));
    assertSame(db, chain.get(1));
    assertSame(base, chain.get(2));
  }

  @Test
  void strictFailureLeavesFailingAndOuterLayersUnchanged() throws Exception {
    RecordingEnvironment env = new RecordingEnvironment(Map.of(
        "ADDRESS", "http://a", "PORT", "1", "DB_ADDRESS", "http://db-a", "DB_PORT", "11", "MOTD", "first"));
    BaseConfig base = new BaseConfig("http://webapp", "8080", env, ReloadPolicy.strict());
    DatabaseConfig db = new DatabaseConfig(base, "http://mongodb", "27017", env, ReloadPolicy.strict());
    MotdConfig motd = new MotdConfig(db, "Hello, World!", env);
    motd.reload();

    env.set("ADDRESS", "http://b").set("DB_ADDRESS", "http://db-b").set("MOTD", "second").unset("DB_PORT");
    ConfigSnapshot before = ConfigSnapshot.of(motd);
    MissingRequiredValueException ex = assertThrows(MissingRequiredValueException.class, motd::reload);
    ConfigSnapshot after = ConfigSnapshot.of(motd);

    assertEquals("DB_PORT", ex.variableName());
    assertEquals(before.layer("motd"), after.layer("motd"));
    assertEquals(before.layer("database"), after.layer("database"));
    assertEquals("http://b", after.layer("base").fields().get("ADDRESS"));
    assertEquals("first", motd.message());
  }

  @Test
  void snapshotCapturesStateAndFields() {
    BaseConfig base = new BaseConfig("http://webapp", "8080");
    MotdConfig motd = new MotdConfig(base, "Hello, World!");

    ConfigSnapshot snapshot = ConfigSnapshot.of(motd);

    assertEquals(2, snapshot.layers().size());
    assertEquals("motd", snapshot.layers().get(0).layer());
    assertEquals(LayerState.UNLOADED, snapshot.layer("base").state());
    assertEquals(Map.of("MOTD", "Hello, World!"), snapshot.layer("motd").fields());
    assertThrows(IllegalArgumentException.class, () -> snapshot.layer("database"));
    assertTrue(snapshot.layers().stream().allMatch(view -> view.state() == LayerState.UNLOADED));
  }
}
