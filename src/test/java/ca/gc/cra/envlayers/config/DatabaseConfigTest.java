package ca.gc.cra.envlayers.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DatabaseConfigTest {

  @Test
  void sharedFieldsAreReadThroughDelegate() {
    BaseConfig base = new BaseConfig("http://webapp", "8080", EnvironmentLookup.empty(),
        ReloadPolicy.defaultFilling());
    DatabaseConfig db = new DatabaseConfig(base, "http://mongodb", "27017", EnvironmentLookup.empty(),
        ReloadPolicy.defaultFilling());

    assertEquals(base.address(), db.address());
    assertEquals(base.port(), db.port());
    assertEquals("http://mongodb", db.dbAddress());
    assertEquals("27017", db.dbPort());
    assertSame(base, db.delegate().orElseThrow());
  }

  @Test
  void reloadFillsDatabaseDefaults() throws Exception {
    EnvironmentLookup env = EnvironmentLookup.of(Map.of("PORT", "9000"));
    BaseConfig base = new BaseConfig("http://webapp", "8080", env, ReloadPolicy.defaultFilling());
    DatabaseConfig db = new DatabaseConfig(base, "http://mongodb", "27017", env, ReloadPolicy.defaultFilling());

    db.reload();

    assertEquals("9000", db.port());
    assertEquals("http://localhost", db.dbAddress());
    assertEquals("37017", db.dbPort());
  }

  @Test
  void strictDatabaseFailureKeepsReloadedBase() {
    EnvironmentLookup env = EnvironmentLookup.of(Map.of(
        "ADDRESS", "http://svc", "PORT", "1", "DB_ADDRESS", "http://db"));
    BaseConfig base = new BaseConfig("http://webapp", "8080", env, ReloadPolicy.strict());
    DatabaseConfig db = new DatabaseConfig(base, "http://mongodb", "27017", env, ReloadPolicy.strict());

    MissingRequiredValueException ex = assertThrows(MissingRequiredValueException.class, db::reload);

    assertEquals("DB_PORT", ex.variableName());
    assertEquals("http://svc", base.address());
    assertEquals(LayerState.LOADED, base.state());
    assertEquals("http://mongodb", db.dbAddress());
    assertEquals("27017", db.dbPort());
    assertEquals(LayerState.UNLOADED, db.state());
  }

  @Test
  void strictDatabaseReloadTreatsEmptyValueAsMissing() {
    EnvironmentLookup env = EnvironmentLookup.of(Map.of(
        "ADDRESS", "http://svc", "PORT", "1", "DB_ADDRESS", "http://db", "DB_PORT", ""));
    BaseConfig base = new BaseConfig("http://webapp", "8080", env, ReloadPolicy.strict());
    DatabaseConfig db = new DatabaseConfig(base, "http://mongodb", "27017", env, ReloadPolicy.strict());

    MissingRequiredValueException ex = assertThrows(MissingRequiredValueException.class, db::reload);

    assertEquals("DB_PORT", ex.variableName());
    assertEquals(List.of("DB_PORT"), ex.missingVariables());
    assertEquals("http://mongodb", db.dbAddress());
    assertEquals("27017", db.dbPort());
    assertEquals(LayerState.LOADED, base.state());
  }

  @Test
  void innerFailurePropagatesBeforeOuterFieldsAreRead() {
    RecordingEnvironment env = new RecordingEnvironment(Map.of("ADDRESS", "http://svc"));
    BaseConfig base = new BaseConfig("http://webapp", "8080", env, ReloadPolicy.strict());
    DatabaseConfig db = new DatabaseConfig(base, "http://mongodb", "27017", env, ReloadPolicy.defaultFilling());

    MissingRequiredValueException ex = assertThrows(MissingRequiredValueException.class, db::reload);

    assertEquals("PORT", ex.variableName());
    assertEquals(List.of("ADDRESS", "PORT"), env.requested());
    assertEquals("http://mongodb", db.dbAddress());
    assertEquals(LayerState.UNLOADED, db.state());
  }

  @Test
  void layerCannotBeWrappedTwice() {
    BaseConfig base = new BaseConfig("http://webapp", "8080", EnvironmentLookup.empty(),
        ReloadPolicy.defaultFilling());
    new DatabaseConfig(base, "http://mongodb", "27017", EnvironmentLookup.empty(), ReloadPolicy.defaultFilling());

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> new MotdConfig(base, "Hello, World!", EnvironmentLookup.empty()));

    assertEquals("base layer is already wrapped by another layer", ex.getMessage());
  }

  @Test
  void delegateIsRequired() {
    assertThrows(NullPointerException.class, () -> new DatabaseConfig(null, "http://mongodb", "27017"));
  }
}
