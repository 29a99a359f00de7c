package com.trod.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.trod.driver.Driver;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * The database handle a model is bound to. It pairs a name with the {@link Driver} that executes
 * statements and DDL, and carries the registration settings for the models bound to it.
 */
public final class Database {

  /**
   * Registration settings.
   *
   * @param autoIncrementKeyName the conventional name of an AUTO_INCREMENT primary key; other
   *     names are reported as diagnostics
   * @param warnOnImplicitTableName whether deriving a table name from the model name is reported
   */
  public record Config(String autoIncrementKeyName, boolean warnOnImplicitTableName) {

    public static final String DEFAULT_AUTO_INCREMENT_KEY = "id";

    public Config {
      Preconditions.checkArgument(
          !Strings.isNullOrEmpty(autoIncrementKeyName), "autoIncrementKeyName is required");
    }

    public static Config defaults() {
      return new Config(DEFAULT_AUTO_INCREMENT_KEY, true);
    }

    /**
     * Reads the settings from {@code TROD_AUTO_INCREMENT_KEY} and
     * {@code TROD_WARN_IMPLICIT_TABLE_NAME}, falling back to the defaults for unset variables.
     */
    public static Config fromEnvironment() {
      String key = System.getenv("TROD_AUTO_INCREMENT_KEY");
      String warn = System.getenv("TROD_WARN_IMPLICIT_TABLE_NAME");
      return new Config(
          Strings.isNullOrEmpty(key) ? DEFAULT_AUTO_INCREMENT_KEY : key,
          Strings.isNullOrEmpty(warn) || Boolean.parseBoolean(warn));
    }
  }

  private final String name;
  private final Driver driver;
  private final Config config;

  /** Creates a handle configured from the environment. */
  public Database(@Nonnull String name, @Nonnull Driver driver) {
    this(name, driver, Config.fromEnvironment());
  }

  public Database(@Nonnull String name, @Nonnull Driver driver, @Nonnull Config config) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Database name is required");
    this.name = name;
    this.driver = Objects.requireNonNull(driver);
    this.config = Objects.requireNonNull(config);
  }

  @Nonnull
  public String getName() {
    return name;
  }

  @Nonnull
  public Driver getDriver() {
    return driver;
  }

  @Nonnull
  public Config getConfig() {
    return config;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("driver", driver.getClass().getSimpleName())
        .toString();
  }
}
